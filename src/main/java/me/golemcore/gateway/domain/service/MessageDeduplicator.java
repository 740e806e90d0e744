package me.golemcore.gateway.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Approximate exactly-once filter for inbound platform events.
 *
 * <p>
 * Remembers message identifiers in a bounded LRU map. An identifier seen again
 * within the TTL is a duplicate; after the TTL it counts as new.
 */
@Component
@Slf4j
public class MessageDeduplicator {

    private final Clock clock;
    private final Duration ttl;
    private final Map<String, Instant> seen;

    public MessageDeduplicator(Clock clock, GatewayProperties properties) {
        this.clock = clock;
        this.ttl = properties.getDedup().getTtl();
        int maxEntries = properties.getDedup().getMaxEntries();
        this.seen = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Instant> eldest) {
                return size() > maxEntries;
            }
        });
    }

    /**
     * Record {@code messageId} and report whether it was already seen within the
     * TTL. Blank identifiers are never duplicates.
     */
    public boolean isDuplicate(String messageId) {
        if (messageId == null || messageId.isBlank()) {
            return false;
        }
        Instant now = clock.instant();
        synchronized (seen) {
            Instant lastSeen = seen.get(messageId);
            if (lastSeen != null && !now.isAfter(lastSeen.plus(ttl))) {
                return true;
            }
            seen.remove(messageId);
            seen.put(messageId, now);
            return false;
        }
    }

    public int size() {
        return seen.size();
    }
}
