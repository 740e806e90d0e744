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
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lazily created session slots, one per chat.
 */
@Component
@Slf4j
public class SessionSlotRegistry {

    private final Clock clock;
    private final Map<String, SessionSlot> slots = new ConcurrentHashMap<>();

    public SessionSlotRegistry(Clock clock) {
        this.clock = clock;
    }

    public SessionSlot getOrCreate(String chatId) {
        return slots.computeIfAbsent(chatId, id -> new SessionSlot(id, clock.instant()));
    }

    public SessionSlot get(String chatId) {
        return slots.get(chatId);
    }

    public int size() {
        return slots.size();
    }

    /**
     * Remove idle slots untouched for longer than {@code ttl}, then evict the
     * least recently touched idle slots while more than {@code maxSlots} remain.
     * Running slots are never removed.
     *
     * @return number of slots removed
     */
    public int cleanup(Duration ttl, int maxSlots) {
        Instant cutoff = clock.instant().minus(ttl);
        int removed = 0;
        for (SessionSlot slot : slots.values()) {
            synchronized (slot) {
                if (!slot.isRunning() && slot.getLastTouched().isBefore(cutoff) && evict(slot)) {
                    removed++;
                }
            }
        }

        int excess = slots.size() - maxSlots;
        if (excess <= 0) {
            return removed;
        }
        List<IdleSlot> idle = new ArrayList<>();
        for (SessionSlot slot : slots.values()) {
            synchronized (slot) {
                if (!slot.isRunning()) {
                    idle.add(new IdleSlot(slot, slot.getLastTouched()));
                }
            }
        }
        idle.sort(Comparator.comparing(IdleSlot::lastTouched));
        for (IdleSlot candidate : idle) {
            if (excess <= 0) {
                break;
            }
            SessionSlot slot = candidate.slot();
            synchronized (slot) {
                if (!slot.isRunning() && evict(slot)) {
                    removed++;
                    excess--;
                }
            }
        }
        return removed;
    }

    private boolean evict(SessionSlot slot) {
        if (slots.remove(slot.getChatId(), slot)) {
            slot.markEvicted();
            return true;
        }
        return false;
    }

    private record IdleSlot(SessionSlot slot, Instant lastTouched) {
    }
}
