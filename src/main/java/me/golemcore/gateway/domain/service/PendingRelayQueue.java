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

import me.golemcore.gateway.domain.model.PendingInputRelay;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * FIFO of outstanding input requests for one chat.
 *
 * <p>
 * A request for a task that is already queued replaces the earlier entry in
 * place. When the queue is over capacity the oldest entries are dropped.
 */
public class PendingRelayQueue {

    private final int capacity;
    private final List<PendingInputRelay> entries = new ArrayList<>();

    public PendingRelayQueue(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    /**
     * @return number of entries dropped to stay within capacity
     */
    public synchronized int push(PendingInputRelay relay) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).taskId().equals(relay.taskId())) {
                entries.set(i, relay);
                return 0;
            }
        }
        entries.add(relay);
        int dropped = 0;
        while (entries.size() > capacity) {
            entries.remove(0);
            dropped++;
        }
        return dropped;
    }

    /**
     * Remove and return the oldest entry that has not expired. Expired entries
     * in front of it are discarded.
     */
    public synchronized PendingInputRelay popOldest(Instant now) {
        Iterator<PendingInputRelay> iterator = entries.iterator();
        while (iterator.hasNext()) {
            PendingInputRelay relay = iterator.next();
            iterator.remove();
            if (!relay.isExpired(now)) {
                return relay;
            }
        }
        return null;
    }

    /**
     * @return number of expired entries removed
     */
    public synchronized int pruneExpired(Instant now) {
        int before = entries.size();
        entries.removeIf(relay -> relay.isExpired(now));
        return before - entries.size();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Creation time of the oldest entry, or {@code null} when empty.
     */
    public synchronized Instant oldestCreatedAt() {
        return entries.isEmpty() ? null : entries.get(0).createdAt();
    }

    public synchronized List<PendingInputRelay> snapshot() {
        return List.copyOf(entries);
    }
}
