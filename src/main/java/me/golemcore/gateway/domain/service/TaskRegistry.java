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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.TaskRecord;
import me.golemcore.gateway.domain.model.TaskStatus;
import me.golemcore.gateway.domain.model.TaskUpdate;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Registry of dispatched background tasks.
 *
 * <p>
 * Records live in memory and are written through to storage as one JSON
 * snapshot. Every write also evicts:
 * <ul>
 * <li>terminal records completed before {@code now - retention};</li>
 * <li>per chat, the oldest terminal records beyond {@code maxPerChat}. Active
 * records are always kept, even when they alone exceed the cap.</li>
 * </ul>
 */
@Service
@Slf4j
public class TaskRegistry {

    static final String DIRECTORY = "tasks";
    static final String SNAPSHOT_FILE = "registry.json";
    static final String RESTART_REASON = "gateway restarted before the task finished";

    private static final int PREVIEW_LIMIT = 500;
    private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(5);
    private static final Comparator<TaskRecord> NEWEST_FIRST = Comparator
            .<TaskRecord, Instant>comparing(TaskRecord::getCreatedAt,
                    Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparing(TaskRecord::getUpdatedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .reversed();

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration retention;
    private final int maxPerChat;
    private final boolean markStaleOnStartup;

    private final Map<String, TaskRecord> records = new LinkedHashMap<>();
    private boolean writeInFlight;
    private boolean writeAgain;

    public TaskRegistry(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            GatewayProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.retention = properties.getTasks().getRetention();
        this.maxPerChat = properties.getTasks().getMaxPerChat();
        this.markStaleOnStartup = properties.getTasks().isMarkStaleOnStartup();
    }

    @PostConstruct
    public void init() {
        try {
            String json = storagePort.getText(DIRECTORY, SNAPSHOT_FILE).join();
            if (json != null && !json.isBlank()) {
                List<TaskRecord> loaded = objectMapper.readValue(json, new TypeReference<List<TaskRecord>>() {
                });
                synchronized (this) {
                    for (TaskRecord record : loaded) {
                        if (record.getTaskId() != null) {
                            records.put(record.getTaskId(), record);
                        }
                    }
                }
                log.info("[TaskRegistry] Loaded {} task record(s)", loaded.size());
            }
        } catch (Exception e) { // NOSONAR - start with an empty registry
            log.warn("[TaskRegistry] Failed to load task records: {}", e.getMessage());
        }
        if (markStaleOnStartup) {
            int marked = markStaleRunning(RESTART_REASON);
            if (marked > 0) {
                log.info("[TaskRegistry] Marked {} unfinished task(s) as failed", marked);
            }
        }
    }

    /**
     * Insert or replace a record. Status defaults to pending; timestamps of an
     * existing record with the same id are preserved.
     *
     * @throws IllegalArgumentException
     *             if task id or chat id is blank
     */
    public void save(TaskRecord record) {
        if (record == null || isBlank(record.getTaskId())) {
            throw new IllegalArgumentException("taskId is required");
        }
        if (isBlank(record.getChatId())) {
            throw new IllegalArgumentException("chatId is required");
        }
        Instant now = clock.instant();
        TaskRecord copy = record.toBuilder().build();
        synchronized (this) {
            TaskRecord existing = records.get(copy.getTaskId());
            if (copy.getStatus() == null) {
                copy.setStatus(TaskStatus.PENDING);
            }
            if (copy.getCreatedAt() == null) {
                copy.setCreatedAt(existing != null && existing.getCreatedAt() != null ? existing.getCreatedAt()
                        : now);
            }
            if (copy.getCompletedAt() == null && existing != null) {
                copy.setCompletedAt(existing.getCompletedAt());
            }
            if (existing != null && existing.isTerminal()) {
                keepTerminalState(copy, existing);
            }
            if (!copy.getStatus().isTerminal()) {
                copy.setCompletedAt(null);
            } else if (copy.getCompletedAt() == null) {
                copy.setCompletedAt(now);
            }
            copy.setUpdatedAt(now);
            records.put(copy.getTaskId(), copy);
            evictLocked(now);
        }
        persist();
    }

    /**
     * Move a task to {@code status}, applying the non-null fields of
     * {@code update}. Unknown ids are ignored. Terminal records never change
     * status again: a later terminal update only fills in its fields, a later
     * active one is ignored.
     *
     * @return true if a record was updated
     * @throws IllegalArgumentException
     *             if task id is blank or status is null
     */
    public boolean updateStatus(String taskId, TaskStatus status, TaskUpdate update) {
        if (isBlank(taskId)) {
            throw new IllegalArgumentException("taskId is required");
        }
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        Instant now = clock.instant();
        synchronized (this) {
            TaskRecord record = records.get(taskId);
            if (record == null) {
                return false;
            }
            boolean wasTerminal = record.isTerminal();
            if (wasTerminal && !status.isTerminal()) {
                log.debug("[TaskRegistry] Ignoring {} for finished task {}", status, taskId);
                return false;
            }
            if (!wasTerminal) {
                record.setStatus(status);
            }
            record.setUpdatedAt(now);
            if (status.isTerminal() && record.getCompletedAt() == null) {
                record.setCompletedAt(now);
            }
            if (update != null) {
                if (update.getTokensUsed() != null) {
                    record.setTokensUsed(update.getTokensUsed());
                }
                if (update.getError() != null) {
                    record.setError(update.getError());
                }
                if (update.getAnswerPreview() != null) {
                    record.setAnswerPreview(truncate(update.getAnswerPreview()));
                }
            }
            evictLocked(now);
        }
        persist();
        return true;
    }

    public synchronized Optional<TaskRecord> get(String taskId) {
        TaskRecord record = records.get(taskId);
        return record != null ? Optional.of(record.toBuilder().build()) : Optional.empty();
    }

    /**
     * Records of a chat, newest first.
     *
     * @param limit
     *            maximum number of records, or zero for all
     */
    public synchronized List<TaskRecord> listByChat(String chatId, boolean activeOnly, int limit) {
        if (isBlank(chatId)) {
            return List.of();
        }
        List<TaskRecord> result = new ArrayList<>();
        for (TaskRecord record : records.values()) {
            if (chatId.equals(record.getChatId()) && (!activeOnly || record.isActive())) {
                result.add(record.toBuilder().build());
            }
        }
        result.sort(NEWEST_FIRST);
        if (limit > 0 && result.size() > limit) {
            return new ArrayList<>(result.subList(0, limit));
        }
        return result;
    }

    public synchronized int countActive(String chatId) {
        int count = 0;
        for (TaskRecord record : records.values()) {
            if (record.getChatId() != null && record.getChatId().equals(chatId) && record.isActive()) {
                count++;
            }
        }
        return count;
    }

    public synchronized int size() {
        return records.size();
    }

    /**
     * Remove every record created before {@code cutoff}, active or not.
     *
     * @return number of records removed
     */
    public int deleteExpired(Instant cutoff) {
        int removed;
        synchronized (this) {
            int before = records.size();
            records.values().removeIf(record -> record.getCreatedAt() != null
                    && record.getCreatedAt().isBefore(cutoff));
            removed = before - records.size();
        }
        if (removed > 0) {
            persist();
        }
        return removed;
    }

    /**
     * Fail every non-terminal record with {@code reason}. Used at startup, when
     * no task from a previous process can still be running.
     *
     * @return number of records marked
     */
    public int markStaleRunning(String reason) {
        Instant now = clock.instant();
        int marked = 0;
        synchronized (this) {
            for (TaskRecord record : records.values()) {
                if (record.isActive()) {
                    record.setStatus(TaskStatus.FAILED);
                    record.setError(reason);
                    record.setUpdatedAt(now);
                    record.setCompletedAt(now);
                    marked++;
                }
            }
            if (marked > 0) {
                evictLocked(now);
            }
        }
        if (marked > 0) {
            persist();
        }
        return marked;
    }

    private static void keepTerminalState(TaskRecord copy, TaskRecord existing) {
        if (!copy.getStatus().isTerminal()) {
            copy.setStatus(existing.getStatus());
        }
        if (copy.getError() == null) {
            copy.setError(existing.getError());
        }
        if (copy.getAnswerPreview() == null) {
            copy.setAnswerPreview(existing.getAnswerPreview());
        }
        if (copy.getTokensUsed() < existing.getTokensUsed()) {
            copy.setTokensUsed(existing.getTokensUsed());
        }
    }

    private void evictLocked(Instant now) {
        Instant cutoff = now.minus(retention);
        records.values().removeIf(record -> !record.isActive()
                && record.getCompletedAt() != null
                && record.getCompletedAt().isBefore(cutoff));

        Map<String, List<TaskRecord>> byChat = new HashMap<>();
        for (TaskRecord record : records.values()) {
            byChat.computeIfAbsent(record.getChatId(), key -> new ArrayList<>()).add(record);
        }
        for (List<TaskRecord> chatRecords : byChat.values()) {
            if (chatRecords.size() <= maxPerChat) {
                continue;
            }
            List<TaskRecord> terminal = new ArrayList<>();
            int active = 0;
            for (TaskRecord record : chatRecords) {
                if (record.isActive()) {
                    active++;
                } else {
                    terminal.add(record);
                }
            }
            terminal.sort(NEWEST_FIRST);
            int budget = Math.max(0, maxPerChat - active);
            for (int i = budget; i < terminal.size(); i++) {
                records.remove(terminal.get(i).getTaskId());
            }
        }
    }

    /**
     * Write the snapshot without blocking the caller. At most one write is in
     * flight; changes made meanwhile are folded into a single follow-up write.
     */
    private void persist() {
        synchronized (this) {
            if (writeInFlight) {
                writeAgain = true;
                return;
            }
            writeInFlight = true;
        }
        writeSnapshot();
    }

    private void writeSnapshot() {
        List<TaskRecord> snapshot = new ArrayList<>();
        synchronized (this) {
            writeAgain = false;
            for (TaskRecord record : records.values()) {
                snapshot.add(record.toBuilder().build());
            }
        }
        CompletableFuture<Void> write;
        try {
            String json = objectMapper.writeValueAsString(snapshot);
            write = storagePort.putTextAtomic(DIRECTORY, SNAPSHOT_FILE, json, false);
        } catch (Exception e) { // NOSONAR - memory stays authoritative
            log.warn("[TaskRegistry] Failed to persist task records: {}", e.getMessage());
            finishWrite();
            return;
        }
        write.whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("[TaskRegistry] Failed to persist task records: {}", error.getMessage());
            }
            finishWrite();
        });
    }

    private void finishWrite() {
        synchronized (this) {
            if (!writeAgain) {
                writeInFlight = false;
                notifyAll();
                return;
            }
        }
        writeSnapshot();
    }

    /**
     * Wait for the pending snapshot write, if any.
     *
     * @return false if a write was still in flight after {@code timeout}
     */
    public synchronized boolean awaitPersisted(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (writeInFlight) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
        }
        return true;
    }

    @PreDestroy
    public void shutdown() {
        try {
            if (!awaitPersisted(SHUTDOWN_WAIT)) {
                log.warn("[TaskRegistry] Snapshot write still running at shutdown");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String truncate(String text) {
        if (text.length() <= PREVIEW_LIMIT) {
            return text;
        }
        return text.substring(0, PREVIEW_LIMIT) + "...";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
