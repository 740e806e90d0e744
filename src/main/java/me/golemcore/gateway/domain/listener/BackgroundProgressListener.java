package me.golemcore.gateway.domain.listener;

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
import me.golemcore.gateway.domain.model.AgentEvent;
import me.golemcore.gateway.domain.model.TaskRecord;
import me.golemcore.gateway.domain.model.TaskStatus;
import me.golemcore.gateway.domain.model.TaskUpdate;
import me.golemcore.gateway.domain.service.TaskRegistry;
import me.golemcore.gateway.port.outbound.MessengerPort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Reports on background tasks dispatched during a run, one status message per
 * task, edited on a slow cadence.
 *
 * <p>
 * The listener outlives the foreground run that created it. {@link #release()}
 * is called when the run returns: with no tracked tasks the listener closes at
 * once, otherwise it stays open until the last tracked task completes. After
 * release a poller checks the {@link TaskRegistry} for tasks that reached a
 * terminal status without a completion signal, and a safety timer closes the
 * listener after {@code maxLifetime}. Tickers and the poller are timed by the
 * shared scheduler but hand their messenger and registry calls to
 * {@code worker}.
 */
@Slf4j
public class BackgroundProgressListener implements AgentEventListener {

    private static final int DESCRIPTION_LIMIT = 120;
    private static final int ARGS_LIMIT = 200;
    private static final int INPUT_SUMMARY_LIMIT = 400;
    private static final int RESULT_LIMIT = 1500;
    private static final int MAX_FILES_SHOWN = 8;
    private static final int MAX_TOOLS_SHOWN = 6;

    private final AgentEventListener inner;
    private final MessengerPort messenger;
    private final TaskRegistry registry;
    private final ScheduledExecutorService scheduler;
    private final Executor worker;
    private final Clock clock;
    private final BackgroundProgressSettings settings;
    private final String chatId;
    private final String userId;
    private final String replyToMessageId;

    private final Object lock = new Object();
    private final Map<String, TrackedTask> tasks = new LinkedHashMap<>();
    private boolean released;
    private boolean closed;
    private ScheduledFuture<?> completionPoller;
    private ScheduledFuture<?> safetyTimer;

    public BackgroundProgressListener(AgentEventListener inner, MessengerPort messenger, TaskRegistry registry,
            ScheduledExecutorService scheduler, Executor worker, Clock clock, BackgroundProgressSettings settings,
            String chatId, String userId, String replyToMessageId) {
        this.inner = inner != null ? inner : AgentEventListener.NOOP;
        this.messenger = messenger;
        this.registry = registry;
        this.scheduler = scheduler;
        this.worker = worker;
        this.clock = clock;
        this.settings = settings;
        this.chatId = chatId;
        this.userId = userId;
        this.replyToMessageId = replyToMessageId;
    }

    @Override
    public void onEvent(AgentEvent event) {
        inner.onEvent(event);
        Optional<BackgroundSignal> signal = BackgroundSignal.decode(event);
        if (signal.isEmpty()) {
            return;
        }
        BackgroundSignal decoded = signal.get();
        if (decoded instanceof BackgroundSignal.Dispatched dispatched) {
            onDispatched(dispatched);
        } else if (decoded instanceof BackgroundSignal.Progress progress) {
            onProgress(progress);
        } else if (decoded instanceof BackgroundSignal.InputRequested requested) {
            onInputRequested(requested);
        } else if (decoded instanceof BackgroundSignal.Completed completed) {
            onCompleted(completed);
        }
    }

    /**
     * Mark the foreground run as finished. Closes immediately when nothing is
     * tracked.
     */
    public void release() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            released = true;
            if (tasks.isEmpty()) {
                closeLocked();
                return;
            }
            long pollMillis = settings.completionPollInterval().toMillis();
            completionPoller = scheduler.scheduleAtFixedRate(() -> worker.execute(this::pollCompletions),
                    pollMillis, pollMillis, TimeUnit.MILLISECONDS);
            safetyTimer = scheduler.schedule(this::expire, settings.maxLifetime().toMillis(),
                    TimeUnit.MILLISECONDS);
        }
    }

    public void close() {
        synchronized (lock) {
            closeLocked();
        }
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    public int trackedTaskCount() {
        synchronized (lock) {
            return tasks.size();
        }
    }

    private void onDispatched(BackgroundSignal.Dispatched signal) {
        TrackedTask task;
        synchronized (lock) {
            if (closed || released || tasks.containsKey(signal.taskId())) {
                return;
            }
            task = new TrackedTask(signal.taskId(), signal.agentType(), signal.description(), clock.instant());
            tasks.put(task.taskId, task);
        }

        Duration cadence = settings.cadenceFor(signal.agentType());
        String messageId = send(renderDispatched(task, cadence));

        synchronized (lock) {
            task.messageId = messageId;
            if (!closed && tasks.get(task.taskId) == task) {
                long cadenceMillis = cadence.toMillis();
                task.ticker = scheduler.scheduleAtFixedRate(() -> worker.execute(() -> flush(task)),
                        cadenceMillis, cadenceMillis, TimeUnit.MILLISECONDS);
            }
        }

        saveRecord(task);
        log.info("[BackgroundProgress] Tracking task {} ({}) for chat {}", task.taskId, task.agentType, chatId);
    }

    private void onProgress(BackgroundSignal.Progress signal) {
        long tokens;
        synchronized (lock) {
            TrackedTask task = tasks.get(signal.taskId());
            if (task == null) {
                return;
            }
            Instant now = clock.instant();
            task.status = TaskStatus.RUNNING;
            if (signal.tokensUsed() > 0) {
                task.tokensUsed = signal.tokensUsed();
            }
            if (!signal.currentTool().isEmpty()) {
                task.currentTool = signal.currentTool();
                task.currentArgs = EventPayloads.truncate(signal.currentArgs(), ARGS_LIMIT);
                task.recentTools.addLast(new TimedValue(now, signal.currentTool()));
            }
            for (String file : signal.files()) {
                task.recentFiles.addLast(new TimedValue(now, file));
            }
            if (!signal.activity().isEmpty()) {
                task.lastActivity = signal.activity();
            }
            task.prune(now.minus(settings.window()));
            tokens = task.tokensUsed;
        }
        updateRecord(signal.taskId(), TaskStatus.RUNNING, TaskUpdate.builder().tokensUsed(tokens).build());
    }

    private void onInputRequested(BackgroundSignal.InputRequested signal) {
        TrackedTask task;
        synchronized (lock) {
            task = tasks.get(signal.taskId());
            if (task == null) {
                return;
            }
            task.status = TaskStatus.WAITING_INPUT;
            task.pendingSummary = EventPayloads.truncate(signal.summary(), INPUT_SUMMARY_LIMIT);
        }
        flush(task);
        updateRecord(signal.taskId(), TaskStatus.WAITING_INPUT, TaskUpdate.none());
    }

    private void onCompleted(BackgroundSignal.Completed signal) {
        TrackedTask task;
        boolean closeNow;
        synchronized (lock) {
            task = tasks.remove(signal.taskId());
            if (task == null) {
                return;
            }
            if (task.ticker != null) {
                task.ticker.cancel(false);
            }
            task.status = signal.status();
            String summary = signal.error().isEmpty() ? signal.answer() : signal.error();
            task.pendingSummary = EventPayloads.truncate(summary, RESULT_LIMIT);
            if (signal.tokensUsed() > 0) {
                task.tokensUsed = signal.tokensUsed();
            }
            closeNow = released && tasks.isEmpty();
        }

        deliver(task, render(task));
        updateRecord(signal.taskId(), signal.status(), TaskUpdate.builder()
                .tokensUsed(task.tokensUsed)
                .answerPreview(signal.error().isEmpty() ? signal.answer() : null)
                .error(signal.error().isEmpty() ? null : signal.error())
                .build());
        log.info("[BackgroundProgress] Task {} finished with status {}", signal.taskId(),
                signal.status().getValue());

        if (closeNow) {
            close();
        }
    }

    private void pollCompletions() {
        if (registry == null) {
            return;
        }
        List<String> ids;
        synchronized (lock) {
            if (closed) {
                return;
            }
            ids = new ArrayList<>(tasks.keySet());
        }
        for (String id : ids) {
            try {
                registry.get(id)
                        .filter(record -> record.getStatus() != null && record.getStatus().isTerminal())
                        .ifPresent(record -> onCompleted(new BackgroundSignal.Completed(id, record.getStatus(),
                                nullToEmpty(record.getAnswerPreview()), nullToEmpty(record.getError()),
                                record.getTokensUsed())));
            } catch (Exception e) { // NOSONAR - poller must keep running
                log.warn("[BackgroundProgress] Completion poll failed for task {}: {}", id, e.getMessage());
            }
        }
    }

    private void expire() {
        int remaining;
        synchronized (lock) {
            if (closed) {
                return;
            }
            remaining = tasks.size();
            closeLocked();
        }
        log.warn("[BackgroundProgress] Listener for chat {} closed after max lifetime with {} task(s) pending",
                chatId, remaining);
    }

    private void closeLocked() {
        if (closed) {
            return;
        }
        closed = true;
        for (TrackedTask task : tasks.values()) {
            if (task.ticker != null) {
                task.ticker.cancel(false);
            }
        }
        tasks.clear();
        if (completionPoller != null) {
            completionPoller.cancel(false);
        }
        if (safetyTimer != null) {
            safetyTimer.cancel(false);
        }
        log.debug("[BackgroundProgress] Listener for chat {} closed", chatId);
    }

    private void flush(TrackedTask task) {
        String text;
        synchronized (lock) {
            if (closed || tasks.get(task.taskId) != task) {
                return;
            }
            task.prune(clock.instant().minus(settings.window()));
            text = render(task);
            task.tokensAtLastFlush = task.tokensUsed;
        }
        deliver(task, text);
    }

    private void deliver(TrackedTask task, String text) {
        String messageId;
        synchronized (lock) {
            messageId = task.messageId;
        }
        if (messageId != null) {
            try {
                messenger.updateMessage(chatId, messageId, text);
                return;
            } catch (Exception e) { // NOSONAR - fall back to a new message
                log.warn("[BackgroundProgress] Update failed for task {}, sending new message: {}",
                        task.taskId, e.getMessage());
            }
        }
        String newId = send(text);
        if (newId != null) {
            synchronized (lock) {
                task.messageId = newId;
            }
        }
    }

    private String send(String text) {
        try {
            return messenger.replyMessage(chatId, replyToMessageId, text);
        } catch (Exception e) { // NOSONAR - status messages are best-effort
            log.error("[BackgroundProgress] Failed to send status to chat {}", chatId, e);
            return null;
        }
    }

    private void saveRecord(TrackedTask task) {
        if (registry == null) {
            return;
        }
        try {
            registry.save(TaskRecord.builder()
                    .taskId(task.taskId)
                    .chatId(chatId)
                    .userId(userId)
                    .agentType(task.agentType)
                    .description(task.description)
                    .status(TaskStatus.RUNNING)
                    .build());
        } catch (Exception e) { // NOSONAR - registry is advisory here
            log.warn("[BackgroundProgress] Failed to register task {}: {}", task.taskId, e.getMessage());
        }
    }

    private void updateRecord(String taskId, TaskStatus status, TaskUpdate update) {
        if (registry == null) {
            return;
        }
        try {
            registry.updateStatus(taskId, status, update);
        } catch (Exception e) { // NOSONAR - registry is advisory here
            log.warn("[BackgroundProgress] Failed to update task {}: {}", taskId, e.getMessage());
        }
    }

    private String renderDispatched(TrackedTask task, Duration cadence) {
        StringBuilder text = new StringBuilder("[Background task started]\n");
        appendHeader(text, task);
        text.append("\nUpdates every ").append(formatDuration(cadence)).append('.');
        return text.toString();
    }

    private String render(TrackedTask task) {
        StringBuilder text = new StringBuilder(title(task.status)).append('\n');
        appendHeader(text, task);
        text.append('\n');
        if (task.status == TaskStatus.WAITING_INPUT || task.status.isTerminal()) {
            String summary = task.pendingSummary == null || task.pendingSummary.isEmpty()
                    ? "(no details)"
                    : task.pendingSummary;
            text.append(summary);
            return text.toString();
        }

        text.append("Last ").append(formatDuration(settings.window())).append(":\n");
        long delta = Math.max(0L, task.tokensUsed - task.tokensAtLastFlush);
        text.append("- tokens: +").append(delta).append(" (total ").append(task.tokensUsed).append(")\n");
        Set<String> files = distinctValues(task.recentFiles, MAX_FILES_SHOWN);
        if (!files.isEmpty()) {
            text.append("- files: ").append(String.join(", ", files)).append('\n');
        }
        Set<String> tools = distinctValues(task.recentTools, MAX_TOOLS_SHOWN);
        if (!tools.isEmpty()) {
            text.append("- tools: ").append(String.join(", ", tools)).append('\n');
        }
        if (task.currentTool != null) {
            text.append("- current: ").append(task.currentTool);
            if (task.currentArgs != null && !task.currentArgs.isEmpty()) {
                text.append(' ').append(task.currentArgs);
            }
            text.append('\n');
        }
        if (task.lastActivity != null) {
            text.append("- activity: ").append(task.lastActivity).append('\n');
        }
        if (files.isEmpty() && tools.isEmpty() && delta == 0) {
            text.append("- no new activity\n");
        }
        return text.toString().stripTrailing();
    }

    private void appendHeader(StringBuilder text, TrackedTask task) {
        text.append("task_id: ").append(task.taskId).append('\n');
        if (!task.agentType.isEmpty()) {
            text.append("agent: ").append(task.agentType).append('\n');
        }
        if (!task.description.isEmpty()) {
            text.append("description: ").append(EventPayloads.truncate(task.description, DESCRIPTION_LIMIT))
                    .append('\n');
        }
        text.append("elapsed: ").append(formatDuration(Duration.between(task.startedAt, clock.instant())));
    }

    private static String title(TaskStatus status) {
        switch (status) {
            case WAITING_INPUT:
                return "[Background task waiting for input]";
            case COMPLETED:
                return "[Background task completed]";
            case FAILED:
                return "[Background task failed]";
            case CANCELLED:
                return "[Background task cancelled]";
            default:
                return "[Background task running]";
        }
    }

    private static Set<String> distinctValues(Deque<TimedValue> values, int limit) {
        Set<String> result = new LinkedHashSet<>();
        values.descendingIterator().forEachRemaining(value -> {
            if (result.size() < limit) {
                result.add(value.value());
            }
        });
        return result;
    }

    static String formatDuration(Duration duration) {
        long seconds = Math.max(0L, duration.getSeconds());
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;
        if (hours > 0) {
            return hours + "h " + minutes + "m";
        }
        if (minutes > 0) {
            return secs > 0 ? minutes + "m " + secs + "s" : minutes + "m";
        }
        return secs + "s";
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private record TimedValue(Instant at, String value) {
    }

    private static final class TrackedTask {

        private final String taskId;
        private final String agentType;
        private final String description;
        private final Instant startedAt;
        private final Deque<TimedValue> recentTools = new ArrayDeque<>();
        private final Deque<TimedValue> recentFiles = new ArrayDeque<>();

        private TaskStatus status = TaskStatus.RUNNING;
        private long tokensUsed;
        private long tokensAtLastFlush;
        private String currentTool;
        private String currentArgs;
        private String lastActivity;
        private String pendingSummary;
        private String messageId;
        private ScheduledFuture<?> ticker;

        private TrackedTask(String taskId, String agentType, String description, Instant startedAt) {
            this.taskId = taskId;
            this.agentType = agentType != null ? agentType : "";
            this.description = description != null ? description : "";
            this.startedAt = startedAt;
        }

        private void prune(Instant cutoff) {
            while (!recentTools.isEmpty() && recentTools.peekFirst().at().isBefore(cutoff)) {
                recentTools.pollFirst();
            }
            while (!recentFiles.isEmpty() && recentFiles.peekFirst().at().isBefore(cutoff)) {
                recentFiles.pollFirst();
            }
        }
    }
}
