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
import me.golemcore.gateway.port.outbound.MessengerPort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keeps one live status message per task run that reflects tool activity.
 *
 * <p>
 * Flushes are rate limited: the first change after a quiet period is flushed
 * right away on {@code flushExecutor}, later changes inside the
 * {@code minInterval} window are coalesced into a single deferred flush. At
 * most one deferred flush is pending at any time. The scheduler only fires the
 * deferred flush; delivery always runs on {@code flushExecutor}. The first
 * flush sends a message, later flushes edit it.
 */
@Slf4j
public class ProgressListener implements AgentEventListener {

    private final AgentEventListener inner;
    private final MessengerPort messenger;
    private final String chatId;
    private final String replyToMessageId;
    private final ScheduledExecutorService scheduler;
    private final Executor flushExecutor;
    private final Clock clock;
    private final Duration minInterval;

    private final Object lock = new Object();
    private final Object flushLock = new Object();
    private final List<ToolStatus> tools = new ArrayList<>();
    private final Map<String, ToolStatus> toolsByCallId = new HashMap<>();

    private int iteration;
    private boolean dirty;
    private boolean closed;
    private Instant lastFlushAt;
    private ScheduledFuture<?> pendingFlush;
    private volatile String messageId;

    public ProgressListener(AgentEventListener inner, MessengerPort messenger, String chatId,
            String replyToMessageId, ScheduledExecutorService scheduler, Executor flushExecutor,
            Clock clock, Duration minInterval) {
        this.inner = inner != null ? inner : AgentEventListener.NOOP;
        this.messenger = messenger;
        this.chatId = chatId;
        this.replyToMessageId = replyToMessageId;
        this.scheduler = scheduler;
        this.flushExecutor = flushExecutor;
        this.clock = clock;
        this.minInterval = minInterval;
    }

    @Override
    public void onEvent(AgentEvent event) {
        inner.onEvent(event);
        ToolActivity.decode(event).ifPresent(this::apply);
    }

    /**
     * Identifier of the status message, or {@code null} if nothing was sent.
     */
    public String getMessageId() {
        return messageId;
    }

    /**
     * Stop scheduling and flush the last state if it has not been delivered.
     * Idempotent.
     */
    public void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            if (pendingFlush != null) {
                pendingFlush.cancel(false);
                pendingFlush = null;
            }
        }
        flush();
    }

    private void apply(ToolActivity activity) {
        boolean flushNow;
        synchronized (lock) {
            if (closed || !record(activity)) {
                return;
            }
            dirty = true;
            flushNow = scheduleFlushLocked();
        }
        if (flushNow) {
            flushExecutor.execute(this::flush);
        }
    }

    private boolean record(ToolActivity activity) {
        if (activity instanceof ToolActivity.IterationStarted started) {
            iteration = started.iteration();
            return true;
        }
        if (activity instanceof ToolActivity.ToolStarted started) {
            if (toolsByCallId.containsKey(started.callId())) {
                return false;
            }
            ToolStatus status = new ToolStatus(started.callId(), started.toolName(), clock.instant());
            tools.add(status);
            toolsByCallId.put(started.callId(), status);
            return true;
        }
        if (activity instanceof ToolActivity.ToolCompleted completed) {
            ToolStatus status = toolsByCallId.get(completed.callId());
            if (status == null || status.isDone()) {
                return false;
            }
            status.setDone(true);
            status.setErrored(completed.errored());
            Duration duration = completed.duration();
            if (duration == null || duration.isZero()) {
                duration = Duration.between(status.getStarted(), clock.instant());
            }
            status.setDuration(duration);
            return true;
        }
        return false;
    }

    /**
     * @return true when the caller should flush immediately
     */
    private boolean scheduleFlushLocked() {
        if (pendingFlush != null) {
            return false;
        }
        Instant now = clock.instant();
        if (lastFlushAt == null || !now.isBefore(lastFlushAt.plus(minInterval))) {
            lastFlushAt = now;
            return true;
        }
        long delayMillis = Duration.between(now, lastFlushAt.plus(minInterval)).toMillis();
        pendingFlush = scheduler.schedule(() -> flushExecutor.execute(this::deferredFlush), delayMillis,
                TimeUnit.MILLISECONDS);
        return false;
    }

    private void deferredFlush() {
        synchronized (lock) {
            pendingFlush = null;
            lastFlushAt = clock.instant();
        }
        flush();
    }

    private void flush() {
        synchronized (flushLock) {
            String text;
            synchronized (lock) {
                if (!dirty) {
                    return;
                }
                dirty = false;
                text = renderLocked();
            }
            deliver(text);
        }
    }

    private void deliver(String text) {
        String current = messageId;
        try {
            if (current == null) {
                messageId = messenger.replyMessage(chatId, replyToMessageId, text);
            } else {
                messenger.updateMessage(chatId, current, text);
            }
        } catch (Exception e) { // NOSONAR - progress is best-effort
            log.warn("[Progress] Failed to deliver progress update for chat {}: {}", chatId, e.getMessage());
        }
    }

    private String renderLocked() {
        ToolStatus active = null;
        int finished = 0;
        for (ToolStatus status : tools) {
            if (status.isDone()) {
                finished++;
            } else if (active == null || !status.getStarted().isBefore(active.getStarted())) {
                active = status;
            }
        }
        if (tools.isEmpty()) {
            return ProgressPhrases.thinking(iteration);
        }
        String phrase = active != null ? ProgressPhrases.forTool(active.getToolName())
                : ProgressPhrases.wrappingUp();
        return phrase + " (" + finished + "/" + tools.size() + " steps done)";
    }
}
