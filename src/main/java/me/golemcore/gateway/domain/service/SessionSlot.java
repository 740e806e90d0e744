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

import me.golemcore.gateway.domain.model.SessionPhase;
import me.golemcore.gateway.domain.model.UserInput;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Concurrency gate of one chat.
 *
 * <p>
 * The slot is its own monitor: callers hold {@code synchronized (slot)} while
 * reading or changing it. The input queue exists exactly while the phase is
 * {@link SessionPhase#RUNNING}.
 */
public class SessionSlot {

    private final String chatId;
    private SessionPhase phase = SessionPhase.IDLE;
    private BlockingQueue<UserInput> inputQueue;
    private String sessionId;
    private String lastSessionId;
    private List<String> pendingOptions = List.of();
    private Instant lastTouched;
    private boolean evicted;

    SessionSlot(String chatId, Instant createdAt) {
        this.chatId = chatId;
        this.lastTouched = createdAt;
    }

    public String getChatId() {
        return chatId;
    }

    public synchronized SessionPhase getPhase() {
        return phase;
    }

    public synchronized boolean isRunning() {
        return phase == SessionPhase.RUNNING;
    }

    public synchronized BlockingQueue<UserInput> getInputQueue() {
        return inputQueue;
    }

    public synchronized String getSessionId() {
        return sessionId;
    }

    public synchronized String getLastSessionId() {
        return lastSessionId;
    }

    public synchronized List<String> getPendingOptions() {
        return pendingOptions;
    }

    public synchronized void setPendingOptions(List<String> options) {
        this.pendingOptions = options != null ? List.copyOf(options) : List.of();
    }

    public synchronized Instant getLastTouched() {
        return lastTouched;
    }

    public synchronized void touch(Instant now) {
        this.lastTouched = now;
    }

    /**
     * True once the registry dropped the slot; holders must look it up again.
     */
    public synchronized boolean isEvicted() {
        return evicted;
    }

    synchronized void markEvicted() {
        this.evicted = true;
    }

    /**
     * Enter {@link SessionPhase#RUNNING} with a fresh input queue.
     *
     * @throws IllegalStateException
     *             if a task is already running
     */
    public synchronized BlockingQueue<UserInput> begin(String sessionId, int inputCapacity) {
        if (phase == SessionPhase.RUNNING) {
            throw new IllegalStateException("Task already running for chat " + chatId);
        }
        this.phase = SessionPhase.RUNNING;
        this.inputQueue = new ArrayBlockingQueue<>(inputCapacity);
        this.sessionId = sessionId;
        this.lastSessionId = sessionId;
        return inputQueue;
    }

    /**
     * Switch the running task to the session the executor actually opened.
     */
    public synchronized void adoptSessionId(String resolvedSessionId) {
        if (phase != SessionPhase.RUNNING || resolvedSessionId == null) {
            return;
        }
        this.sessionId = resolvedSessionId;
        this.lastSessionId = resolvedSessionId;
    }

    /**
     * Leave {@link SessionPhase#RUNNING}. An awaiting slot keeps its session for
     * the resume; an idle slot clears it.
     *
     * @return messages injected but never consumed by the task
     */
    public synchronized List<UserInput> finish(boolean awaitingInput, Instant now) {
        List<UserInput> leftovers = new ArrayList<>();
        if (inputQueue != null) {
            inputQueue.drainTo(leftovers);
        }
        this.inputQueue = null;
        this.lastTouched = now;
        if (awaitingInput) {
            this.phase = SessionPhase.AWAITING_INPUT;
        } else {
            this.phase = SessionPhase.IDLE;
            this.sessionId = null;
            this.pendingOptions = List.of();
        }
        return leftovers;
    }

    /**
     * Rebind the slot to a new session and go idle.
     */
    public synchronized void startNewSession(String newSessionId) {
        this.phase = SessionPhase.IDLE;
        this.sessionId = newSessionId;
        this.lastSessionId = newSessionId;
        this.pendingOptions = List.of();
    }

    /**
     * Forget the current session entirely.
     */
    public synchronized void reset() {
        this.phase = SessionPhase.IDLE;
        this.sessionId = null;
        this.lastSessionId = null;
        this.pendingOptions = List.of();
    }
}
