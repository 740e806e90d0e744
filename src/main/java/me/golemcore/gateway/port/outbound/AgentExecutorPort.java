package me.golemcore.gateway.port.outbound;

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

import me.golemcore.gateway.domain.listener.AgentEventListener;
import me.golemcore.gateway.domain.model.AgentSession;
import me.golemcore.gateway.domain.model.ExecutionContext;
import me.golemcore.gateway.domain.model.InputResponse;
import me.golemcore.gateway.domain.model.TaskResult;

import java.util.Optional;

/**
 * Agent runtime that executes tasks on behalf of a chat.
 *
 * <p>
 * Optional capabilities are exposed as {@link Optional} accessors instead of
 * extra interfaces so callers never cast.
 */
public interface AgentExecutorPort {

    /**
     * Load or create the session with the given identifier.
     */
    AgentSession ensureSession(String sessionId) throws AgentExecutionException;

    /**
     * Run one task to completion. Blocks for the whole run; lifecycle signals are
     * delivered to {@code listener} on the executor's threads.
     *
     * @param content
     *            task text, empty when the run resumes from seeded input
     */
    TaskResult executeTask(ExecutionContext context, String content, AgentEventListener listener)
            throws AgentExecutionException;

    default Optional<SessionResetter> sessionResetter() {
        return Optional.empty();
    }

    default Optional<ExternalInputResponder> externalInputResponder() {
        return Optional.empty();
    }

    /**
     * Clears the conversation history of a session.
     */
    @FunctionalInterface
    interface SessionResetter {
        void resetSession(String sessionId) throws AgentExecutionException;
    }

    /**
     * Delivers a user's answer to an agent that asked for input out of band.
     */
    @FunctionalInterface
    interface ExternalInputResponder {
        void replyExternalInput(InputResponse response) throws AgentExecutionException;
    }
}
