package me.golemcore.gateway.adapter.outbound.agent;

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
import me.golemcore.gateway.domain.listener.AgentEventListener;
import me.golemcore.gateway.domain.model.AgentSession;
import me.golemcore.gateway.domain.model.ExecutionContext;
import me.golemcore.gateway.domain.model.TaskResult;
import me.golemcore.gateway.port.outbound.AgentExecutorPort;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Placeholder agent executor used when no agent runtime is wired in.
 *
 * <p>
 * Every task completes immediately with a fixed answer. Supports neither
 * session reset nor external input replies.
 */
@Component
@Slf4j
public class NoOpAgentExecutorAdapter implements AgentExecutorPort {

    static final String ANSWER = "[No agent configured]";

    @Override
    public AgentSession ensureSession(String sessionId) {
        return new AgentSession(sessionId, Map.of());
    }

    @Override
    public TaskResult executeTask(ExecutionContext context, String content, AgentEventListener listener) {
        log.warn("NoOpAgentExecutorAdapter: executeTask() called for chat {} - no agent configured",
                context.chatId());
        return TaskResult.builder()
                .answer(ANSWER)
                .stopReason("final_answer")
                .build();
    }
}
