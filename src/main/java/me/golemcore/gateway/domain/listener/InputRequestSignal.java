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

import me.golemcore.gateway.domain.model.AgentEvent;
import me.golemcore.gateway.domain.model.AgentEventTypes;
import me.golemcore.gateway.domain.model.InputOption;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * External agent asking the user for input or permission.
 */
public record InputRequestSignal(
        String taskId,
        String requestId,
        String agentType,
        String summary,
        List<InputOption> options,
        String requestType) {

    /**
     * Decode an executor event. Requests without both a task id and a request id
     * decode to empty.
     */
    public static Optional<InputRequestSignal> decode(AgentEvent event) {
        if (event == null || !AgentEventTypes.INPUT_REQUESTED.equals(event.type())) {
            return Optional.empty();
        }
        Map<String, Object> payload = event.payload();
        String taskId = EventPayloads.string(payload, "task_id");
        String requestId = EventPayloads.string(payload, "request_id");
        if (taskId.isEmpty() || requestId.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new InputRequestSignal(taskId, requestId,
                EventPayloads.string(payload, "agent_type"),
                EventPayloads.string(payload, "summary"),
                EventPayloads.options(payload, "options"),
                EventPayloads.string(payload, "type")));
    }
}
