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
import me.golemcore.gateway.domain.model.TaskStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Background task signals understood by {@link BackgroundProgressListener}.
 */
public interface BackgroundSignal {

    String taskId();

    record Dispatched(String taskId, String description, String agentType) implements BackgroundSignal {
    }

    record Progress(String taskId, String currentTool, String currentArgs, long tokensUsed, List<String> files,
            String activity) implements BackgroundSignal {
    }

    record InputRequested(String taskId, String summary) implements BackgroundSignal {
    }

    record Completed(String taskId, TaskStatus status, String answer, String error, long tokensUsed)
            implements BackgroundSignal {
    }

    /**
     * Decode an executor event. Unknown types and events without a task id decode
     * to empty.
     */
    static Optional<BackgroundSignal> decode(AgentEvent event) {
        if (event == null || event.type() == null) {
            return Optional.empty();
        }
        Map<String, Object> payload = event.payload();
        String taskId = EventPayloads.string(payload, "task_id");
        if (taskId.isEmpty()) {
            return Optional.empty();
        }
        switch (event.type()) {
            case AgentEventTypes.BACKGROUND_DISPATCHED:
                return Optional.of(new Dispatched(taskId, EventPayloads.string(payload, "description"),
                        EventPayloads.string(payload, "agent_type")));
            case AgentEventTypes.BACKGROUND_PROGRESS:
                return Optional.of(new Progress(taskId,
                        EventPayloads.string(payload, "current_tool"),
                        EventPayloads.string(payload, "current_args"),
                        EventPayloads.number(payload, "tokens_used"),
                        EventPayloads.strings(payload, "files_touched"),
                        EventPayloads.string(payload, "activity")));
            case AgentEventTypes.INPUT_REQUESTED:
                return Optional.of(new InputRequested(taskId, EventPayloads.string(payload, "summary")));
            case AgentEventTypes.BACKGROUND_COMPLETED: {
                TaskStatus status = TaskStatus.fromValue(EventPayloads.string(payload, "status"));
                String error = EventPayloads.string(payload, "error");
                if (status == null || !status.isTerminal()) {
                    // a completion always ends the task
                    status = error.isEmpty() ? TaskStatus.COMPLETED : TaskStatus.FAILED;
                }
                return Optional.of(new Completed(taskId, status,
                        EventPayloads.string(payload, "answer"),
                        error,
                        EventPayloads.number(payload, "tokens_used")));
            }
            default:
                return Optional.empty();
        }
    }
}
