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

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Tool activity signals understood by {@link ProgressListener}.
 */
public interface ToolActivity {

    record IterationStarted(int iteration) implements ToolActivity {
    }

    record ToolStarted(String callId, String toolName) implements ToolActivity {
    }

    record ToolCompleted(String callId, String toolName, Duration duration, boolean errored)
            implements ToolActivity {
    }

    /**
     * Decode an executor event. Unknown types and tool events without a call id
     * decode to empty.
     */
    static Optional<ToolActivity> decode(AgentEvent event) {
        if (event == null || event.type() == null) {
            return Optional.empty();
        }
        Map<String, Object> payload = event.payload();
        switch (event.type()) {
            case AgentEventTypes.NODE_STARTED:
                return Optional.of(new IterationStarted((int) EventPayloads.number(payload, "iteration")));
            case AgentEventTypes.TOOL_STARTED: {
                String callId = EventPayloads.string(payload, "call_id");
                if (callId.isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(new ToolStarted(callId, EventPayloads.string(payload, "tool_name")));
            }
            case AgentEventTypes.TOOL_COMPLETED: {
                String callId = EventPayloads.string(payload, "call_id");
                if (callId.isEmpty()) {
                    return Optional.empty();
                }
                boolean errored = !EventPayloads.string(payload, "error").isEmpty()
                        || EventPayloads.flag(payload, "errored");
                return Optional.of(new ToolCompleted(callId, EventPayloads.string(payload, "tool_name"),
                        EventPayloads.duration(payload, "duration_ms"), errored));
            }
            default:
                return Optional.empty();
        }
    }
}
