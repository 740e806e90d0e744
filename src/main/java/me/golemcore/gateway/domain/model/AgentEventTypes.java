package me.golemcore.gateway.domain.model;

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

/**
 * Event type names emitted by the agent executor.
 */
public final class AgentEventTypes {

    public static final String NODE_STARTED = "workflow.node.started";
    public static final String TOOL_STARTED = "workflow.tool.started";
    public static final String TOOL_COMPLETED = "workflow.tool.completed";
    public static final String BACKGROUND_DISPATCHED = "background.task.dispatched";
    public static final String BACKGROUND_PROGRESS = "external.agent.progress";
    public static final String BACKGROUND_COMPLETED = "background.task.completed";
    public static final String INPUT_REQUESTED = "external.input.requested";

    private AgentEventTypes() {
    }
}
