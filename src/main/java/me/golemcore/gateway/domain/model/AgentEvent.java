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

import java.time.Instant;
import java.util.Map;

/**
 * Loosely typed lifecycle signal emitted by the agent executor. Listeners
 * decode the payload for the event types they understand.
 */
public record AgentEvent(String type, String nodeId, Map<String, Object> payload, Instant timestamp) {

    public AgentEvent {
        payload = payload != null ? payload : Map.of();
    }

    public static AgentEvent of(String type, Map<String, Object> payload) {
        return new AgentEvent(type, null, payload, Instant.now());
    }
}
