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

import java.util.Map;

/**
 * Session handle returned by the agent executor.
 */
public record AgentSession(String id, Map<String, String> metadata) {

    public static final String AWAIT_USER_INPUT_KEY = "await_user_input";

    public AgentSession {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    /**
     * Whether the session was left waiting for the user, e.g. by a run that
     * finished before a restart.
     */
    public boolean isAwaitingUserInput() {
        String flag = metadata.get(AWAIT_USER_INPUT_KEY);
        return flag != null && "true".equalsIgnoreCase(flag.trim());
    }
}
