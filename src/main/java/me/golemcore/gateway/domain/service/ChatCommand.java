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

import java.util.Locale;
import java.util.Optional;

/**
 * Control command recognized by the gateway.
 */
public record ChatCommand(Type type, String argument) {

    public enum Type {
        NEW, RESET, STATUS, TASKS, TASK
    }

    /**
     * Parse {@code /name[@bot] [argument]}. Unknown commands are not control
     * commands and go to the agent as ordinary text.
     */
    public static Optional<ChatCommand> parse(String content) {
        if (content == null) {
            return Optional.empty();
        }
        String text = content.trim();
        if (!text.startsWith("/") || text.length() < 2) {
            return Optional.empty();
        }
        String[] parts = text.substring(1).split("\\s+", 2);
        String name = parts[0].split("@", 2)[0].toLowerCase(Locale.ROOT);
        String argument = parts.length > 1 ? parts[1].trim() : "";
        switch (name) {
            case "new":
                return Optional.of(new ChatCommand(Type.NEW, argument));
            case "reset":
                return Optional.of(new ChatCommand(Type.RESET, argument));
            case "status":
                return Optional.of(new ChatCommand(Type.STATUS, argument));
            case "tasks":
                return Optional.of(new ChatCommand(Type.TASKS, argument));
            case "task":
                return Optional.of(new ChatCommand(Type.TASK, argument));
            default:
                return Optional.empty();
        }
    }
}
