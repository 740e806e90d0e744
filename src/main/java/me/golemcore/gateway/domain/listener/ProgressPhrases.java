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

import java.util.List;
import java.util.Locale;

/**
 * Status phrases shown in the live progress message.
 */
final class ProgressPhrases {

    private static final List<String> THINKING = List.of(
            "Thinking...",
            "Working through the request...",
            "Considering the next step...");

    private static final String WRAPPING_UP = "Wrapping up...";

    private ProgressPhrases() {
    }

    static String thinking(int iteration) {
        return THINKING.get(Math.floorMod(iteration, THINKING.size()));
    }

    static String wrappingUp() {
        return WRAPPING_UP;
    }

    static String forTool(String toolName) {
        String name = toolName == null ? "" : toolName.toLowerCase(Locale.ROOT);
        if (containsAny(name, "search", "web_fetch", "lookup")) {
            return "Searching...";
        }
        if (containsAny(name, "read", "list_dir", "grep", "glob", "file_info")) {
            return "Reading files...";
        }
        if (containsAny(name, "write", "edit", "replace", "patch")) {
            return "Editing files...";
        }
        if (containsAny(name, "shell", "bash", "exec", "command")) {
            return "Running commands...";
        }
        if (containsAny(name, "browser", "navigate", "screenshot")) {
            return "Browsing...";
        }
        if (containsAny(name, "memory", "recall")) {
            return "Recalling context...";
        }
        if (containsAny(name, "image", "draw", "vision")) {
            return "Working with images...";
        }
        if (containsAny(name, "message", "chat", "send")) {
            return "Sending messages...";
        }
        if (containsAny(name, "plan", "todo")) {
            return "Planning...";
        }
        if (containsAny(name, "subagent", "dispatch", "delegate")) {
            return "Delegating to a helper...";
        }
        return "Working on it...";
    }

    private static boolean containsAny(String name, String... fragments) {
        for (String fragment : fragments) {
            if (name.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
