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

import me.golemcore.gateway.domain.model.InputOption;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Lenient accessors for loosely typed event payloads.
 */
final class EventPayloads {

    private EventPayloads() {
    }

    static String string(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value == null) {
            return "";
        }
        return value.toString().trim();
    }

    static long number(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return 0L;
            }
        }
        return 0L;
    }

    static boolean flag(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && "true".equalsIgnoreCase(value.toString().trim());
    }

    static Duration duration(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value instanceof Duration d) {
            return d;
        }
        return Duration.ofMillis(Math.max(0L, number(payload, key)));
    }

    static List<String> strings(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                if (item != null && !item.toString().isBlank()) {
                    result.add(item.toString().trim());
                }
            }
        }
        return result;
    }

    static List<InputOption> options(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        List<InputOption> result = new ArrayList<>();
        if (!(value instanceof Collection<?> items)) {
            return result;
        }
        for (Object item : items) {
            if (item instanceof InputOption option) {
                result.add(option);
            } else if (item instanceof Map<?, ?> raw) {
                @SuppressWarnings("unchecked")
                Map<String, Object> fields = (Map<String, Object>) raw;
                String id = string(fields, "id");
                String label = string(fields, "label");
                if (label.isEmpty()) {
                    label = id;
                }
                if (!label.isEmpty()) {
                    result.add(new InputOption(id, label, string(fields, "description")));
                }
            }
        }
        return result;
    }

    static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        if (trimmed.length() <= maxLength) {
            return trimmed;
        }
        return trimmed.substring(0, maxLength) + "...";
    }
}
