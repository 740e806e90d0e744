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

import me.golemcore.gateway.domain.model.InputOption;
import me.golemcore.gateway.domain.model.InputResponse;
import me.golemcore.gateway.domain.model.PendingInputRelay;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Interprets a chat message as the answer to a pending input request or to a
 * numbered list of options.
 *
 * <p>
 * Numeric lists such as {@code "2,3"} select several options. Selection is
 * best-effort: a list containing any out-of-range number is treated as free
 * text.
 */
public final class InputReplyParser {

    public static final String OPTION_APPROVE = "approve";
    public static final String OPTION_DENY = "deny";
    public static final String OPTION_APPROVE_ALWAYS = "approve_always";

    private static final Set<String> SKIP_KEYWORDS = Set.of(
            "skip", "no", "deny", "reject", "cancel", "跳过", "拒绝", "取消");
    private static final Pattern NUMBER_LIST = Pattern.compile("\\d+(\\s*[,，、]\\s*\\d+)*");
    private static final Pattern SEPARATOR = Pattern.compile("\\s*[,，、]\\s*");

    private InputReplyParser() {
    }

    public static InputResponse resolve(PendingInputRelay relay, String content) {
        String reply = content == null ? "" : content.trim();
        String normalized = reply.toLowerCase(Locale.ROOT);

        if (SKIP_KEYWORDS.contains(normalized)) {
            return new InputResponse(relay.taskId(), relay.requestId(), false, "", reply);
        }

        List<InputOption> options = relay.options();
        if (!options.isEmpty()) {
            List<Integer> picks = parseSelection(reply, options.size());
            if (!picks.isEmpty()) {
                List<String> ids = new ArrayList<>();
                List<String> labels = new ArrayList<>();
                for (int pick : picks) {
                    InputOption option = options.get(pick - 1);
                    ids.add(option.id() != null && !option.id().isEmpty() ? option.id() : option.label());
                    labels.add(option.label());
                }
                return new InputResponse(relay.taskId(), relay.requestId(), true, String.join(",", ids),
                        String.join(", ", labels));
            }
        } else {
            switch (normalized) {
                case "1":
                    return new InputResponse(relay.taskId(), relay.requestId(), true, OPTION_APPROVE, reply);
                case "2":
                    return new InputResponse(relay.taskId(), relay.requestId(), false, OPTION_DENY, reply);
                case "3":
                    return new InputResponse(relay.taskId(), relay.requestId(), true, OPTION_APPROVE_ALWAYS,
                            reply);
                default:
                    break;
            }
        }
        return new InputResponse(relay.taskId(), relay.requestId(), true, "", reply);
    }

    /**
     * Translate a numbered reply into the chosen labels.
     *
     * @return the labels joined with {@code ", "}, or {@code content} unchanged
     *         when it is not a valid selection
     */
    public static String resolveNumberedReply(String content, List<String> labels) {
        if (content == null || labels == null || labels.isEmpty()) {
            return content;
        }
        List<Integer> picks = parseSelection(content.trim(), labels.size());
        if (picks.isEmpty()) {
            return content;
        }
        List<String> chosen = new ArrayList<>();
        for (int pick : picks) {
            chosen.add(labels.get(pick - 1));
        }
        return String.join(", ", chosen);
    }

    /**
     * @return 1-based picks in reply order without duplicates, or an empty list
     *         when the reply is not a valid selection
     */
    static List<Integer> parseSelection(String reply, int optionCount) {
        if (reply.isEmpty() || !NUMBER_LIST.matcher(reply).matches()) {
            return List.of();
        }
        List<Integer> picks = new ArrayList<>();
        for (String part : SEPARATOR.split(reply)) {
            int pick;
            try {
                pick = Integer.parseInt(part);
            } catch (NumberFormatException e) {
                return List.of();
            }
            if (pick < 1 || pick > optionCount) {
                return List.of();
            }
            if (!picks.contains(pick)) {
                picks.add(pick);
            }
        }
        return picks;
    }

    /**
     * Render numbered options for a chat message.
     */
    public static String formatNumberedOptions(List<String> labels) {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < labels.size(); i++) {
            text.append(i + 1).append(". ").append(labels.get(i)).append('\n');
        }
        return text.toString().stripTrailing();
    }
}
