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

import me.golemcore.gateway.domain.model.SessionPhase;
import me.golemcore.gateway.domain.model.TaskRecord;
import me.golemcore.gateway.domain.model.TaskResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Chat texts produced by the gateway itself.
 */
final class GatewayReplies {

    static final String NO_RESPONSE = "(no response)";
    static final String NEED_MORE_INFO = "I need more information to continue. Please reply with the details.";
    static final String NEW_SESSION = "Started a new session. Following messages use a fresh context.";
    static final String RESET_DONE = "Conversation history cleared.";
    static final String RESET_UNSUPPORTED = "This agent cannot clear history. Use /new to start a fresh session.";

    private static final int DESCRIPTION_LIMIT = 80;

    private GatewayReplies() {
    }

    static String taskReply(TaskResult result, Exception failure) {
        if (failure != null) {
            return "Task failed: " + describe(failure);
        }
        if (result == null) {
            return NO_RESPONSE;
        }
        if (result.isAwaitingUserInput()) {
            String question = firstNonBlank(result.getAwaitQuestion(), result.getAnswer(), NEED_MORE_INFO);
            List<String> options = result.getAwaitOptions();
            if (options != null && !options.isEmpty()) {
                return question + "\n\n" + InputReplyParser.formatNumberedOptions(options)
                        + "\n\nReply with a number, or type your answer.";
            }
            return question;
        }
        return firstNonBlank(result.getAnswer(), NO_RESPONSE);
    }

    static String sessionFailure(Exception failure) {
        return "Failed to prepare session: " + describe(failure);
    }

    static String status(SessionPhase phase, String sessionId, int activeTasks, int pendingRequests) {
        StringBuilder text = new StringBuilder("Status: ").append(describe(phase));
        text.append("\nSession: ").append(sessionId != null ? sessionId : "none");
        text.append("\nActive background tasks: ").append(activeTasks);
        if (pendingRequests > 0) {
            text.append("\nPending input requests: ").append(pendingRequests);
        }
        return text.toString();
    }

    static String taskList(List<TaskRecord> records, Instant now) {
        if (records.isEmpty()) {
            return "No background tasks for this chat.";
        }
        StringBuilder text = new StringBuilder("Background tasks:");
        for (TaskRecord record : records) {
            text.append("\n- ").append(record.getTaskId())
                    .append(" [").append(record.getStatus().getValue()).append(']');
            if (record.getAgentType() != null && !record.getAgentType().isBlank()) {
                text.append(' ').append(record.getAgentType());
            }
            if (record.getDescription() != null && !record.getDescription().isBlank()) {
                text.append(": ").append(truncate(record.getDescription(), DESCRIPTION_LIMIT));
            }
            if (record.getCreatedAt() != null) {
                text.append(" (").append(age(record.getCreatedAt(), now)).append(" ago)");
            }
        }
        return text.toString();
    }

    static String taskDetail(TaskRecord record, Instant now) {
        StringBuilder text = new StringBuilder("Task ").append(record.getTaskId());
        text.append("\nStatus: ").append(record.getStatus().getValue());
        if (record.getAgentType() != null && !record.getAgentType().isBlank()) {
            text.append("\nAgent: ").append(record.getAgentType());
        }
        if (record.getDescription() != null && !record.getDescription().isBlank()) {
            text.append("\nDescription: ").append(record.getDescription());
        }
        if (record.getCreatedAt() != null) {
            text.append("\nStarted: ").append(age(record.getCreatedAt(), now)).append(" ago");
        }
        if (record.getTokensUsed() > 0) {
            text.append("\nTokens: ").append(record.getTokensUsed());
        }
        if (record.getError() != null && !record.getError().isBlank()) {
            text.append("\nError: ").append(record.getError());
        } else if (record.getAnswerPreview() != null && !record.getAnswerPreview().isBlank()) {
            text.append("\nResult: ").append(record.getAnswerPreview());
        }
        return text.toString();
    }

    static String taskNotFound(String taskId) {
        return taskId.isEmpty() ? "Usage: /task <id>" : "Task " + taskId + " not found.";
    }

    private static String describe(SessionPhase phase) {
        switch (phase) {
            case RUNNING:
                return "working on a task";
            case AWAITING_INPUT:
                return "waiting for your reply";
            default:
                return "idle";
        }
    }

    private static String describe(Exception failure) {
        String message = failure.getMessage();
        return message != null && !message.isBlank() ? message : failure.getClass().getSimpleName();
    }

    private static String age(Instant since, Instant now) {
        long seconds = Math.max(0L, Duration.between(since, now).getSeconds());
        if (seconds < 60) {
            return seconds + "s";
        }
        if (seconds < 3600) {
            return (seconds / 60) + "m";
        }
        if (seconds < 86400) {
            return (seconds / 3600) + "h";
        }
        return (seconds / 86400) + "d";
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "";
    }

    private static String truncate(String text, int maxLength) {
        return text.length() <= maxLength ? text : text.substring(0, maxLength) + "...";
    }
}
