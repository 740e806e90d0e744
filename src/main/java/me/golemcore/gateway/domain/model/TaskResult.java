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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a single task execution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskResult {

    public static final String STOP_REASON_AWAIT_USER_INPUT = "await_user_input";

    private String answer;
    private String stopReason;
    private String awaitQuestion;
    @Builder.Default
    private List<String> awaitOptions = new ArrayList<>();
    @Builder.Default
    private List<Attachment> attachments = new ArrayList<>();
    private long tokensUsed;

    public boolean isAwaitingUserInput() {
        return stopReason != null && STOP_REASON_AWAIT_USER_INPUT.equalsIgnoreCase(stopReason.trim());
    }
}
