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

import me.golemcore.gateway.port.outbound.CompletionNotifier;

import java.util.concurrent.BlockingQueue;

/**
 * Per-run context handed to the agent executor.
 *
 * @param inputQueue
 *            bounded queue the executor drains for follow-up user messages
 * @param completionNotifier
 *            sink for terminal task state that outlives the listener chain
 */
public record ExecutionContext(
        String channelType,
        String chatId,
        String senderId,
        String messageId,
        String sessionId,
        boolean group,
        BlockingQueue<UserInput> inputQueue,
        CompletionNotifier completionNotifier) {
}
