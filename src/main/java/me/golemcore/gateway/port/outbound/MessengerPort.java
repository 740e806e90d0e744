package me.golemcore.gateway.port.outbound;

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

import me.golemcore.gateway.domain.model.Attachment;

/**
 * Outbound messaging operations of the chat platform.
 *
 * <p>
 * All methods make a single attempt and throw {@link MessengerException} on
 * failure. Callers log and continue; nothing is retried.
 */
public interface MessengerPort {

    /**
     * Send a new message to the chat.
     *
     * @return platform identifier of the created message
     */
    String sendMessage(String chatId, String text);

    /**
     * Send a message quoting {@code replyToMessageId}. Falls back to a plain
     * message when the identifier is blank.
     *
     * @return platform identifier of the created message
     */
    String replyMessage(String chatId, String replyToMessageId, String text);

    /**
     * Replace the text of a previously sent message.
     */
    void updateMessage(String chatId, String messageId, String text);

    void addReaction(String chatId, String messageId, String emoji);

    void sendDocument(String chatId, String replyToMessageId, Attachment attachment);
}
