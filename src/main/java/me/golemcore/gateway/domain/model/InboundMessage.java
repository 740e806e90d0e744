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

/**
 * Platform-neutral inbound chat message, already decoded by the channel
 * adapter.
 *
 * @param reprocessed
 *            true when the message was drained from a finished task and fed
 *            back through the gateway; such messages bypass deduplication
 */
public record InboundMessage(
        String channelType,
        String chatId,
        String senderId,
        String messageId,
        String content,
        boolean group,
        boolean reprocessed,
        Instant receivedAt) {

    public static InboundMessage text(String channelType, String chatId, String senderId, String messageId,
            String content, boolean group) {
        return new InboundMessage(channelType, chatId, senderId, messageId, content, group, false, Instant.now());
    }
}
