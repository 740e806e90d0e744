package me.golemcore.gateway.adapter.inbound.telegram;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.Attachment;
import me.golemcore.gateway.domain.model.InboundMessage;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.inbound.ChannelPort;
import me.golemcore.gateway.port.inbound.InboundMessageHandler;
import me.golemcore.gateway.port.outbound.MessengerException;
import me.golemcore.gateway.port.outbound.MessengerPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.longpolling.util.LongPollingSingleThreadUpdateConsumer;
import org.telegram.telegrambots.meta.api.methods.reactions.SetMessageReaction;
import org.telegram.telegrambots.meta.api.methods.send.SendDocument;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.io.ByteArrayInputStream;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Telegram channel: long-polls updates into the gateway and implements the
 * outbound {@link MessengerPort} on the same bot client.
 *
 * <p>
 * Only text messages (and captions of media messages) are forwarded. Message
 * identifiers are the Telegram integer ids rendered as strings.
 */
@Component
@Slf4j
public class TelegramAdapter implements ChannelPort, MessengerPort, LongPollingSingleThreadUpdateConsumer {

    static final String CHANNEL_TYPE = "telegram";
    static final int MAX_MESSAGE_LENGTH = 4096;
    private static final String NOT_MODIFIED = "message is not modified";

    private final GatewayProperties properties;
    private final TelegramBotsLongPollingApplication botsApplication;
    private final ObjectProvider<InboundMessageHandler> handlerProvider;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private volatile TelegramClient telegramClient;
    private volatile boolean running = false;
    private final Object lifecycleLock = new Object();

    public TelegramAdapter(GatewayProperties properties, TelegramBotsLongPollingApplication botsApplication,
            ObjectProvider<InboundMessageHandler> handlerProvider, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.botsApplication = botsApplication;
        this.handlerProvider = handlerProvider;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Package-private setter for testing.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
    }

    private synchronized TelegramClient getOrCreateClient() {
        if (telegramClient == null) {
            String token = properties.getTelegram().getToken();
            if (token == null || token.isBlank()) {
                return null;
            }
            telegramClient = new OkHttpTelegramClient(token);
        }
        return telegramClient;
    }

    private TelegramClient requireClient() {
        TelegramClient client = getOrCreateClient();
        if (client == null) {
            throw new MessengerException("Telegram client not configured");
        }
        return client;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("Telegram adapter already running");
                return;
            }
            if (!properties.getTelegram().isEnabled()) {
                log.info("Telegram channel disabled");
                return;
            }
            if (getOrCreateClient() == null) {
                log.warn("Telegram token not configured, adapter will not start");
                return;
            }
            try {
                botsApplication.registerBot(properties.getTelegram().getToken(), this);
                running = true;
                log.info("Telegram adapter started");
            } catch (TelegramApiException e) {
                if (e.getMessage() != null && e.getMessage().contains("already registered")) {
                    running = true;
                    log.warn("Telegram bot already registered; keeping existing polling session active");
                    return;
                }
                log.error("Failed to start Telegram adapter", e);
            }
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running) {
                return;
            }
            running = false;
            try {
                botsApplication.close();
                log.info("Telegram adapter stopped");
            } catch (Exception e) { // NOSONAR - shutdown path
                log.error("Error stopping Telegram adapter", e);
            }
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public void consume(Update update) {
        if (!update.hasMessage()) {
            return;
        }
        Message telegramMessage = update.getMessage();
        String content = telegramMessage.hasText() ? telegramMessage.getText() : telegramMessage.getCaption();
        if (content == null || content.isBlank() || telegramMessage.getFrom() == null) {
            return;
        }
        InboundMessage message = new InboundMessage(
                CHANNEL_TYPE,
                telegramMessage.getChatId().toString(),
                telegramMessage.getFrom().getId().toString(),
                telegramMessage.getMessageId().toString(),
                content,
                telegramMessage.isGroupMessage() || telegramMessage.isSuperGroupMessage(),
                false,
                clock.instant());

        InboundMessageHandler handler = handlerProvider.getIfAvailable();
        if (handler == null) {
            log.warn("[Telegram] No inbound handler registered, dropping message {}", message.messageId());
            return;
        }
        try {
            handler.handle(message);
        } catch (Exception e) { // NOSONAR - keep the polling thread alive
            log.error("[Telegram] Failed to handle message {} in chat {}", message.messageId(), message.chatId(),
                    e);
        }
    }

    @Override
    public String sendMessage(String chatId, String text) {
        return replyMessage(chatId, null, text);
    }

    @Override
    public String replyMessage(String chatId, String replyToMessageId, String text) {
        SendMessage.SendMessageBuilder<?, ?> builder = SendMessage.builder()
                .chatId(chatId)
                .text(truncate(text));
        Integer replyTo = parseMessageId(replyToMessageId);
        if (replyTo != null) {
            builder.replyToMessageId(replyTo);
        }
        try {
            Message sent = requireClient().execute(builder.build());
            return sent != null && sent.getMessageId() != null ? sent.getMessageId().toString() : null;
        } catch (TelegramApiException e) {
            throw new MessengerException("Failed to send message to chat " + chatId, e);
        }
    }

    @Override
    public void updateMessage(String chatId, String messageId, String text) {
        Integer id = parseMessageId(messageId);
        if (id == null) {
            throw new MessengerException("Invalid message id: " + messageId);
        }
        EditMessageText edit = EditMessageText.builder()
                .chatId(chatId)
                .messageId(id)
                .text(truncate(text))
                .build();
        try {
            requireClient().execute(edit);
        } catch (TelegramApiException e) {
            if (e.getMessage() != null && e.getMessage().contains(NOT_MODIFIED)) {
                log.debug("[Telegram] Message {} unchanged", messageId);
                return;
            }
            throw new MessengerException("Failed to edit message " + messageId + " in chat " + chatId, e);
        }
    }

    @Override
    public void addReaction(String chatId, String messageId, String emoji) {
        Integer id = parseMessageId(messageId);
        if (id == null) {
            throw new MessengerException("Invalid message id: " + messageId);
        }
        try {
            requireClient().execute(buildReaction(chatId, id, emoji));
        } catch (TelegramApiException | IllegalArgumentException e) {
            throw new MessengerException("Failed to react to message " + messageId + " in chat " + chatId, e);
        }
    }

    /**
     * Builds the request from Bot API field names so the polymorphic reaction
     * type is resolved by the library's own deserializer.
     */
    SetMessageReaction buildReaction(String chatId, int messageId, String emoji) {
        Map<String, Object> reaction = new LinkedHashMap<>();
        reaction.put("type", "emoji");
        reaction.put("emoji", emoji);
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("chat_id", chatId);
        request.put("message_id", messageId);
        request.put("reaction", List.of(reaction));
        return objectMapper.convertValue(request, SetMessageReaction.class);
    }

    @Override
    public void sendDocument(String chatId, String replyToMessageId, Attachment attachment) {
        SendDocument.SendDocumentBuilder<?, ?> builder = SendDocument.builder()
                .chatId(chatId)
                .document(new InputFile(new ByteArrayInputStream(attachment.data()), attachment.name()));
        Integer replyTo = parseMessageId(replyToMessageId);
        if (replyTo != null) {
            builder.replyToMessageId(replyTo);
        }
        try {
            requireClient().execute(builder.build());
            log.debug("[Telegram] Sent document '{}' ({} bytes) to chat: {}", attachment.name(),
                    attachment.data().length, chatId);
        } catch (TelegramApiException e) {
            throw new MessengerException("Failed to send document '" + attachment.name() + "' to chat " + chatId,
                    e);
        }
    }

    static String truncate(String text) {
        if (text == null || text.isEmpty()) {
            return ".";
        }
        if (text.length() <= MAX_MESSAGE_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_MESSAGE_LENGTH - 3) + "...";
    }

    private static Integer parseMessageId(String messageId) {
        if (messageId == null || messageId.isBlank()) {
            return null;
        }
        try {
            return Integer.valueOf(messageId.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
