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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.AgentEvent;
import me.golemcore.gateway.domain.model.InputOption;
import me.golemcore.gateway.domain.service.InputRelayService;
import me.golemcore.gateway.port.outbound.MessengerPort;

import java.util.List;

/**
 * Turns external input requests into chat prompts and queues them so the next
 * chat message can answer them.
 */
@Slf4j
public class InputRequestListener implements AgentEventListener {

    private static final String PERMISSION_TYPE = "permission";

    private final AgentEventListener inner;
    private final InputRelayService relays;
    private final MessengerPort messenger;
    private final String chatId;
    private final String replyToMessageId;

    public InputRequestListener(AgentEventListener inner, InputRelayService relays, MessengerPort messenger,
            String chatId, String replyToMessageId) {
        this.inner = inner != null ? inner : AgentEventListener.NOOP;
        this.relays = relays;
        this.messenger = messenger;
        this.chatId = chatId;
        this.replyToMessageId = replyToMessageId;
    }

    @Override
    public void onEvent(AgentEvent event) {
        inner.onEvent(event);
        InputRequestSignal.decode(event).ifPresent(this::relay);
    }

    private void relay(InputRequestSignal request) {
        relays.register(chatId, request.taskId(), request.requestId(), request.agentType(), request.options(),
                request.requestType());
        try {
            messenger.replyMessage(chatId, replyToMessageId, formatPrompt(request));
        } catch (Exception e) { // NOSONAR - the relay stays queued even if the prompt is lost
            log.error("[InputRelay] Failed to send input prompt for task {} to chat {}", request.taskId(), chatId,
                    e);
        }
    }

    static String formatPrompt(InputRequestSignal request) {
        String agent = request.agentType().isEmpty() ? "Agent" : request.agentType();
        StringBuilder text = new StringBuilder();
        text.append('[').append(agent).append(" needs input] task ").append(request.taskId()).append('\n');
        if (!request.summary().isEmpty()) {
            text.append(request.summary()).append('\n');
        }
        List<InputOption> options = request.options();
        if (!options.isEmpty()) {
            text.append('\n');
            for (int i = 0; i < options.size(); i++) {
                InputOption option = options.get(i);
                text.append(i + 1).append(". ").append(option.label());
                if (option.description() != null && !option.description().isBlank()) {
                    text.append(" - ").append(option.description());
                }
                text.append('\n');
            }
            text.append("\nReply with a number, or type your answer.");
        } else if (PERMISSION_TYPE.equalsIgnoreCase(request.requestType())) {
            text.append("\nReply 1 to approve, 2 to deny, 3 to approve and remember.");
        } else {
            text.append("\nReply with your answer.");
        }
        return text.toString();
    }
}
