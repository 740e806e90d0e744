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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.InputOption;
import me.golemcore.gateway.domain.model.InputResponse;
import me.golemcore.gateway.domain.model.PendingInputRelay;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.AgentExecutorPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-chat queues of external input requests and their resolution from chat
 * replies.
 */
@Service
@Slf4j
public class InputRelayService {

    private final AgentExecutorPort agentExecutor;
    private final Clock clock;
    private final GatewayProperties.RelayProperties settings;

    private final Map<String, PendingRelayQueue> queues = new ConcurrentHashMap<>();

    public InputRelayService(AgentExecutorPort agentExecutor, Clock clock, GatewayProperties properties) {
        this.agentExecutor = agentExecutor;
        this.clock = clock;
        this.settings = properties.getRelay();
    }

    /**
     * Queue a request for the chat, replacing an earlier one from the same task.
     */
    public PendingInputRelay register(String chatId, String taskId, String requestId, String agentType,
            List<InputOption> options, String requestType) {
        Instant now = clock.instant();
        PendingInputRelay relay = new PendingInputRelay(taskId, requestId, agentType, options, requestType, now,
                now.plus(settings.getTtl()));
        push(chatId, relay);
        return relay;
    }

    public void push(String chatId, PendingInputRelay relay) {
        PendingRelayQueue queue = queues.computeIfAbsent(chatId,
                key -> new PendingRelayQueue(settings.getMaxPerChat()));
        int dropped = queue.push(relay);
        if (dropped > 0) {
            log.warn("[InputRelay] Dropped {} oldest relay(s) for chat {}", dropped, chatId);
        }
        enforceChatCap();
        log.debug("[InputRelay] Queued request {} of task {} for chat {}", relay.requestId(), relay.taskId(),
                chatId);
    }

    public Optional<PendingInputRelay> popOldest(String chatId) {
        PendingRelayQueue queue = queues.get(chatId);
        if (queue == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(queue.popOldest(clock.instant()));
    }

    /**
     * Treat {@code content} as the answer to the chat's oldest pending request.
     *
     * @return true when the message was consumed as an answer
     */
    public boolean tryResolve(String chatId, String content) {
        if (queues.get(chatId) == null) {
            return false;
        }
        Optional<AgentExecutorPort.ExternalInputResponder> responder = agentExecutor.externalInputResponder();
        if (responder.isEmpty()) {
            log.warn("[InputRelay] Agent executor cannot accept external input; pending request left for chat {}",
                    chatId);
            return false;
        }
        Optional<PendingInputRelay> relay = popOldest(chatId);
        if (relay.isEmpty()) {
            return false;
        }
        InputResponse response = InputReplyParser.resolve(relay.get(), content);
        try {
            responder.get().replyExternalInput(response);
            log.info("[InputRelay] Answered request {} of task {} (approved={})", response.requestId(),
                    response.taskId(), response.approved());
            return true;
        } catch (Exception e) { // NOSONAR - message falls through to normal handling
            log.warn("[InputRelay] External input reply failed for task {}: {}", response.taskId(),
                    e.getMessage());
            return false;
        }
    }

    public int pendingCount(String chatId) {
        PendingRelayQueue queue = queues.get(chatId);
        return queue != null ? queue.size() : 0;
    }

    public int chatCount() {
        return queues.size();
    }

    /**
     * Drop expired requests and enforce the chat cap.
     */
    public CleanupResult cleanup() {
        Instant now = clock.instant();
        int expired = 0;
        for (Map.Entry<String, PendingRelayQueue> entry : queues.entrySet()) {
            expired += entry.getValue().pruneExpired(now);
            if (entry.getValue().isEmpty()) {
                queues.remove(entry.getKey(), entry.getValue());
            }
        }
        int evictedChats = enforceChatCap();
        return new CleanupResult(expired, evictedChats);
    }

    private int enforceChatCap() {
        int excess = queues.size() - settings.getMaxChats();
        if (excess <= 0) {
            return 0;
        }
        List<Map.Entry<String, PendingRelayQueue>> candidates = new ArrayList<>(queues.entrySet());
        candidates.sort(Comparator.comparing(entry -> oldestOrMin(entry.getValue())));
        int evicted = 0;
        for (Map.Entry<String, PendingRelayQueue> entry : candidates) {
            if (evicted >= excess) {
                break;
            }
            if (queues.remove(entry.getKey(), entry.getValue())) {
                evicted++;
                log.warn("[InputRelay] Relay chat cap reached, dropped pending requests for chat {}",
                        entry.getKey());
            }
        }
        return evicted;
    }

    private static Instant oldestOrMin(PendingRelayQueue queue) {
        Instant oldest = queue.oldestCreatedAt();
        return oldest != null ? oldest : Instant.MIN;
    }

    public record CleanupResult(int expiredRelays, int evictedChats) {
    }
}
