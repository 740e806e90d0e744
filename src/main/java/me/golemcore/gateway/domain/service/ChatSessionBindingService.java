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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.model.ChatSessionBinding;
import me.golemcore.gateway.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Chat to session bindings, cached in memory and stored one JSON file per
 * chat.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatSessionBindingService {

    static final String DIRECTORY = "bindings";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, ChatSessionBinding> bindings = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        List<String> files;
        try {
            files = storagePort.listObjects(DIRECTORY, "").join();
        } catch (Exception e) { // NOSONAR - start without bindings
            log.warn("[Bindings] Failed to list chat session bindings: {}", e.getMessage());
            return;
        }
        for (String file : files) {
            if (!file.endsWith(".json")) {
                continue;
            }
            try {
                String json = storagePort.getText(DIRECTORY, file).join();
                if (json == null || json.isBlank()) {
                    continue;
                }
                ChatSessionBinding binding = objectMapper.readValue(json, ChatSessionBinding.class);
                if (binding.chatId() != null && binding.sessionId() != null) {
                    bindings.put(key(binding.channelType(), binding.chatId()), binding);
                }
            } catch (Exception e) { // NOSONAR - skip unreadable files
                log.warn("[Bindings] Skipping unreadable binding {}: {}", file, e.getMessage());
            }
        }
        log.info("[Bindings] Loaded {} chat session binding(s)", bindings.size());
    }

    public Optional<ChatSessionBinding> find(String channelType, String chatId) {
        if (chatId == null || chatId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(bindings.get(key(channelType, chatId)));
    }

    /**
     * Bind the chat to {@code sessionId} and write the binding through to
     * storage. Storage failures are logged.
     */
    public void bind(String channelType, String chatId, String sessionId, boolean awaitingInput) {
        if (chatId == null || chatId.isBlank() || sessionId == null || sessionId.isBlank()) {
            return;
        }
        ChatSessionBinding binding = new ChatSessionBinding(channelType, chatId.trim(), sessionId.trim(),
                awaitingInput, clock.instant());
        bindings.put(key(channelType, chatId), binding);
        try {
            String json = objectMapper.writeValueAsString(binding);
            storagePort.putTextAtomic(DIRECTORY, fileName(channelType, chatId), json, false).join();
        } catch (Exception e) { // NOSONAR - memory copy stays usable
            log.warn("[Bindings] Failed to persist binding for chat {}: {}", chatId, e.getMessage());
        }
    }

    public void clear(String channelType, String chatId) {
        if (bindings.remove(key(channelType, chatId)) == null) {
            return;
        }
        try {
            storagePort.deleteObject(DIRECTORY, fileName(channelType, chatId)).join();
        } catch (Exception e) { // NOSONAR - stale file is overwritten on next bind
            log.warn("[Bindings] Failed to delete binding for chat {}: {}", chatId, e.getMessage());
        }
    }

    private static String key(String channelType, String chatId) {
        return channelType + ":" + chatId.trim();
    }

    static String fileName(String channelType, String chatId) {
        return (channelType + "_" + chatId.trim()).replaceAll("[^A-Za-z0-9_.-]", "_") + ".json";
    }
}
