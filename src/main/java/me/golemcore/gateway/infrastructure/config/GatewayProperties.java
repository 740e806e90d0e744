package me.golemcore.gateway.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration properties for the gateway, bound from the
 * {@code gateway.*} namespace.
 *
 * <p>
 * Each nested class groups the tunables of one subsystem. Defaults are the
 * production values; tests construct the object directly and override what
 * they need.
 */
@Component
@ConfigurationProperties(prefix = "gateway")
@Data
public class GatewayProperties {

    private DedupProperties dedup = new DedupProperties();
    private SessionProperties session = new SessionProperties();
    private ProgressProperties progress = new ProgressProperties();
    private BackgroundProperties background = new BackgroundProperties();
    private RelayProperties relay = new RelayProperties();
    private TasksProperties tasks = new TasksProperties();
    private CleanupProperties cleanup = new CleanupProperties();
    private ReactionProperties reactions = new ReactionProperties();
    private StorageProperties storage = new StorageProperties();
    private TelegramProperties telegram = new TelegramProperties();

    @Data
    public static class DedupProperties {
        private int maxEntries = 2048;
        private Duration ttl = Duration.ofMinutes(10);
    }

    @Data
    public static class SessionProperties {
        private int inputCapacity = 16;
        private Duration slotTtl = Duration.ofHours(6);
        private int maxSlots = 2048;
    }

    @Data
    public static class ProgressProperties {
        private boolean enabled = true;
        private Duration minInterval = Duration.ofSeconds(2);
    }

    @Data
    public static class BackgroundProperties {
        private boolean enabled = true;
        private Duration interval = Duration.ofMinutes(10);
        private Duration window = Duration.ofMinutes(10);
        private Duration codeAgentInterval = Duration.ofMinutes(3);
        private List<String> codeAgentTypes = new ArrayList<>(List.of("codex", "claude_code"));
        private Duration completionPollInterval = Duration.ofSeconds(30);
        private Duration maxLifetime = Duration.ofHours(4);
    }

    @Data
    public static class RelayProperties {
        private Duration ttl = Duration.ofMinutes(30);
        private int maxPerChat = 8;
        private int maxChats = 512;
    }

    @Data
    public static class TasksProperties {
        private Duration retention = Duration.ofHours(72);
        private int maxPerChat = 50;
        private boolean markStaleOnStartup = true;
    }

    @Data
    public static class CleanupProperties {
        private Duration interval = Duration.ofMinutes(5);
    }

    @Data
    public static class ReactionProperties {
        private boolean enabled = true;
        private String ackEmoji = "👀";
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/gateway";
    }

    @Data
    public static class TelegramProperties {
        private boolean enabled = false;
        private String token;
    }
}
