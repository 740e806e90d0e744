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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.service.GatewayWorkers;
import me.golemcore.gateway.port.inbound.ChannelPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans and channel startup.
 *
 * <p>
 * On startup every {@link ChannelPort} is started; each channel checks its own
 * {@code gateway.<type>.enabled} flag.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final GatewayProperties properties;
    private final List<ChannelPort> channelPorts;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Runs agent tasks, deferred sends and reprocessing of drained messages.
     */
    @Bean(destroyMethod = "shutdown")
    public static GatewayWorkers gatewayWorkers() {
        return new GatewayWorkers(Executors.newCachedThreadPool(namedDaemonThreads("gateway-worker")));
    }

    /**
     * Timers of progress listeners: deferred flushes, tickers, pollers.
     */
    @Bean(destroyMethod = "shutdownNow")
    public static ScheduledExecutorService gatewayScheduler() {
        return Executors.newScheduledThreadPool(2, namedDaemonThreads("gateway-timer"));
    }

    /**
     * Always created; the Telegram adapter only registers with it when
     * {@code gateway.telegram.enabled} is set.
     */
    @Bean
    public static TelegramBotsLongPollingApplication telegramBotsApplication() {
        return new TelegramBotsLongPollingApplication();
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Gateway starting...");
        log.info("Storage Path: {}", properties.getStorage().getBasePath());

        for (ChannelPort channel : channelPorts) {
            log.info("Starting channel: {}", channel.getChannelType());
            channel.start();
        }

        log.info("GolemCore Gateway started");
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
