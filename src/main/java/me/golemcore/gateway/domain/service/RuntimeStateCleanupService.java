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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.TurnStatePort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic sweep that keeps per-chat runtime state bounded: session slots,
 * pending input relays and external turn state.
 *
 * <p>
 * The three sweeps are independent; a failure in one does not skip the others.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RuntimeStateCleanupService {

    private final GatewayProperties properties;
    private final SessionSlotRegistry slots;
    private final InputRelayService relays;
    private final ObjectProvider<TurnStatePort> turnStateProvider;
    private final Clock clock;

    private ScheduledExecutorService cleanupExecutor;

    @PostConstruct
    public void start() {
        long intervalMillis = properties.getCleanup().getInterval().toMillis();
        cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "runtime-state-cleanup");
            t.setDaemon(true);
            return t;
        });
        cleanupExecutor.scheduleAtFixedRate(this::sweep, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("[Cleanup] Runtime state cleanup every {}s", intervalMillis / 1000);
    }

    @PreDestroy
    public void stop() {
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdownNow();
            try {
                cleanupExecutor.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Run one cleanup pass.
     */
    public SweepResult sweep() {
        int slotsRemoved = 0;
        int relaysExpired = 0;
        int relayChatsEvicted = 0;
        int turnStatesRemoved = 0;

        try {
            GatewayProperties.SessionProperties session = properties.getSession();
            slotsRemoved = slots.cleanup(session.getSlotTtl(), session.getMaxSlots());
        } catch (Exception e) { // NOSONAR - keep sweeping the rest
            log.error("[Cleanup] Session slot sweep failed", e);
        }

        try {
            InputRelayService.CleanupResult relayResult = relays.cleanup();
            relaysExpired = relayResult.expiredRelays();
            relayChatsEvicted = relayResult.evictedChats();
        } catch (Exception e) { // NOSONAR - keep sweeping the rest
            log.error("[Cleanup] Input relay sweep failed", e);
        }

        TurnStatePort turnState = turnStateProvider.getIfAvailable();
        if (turnState != null) {
            try {
                turnStatesRemoved = turnState.cleanupExpired(clock.instant());
            } catch (Exception e) { // NOSONAR - external collaborator
                log.error("[Cleanup] Turn state sweep failed", e);
            }
        }

        SweepResult result = new SweepResult(slotsRemoved, relaysExpired, relayChatsEvicted, turnStatesRemoved);
        if (result.total() > 0) {
            log.info("[Cleanup] Removed slots={}, expiredRelays={}, relayChats={}, turnStates={}",
                    slotsRemoved, relaysExpired, relayChatsEvicted, turnStatesRemoved);
        }
        return result;
    }

    public record SweepResult(int slotsRemoved, int relaysExpired, int relayChatsEvicted, int turnStatesRemoved) {

        public int total() {
            return slotsRemoved + relaysExpired + relayChatsEvicted + turnStatesRemoved;
        }
    }
}
