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

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs gateway execution units (task runs, reprocessing, immediate progress
 * flushes) and tracks how many are in flight so callers can wait for all of
 * them to finish.
 */
@Slf4j
public class GatewayWorkers {

    private final ExecutorService executor;
    private final Object monitor = new Object();
    private int inFlight;

    public GatewayWorkers(ExecutorService executor) {
        this.executor = executor;
    }

    public void submit(String name, Runnable work) {
        synchronized (monitor) {
            inFlight++;
        }
        try {
            executor.execute(() -> {
                try {
                    work.run();
                } catch (Exception e) { // NOSONAR - keep the worker alive
                    log.error("[Workers] Unit '{}' failed", name, e);
                } finally {
                    done();
                }
            });
        } catch (RejectedExecutionException e) {
            done();
            log.error("[Workers] Unit '{}' rejected, executor is shut down", name);
        }
    }

    /**
     * Block until no unit is in flight.
     *
     * @return false if {@code timeout} elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (monitor) {
            while (inFlight > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(monitor, remaining);
            }
            return true;
        }
    }

    public int inFlight() {
        synchronized (monitor) {
            return inFlight;
        }
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void done() {
        synchronized (monitor) {
            inFlight--;
            monitor.notifyAll();
        }
    }
}
