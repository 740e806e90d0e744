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

import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Cadence and lifetime settings of a {@link BackgroundProgressListener}.
 *
 * @param codeAgentTypes
 *            agent types reported on {@code codeAgentInterval} when it is
 *            shorter than {@code interval}
 */
public record BackgroundProgressSettings(
        Duration interval,
        Duration window,
        Duration codeAgentInterval,
        Set<String> codeAgentTypes,
        Duration completionPollInterval,
        Duration maxLifetime) {

    public BackgroundProgressSettings {
        codeAgentTypes = codeAgentTypes != null ? Set.copyOf(codeAgentTypes) : Set.of();
    }

    public Duration cadenceFor(String agentType) {
        if (agentType == null || !codeAgentTypes.contains(agentType.trim().toLowerCase(Locale.ROOT))) {
            return interval;
        }
        return codeAgentInterval.compareTo(interval) < 0 ? codeAgentInterval : interval;
    }
}
