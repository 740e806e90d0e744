package me.golemcore.gateway.port.inbound;

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

/**
 * Inbound chat channel (Telegram, ...) that feeds messages into the gateway.
 *
 * <p>
 * Channels are started by the infrastructure configuration when their
 * {@code gateway.<type>.enabled} flag is set.
 */
public interface ChannelPort {

    String getChannelType();

    void start();

    void stop();

    boolean isRunning();
}
