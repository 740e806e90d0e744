package me.golemcore.gateway.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Key/value text storage for gateway state that survives restarts.
 */
public interface StoragePort {

    /**
     * Read text content.
     *
     * @return future of the content, or of {@code null} when absent
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Atomically replace text content: temp file, fsync, then rename.
     *
     * @param backup
     *            if true, preserve the previous version as {@code .bak}
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);

    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * List files under {@code directory}, relative to it, sorted.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);
}
