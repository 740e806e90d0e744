package me.golemcore.gateway.adapter.outbound.storage;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of {@link StoragePort}.
 *
 * <p>
 * Gateway state lives under {@code gateway.storage.base-path}:
 * <ul>
 * <li>tasks/ - task registry snapshot
 * <li>bindings/ - chat to session bindings
 * </ul>
 * Writes go to a {@code .tmp} sibling first; listings hide those and
 * {@code .bak} copies.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private static final String TEMP_SUFFIX = ".tmp";
    private static final String BACKUP_SUFFIX = ".bak";
    private static final List<String> STATE_DIRECTORIES = List.of("tasks", "bindings");

    private final GatewayProperties properties;

    private Path root;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getBasePath();
        root = Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        try {
            for (String directory : STATE_DIRECTORIES) {
                Files.createDirectories(root.resolve(directory));
            }
            log.info("[Storage] Gateway state stored at {}", root);
        } catch (IOException e) {
            log.error("[Storage] Cannot create state directories under {}", root, e);
        }
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return io("read " + directory + "/" + path, () -> {
            Path file = locate(directory, path);
            return Files.isRegularFile(file) ? Files.readString(file, StandardCharsets.UTF_8) : null;
        });
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        return io("delete " + directory + "/" + path, () -> {
            Files.deleteIfExists(locate(directory, path));
            return null;
        });
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        return io("list " + directory, () -> {
            Path base = locate(directory, "");
            Path start = prefix == null || prefix.isEmpty() ? base : locate(directory, prefix);
            if (!Files.exists(start)) {
                return List.of();
            }
            try (Stream<Path> files = Files.walk(start)) {
                return files.filter(Files::isRegularFile)
                        .filter(file -> isVisible(file.getFileName().toString()))
                        .map(file -> base.relativize(file).toString())
                        .sorted()
                        .toList();
            }
        });
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return io("write " + directory + "/" + path, () -> {
            Path target = locate(directory, path);
            Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
            Files.createDirectories(target.getParent());
            try {
                writeSynced(temp, content.getBytes(StandardCharsets.UTF_8));
                if (backup && Files.exists(target)) {
                    Files.copy(target, target.resolveSibling(target.getFileName() + BACKUP_SUFFIX),
                            StandardCopyOption.REPLACE_EXISTING);
                }
                replace(temp, target);
            } catch (IOException e) {
                Files.deleteIfExists(temp);
                throw e;
            }
            return null;
        });
    }

    private static void writeSynced(Path file, byte[] bytes) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic rename unsupported for {}, replacing in place", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static boolean isVisible(String fileName) {
        return !fileName.endsWith(TEMP_SUFFIX) && !fileName.endsWith(BACKUP_SUFFIX);
    }

    private Path locate(String directory, String path) {
        Path resolved = root.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }

    private static <T> CompletableFuture<T> io(String operation, IoCall<T> call) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return call.run();
            } catch (IOException e) {
                throw new UncheckedIOException("Storage failed to " + operation, e);
            }
        });
    }

    @FunctionalInterface
    private interface IoCall<T> {
        T run() throws IOException;
    }
}
