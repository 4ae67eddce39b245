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

package me.golemcore.conductor.adapter.outbound.storage;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.port.outbound.ProjectStoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.CompletableFuture;

/**
 * Local filesystem implementation of ProjectStoragePort.
 *
 * <p>
 * Paths are resolved relative to the project root and must stay inside it.
 * Whole-file writes go through a temp file and an atomic rename; appends
 * create missing parent directories.
 */
@Component
@Slf4j
public class LocalProjectStorageAdapter implements ProjectStoragePort {

    @Override
    public CompletableFuture<Void> putText(String projectRoot, String path, String content) {
        return CompletableFuture.runAsync(() -> {
            Path targetPath = resolvePath(projectRoot, path);
            Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");
            try {
                createParent(targetPath);
                Files.writeString(tempPath, content, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.TRUNCATE_EXISTING);
                try {
                    Files.move(tempPath, targetPath,
                            StandardCopyOption.REPLACE_EXISTING,
                            StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    log.warn("[Storage] Atomic move not supported, using regular move");
                    Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
                }
            } catch (IOException e) {
                try {
                    Files.deleteIfExists(tempPath);
                } catch (IOException cleanupEx) {
                    log.warn("[Storage] Failed to cleanup temp file: {}", tempPath);
                }
                throw new UncheckedIOException("Failed to write file: " + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<String> getText(String projectRoot, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path filePath = resolvePath(projectRoot, path);
            if (!Files.exists(filePath)) {
                return null;
            }
            try {
                return Files.readString(filePath, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read file: " + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> appendText(String projectRoot, String path, String content) {
        return CompletableFuture.runAsync(() -> {
            Path filePath = resolvePath(projectRoot, path);
            try {
                createParent(filePath);
                Files.writeString(filePath, content, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to append to file: " + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> exists(String projectRoot, String path) {
        return CompletableFuture.supplyAsync(() -> Files.exists(resolvePath(projectRoot, path)));
    }

    private static void createParent(Path filePath) throws IOException {
        Path parent = filePath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static Path resolvePath(String projectRoot, String path) {
        Path root = Paths.get(projectRoot).toAbsolutePath().normalize();
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path traversal blocked: " + path);
        }
        return resolved;
    }
}
