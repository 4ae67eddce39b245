package me.golemcore.conductor.port.outbound;

import java.util.concurrent.CompletableFuture;

/**
 * Text storage rooted at a project directory. Paths are relative to the
 * project root; traversal outside it is rejected.
 */
public interface ProjectStoragePort {

    CompletableFuture<Void> putText(String projectRoot, String path, String content);

    /**
     * Completes with {@code null} when the file does not exist.
     */
    CompletableFuture<String> getText(String projectRoot, String path);

    CompletableFuture<Void> appendText(String projectRoot, String path, String content);

    CompletableFuture<Boolean> exists(String projectRoot, String path);
}
