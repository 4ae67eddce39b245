package me.golemcore.conductor.adapter.outbound.llm;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.domain.model.LlmChunk;
import me.golemcore.conductor.domain.model.LlmRequest;
import me.golemcore.conductor.domain.model.LlmResponse;
import me.golemcore.conductor.domain.model.LlmUsage;
import me.golemcore.conductor.port.outbound.LlmPort;
import reactor.core.publisher.Flux;

import java.util.concurrent.CompletableFuture;

/**
 * No-op LLM adapter used when no API key is configured.
 *
 * <p>
 * Always answers with a placeholder and never calls tools, so a turn completes
 * without touching the network.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Slf4j
public class NoOpLlmAdapter implements LlmPort {

    static final String PLACEHOLDER = "[No LLM configured]";

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("[LLM] NoOpLlmAdapter: chat() called - no LLM configured");
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .content(PLACEHOLDER)
                .model("none")
                .finishReason("stop")
                .usage(LlmUsage.builder()
                        .inputTokens(0)
                        .outputTokens(0)
                        .totalTokens(0)
                        .build())
                .build());
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return Flux.just(LlmChunk.builder()
                .text(PLACEHOLDER)
                .done(true)
                .build());
    }

    @Override
    public String getCurrentModel() {
        return "none";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
