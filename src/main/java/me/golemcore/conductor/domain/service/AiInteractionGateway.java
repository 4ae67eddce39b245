package me.golemcore.conductor.domain.service;


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
import me.golemcore.conductor.domain.model.LlmRequest;
import me.golemcore.conductor.domain.model.LlmResponse;
import me.golemcore.conductor.domain.model.Message;
import me.golemcore.conductor.domain.model.RuntimeEventType;
import me.golemcore.conductor.domain.model.ToolDefinition;
import me.golemcore.conductor.domain.model.TurnContext;
import me.golemcore.conductor.domain.support.CancellationToken;
import me.golemcore.conductor.port.outbound.ContextBuilderPort;
import me.golemcore.conductor.port.outbound.LlmPort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single entry point for model calls.
 *
 * <p>
 * A call is attempted up to {@value #MAX_ATTEMPTS} times with a fixed
 * {@code 2s} pause between attempts. Every attempt rebuilds the augmented
 * context from the latest user message, so a retry sees the freshest project
 * state. The pause is a cancellation point: cancelling the turn while waiting
 * aborts with {@link CancellationException}.
 */
@Slf4j
public class AiInteractionGateway {

    public static final int MAX_ATTEMPTS = 3;
    public static final Duration RETRY_BACKOFF = Duration.ofSeconds(2);

    private final LlmPort llmPort;
    private final ContextBuilderPort contextBuilder;
    private final RuntimeEventService runtimeEventService;
    private final Clock clock;
    private final Sleeper sleeper;
    private final String model;
    private final double temperature;
    private final Duration requestTimeout;

    /**
     * Waits between attempts. Implementations must return early with
     * {@link CancellationException} when the token is cancelled.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration, CancellationToken cancellation) throws InterruptedException;
    }

    public AiInteractionGateway(LlmPort llmPort, ContextBuilderPort contextBuilder,
            RuntimeEventService runtimeEventService, Clock clock, Sleeper sleeper,
            String model, double temperature, Duration requestTimeout) {
        this.llmPort = llmPort;
        this.contextBuilder = contextBuilder;
        this.runtimeEventService = runtimeEventService;
        this.clock = clock;
        this.sleeper = sleeper;
        this.model = model;
        this.temperature = temperature;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Sends the transcript, retrying failed calls.
     *
     * @param transcript
     *            messages to send, oldest first
     * @param tools
     *            tools the model may call for this exchange (empty for none)
     * @param systemPrompt
     *            role instruction, may be null
     * @param context
     *            turn context (mode, project root, explicit context,
     *            cancellation)
     * @return the first successful response
     * @throws LlmCallException
     *             when all attempts failed
     * @throws CancellationException
     *             when the turn was cancelled
     */
    public LlmResponse sendWithRetry(List<Message> transcript, List<ToolDefinition> tools, String systemPrompt,
            TurnContext context) {
        CancellationToken cancellation = context.getCancellation();
        Exception lastError = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            cancellation.throwIfCancelled();
            LlmRequest request = buildRequest(transcript, tools, systemPrompt, context);
            Instant start = clock.instant();
            try {
                LlmResponse response = call(request);
                log.debug("[LLM] Response in {}ms (attempt {}/{}), tool calls: {}",
                        Duration.between(start, clock.instant()).toMillis(), attempt, MAX_ATTEMPTS,
                        response.hasToolCalls() ? response.getToolCalls().size() : 0);
                return response;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted while waiting for the model");
            } catch (Exception e) { // NOSONAR - any backend failure is retried
                lastError = e;
                if (attempt == MAX_ATTEMPTS) {
                    break;
                }
                log.warn("[LLM] Attempt {}/{} failed: {}, retrying in {}s", attempt, MAX_ATTEMPTS,
                        ToolCallExecutionService.safeCauseMessage(e), RETRY_BACKOFF.toSeconds());
                runtimeEventService.emit(context, RuntimeEventType.LLM_RETRY, Map.of(
                        "attempt", attempt,
                        "error", ToolCallExecutionService.safeCauseMessage(e)));
                backoff(cancellation);
            }
        }
        String reason = ToolCallExecutionService.safeCauseMessage(lastError);
        log.error("[LLM] All {} attempts failed: {}", MAX_ATTEMPTS, reason);
        throw new LlmCallException("LLM call failed after " + MAX_ATTEMPTS + " attempts: " + reason, MAX_ATTEMPTS,
                lastError);
    }

    private LlmResponse call(LlmRequest request) throws Exception {
        CompletableFuture<LlmResponse> future = llmPort.chat(request);
        try {
            LlmResponse response = future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (response == null) {
                throw new IllegalStateException("LLM returned no response");
            }
            return response;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            throw cause instanceof Exception exception ? exception : e;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new IllegalStateException("LLM call timed out after " + requestTimeout.toSeconds() + "s", e);
        }
    }

    private void backoff(CancellationToken cancellation) {
        try {
            sleeper.sleep(RETRY_BACKOFF, cancellation);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted during retry backoff");
        }
        cancellation.throwIfCancelled();
    }

    private LlmRequest buildRequest(List<Message> transcript, List<ToolDefinition> tools, String systemPrompt,
            TurnContext context) {
        String augmentedContext = contextBuilder.buildContext(latestUserInput(transcript),
                context.getExplicitContext(), context.getProjectRoot());
        return LlmRequest.builder()
                .model(model)
                .systemPrompt(systemPrompt)
                .messages(new ArrayList<>(transcript))
                .tools(tools != null ? new ArrayList<>(tools) : new ArrayList<>())
                .context(augmentedContext)
                .mode(context.getMode())
                .projectRoot(context.getProjectRoot())
                .conversationId(context.getConversationId())
                .temperature(temperature)
                .build();
    }

    static String latestUserInput(List<Message> transcript) {
        for (int i = transcript.size() - 1; i >= 0; i--) {
            Message message = transcript.get(i);
            if (message.isUserMessage() && message.getContent() != null) {
                return message.getContent();
            }
        }
        return "";
    }

    /**
     * Sleeps in short slices so a cancel is noticed within one slice.
     */
    public static void cancellableSleep(Duration duration, CancellationToken cancellation)
            throws InterruptedException {
        long deadline = System.nanoTime() + duration.toNanos();
        long slice = TimeUnit.MILLISECONDS.toNanos(50);
        while (true) {
            cancellation.throwIfCancelled();
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return;
            }
            TimeUnit.NANOSECONDS.sleep(Math.min(slice, remaining));
        }
    }
}
