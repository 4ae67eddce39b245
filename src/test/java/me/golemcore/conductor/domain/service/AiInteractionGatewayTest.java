package me.golemcore.conductor.domain.service;

import me.golemcore.conductor.domain.model.AgentMode;
import me.golemcore.conductor.domain.model.LlmRequest;
import me.golemcore.conductor.domain.model.LlmResponse;
import me.golemcore.conductor.domain.model.Message;
import me.golemcore.conductor.domain.model.RuntimeEvent;
import me.golemcore.conductor.domain.model.RuntimeEventType;
import me.golemcore.conductor.domain.model.ToolDefinition;
import me.golemcore.conductor.domain.model.TurnContext;
import me.golemcore.conductor.port.outbound.ContextBuilderPort;
import me.golemcore.conductor.port.outbound.LlmPort;
import me.golemcore.conductor.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AiInteractionGatewayTest {

    @Mock
    private LlmPort llmPort;

    @Mock
    private ContextBuilderPort contextBuilder;

    private MutableClock clock;
    private final List<Instant> callInstants = new ArrayList<>();
    private final List<Duration> sleeps = new ArrayList<>();
    private AiInteractionGateway gateway;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        clock = new MutableClock(Instant.parse("2026-02-14T00:00:00Z"));
        AiInteractionGateway.Sleeper fakeSleeper = (duration, cancellation) -> {
            sleeps.add(duration);
            clock.advance(duration);
        };
        gateway = new AiInteractionGateway(llmPort, contextBuilder, new RuntimeEventService(clock), clock,
                fakeSleeper, "gpt-test", 0.2, Duration.ofSeconds(5));
        when(contextBuilder.buildContext(anyString(), any(), any())).thenReturn("CTX");
    }

    private static TurnContext context() {
        return TurnContext.builder()
                .conversationId("conv-1")
                .projectRoot("/work/app")
                .mode(AgentMode.AGENT)
                .explicitContext("selected code")
                .build();
    }

    private CompletableFuture<LlmResponse> recordFailure(String message) {
        callInstants.add(clock.instant());
        return CompletableFuture.failedFuture(new IllegalStateException(message));
    }

    private CompletableFuture<LlmResponse> recordSuccess(LlmResponse response) {
        callInstants.add(clock.instant());
        return CompletableFuture.completedFuture(response);
    }

    @Test
    void shouldRetryTwiceThenSucceedWithBackoffBetweenCalls() {
        LlmResponse ok = LlmResponse.text("hello");
        when(llmPort.chat(any(LlmRequest.class)))
                .thenAnswer(invocation -> recordFailure("503"))
                .thenAnswer(invocation -> recordFailure("503 again"))
                .thenAnswer(invocation -> recordSuccess(ok));
        TurnContext context = context();

        LlmResponse response = gateway.sendWithRetry(List.of(Message.user("hi")), List.of(), null, context);

        assertSame(ok, response);
        verify(llmPort, times(3)).chat(any(LlmRequest.class));
        assertEquals(3, callInstants.size());
        for (int i = 1; i < callInstants.size(); i++) {
            Duration gap = Duration.between(callInstants.get(i - 1), callInstants.get(i));
            assertTrue(gap.compareTo(AiInteractionGateway.RETRY_BACKOFF) >= 0);
        }
        long retries = context.getRuntimeEvents().stream()
                .map(RuntimeEvent::type)
                .filter(RuntimeEventType.LLM_RETRY::equals)
                .count();
        assertEquals(2, retries);
    }

    @Test
    void shouldThrowAfterThirdFailureWithoutFourthCall() {
        when(llmPort.chat(any(LlmRequest.class))).thenAnswer(invocation -> recordFailure("rate limited"));

        LlmCallException exception = assertThrows(LlmCallException.class,
                () -> gateway.sendWithRetry(List.of(Message.user("hi")), List.of(), null, context()));

        assertEquals("LLM call failed after 3 attempts: rate limited", exception.getMessage());
        verify(llmPort, times(3)).chat(any(LlmRequest.class));
        assertEquals(List.of(Duration.ofSeconds(2), Duration.ofSeconds(2)), sleeps);
    }

    @Test
    void shouldNotSleepAfterFirstSuccess() {
        when(llmPort.chat(any(LlmRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(LlmResponse.text("ok")));

        gateway.sendWithRetry(List.of(Message.user("hi")), List.of(), null, context());

        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldBuildRequestFromTranscriptAndContext() {
        when(llmPort.chat(any(LlmRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(LlmResponse.text("ok")));
        List<Message> transcript = List.of(Message.user("first"), Message.user("fix the build"));
        List<ToolDefinition> tools = List.of(ToolDefinition.simple("read_file", "Read a file"));

        gateway.sendWithRetry(transcript, tools, "You are the planner", context());

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        LlmRequest request = captor.getValue();
        assertEquals("gpt-test", request.getModel());
        assertEquals("You are the planner", request.getSystemPrompt());
        assertEquals("CTX", request.getContext());
        assertEquals(2, request.getMessages().size());
        assertEquals(1, request.getTools().size());
        assertEquals(AgentMode.AGENT, request.getMode());
        verify(contextBuilder).buildContext(eq("fix the build"), eq("selected code"), eq("/work/app"));
    }

    @Test
    void shouldTreatNullResponseAsFailure() {
        when(llmPort.chat(any(LlmRequest.class)))
                .thenReturn(CompletableFuture.completedFuture(null))
                .thenReturn(CompletableFuture.completedFuture(LlmResponse.text("ok")));

        LlmResponse response = gateway.sendWithRetry(List.of(Message.user("hi")), List.of(), null, context());

        assertEquals("ok", response.getContent());
        verify(llmPort, times(2)).chat(any(LlmRequest.class));
    }

    @Test
    void shouldStopImmediatelyWhenAlreadyCancelled() {
        TurnContext context = context();
        context.getCancellation().cancel("user stop");

        assertThrows(CancellationException.class,
                () -> gateway.sendWithRetry(List.of(Message.user("hi")), List.of(), null, context));

        verify(llmPort, never()).chat(any(LlmRequest.class));
    }

    @Test
    void shouldAbortBackoffWhenCancelledDuringWait() {
        AiInteractionGateway realSleepGateway = new AiInteractionGateway(llmPort, contextBuilder,
                new RuntimeEventService(clock), clock, AiInteractionGateway::cancellableSleep, "gpt-test", 0.2,
                Duration.ofSeconds(5));
        TurnContext context = context();
        when(llmPort.chat(any(LlmRequest.class))).thenAnswer(invocation -> {
            context.getCancellation().cancel("user stop");
            return recordFailure("503");
        });

        assertThrows(CancellationException.class,
                () -> realSleepGateway.sendWithRetry(List.of(Message.user("hi")), List.of(), null, context));

        verify(llmPort, times(1)).chat(any(LlmRequest.class));
    }

    @Test
    void shouldPickLatestUserMessage() {
        List<Message> transcript = List.of(
                Message.user("old"),
                Message.builder().role(Message.ROLE_ASSISTANT).content("answer").build(),
                Message.user("new"),
                Message.builder().role(Message.ROLE_TOOL).content("{}").build());

        assertEquals("new", AiInteractionGateway.latestUserInput(transcript));
        assertEquals("", AiInteractionGateway.latestUserInput(List.of()));
    }
}
