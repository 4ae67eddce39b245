package me.golemcore.conductor.domain.system.toolloop;

import me.golemcore.conductor.domain.model.AgentMode;
import me.golemcore.conductor.domain.model.LlmResponse;
import me.golemcore.conductor.domain.model.Message;
import me.golemcore.conductor.domain.model.ToolDefinition;
import me.golemcore.conductor.domain.model.TurnContext;
import me.golemcore.conductor.domain.service.AiInteractionGateway;
import me.golemcore.conductor.domain.service.ConversationHistoryService;
import me.golemcore.conductor.domain.service.LlmCallException;
import me.golemcore.conductor.port.outbound.ProjectStoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReasoningCorrectionsHandlerTest {

    private static final String GOOD_REASONING = "<ide_reasoning>\nAnalyze: the build fails on CI\n"
            + "Research: the Gradle cache is stale\nPlan: clear the cache step\nReflect: safe change\n"
            + "</ide_reasoning>\n";

    @Mock
    private AiInteractionGateway gateway;

    @Mock
    private ProjectStoragePort storage;

    private ConversationHistoryService history;
    private ReasoningCorrectionsHandler handler;
    private final List<ToolDefinition> tools = List.of(ToolDefinition.simple("write_file", "Write"));

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        history = new ConversationHistoryService(storage,
                Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC")), "id");
        history.append(Message.user("fix the CI build"));
        handler = new ReasoningCorrectionsHandler(gateway, history);
    }

    private static TurnContext context(AgentMode mode) {
        return TurnContext.builder().mode(mode).build();
    }

    @SuppressWarnings("unchecked")
    private List<Message> capturedTranscript() {
        ArgumentCaptor<List<Message>> captor = ArgumentCaptor.forClass(List.class);
        verify(gateway).sendWithRetry(captor.capture(), anyList(), any(), any());
        return captor.getValue();
    }

    // ==================== initial corrections ====================

    @Test
    void shouldForceToolFollowupInAgentMode() {
        LlmResponse followup = LlmResponse.builder()
                .toolCalls(List.of(Message.ToolCall.builder().id("c1").name("write_file").build()))
                .build();
        when(gateway.sendWithRetry(anyList(), eq(tools), isNull(), any())).thenReturn(followup);

        ReasoningCorrectionsHandler.Corrected corrected = handler.applyInitialCorrections(context(AgentMode.AGENT),
                LlmResponse.text("I will fix the pipeline."), tools);

        assertSame(followup, corrected.response());
        assertEquals(1, corrected.extraCalls());
        List<Message> transcript = capturedTranscript();
        assertEquals(3, transcript.size());
        assertEquals(ReasoningCorrectionsHandler.FORCE_TOOL_FOLLOWUP, transcript.get(1).getContent());
        assertEquals("fix the CI build", transcript.get(2).getContent());
    }

    @Test
    void shouldAskAgainWhenModelWantsUserInput() {
        when(gateway.sendWithRetry(anyList(), eq(tools), isNull(), any()))
                .thenReturn(LlmResponse.text("Proceeding with defaults."));

        ReasoningCorrectionsHandler.Corrected corrected = handler.applyInitialCorrections(context(AgentMode.AGENT),
                LlmResponse.text("Could you share the failing log?"), tools);

        assertEquals("Proceeding with defaults.", corrected.response().getContent());
        List<Message> transcript = capturedTranscript();
        assertEquals(ReasoningCorrectionsHandler.NO_USER_INPUT_NEXT_STEP,
                transcript.get(transcript.size() - 1).getContent());
    }

    @Test
    void shouldSkipInitialCorrectionsInChatMode() {
        LlmResponse response = LlmResponse.text("I will fix it.");

        ReasoningCorrectionsHandler.Corrected corrected = handler.applyInitialCorrections(context(AgentMode.CHAT),
                response, tools);

        assertSame(response, corrected.response());
        assertEquals(0, corrected.extraCalls());
        verify(gateway, never()).sendWithRetry(anyList(), anyList(), any(), any());
    }

    // ==================== final corrections ====================

    @Test
    void shouldRewriteResponseWithMissingSections() {
        LlmResponse draft = LlmResponse.text("<ide_reasoning>Plan: guess</ide_reasoning>Done.");
        when(gateway.sendWithRetry(anyList(), eq(List.of()), isNull(), any()))
                .thenReturn(LlmResponse.text(GOOD_REASONING + "Done properly."));

        ReasoningCorrectionsHandler.Corrected corrected = handler.applyFinalCorrections(context(AgentMode.CHAT),
                draft);

        assertTrue(corrected.response().getContent().endsWith("Done properly."));
        assertEquals(1, corrected.extraCalls());
        List<Message> transcript = capturedTranscript();
        assertTrue(transcript.get(transcript.size() - 2).isAssistantMessage());
        assertEquals(ReasoningCorrectionsHandler.REASONING_FORMAT,
                transcript.get(transcript.size() - 1).getContent());
    }

    @Test
    void shouldKeepDraftWhenCorrectionFails() {
        LlmResponse draft = LlmResponse.text("<ide_reasoning>Plan: guess</ide_reasoning>Done.");
        when(gateway.sendWithRetry(anyList(), anyList(), any(), any()))
                .thenThrow(new LlmCallException("LLM call failed after 3 attempts: 503", 3, null));

        ReasoningCorrectionsHandler.Corrected corrected = handler.applyFinalCorrections(context(AgentMode.CHAT),
                draft);

        assertSame(draft, corrected.response());
        assertEquals(2, corrected.extraCalls());
    }

    @Test
    void shouldKeepDraftWhenCorrectionIsBlank() {
        LlmResponse draft = LlmResponse.text("<ide_reasoning>Plan: guess</ide_reasoning>Done.");
        when(gateway.sendWithRetry(anyList(), anyList(), any(), any())).thenReturn(LlmResponse.text("  "));

        assertSame(draft, handler.applyFinalCorrections(context(AgentMode.CHAT), draft).response());
    }

    @Test
    void shouldLeaveGoodReasoningAlone() {
        LlmResponse good = LlmResponse.text(GOOD_REASONING + "All set.");

        ReasoningCorrectionsHandler.Corrected corrected = handler.applyFinalCorrections(context(AgentMode.AGENT),
                good);

        assertSame(good, corrected.response());
        assertEquals(0, corrected.extraCalls());
    }
}
