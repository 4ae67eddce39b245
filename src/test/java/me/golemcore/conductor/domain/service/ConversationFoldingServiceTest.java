package me.golemcore.conductor.domain.service;

import me.golemcore.conductor.domain.model.Message;
import me.golemcore.conductor.domain.model.RuntimeEvent;
import me.golemcore.conductor.domain.model.RuntimeEventType;
import me.golemcore.conductor.domain.model.ToolExecutionStatus;
import me.golemcore.conductor.domain.model.TurnContext;
import me.golemcore.conductor.port.outbound.ConversationLogPort;
import me.golemcore.conductor.port.outbound.FoldArchivePort;
import me.golemcore.conductor.port.outbound.ProjectStoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConversationFoldingServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");

    private FoldArchivePort archive;
    private ConversationLogPort conversationLog;
    private ConversationHistoryService history;
    private TurnContext context;
    private ConversationFoldingService folding;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneId.of("UTC"));
        archive = mock(FoldArchivePort.class);
        conversationLog = mock(ConversationLogPort.class);
        history = new ConversationHistoryService(mock(ProjectStoragePort.class), clock, "id");
        context = TurnContext.builder().conversationId("conv-1").projectRoot("/work/app").build();
        folding = new ConversationFoldingService(archive, conversationLog, new RuntimeEventService(clock), clock,
                new ConversationFoldingService.Thresholds(6, 10_000, 2));
    }

    private void fill(int count) {
        for (int i = 0; i < count; i++) {
            history.append(i % 2 == 0 ? Message.user("question " + i)
                    : Message.builder().role(Message.ROLE_ASSISTANT).content("answer " + i).build());
        }
    }

    @Test
    void shouldFoldOnMessageCount() {
        assertFalse(ConversationFoldingService.shouldFold(List.of(Message.user("a")),
                new ConversationFoldingService.Thresholds(1, 100, 0)));
        assertTrue(ConversationFoldingService.shouldFold(List.of(Message.user("a"), Message.user("b")),
                new ConversationFoldingService.Thresholds(1, 100, 0)));
    }

    @Test
    void shouldFoldOnTotalCharacters() {
        List<Message> big = List.of(Message.user("x".repeat(60)),
                Message.builder().role(Message.ROLE_ASSISTANT).content("y").reasoning("z".repeat(50)).build());

        assertTrue(ConversationFoldingService.shouldFold(big, new ConversationFoldingService.Thresholds(100, 100, 0)));
    }

    @Test
    void shouldReplaceOldMessagesWithSummaryAndKeepRecentOnes() {
        when(archive.archive(eq("/work/app"), eq("conv-1"), anyList(), anyString())).thenReturn("fold-1");
        fill(8);

        Optional<ConversationFoldingService.FoldResult> result = folding.foldIfNeeded(history, context);

        assertTrue(result.isPresent());
        assertEquals("fold-1", result.get().archiveId());
        assertEquals(6, result.get().foldedMessageCount());
        List<Message> messages = history.getMessages();
        assertEquals(3, messages.size());
        assertTrue(messages.get(0).isSystemMessage());
        assertTrue(messages.get(0).getContent().startsWith("Context summary (auto-generated):"));
        assertEquals("question 6", messages.get(1).getContent());
        assertEquals("answer 7", messages.get(2).getContent());
        assertTrue(context.getRuntimeEvents().stream()
                .map(RuntimeEvent::type)
                .anyMatch(RuntimeEventType.COMPACTION_FINISHED::equals));
        verify(conversationLog).append(eq("/work/app"), eq("conv-1"), eq("chat.context_folded"), any());
    }

    @Test
    void shouldFoldToolResultsTogetherWithTheirToolCall() {
        when(archive.archive(any(), any(), anyList(), any())).thenReturn("fold-2");
        fill(5);
        history.append(Message.builder().role(Message.ROLE_ASSISTANT).toolCalls(List.of(
                Message.ToolCall.builder().id("call_1").name("read_file").build(),
                Message.ToolCall.builder().id("call_2").name("list_files").build())).build());
        history.append(toolResult("call_1", "read_file"));
        history.append(toolResult("call_2", "list_files"));
        history.append(Message.builder().role(Message.ROLE_ASSISTANT).content("done").build());

        Optional<ConversationFoldingService.FoldResult> result = folding.foldIfNeeded(history, context);

        assertTrue(result.isPresent());
        assertEquals(8, result.get().foldedMessageCount());
        List<Message> messages = history.getMessages();
        assertEquals(2, messages.size());
        assertTrue(messages.get(0).isSystemMessage());
        assertEquals("done", messages.get(1).getContent());
    }

    @Test
    void shouldMoveBoundaryPastLeadingToolResults() {
        List<Message> messages = List.of(Message.user("a"), toolResult("call_1", "read_file"), Message.user("b"));

        assertEquals(2, ConversationFoldingService.toolBatchBoundary(messages, 2));
        assertEquals(2, ConversationFoldingService.toolBatchBoundary(messages, 1));
        assertEquals(3, ConversationFoldingService.toolBatchBoundary(List.of(Message.user("a"),
                toolResult("call_1", "read_file"), toolResult("call_2", "read_file")), 1));
    }

    private static Message toolResult(String toolCallId, String toolName) {
        return Message.builder()
                .role(Message.ROLE_TOOL)
                .toolCallId(toolCallId)
                .toolName(toolName)
                .toolStatus(ToolExecutionStatus.COMPLETED)
                .content("ok")
                .build();
    }

    @Test
    void shouldDoNothingBelowThresholds() {
        fill(4);

        assertTrue(folding.foldIfNeeded(history, context).isEmpty());
        assertEquals(4, history.size());
        verify(archive, never()).archive(any(), any(), anyList(), any());
    }

    @Test
    void shouldLeaveHistoryIntactWhenArchiveFails() {
        when(archive.archive(any(), any(), anyList(), any())).thenThrow(new IllegalStateException("disk full"));
        fill(8);

        assertTrue(folding.foldIfNeeded(history, context).isEmpty());
        assertEquals(8, history.size());
    }

    @Test
    void shouldSummarizeSectionsAndCollapseTools() {
        List<Message> messages = List.of(
                Message.user("fix the login bug"),
                Message.builder().role(Message.ROLE_ASSISTANT).content("Looking at AuthService").build(),
                Message.builder().role(Message.ROLE_TOOL).toolCallId("call_1").toolName("read_file")
                        .toolStatus(ToolExecutionStatus.COMPLETED).content("{}").build());

        String summary = ConversationFoldingService.summarize(messages, NOW);

        assertTrue(summary.startsWith("Context summary (auto-generated):\nFolded 3 messages"));
        assertTrue(summary.contains("User requests/topics:\nfix the login bug"));
        assertTrue(summary.contains("Assistant responses (high level):\nLooking at AuthService"));
        assertTrue(summary.contains("Tool activity (collapsed):\n- read_file (call_1) [completed]"));
    }

    @Test
    void shouldMarkEmptySectionsAsNone() {
        String summary = ConversationFoldingService.summarize(List.of(Message.user("only question")), NOW);

        assertTrue(summary.contains("Assistant responses (high level):\n(none)"));
        assertTrue(summary.endsWith("Tool activity (collapsed):\n(none)"));
    }
}
