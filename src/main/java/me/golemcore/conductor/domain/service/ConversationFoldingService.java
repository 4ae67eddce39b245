package me.golemcore.conductor.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.domain.model.Message;
import me.golemcore.conductor.domain.model.RuntimeEventType;
import me.golemcore.conductor.domain.model.TurnContext;
import me.golemcore.conductor.port.outbound.ConversationLogPort;
import me.golemcore.conductor.port.outbound.FoldArchivePort;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Keeps the transcript within size limits by folding its oldest part into one
 * auto-generated summary message. The raw folded messages are archived first
 * so nothing is lost.
 *
 * <p>
 * A fold happens when the message count or the total characters (content plus
 * reasoning) exceed the thresholds, and only when more messages exist than
 * the number preserved verbatim.
 */
@Slf4j
public class ConversationFoldingService {

    static final String SUMMARY_HEADER = "Context summary (auto-generated):";
    private static final int MAX_USER_TOPICS = 5;
    private static final int MAX_ASSISTANT_HIGHLIGHTS = 3;
    private static final int MAX_TOOL_LINES = 8;
    private static final int MAX_SNIPPET_CHARS = 200;

    private final FoldArchivePort archive;
    private final ConversationLogPort conversationLog;
    private final RuntimeEventService runtimeEventService;
    private final Clock clock;
    private final Thresholds thresholds;

    public record Thresholds(int maxMessageCount, int maxContentCharacters, int preserveMostRecentMessages) {
    }

    public record FoldResult(String archiveId, int foldedMessageCount, String summary) {
    }

    public ConversationFoldingService(FoldArchivePort archive, ConversationLogPort conversationLog,
            RuntimeEventService runtimeEventService, Clock clock, Thresholds thresholds) {
        this.archive = archive;
        this.conversationLog = conversationLog;
        this.runtimeEventService = runtimeEventService;
        this.clock = clock;
        this.thresholds = thresholds;
    }

    public static boolean shouldFold(List<Message> messages, Thresholds thresholds) {
        if (messages.size() > thresholds.maxMessageCount()) {
            return true;
        }
        long totalChars = 0;
        for (Message message : messages) {
            totalChars += length(message.getContent()) + length(message.getReasoning());
        }
        return totalChars > thresholds.maxContentCharacters();
    }

    /**
     * Folds the history in place when it exceeds the thresholds.
     *
     * @return the fold that was applied, or empty when none was needed
     */
    public Optional<FoldResult> foldIfNeeded(ConversationHistoryService history, TurnContext context) {
        List<Message> messages = history.getMessages();
        if (!shouldFold(messages, thresholds) || messages.size() <= thresholds.preserveMostRecentMessages()) {
            return Optional.empty();
        }
        int foldCount = toolBatchBoundary(messages, messages.size() - thresholds.preserveMostRecentMessages());
        List<Message> toFold = messages.subList(0, foldCount);
        String summary = summarize(toFold, clock.instant());

        String archiveId;
        try {
            archiveId = archive.archive(context.getProjectRoot(), context.getConversationId(), toFold, summary);
        } catch (RuntimeException e) {
            log.warn("[History] Fold skipped, archive failed: {}", e.getMessage());
            return Optional.empty();
        }
        history.replaceOldestMessages(foldCount, Message.system(summary));

        log.info("[History] Folded {} messages into summary (archive {})", foldCount, archiveId);
        conversationLog.append(context.getProjectRoot(), context.getConversationId(), "chat.context_folded", Map.of(
                "foldId", archiveId,
                "foldedMessageCount", foldCount,
                "summary", summary));
        runtimeEventService.emit(context, RuntimeEventType.COMPACTION_FINISHED, Map.of(
                "foldId", archiveId,
                "foldedMessageCount", foldCount));
        return Optional.of(new FoldResult(archiveId, foldCount, summary));
    }

    /**
     * Moves the fold boundary past tool results at the head of the kept tail,
     * so a kept tool result never loses its assistant tool-call message.
     */
    static int toolBatchBoundary(List<Message> messages, int foldCount) {
        int boundary = foldCount;
        while (boundary < messages.size() && messages.get(boundary).isToolMessage()) {
            boundary++;
        }
        return boundary;
    }

    static String summarize(List<Message> messages, Instant createdAt) {
        Instant start = messages.isEmpty() || messages.get(0).getTimestamp() == null
                ? createdAt
                : messages.get(0).getTimestamp();
        Instant end = messages.isEmpty() || messages.get(messages.size() - 1).getTimestamp() == null
                ? createdAt
                : messages.get(messages.size() - 1).getTimestamp();

        String userTopics = messages.stream()
                .filter(Message::isUserMessage)
                .map(message -> snippet(message.getContent()))
                .filter(text -> !text.isEmpty())
                .limit(MAX_USER_TOPICS)
                .collect(Collectors.joining(" | "));
        String assistantHighlights = messages.stream()
                .filter(Message::isAssistantMessage)
                .map(message -> snippet(message.getContent()))
                .filter(text -> !text.isEmpty())
                .limit(MAX_ASSISTANT_HIGHLIGHTS)
                .collect(Collectors.joining(" | "));
        String toolActivity = messages.stream()
                .filter(message -> message.isToolMessage() && message.getToolCallId() != null)
                .filter(message -> message.getContent() != null && !message.getContent().isBlank())
                .map(message -> "- " + Objects.requireNonNullElse(message.getToolName(), "unknown_tool")
                        + " (" + message.getToolCallId() + ") ["
                        + (message.getToolStatus() != null ? message.getToolStatus().getWireName() : "unknown") + "]")
                .limit(MAX_TOOL_LINES)
                .collect(Collectors.joining("\n"));

        return SUMMARY_HEADER + "\n"
                + "Folded " + messages.size() + " messages (" + start + " to " + end + ").\n\n"
                + "User requests/topics:\n" + orNone(userTopics) + "\n\n"
                + "Assistant responses (high level):\n" + orNone(assistantHighlights) + "\n\n"
                + "Tool activity (collapsed):\n" + orNone(toolActivity);
    }

    private static String snippet(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        return trimmed.length() > MAX_SNIPPET_CHARS ? trimmed.substring(0, MAX_SNIPPET_CHARS) + "…" : trimmed;
    }

    private static String orNone(String section) {
        return section.isEmpty() ? "(none)" : section;
    }

    private static int length(String value) {
        return value != null ? value.length() : 0;
    }
}
