package me.golemcore.conductor.domain.system.toolloop;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.domain.model.LlmResponse;
import me.golemcore.conductor.domain.model.Message;
import me.golemcore.conductor.domain.model.ToolExecutionStatus;
import me.golemcore.conductor.domain.model.TurnContext;
import me.golemcore.conductor.domain.service.AiInteractionGateway;
import me.golemcore.conductor.domain.service.ConversationHistoryService;
import me.golemcore.conductor.domain.service.ToolCallExecutionResult;
import me.golemcore.conductor.domain.service.ToolCallExecutionService;
import me.golemcore.conductor.domain.service.ToolResultMessageFactory;
import me.golemcore.conductor.port.outbound.ConversationLogPort;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs the bounded "execute tool calls, record results, ask again" cycle shared
 * by the single-pass tool loop and the looping orchestration phases.
 *
 * <p>
 * Every mutation of the transcript goes through
 * {@link ConversationHistoryService}: the assistant message announcing the
 * calls, executing snapshots pushed by tool progress, and the terminal tool
 * messages.
 */
@Slf4j
public class ToolIterationRunner {

    private static final String CANCELLED_BY_USER = "Cancelled by user";

    private final AiInteractionGateway gateway;
    private final ToolCallExecutionService executionService;
    private final ConversationHistoryService history;
    private final ToolResultMessageFactory messageFactory;
    private final ConversationLogPort conversationLog;
    private final Clock clock;

    public ToolIterationRunner(AiInteractionGateway gateway, ToolCallExecutionService executionService,
            ConversationHistoryService history, ToolResultMessageFactory messageFactory,
            ConversationLogPort conversationLog, Clock clock) {
        this.gateway = gateway;
        this.executionService = executionService;
        this.history = history;
        this.messageFactory = messageFactory;
        this.conversationLog = conversationLog;
        this.clock = clock;
    }

    /**
     * Result of a bounded run.
     *
     * @param lastResponse
     *            latest model response; still has tool calls when the cap was hit
     * @param iterations
     *            tool batches executed
     * @param llmCalls
     *            model exchanges made by the run
     * @param toolExecutions
     *            tool results recorded
     * @param capReached
     *            whether the run stopped with tool calls still pending
     */
    public record LoopOutcome(LlmResponse lastResponse, int iterations, int llmCalls, int toolExecutions,
            boolean capReached) {
    }

    /**
     * While the latest response has tool calls and fewer than
     * {@code maxIterations} batches ran: record and execute the batch, then send
     * the updated transcript.
     */
    public LoopOutcome run(TurnContext context, LlmResponse initial, String systemPrompt, int maxIterations) {
        LlmResponse current = initial;
        int iterations = 0;
        int llmCalls = 0;
        int toolExecutions = 0;
        while (current.hasToolCalls() && iterations < maxIterations) {
            context.getCancellation().throwIfCancelled();
            iterations++;
            List<ToolCallExecutionResult> results = executeToolCalls(context, current);
            toolExecutions += results.size();
            log.debug("[ToolLoop] Iteration {}/{}: {} tool result(s)", iterations, maxIterations, results.size());

            current = gateway.sendWithRetry(history.getMessages(), context.toolDefinitions(), systemPrompt,
                    context);
            llmCalls++;
        }
        boolean capReached = current.hasToolCalls();
        if (capReached) {
            log.warn("[ToolLoop] Reached max iterations ({}) with {} pending tool call(s)", maxIterations,
                    current.getToolCalls().size());
        }
        return new LoopOutcome(current, iterations, llmCalls, toolExecutions, capReached);
    }

    /**
     * Records the assistant message carrying the calls, marks calls the user
     * already cancelled, executes the batch and records every result.
     */
    public List<ToolCallExecutionResult> executeToolCalls(TurnContext context, LlmResponse response) {
        List<Message.ToolCall> toolCalls = response.getToolCalls();
        ReasoningParser.Split split = ReasoningParser.split(response.getContent());
        history.append(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(split.content())
                .reasoning(split.reasoning())
                .toolCalls(toolCalls)
                .timestamp(clock.instant())
                .build());
        logAssistantToolCalls(context, split.content(), toolCalls);

        markCancelledToolCalls(context, toolCalls);

        List<ToolCallExecutionResult> results = executionService.executeBatch(toolCalls, context,
                this::recordProgress);
        for (ToolCallExecutionResult result : results) {
            history.upsertToolExecutionMessage(result.message());
        }
        return results;
    }

    /**
     * Appends the terminal assistant message of a turn or phase.
     */
    public void appendFinalAssistant(String rawText) {
        ReasoningParser.Split split = ReasoningParser.split(rawText);
        history.append(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(split.content())
                .reasoning(split.reasoning())
                .timestamp(clock.instant())
                .build());
    }

    private void recordProgress(Message message) {
        if (message.isToolMessage()) {
            history.upsertToolExecutionMessage(message);
        } else {
            history.append(message);
        }
    }

    private void markCancelledToolCalls(TurnContext context, List<Message.ToolCall> toolCalls) {
        for (Message.ToolCall toolCall : toolCalls) {
            if (context.getCancelledToolCallIds().contains(toolCall.getId())) {
                String targetFile = history.findToolMessage(toolCall.getId()).map(Message::getTargetFile).orElse(null);
                Message cancelled = messageFactory.failed(toolCall, targetFile, CANCELLED_BY_USER, null);
                history.updateMessageStatus(toolCall.getId(), ToolExecutionStatus.FAILED, cancelled.getContent());
            }
        }
    }

    private void logAssistantToolCalls(TurnContext context, String content, List<Message.ToolCall> toolCalls) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("content", content);
        data.put("toolCalls", toolCalls.stream()
                .map(call -> Map.of("id", call.getId(), "name", call.getName()))
                .toList());
        conversationLog.append(context.getProjectRoot(), context.getConversationId(), "chat.assistant_tool_calls",
                data);
    }
}
