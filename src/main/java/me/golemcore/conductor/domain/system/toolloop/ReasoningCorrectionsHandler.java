package me.golemcore.conductor.domain.system.toolloop;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.domain.model.AgentMode;
import me.golemcore.conductor.domain.model.LlmResponse;
import me.golemcore.conductor.domain.model.Message;
import me.golemcore.conductor.domain.model.ToolDefinition;
import me.golemcore.conductor.domain.model.TurnContext;
import me.golemcore.conductor.domain.service.AiInteractionGateway;
import me.golemcore.conductor.domain.service.ConversationHistoryService;
import me.golemcore.conductor.domain.service.LlmCallException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Corrective re-asks applied around the tool loop. Each correction costs
 * exactly one extra exchange and its prompt is transient: it is sent to the
 * model but never recorded in the transcript.
 */
@Slf4j
public class ReasoningCorrectionsHandler {

    static final String FORCE_TOOL_FOLLOWUP = "You indicated you will implement changes, but you returned no "
            + "tool calls. In Agent mode, you MUST now proceed by calling the appropriate tools. "
            + "Return tool calls now.";

    static final String NO_USER_INPUT_NEXT_STEP = "In Agent mode, do not ask the user for additional inputs "
            + "(diffs, files, confirmations) as a next step. Proceed autonomously using the available tools and "
            + "make reasonable assumptions. If multiple options exist, pick the safest default and continue. "
            + "Return tool calls now if needed.";

    static final String REASONING_FORMAT = "Your reasoning block is missing required sections. Rewrite your "
            + "previous response: start with an <ide_reasoning> block containing Analyze:, Research:, Plan: and "
            + "Reflect: sections, then give the answer. Do not call tools.";

    static final String REASONING_QUALITY = "Your reasoning block contains placeholders or too little concrete "
            + "content. Rewrite your previous response with concrete content in at least two of the Analyze, "
            + "Research, Plan and Reflect sections, then give the answer. Do not call tools.";

    private final AiInteractionGateway gateway;
    private final ConversationHistoryService history;

    public ReasoningCorrectionsHandler(AiInteractionGateway gateway, ConversationHistoryService history) {
        this.gateway = gateway;
        this.history = history;
    }

    /** Response after corrections plus the number of extra exchanges made. */
    public record Corrected(LlmResponse response, int extraCalls) {
    }

    /**
     * Agent mode only, for a first response without tool calls: forces a tool
     * follow-up when the model merely announced work, then re-asks once more
     * when it asked the user for input instead of proceeding.
     */
    public Corrected applyInitialCorrections(TurnContext context, LlmResponse response, List<ToolDefinition> tools) {
        if (context.getMode() != AgentMode.AGENT) {
            return new Corrected(response, 0);
        }
        LlmResponse current = response;
        int extraCalls = 0;

        if (!current.hasToolCalls() && ReasoningParser.shouldForceToolFollowup(current.getContent())) {
            log.info("[ToolLoop] Response announced work without tool calls, forcing follow-up");
            List<Message> transcript = new ArrayList<>(history.getMessages());
            transcript.add(Message.system(FORCE_TOOL_FOLLOWUP));
            latestUserMessage(transcript).ifPresent(transcript::add);
            current = gateway.sendWithRetry(transcript, tools, null, context);
            extraCalls++;
        }

        if (!current.hasToolCalls() && ReasoningParser.isRequestingUserInput(current.getContent())) {
            log.info("[ToolLoop] Response asked the user for input, re-asking to proceed autonomously");
            List<Message> transcript = new ArrayList<>(history.getMessages());
            transcript.add(Message.system(NO_USER_INPUT_NEXT_STEP));
            current = gateway.sendWithRetry(transcript, tools, null, context);
            extraCalls++;
        }
        return new Corrected(current, extraCalls);
    }

    /**
     * Format pass, then quality pass, over the final response. A failed
     * correction exchange keeps the uncorrected response.
     */
    public Corrected applyFinalCorrections(TurnContext context, LlmResponse response) {
        LlmResponse current = response;
        int extraCalls = 0;
        if (ReasoningParser.needsReasoningFormatCorrection(current.getContent())) {
            current = reask(context, current, REASONING_FORMAT);
            extraCalls++;
        }
        if (ReasoningParser.isLowQualityReasoning(current.getContent())) {
            current = reask(context, current, REASONING_QUALITY);
            extraCalls++;
        }
        return new Corrected(current, extraCalls);
    }

    private LlmResponse reask(TurnContext context, LlmResponse draft, String instruction) {
        List<Message> transcript = new ArrayList<>(history.getMessages());
        transcript.add(Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(draft.getContent())
                .build());
        transcript.add(Message.system(instruction));
        try {
            LlmResponse corrected = gateway.sendWithRetry(transcript, List.of(), null, context);
            if (corrected.getContent() == null || corrected.getContent().isBlank()) {
                log.warn("[ToolLoop] Correction returned empty content, keeping previous response");
                return draft;
            }
            return corrected;
        } catch (LlmCallException e) {
            log.warn("[ToolLoop] Correction exchange failed, keeping previous response: {}", e.getMessage());
            return draft;
        }
    }

    private static Optional<Message> latestUserMessage(List<Message> transcript) {
        for (int i = transcript.size() - 1; i >= 0; i--) {
            if (transcript.get(i).isUserMessage()) {
                return Optional.of(transcript.get(i));
            }
        }
        return Optional.empty();
    }
}
