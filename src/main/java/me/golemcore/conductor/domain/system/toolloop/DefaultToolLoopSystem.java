package me.golemcore.conductor.domain.system.toolloop;

import me.golemcore.conductor.domain.model.AgentMode;
import me.golemcore.conductor.domain.model.LlmResponse;
import me.golemcore.conductor.domain.model.ToolDefinition;
import me.golemcore.conductor.domain.model.TurnContext;
import me.golemcore.conductor.domain.service.AiInteractionGateway;
import me.golemcore.conductor.domain.service.ConversationFoldingService;
import me.golemcore.conductor.domain.service.ConversationHistoryService;
import me.golemcore.conductor.infrastructure.config.ConductorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Tool loop orchestrator (single-turn internal loop).
 *
 * <p>
 * One call of {@link #processTurn}: 1) fold an oversized transcript, 2) send
 * the transcript, 3) execute returned tool calls and re-send until the model
 * stops calling tools or the mode's iteration cap is hit, 4) apply reasoning
 * corrections, 5) record the terminal assistant message.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    static final String AGENT_SYSTEM_PROMPT = "You are a coding agent working inside the user's project. "
            + "Use the available tools to inspect and change files and to run commands. Start every response "
            + "with an <ide_reasoning> block (Analyze:, Research:, Plan:, Reflect:), then act.";

    static final String CHAT_SYSTEM_PROMPT = "You are a coding assistant answering questions about the user's "
            + "project. Use read-only tools when you need to look something up. Start every response with an "
            + "<ide_reasoning> block (Analyze:, Research:, Plan:, Reflect:), then answer.";

    private final AiInteractionGateway gateway;
    private final ToolIterationRunner runner;
    private final ReasoningCorrectionsHandler corrections;
    private final ConversationHistoryService history;
    private final ConversationFoldingService folding;
    private final ConductorProperties.ToolLoopProperties settings;

    public DefaultToolLoopSystem(AiInteractionGateway gateway, ToolIterationRunner runner,
            ReasoningCorrectionsHandler corrections, ConversationHistoryService history,
            ConversationFoldingService folding, ConductorProperties.ToolLoopProperties settings) {
        this.gateway = gateway;
        this.runner = runner;
        this.corrections = corrections;
        this.history = history;
        this.folding = folding;
        this.settings = settings;
    }

    @Override
    public ToolLoopTurnResult processTurn(TurnContext context) {
        if (folding != null) {
            folding.foldIfNeeded(history, context);
        }

        String systemPrompt = systemPromptFor(context.getMode());
        List<ToolDefinition> tools = context.toolDefinitions();
        int llmCalls = 0;

        LlmResponse response = gateway.sendWithRetry(history.getMessages(), tools, systemPrompt, context);
        llmCalls++;

        ReasoningCorrectionsHandler.Corrected initial = corrections.applyInitialCorrections(context, response,
                tools);
        response = initial.response();
        llmCalls += initial.extraCalls();

        int cap = maxIterations(context.getMode());
        ToolIterationRunner.LoopOutcome outcome = runner.run(context, response, systemPrompt, cap);
        llmCalls += outcome.llmCalls();
        response = outcome.lastResponse();

        ReasoningCorrectionsHandler.Corrected finalPass = corrections.applyFinalCorrections(context, response);
        response = finalPass.response();
        llmCalls += finalPass.extraCalls();

        String rawText = response.getContent();
        if (outcome.capReached() && (rawText == null || rawText.isBlank())) {
            rawText = "Tool loop stopped: reached max iterations (" + cap + ").";
        }
        runner.appendFinalAssistant(rawText);
        String finalText = ReasoningParser.split(rawText).content();

        log.info("[ToolLoop] Turn finished: mode={}, iterations={}, llmCalls={}, toolExecutions={}, capReached={}",
                context.getMode(), outcome.iterations(), llmCalls, outcome.toolExecutions(), outcome.capReached());
        return new ToolLoopTurnResult(finalText, outcome.iterations(), llmCalls, outcome.toolExecutions(),
                outcome.capReached());
    }

    int maxIterations(AgentMode mode) {
        if (mode == AgentMode.AGENT) {
            return settings != null ? settings.getAgentMaxIterations() : 12;
        }
        return settings != null ? settings.getChatMaxIterations() : 5;
    }

    private static String systemPromptFor(AgentMode mode) {
        return mode == AgentMode.AGENT ? AGENT_SYSTEM_PROMPT : CHAT_SYSTEM_PROMPT;
    }
}
