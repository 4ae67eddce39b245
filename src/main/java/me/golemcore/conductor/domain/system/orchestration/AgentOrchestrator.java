package me.golemcore.conductor.domain.system.orchestration;

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
import me.golemcore.conductor.domain.component.ToolComponent;
import me.golemcore.conductor.domain.model.LlmResponse;
import me.golemcore.conductor.domain.model.OrchestrationPhase;
import me.golemcore.conductor.domain.model.RuntimeEventType;
import me.golemcore.conductor.domain.model.TurnContext;
import me.golemcore.conductor.domain.service.AiInteractionGateway;
import me.golemcore.conductor.domain.service.ConversationHistoryService;
import me.golemcore.conductor.domain.service.RuntimeEventService;
import me.golemcore.conductor.domain.system.toolloop.ReasoningParser;
import me.golemcore.conductor.domain.system.toolloop.ToolIterationRunner;
import me.golemcore.conductor.infrastructure.config.ConductorProperties;
import me.golemcore.conductor.port.outbound.ConversationLogPort;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Steps a turn through the fixed phase sequence Architect, Planner, Worker,
 * Reviewer, Verifier, Finalizer. Phases never repeat and are never skipped.
 *
 * <p>
 * Each phase sends the shared transcript with its role instruction as the
 * system prompt and the tool subset its {@link OrchestrationPhase.ToolPolicy}
 * selects. A looping phase that hits its cap with tool calls still pending does
 * not fail the run: the orchestrator records a {@code PHASE_INCOMPLETE} event
 * and moves on.
 */
@Slf4j
public class AgentOrchestrator {

    static final String RUN_COMMAND_TOOL = "run_command";

    private final AiInteractionGateway gateway;
    private final ToolIterationRunner runner;
    private final ConversationHistoryService history;
    private final RuntimeEventService runtimeEventService;
    private final ConversationLogPort conversationLog;
    private final ConductorProperties.OrchestrationProperties settings;

    public AgentOrchestrator(AiInteractionGateway gateway, ToolIterationRunner runner,
            ConversationHistoryService history, RuntimeEventService runtimeEventService,
            ConversationLogPort conversationLog, ConductorProperties.OrchestrationProperties settings) {
        this.gateway = gateway;
        this.runner = runner;
        this.history = history;
        this.runtimeEventService = runtimeEventService;
        this.conversationLog = conversationLog;
        this.settings = settings;
    }

    public OrchestrationResult run(TurnContext context) {
        List<PhaseOutcome> outcomes = new ArrayList<>();
        LlmResponse finalResponse = null;
        for (OrchestrationPhase phase : OrchestrationPhase.values()) {
            context.getCancellation().throwIfCancelled();
            phaseStarted(context, phase);
            TurnContext phaseContext = context.toBuilder()
                    .availableTools(toolsFor(phase, context.getAvailableTools()))
                    .build();

            PhaseRun run;
            if (phase.isLooping()) {
                run = loop(phaseContext, phase, maxIterations(phase));
            } else if (phase.getToolPolicy() == OrchestrationPhase.ToolPolicy.SINGLE_TOOL) {
                run = executeOnce(phaseContext, phase);
            } else {
                run = singleExchange(phaseContext, phase);
            }
            outcomes.add(run.outcome());
            if (run.outcome().incomplete()) {
                phaseIncomplete(context, phase, maxIterations(phase), run.response());
            }
            finalResponse = run.response();
        }
        String finalText = finalResponse != null ? ReasoningParser.split(finalResponse.getContent()).content() : "";
        log.info("[Orchestrator] Run finished: {} phase(s), incomplete={}", outcomes.size(),
                outcomes.stream().filter(PhaseOutcome::incomplete).map(PhaseOutcome::phase).toList());
        return new OrchestrationResult(finalResponse, finalText, outcomes);
    }

    /**
     * Tools the phase may call. The Verifier keeps every tool but sees the
     * command tool only through the prefix allowlist.
     */
    List<ToolComponent> toolsFor(OrchestrationPhase phase, List<ToolComponent> allTools) {
        return switch (phase.getToolPolicy()) {
        case NONE -> List.of();
        case SINGLE_TOOL -> allTools.stream()
                .filter(tool -> phase.getToolName().equals(tool.getToolName()))
                .toList();
        case ALL -> List.copyOf(allTools);
        case COMMAND_ALLOWLIST -> allTools.stream()
                .map(tool -> phase.getToolName().equals(tool.getToolName())
                        ? new AllowlistedRunCommandTool(tool, settings.getVerifyAllowedPrefixes())
                        : tool)
                .toList();
        };
    }

    int maxIterations(OrchestrationPhase phase) {
        int configured = switch (phase) {
        case WORKER -> settings.getMaxWorkerIterations();
        case REVIEWER -> settings.getMaxReviewIterations();
        case VERIFIER -> settings.getMaxVerifyIterations();
        case ARCHITECT, PLANNER, FINALIZER -> 1;
        };
        return Math.max(1, configured);
    }

    private record PhaseRun(LlmResponse response, PhaseOutcome outcome) {
    }

    private PhaseRun singleExchange(TurnContext phaseContext, OrchestrationPhase phase) {
        LlmResponse response = send(phaseContext, phase);
        appendIfPresent(response);
        return new PhaseRun(response, new PhaseOutcome(phase, 1, 0, 0, false));
    }

    // Planner: the plan is written through tool calls; they run once and the model is not asked again.
    private PhaseRun executeOnce(TurnContext phaseContext, OrchestrationPhase phase) {
        LlmResponse response = send(phaseContext, phase);
        int executions = 0;
        if (response.hasToolCalls()) {
            executions = runner.executeToolCalls(phaseContext, response).size();
        }
        return new PhaseRun(response, new PhaseOutcome(phase, 1, executions > 0 ? 1 : 0, executions, false));
    }

    private PhaseRun loop(TurnContext phaseContext, OrchestrationPhase phase, int maxIterations) {
        LlmResponse initial = send(phaseContext, phase);
        ToolIterationRunner.LoopOutcome outcome = runner.run(phaseContext, initial, phase.getInstruction(),
                maxIterations);
        if (!outcome.capReached()) {
            appendIfPresent(outcome.lastResponse());
        }
        return new PhaseRun(outcome.lastResponse(), new PhaseOutcome(phase, 1 + outcome.llmCalls(),
                outcome.iterations(), outcome.toolExecutions(), outcome.capReached()));
    }

    private LlmResponse send(TurnContext phaseContext, OrchestrationPhase phase) {
        return gateway.sendWithRetry(history.getMessages(), phaseContext.toolDefinitions(), phase.getInstruction(),
                phaseContext);
    }

    private void appendIfPresent(LlmResponse response) {
        if (response.getContent() != null && !response.getContent().isBlank()) {
            runner.appendFinalAssistant(response.getContent());
        }
    }

    private void phaseStarted(TurnContext context, OrchestrationPhase phase) {
        log.info("[Orchestrator] Phase {} started", phase);
        runtimeEventService.emit(context, RuntimeEventType.PHASE_STARTED, Map.of("phase", phase.name()));
        conversationLog.append(context.getProjectRoot(), context.getConversationId(), "orchestrator.phase_started",
                Map.of("phase", phase.name()));
    }

    private void phaseIncomplete(TurnContext context, OrchestrationPhase phase, int cap, LlmResponse response) {
        int pending = response.hasToolCalls() ? response.getToolCalls().size() : 0;
        log.warn("[Orchestrator] Phase {} reached its cap ({}) with {} pending tool call(s), continuing", phase, cap,
                pending);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("phase", phase.name());
        data.put("maxIterations", cap);
        data.put("pendingToolCalls", pending);
        runtimeEventService.emit(context, RuntimeEventType.PHASE_INCOMPLETE, data);
        conversationLog.append(context.getProjectRoot(), context.getConversationId(),
                "orchestrator.phase_incomplete", data);
    }
}
