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
import me.golemcore.conductor.domain.model.AgentMode;
import me.golemcore.conductor.domain.model.Message;
import me.golemcore.conductor.domain.model.RuntimeEventType;
import me.golemcore.conductor.domain.model.TurnContext;
import me.golemcore.conductor.domain.model.TurnResult;
import me.golemcore.conductor.domain.system.orchestration.AgentOrchestrator;
import me.golemcore.conductor.domain.system.orchestration.OrchestrationResult;
import me.golemcore.conductor.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.conductor.domain.system.toolloop.ToolLoopTurnResult;
import me.golemcore.conductor.port.outbound.ConversationLogPort;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * Entry point of a conversation turn: records the user message, then runs
 * either the agent orchestrator or the single-pass tool loop.
 *
 * <p>
 * The orchestrator handles agent-mode turns when orchestration is enabled;
 * every other turn goes through the tool loop. The two paths never run for
 * the same turn.
 */
@Slf4j
public class ConversationTurnService {

    private final ConversationHistoryService history;
    private final ToolLoopSystem toolLoopSystem;
    private final AgentOrchestrator orchestrator;
    private final RuntimeEventService runtimeEventService;
    private final ConversationLogPort conversationLog;
    private final Clock clock;
    private final boolean orchestrationEnabled;

    public ConversationTurnService(ConversationHistoryService history, ToolLoopSystem toolLoopSystem,
            AgentOrchestrator orchestrator, RuntimeEventService runtimeEventService,
            ConversationLogPort conversationLog, Clock clock, boolean orchestrationEnabled) {
        this.history = history;
        this.toolLoopSystem = toolLoopSystem;
        this.orchestrator = orchestrator;
        this.runtimeEventService = runtimeEventService;
        this.conversationLog = conversationLog;
        this.clock = clock;
        this.orchestrationEnabled = orchestrationEnabled;
    }

    /**
     * Runs one turn. Backend failures and cancellation end the turn with an
     * error result; blank input is rejected without touching the transcript.
     */
    public TurnResult submit(TurnContext context) {
        String userInput = context.getUserInput();
        if (userInput == null || userInput.isBlank()) {
            return new TurnResult(history.getConversationId(), "", "Empty user input", List.of(), List.of());
        }
        if (context.getConversationId() == null) {
            context.setConversationId(history.getConversationId());
        }
        if (context.getProjectRoot() == null) {
            context.setProjectRoot(history.getProjectRoot());
        }

        runtimeEventService.emit(context, RuntimeEventType.TURN_STARTED, Map.of("mode", context.getMode().name()));
        Map<String, Object> userData = new LinkedHashMap<>();
        userData.put("content", userInput);
        userData.put("mode", context.getMode().name());
        userData.put("hasSelectionContext", context.getExplicitContext() != null
                && !context.getExplicitContext().isEmpty());
        conversationLog.append(context.getProjectRoot(), context.getConversationId(), "chat.user_message",
                userData);

        history.append(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_USER)
                .content(userInput)
                .timestamp(clock.instant())
                .build());

        try {
            TurnResult result = useOrchestrator(context) ? orchestrate(context) : loop(context);
            runtimeEventService.emit(context, RuntimeEventType.TURN_FINISHED,
                    Map.of("mode", context.getMode().name()));
            return withEvents(result, context);
        } catch (LlmCallException | CancellationException e) {
            String error = "Failed to get AI response: " + e.getMessage();
            log.error("[Runtime] Turn failed: {}", e.getMessage());
            runtimeEventService.emit(context, RuntimeEventType.TURN_FAILED, Map.of("error", error));
            conversationLog.append(context.getProjectRoot(), context.getConversationId(), "chat.error",
                    Map.of("error", error));
            return new TurnResult(context.getConversationId(), "", error, List.of(),
                    List.copyOf(context.getRuntimeEvents()));
        }
    }

    boolean useOrchestrator(TurnContext context) {
        return orchestrationEnabled && orchestrator != null && context.getMode() == AgentMode.AGENT;
    }

    private TurnResult orchestrate(TurnContext context) {
        OrchestrationResult result = orchestrator.run(context);
        return new TurnResult(context.getConversationId(), result.finalText(), null, result.incompletePhases(),
                List.of());
    }

    private TurnResult loop(TurnContext context) {
        ToolLoopTurnResult result = toolLoopSystem.processTurn(context);
        return new TurnResult(context.getConversationId(), result.finalText(), null, List.of(), List.of());
    }

    private static TurnResult withEvents(TurnResult result, TurnContext context) {
        return new TurnResult(result.conversationId(), result.finalText(), result.error(), result.incompletePhases(),
                List.copyOf(context.getRuntimeEvents()));
    }
}
