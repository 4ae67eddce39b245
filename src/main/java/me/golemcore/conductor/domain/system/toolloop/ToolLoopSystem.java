package me.golemcore.conductor.domain.system.toolloop;

import me.golemcore.conductor.domain.model.TurnContext;

/**
 * Executes LLM -> tools -> LLM loop inside a single conversation turn.
 */
public interface ToolLoopSystem {

    ToolLoopTurnResult processTurn(TurnContext context);
}
