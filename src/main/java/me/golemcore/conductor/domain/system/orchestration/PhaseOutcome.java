package me.golemcore.conductor.domain.system.orchestration;

import me.golemcore.conductor.domain.model.OrchestrationPhase;

/**
 * What one orchestration phase did.
 *
 * @param phase
 *            the phase
 * @param llmCalls
 *            model exchanges made by the phase
 * @param toolIterations
 *            tool batches executed
 * @param toolExecutions
 *            tool results recorded
 * @param incomplete
 *            the phase hit its iteration cap with tool calls still pending
 */
public record PhaseOutcome(OrchestrationPhase phase, int llmCalls, int toolIterations, int toolExecutions,
        boolean incomplete) {
}
