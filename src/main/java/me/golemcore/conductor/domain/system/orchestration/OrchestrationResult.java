package me.golemcore.conductor.domain.system.orchestration;

import me.golemcore.conductor.domain.model.LlmResponse;
import me.golemcore.conductor.domain.model.OrchestrationPhase;

import java.util.List;

/**
 * Result of a full orchestrated run: the Finalizer's response plus the
 * outcome of every phase in execution order.
 */
public record OrchestrationResult(LlmResponse finalResponse, String finalText, List<PhaseOutcome> phases) {

    public OrchestrationResult {
        phases = List.copyOf(phases);
    }

    public List<OrchestrationPhase> incompletePhases() {
        return phases.stream()
                .filter(PhaseOutcome::incomplete)
                .map(PhaseOutcome::phase)
                .toList();
    }

    public int totalLlmCalls() {
        return phases.stream().mapToInt(PhaseOutcome::llmCalls).sum();
    }
}
