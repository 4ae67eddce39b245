package me.golemcore.conductor.domain.model;

import java.util.List;

/**
 * Outcome of one conversation turn. A failed turn carries the error text
 * instead of throwing, so a backend outage never escapes as a crash.
 *
 * @param conversationId
 *            conversation the turn belongs to
 * @param finalText
 *            visible text of the terminal assistant message, empty on failure
 * @param error
 *            failure description, null on success
 * @param incompletePhases
 *            orchestration phases that stopped at their cap (empty for the
 *            single-pass loop)
 * @param events
 *            runtime events emitted while the turn ran
 */
public record TurnResult(String conversationId, String finalText, String error,
        List<OrchestrationPhase> incompletePhases, List<RuntimeEvent> events) {

    public TurnResult {
        incompletePhases = incompletePhases != null ? List.copyOf(incompletePhases) : List.of();
        events = events != null ? List.copyOf(events) : List.of();
    }

    public boolean isSuccess() {
        return error == null;
    }
}
