package me.golemcore.conductor.domain.system.toolloop;

/**
 * Outcome of one tool-loop turn.
 *
 * @param finalText
 *            visible text of the terminal assistant message (reasoning removed)
 * @param iterations
 *            tool batches executed
 * @param llmCalls
 *            model exchanges, corrections included
 * @param toolExecutions
 *            tool results recorded
 * @param capReached
 *            whether the loop stopped with tool calls still pending
 */
public record ToolLoopTurnResult(String finalText, int iterations, int llmCalls, int toolExecutions,
        boolean capReached) {
}
