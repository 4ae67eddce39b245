package me.golemcore.conductor.port.outbound;

/**
 * Builds the augmented context sent alongside the transcript. Must be a pure
 * query: no side effects, safe to call once per retry attempt.
 */
public interface ContextBuilderPort {

    /**
     * @param userInput
     *            latest user message text (may be empty)
     * @param explicitContext
     *            context the caller attached explicitly (may be null)
     * @param projectRoot
     *            project root the turn operates on (may be null)
     * @return augmented context, or {@code null} when there is nothing to add
     */
    String buildContext(String userInput, String explicitContext, String projectRoot);
}
