package me.golemcore.conductor.domain.model;

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages.
 */
public enum ToolFailureKind {

    /**
     * The requested tool name did not resolve, neither directly nor through the
     * alias table.
     */
    NOT_FOUND,

    /**
     * Tool execution was denied by policy (e.g. command not allowlisted for the
     * current phase).
     */
    POLICY_DENIED,

    /**
     * Tool execution failed during runtime (the tool body threw).
     */
    EXECUTION_FAILED,

    /**
     * Tool returned successfully but with an empty-after-trim output.
     */
    EMPTY_RESPONSE,

    /**
     * No progress was observed within the configured liveness timeout.
     */
    TIMED_OUT,

    /**
     * The invocation was cancelled externally (e.g. by the user).
     */
    CANCELLED,

    /**
     * The same call (name and arguments) already ran in this batch.
     */
    DUPLICATE_SKIPPED
}
