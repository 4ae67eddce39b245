package me.golemcore.conductor.domain.service;

/**
 * A supervised tool invocation produced no progress within its liveness
 * timeout.
 */
public class ToolTimeoutException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final long timeoutSeconds;

    public ToolTimeoutException(String toolName, long timeoutSeconds) {
        super("Tool '" + toolName + "' timed out after " + timeoutSeconds + " seconds without progress");
        this.timeoutSeconds = timeoutSeconds;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
