package me.golemcore.conductor.domain.service;

/**
 * Raised by the interaction gateway when every attempt against the backend
 * failed. The cause is the error of the last attempt.
 */
public class LlmCallException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final int attempts;

    public LlmCallException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
