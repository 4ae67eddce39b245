package me.golemcore.conductor.domain.service;

/**
 * A tool finished without throwing but returned nothing usable.
 */
public class ToolExecutionCrashException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public static final String EMPTY_RESPONSE_MESSAGE = "Tool returned an empty response. Treat this as a crash.";

    public ToolExecutionCrashException(String message) {
        super(message);
    }

    public static ToolExecutionCrashException emptyResponse() {
        return new ToolExecutionCrashException(EMPTY_RESPONSE_MESSAGE);
    }
}
