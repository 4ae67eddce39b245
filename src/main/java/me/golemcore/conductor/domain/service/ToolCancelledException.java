package me.golemcore.conductor.domain.service;

/**
 * A supervised tool invocation was cancelled from outside.
 */
public class ToolCancelledException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public ToolCancelledException(String toolName) {
        super("Tool '" + toolName + "' was cancelled");
    }
}
