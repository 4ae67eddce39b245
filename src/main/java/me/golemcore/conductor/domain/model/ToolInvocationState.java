package me.golemcore.conductor.domain.model;

import java.time.Instant;

/**
 * Snapshot of one supervised tool invocation. Instances are immutable; the
 * watchdog replaces the snapshot on progress, cancellation or pause.
 *
 * @param toolCallId
 *            tool-call id being supervised
 * @param toolName
 *            tool name
 * @param targetFile
 *            file the tool operates on, if any
 * @param startedAt
 *            when the invocation began
 * @param lastProgressAt
 *            last observed progress, initially {@code startedAt}
 * @param timeoutSeconds
 *            liveness timeout; the deadline is {@code lastProgressAt + timeoutSeconds}
 * @param cancelled
 *            whether an external cancel was requested
 */
public record ToolInvocationState(
        String toolCallId,
        String toolName,
        String targetFile,
        Instant startedAt,
        Instant lastProgressAt,
        long timeoutSeconds,
        boolean cancelled
) {

    public ToolInvocationState withProgress(Instant at) {
        return new ToolInvocationState(toolCallId, toolName, targetFile, startedAt, at, timeoutSeconds, cancelled);
    }

    public ToolInvocationState withCancelled() {
        return new ToolInvocationState(toolCallId, toolName, targetFile, startedAt, lastProgressAt, timeoutSeconds,
                true);
    }

    public Instant deadline() {
        return lastProgressAt.plusSeconds(timeoutSeconds);
    }
}
