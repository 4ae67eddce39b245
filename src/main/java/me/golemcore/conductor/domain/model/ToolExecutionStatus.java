package me.golemcore.conductor.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a single tool invocation as reported to the transcript.
 * {@link #EXECUTING} may be emitted many times for the same tool call before
 * exactly one terminal status.
 */
public enum ToolExecutionStatus {

    EXECUTING("executing"), COMPLETED("completed"), FAILED("failed");

    private final String wireName;

    ToolExecutionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this != EXECUTING;
    }

    @JsonCreator
    public static ToolExecutionStatus fromWireName(String value) {
        if (value == null) {
            return null;
        }
        return ToolExecutionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
