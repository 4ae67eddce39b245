package me.golemcore.conductor.domain.model;

/**
 * Kinds of runtime events emitted while a turn is processed.
 */
public enum RuntimeEventType {
    TURN_STARTED, TURN_FINISHED, TURN_FAILED, LLM_RETRY, TOOL_STARTED, TOOL_FINISHED, PHASE_STARTED, PHASE_INCOMPLETE,
    COMPACTION_FINISHED
}
