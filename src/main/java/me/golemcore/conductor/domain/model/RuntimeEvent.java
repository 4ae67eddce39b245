package me.golemcore.conductor.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Observable engine event (turn, tool, phase and compaction lifecycle).
 */
@Builder
public record RuntimeEvent(
        RuntimeEventType type,
        Instant timestamp,
        String conversationId,
        Map<String, Object> payload
) {
}
