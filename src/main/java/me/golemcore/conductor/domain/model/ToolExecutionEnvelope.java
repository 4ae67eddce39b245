package me.golemcore.conductor.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * Wire contract between the engine and the UI/log layer. Serialized as the
 * {@code content} of a tool-role {@link Message}.
 *
 * @param status
 *            executing, completed or failed
 * @param message
 *            human-readable status line (error text for failures)
 * @param payload
 *            tool output; absent for failures and empty results
 * @param preview
 *            short preview of the proposed change, derived from the arguments
 * @param toolName
 *            tool name as requested by the model
 * @param toolCallId
 *            originating tool-call id
 * @param targetFile
 *            file the tool operates on, if any
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolExecutionEnvelope(
        ToolExecutionStatus status,
        String message,
        String payload,
        String preview,
        String toolName,
        String toolCallId,
        String targetFile
) {
}
