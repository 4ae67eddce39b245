package me.golemcore.conductor.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.conductor.domain.model.Message;
import me.golemcore.conductor.domain.model.ToolExecutionEnvelope;
import me.golemcore.conductor.domain.model.ToolExecutionStatus;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

/**
 * Builds tool-role messages whose content is the serialized
 * {@link ToolExecutionEnvelope}.
 *
 * <p>
 * Failures never carry a payload; their text goes into {@code message}. A
 * completed call with blank output carries no payload either.
 */
@Component
public class ToolResultMessageFactory {

    static final String MSG_EXECUTING = "Tool execution in progress.";
    static final String MSG_COMPLETED = "Tool completed successfully.";
    static final String MSG_COMPLETED_EMPTY = "Tool completed with no payload.";
    static final String MSG_FAILED_EMPTY = "Tool failed with no error details.";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ToolResultMessageFactory(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Message executing(Message.ToolCall toolCall, String targetFile, String content, String preview) {
        return build(ToolExecutionStatus.EXECUTING, content, toolCall, targetFile, preview);
    }

    public Message completed(Message.ToolCall toolCall, String targetFile, String content, String preview) {
        return build(ToolExecutionStatus.COMPLETED, content, toolCall, targetFile, preview);
    }

    public Message failed(Message.ToolCall toolCall, String targetFile, String error, String preview) {
        return build(ToolExecutionStatus.FAILED, error, toolCall, targetFile, preview);
    }

    public Message build(ToolExecutionStatus status, String content, Message.ToolCall toolCall, String targetFile,
            String preview) {
        ToolExecutionEnvelope envelope = envelope(status, content, toolCall.getName(), toolCall.getId(), targetFile,
                preview);
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_TOOL)
                .content(serialize(envelope))
                .toolCallId(toolCall.getId())
                .toolName(toolCall.getName())
                .toolStatus(status)
                .targetFile(targetFile)
                .timestamp(clock.instant())
                .build();
    }

    public static ToolExecutionEnvelope envelope(ToolExecutionStatus status, String content, String toolName,
            String toolCallId, String targetFile, String preview) {
        String safeContent = content != null ? content : "";
        boolean blank = safeContent.isBlank();
        String message = switch (status) {
        case EXECUTING -> MSG_EXECUTING;
        case COMPLETED -> blank ? MSG_COMPLETED_EMPTY : MSG_COMPLETED;
        case FAILED -> blank ? MSG_FAILED_EMPTY : safeContent;
        };
        String payload = status == ToolExecutionStatus.FAILED || blank ? null : safeContent;
        return ToolExecutionEnvelope.builder()
                .status(status)
                .message(message)
                .payload(payload)
                .preview(preview)
                .toolName(toolName)
                .toolCallId(toolCallId)
                .targetFile(targetFile)
                .build();
    }

    public ToolExecutionEnvelope parse(Message message) {
        try {
            return objectMapper.readValue(message.getContent(), ToolExecutionEnvelope.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a tool execution envelope: " + message.getId(), e);
        }
    }

    private String serialize(ToolExecutionEnvelope envelope) {
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize tool envelope for " + envelope.toolCallId(), e);
        }
    }
}
