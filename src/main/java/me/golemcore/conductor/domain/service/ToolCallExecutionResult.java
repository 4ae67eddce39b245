package me.golemcore.conductor.domain.service;

import me.golemcore.conductor.domain.model.Message;
import me.golemcore.conductor.domain.model.ToolResult;

/** Terminal outcome of one tool call: the classified result and the tool message recorded for it. */
public record ToolCallExecutionResult(String toolCallId, String toolName, ToolResult toolResult, Message message) {
}
