package me.golemcore.conductor.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Represents a single message in a conversation transcript. Supports the
 * system, user, assistant and tool roles. Assistant messages may carry the tool
 * calls requested by the model; tool messages carry the execution context of
 * one tool call (tool name, status, target file, originating tool-call id) and
 * a serialized {@link ToolExecutionEnvelope} as their content.
 */
@Data
@Builder(toBuilder = true)
public class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private String id;
    private String role; // user, assistant, system, tool
    private String content;
    private String reasoning; // model "thinking" split out of visible content

    private List<ToolCall> toolCalls;
    private String toolCallId; // For tool response messages
    private String toolName; // Tool name for tool response messages
    private ToolExecutionStatus toolStatus;
    private String targetFile;

    private Map<String, Object> metadata;
    private Instant timestamp;

    /**
     * Checks if this message is from the user.
     */
    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    /**
     * Checks if this message is from the assistant.
     */
    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    /**
     * Checks if this is a system message.
     */
    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    /**
     * Checks if this is a tool result message.
     */
    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    /**
     * Checks if this message contains tool calls from the LLM.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public static Message system(String content) {
        return Message.builder().role(ROLE_SYSTEM).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(ROLE_USER).content(content).build();
    }

    /**
     * Represents a function call requested by the LLM. Contains the tool name, ID
     * for correlation, and the arguments as a JSON object tree.
     */
    @Data
    @Builder(toBuilder = true)
    public static class ToolCall {
        private String id;
        private String name;
        private ObjectNode arguments;

        /**
         * Returns the arguments, never {@code null}.
         */
        public ObjectNode argumentsOrEmpty() {
            return arguments != null ? arguments : JsonNodeFactory.instance.objectNode();
        }
    }
}
