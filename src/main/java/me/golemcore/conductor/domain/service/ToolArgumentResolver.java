package me.golemcore.conductor.domain.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.conductor.domain.model.Message;
import me.golemcore.conductor.domain.model.ToolArguments;
import me.golemcore.conductor.port.outbound.ActiveFilePort;
import me.golemcore.conductor.port.outbound.PathValidatorPort;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the arguments handed to a tool and classifies tool calls for
 * scheduling.
 *
 * <p>
 * File-like tools called without a {@code path} get the active file injected
 * as their path, when one is known.
 */
public class ToolArgumentResolver {

    private static final Set<String> FILE_PATH_TOOLS = Set.of(
            "read_file", "write_file", "write_files", "create_file", "delete_file", "replace_in_file",
            "index_read_file");

    private static final Set<String> WRITE_LIKE_TOOLS = Set.of(
            "write_file", "write_files", "create_file", "delete_file", "replace_in_file", "run_command");

    private static final List<String> PATH_KEYS = List.of(
            "path", "targetPath", "target_path", "file_path", "file", "target");

    private final ActiveFilePort activeFilePort;
    private final PathValidatorPort pathValidator;

    public ToolArgumentResolver(ActiveFilePort activeFilePort) {
        this(activeFilePort, null);
    }

    public ToolArgumentResolver(ActiveFilePort activeFilePort, PathValidatorPort pathValidator) {
        this.activeFilePort = activeFilePort;
        this.pathValidator = pathValidator;
    }

    public boolean isFilePathLikeTool(String toolName) {
        return FILE_PATH_TOOLS.contains(toolName);
    }

    public boolean isWriteLikeTool(String toolName) {
        return WRITE_LIKE_TOOLS.contains(toolName);
    }

    /**
     * Target file of the call: the first non-blank path-like argument, or the
     * active file for file-like tools.
     */
    public Optional<String> resolveTargetFile(Message.ToolCall toolCall) {
        return resolveTargetFile(toolCall, toolCall.getName());
    }

    /**
     * Same as {@link #resolveTargetFile(Message.ToolCall)}, classified by the
     * resolved tool name rather than the requested one.
     */
    public Optional<String> resolveTargetFile(Message.ToolCall toolCall, String toolName) {
        Optional<String> explicit = explicitFilePath(new ToolArguments(toolCall.argumentsOrEmpty()));
        if (explicit.isPresent()) {
            return explicit;
        }
        if (isFilePathLikeTool(toolName)) {
            return activeFilePath();
        }
        return Optional.empty();
    }

    /**
     * Resource key for write scheduling: the target file if known, otherwise the
     * tool name, so unrelated writes of the same tool still serialize. Inside a
     * project the target is normalized against the root, so different spellings
     * of one file share a key. A path escaping the root keeps its declared form;
     * the tool rejects it on its own.
     */
    public String pathKey(Message.ToolCall toolCall, String projectRoot) {
        return pathKey(toolCall, toolCall.getName(), projectRoot);
    }

    public String pathKey(Message.ToolCall toolCall, String toolName, String projectRoot) {
        Optional<String> target = resolveTargetFile(toolCall, toolName);
        if (target.isEmpty()) {
            return toolName;
        }
        if (pathValidator == null || projectRoot == null) {
            return target.get();
        }
        try {
            return pathValidator.resolve(projectRoot, target.get()).toString();
        } catch (PathEscapeException e) {
            return target.get();
        }
    }

    /**
     * Model arguments plus correlation fields plus the injected default path.
     */
    public ToolArguments mergeArguments(Message.ToolCall toolCall, String conversationId) {
        return mergeArguments(toolCall, toolCall.getName(), conversationId);
    }

    public ToolArguments mergeArguments(Message.ToolCall toolCall, String toolName, String conversationId) {
        ObjectNode merged = toolCall.argumentsOrEmpty().deepCopy();
        merged.put(ToolArguments.TOOL_CALL_ID, toolCall.getId());
        if (conversationId != null) {
            merged.put(ToolArguments.CONVERSATION_ID, conversationId);
        }
        if (isFilePathLikeTool(toolName)) {
            boolean hasPath = merged.hasNonNull("path") && merged.get("path").isTextual()
                    && !merged.get("path").asText().isBlank();
            if (!hasPath) {
                activeFilePath().ifPresent(path -> merged.put("path", path));
            }
        }
        return new ToolArguments(merged);
    }

    private Optional<String> explicitFilePath(ToolArguments arguments) {
        for (String key : PATH_KEYS) {
            Optional<String> value = arguments.get(key)
                    .filter(node -> node.isTextual())
                    .map(node -> node.asText().trim())
                    .filter(text -> !text.isEmpty());
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    private Optional<String> activeFilePath() {
        if (activeFilePort == null) {
            return Optional.empty();
        }
        return activeFilePort.activeFilePath().filter(path -> !path.isBlank());
    }
}
