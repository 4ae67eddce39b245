package me.golemcore.conductor.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.conductor.domain.model.ToolArguments;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Short human-readable preview of the change a tool call proposes. Built from
 * the tool name and arguments alone, before anything is executed, so it never
 * touches the file system.
 */
@Component
public class ToolChangePreviewBuilder {

    static final int MAX_PREVIEW_LINES = 8;
    static final int MAX_PREVIEW_CHARS = 400;

    private static final List<String> OLD_TEXT_KEYS = List.of("old_string", "old_text", "search", "find");
    private static final List<String> NEW_TEXT_KEYS = List.of("new_string", "new_text", "replace", "replacement");
    private static final List<String> PATH_KEYS = List.of("path", "file_path", "target_path", "file");

    /**
     * @return the preview, or empty for tools that propose no change
     */
    public Optional<String> build(String toolName, ToolArguments arguments) {
        if (toolName == null || arguments == null) {
            return Optional.empty();
        }
        return switch (toolName) {
        case "replace_in_file" -> editPreview(arguments);
        case "write_file", "create_file" -> writePreview(arguments);
        case "write_files" -> multiWritePreview(arguments);
        case "run_command" -> arguments.getString("command")
                .filter(command -> !command.isBlank())
                .map(command -> "$ " + excerpt(command.trim()));
        case "delete_file" -> firstString(arguments, PATH_KEYS).map(path -> "delete " + path);
        default -> Optional.empty();
        };
    }

    private Optional<String> editPreview(ToolArguments arguments) {
        Optional<String> before = firstString(arguments, OLD_TEXT_KEYS);
        Optional<String> after = firstString(arguments, NEW_TEXT_KEYS);
        if (before.isEmpty() && after.isEmpty()) {
            return Optional.empty();
        }
        StringBuilder preview = new StringBuilder();
        firstString(arguments, PATH_KEYS).ifPresent(path -> preview.append(path).append('\n'));
        preview.append("- ").append(excerpt(before.orElse(""))).append('\n');
        preview.append("+ ").append(excerpt(after.orElse("")));
        return Optional.of(preview.toString());
    }

    private Optional<String> writePreview(ToolArguments arguments) {
        Optional<String> content = arguments.getString("content");
        Optional<String> path = firstString(arguments, PATH_KEYS);
        if (content.isEmpty() && path.isEmpty()) {
            return Optional.empty();
        }
        StringBuilder preview = new StringBuilder();
        path.ifPresent(p -> preview.append(p).append('\n'));
        content.ifPresent(c -> preview.append(excerpt(c)));
        return Optional.of(preview.toString().stripTrailing());
    }

    private Optional<String> multiWritePreview(ToolArguments arguments) {
        Optional<JsonNode> files = arguments.get("files");
        if (files.isEmpty() || !files.get().isArray()) {
            return Optional.empty();
        }
        List<String> paths = new ArrayList<>();
        Iterator<JsonNode> elements = files.get().elements();
        while (elements.hasNext()) {
            JsonNode file = elements.next();
            JsonNode path = file.isObject() ? file.get("path") : null;
            if (path != null && path.isTextual()) {
                paths.add(path.asText());
            }
        }
        if (paths.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of("write " + paths.size() + " file(s): " + String.join(", ", paths));
    }

    private static Optional<String> firstString(ToolArguments arguments, List<String> keys) {
        for (String key : keys) {
            Optional<String> value = arguments.getString(key).filter(text -> !text.isBlank());
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    static String excerpt(String text) {
        String[] lines = text.split("\n", -1);
        StringBuilder excerpt = new StringBuilder();
        int count = Math.min(lines.length, MAX_PREVIEW_LINES);
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                excerpt.append('\n');
            }
            excerpt.append(lines[i]);
        }
        boolean clipped = lines.length > MAX_PREVIEW_LINES;
        if (excerpt.length() > MAX_PREVIEW_CHARS) {
            excerpt.setLength(MAX_PREVIEW_CHARS);
            clipped = true;
        }
        if (clipped) {
            excerpt.append(" …");
        }
        return excerpt.toString();
    }
}
