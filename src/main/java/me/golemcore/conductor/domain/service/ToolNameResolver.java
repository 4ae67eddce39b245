package me.golemcore.conductor.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.domain.component.ToolComponent;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the tool name requested by the model onto one of the available tools.
 *
 * <p>
 * Order: exact name, then the alias table (first alias target that is
 * available wins), then one retry with the name trimmed and lower-cased
 * (exact, then alias). Anything else is unresolved.
 */
@Component
@Slf4j
public class ToolNameResolver {

    private static final Map<String, List<String>> ALIASES = Map.ofEntries(
            Map.entry("read", List.of("read_file")),
            Map.entry("write", List.of("write_file", "write_files")),
            Map.entry("edit", List.of("replace_in_file")),
            Map.entry("delete", List.of("delete_file")),
            Map.entry("run", List.of("run_command")),
            Map.entry("shell", List.of("run_command")),
            Map.entry("bash", List.of("run_command")),
            Map.entry("search", List.of("search_files")),
            Map.entry("grep", List.of("search_files")),
            Map.entry("ls", List.of("list_files")),
            Map.entry("list", List.of("list_files")));

    public Optional<ToolComponent> resolve(String requestedName, Collection<ToolComponent> availableTools) {
        if (requestedName == null || availableTools == null || availableTools.isEmpty()) {
            return Optional.empty();
        }
        Optional<ToolComponent> resolved = resolveExactOrAlias(requestedName, availableTools);
        if (resolved.isPresent()) {
            return resolved;
        }
        String normalized = requestedName.trim().toLowerCase(Locale.ROOT);
        if (!normalized.equals(requestedName)) {
            resolved = resolveExactOrAlias(normalized, availableTools);
            resolved.ifPresent(tool -> log.debug("[Tools] Resolved '{}' as '{}' after normalization",
                    requestedName, tool.getToolName()));
        }
        return resolved;
    }

    private Optional<ToolComponent> resolveExactOrAlias(String name, Collection<ToolComponent> availableTools) {
        Optional<ToolComponent> exact = findByName(name, availableTools);
        if (exact.isPresent()) {
            return exact;
        }
        for (String target : ALIASES.getOrDefault(name, List.of())) {
            Optional<ToolComponent> aliased = findByName(target, availableTools);
            if (aliased.isPresent()) {
                log.debug("[Tools] Resolved alias '{}' -> '{}'", name, target);
                return aliased;
            }
        }
        return Optional.empty();
    }

    private static Optional<ToolComponent> findByName(String name, Collection<ToolComponent> availableTools) {
        return availableTools.stream()
                .filter(tool -> name.equals(tool.getToolName()))
                .findFirst();
    }
}
