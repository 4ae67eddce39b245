package me.golemcore.conductor.domain.system.orchestration;

import me.golemcore.conductor.domain.component.ProgressReportingToolComponent;
import me.golemcore.conductor.domain.component.ToolComponent;
import me.golemcore.conductor.domain.model.ToolArguments;
import me.golemcore.conductor.domain.model.ToolDefinition;
import me.golemcore.conductor.domain.support.CancellationToken;

import java.util.List;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Command tool restricted to a set of command prefixes. Commands outside the
 * allowlist, or chaining further commands through shell control operators, are
 * rejected before the wrapped tool runs.
 */
public class AllowlistedRunCommandTool implements ProgressReportingToolComponent {

    // ; & | (including && and ||), backticks, $( ) and line breaks
    private static final Pattern CONTROL_OPERATORS = Pattern.compile("[;&|`\\r\\n]|\\$\\(");

    private final ToolComponent base;
    private final List<String> allowedPrefixes;

    public AllowlistedRunCommandTool(ToolComponent base, List<String> allowedPrefixes) {
        this.base = base;
        this.allowedPrefixes = List.copyOf(allowedPrefixes);
    }

    @Override
    public ToolDefinition getDefinition() {
        ToolDefinition definition = base.getDefinition();
        return ToolDefinition.builder()
                .name(definition.getName())
                .description("Execute a shell command in the terminal (allowlisted for verify phase).")
                .inputSchema(definition.getInputSchema())
                .build();
    }

    @Override
    public boolean isEnabled() {
        return base.isEnabled();
    }

    @Override
    public String execute(ToolArguments arguments, CancellationToken cancellation, Consumer<String> onChunk)
            throws Exception {
        ToolArguments validated = withValidatedCommand(arguments);
        if (base instanceof ProgressReportingToolComponent reporting) {
            return reporting.execute(validated, cancellation, onChunk);
        }
        return base.execute(validated, cancellation);
    }

    public List<String> getAllowedPrefixes() {
        return allowedPrefixes;
    }

    boolean isAllowed(String command) {
        String normalized = command.trim();
        return !hasControlOperators(normalized) && allowedPrefixes.stream().anyMatch(normalized::startsWith);
    }

    static boolean hasControlOperators(String command) {
        return CONTROL_OPERATORS.matcher(command).find();
    }

    private ToolArguments withValidatedCommand(ToolArguments arguments) {
        String raw = arguments.getString("command")
                .orElseThrow(() -> new IllegalArgumentException("Missing 'command' argument for run_command"));
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Invalid 'command' for run_command (empty)");
        }
        if (hasControlOperators(trimmed)) {
            throw new IllegalArgumentException(
                    "Command chaining is not allowed for verify (found a shell control operator): " + trimmed);
        }
        if (!isAllowed(trimmed)) {
            throw new IllegalArgumentException(
                    "Command is not allowlisted for verify. Allowed prefixes: " + String.join(", ", allowedPrefixes));
        }
        return new ToolArguments(arguments.asObjectNode().put("command", trimmed));
    }
}
