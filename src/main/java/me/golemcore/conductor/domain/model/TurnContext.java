package me.golemcore.conductor.domain.model;

import lombok.Builder;
import lombok.Data;
import me.golemcore.conductor.domain.component.ToolComponent;
import me.golemcore.conductor.domain.support.CancellationToken;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Execution context for one conversation turn. Carries the tools the caller
 * made available, the cancellation signal shared by every call chain of the
 * turn, and the runtime events emitted while the turn runs.
 */
@Data
@Builder(toBuilder = true)
public class TurnContext {

    private String conversationId;
    private String projectRoot;

    @Builder.Default
    private AgentMode mode = AgentMode.CHAT;

    private String userInput;

    /**
     * Context the caller attached explicitly (selected code, open file).
     */
    private String explicitContext;

    @Builder.Default
    private List<ToolComponent> availableTools = new ArrayList<>();

    @Builder.Default
    private CancellationToken cancellation = CancellationToken.create();

    /**
     * Tool-call ids the user cancelled before their results were recorded.
     */
    @Builder.Default
    private Set<String> cancelledToolCallIds = ConcurrentHashMap.newKeySet();

    @Builder.Default
    private List<RuntimeEvent> runtimeEvents = new CopyOnWriteArrayList<>();

    public List<ToolDefinition> toolDefinitions() {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (ToolComponent tool : availableTools) {
            if (tool.isEnabled()) {
                definitions.add(tool.getDefinition());
            }
        }
        return definitions;
    }
}
