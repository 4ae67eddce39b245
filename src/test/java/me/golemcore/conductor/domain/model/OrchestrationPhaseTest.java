package me.golemcore.conductor.domain.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrchestrationPhaseTest {

    @Test
    void shouldDeclarePhasesInExecutionOrder() {
        assertEquals(List.of(OrchestrationPhase.ARCHITECT, OrchestrationPhase.PLANNER, OrchestrationPhase.WORKER,
                OrchestrationPhase.REVIEWER, OrchestrationPhase.VERIFIER, OrchestrationPhase.FINALIZER),
                List.of(OrchestrationPhase.values()));
    }

    @Test
    void shouldLoopOnlyToolUsingPhases() {
        List<OrchestrationPhase> looping = Arrays.stream(OrchestrationPhase.values())
                .filter(OrchestrationPhase::isLooping)
                .toList();

        assertEquals(List.of(OrchestrationPhase.WORKER, OrchestrationPhase.REVIEWER, OrchestrationPhase.VERIFIER),
                looping);
    }

    @Test
    void shouldExposeToolPolicies() {
        assertEquals(OrchestrationPhase.ToolPolicy.NONE, OrchestrationPhase.ARCHITECT.getToolPolicy());
        assertEquals(OrchestrationPhase.ToolPolicy.SINGLE_TOOL, OrchestrationPhase.PLANNER.getToolPolicy());
        assertEquals("planner", OrchestrationPhase.PLANNER.getToolName());
        assertEquals(OrchestrationPhase.ToolPolicy.COMMAND_ALLOWLIST, OrchestrationPhase.VERIFIER.getToolPolicy());
        assertEquals("run_command", OrchestrationPhase.VERIFIER.getToolName());
        assertTrue(OrchestrationPhase.FINALIZER.getInstruction().contains("Do not call tools"));
    }
}
