package me.golemcore.conductor.domain.system.toolloop;

import me.golemcore.conductor.domain.model.AgentMode;
import me.golemcore.conductor.domain.model.LlmResponse;
import me.golemcore.conductor.domain.model.Message;
import me.golemcore.conductor.domain.model.ToolExecutionStatus;
import me.golemcore.conductor.domain.model.TurnContext;
import me.golemcore.conductor.infrastructure.config.ConductorProperties;
import me.golemcore.conductor.testsupport.EngineHarness;
import me.golemcore.conductor.testsupport.StubTool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static me.golemcore.conductor.testsupport.EngineHarness.call;
import static me.golemcore.conductor.testsupport.EngineHarness.toolCalls;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Scenario tests for a full turn through the tool loop: real scheduler,
 * watchdog, execution service and history, with a scripted model.
 */
class ToolLoopSystemBddTest {

    private EngineHarness harness;
    private DefaultToolLoopSystem system;

    @BeforeEach
    void setUp() {
        harness = new EngineHarness();
        ConductorProperties.ToolLoopProperties settings = new ConductorProperties.ToolLoopProperties();
        settings.setAgentMaxIterations(3);
        settings.setChatMaxIterations(2);
        system = new DefaultToolLoopSystem(harness.gateway, harness.runner, harness.corrections, harness.history,
                null, settings);
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private TurnContext agentTurn(String input, StubTool... tools) {
        harness.history.append(Message.user(input));
        return TurnContext.builder()
                .conversationId("conv-1")
                .projectRoot("/work/app")
                .mode(AgentMode.AGENT)
                .userInput(input)
                .availableTools(new ArrayList<>(List.of(tools)))
                .build();
    }

    @Test
    void shouldReadFileAndAnswerInOneTurn() {
        // GIVEN: a project with one readable file
        StubTool readFile = StubTool.returning("read_file", "class App {}");
        TurnContext context = agentTurn("what is in App.java?", readFile);

        // AND: a model that reads the file, then answers
        harness.respond(
                toolCalls(null, call("c1", "read_file", "path", "App.java")),
                LlmResponse.text("App.java declares an empty class."));

        // WHEN: the turn is processed
        ToolLoopTurnResult result = system.processTurn(context);

        // THEN: the answer is returned and the transcript holds call, result and answer
        assertEquals("App.java declares an empty class.", result.finalText());
        assertEquals(1, result.iterations());
        assertEquals(2, result.llmCalls());
        List<Message> messages = harness.history.getMessages();
        assertEquals(4, messages.size());
        assertTrue(messages.get(1).hasToolCalls());
        assertEquals(ToolExecutionStatus.COMPLETED, messages.get(2).getToolStatus());
        assertEquals("App.java declares an empty class.", messages.get(3).getContent());
    }

    @Test
    void shouldStopAtIterationCapWhenModelKeepsCallingTools() {
        // GIVEN: a model that never stops calling tools
        StubTool listFiles = StubTool.returning("list_files", "a.txt");
        TurnContext context = agentTurn("explore", listFiles);
        harness.thenAlways(toolCalls(null, call("loop", "list_files", "dir", ".")));

        // WHEN: the turn is processed
        ToolLoopTurnResult result = system.processTurn(context);

        // THEN: exactly three batches ran and the turn ends with the cap notice
        assertTrue(result.capReached());
        assertEquals(3, result.iterations());
        assertEquals(3, listFiles.getInvocations().size());
        assertEquals("Tool loop stopped: reached max iterations (3).", result.finalText());
    }

    @Test
    void shouldForceToolCallsWhenAgentOnlyAnnouncesWork() {
        // GIVEN: a model that first announces work, then complies when pushed
        StubTool writeFile = StubTool.returning("write_file", "wrote 12 bytes");
        TurnContext context = agentTurn("add a README", writeFile);
        harness.respond(
                LlmResponse.text("I will implement the README now."),
                toolCalls(null, call("c1", "write_file", "path", "README.md")),
                LlmResponse.text("README added."));

        // WHEN: the turn is processed
        ToolLoopTurnResult result = system.processTurn(context);

        // THEN: the follow-up produced a real tool call
        assertEquals("README added.", result.finalText());
        assertEquals(1, writeFile.getInvocations().size());
        assertEquals(3, result.llmCalls());
        List<Message> forced = harness.requests.get(1).getMessages();
        assertEquals(ReasoningCorrectionsHandler.FORCE_TOOL_FOLLOWUP, forced.get(forced.size() - 2).getContent());
    }

    @Test
    void shouldRecordFailedToolAndLetModelRecover() {
        // GIVEN: a model that calls a tool the project does not have
        TurnContext context = agentTurn("deploy it");
        harness.respond(
                toolCalls(null, call("c1", "deploy", null, null)),
                LlmResponse.text("No deploy tool is available."));

        // WHEN: the turn is processed
        ToolLoopTurnResult result = system.processTurn(context);

        // THEN: the failure is recorded and the turn still completes
        assertFalse(result.capReached());
        assertEquals("No deploy tool is available.", result.finalText());
        Message toolMessage = harness.history.findToolMessage("c1").orElseThrow();
        assertEquals(ToolExecutionStatus.FAILED, toolMessage.getToolStatus());
        assertTrue(toolMessage.getContent().contains("Tool not found"));
    }
}
