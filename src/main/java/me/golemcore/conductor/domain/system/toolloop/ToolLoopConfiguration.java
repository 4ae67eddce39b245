package me.golemcore.conductor.domain.system.toolloop;

import me.golemcore.conductor.domain.service.AiInteractionGateway;
import me.golemcore.conductor.domain.service.ConversationFoldingService;
import me.golemcore.conductor.domain.service.ConversationHistoryService;
import me.golemcore.conductor.domain.service.ConversationTurnService;
import me.golemcore.conductor.domain.service.RuntimeEventService;
import me.golemcore.conductor.domain.service.ToolArgumentResolver;
import me.golemcore.conductor.domain.service.ToolCallExecutionService;
import me.golemcore.conductor.domain.service.ToolChangePreviewBuilder;
import me.golemcore.conductor.domain.service.ToolNameResolver;
import me.golemcore.conductor.domain.service.ToolResultMessageFactory;
import me.golemcore.conductor.domain.service.ToolScheduler;
import me.golemcore.conductor.domain.service.ToolTimeoutWatchdog;
import me.golemcore.conductor.domain.system.orchestration.AgentOrchestrator;
import me.golemcore.conductor.infrastructure.config.ConductorProperties;
import me.golemcore.conductor.port.outbound.ActiveFilePort;
import me.golemcore.conductor.port.outbound.ContextBuilderPort;
import me.golemcore.conductor.port.outbound.ConversationLogPort;
import me.golemcore.conductor.port.outbound.FoldArchivePort;
import me.golemcore.conductor.port.outbound.LlmPort;
import me.golemcore.conductor.port.outbound.PathValidatorPort;
import me.golemcore.conductor.port.outbound.ProjectStoragePort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Spring wiring for the tool engine, the tool loop and the orchestrator. */
@Configuration
public class ToolLoopConfiguration {

    @Bean
    public ToolScheduler toolScheduler(ConductorProperties properties) {
        return new ToolScheduler(properties.getTools().getMaxParallelReads());
    }

    @Bean
    public ToolTimeoutWatchdog toolTimeoutWatchdog(Clock clock, ConductorProperties properties) {
        return new ToolTimeoutWatchdog(clock, Duration.ofMillis(properties.getTools().getPollIntervalMillis()));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService toolBatchExecutor(ConductorProperties properties) {
        return Executors.newFixedThreadPool(properties.getTools().getExecutorThreads(), namedThreads("tool-batch-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService toolBodyExecutor() {
        return Executors.newCachedThreadPool(namedThreads("tool-body-"));
    }

    @Bean
    public ToolArgumentResolver toolArgumentResolver(ObjectProvider<ActiveFilePort> activeFilePort,
            PathValidatorPort pathValidator) {
        return new ToolArgumentResolver(activeFilePort.getIfAvailable(), pathValidator);
    }

    @Bean
    public ToolCallExecutionService toolCallExecutionService(ToolScheduler scheduler, ToolTimeoutWatchdog watchdog,
            ToolNameResolver nameResolver, ToolArgumentResolver argumentResolver,
            ToolChangePreviewBuilder previewBuilder, ToolResultMessageFactory messageFactory,
            RuntimeEventService runtimeEventService, ConversationLogPort conversationLog,
            @Qualifier("toolBatchExecutor") ExecutorService batchExecutor,
            @Qualifier("toolBodyExecutor") ExecutorService bodyExecutor,
            ConductorProperties properties) {
        return new ToolCallExecutionService(scheduler, watchdog, nameResolver, argumentResolver, previewBuilder,
                messageFactory, runtimeEventService, conversationLog, batchExecutor, bodyExecutor,
                properties.getTools().getTimeoutSeconds(), properties.getTools().getMaxToolResultChars());
    }

    @Bean
    public AiInteractionGateway aiInteractionGateway(LlmPort llmPort, ContextBuilderPort contextBuilder,
            RuntimeEventService runtimeEventService, Clock clock, ConductorProperties properties) {
        ConductorProperties.LlmProperties llm = properties.getLlm();
        return new AiInteractionGateway(llmPort, contextBuilder, runtimeEventService, clock,
                AiInteractionGateway::cancellableSleep, llm.getModel(), llm.getTemperature(),
                Duration.ofSeconds(llm.getRequestTimeoutSeconds()));
    }

    @Bean
    public ConversationHistoryService conversationHistoryService(ProjectStoragePort storage, Clock clock,
            ConductorProperties properties) {
        return new ConversationHistoryService(storage, clock, properties.getConversation().getIdFile());
    }

    @Bean
    public ConversationFoldingService conversationFoldingService(FoldArchivePort archive,
            ConversationLogPort conversationLog, RuntimeEventService runtimeEventService, Clock clock,
            ConductorProperties properties) {
        ConductorProperties.FoldingProperties folding = properties.getFolding();
        return new ConversationFoldingService(archive, conversationLog, runtimeEventService, clock,
                new ConversationFoldingService.Thresholds(folding.getMaxMessages(), folding.getMaxContentChars(),
                        folding.getPreserveRecentMessages()));
    }

    @Bean
    public ToolIterationRunner toolIterationRunner(AiInteractionGateway gateway,
            ToolCallExecutionService executionService, ConversationHistoryService history,
            ToolResultMessageFactory messageFactory, ConversationLogPort conversationLog, Clock clock) {
        return new ToolIterationRunner(gateway, executionService, history, messageFactory, conversationLog, clock);
    }

    @Bean
    public ReasoningCorrectionsHandler reasoningCorrectionsHandler(AiInteractionGateway gateway,
            ConversationHistoryService history) {
        return new ReasoningCorrectionsHandler(gateway, history);
    }

    @Bean
    public ToolLoopSystem toolLoopSystem(AiInteractionGateway gateway, ToolIterationRunner runner,
            ReasoningCorrectionsHandler corrections, ConversationHistoryService history,
            ConversationFoldingService folding, ConductorProperties properties) {
        return new DefaultToolLoopSystem(gateway, runner, corrections, history,
                properties.getFolding().isEnabled() ? folding : null, properties.getToolLoop());
    }

    @Bean
    public AgentOrchestrator agentOrchestrator(AiInteractionGateway gateway, ToolIterationRunner runner,
            ConversationHistoryService history, RuntimeEventService runtimeEventService,
            ConversationLogPort conversationLog, ConductorProperties properties) {
        return new AgentOrchestrator(gateway, runner, history, runtimeEventService, conversationLog,
                properties.getOrchestration());
    }

    @Bean
    public ConversationTurnService conversationTurnService(ConversationHistoryService history,
            ToolLoopSystem toolLoopSystem, AgentOrchestrator orchestrator, RuntimeEventService runtimeEventService,
            ConversationLogPort conversationLog, Clock clock, ConductorProperties properties) {
        return new ConversationTurnService(history, toolLoopSystem, orchestrator, runtimeEventService,
                conversationLog, clock, properties.getOrchestration().isEnabled());
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
