package me.golemcore.conductor.infrastructure.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.conductor.adapter.outbound.context.ExplicitContextBuilder;
import me.golemcore.conductor.adapter.outbound.llm.Langchain4jAdapter;
import me.golemcore.conductor.adapter.outbound.llm.NoOpLlmAdapter;
import me.golemcore.conductor.adapter.outbound.log.JsonlConversationLogAdapter;
import me.golemcore.conductor.adapter.outbound.storage.LocalFoldArchiveAdapter;
import me.golemcore.conductor.port.outbound.ContextBuilderPort;
import me.golemcore.conductor.port.outbound.ConversationLogPort;
import me.golemcore.conductor.port.outbound.FoldArchivePort;
import me.golemcore.conductor.port.outbound.LlmPort;
import me.golemcore.conductor.port.outbound.ProjectIndexPort;
import me.golemcore.conductor.port.outbound.ProjectStoragePort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring wiring for outbound adapters and shared infrastructure beans.
 *
 * <p>
 * The LLM port falls back to {@link NoOpLlmAdapter} when
 * {@code conductor.llm.api-key} is blank. A {@link ProjectIndexPort} bean is
 * optional; without one the context builder only forwards explicit context.
 */
@Configuration
@Slf4j
public class ConductorConfiguration {

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public LlmPort llmPort(ConductorProperties properties, ObjectMapper objectMapper) {
        ConductorProperties.LlmProperties llm = properties.getLlm();
        if (llm.getApiKey() == null || llm.getApiKey().isBlank()) {
            log.warn("[LLM] No API key configured (conductor.llm.api-key), using NoOpLlmAdapter");
            return new NoOpLlmAdapter();
        }
        return new Langchain4jAdapter(llm, objectMapper);
    }

    @Bean
    public ConversationLogPort conversationLogPort(ProjectStoragePort storage, ObjectMapper objectMapper,
            Clock clock, ConductorProperties properties) {
        return new JsonlConversationLogAdapter(storage, objectMapper, clock,
                properties.getConversation().getLogDirectory());
    }

    @Bean
    public FoldArchivePort foldArchivePort(ProjectStoragePort storage, ObjectMapper objectMapper, Clock clock,
            ConductorProperties properties) {
        return new LocalFoldArchiveAdapter(storage, objectMapper, clock,
                properties.getConversation().getFoldDirectory());
    }

    @Bean
    public ContextBuilderPort contextBuilderPort(ObjectProvider<ProjectIndexPort> projectIndex) {
        return new ExplicitContextBuilder(projectIndex.getIfAvailable());
    }
}
