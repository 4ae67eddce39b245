package me.golemcore.conductor.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.conductor.adapter.outbound.context.ExplicitContextBuilder;
import me.golemcore.conductor.adapter.outbound.llm.Langchain4jAdapter;
import me.golemcore.conductor.adapter.outbound.llm.NoOpLlmAdapter;
import me.golemcore.conductor.port.outbound.ContextBuilderPort;
import me.golemcore.conductor.port.outbound.LlmPort;
import me.golemcore.conductor.port.outbound.ProjectIndexPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConductorConfigurationTest {

    private ConductorConfiguration configuration;
    private ConductorProperties properties;

    @BeforeEach
    void setUp() {
        configuration = new ConductorConfiguration();
        properties = new ConductorProperties();
    }

    @Test
    void shouldFallBackToNoOpAdapterWithoutApiKey() {
        properties.getLlm().setApiKey("  ");

        LlmPort port = configuration.llmPort(properties, ConductorConfiguration.objectMapper());

        assertInstanceOf(NoOpLlmAdapter.class, port);
    }

    @Test
    void shouldCreateLangchainAdapterWhenApiKeyIsSet() {
        properties.getLlm().setApiKey("sk-test");
        properties.getLlm().setBaseUrl("http://localhost:1/v1");

        LlmPort port = configuration.llmPort(properties, ConductorConfiguration.objectMapper());

        assertInstanceOf(Langchain4jAdapter.class, port);
    }

    @Test
    void shouldWriteInstantsAsIsoStrings() throws Exception {
        ObjectMapper mapper = ConductorConfiguration.objectMapper();

        String json = mapper.writeValueAsString(Instant.parse("2026-02-14T00:00:00Z"));

        assertTrue(json.contains("2026-02-14T00:00:00Z"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldBuildContextBuilderWithoutProjectIndex() {
        ObjectProvider<ProjectIndexPort> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(null);

        ContextBuilderPort builder = configuration.contextBuilderPort(provider);

        assertInstanceOf(ExplicitContextBuilder.class, builder);
    }
}
