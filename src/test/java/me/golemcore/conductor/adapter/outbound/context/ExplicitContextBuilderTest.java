package me.golemcore.conductor.adapter.outbound.context;

import me.golemcore.conductor.port.outbound.ProjectIndexPort;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExplicitContextBuilderTest {

    @Test
    void shouldExtractUpToFiveDistinctKeywords() {
        assertEquals(List.of("Fix", "LoginService", "crash", "when", "email"),
                List.copyOf(ExplicitContextBuilder.keywords(
                        "Fix LoginService crash when email is empty, LoginService again")));
        assertTrue(ExplicitContextBuilder.keywords(null).isEmpty());
        assertTrue(ExplicitContextBuilder.keywords("a bc de").isEmpty());
    }

    @Test
    void shouldCombineExplicitContextWithIndexMatches() {
        ProjectIndexPort index = mock(ProjectIndexPort.class);
        when(index.search("/work/app", "LoginService", 10)).thenReturn(List.of("class LoginService (Login.swift)"));
        when(index.search(eq("/work/app"), eq("crash"), anyInt())).thenReturn(List.of());

        String context = new ExplicitContextBuilder(index)
                .buildContext("LoginService crash", "selected: func login()", "/work/app");

        assertEquals("selected: func login()\n\n"
                + "CODEBASE INDEX (matching symbols):\n- class LoginService (Login.swift)", context);
    }

    @Test
    void shouldCapIndexResults() {
        ProjectIndexPort index = mock(ProjectIndexPort.class);
        List<String> ten = IntStream.range(0, 10).mapToObj(i -> "symbol" + i).toList();
        when(index.search(anyString(), anyString(), anyInt())).thenReturn(ten);

        String context = new ExplicitContextBuilder(index)
                .buildContext("alpha beta gamma delta epsilon", null, "/work/app");

        long lines = context.lines().filter(line -> line.startsWith("- ")).count();
        assertEquals(25, lines);
    }

    @Test
    void shouldIgnoreFailingIndexLookups() {
        ProjectIndexPort index = mock(ProjectIndexPort.class);
        when(index.search(anyString(), anyString(), anyInt())).thenThrow(new IllegalStateException("index down"));

        assertEquals("explicit", new ExplicitContextBuilder(index).buildContext("search term", "explicit", "/w"));
    }

    @Test
    void shouldReturnNullWhenNothingToAdd() {
        ProjectIndexPort index = mock(ProjectIndexPort.class);

        assertNull(new ExplicitContextBuilder(null).buildContext("anything", null, "/work/app"));
        assertNull(new ExplicitContextBuilder(index).buildContext("query", "", null));
        verify(index, never()).search(anyString(), anyString(), anyInt());
    }
}
