package com.deepansh.memory.api;

import com.deepansh.memory.tool.ToolDefinition;
import com.deepansh.memory.tool.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ToolCommandRunnerTest {

    private ToolRegistry toolRegistry;
    private ToolCommandRunner runner;

    @BeforeEach
    void setUp() {
        toolRegistry = mock(ToolRegistry.class);
        runner = new ToolCommandRunner(toolRegistry, new ObjectMapper());
    }

    @Test
    void run_noArguments_doesNothing() {
        runner.run();

        verifyNoInteractions(toolRegistry);
    }

    @Test
    void dispatch_toolWithJson_passesParsedArguments() {
        when(toolRegistry.execute(eq("recall"), any())).thenReturn("Found 0 session(s):");

        String result = runner.dispatch("recall", "{\"projectPath\":\"/p\",\"limit\":3,\"tags\":[\"a\"]}");

        assertThat(result).isEqualTo("Found 0 session(s):");
        verify(toolRegistry).execute("recall", Map.of("projectPath", "/p", "limit", 3, "tags", List.of("a")));
    }

    @Test
    void dispatch_toolWithoutJson_passesEmptyArguments() {
        when(toolRegistry.execute(eq("stats"), any())).thenReturn("ERROR: 'projectPath' is required");

        assertThat(runner.dispatch("stats")).isEqualTo("ERROR: 'projectPath' is required");
        verify(toolRegistry).execute("stats", Map.of());
    }

    @Test
    void dispatch_malformedJson_returnsError() {
        String result = runner.dispatch("recall", "{projectPath: /p");

        assertThat(result).startsWith("ERROR: Arguments must be a JSON object:");
        verify(toolRegistry, never()).execute(anyString(), any());
    }

    @Test
    void dispatch_jsonArray_returnsError() {
        assertThat(runner.dispatch("recall", "[1,2]")).startsWith("ERROR: Arguments must be a JSON object:");
    }

    @Test
    void dispatch_tools_listsFirstDescriptionLine() {
        when(toolRegistry.getAllDefinitions()).thenReturn(List.of(
                ToolDefinition.builder().name("recall").description("Search past sessions.\nMore detail.").build(),
                ToolDefinition.builder().name("stats").description("Project statistics.").build()));

        assertThat(runner.dispatch("tools")).isEqualTo(
                "Available tools:\n  recall: Search past sessions.\n  stats: Project statistics.");
    }
}
