package com.deepansh.memory;

import com.deepansh.memory.api.ToolCommandRunner;
import com.deepansh.memory.store.MigrationCatalog;
import com.deepansh.memory.store.SchemaManager;
import com.deepansh.memory.tool.ToolDefinition;
import com.deepansh.memory.tool.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Path;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class SessionMemoryApplicationTest {

    private static final Pattern SESSION_ID = Pattern.compile("Session started: (\\S+)");

    @TempDir
    static Path storeDir;

    @DynamicPropertySource
    static void storeLocation(DynamicPropertyRegistry registry) {
        registry.add("memory.store.directory", storeDir::toString);
    }

    @Autowired
    private ToolRegistry toolRegistry;

    @Autowired
    private SchemaManager schemaManager;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void contextLoads_registersEveryToolAndMigratesStore() {
        assertThat(toolRegistry.getAllDefinitions()).extracting(ToolDefinition::getName).containsExactly(
                "get_knowledge", "promote_knowledge", "recall", "record_event", "session_end",
                "session_start", "stats", "use_knowledge", "value_metrics");
        assertThat(schemaManager.currentVersion()).isEqualTo(MigrationCatalog.CURRENT_VERSION);
    }

    @Test
    void commandLine_fullSessionRoundTrip() {
        ToolCommandRunner runner = new ToolCommandRunner(toolRegistry, objectMapper);
        String project = storeDir.resolve("project").toString();

        String started = runner.dispatch("session_start",
                "{\"projectPath\":\"" + project + "\",\"branch\":\"main\",\"agentType\":\"cursor\"}");
        Matcher m = SESSION_ID.matcher(started);
        assertThat(m.find()).as(started).isTrue();
        String sessionId = m.group(1);

        assertThat(toolRegistry.execute("record_event", Map.of("sessionId", sessionId, "detail",
                Map.of("type", "decision", "title", "Use repository pattern", "rationale", "one place for SQL"))))
                .startsWith("Event recorded: decision");
        assertThat(toolRegistry.execute("promote_knowledge", Map.of("projectPath", project,
                "title", "Use repository pattern", "content", "Repositories own all SQL",
                "knowledgeType", "pattern", "sessionId", sessionId)))
                .startsWith("Knowledge promoted: Use repository pattern");
        assertThat(toolRegistry.execute("session_end", Map.of("sessionId", sessionId,
                "summary", "Built storage layer")))
                .startsWith("Session " + sessionId + " completed.");

        String next = runner.dispatch("session_start", "{\"projectPath\":\"" + project + "\",\"branch\":\"main\"}");

        assertThat(next)
                .contains("--- Recent Sessions ---")
                .contains("Built storage layer")
                .contains("Decision: Use repository pattern: one place for SQL")
                .contains("--- Project Knowledge ---");
        assertThat(toolRegistry.execute("value_metrics", Map.of("projectPath", project)))
                .contains("Sessions tracked: 2")
                .contains("Knowledge surfaced: 1 times across sessions")
                .contains("Cursor: ");
    }
}
