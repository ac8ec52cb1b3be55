package com.deepansh.memory.tool.impl;

import com.deepansh.memory.core.OperationResult;
import com.deepansh.memory.core.SessionLifecycleService;
import com.deepansh.memory.model.SessionMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SessionEndToolTest {

    private SessionLifecycleService lifecycleService;
    private SessionEndTool tool;

    @BeforeEach
    void setUp() {
        lifecycleService = mock(SessionLifecycleService.class);
        tool = new SessionEndTool(lifecycleService);
    }

    @Test
    void execute_missingSessionId_returnsError() {
        assertThat(tool.execute(Map.of("summary", "x"))).startsWith("ERROR:").contains("sessionId");
    }

    @Test
    void execute_rendersMetrics() {
        when(lifecycleService.endSession(any())).thenReturn(OperationResult.success(SessionMetrics.builder()
                .sessionId("s1").durationSecs(3900).eventsTotal(12).filesRead(4).filesModified(2)
                .decisionsRecorded(1).patternsDiscovered(3).errorsResolved(0).build()));

        String result = tool.execute(Map.of("sessionId", "s1", "summary", "Built storage layer"));

        assertThat(result)
                .startsWith("Session s1 completed.")
                .contains("Duration: 1h 5m")
                .contains("Events: 12")
                .contains("Files read: 4 | modified: 2")
                .contains("Decisions: 1 | Patterns: 3")
                .contains("Errors resolved: 0")
                .endsWith("Summary: Built storage layer");
    }

    @Test
    void execute_alreadyEnded_returnsError() {
        when(lifecycleService.endSession(any()))
                .thenReturn(OperationResult.failure("Session s1 not found or already ended."));

        assertThat(tool.execute(Map.of("sessionId", "s1")))
                .isEqualTo("ERROR: Session s1 not found or already ended.");
    }

    @Test
    void duration_formatsHoursAndMinutes() {
        assertThat(Formats.duration(59)).isEqualTo("0m");
        assertThat(Formats.duration(600)).isEqualTo("10m");
        assertThat(Formats.duration(7260)).isEqualTo("2h 1m");
        assertThat(Formats.minutes(95)).isEqualTo("1h 35m");
    }
}
