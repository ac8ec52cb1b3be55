package com.deepansh.memory.tool.impl;

import com.deepansh.memory.core.HistoryService;
import com.deepansh.memory.core.OperationResult;
import com.deepansh.memory.model.AgentType;
import com.deepansh.memory.model.EventCategory;
import com.deepansh.memory.model.SessionStats;
import com.deepansh.memory.model.StatsPeriod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class StatsToolTest {

    private HistoryService historyService;
    private StatsTool tool;

    @BeforeEach
    void setUp() {
        historyService = mock(HistoryService.class);
        tool = new StatsTool(historyService);
    }

    @Test
    void execute_noPeriod_asksForWeek() {
        when(historyService.stats(any(), any())).thenReturn(OperationResult.failure("x"));

        tool.execute(Map.of("projectPath", "/p"));

        verify(historyService).stats(eq("/p"), eq(StatsPeriod.WEEK));
    }

    @Test
    void execute_invalidPeriod_returnsError() {
        assertThat(tool.execute(Map.of("projectPath", "/p", "period", "decade")))
                .startsWith("ERROR:").contains("decade");
        verifyNoInteractions(historyService);
    }

    @Test
    void execute_rendersBreakdowns() {
        SessionStats stats = SessionStats.builder()
                .projectPath("/p").period(StatsPeriod.MONTH)
                .totalSessions(3).totalDurationSecs(5400).patternsDiscovered(2)
                .topFiles(List.of(new SessionStats.FileTouchCount("src/App.java", 9)))
                .categoryBreakdown(List.of(new SessionStats.CategoryCount(EventCategory.READ, 14)))
                .agentBreakdown(List.of(new SessionStats.AgentSessionCount(AgentType.AIDER, 3)))
                .build();
        when(historyService.stats(any(), any())).thenReturn(OperationResult.success(stats));

        String result = tool.execute(Map.of("projectPath", "/p", "period", "month"));

        assertThat(result)
                .startsWith("Project stats for /p (month):")
                .contains("Sessions: 3")
                .contains("Total time: 1h 30m")
                .contains("Patterns discovered: 2")
                .contains("  src/App.java (9)")
                .contains("  read: 14")
                .contains("  Aider: 3 session(s)");
    }
}
