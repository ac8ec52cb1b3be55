package com.deepansh.memory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** Aggregates for one project over a time window. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionStats {

    private String projectPath;
    private StatsPeriod period;
    private int totalSessions;
    private long totalDurationSecs;

    @Builder.Default
    private List<FileTouchCount> topFiles = new ArrayList<>();

    @Builder.Default
    private List<CategoryCount> categoryBreakdown = new ArrayList<>();

    private int patternsDiscovered;

    @Builder.Default
    private List<AgentSessionCount> agentBreakdown = new ArrayList<>();

    public record FileTouchCount(String path, int touches) {}

    public record CategoryCount(EventCategory category, int count) {}

    public record AgentSessionCount(AgentType agentType, int sessions) {}
}
