package com.deepansh.memory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Per-project counters of how often stored history paid off.
 * Time saved accumulates per unit: surfaced 60s, decision recall 180s,
 * pattern applied 300s, error prevented 900s.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValueMetrics {

    public static final int SECS_PER_SURFACED = 60;
    public static final int SECS_PER_DECISION_RECALL = 180;
    public static final int SECS_PER_PATTERN_APPLIED = 300;
    public static final int SECS_PER_ERROR_PREVENTED = 900;

    private String projectPath;
    private int totalSessions;
    private int contextReuseCount;
    private int knowledgeSurfacedCount;
    private int decisionsRecalledCount;
    private int patternsAppliedCount;
    private int errorsPreventedCount;
    private long estimatedTimeSavedSecs;
    private Instant updatedAt;
}
