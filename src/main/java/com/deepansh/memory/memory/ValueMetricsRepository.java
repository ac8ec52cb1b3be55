package com.deepansh.memory.memory;

import com.deepansh.memory.model.ValueMetrics;
import com.deepansh.memory.model.ValueSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.Optional;

import static com.deepansh.memory.store.Timestamps.format;
import static com.deepansh.memory.store.Timestamps.parse;

/**
 * Per-project value counters. The row is created on the first increment.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class ValueMetricsRepository {

    private static final RowMapper<ValueMetrics> ROW_MAPPER = (rs, rowNum) -> ValueMetrics.builder()
            .projectPath(rs.getString("project_path"))
            .totalSessions(rs.getInt("total_sessions"))
            .contextReuseCount(rs.getInt("context_reuse_count"))
            .knowledgeSurfacedCount(rs.getInt("knowledge_surfaced_count"))
            .decisionsRecalledCount(rs.getInt("decisions_recalled_count"))
            .patternsAppliedCount(rs.getInt("patterns_applied_count"))
            .errorsPreventedCount(rs.getInt("errors_prevented_count"))
            .estimatedTimeSavedSecs(rs.getLong("estimated_time_saved_secs"))
            .updatedAt(parse(rs.getString("updated_at")))
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public ValueMetrics ensure(String projectPath) {
        jdbcTemplate.update("INSERT OR IGNORE INTO value_metrics (project_path, updated_at) VALUES (?, ?)",
                projectPath, format(clock.instant()));
        return find(projectPath).orElseThrow();
    }

    public Optional<ValueMetrics> find(String projectPath) {
        return jdbcTemplate.query("SELECT * FROM value_metrics WHERE project_path = ?", ROW_MAPPER, projectPath)
                .stream().findFirst();
    }

    public void incrementSessions(String projectPath) {
        bump(projectPath, "total_sessions", 1, 0);
    }

    public void incrementContextReuse(String projectPath) {
        bump(projectPath, "context_reuse_count", 1, 0);
    }

    public void incrementKnowledgeSurfaced(String projectPath, int count) {
        bump(projectPath, "knowledge_surfaced_count", count, ValueMetrics.SECS_PER_SURFACED);
    }

    public void incrementDecisionRecall(String projectPath, int count) {
        bump(projectPath, "decisions_recalled_count", count, ValueMetrics.SECS_PER_DECISION_RECALL);
    }

    public void incrementPatternApplied(String projectPath, int count) {
        bump(projectPath, "patterns_applied_count", count, ValueMetrics.SECS_PER_PATTERN_APPLIED);
    }

    public void incrementErrorPrevented(String projectPath, int count) {
        bump(projectPath, "errors_prevented_count", count, ValueMetrics.SECS_PER_ERROR_PREVENTED);
    }

    /** Zero summary when the project has no metrics row. */
    public ValueSummary summary(String projectPath, double hourlyRate) {
        return find(projectPath)
                .map(m -> ValueSummary.of(m, hourlyRate))
                .orElseGet(() -> ValueSummary.empty(hourlyRate));
    }

    // column is always one of the constants above, never caller input
    private void bump(String projectPath, String column, int count, int secsPerUnit) {
        ensure(projectPath);
        jdbcTemplate.update("""
                UPDATE value_metrics
                SET %1$s = %1$s + ?,
                    estimated_time_saved_secs = estimated_time_saved_secs + ?,
                    updated_at = ?
                WHERE project_path = ?""".formatted(column),
                count, (long) count * secsPerUnit, format(clock.instant()), projectPath);
        log.debug("Value metric {} +{} [project={}]", column, count, projectPath);
    }
}
