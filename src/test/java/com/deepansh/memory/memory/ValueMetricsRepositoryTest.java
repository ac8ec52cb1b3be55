package com.deepansh.memory.memory;

import com.deepansh.memory.model.ValueMetrics;
import com.deepansh.memory.model.ValueSummary;
import com.deepansh.memory.support.MutableClock;
import com.deepansh.memory.support.TestStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.deepansh.memory.support.Fixtures.PROJECT;
import static org.assertj.core.api.Assertions.assertThat;

class ValueMetricsRepositoryTest {

    private TestStore store;
    private ValueMetricsRepository repository;

    @BeforeEach
    void setUp() {
        store = TestStore.migrated();
        repository = new ValueMetricsRepository(store.jdbcTemplate,
                new MutableClock(Instant.parse("2026-03-02T09:00:00Z")));
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void find_untouchedProject_returnsEmpty() {
        assertThat(repository.find(PROJECT)).isEmpty();
    }

    @Test
    void ensure_isIdempotent() {
        repository.ensure(PROJECT);
        ValueMetrics metrics = repository.ensure(PROJECT);

        assertThat(metrics.getTotalSessions()).isZero();
        assertThat(metrics.getEstimatedTimeSavedSecs()).isZero();
    }

    @Test
    void increments_addTimeSavedPerUnit() {
        repository.incrementSessions(PROJECT);
        repository.incrementContextReuse(PROJECT);
        repository.incrementKnowledgeSurfaced(PROJECT, 3);
        repository.incrementDecisionRecall(PROJECT, 1);
        repository.incrementPatternApplied(PROJECT, 1);
        repository.incrementErrorPrevented(PROJECT, 1);

        ValueMetrics metrics = repository.find(PROJECT).orElseThrow();

        assertThat(metrics.getTotalSessions()).isEqualTo(1);
        assertThat(metrics.getContextReuseCount()).isEqualTo(1);
        assertThat(metrics.getKnowledgeSurfacedCount()).isEqualTo(3);
        assertThat(metrics.getDecisionsRecalledCount()).isEqualTo(1);
        assertThat(metrics.getPatternsAppliedCount()).isEqualTo(1);
        assertThat(metrics.getErrorsPreventedCount()).isEqualTo(1);
        assertThat(metrics.getEstimatedTimeSavedSecs()).isEqualTo(3 * 60 + 180 + 300 + 900);
    }

    @Test
    void summary_convertsSecondsToMinutesAndMoney() {
        repository.incrementErrorPrevented(PROJECT, 2);
        repository.incrementKnowledgeSurfaced(PROJECT, 1);

        ValueSummary summary = repository.summary(PROJECT, 50.0);

        assertThat(summary.timeSavedMinutes()).isEqualTo(31);
        assertThat(summary.estimatedValue()).isEqualTo(25.83);
        assertThat(summary.errorsPrevented()).isEqualTo(2);
        assertThat(summary.hourlyRate()).isEqualTo(50.0);
    }

    @Test
    void summary_noRow_isZero() {
        ValueSummary summary = repository.summary(PROJECT, 80.0);

        assertThat(summary.timeSavedMinutes()).isZero();
        assertThat(summary.estimatedValue()).isZero();
        assertThat(summary.hourlyRate()).isEqualTo(80.0);
    }
}
