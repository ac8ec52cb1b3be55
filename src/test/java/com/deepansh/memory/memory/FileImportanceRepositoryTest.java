package com.deepansh.memory.memory;

import com.deepansh.memory.model.EventDetail.FileOperation;
import com.deepansh.memory.model.FileImportance;
import com.deepansh.memory.support.MutableClock;
import com.deepansh.memory.support.TestStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static com.deepansh.memory.support.Fixtures.PROJECT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FileImportanceRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private TestStore store;
    private MutableClock clock;
    private FileImportanceRepository repository;

    @BeforeEach
    void setUp() {
        store = TestStore.migrated();
        clock = new MutableClock(T0);
        repository = new FileImportanceRepository(store.jdbcTemplate, clock);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void computeImportanceScore_editsWeighThreeTimesReads() {
        assertThat(FileImportanceRepository.computeImportanceScore(2, 1, T0, T0)).isEqualTo(5.0);
    }

    @Test
    void computeImportanceScore_halvesEverySevenDays() {
        double score = FileImportanceRepository.computeImportanceScore(4, 0, T0, T0.plus(Duration.ofDays(7)));

        assertThat(score).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void recordAccess_firstAccessCreatesRow() {
        FileImportance row = repository.recordAccess(PROJECT, "src/App.java", FileOperation.READ);

        assertThat(row.getReadCount()).isEqualTo(1);
        assertThat(row.getEditCount()).isZero();
        assertThat(row.getImportanceScore()).isEqualTo(1.0);
        assertThat(repository.find(PROJECT, "src/App.java")).contains(row);
    }

    @Test
    void recordAccess_writeAndEditBothCountAsEdits() {
        repository.recordAccess(PROJECT, "src/App.java", FileOperation.READ);
        repository.recordAccess(PROJECT, "src/App.java", FileOperation.WRITE);
        FileImportance row = repository.recordAccess(PROJECT, "src/App.java", FileOperation.EDIT);

        assertThat(row.getReadCount()).isEqualTo(1);
        assertThat(row.getEditCount()).isEqualTo(2);
        assertThat(row.getImportanceScore()).isEqualTo(7.0);
    }

    @Test
    void findTop_ordersByScore() {
        repository.recordAccess(PROJECT, "a.java", FileOperation.READ);
        repository.recordAccess(PROJECT, "b.java", FileOperation.EDIT);
        repository.recordAccess(PROJECT, "c.java", FileOperation.READ);
        repository.recordAccess(PROJECT, "c.java", FileOperation.READ);

        assertThat(repository.findTop(PROJECT, 2))
                .extracting(FileImportance::getFilePath).containsExactly("b.java", "c.java");
    }

    @Test
    void refreshScores_appliesDecayToStaleRows() {
        repository.recordAccess(PROJECT, "a.java", FileOperation.EDIT);
        clock.advance(Duration.ofDays(7));
        repository.recordAccess(PROJECT, "fresh.java", FileOperation.READ);

        int updated = repository.refreshScores(PROJECT);

        assertThat(updated).isEqualTo(1);
        assertThat(repository.find(PROJECT, "a.java").orElseThrow().getImportanceScore())
                .isCloseTo(1.5, within(1e-9));
        assertThat(repository.find(PROJECT, "fresh.java").orElseThrow().getImportanceScore()).isEqualTo(1.0);
    }

    @Test
    void refreshScores_nothingChanged_returnsZero() {
        repository.recordAccess(PROJECT, "a.java", FileOperation.READ);

        assertThat(repository.refreshScores(PROJECT)).isZero();
    }
}
