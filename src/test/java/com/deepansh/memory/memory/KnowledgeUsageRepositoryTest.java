package com.deepansh.memory.memory;

import com.deepansh.memory.model.KnowledgeType;
import com.deepansh.memory.model.KnowledgeUsage;
import com.deepansh.memory.model.UsageType;
import com.deepansh.memory.support.MutableClock;
import com.deepansh.memory.support.TestStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.util.AlternativeJdkIdGenerator;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static com.deepansh.memory.support.Fixtures.PROJECT;
import static com.deepansh.memory.support.Fixtures.knowledge;
import static com.deepansh.memory.support.Fixtures.session;
import static org.assertj.core.api.Assertions.assertThat;

class KnowledgeUsageRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");

    private TestStore store;
    private MutableClock clock;
    private KnowledgeRepository knowledgeRepository;
    private KnowledgeUsageRepository usages;

    @BeforeEach
    void setUp() {
        store = TestStore.migrated();
        clock = new MutableClock(T0);
        new SessionRepository(store.jdbcTemplate, clock).insert(session("s1", "main", T0));
        knowledgeRepository = new KnowledgeRepository(store.jdbcTemplate, new ObjectMapper());
        knowledgeRepository.insert(knowledge("k1", KnowledgeType.DECISION, "A", "a", "main", T0));
        usages = new KnowledgeUsageRepository(store.jdbcTemplate, knowledgeRepository,
                new AlternativeJdkIdGenerator(), clock);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void record_logsUsageAndIncrementsCounter() {
        KnowledgeUsage usage = usages.record("k1", "s1", UsageType.RECALLED);

        assertThat(usage.getUsageId()).isNotBlank();
        assertThat(usage.getTimestamp()).isEqualTo(T0);
        assertThat(knowledgeRepository.findById("k1").orElseThrow().getUsageCount()).isEqualTo(1);
        assertThat(usages.findBySession("s1"))
                .extracting(KnowledgeUsage::getUsageType).containsExactly(UsageType.RECALLED);
    }

    @Test
    void findByKnowledge_isNewestFirst() {
        usages.record("k1", "s1", UsageType.SURFACED);
        clock.advance(Duration.ofMinutes(1));
        usages.record("k1", "s1", UsageType.APPLIED);

        assertThat(usages.findByKnowledge("k1", 10))
                .extracting(KnowledgeUsage::getUsageType)
                .containsExactly(UsageType.APPLIED, UsageType.SURFACED);
    }

    @Test
    void countByType_coversEveryTypeAndHonoursSince() {
        usages.record("k1", "s1", UsageType.SURFACED);
        clock.advance(Duration.ofDays(2));
        usages.record("k1", "s1", UsageType.SURFACED);
        usages.record("k1", "s1", UsageType.APPLIED);

        Map<UsageType, Integer> all = usages.countByType(PROJECT, null);
        Map<UsageType, Integer> recent = usages.countByType(PROJECT, T0.plus(Duration.ofDays(1)));

        assertThat(all).containsEntry(UsageType.SURFACED, 2)
                .containsEntry(UsageType.APPLIED, 1)
                .containsEntry(UsageType.RECALLED, 0);
        assertThat(recent).containsEntry(UsageType.SURFACED, 1);
    }
}
