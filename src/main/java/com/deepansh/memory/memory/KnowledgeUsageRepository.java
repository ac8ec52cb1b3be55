package com.deepansh.memory.memory;

import com.deepansh.memory.model.KnowledgeUsage;
import com.deepansh.memory.model.UsageType;
import com.deepansh.memory.store.Timestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.IdGenerator;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.deepansh.memory.store.Timestamps.format;
import static com.deepansh.memory.store.Timestamps.parse;

@Repository
@Slf4j
@RequiredArgsConstructor
public class KnowledgeUsageRepository {

    private static final RowMapper<KnowledgeUsage> ROW_MAPPER = (rs, rowNum) -> KnowledgeUsage.builder()
            .usageId(rs.getString("usage_id"))
            .knowledgeId(rs.getString("knowledge_id"))
            .sessionId(rs.getString("session_id"))
            .usageType(UsageType.fromValue(rs.getString("usage_type")))
            .timestamp(parse(rs.getString("timestamp")))
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final KnowledgeRepository knowledgeRepository;
    private final IdGenerator idGenerator;
    private final Clock clock;

    /** Logs the usage and bumps the item's usage counter by one. */
    @Transactional
    public KnowledgeUsage record(String knowledgeId, String sessionId, UsageType usageType) {
        KnowledgeUsage usage = KnowledgeUsage.builder()
                .usageId(idGenerator.generateId().toString())
                .knowledgeId(knowledgeId)
                .sessionId(sessionId)
                .usageType(usageType)
                .timestamp(Timestamps.now(clock))
                .build();

        jdbcTemplate.update("""
                INSERT INTO knowledge_usage (usage_id, knowledge_id, session_id, usage_type, timestamp)
                VALUES (?, ?, ?, ?, ?)""",
                usage.getUsageId(), knowledgeId, sessionId, usageType.value(), format(usage.getTimestamp()));
        knowledgeRepository.incrementUsage(knowledgeId);

        log.debug("Knowledge usage [knowledge={}, session={}, type={}]", knowledgeId, sessionId, usageType.value());
        return usage;
    }

    public List<KnowledgeUsage> findByKnowledge(String knowledgeId, int limit) {
        return jdbcTemplate.query("""
                SELECT * FROM knowledge_usage WHERE knowledge_id = ?
                ORDER BY timestamp DESC, rowid DESC LIMIT ?""",
                ROW_MAPPER, knowledgeId, limit);
    }

    public List<KnowledgeUsage> findBySession(String sessionId) {
        return jdbcTemplate.query("""
                SELECT * FROM knowledge_usage WHERE session_id = ?
                ORDER BY timestamp ASC, rowid ASC""",
                ROW_MAPPER, sessionId);
    }

    /** Usage counts for a project's knowledge since an optional instant; every type present. */
    public Map<UsageType, Integer> countByType(String projectPath, Instant since) {
        Map<UsageType, Integer> counts = new EnumMap<>(UsageType.class);
        for (UsageType t : UsageType.values()) {
            counts.put(t, 0);
        }
        String sinceClause = since != null ? " AND ku.timestamp >= ?" : "";
        Object[] params = since != null
                ? new Object[]{projectPath, format(since)}
                : new Object[]{projectPath};
        jdbcTemplate.query("""
                SELECT ku.usage_type, COUNT(*) AS cnt
                FROM knowledge_usage ku
                JOIN promoted_knowledge pk ON ku.knowledge_id = pk.knowledge_id
                WHERE pk.project_path = ?%s
                GROUP BY ku.usage_type""".formatted(sinceClause),
                rs -> {
                    counts.put(UsageType.fromValue(rs.getString("usage_type")), rs.getInt("cnt"));
                }, params);
        return counts;
    }
}
