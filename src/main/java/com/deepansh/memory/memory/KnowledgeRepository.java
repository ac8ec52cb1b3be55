package com.deepansh.memory.memory;

import com.deepansh.memory.model.KnowledgeCounts;
import com.deepansh.memory.model.KnowledgeType;
import com.deepansh.memory.model.PromotedKnowledge;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.deepansh.memory.store.Timestamps.format;
import static com.deepansh.memory.store.Timestamps.parse;

/**
 * Promoted knowledge. Every listing skips superseded rows; only
 * {@link #findById(String)} returns them.
 */
@Repository
@Slf4j
public class KnowledgeRepository {

    private static final TypeReference<List<String>> TAG_LIST = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<PromotedKnowledge> rowMapper;

    public KnowledgeRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, rowNum) -> PromotedKnowledge.builder()
                .knowledgeId(rs.getString("knowledge_id"))
                .projectPath(rs.getString("project_path"))
                .sessionId(rs.getString("session_id"))
                .sourceEventId(rs.getString("source_event_id"))
                .title(rs.getString("title"))
                .content(rs.getString("content"))
                .knowledgeType(KnowledgeType.fromValue(rs.getString("knowledge_type")))
                .tags(readTags(rs.getString("knowledge_id"), rs.getString("tags")))
                .createdAt(parse(rs.getString("created_at")))
                .branch(rs.getString("branch"))
                .contentHash(rs.getString("content_hash"))
                .usageCount(rs.getInt("usage_count"))
                .supersededBy(rs.getString("superseded_by"))
                .syncedAt(parse(rs.getString("synced_at")))
                .remoteKnowledgeId(rs.getString("remote_knowledge_id"))
                .build();
    }

    public PromotedKnowledge insert(PromotedKnowledge knowledge) {
        jdbcTemplate.update("""
                INSERT INTO promoted_knowledge
                  (knowledge_id, project_path, session_id, source_event_id, title, content,
                   knowledge_type, tags, created_at, branch, content_hash, usage_count)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""",
                knowledge.getKnowledgeId(),
                knowledge.getProjectPath(),
                knowledge.getSessionId(),
                knowledge.getSourceEventId(),
                knowledge.getTitle(),
                knowledge.getContent(),
                knowledge.getKnowledgeType().value(),
                writeTags(knowledge.getTags()),
                format(knowledge.getCreatedAt()),
                knowledge.getBranch(),
                knowledge.getContentHash(),
                knowledge.getUsageCount());
        log.debug("Inserted knowledge [id={}, project={}, type={}]",
                knowledge.getKnowledgeId(), knowledge.getProjectPath(), knowledge.getKnowledgeType().value());
        return knowledge;
    }

    public Optional<PromotedKnowledge> findById(String knowledgeId) {
        return jdbcTemplate.query("SELECT * FROM promoted_knowledge WHERE knowledge_id = ?", rowMapper, knowledgeId)
                .stream().findFirst();
    }

    /** Newest first, optionally one type only. */
    public List<PromotedKnowledge> findByProject(String projectPath, KnowledgeType type, int limit) {
        if (type != null) {
            return jdbcTemplate.query("""
                    SELECT * FROM promoted_knowledge
                    WHERE project_path = ? AND knowledge_type = ? AND superseded_by IS NULL
                    ORDER BY created_at DESC, rowid DESC LIMIT ?""",
                    rowMapper, projectPath, type.value(), limit);
        }
        return jdbcTemplate.query("""
                SELECT * FROM promoted_knowledge
                WHERE project_path = ? AND superseded_by IS NULL
                ORDER BY created_at DESC, rowid DESC LIMIT ?""",
                rowMapper, projectPath, limit);
    }

    public List<PromotedKnowledge> findAllCurrent(String projectPath) {
        return jdbcTemplate.query("""
                SELECT * FROM promoted_knowledge
                WHERE project_path = ? AND superseded_by IS NULL
                ORDER BY created_at DESC, rowid DESC""",
                rowMapper, projectPath);
    }

    public Optional<PromotedKnowledge> findCurrentByHash(String projectPath, String contentHash) {
        return jdbcTemplate.query("""
                SELECT * FROM promoted_knowledge
                WHERE project_path = ? AND content_hash = ? AND superseded_by IS NULL
                ORDER BY created_at ASC, rowid ASC LIMIT 1""",
                rowMapper, projectPath, contentHash).stream().findFirst();
    }

    /** Oldest current item with the hash, other than excludeId. */
    public Optional<PromotedKnowledge> findCurrentByHash(String projectPath, String contentHash, String excludeId) {
        if (excludeId == null) {
            return findCurrentByHash(projectPath, contentHash);
        }
        return jdbcTemplate.query("""
                SELECT * FROM promoted_knowledge
                WHERE project_path = ? AND content_hash = ? AND superseded_by IS NULL AND knowledge_id <> ?
                ORDER BY created_at ASC, rowid ASC LIMIT 1""",
                rowMapper, projectPath, contentHash, excludeId).stream().findFirst();
    }

    /** Items not yet pushed to a remote, oldest first. */
    public List<PromotedKnowledge> findUnsynced(String projectPath) {
        return jdbcTemplate.query("""
                SELECT * FROM promoted_knowledge
                WHERE project_path = ? AND synced_at IS NULL AND superseded_by IS NULL
                ORDER BY created_at ASC, rowid ASC""",
                rowMapper, projectPath);
    }

    public boolean markSynced(String knowledgeId, Instant syncedAt, String remoteKnowledgeId) {
        return jdbcTemplate.update("""
                UPDATE promoted_knowledge SET synced_at = ?, remote_knowledge_id = ?
                WHERE knowledge_id = ?""",
                format(syncedAt), remoteKnowledgeId, knowledgeId) > 0;
    }

    /** Points oldId at its replacement. No cascade to items that oldId itself superseded. */
    public boolean markSuperseded(String oldId, String newId) {
        return jdbcTemplate.update("UPDATE promoted_knowledge SET superseded_by = ? WHERE knowledge_id = ?",
                newId, oldId) > 0;
    }

    public boolean incrementUsage(String knowledgeId) {
        return jdbcTemplate.update(
                "UPDATE promoted_knowledge SET usage_count = usage_count + 1 WHERE knowledge_id = ?",
                knowledgeId) > 0;
    }

    public KnowledgeCounts counts(String projectPath) {
        Map<KnowledgeType, Integer> byType = new EnumMap<>(KnowledgeType.class);
        for (KnowledgeType t : KnowledgeType.values()) {
            byType.put(t, 0);
        }
        jdbcTemplate.query("""
                SELECT knowledge_type, COUNT(*) AS cnt FROM promoted_knowledge
                WHERE project_path = ? AND superseded_by IS NULL
                GROUP BY knowledge_type""",
                rs -> {
                    byType.put(KnowledgeType.fromValue(rs.getString("knowledge_type")), rs.getInt("cnt"));
                }, projectPath);
        int total = byType.values().stream().mapToInt(Integer::intValue).sum();
        return new KnowledgeCounts(total, byType);
    }

    private String writeTags(List<String> tags) {
        try {
            return objectMapper.writeValueAsString(tags == null ? List.of() : tags);
        } catch (JsonProcessingException e) {
            throw new InvalidDataAccessApiUsageException("Tags are not serializable: " + e.getMessage(), e);
        }
    }

    private List<String> readTags(String knowledgeId, String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return new ArrayList<>(objectMapper.readValue(json, TAG_LIST));
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Unreadable tags for knowledge " + knowledgeId, e);
        }
    }
}
