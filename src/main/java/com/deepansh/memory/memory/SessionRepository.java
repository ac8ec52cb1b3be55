package com.deepansh.memory.memory;

import com.deepansh.memory.model.AgentType;
import com.deepansh.memory.model.EventCategory;
import com.deepansh.memory.model.EventType;
import com.deepansh.memory.model.Session;
import com.deepansh.memory.model.SessionMetrics;
import com.deepansh.memory.model.SessionStats;
import com.deepansh.memory.model.SessionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.deepansh.memory.store.Timestamps.format;
import static com.deepansh.memory.store.Timestamps.parse;

/**
 * Session rows. Listings are newest first by start time; rowid breaks ties
 * so sessions started in the same millisecond keep insertion order.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class SessionRepository {

    static final RowMapper<Session> ROW_MAPPER = (rs, rowNum) -> Session.builder()
            .sessionId(rs.getString("session_id"))
            .projectPath(rs.getString("project_path"))
            .branch(rs.getString("branch"))
            .startedAt(parse(rs.getString("started_at")))
            .endedAt(parse(rs.getString("ended_at")))
            .status(SessionStatus.fromValue(rs.getString("status")))
            .summary(rs.getString("summary"))
            .gitCommitStart(rs.getString("git_commit_start"))
            .gitCommitEnd(rs.getString("git_commit_end"))
            .agentType(AgentType.fromValue(rs.getString("agent_type")))
            .agentVersion(rs.getString("agent_version"))
            .build();

    private static final int TOP_FILES = 10;

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public Session insert(Session session) {
        jdbcTemplate.update("""
                INSERT INTO sessions (session_id, project_path, branch, started_at, status,
                                      git_commit_start, agent_type, agent_version)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)""",
                session.getSessionId(),
                session.getProjectPath(),
                session.getBranch(),
                format(session.getStartedAt()),
                session.getStatus().value(),
                session.getGitCommitStart(),
                session.getAgentType().value(),
                session.getAgentVersion());
        log.debug("Inserted session [id={}, project={}]", session.getSessionId(), session.getProjectPath());
        return session;
    }

    public Optional<Session> findById(String sessionId) {
        return jdbcTemplate.query("SELECT * FROM sessions WHERE session_id = ?", ROW_MAPPER, sessionId)
                .stream().findFirst();
    }

    public Optional<Session> findActive(String projectPath) {
        return jdbcTemplate.query("""
                SELECT * FROM sessions
                WHERE project_path = ? AND status = 'active'
                ORDER BY started_at DESC, rowid DESC
                LIMIT 1""", ROW_MAPPER, projectPath).stream().findFirst();
    }

    /**
     * Completes an active session. Returns empty when the session does not
     * exist or is no longer active; nothing is written in that case.
     */
    public Optional<Session> end(String sessionId, Instant endedAt, String summary, String gitCommitEnd) {
        int changed = jdbcTemplate.update("""
                UPDATE sessions
                SET ended_at = ?, status = 'completed', summary = ?, git_commit_end = ?
                WHERE session_id = ? AND status = 'active'""",
                format(endedAt), summary, gitCommitEnd, sessionId);
        if (changed == 0) {
            return Optional.empty();
        }
        return findById(sessionId);
    }

    /** Marks every active session of the project abandoned. Returns how many were. */
    public int abandonActive(String projectPath, Instant endedAt) {
        return jdbcTemplate.update("""
                UPDATE sessions
                SET ended_at = ?, status = 'abandoned'
                WHERE project_path = ? AND status = 'active'""",
                format(endedAt), projectPath);
    }

    public List<Session> findRecentCompleted(String projectPath, String branch, int limit) {
        if (branch != null) {
            return jdbcTemplate.query("""
                    SELECT * FROM sessions
                    WHERE project_path = ? AND branch = ? AND status = 'completed'
                    ORDER BY started_at DESC, rowid DESC LIMIT ?""",
                    ROW_MAPPER, projectPath, branch, limit);
        }
        return jdbcTemplate.query("""
                SELECT * FROM sessions
                WHERE project_path = ? AND status = 'completed'
                ORDER BY started_at DESC, rowid DESC LIMIT ?""",
                ROW_MAPPER, projectPath, limit);
    }

    /** Summary substring search. Without a query this is the recent-completed listing. */
    public List<Session> search(String projectPath, String query, String branch, int limit) {
        if (query == null || query.isBlank()) {
            return findRecentCompleted(projectPath, branch, limit);
        }
        String like = "%" + query + "%";
        if (branch != null) {
            return jdbcTemplate.query("""
                    SELECT * FROM sessions
                    WHERE project_path = ? AND branch = ? AND summary LIKE ?
                    ORDER BY started_at DESC, rowid DESC LIMIT ?""",
                    ROW_MAPPER, projectPath, branch, like, limit);
        }
        return jdbcTemplate.query("""
                SELECT * FROM sessions
                WHERE project_path = ? AND summary LIKE ?
                ORDER BY started_at DESC, rowid DESC LIMIT ?""",
                ROW_MAPPER, projectPath, like, limit);
    }

    /**
     * Activity summary for one session. Open sessions are measured up to now.
     */
    public Optional<SessionMetrics> computeMetrics(String sessionId) {
        Optional<Session> found = findById(sessionId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Session session = found.get();
        Instant end = session.getEndedAt() != null ? session.getEndedAt() : clock.instant();

        Map<EventCategory, Integer> byCategory = new EnumMap<>(EventCategory.class);
        for (EventCategory c : EventCategory.values()) {
            byCategory.put(c, 0);
        }
        jdbcTemplate.query("""
                SELECT category, COUNT(*) AS cnt FROM session_events
                WHERE session_id = ? GROUP BY category""",
                rs -> {
                    byCategory.merge(EventCategory.fromValue(rs.getString("category")), rs.getInt("cnt"), Integer::sum);
                }, sessionId);

        Map<EventType, Integer> byType = new EnumMap<>(EventType.class);
        jdbcTemplate.query("""
                SELECT event_type, COUNT(*) AS cnt FROM session_events
                WHERE session_id = ? GROUP BY event_type""",
                rs -> {
                    byType.put(EventType.fromValue(rs.getString("event_type")), rs.getInt("cnt"));
                }, sessionId);

        Integer filesRead = jdbcTemplate.queryForObject("""
                SELECT COUNT(DISTINCT json_extract(detail_json, '$.path')) FROM session_events
                WHERE session_id = ? AND event_type = 'file_read'""", Integer.class, sessionId);
        Integer filesModified = jdbcTemplate.queryForObject("""
                SELECT COUNT(DISTINCT json_extract(detail_json, '$.path')) FROM session_events
                WHERE session_id = ? AND event_type IN ('file_write', 'file_edit')""", Integer.class, sessionId);

        return Optional.of(SessionMetrics.builder()
                .sessionId(sessionId)
                .durationSecs(Duration.between(session.getStartedAt(), end).getSeconds())
                .eventsTotal(byCategory.values().stream().mapToInt(Integer::intValue).sum())
                .eventsByCategory(byCategory)
                .filesRead(filesRead == null ? 0 : filesRead)
                .filesModified(filesModified == null ? 0 : filesModified)
                .decisionsRecorded(byType.getOrDefault(EventType.DECISION, 0))
                .patternsDiscovered(byType.getOrDefault(EventType.PATTERN, 0))
                .errorsResolved(byType.getOrDefault(EventType.ERROR_RESOLVED, 0))
                .build());
    }

    /**
     * Aggregates over sessions started at or after since (all sessions when null).
     * Duration only counts sessions that have ended.
     */
    public SessionStats projectStats(String projectPath, Instant since) {
        String sinceClause = since != null ? " AND s.started_at >= ?" : "";
        Object[] params = since != null
                ? new Object[]{projectPath, format(since)}
                : new Object[]{projectPath};

        List<Session> sessions = jdbcTemplate.query(
                "SELECT s.* FROM sessions s WHERE s.project_path = ?" + sinceClause, ROW_MAPPER, params);
        long totalDuration = sessions.stream()
                .filter(s -> s.getEndedAt() != null)
                .mapToLong(s -> Duration.between(s.getStartedAt(), s.getEndedAt()).getSeconds())
                .sum();

        List<SessionStats.FileTouchCount> topFiles = jdbcTemplate.query("""
                SELECT json_extract(e.detail_json, '$.path') AS path, COUNT(*) AS cnt
                FROM session_events e
                JOIN sessions s ON e.session_id = s.session_id
                WHERE s.project_path = ?%s
                  AND e.event_type IN ('file_read', 'file_write', 'file_edit')
                  AND json_extract(e.detail_json, '$.path') IS NOT NULL
                GROUP BY path
                ORDER BY cnt DESC, path ASC
                LIMIT %d""".formatted(sinceClause, TOP_FILES),
                (rs, rowNum) -> new SessionStats.FileTouchCount(rs.getString("path"), rs.getInt("cnt")),
                params);

        List<SessionStats.CategoryCount> categories = jdbcTemplate.query("""
                SELECT e.category, COUNT(*) AS cnt
                FROM session_events e
                JOIN sessions s ON e.session_id = s.session_id
                WHERE s.project_path = ?%s
                GROUP BY e.category
                ORDER BY cnt DESC""".formatted(sinceClause),
                (rs, rowNum) -> new SessionStats.CategoryCount(
                        EventCategory.fromValue(rs.getString("category")), rs.getInt("cnt")),
                params);

        Integer patterns = jdbcTemplate.queryForObject("""
                SELECT COUNT(*) FROM session_events e
                JOIN sessions s ON e.session_id = s.session_id
                WHERE s.project_path = ?%s AND e.event_type = 'pattern'""".formatted(sinceClause),
                Integer.class, params);

        return SessionStats.builder()
                .projectPath(projectPath)
                .totalSessions(sessions.size())
                .totalDurationSecs(totalDuration)
                .topFiles(new ArrayList<>(topFiles))
                .categoryBreakdown(new ArrayList<>(categories))
                .patternsDiscovered(patterns == null ? 0 : patterns)
                .agentBreakdown(new ArrayList<>(agentBreakdown(projectPath, since)))
                .build();
    }

    /** Session counts per agent for a project, most used first. */
    public List<SessionStats.AgentSessionCount> agentBreakdown(String projectPath, Instant since) {
        String sinceClause = since != null ? " AND started_at >= ?" : "";
        Object[] params = since != null
                ? new Object[]{projectPath, format(since)}
                : new Object[]{projectPath};
        return jdbcTemplate.query(
                "SELECT agent_type, COUNT(*) AS cnt FROM sessions WHERE project_path = ?" + sinceClause
                        + " GROUP BY agent_type ORDER BY cnt DESC, agent_type ASC",
                (rs, rowNum) -> new SessionStats.AgentSessionCount(
                        AgentType.fromValue(rs.getString("agent_type")), rs.getInt("cnt")),
                params);
    }
}
