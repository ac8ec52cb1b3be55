package com.deepansh.memory.memory;

import com.deepansh.memory.model.EventCategory;
import com.deepansh.memory.model.EventDetail;
import com.deepansh.memory.model.EventType;
import com.deepansh.memory.model.SessionEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

import static com.deepansh.memory.store.Timestamps.format;
import static com.deepansh.memory.store.Timestamps.parse;

/**
 * Append-only event log. Within a session events come back in timestamp
 * order; the detail payload round-trips through JSON.
 */
@Repository
@Slf4j
public class SessionEventRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<SessionEvent> rowMapper;

    public SessionEventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, rowNum) -> SessionEvent.builder()
                .eventId(rs.getString("event_id"))
                .sessionId(rs.getString("session_id"))
                .timestamp(parse(rs.getString("timestamp")))
                .eventType(EventType.fromValue(rs.getString("event_type")))
                .category(EventCategory.fromValue(rs.getString("category")))
                .detail(readDetail(rs.getString("event_id"), rs.getString("detail_json")))
                .build();
    }

    public SessionEvent insert(SessionEvent event) {
        jdbcTemplate.update("""
                INSERT INTO session_events (event_id, session_id, timestamp, event_type, category, detail_json)
                VALUES (?, ?, ?, ?, ?, ?)""",
                event.getEventId(),
                event.getSessionId(),
                format(event.getTimestamp()),
                event.getEventType().value(),
                event.getCategory().value(),
                writeDetail(event.getDetail()));
        log.debug("Recorded event [id={}, session={}, type={}]",
                event.getEventId(), event.getSessionId(), event.getEventType().value());
        return event;
    }

    /** Events of one session, oldest first, optionally restricted to a type. */
    public List<SessionEvent> findBySession(String sessionId, EventType type) {
        if (type != null) {
            return jdbcTemplate.query("""
                    SELECT * FROM session_events
                    WHERE session_id = ? AND event_type = ?
                    ORDER BY timestamp ASC, rowid ASC""",
                    rowMapper, sessionId, type.value());
        }
        return jdbcTemplate.query("""
                SELECT * FROM session_events
                WHERE session_id = ?
                ORDER BY timestamp ASC, rowid ASC""",
                rowMapper, sessionId);
    }

    /** Latest events across every session of a project, newest first. */
    public List<SessionEvent> findRecentByProject(String projectPath, EventType type, int limit) {
        if (type != null) {
            return jdbcTemplate.query("""
                    SELECT e.* FROM session_events e
                    JOIN sessions s ON e.session_id = s.session_id
                    WHERE s.project_path = ? AND e.event_type = ?
                    ORDER BY e.timestamp DESC, e.rowid DESC LIMIT ?""",
                    rowMapper, projectPath, type.value(), limit);
        }
        return jdbcTemplate.query("""
                SELECT e.* FROM session_events e
                JOIN sessions s ON e.session_id = s.session_id
                WHERE s.project_path = ?
                ORDER BY e.timestamp DESC, e.rowid DESC LIMIT ?""",
                rowMapper, projectPath, limit);
    }

    private String writeDetail(EventDetail detail) {
        try {
            return objectMapper.writeValueAsString(detail);
        } catch (JsonProcessingException e) {
            throw new InvalidDataAccessApiUsageException("Event detail is not serializable: " + e.getMessage(), e);
        }
    }

    private EventDetail readDetail(String eventId, String json) {
        try {
            return objectMapper.readValue(json, EventDetail.class);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Unreadable detail for event " + eventId, e);
        }
    }
}
