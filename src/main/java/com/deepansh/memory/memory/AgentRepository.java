package com.deepansh.memory.memory;

import com.deepansh.memory.model.AgentInfo;
import com.deepansh.memory.model.AgentType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static com.deepansh.memory.store.Timestamps.format;
import static com.deepansh.memory.store.Timestamps.parse;

@Repository
@RequiredArgsConstructor
public class AgentRepository {

    private static final RowMapper<AgentInfo> ROW_MAPPER = (rs, rowNum) -> AgentInfo.builder()
            .agentType(AgentType.fromValue(rs.getString("agent_type")))
            .displayName(rs.getString("display_name"))
            .firstSeenAt(parse(rs.getString("first_seen_at")))
            .lastSeenAt(parse(rs.getString("last_seen_at")))
            .totalSessions(rs.getInt("total_sessions"))
            .build();

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    /** Registers a session for the agent: first sighting inserts, later ones bump the counter. */
    public AgentInfo upsert(AgentType agentType) {
        String now = format(clock.instant());
        jdbcTemplate.update("""
                INSERT INTO agents (agent_type, display_name, first_seen_at, last_seen_at, total_sessions)
                VALUES (?, ?, ?, ?, 1)
                ON CONFLICT(agent_type) DO UPDATE SET
                  last_seen_at = excluded.last_seen_at,
                  total_sessions = total_sessions + 1""",
                agentType.value(), agentType.displayName(), now, now);
        return find(agentType).orElseThrow();
    }

    public Optional<AgentInfo> find(AgentType agentType) {
        return jdbcTemplate.query("SELECT * FROM agents WHERE agent_type = ?", ROW_MAPPER, agentType.value())
                .stream().findFirst();
    }

    public List<AgentInfo> findAll() {
        return jdbcTemplate.query("SELECT * FROM agents ORDER BY total_sessions DESC, agent_type ASC", ROW_MAPPER);
    }
}
