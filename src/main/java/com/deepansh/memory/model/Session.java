package com.deepansh.memory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One unit of work in a project. At most one session per project path is
 * ACTIVE; sessions are never deleted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Session {

    private String sessionId;
    private String projectPath;
    private String branch;
    private Instant startedAt;
    private Instant endedAt;

    @Builder.Default
    private SessionStatus status = SessionStatus.ACTIVE;

    private String summary;
    private String gitCommitStart;
    private String gitCommitEnd;

    @Builder.Default
    private AgentType agentType = AgentType.UNKNOWN;

    private String agentVersion;

    public boolean isActive() {
        return status == SessionStatus.ACTIVE;
    }
}
