package com.deepansh.memory.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Registry row for an agent that has opened at least one session. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentInfo {

    private AgentType agentType;
    private String displayName;
    private Instant firstSeenAt;
    private Instant lastSeenAt;
    private int totalSessions;
}
