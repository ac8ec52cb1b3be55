package com.deepansh.memory.core;

import com.deepansh.memory.model.AgentType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Caller-supplied values win over probed ones; anything left null is
 * detected from the workspace and environment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartSessionRequest {

    private String projectPath;
    private String branch;
    private String gitCommit;
    private AgentType agentType;
    private String agentVersion;
}
