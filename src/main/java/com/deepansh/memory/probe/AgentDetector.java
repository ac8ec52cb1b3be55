package com.deepansh.memory.probe;

import com.deepansh.memory.model.AgentIdentity;
import com.deepansh.memory.model.AgentType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identifies the coding agent from its version variable. The first variable
 * present wins, in declaration order.
 */
@Component
public class AgentDetector {

    private static final Map<String, AgentType> VERSION_VARIABLES = new LinkedHashMap<>();

    static {
        VERSION_VARIABLES.put("CLAUDE_CODE_VERSION", AgentType.CLAUDE_CODE);
        VERSION_VARIABLES.put("CURSOR_VERSION", AgentType.CURSOR);
        VERSION_VARIABLES.put("AIDER_VERSION", AgentType.AIDER);
        VERSION_VARIABLES.put("OPENCLAW_VERSION", AgentType.OPENCLAW);
    }

    private final Map<String, String> environment;

    @Autowired
    public AgentDetector() {
        this(System.getenv());
    }

    public AgentDetector(Map<String, String> environment) {
        this.environment = environment;
    }

    public AgentIdentity detect() {
        for (Map.Entry<String, AgentType> entry : VERSION_VARIABLES.entrySet()) {
            String version = environment.get(entry.getKey());
            if (version != null && !version.isBlank()) {
                return new AgentIdentity(entry.getValue(), version.trim());
            }
        }
        return AgentIdentity.UNKNOWN;
    }
}
