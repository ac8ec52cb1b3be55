package com.deepansh.memory.model;

/**
 * The coding agent driving a session, as detected from the environment or
 * supplied by the caller. Version is null when unknown.
 */
public record AgentIdentity(AgentType type, String version) {

    public static final AgentIdentity UNKNOWN = new AgentIdentity(AgentType.UNKNOWN, null);

    public AgentIdentity {
        type = type == null ? AgentType.UNKNOWN : type;
    }
}
