package com.deepansh.memory.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum AgentType {
    CLAUDE_CODE("claude-code", "Claude Code"),
    CURSOR("cursor", "Cursor"),
    AIDER("aider", "Aider"),
    OPENCLAW("openclaw", "OpenClaw"),
    UNKNOWN("unknown", "Unknown Agent");

    private final String value;
    private final String displayName;

    AgentType(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String displayName() {
        return displayName;
    }

    /** Unrecognised values fall back to UNKNOWN rather than failing a read. */
    public static AgentType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equals(value))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
