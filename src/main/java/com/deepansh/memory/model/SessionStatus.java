package com.deepansh.memory.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * active → completed (normal end) or active → abandoned (a newer session
 * started for the same project). Both targets are terminal.
 */
public enum SessionStatus {
    ACTIVE("active"),
    COMPLETED("completed"),
    ABANDONED("abandoned");

    private final String value;

    SessionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static SessionStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown session status: " + value));
    }
}
