package com.deepansh.memory.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum KnowledgeType {
    DECISION("decision"),
    PATTERN("pattern"),
    ERROR_RESOLVED("error_resolved"),
    MILESTONE("milestone");

    private final String value;

    KnowledgeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static KnowledgeType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown knowledge type: " + value));
    }
}
