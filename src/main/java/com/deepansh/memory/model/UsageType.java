package com.deepansh.memory.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/** How a knowledge item was put to use. Every usage bumps the item's usage counter. */
public enum UsageType {
    SURFACED("surfaced"),
    RECALLED("recalled"),
    APPLIED("applied");

    private final String value;

    UsageType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static UsageType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown usage type: " + value));
    }
}
