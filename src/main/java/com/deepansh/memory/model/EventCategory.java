package com.deepansh.memory.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum EventCategory {
    READ("read"),
    SEARCH("search"),
    EDIT("edit"),
    EXECUTE("execute"),
    AGENT("agent"),
    OTHER("other");

    private final String value;

    EventCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static EventCategory fromValue(String value) {
        return Arrays.stream(values())
                .filter(c -> c.value.equals(value))
                .findFirst()
                .orElse(OTHER);
    }
}
