package com.deepansh.memory.context;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MatchType {
    EXACT("exact"),
    TITLE("title");

    private final String value;

    MatchType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
