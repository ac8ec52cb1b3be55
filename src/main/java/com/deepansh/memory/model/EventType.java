package com.deepansh.memory.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Closed set of session event types. Each type maps to exactly one category.
 */
public enum EventType {
    FILE_READ("file_read", EventCategory.READ),
    FILE_WRITE("file_write", EventCategory.EDIT),
    FILE_EDIT("file_edit", EventCategory.EDIT),
    TOOL_CALL("tool_call", EventCategory.EXECUTE),
    DECISION("decision", EventCategory.OTHER),
    PATTERN("pattern", EventCategory.OTHER),
    ERROR_RESOLVED("error_resolved", EventCategory.OTHER),
    MILESTONE("milestone", EventCategory.OTHER);

    private final String value;
    private final EventCategory category;

    EventType(String value, EventCategory category) {
        this.value = value;
        this.category = category;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public EventCategory category() {
        return category;
    }

    public static EventType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + value));
    }
}
