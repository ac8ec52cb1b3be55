package com.deepansh.memory.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Optional;

public enum StatsPeriod {
    DAY("day"),
    WEEK("week"),
    MONTH("month"),
    ALL("all");

    private final String value;

    StatsPeriod(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Start of the window ending at now, empty for ALL. A month is one calendar month in UTC. */
    public Optional<Instant> since(Instant now) {
        return switch (this) {
            case DAY -> Optional.of(now.atOffset(ZoneOffset.UTC).minusDays(1).toInstant());
            case WEEK -> Optional.of(now.atOffset(ZoneOffset.UTC).minusDays(7).toInstant());
            case MONTH -> Optional.of(now.atOffset(ZoneOffset.UTC).minusMonths(1).toInstant());
            case ALL -> Optional.empty();
        };
    }

    /** Null or blank → WEEK. */
    public static StatsPeriod fromValue(String value) {
        if (value == null || value.isBlank()) {
            return WEEK;
        }
        return Arrays.stream(values())
                .filter(p -> p.value.equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown period: " + value + " (expected day, week, month or all)"));
    }
}
