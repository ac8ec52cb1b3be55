package com.deepansh.memory.store;

import java.util.List;

/**
 * One numbered schema step: a self-contained batch of idempotent statements.
 * Once a version is logged in schema_version its statements must never change.
 */
public record Migration(int version, String description, List<String> statements) {

    public Migration {
        if (version < 1) {
            throw new IllegalArgumentException("Migration version must be >= 1, got " + version);
        }
        statements = List.copyOf(statements);
    }

    public static Migration of(int version, String description, String... statements) {
        return new Migration(version, description, List.of(statements));
    }
}
