package com.deepansh.memory.store;

/**
 * Fatal store initialization failure: a gap in the migration sequence or a
 * migration that could not be applied. The store must not be used afterwards.
 */
public class SchemaMigrationException extends RuntimeException {

    public SchemaMigrationException(String message) {
        super(message);
    }

    public SchemaMigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
