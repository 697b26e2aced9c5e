package com.eyelevel.mediamigrator.exception;

import java.io.Serial;

/**
 * A base exception for errors raised by the migration pipeline.
 */
public class MigrationException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 5083427709212861932L;

    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
