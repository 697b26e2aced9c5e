package com.eyelevel.mediamigrator.exception;

import java.io.Serial;

/**
 * A concurrent writer changed the target record before the requested transition could be applied.
 */
public class ConflictException extends MigrationException {
    @Serial
    private static final long serialVersionUID = 6618845503126474290L;

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
