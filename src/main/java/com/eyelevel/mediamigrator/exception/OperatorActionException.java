package com.eyelevel.mediamigrator.exception;

import java.io.Serial;

/**
 * An operator request is not valid for the current state of the target unit or run.
 */
public class OperatorActionException extends MigrationException {
    @Serial
    private static final long serialVersionUID = 8842330175526009031L;

    public OperatorActionException(String message) {
        super(message);
    }

    public OperatorActionException(String message, Throwable cause) {
        super(message, cause);
    }
}
