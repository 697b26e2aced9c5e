package com.eyelevel.mediamigrator.exception;

import java.io.Serial;

/**
 * The local filesystem ran out of space while writing. Work is deferred, not failed.
 */
public class InsufficientDiskSpaceException extends MigrationException {
    @Serial
    private static final long serialVersionUID = 7730861149927065502L;

    public InsufficientDiskSpaceException(String message) {
        super(message);
    }

    public InsufficientDiskSpaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
