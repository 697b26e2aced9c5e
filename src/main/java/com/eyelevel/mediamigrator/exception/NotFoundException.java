package com.eyelevel.mediamigrator.exception;

import java.io.Serial;

/**
 * An operator request named an archive, item or run that does not exist.
 */
public class NotFoundException extends MigrationException {
    @Serial
    private static final long serialVersionUID = -3150962818863712944L;

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
