package com.eyelevel.mediamigrator.exception;

import java.io.Serial;

/**
 * The bytes of an archive or media file are unreadable. Retrying with the same bytes is pointless.
 */
public class CorruptInputException extends MigrationException {
    @Serial
    private static final long serialVersionUID = -2297461520384412093L;

    public CorruptInputException(String message) {
        super(message);
    }

    public CorruptInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
