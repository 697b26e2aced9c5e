package com.eyelevel.mediamigrator.exception;

import java.io.Serial;

/**
 * The durable State Store cannot be read or written. Fatal to the run.
 */
public class StateStoreException extends MigrationException {
    @Serial
    private static final long serialVersionUID = -4416752840192711208L;

    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
