package com.eyelevel.mediamigrator.exception;

import java.io.Serial;

/**
 * An external collaborator rejected the unit; repeating the same call will not help.
 */
public class PermanentCollaboratorException extends MigrationException {
    @Serial
    private static final long serialVersionUID = 3412209988151240556L;

    public PermanentCollaboratorException(String message) {
        super(message);
    }

    public PermanentCollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
