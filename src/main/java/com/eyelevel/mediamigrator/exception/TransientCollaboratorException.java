package com.eyelevel.mediamigrator.exception;

import java.io.Serial;

/**
 * An external collaborator failed in a way that may succeed on a later attempt (network, timeout, rate limit).
 */
public class TransientCollaboratorException extends MigrationException {
    @Serial
    private static final long serialVersionUID = -6628013940711320761L;

    public TransientCollaboratorException(String message) {
        super(message);
    }

    public TransientCollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
