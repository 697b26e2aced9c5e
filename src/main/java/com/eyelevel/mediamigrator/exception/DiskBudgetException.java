package com.eyelevel.mediamigrator.exception;

import java.io.Serial;

/**
 * Disk usage could not be measured, so no admission decision can be trusted. Fatal to the run.
 */
public class DiskBudgetException extends MigrationException {
    @Serial
    private static final long serialVersionUID = 1954017752203389167L;

    public DiskBudgetException(String message) {
        super(message);
    }

    public DiskBudgetException(String message, Throwable cause) {
        super(message, cause);
    }
}
