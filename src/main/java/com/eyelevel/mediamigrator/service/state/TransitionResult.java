package com.eyelevel.mediamigrator.service.state;

/**
 * Outcome of a compare-and-set phase transition.
 */
public enum TransitionResult {
    SUCCESS,
    /**
     * The record exists but is no longer in the expected phase; another writer moved it first.
     */
    CONFLICT,
    NOT_FOUND;

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
