package com.eyelevel.mediamigrator.model;

/**
 * Closed failure taxonomy. Pipeline logic branches only on these values, never on raw exception types.
 */
public enum FailureKind {
    /**
     * Retryable with backoff until the attempt budget is spent.
     */
    TRANSIENT,
    /**
     * Never retried automatically.
     */
    PERMANENT,
    /**
     * The bytes themselves are bad; retrying needs a fresh copy or an operator skip.
     */
    CORRUPT_INPUT,
    /**
     * Not a failure: the work is deferred until resources free up.
     */
    RESOURCE_EXHAUSTED
}
