package com.eyelevel.mediamigrator.service.retry;

import com.eyelevel.mediamigrator.model.FailureKind;

import java.time.Duration;

/**
 * What to do with a unit after a failure.
 *
 * @param kind     effective classification; a transient failure past its attempt budget becomes PERMANENT
 * @param action   the next step for the unit
 * @param delay    how long to wait before the unit becomes eligible again (zero unless retried or deferred)
 * @param attempts attempts counted against the retry budget after this failure
 */
public record RetryDecision(FailureKind kind, Action action, Duration delay, int attempts) {

    public enum Action {
        /**
         * Return to the last durable phase and try again after {@code delay}.
         */
        RETRY,
        /**
         * Resources were short; try again later without spending an attempt.
         */
        DEFER,
        /**
         * Give up; the unit is failed until an operator retries it.
         */
        FAIL,
        /**
         * Input bytes are bad; the unit needs re-acquisition or an operator skip.
         */
        QUARANTINE
    }

    public boolean isRetryable() {
        return action == Action.RETRY || action == Action.DEFER;
    }
}
