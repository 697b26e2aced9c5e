package com.eyelevel.mediamigrator.service.retry;

import com.eyelevel.mediamigrator.config.MigrationProperties;
import com.eyelevel.mediamigrator.model.FailureKind;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Jittered exponential back-off with a hard attempt budget.
 * <p>
 * The delay before attempt {@code n + 1} is {@code initialDelay * multiplier^(n - 1)}, capped at {@code maxDelay},
 * then spread by {@code ±jitter} of itself and capped again.
 */
@Component
public class BackoffPolicy {

    private final MigrationProperties.Retry config;
    private final DoubleSupplier random;

    @Autowired
    public BackoffPolicy(MigrationProperties properties) {
        this(properties.getRetry(), () -> ThreadLocalRandom.current().nextDouble());
    }

    BackoffPolicy(MigrationProperties.Retry config, DoubleSupplier random) {
        this.config = config;
        this.random = random;
    }

    /**
     * @param kind     classification of the failure
     * @param attempts attempts made so far, including the one that just failed
     */
    public RetryDecision decide(FailureKind kind, int attempts) {
        return switch (kind) {
            case TRANSIENT -> attempts >= config.getMaxAttempts()
                              ? new RetryDecision(FailureKind.PERMANENT, RetryDecision.Action.FAIL, Duration.ZERO,
                                                  attempts)
                              : new RetryDecision(FailureKind.TRANSIENT, RetryDecision.Action.RETRY,
                                                  delayFor(attempts), attempts);
            case RESOURCE_EXHAUSTED -> new RetryDecision(kind, RetryDecision.Action.DEFER,
                                                         Duration.ofMillis(config.getInitialDelayMs()),
                                                         Math.max(0, attempts - 1));
            case CORRUPT_INPUT -> new RetryDecision(kind, RetryDecision.Action.QUARANTINE, Duration.ZERO, attempts);
            case PERMANENT -> new RetryDecision(kind, RetryDecision.Action.FAIL, Duration.ZERO, attempts);
        };
    }

    Duration delayFor(int attempt) {
        double base = config.getInitialDelayMs() * Math.pow(config.getMultiplier(), Math.max(0, attempt - 1));
        double capped = Math.min(base, config.getMaxDelayMs());
        double jitter = Math.min(1.0, Math.max(0.0, config.getJitter()));
        double spread = capped * jitter * (2.0 * random.getAsDouble() - 1.0);
        long millis = (long) Math.min(config.getMaxDelayMs(), Math.max(0.0, capped + spread));
        return Duration.ofMillis(millis);
    }
}
