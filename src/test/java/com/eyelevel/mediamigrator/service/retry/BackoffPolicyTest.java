package com.eyelevel.mediamigrator.service.retry;

import com.eyelevel.mediamigrator.config.MigrationProperties;
import com.eyelevel.mediamigrator.model.FailureKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class BackoffPolicyTest {

    private MigrationProperties.Retry config;

    @BeforeEach
    void setUp() {
        config = new MigrationProperties.Retry();
        config.setMaxAttempts(3);
        config.setInitialDelayMs(1_000);
        config.setMultiplier(2.0);
        config.setMaxDelayMs(5_000);
        config.setJitter(0.0);
    }

    @Test
    void delayGrowsExponentiallyUpToTheCap() {
        BackoffPolicy policy = new BackoffPolicy(config, () -> 0.5);

        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofMillis(1_000));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofMillis(2_000));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofMillis(4_000));
        assertThat(policy.delayFor(4)).isEqualTo(Duration.ofMillis(5_000));
        assertThat(policy.delayFor(10)).isEqualTo(Duration.ofMillis(5_000));
    }

    @Test
    void jitterSpreadsTheDelayButNeverExceedsTheCap() {
        config.setJitter(0.5);

        assertThat(new BackoffPolicy(config, () -> 0.0).delayFor(1)).isEqualTo(Duration.ofMillis(500));
        assertThat(new BackoffPolicy(config, () -> 1.0).delayFor(1)).isEqualTo(Duration.ofMillis(1_500));
        assertThat(new BackoffPolicy(config, () -> 1.0).delayFor(4)).isEqualTo(Duration.ofMillis(5_000));
    }

    @Test
    void transientFailureIsRetriedUntilTheBudgetIsSpent() {
        BackoffPolicy policy = new BackoffPolicy(config, () -> 0.5);

        RetryDecision second = policy.decide(FailureKind.TRANSIENT, 2);
        assertThat(second.action()).isEqualTo(RetryDecision.Action.RETRY);
        assertThat(second.kind()).isEqualTo(FailureKind.TRANSIENT);
        assertThat(second.delay()).isEqualTo(Duration.ofMillis(2_000));

        RetryDecision exhausted = policy.decide(FailureKind.TRANSIENT, 3);
        assertThat(exhausted.action()).isEqualTo(RetryDecision.Action.FAIL);
        assertThat(exhausted.kind()).isEqualTo(FailureKind.PERMANENT);
        assertThat(exhausted.isRetryable()).isFalse();
    }

    @Test
    void resourceExhaustionIsDeferredWithoutChargingAnAttempt() {
        RetryDecision decision = new BackoffPolicy(config, () -> 0.5).decide(FailureKind.RESOURCE_EXHAUSTED, 3);

        assertThat(decision.action()).isEqualTo(RetryDecision.Action.DEFER);
        assertThat(decision.attempts()).isEqualTo(2);
        assertThat(decision.isRetryable()).isTrue();
    }

    @Test
    void corruptInputIsQuarantinedAndPermanentFails() {
        BackoffPolicy policy = new BackoffPolicy(config, () -> 0.5);

        assertThat(policy.decide(FailureKind.CORRUPT_INPUT, 1).action()).isEqualTo(RetryDecision.Action.QUARANTINE);
        assertThat(policy.decide(FailureKind.PERMANENT, 1).action()).isEqualTo(RetryDecision.Action.FAIL);
    }
}
