package com.eyelevel.mediamigrator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.ColumnDefault;

import java.time.LocalDateTime;

/**
 * Persisted failure bookkeeping of an archive or media item, so retry budgets survive a restart.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryRecord {

    @Enumerated(EnumType.STRING)
    @Column(name = "retry_failure_kind", length = 32)
    private FailureKind failureKind;

    @ColumnDefault("0")
    @Column(name = "retry_attempts", nullable = false)
    private int attempts;

    @Column(name = "retry_next_eligible_at")
    private LocalDateTime nextEligibleAt;

    @Column(name = "retry_last_error", columnDefinition = "TEXT")
    private String lastError;

    /**
     * The phase the unit returns to when it is retried, i.e. the last phase durably reached before the failure.
     */
    @Column(name = "retry_failed_in_phase", length = 32)
    private String failedInPhase;

    /**
     * When the unit last became FAILED; {@code null} while it is retryable.
     */
    @Column(name = "retry_failed_at")
    private LocalDateTime failedAt;

    public static RetryRecord clean() {
        return new RetryRecord();
    }
}
