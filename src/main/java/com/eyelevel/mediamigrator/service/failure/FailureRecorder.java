package com.eyelevel.mediamigrator.service.failure;

import com.eyelevel.mediamigrator.model.ArchivePhase;
import com.eyelevel.mediamigrator.model.FailureKind;
import com.eyelevel.mediamigrator.model.MediaPhase;
import com.eyelevel.mediamigrator.model.RetryRecord;
import com.eyelevel.mediamigrator.service.retry.FailureContext;
import com.eyelevel.mediamigrator.service.retry.RetryClassifier;
import com.eyelevel.mediamigrator.service.retry.RetryDecision;
import com.eyelevel.mediamigrator.service.state.StateStore;
import com.eyelevel.mediamigrator.service.state.TransitionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Records per-unit failures in the State Store.
 * <p>
 * The failure is classified, the retry budget persisted on the unit is charged, and the unit is moved in one
 * compare-and-set: back to its last durable phase with a next-eligible time, or to its failed/corrupted phase.
 * A unit is never failed from a phase other than the one its worker claimed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FailureRecorder {

    private static final int MAX_ERROR_LENGTH = 4000;

    private final StateStore stateStore;
    private final RetryClassifier retryClassifier;
    private final Clock clock;

    /**
     * @param claimedPhase phase the worker holds the archive in
     * @param resumePhase  last durable phase, where a retry starts over
     */
    public RetryDecision recordArchiveFailure(String archiveId, ArchivePhase claimedPhase, ArchivePhase resumePhase,
                                              Throwable error) {
        FailureKind kind = retryClassifier.classify(error, new FailureContext(archiveId, claimedPhase.name()));
        AtomicReference<RetryDecision> decision = new AtomicReference<>();
        TransitionResult result = stateStore.updateArchive(archiveId, claimedPhase, unit -> {
            RetryDecision next = retryClassifier.decide(kind, unit.getRetry().getAttempts() + 1);
            decision.set(next);
            unit.setPhase(switch (next.action()) {
                case RETRY, DEFER -> resumePhase;
                case FAIL -> ArchivePhase.FAILED;
                case QUARANTINE -> ArchivePhase.CORRUPTED;
            });
            unit.setRetry(retryRecord(next, resumePhase.name(), error));
        });
        return report(archiveId, "archive", claimedPhase.name(), result, decision.get(), error);
    }

    public RetryDecision recordItemFailure(String itemId, MediaPhase claimedPhase, MediaPhase resumePhase,
                                           Throwable error) {
        FailureKind kind = retryClassifier.classify(error, new FailureContext(itemId, claimedPhase.name()));
        AtomicReference<RetryDecision> decision = new AtomicReference<>();
        TransitionResult result = stateStore.updateItem(itemId, claimedPhase, item -> {
            RetryDecision next = retryClassifier.decide(kind, item.getRetry().getAttempts() + 1);
            decision.set(next);
            item.setPhase(next.isRetryable() ? resumePhase : MediaPhase.FAILED);
            item.setRetry(retryRecord(next, resumePhase.name(), error));
        });
        return report(itemId, "item", claimedPhase.name(), result, decision.get(), error);
    }

    /**
     * Fails an archive outright with {@code kind}, without charging the retry budget. Used for archives that can
     * never be admitted.
     */
    public void failArchive(String archiveId, ArchivePhase expectedPhase, FailureKind kind, String reason) {
        TransitionResult result = stateStore.updateArchive(archiveId, expectedPhase, unit -> {
            unit.setPhase(ArchivePhase.FAILED);
            RetryRecord retry = unit.getRetry();
            retry.setFailureKind(kind);
            retry.setNextEligibleAt(null);
            retry.setLastError(reason);
            retry.setFailedInPhase(expectedPhase.name());
            retry.setFailedAt(LocalDateTime.now(clock));
        });
        if (result.isSuccess()) {
            log.error("[{}] Archive failed ({}): {}", archiveId, kind, reason);
        } else {
            log.warn("[{}] Could not fail archive from {}: {}", archiveId, expectedPhase, result);
        }
    }

    /**
     * Fails an item outright with {@code kind}, without charging the retry budget.
     */
    public void failItem(String itemId, MediaPhase expectedPhase, FailureKind kind, String reason) {
        TransitionResult result = stateStore.updateItem(itemId, expectedPhase, item -> {
            item.setPhase(MediaPhase.FAILED);
            RetryRecord retry = item.getRetry();
            retry.setFailureKind(kind);
            retry.setNextEligibleAt(null);
            retry.setLastError(reason);
            retry.setFailedInPhase(expectedPhase.name());
            retry.setFailedAt(LocalDateTime.now(clock));
        });
        if (result.isSuccess()) {
            log.error("[{}] Item failed ({}): {}", itemId, kind, reason);
        } else {
            log.warn("[{}] Could not fail item from {}: {}", itemId, expectedPhase, result);
        }
    }

    private RetryRecord retryRecord(RetryDecision decision, String resumePhase, Throwable error) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime nextEligibleAt = decision.isRetryable() ? now.plus(decision.delay()) : null;
        return RetryRecord.builder()
                          .failureKind(decision.kind())
                          .attempts(decision.attempts())
                          .nextEligibleAt(nextEligibleAt)
                          .lastError(describe(error))
                          .failedInPhase(resumePhase)
                          .failedAt(decision.isRetryable() ? null : now)
                          .build();
    }

    private RetryDecision report(String unitId, String unitType, String stage, TransitionResult result,
                                 RetryDecision decision, Throwable error) {
        if (!result.isSuccess() || decision == null) {
            log.warn("[{}] Failure during {} could not be recorded, {} was moved concurrently ({}): {}", unitId,
                     stage, unitType, result, describe(error));
            return decision;
        }
        switch (decision.action()) {
            case RETRY -> log.warn("[{}] {} failed during {} (attempt {}), retrying in {} ms: {}", unitId, unitType,
                                   stage, decision.attempts(), decision.delay().toMillis(), describe(error));
            case DEFER -> log.warn("[{}] {} deferred during {} for {} ms: {}", unitId, unitType, stage,
                                   decision.delay().toMillis(), describe(error));
            case FAIL -> log.error("[{}] {} failed permanently during {} after {} attempt(s): {}", unitId, unitType,
                                   stage, decision.attempts(), describe(error));
            case QUARANTINE -> log.error("[{}] {} has corrupt input, detected during {}: {}", unitId, unitType, stage,
                                         describe(error));
        }
        return decision;
    }

    static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getClass().getSimpleName() + ": " + error.getMessage();
        Throwable cause = error.getCause();
        if (cause != null && cause != error) {
            message += " (caused by " + cause.getClass().getSimpleName() + ": " + cause.getMessage() + ")";
        }
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
