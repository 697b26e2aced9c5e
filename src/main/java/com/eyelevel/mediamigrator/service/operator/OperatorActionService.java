package com.eyelevel.mediamigrator.service.operator;

import com.eyelevel.mediamigrator.dto.report.MigrationReport;
import com.eyelevel.mediamigrator.dto.run.RunStatusResponse;
import com.eyelevel.mediamigrator.dto.run.UnitActionResponse;
import com.eyelevel.mediamigrator.exception.ConflictException;
import com.eyelevel.mediamigrator.exception.NotFoundException;
import com.eyelevel.mediamigrator.exception.OperatorActionException;
import com.eyelevel.mediamigrator.model.ArchivePhase;
import com.eyelevel.mediamigrator.model.ArchiveUnit;
import com.eyelevel.mediamigrator.model.MediaItem;
import com.eyelevel.mediamigrator.model.MediaPhase;
import com.eyelevel.mediamigrator.model.RetryRecord;
import com.eyelevel.mediamigrator.model.RunStatus;
import com.eyelevel.mediamigrator.service.cleanup.ArchiveCleanupService;
import com.eyelevel.mediamigrator.service.disk.DiskBudgetGovernor;
import com.eyelevel.mediamigrator.service.orchestrator.PipelineOrchestrator;
import com.eyelevel.mediamigrator.service.orchestrator.RunLifecycleService;
import com.eyelevel.mediamigrator.service.orchestrator.RunState;
import com.eyelevel.mediamigrator.service.report.MigrationReportService;
import com.eyelevel.mediamigrator.service.state.StateStore;
import com.eyelevel.mediamigrator.service.state.TransitionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Decisions the pipeline leaves to a human: run control and the fate of failed or corrupted units.
 * <p>
 * Every unit action is a compare-and-set from the phase the operator saw. If a worker or another request moved
 * the unit first, the action is rejected with a {@link ConflictException} instead of being applied on top.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OperatorActionService {

    private static final Set<ArchivePhase> SKIPPABLE_ARCHIVE_PHASES = EnumSet.of(ArchivePhase.CORRUPTED,
                                                                                 ArchivePhase.FAILED);

    private final RunLifecycleService runLifecycleService;
    private final PipelineOrchestrator pipelineOrchestrator;
    private final StateStore stateStore;
    private final ArchiveCleanupService archiveCleanupService;
    private final DiskBudgetGovernor diskBudgetGovernor;
    private final MigrationReportService reportService;
    private final Clock clock;

    //<editor-fold desc="Run control">

    public RunStatusResponse start() {
        return toResponse(runLifecycleService.startOrResume());
    }

    public RunStatusResponse status() {
        return toResponse(runLifecycleService.latest()
                                             .orElseThrow(() -> new NotFoundException(
                                                     "No migration run has been started yet.")));
    }

    /**
     * Resumes a run paused by the failure threshold, accepting every item failed since the run started or last
     * proceeded.
     */
    public RunStatusResponse proceed() {
        RunState run = requireActiveRun();
        if (!run.is(RunStatus.PAUSED_FOR_RETRIES)) {
            throw new OperatorActionException("Run #" + run.runId() + " is " + run.status()
                                              + "; only a run paused for retries can proceed.");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        long failed = stateStore.countItemsFailedSince(run.failureWindowStart());
        if (!runLifecycleService.proceed(run.runId(), failed, now)) {
            throw new ConflictException("Run #" + run.runId() + " changed status before it could proceed.");
        }
        return toResponse(runLifecycleService.refresh(run.runId()));
    }

    public RunStatusResponse stop() {
        RunState run = requireActiveRun();
        if (run.is(RunStatus.STOPPING)) {
            return toResponse(run);
        }
        if (!runLifecycleService.requestStop(run.runId())) {
            throw new ConflictException("Run #" + run.runId() + " changed status before it could be stopped.");
        }
        return toResponse(runLifecycleService.refresh(run.runId()));
    }

    public RunStatusResponse discover() {
        RunState run = requireActiveRun();
        if (run.is(RunStatus.STOPPING)) {
            throw new OperatorActionException("Run #" + run.runId() + " is stopping; nothing new is admitted.");
        }
        pipelineOrchestrator.discover(run);
        return toResponse(runLifecycleService.refresh(run.runId()));
    }

    public MigrationReport report() {
        return reportService.build(runLifecycleService.latest().orElse(null));
    }
    //</editor-fold>

    //<editor-fold desc="Media items">

    /**
     * Sends a {@code FAILED} item back to the last phase it reached, with a fresh retry budget.
     */
    public UnitActionResponse retryItem(String itemId) {
        MediaItem item = requireItemIn(itemId, MediaPhase.FAILED);
        MediaPhase target = resumePhaseOf(item);
        TransitionResult result = stateStore.updateItem(itemId, MediaPhase.FAILED, failed -> {
            failed.setPhase(target);
            failed.setRetry(RetryRecord.clean());
        });
        requireApplied(result, "Item " + itemId);
        log.info("[{}] Operator retry: FAILED -> {}.", itemId, target);
        return new UnitActionResponse(itemId, target.name());
    }

    public UnitActionResponse skipItem(String itemId) {
        requireItemIn(itemId, MediaPhase.FAILED);
        requireApplied(stateStore.transitionItem(itemId, MediaPhase.FAILED, MediaPhase.SKIPPED), "Item " + itemId);
        log.info("[{}] Operator skip: FAILED -> SKIPPED.", itemId);
        return new UnitActionResponse(itemId, MediaPhase.SKIPPED.name());
    }
    //</editor-fold>

    //<editor-fold desc="Archives">

    /**
     * Discards the local copy of a {@code CORRUPTED} archive and queues it for a fresh download.
     */
    public UnitActionResponse reacquireArchive(String archiveId) {
        ArchiveUnit archive = requireArchive(archiveId);
        if (archive.getPhase() != ArchivePhase.CORRUPTED) {
            throw new OperatorActionException("Archive " + archiveId + " is " + archive.getPhase()
                                              + "; only a corrupted archive can be re-acquired.");
        }
        try {
            archiveCleanupService.deleteLocalCopies(archive);
        } catch (IOException e) {
            throw new OperatorActionException("Could not delete the local copy of archive " + archiveId + ": "
                                              + e.getMessage(), e);
        }
        TransitionResult result = stateStore.updateArchive(archiveId, ArchivePhase.CORRUPTED, corrupted -> {
            corrupted.setPhase(ArchivePhase.DISCOVERED);
            corrupted.setLocalPath(null);
            corrupted.setExtractedPath(null);
            corrupted.setContentFingerprint(null);
            corrupted.setRetry(RetryRecord.clean());
        });
        requireApplied(result, "Archive " + archiveId);
        log.info("[{}] Operator re-acquire: CORRUPTED -> DISCOVERED.", archiveId);
        return new UnitActionResponse(archiveId, ArchivePhase.DISCOVERED.name());
    }

    /**
     * Gives up on a corrupted or failed archive. Its items that are not yet terminal are skipped with it.
     */
    public UnitActionResponse skipArchive(String archiveId) {
        ArchiveUnit archive = requireArchive(archiveId);
        if (!SKIPPABLE_ARCHIVE_PHASES.contains(archive.getPhase())) {
            throw new OperatorActionException("Archive " + archiveId + " is " + archive.getPhase()
                                              + "; only a corrupted or failed archive can be skipped.");
        }
        requireApplied(stateStore.transitionArchive(archiveId, archive.getPhase(), ArchivePhase.SKIPPED),
                       "Archive " + archiveId);

        int skippedItems = 0;
        for (MediaItem item : stateStore.findItemsOfArchive(archiveId)) {
            if (!item.getPhase().isTerminal() && !MediaPhase.IN_FLIGHT.contains(item.getPhase())
                && stateStore.transitionItem(item.getId(), item.getPhase(), MediaPhase.SKIPPED)
                   == TransitionResult.SUCCESS) {
                skippedItems++;
            }
        }
        try {
            archiveCleanupService.deleteLocalCopies(archive);
        } catch (IOException e) {
            log.warn("[{}] Skipped archive's local files could not be removed: {}", archiveId, e.getMessage());
        }
        log.info("[{}] Operator skip: {} -> SKIPPED ({} item(s) skipped).", archiveId, archive.getPhase(),
                 skippedItems);
        return new UnitActionResponse(archiveId, ArchivePhase.SKIPPED.name());
    }

    /**
     * Sends a {@code FAILED} archive back to the last phase it reached, with a fresh retry budget.
     */
    public UnitActionResponse retryArchive(String archiveId) {
        ArchiveUnit archive = requireArchive(archiveId);
        if (archive.getPhase() != ArchivePhase.FAILED) {
            throw new OperatorActionException("Archive " + archiveId + " is " + archive.getPhase()
                                              + "; only a failed archive can be retried.");
        }
        ArchivePhase target = resumePhaseOf(archive);
        TransitionResult result = stateStore.updateArchive(archiveId, ArchivePhase.FAILED, failed -> {
            failed.setPhase(target);
            failed.setRetry(RetryRecord.clean());
        });
        requireApplied(result, "Archive " + archiveId);
        log.info("[{}] Operator retry: FAILED -> {}.", archiveId, target);
        return new UnitActionResponse(archiveId, target.name());
    }
    //</editor-fold>

    //<editor-fold desc="Private Helper Methods">

    private RunState requireActiveRun() {
        return runLifecycleService.current()
                                  .orElseThrow(() -> new OperatorActionException("No migration run is active."));
    }

    private MediaItem requireItemIn(String itemId, MediaPhase expected) {
        MediaItem item = stateStore.findItem(itemId)
                                   .orElseThrow(() -> new NotFoundException("Media item not found: " + itemId));
        if (item.getPhase() != expected) {
            throw new OperatorActionException("Item " + itemId + " is " + item.getPhase() + ", not " + expected + ".");
        }
        return item;
    }

    private ArchiveUnit requireArchive(String archiveId) {
        return stateStore.findArchive(archiveId)
                         .orElseThrow(() -> new NotFoundException("Archive not found: " + archiveId));
    }

    private static void requireApplied(TransitionResult result, String subject) {
        if (result == TransitionResult.NOT_FOUND) {
            throw new NotFoundException(subject + " no longer exists.");
        }
        if (result != TransitionResult.SUCCESS) {
            throw new ConflictException(subject + " was changed concurrently; reload and try again.");
        }
    }

    private static MediaPhase resumePhaseOf(MediaItem item) {
        String failedIn = item.getRetry().getFailedInPhase();
        if (failedIn == null) {
            return MediaPhase.EXTRACTED;
        }
        MediaPhase phase = MediaPhase.valueOf(failedIn);
        return phase.isTerminal() || MediaPhase.IN_FLIGHT.contains(phase) ? MediaPhase.EXTRACTED : phase;
    }

    private static ArchivePhase resumePhaseOf(ArchiveUnit archive) {
        String failedIn = archive.getRetry().getFailedInPhase();
        if (failedIn == null) {
            return ArchivePhase.DISCOVERED;
        }
        ArchivePhase phase = ArchivePhase.valueOf(failedIn);
        return ArchivePhase.PENDING.contains(phase) && !phase.isInFlight() ? phase : ArchivePhase.DISCOVERED;
    }

    private RunStatusResponse toResponse(RunState run) {
        return RunStatusResponse.builder()
                                .runId(run.runId())
                                .status(run.status())
                                .statusReason(run.statusReason())
                                .discoveryCompleted(run.discoveryCompleted())
                                .acknowledgedFailures(run.acknowledgedFailures())
                                .startedAt(run.startedAt())
                                .finishedAt(run.finishedAt())
                                .archivesByPhase(stateStore.countArchivesByPhase())
                                .itemsByPhase(stateStore.countItemsByPhase())
                                .diskBudget(diskBudgetGovernor.snapshot())
                                .build();
    }
    //</editor-fold>
}
