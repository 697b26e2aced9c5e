package com.eyelevel.mediamigrator.service.orchestrator;

import com.eyelevel.mediamigrator.collaborator.source.ArchiveSource;
import com.eyelevel.mediamigrator.collaborator.source.RemoteArchive;
import com.eyelevel.mediamigrator.config.MigrationProperties;
import com.eyelevel.mediamigrator.exception.DiskBudgetException;
import com.eyelevel.mediamigrator.exception.PermanentCollaboratorException;
import com.eyelevel.mediamigrator.exception.StateStoreException;
import com.eyelevel.mediamigrator.exception.TransientCollaboratorException;
import com.eyelevel.mediamigrator.model.ArchivePhase;
import com.eyelevel.mediamigrator.model.ArchiveUnit;
import com.eyelevel.mediamigrator.model.MediaItem;
import com.eyelevel.mediamigrator.model.MediaPhase;
import com.eyelevel.mediamigrator.model.RunStatus;
import com.eyelevel.mediamigrator.service.cleanup.ArchiveCleanupService;
import com.eyelevel.mediamigrator.service.disk.Admission;
import com.eyelevel.mediamigrator.service.disk.DiskBudgetGovernor;
import com.eyelevel.mediamigrator.service.disk.DiskReservation;
import com.eyelevel.mediamigrator.service.report.MigrationReportService;
import com.eyelevel.mediamigrator.service.state.StateStore;
import com.eyelevel.mediamigrator.service.state.TransitionResult;
import com.eyelevel.mediamigrator.worker.AlbumResolveWorker;
import com.eyelevel.mediamigrator.worker.DownloadWorker;
import com.eyelevel.mediamigrator.worker.ExtractWorker;
import com.eyelevel.mediamigrator.worker.InfrastructureFaultLatch;
import com.eyelevel.mediamigrator.worker.MetadataMergeWorker;
import com.eyelevel.mediamigrator.worker.PhaseWorker;
import com.eyelevel.mediamigrator.worker.UploadWorker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Drives every archive and media item through the pipeline, one {@link #step} at a time.
 * <p>
 * A step never blocks on a unit's work: it dispatches claimed units to the per-phase pools and returns. Everything
 * it decides is re-derived from the State Store on the next step, so the orchestrator holds no state between
 * steps other than the run it is handed.
 */
@Slf4j
@Service
public class PipelineOrchestrator {

    private final RunLifecycleService runLifecycleService;
    private final StateStore stateStore;
    private final ArchiveSource archiveSource;
    private final DiskBudgetGovernor diskBudgetGovernor;
    private final ArchiveCleanupService archiveCleanupService;
    private final MigrationReportService reportService;
    private final InfrastructureFaultLatch faultLatch;
    private final AlbumResolveWorker albumResolveWorker;
    private final MigrationProperties.Orchestrator config;
    private final List<PhaseWorker<?, ?>> pooledWorkers;

    public PipelineOrchestrator(RunLifecycleService runLifecycleService,
                                StateStore stateStore,
                                ArchiveSource archiveSource,
                                DiskBudgetGovernor diskBudgetGovernor,
                                ArchiveCleanupService archiveCleanupService,
                                MigrationReportService reportService,
                                InfrastructureFaultLatch faultLatch,
                                DownloadWorker downloadWorker,
                                ExtractWorker extractWorker,
                                MetadataMergeWorker metadataMergeWorker,
                                UploadWorker uploadWorker,
                                AlbumResolveWorker albumResolveWorker,
                                MigrationProperties properties) {
        this.runLifecycleService = runLifecycleService;
        this.stateStore = stateStore;
        this.archiveSource = archiveSource;
        this.diskBudgetGovernor = diskBudgetGovernor;
        this.archiveCleanupService = archiveCleanupService;
        this.reportService = reportService;
        this.faultLatch = faultLatch;
        this.albumResolveWorker = albumResolveWorker;
        this.config = properties.getOrchestrator();
        // Downstream phases first, so finishing items frees disk before new archives claim it.
        this.pooledWorkers = List.of(uploadWorker, metadataMergeWorker, extractWorker, downloadWorker);
    }

    /**
     * Performs one orchestration cycle for {@code run} and returns the run as it stands afterwards.
     *
     * @throws StateStoreException  if the State Store fails; the run is stopped first.
     * @throws DiskBudgetException  if disk usage can no longer be measured; the run is stopped first.
     */
    public synchronized RunState step(RunState run) {
        if (run == null || !run.isActive()) {
            return run;
        }
        try {
            Optional<RuntimeException> fault = faultLatch.take();
            if (fault.isPresent()) {
                throw fault.get();
            }
            if (run.is(RunStatus.STOPPING)) {
                return finishStopping(run);
            }

            if (!run.discoveryCompleted() && !discover(run)) {
                return runLifecycleService.refresh(run.runId());
            }

            boolean deferred = false;
            for (PhaseWorker<?, ?> worker : pooledWorkers) {
                deferred |= dispatch(worker);
            }
            resolvePendingAlbums();
            completeArchives();

            RunState current = runLifecycleService.refresh(run.runId());
            if (current.is(RunStatus.RUNNING)) {
                current = checkFailureThreshold(current);
            }
            if (current.is(RunStatus.RUNNING) && config.isCleanupAfterUpload()) {
                cleanUp(deferred);
            }
            if (current.is(RunStatus.RUNNING) && isFinished(current)) {
                if (runLifecycleService.complete(current.runId())) {
                    current = runLifecycleService.refresh(current.runId());
                    log.info("Migration run #{} completed.", current.runId());
                    reportService.writeReport(current);
                }
            }
            return current;
        } catch (StateStoreException | DiskBudgetException | DataAccessException e) {
            log.error("CRITICAL: Infrastructure fault during step of run #{}; stopping the run.", run.runId(), e);
            abortQuietly(run, "Infrastructure fault: " + e.getMessage());
            throw e;
        }
    }

    /**
     * Lists the archive source and records every archive not seen before as {@code DISCOVERED}.
     *
     * @return {@code false} if listing failed transiently and should be attempted again on the next step.
     */
    public synchronized boolean discover(RunState run) {
        List<RemoteArchive> available;
        try {
            available = archiveSource.listAvailable();
        } catch (TransientCollaboratorException e) {
            log.warn("Archive source could not be listed, will retry on the next step: {}", e.getMessage());
            return false;
        } catch (PermanentCollaboratorException e) {
            log.error("Archive source cannot be listed: {}", e.getMessage());
            if (runLifecycleService.abort(run.runId(), "Archive source unavailable: " + e.getMessage())) {
                reportService.writeReport(runLifecycleService.refresh(run.runId()));
            }
            return false;
        }

        int registered = 0;
        for (RemoteArchive archive : available) {
            if (stateStore.registerDiscovered(archive.id(), archive.name(), archive.size())) {
                log.info("[{}] Discovered archive '{}' ({} bytes).", archive.id(), archive.name(), archive.size());
                registered++;
            }
        }
        runLifecycleService.markDiscoveryCompleted(run.runId());
        log.info("Discovery finished: {} archive(s) listed, {} new.", available.size(), registered);
        return true;
    }

    /**
     * Moves every unit left in an in-flight phase by an interrupted process back to its last durable phase.
     * Must run before any worker is started.
     *
     * @return the number of units reset.
     */
    public synchronized int recoverInFlight() {
        int reset = stateStore.resetArchives(ArchivePhase.DOWNLOADING, ArchivePhase.DISCOVERED)
                    + stateStore.resetArchives(ArchivePhase.EXTRACTING, ArchivePhase.DOWNLOADED)
                    + stateStore.resetItems(MediaPhase.MERGING_METADATA, MediaPhase.EXTRACTED)
                    + stateStore.resetItems(MediaPhase.UPLOADING, MediaPhase.ALBUM_RESOLVED);
        if (reset > 0) {
            log.warn("Recovered {} unit(s) left in flight by a previous process.", reset);
        } else {
            log.info("No in-flight units to recover.");
        }
        return reset;
    }

    /**
     * Hands as many eligible units to {@code worker} as its pool and the disk budget allow.
     *
     * @return {@code true} if an admission was deferred for lack of disk space.
     */
    private <U> boolean dispatch(PhaseWorker<U, ?> worker) {
        long freeSlots = worker.capacity() - worker.inFlightCount();
        if (freeSlots <= 0) {
            return false;
        }
        List<U> candidates = worker.findCandidates((int) Math.min(freeSlots, config.getPageSize()));
        for (U unit : candidates) {
            String unitId = worker.unitId(unit);
            long estimate = worker.estimateBytes(unit);
            if (estimate > 0 && !diskBudgetGovernor.canEverFit(estimate)) {
                log.error("[{}] {} needs {} bytes, more than the whole disk budget.", unitId, worker.phaseName(),
                          estimate);
                worker.rejectOversized(unit, estimate);
                continue;
            }
            DiskReservation reservation = null;
            if (estimate > 0) {
                Admission admission = diskBudgetGovernor.admit(estimate, worker.phaseName() + " " + unitId);
                if (!admission.isAdmitted()) {
                    return true;
                }
                reservation = admission.reservation();
            }
            if (worker.claim(unit) != TransitionResult.SUCCESS) {
                log.debug("[{}] Lost the claim for {}.", unitId, worker.phaseName());
                diskBudgetGovernor.release(reservation, 0L);
                continue;
            }
            DiskReservation admitted = reservation;
            try {
                worker.executor().execute(() -> worker.execute(unit, admitted));
            } catch (TaskRejectedException e) {
                log.warn("[{}] {} pool rejected the unit; it will be dispatched again.", unitId, worker.phaseName());
                worker.releaseClaim(unit);
                diskBudgetGovernor.release(admitted, 0L);
                return false;
            }
        }
        return false;
    }

    private void resolvePendingAlbums() {
        for (MediaItem item : albumResolveWorker.findCandidates(config.getPageSize())) {
            albumResolveWorker.process(item);
        }
    }

    private void completeArchives() {
        Iterator<ArchiveUnit> extracted = stateStore.streamArchivesByPhase(ArchivePhase.EXTRACTED,
                                                                           config.getPageSize()).iterator();
        while (extracted.hasNext()) {
            ArchiveUnit archive = extracted.next();
            if (stateStore.countItemsOfArchiveIn(archive.getId(), MediaPhase.NON_TERMINAL) == 0
                && stateStore.transitionArchive(archive.getId(), ArchivePhase.EXTRACTED, ArchivePhase.PROCESSED)
                   == TransitionResult.SUCCESS) {
                log.info("[{}] Every item is terminal; archive processed.", archive.getId());
            }
        }
    }

    private RunState checkFailureThreshold(RunState run) {
        long terminal = stateStore.countItemsIn(MediaPhase.TERMINAL);
        if (terminal < config.getMinItemsForThreshold()) {
            return run;
        }
        long unacknowledged = stateStore.countItemsFailedSince(run.failureWindowStart());
        double failureRate = (double) unacknowledged / terminal;
        if (failureRate <= config.getFailureThreshold()) {
            return run;
        }
        String reason = String.format("%d of %d finished items failed (%.1f%% > %.1f%%); review and proceed.",
                                      unacknowledged, terminal, failureRate * 100, config.getFailureThreshold() * 100);
        if (!runLifecycleService.pause(run.runId(), reason)) {
            return runLifecycleService.refresh(run.runId());
        }
        log.warn("Run #{} paused for retries: {}", run.runId(), reason);
        RunState paused = runLifecycleService.refresh(run.runId());
        reportService.writeReport(paused);
        return paused;
    }

    private void cleanUp(boolean deferred) {
        archiveCleanupService.cleanEligibleArchives(config.getPageSize());
        if (deferred && diskBudgetGovernor.cleanupThresholdCrossed()) {
            log.warn("Disk budget below the cleanup threshold; removing files of uploaded items.");
            archiveCleanupService.pruneUploadedItems(config.getPageSize());
        }
    }

    private boolean isFinished(RunState run) {
        return run.discoveryCompleted()
               && stateStore.countArchivesIn(ArchivePhase.PENDING) == 0
               && stateStore.countItemsIn(MediaPhase.NON_TERMINAL) == 0;
    }

    private RunState finishStopping(RunState run) {
        long inFlight = 0L;
        for (PhaseWorker<?, ?> worker : pooledWorkers) {
            inFlight += worker.inFlightCount();
        }
        if (inFlight > 0) {
            log.info("Run #{} stopping; waiting for {} unit(s) in flight.", run.runId(), inFlight);
            return run;
        }
        if (runLifecycleService.markStopped(run.runId(), run.statusReason())) {
            RunState stopped = runLifecycleService.refresh(run.runId());
            reportService.writeReport(stopped);
            return stopped;
        }
        return runLifecycleService.refresh(run.runId());
    }

    private void abortQuietly(RunState run, String reason) {
        try {
            if (runLifecycleService.abort(run.runId(), reason)) {
                reportService.writeReport(runLifecycleService.refresh(run.runId()));
            }
        } catch (RuntimeException e) {
            log.error("CRITICAL: Could not record the stop of run #{}.", run.runId(), e);
        }
    }
}
