package com.eyelevel.mediamigrator.service.orchestrator;

import com.eyelevel.mediamigrator.exception.NotFoundException;
import com.eyelevel.mediamigrator.model.MigrationRun;
import com.eyelevel.mediamigrator.model.RunStatus;
import com.eyelevel.mediamigrator.repository.MigrationRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Owns the {@code migration_run} rows. Every status change is a conditional update on the expected status,
 * committed in its own transaction, so the scheduler and operator requests never overwrite each other.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunLifecycleService {

    private static final Set<RunStatus> ACTIVE = EnumSet.of(RunStatus.RUNNING, RunStatus.PAUSED_FOR_RETRIES,
                                                            RunStatus.STOPPING);

    private final MigrationRunRepository migrationRunRepository;
    private final Clock clock;

    /**
     * Returns the active run, or starts a new one when none is active.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public RunState startOrResume() {
        Optional<MigrationRun> active = migrationRunRepository.findFirstByStatusInOrderByIdDesc(ACTIVE);
        if (active.isPresent()) {
            log.info("Resuming migration run #{} in status {}.", active.get().getId(), active.get().getStatus());
            return RunState.of(active.get());
        }
        LocalDateTime now = LocalDateTime.now(clock);
        MigrationRun run = migrationRunRepository.saveAndFlush(MigrationRun.builder()
                                                                           .status(RunStatus.RUNNING)
                                                                           .startedAt(now)
                                                                           .failuresCountedSince(now)
                                                                           .build());
        log.info("Started migration run #{}.", run.getId());
        return RunState.of(run);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public Optional<RunState> current() {
        return migrationRunRepository.findFirstByStatusInOrderByIdDesc(ACTIVE).map(RunState::of);
    }

    /**
     * The active run, or the most recent finished one.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public Optional<RunState> latest() {
        Optional<MigrationRun> active = migrationRunRepository.findFirstByStatusInOrderByIdDesc(ACTIVE);
        return active.or(migrationRunRepository::findFirstByOrderByIdDesc).map(RunState::of);
    }

    /**
     * @return id of the active run, or {@code null} if no run is active.
     */
    public Long currentRunId() {
        return current().map(RunState::runId).orElse(null);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public RunState refresh(Long runId) {
        return migrationRunRepository.findById(runId)
                                     .map(RunState::of)
                                     .orElseThrow(() -> new NotFoundException("Migration run not found: " + runId));
    }

    /**
     * RUNNING → PAUSED_FOR_RETRIES.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean pause(Long runId, String reason) {
        return changeStatus(runId, RunStatus.RUNNING, RunStatus.PAUSED_FOR_RETRIES, reason, null);
    }

    /**
     * PAUSED_FOR_RETRIES → RUNNING, accepting {@code acknowledgedFailures} failed items. Failures recorded up to
     * {@code countedUntil} no longer count toward the threshold.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean proceed(Long runId, long acknowledgedFailures, LocalDateTime countedUntil) {
        boolean resumed = migrationRunRepository.resumeAcknowledging(runId, acknowledgedFailures, countedUntil) > 0;
        if (resumed) {
            log.info("Run #{} resumed by operator; {} failed items acknowledged.", runId, acknowledgedFailures);
        }
        return resumed;
    }

    /**
     * RUNNING or PAUSED_FOR_RETRIES → STOPPING. In-flight work finishes; nothing new is admitted.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean requestStop(Long runId) {
        return changeStatus(runId, RunStatus.RUNNING, RunStatus.STOPPING, "Stop requested by operator.", null)
               || changeStatus(runId, RunStatus.PAUSED_FOR_RETRIES, RunStatus.STOPPING,
                               "Stop requested by operator.", null);
    }

    /**
     * STOPPING → STOPPED.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markStopped(Long runId, String reason) {
        return changeStatus(runId, RunStatus.STOPPING, RunStatus.STOPPED, reason, LocalDateTime.now(clock));
    }

    /**
     * RUNNING → COMPLETED.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean complete(Long runId) {
        return changeStatus(runId, RunStatus.RUNNING, RunStatus.COMPLETED, null, LocalDateTime.now(clock));
    }

    /**
     * Stops an active run immediately because of a fault it cannot recover from.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean abort(Long runId, String reason) {
        LocalDateTime now = LocalDateTime.now(clock);
        for (RunStatus from : ACTIVE) {
            if (changeStatus(runId, from, RunStatus.STOPPED, reason, now)) {
                log.error("Run #{} aborted: {}", runId, reason);
                return true;
            }
        }
        return false;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markDiscoveryCompleted(Long runId) {
        migrationRunRepository.markDiscoveryCompleted(runId);
    }

    private boolean changeStatus(Long runId, RunStatus from, RunStatus to, String reason, LocalDateTime finishedAt) {
        boolean changed = migrationRunRepository.updateStatusIfExpected(runId, to, from, reason, finishedAt) > 0;
        if (changed) {
            log.info("Run #{} status {} -> {}{}", runId, from, to, reason == null ? "" : " (" + reason + ")");
        } else {
            log.debug("Run #{} status change {} -> {} not applied.", runId, from, to);
        }
        return changed;
    }
}
