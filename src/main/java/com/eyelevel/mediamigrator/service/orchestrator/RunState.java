package com.eyelevel.mediamigrator.service.orchestrator;

import com.eyelevel.mediamigrator.model.MigrationRun;
import com.eyelevel.mediamigrator.model.RunStatus;

import java.time.LocalDateTime;

/**
 * Immutable snapshot of a {@link MigrationRun}, passed into and returned from each orchestrator step.
 */
public record RunState(Long runId,
                       RunStatus status,
                       long acknowledgedFailures,
                       boolean discoveryCompleted,
                       String statusReason,
                       LocalDateTime startedAt,
                       LocalDateTime finishedAt,
                       LocalDateTime failuresCountedSince) {

    public static RunState of(MigrationRun run) {
        return new RunState(run.getId(), run.getStatus(), run.getAcknowledgedFailures(),
                            run.isDiscoveryCompleted(), run.getStatusReason(), run.getStartedAt(),
                            run.getFinishedAt(), run.getFailuresCountedSince());
    }

    /**
     * Start of the window in which failed items count toward the failure threshold.
     */
    public LocalDateTime failureWindowStart() {
        return failuresCountedSince != null ? failuresCountedSince : startedAt;
    }

    public boolean isActive() {
        return status.isActive();
    }

    public boolean is(RunStatus expected) {
        return status == expected;
    }
}
