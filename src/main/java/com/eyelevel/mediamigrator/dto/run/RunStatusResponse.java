package com.eyelevel.mediamigrator.dto.run;

import com.eyelevel.mediamigrator.model.ArchivePhase;
import com.eyelevel.mediamigrator.model.MediaPhase;
import com.eyelevel.mediamigrator.model.RunStatus;
import com.eyelevel.mediamigrator.service.disk.DiskBudget;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Status snapshot of a migration run as shown to the operator.
 */
@Getter
@Builder
public class RunStatusResponse {

    private final Long runId;
    private final RunStatus status;
    private final String statusReason;
    private final boolean discoveryCompleted;
    private final long acknowledgedFailures;
    private final LocalDateTime startedAt;
    private final LocalDateTime finishedAt;
    private final Map<ArchivePhase, Long> archivesByPhase;
    private final Map<MediaPhase, Long> itemsByPhase;
    private final DiskBudget diskBudget;
}
