package com.eyelevel.mediamigrator.dto.report;

import com.eyelevel.mediamigrator.model.ArchivePhase;
import com.eyelevel.mediamigrator.model.FailureKind;
import com.eyelevel.mediamigrator.model.MediaPhase;
import com.eyelevel.mediamigrator.model.RunStatus;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a migration run: what was uploaded, and precisely what still needs a decision.
 */
@Getter
@Builder
public class MigrationReport {

    private final Long runId;
    private final RunStatus status;
    private final String statusReason;
    private final LocalDateTime startedAt;
    private final LocalDateTime finishedAt;
    private final LocalDateTime generatedAt;

    private final Map<ArchivePhase, Long> archivesByPhase;
    private final Map<MediaPhase, Long> itemsByPhase;
    private final long uploadedItems;
    private final long failedItems;
    private final long acknowledgedFailures;

    private final long totalAlbums;
    private final long albumsCreatedThisRun;
    private final long albumsPreexisting;

    private final List<FailedItem> failedItemDetails;
    private final List<ProblemArchive> problemArchives;

    public record FailedItem(String id,
                             String archiveId,
                             String relativePath,
                             FailureKind failureKind,
                             int attempts,
                             String failedInPhase,
                             String lastError) {
    }

    public record ProblemArchive(String id,
                                 String displayName,
                                 ArchivePhase phase,
                                 FailureKind failureKind,
                                 int attempts,
                                 String lastError) {
    }
}
