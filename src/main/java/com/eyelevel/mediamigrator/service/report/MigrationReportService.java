package com.eyelevel.mediamigrator.service.report;

import com.eyelevel.mediamigrator.common.json.JsonSerializer;
import com.eyelevel.mediamigrator.config.MigrationProperties;
import com.eyelevel.mediamigrator.dto.report.MigrationReport;
import com.eyelevel.mediamigrator.model.ArchivePhase;
import com.eyelevel.mediamigrator.model.MediaPhase;
import com.eyelevel.mediamigrator.repository.AlbumRepository;
import com.eyelevel.mediamigrator.service.orchestrator.RunState;
import com.eyelevel.mediamigrator.service.state.StateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the migration report from the State Store and writes it as JSON to the reports directory.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MigrationReportService {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final StateStore stateStore;
    private final AlbumRepository albumRepository;
    private final JsonSerializer jsonSerializer;
    private final MigrationProperties properties;
    private final Clock clock;

    public MigrationReport build(RunState run) {
        Map<MediaPhase, Long> itemsByPhase = stateStore.countItemsByPhase();
        long totalAlbums = albumRepository.count();
        long createdThisRun = run == null ? 0L : albumRepository.countByCreatedInRunId(run.runId());
        int pageSize = properties.getOrchestrator().getPageSize();

        List<MigrationReport.FailedItem> failedItems =
                stateStore.streamItemsByPhase(MediaPhase.FAILED, pageSize)
                          .map(item -> new MigrationReport.FailedItem(item.getId(), item.getArchiveId(),
                                                                      item.getRelativePath(),
                                                                      item.getRetry().getFailureKind(),
                                                                      item.getRetry().getAttempts(),
                                                                      item.getRetry().getFailedInPhase(),
                                                                      item.getRetry().getLastError()))
                          .toList();
        List<MigrationReport.ProblemArchive> problemArchives =
                stateStore.findArchivesIn(List.of(ArchivePhase.CORRUPTED, ArchivePhase.FAILED)).stream()
                          .map(archive -> new MigrationReport.ProblemArchive(archive.getId(),
                                                                             archive.getDisplayName(),
                                                                             archive.getPhase(),
                                                                             archive.getRetry().getFailureKind(),
                                                                             archive.getRetry().getAttempts(),
                                                                             archive.getRetry().getLastError()))
                          .toList();

        return MigrationReport.builder()
                              .runId(run == null ? null : run.runId())
                              .status(run == null ? null : run.status())
                              .statusReason(run == null ? null : run.statusReason())
                              .startedAt(run == null ? null : run.startedAt())
                              .finishedAt(run == null ? null : run.finishedAt())
                              .generatedAt(LocalDateTime.now(clock))
                              .archivesByPhase(stateStore.countArchivesByPhase())
                              .itemsByPhase(itemsByPhase)
                              .uploadedItems(itemsByPhase.getOrDefault(MediaPhase.UPLOADED, 0L))
                              .failedItems(itemsByPhase.getOrDefault(MediaPhase.FAILED, 0L))
                              .acknowledgedFailures(run == null ? 0L : run.acknowledgedFailures())
                              .totalAlbums(totalAlbums)
                              .albumsCreatedThisRun(createdThisRun)
                              .albumsPreexisting(totalAlbums - createdThisRun)
                              .failedItemDetails(failedItems)
                              .problemArchives(problemArchives)
                              .build();
    }

    /**
     * Builds the report and writes it to the reports directory. A report that cannot be written is logged and
     * skipped; it never affects the run.
     *
     * @return the written file, or empty if writing failed.
     */
    public Optional<Path> writeReport(RunState run) {
        MigrationReport report = build(run);
        logSummary(report);
        Path reportsDir = Paths.get(properties.getReportsDir()).toAbsolutePath().normalize();
        String fileName = String.format("migration-report-run-%s-%s.json", run == null ? "none" : run.runId(),
                                        FILE_TIMESTAMP.format(report.getGeneratedAt()));
        try {
            Files.createDirectories(reportsDir);
            Path reportFile = reportsDir.resolve(fileName);
            Files.writeString(reportFile, jsonSerializer.serialize(report, true), StandardCharsets.UTF_8);
            log.info("Migration report written to '{}'.", reportFile);
            return Optional.of(reportFile);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to write migration report '{}'.", fileName, e);
            return Optional.empty();
        }
    }

    private void logSummary(MigrationReport report) {
        log.info("Run #{} {}: {} uploaded, {} failed, {} problem archives, {} albums ({} new).", report.getRunId(),
                 report.getStatus(), report.getUploadedItems(), report.getFailedItems(),
                 report.getProblemArchives().size(), report.getTotalAlbums(), report.getAlbumsCreatedThisRun());
        int limit = properties.getOrchestrator().getFailureListLimit();
        report.getFailedItemDetails().stream().limit(limit).forEach(
                failed -> log.warn("  FAILED [{}] {} after {} attempt(s) in {}: {}", failed.failureKind(),
                                   failed.id(), failed.attempts(), failed.failedInPhase(), failed.lastError()));
        if (report.getFailedItemDetails().size() > limit) {
            log.warn("  ... and {} more failed items, see the report file.",
                     report.getFailedItemDetails().size() - limit);
        }
        report.getProblemArchives().forEach(
                archive -> log.warn("  {} archive {} [{}]: {}", archive.phase(), archive.id(), archive.failureKind(),
                                    archive.lastError()));
    }
}
