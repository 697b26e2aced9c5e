package com.eyelevel.mediamigrator.worker;

import com.eyelevel.mediamigrator.collaborator.extract.ArchiveExtractor;
import com.eyelevel.mediamigrator.collaborator.extract.ExtractedEntry;
import com.eyelevel.mediamigrator.collaborator.extract.MediaFileTypes;
import com.eyelevel.mediamigrator.config.MigrationProperties;
import com.eyelevel.mediamigrator.model.ArchivePhase;
import com.eyelevel.mediamigrator.model.ArchiveUnit;
import com.eyelevel.mediamigrator.model.FailureKind;
import com.eyelevel.mediamigrator.model.MediaItem;
import com.eyelevel.mediamigrator.model.MediaPhase;
import com.eyelevel.mediamigrator.model.RetryRecord;
import com.eyelevel.mediamigrator.service.disk.DiskBudgetGovernor;
import com.eyelevel.mediamigrator.service.failure.FailureRecorder;
import com.eyelevel.mediamigrator.service.state.StateStore;
import com.eyelevel.mediamigrator.service.state.TransitionResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@code DOWNLOADED → EXTRACTING → EXTRACTED}: unpacks an archive and fans it out into media items.
 * <p>
 * The archive's move to {@code EXTRACTED} and the creation of its items are committed together. Items already
 * known from an earlier extraction keep their progress; see {@link #refreshExisting}.
 */
@Slf4j
@Component
public class ExtractWorker extends PhaseWorker<ArchiveUnit, Integer> {

    private final StateStore stateStore;
    private final ArchiveExtractor archiveExtractor;
    private final FailureRecorder failureRecorder;
    private final PhaseExecutors phaseExecutors;
    private final MigrationProperties properties;

    public ExtractWorker(DiskBudgetGovernor diskBudgetGovernor, InfrastructureFaultLatch faultLatch,
                         StateStore stateStore, ArchiveExtractor archiveExtractor, FailureRecorder failureRecorder,
                         PhaseExecutors phaseExecutors, MigrationProperties properties) {
        super(diskBudgetGovernor, faultLatch);
        this.stateStore = stateStore;
        this.archiveExtractor = archiveExtractor;
        this.failureRecorder = failureRecorder;
        this.phaseExecutors = phaseExecutors;
        this.properties = properties;
    }

    @Override
    public String phaseName() {
        return "extract";
    }

    @Override
    public String unitId(ArchiveUnit unit) {
        return unit.getId();
    }

    @Override
    public TaskExecutor executor() {
        return phaseExecutors.extract();
    }

    @Override
    public int capacity() {
        return properties.getConcurrency().getExtract();
    }

    @Override
    public long inFlightCount() {
        return stateStore.countArchives(ArchivePhase.EXTRACTING);
    }

    @Override
    public List<ArchiveUnit> findCandidates(int limit) {
        return stateStore.findEligibleArchives(ArchivePhase.DOWNLOADED, limit);
    }

    @Override
    public long estimateBytes(ArchiveUnit unit) {
        long compressedSize = unit.getExpectedSize();
        if (compressedSize <= 0 && unit.getLocalPath() != null) {
            try {
                compressedSize = Files.size(Paths.get(unit.getLocalPath()));
            } catch (IOException e) {
                compressedSize = 0L;
            }
        }
        if (compressedSize <= 0) {
            return properties.getDisk().getUnknownSizeEstimateBytes();
        }
        return (long) Math.ceil(compressedSize * properties.getDisk().getExtractionFactor());
    }

    @Override
    public TransitionResult claim(ArchiveUnit unit) {
        return stateStore.transitionArchive(unit.getId(), ArchivePhase.DOWNLOADED, ArchivePhase.EXTRACTING);
    }

    @Override
    public void releaseClaim(ArchiveUnit unit) {
        stateStore.transitionArchive(unit.getId(), ArchivePhase.EXTRACTING, ArchivePhase.DOWNLOADED);
    }

    @Override
    public void rejectOversized(ArchiveUnit unit, long estimatedBytes) {
        failureRecorder.failArchive(unit.getId(), ArchivePhase.DOWNLOADED, FailureKind.RESOURCE_EXHAUSTED,
                                    "Extraction needs " + FileUtils.byteCountToDisplaySize(estimatedBytes)
                                    + ", more than the whole disk budget.");
    }

    @Override
    protected PhaseOutcome<Integer> process(ArchiveUnit unit) {
        Path archivePath = unit.getLocalPath() == null ? null : Paths.get(unit.getLocalPath());
        if (archivePath == null || !Files.isRegularFile(archivePath)) {
            log.warn("[{}] Local copy '{}' is gone, sending the archive back for download.", unit.getId(),
                     unit.getLocalPath());
            stateStore.updateArchive(unit.getId(), ArchivePhase.EXTRACTING, archive -> {
                archive.setPhase(ArchivePhase.DISCOVERED);
                archive.setLocalPath(null);
            });
            return PhaseOutcome.success(0);
        }

        Path targetDir = extractionDirectory(unit);
        List<ExtractedEntry> entries = archiveExtractor.extract(archivePath, targetDir);

        Map<String, ExtractedEntry> sidecars = new HashMap<>();
        long bytesWritten = 0L;
        for (ExtractedEntry entry : entries) {
            bytesWritten += entry.size();
            if (MediaFileTypes.isSidecar(entry.relativePath())) {
                sidecars.put(entry.relativePath(), entry);
            }
        }

        List<MediaItem> items = new ArrayList<>();
        for (ExtractedEntry entry : entries) {
            if (!MediaFileTypes.isMedia(entry.relativePath())) {
                continue;
            }
            ExtractedEntry sidecar = MediaFileTypes.sidecarCandidates(entry.relativePath()).stream()
                                                   .map(sidecars::get)
                                                   .filter(Objects::nonNull)
                                                   .findFirst()
                                                   .orElse(null);
            items.add(MediaItem.builder()
                               .id(MediaItem.idFor(unit.getId(), entry.relativePath()))
                               .archiveId(unit.getId())
                               .relativePath(entry.relativePath())
                               .sourcePath(entry.path().toString())
                               .sidecarPath(sidecar == null ? null : sidecar.path().toString())
                               .fileSize(entry.size())
                               .contentFingerprint(entry.sha256())
                               .phase(MediaPhase.EXTRACTED)
                               .build());
        }

        TransitionResult result = stateStore.commitExtraction(unit.getId(), targetDir.toString(), items,
                                                              this::refreshExisting);
        if (!result.isSuccess()) {
            log.warn("[{}] Extraction finished but the archive was moved concurrently: {}", unit.getId(), result);
        } else {
            log.info("[{}] Extracted {} media items ({} with sidecars).", unit.getId(), items.size(),
                     items.stream().filter(item -> item.getSidecarPath() != null).count());
        }
        return PhaseOutcome.success(items.size(), bytesWritten);
    }

    @Override
    protected void recordFailure(ArchiveUnit unit, Throwable error) {
        failureRecorder.recordArchiveFailure(unit.getId(), ArchivePhase.EXTRACTING, ArchivePhase.DOWNLOADED, error);
    }

    /**
     * Reconciles an item known from an earlier extraction with its re-extracted copy. Uploaded and skipped items
     * are never sent through the pipeline again and failed items wait for the operator; every other item starts
     * over from {@code EXTRACTED} with the new file.
     */
    void refreshExisting(MediaItem existing, MediaItem fresh) {
        existing.setSourcePath(fresh.getSourcePath());
        existing.setSidecarPath(fresh.getSidecarPath());
        existing.setSourceRemoved(false);
        if (existing.getPhase().isTerminal()) {
            if (existing.getContentFingerprint() != null
                && !existing.getContentFingerprint().equals(fresh.getContentFingerprint())) {
                log.warn("[{}] Re-extracted content differs from the {} copy; keeping the recorded state.",
                         existing.getId(), existing.getPhase());
            }
            return;
        }
        existing.setFileSize(fresh.getFileSize());
        existing.setContentFingerprint(fresh.getContentFingerprint());
        existing.setPhase(MediaPhase.EXTRACTED);
        existing.setRetry(RetryRecord.clean());
    }

    private Path extractionDirectory(ArchiveUnit unit) {
        String baseName = FilenameUtils.getBaseName(unit.getDisplayName());
        String suffix = DigestUtils.sha256Hex(unit.getId()).substring(0, 8);
        return Paths.get(properties.getExtractedDir()).toAbsolutePath().normalize().resolve(baseName + "-" + suffix);
    }
}
