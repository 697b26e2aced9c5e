package com.eyelevel.mediamigrator.worker;

import com.eyelevel.mediamigrator.collaborator.metadata.MediaMetadata;
import com.eyelevel.mediamigrator.collaborator.metadata.MetadataTagger;
import com.eyelevel.mediamigrator.collaborator.metadata.SidecarMetadata;
import com.eyelevel.mediamigrator.collaborator.metadata.SidecarMetadataReader;
import com.eyelevel.mediamigrator.config.MigrationProperties;
import com.eyelevel.mediamigrator.exception.PermanentCollaboratorException;
import com.eyelevel.mediamigrator.model.FailureKind;
import com.eyelevel.mediamigrator.model.MediaItem;
import com.eyelevel.mediamigrator.model.MediaPhase;
import com.eyelevel.mediamigrator.model.RetryRecord;
import com.eyelevel.mediamigrator.service.disk.DiskBudgetGovernor;
import com.eyelevel.mediamigrator.service.failure.FailureRecorder;
import com.eyelevel.mediamigrator.service.state.StateStore;
import com.eyelevel.mediamigrator.service.state.TransitionResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

/**
 * {@code EXTRACTED → MERGING_METADATA → METADATA_MERGED}, followed directly by album resolution.
 * <p>
 * ExifTool rewrites the file through a temporary copy, so the item's size is admitted against the disk budget
 * for the duration of the merge.
 */
@Slf4j
@Component
public class MetadataMergeWorker extends PhaseWorker<MediaItem, Set<String>> {

    private final StateStore stateStore;
    private final SidecarMetadataReader sidecarMetadataReader;
    private final MetadataTagger metadataTagger;
    private final AlbumResolveWorker albumResolveWorker;
    private final FailureRecorder failureRecorder;
    private final PhaseExecutors phaseExecutors;
    private final MigrationProperties properties;

    public MetadataMergeWorker(DiskBudgetGovernor diskBudgetGovernor, InfrastructureFaultLatch faultLatch,
                               StateStore stateStore, SidecarMetadataReader sidecarMetadataReader,
                               MetadataTagger metadataTagger, AlbumResolveWorker albumResolveWorker,
                               FailureRecorder failureRecorder, PhaseExecutors phaseExecutors,
                               MigrationProperties properties) {
        super(diskBudgetGovernor, faultLatch);
        this.stateStore = stateStore;
        this.sidecarMetadataReader = sidecarMetadataReader;
        this.metadataTagger = metadataTagger;
        this.albumResolveWorker = albumResolveWorker;
        this.failureRecorder = failureRecorder;
        this.phaseExecutors = phaseExecutors;
        this.properties = properties;
    }

    @Override
    public String phaseName() {
        return "metadata";
    }

    @Override
    public String unitId(MediaItem unit) {
        return unit.getId();
    }

    @Override
    public TaskExecutor executor() {
        return phaseExecutors.metadata();
    }

    @Override
    public int capacity() {
        return properties.getConcurrency().getMetadata();
    }

    @Override
    public long inFlightCount() {
        return stateStore.countItems(MediaPhase.MERGING_METADATA);
    }

    @Override
    public List<MediaItem> findCandidates(int limit) {
        return stateStore.findEligibleItems(MediaPhase.EXTRACTED, limit);
    }

    @Override
    public long estimateBytes(MediaItem unit) {
        return Math.max(0L, unit.getFileSize());
    }

    @Override
    public TransitionResult claim(MediaItem unit) {
        return stateStore.transitionItem(unit.getId(), MediaPhase.EXTRACTED, MediaPhase.MERGING_METADATA);
    }

    @Override
    public void releaseClaim(MediaItem unit) {
        stateStore.transitionItem(unit.getId(), MediaPhase.MERGING_METADATA, MediaPhase.EXTRACTED);
    }

    @Override
    public void rejectOversized(MediaItem unit, long estimatedBytes) {
        failureRecorder.failItem(unit.getId(), MediaPhase.EXTRACTED, FailureKind.RESOURCE_EXHAUSTED,
                                 "Metadata merge needs " + FileUtils.byteCountToDisplaySize(estimatedBytes)
                                 + ", more than the whole disk budget.");
    }

    @Override
    protected PhaseOutcome<Set<String>> process(MediaItem item) {
        Path mediaPath = Paths.get(item.getSourcePath());
        if (!Files.isRegularFile(mediaPath)) {
            throw new PermanentCollaboratorException("Extracted file is missing: " + mediaPath);
        }
        SidecarMetadata sidecar = item.getSidecarPath() == null
                                  ? SidecarMetadata.EMPTY
                                  : sidecarMetadataReader.read(Paths.get(item.getSidecarPath()));
        MediaMetadata metadata = new MediaMetadata(sidecar.takenAt(), sidecar.latitude(), sidecar.longitude(),
                                                   sidecar.altitude(), sidecar.description(), sidecar.title());
        if (!metadata.isEmpty()) {
            metadataTagger.applyMetadata(mediaPath, metadata);
        }

        LocalDateTime takenAt = sidecar.takenAt() == null ? null
                                                          : LocalDateTime.ofInstant(sidecar.takenAt(),
                                                                                    ZoneOffset.UTC);
        TransitionResult result = stateStore.updateItem(item.getId(), MediaPhase.MERGING_METADATA, merged -> {
            merged.setPhase(MediaPhase.METADATA_MERGED);
            merged.setTakenAt(takenAt);
            merged.setLatitude(sidecar.latitude());
            merged.setLongitude(sidecar.longitude());
            merged.setAltitude(sidecar.altitude());
            merged.setDescription(sidecar.description());
            merged.setTitle(sidecar.title());
            merged.setRetry(RetryRecord.clean());
        });
        if (!result.isSuccess()) {
            log.warn("[{}] Metadata merged but the item was moved concurrently: {}", item.getId(), result);
            return PhaseOutcome.success(Set.of());
        }
        log.info("[{}] Metadata merged{}.", item.getId(), metadata.isEmpty() ? " (nothing to write)" : "");
        // Album failures are recorded against METADATA_MERGED by the resolve worker itself.
        PhaseOutcome<Set<String>> albums = albumResolveWorker.process(item, sidecar);
        return PhaseOutcome.success(albums.isSuccess() ? albums.output() : Set.of());
    }

    @Override
    protected void recordFailure(MediaItem item, Throwable error) {
        failureRecorder.recordItemFailure(item.getId(), MediaPhase.MERGING_METADATA, MediaPhase.EXTRACTED, error);
    }
}
