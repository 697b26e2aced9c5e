package com.eyelevel.mediamigrator.worker;

import com.eyelevel.mediamigrator.collaborator.upload.PhotoUploader;
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
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * {@code ALBUM_RESOLVED → UPLOADING → UPLOADED}.
 * <p>
 * The claim into {@code UPLOADING} is the only way to reach the uploader, so an item is handed to it at most
 * once per claim, and an {@code UPLOADED} item is never claimed again.
 */
@Slf4j
@Component
public class UploadWorker extends PhaseWorker<MediaItem, String> {

    private final StateStore stateStore;
    private final PhotoUploader photoUploader;
    private final FailureRecorder failureRecorder;
    private final PhaseExecutors phaseExecutors;
    private final MigrationProperties properties;

    public UploadWorker(DiskBudgetGovernor diskBudgetGovernor, InfrastructureFaultLatch faultLatch,
                        StateStore stateStore, PhotoUploader photoUploader, FailureRecorder failureRecorder,
                        PhaseExecutors phaseExecutors, MigrationProperties properties) {
        super(diskBudgetGovernor, faultLatch);
        this.stateStore = stateStore;
        this.photoUploader = photoUploader;
        this.failureRecorder = failureRecorder;
        this.phaseExecutors = phaseExecutors;
        this.properties = properties;
    }

    @Override
    public String phaseName() {
        return "upload";
    }

    @Override
    public String unitId(MediaItem unit) {
        return unit.getId();
    }

    @Override
    public TaskExecutor executor() {
        return phaseExecutors.upload();
    }

    @Override
    public int capacity() {
        return properties.getConcurrency().getUpload();
    }

    @Override
    public long inFlightCount() {
        return stateStore.countItems(MediaPhase.UPLOADING);
    }

    @Override
    public List<MediaItem> findCandidates(int limit) {
        return stateStore.findEligibleItems(MediaPhase.ALBUM_RESOLVED, limit);
    }

    @Override
    public long estimateBytes(MediaItem unit) {
        return 0L;
    }

    @Override
    public TransitionResult claim(MediaItem unit) {
        return stateStore.transitionItem(unit.getId(), MediaPhase.ALBUM_RESOLVED, MediaPhase.UPLOADING);
    }

    @Override
    public void releaseClaim(MediaItem unit) {
        stateStore.transitionItem(unit.getId(), MediaPhase.UPLOADING, MediaPhase.ALBUM_RESOLVED);
    }

    @Override
    public void rejectOversized(MediaItem unit, long estimatedBytes) {
        failureRecorder.failItem(unit.getId(), MediaPhase.ALBUM_RESOLVED, FailureKind.RESOURCE_EXHAUSTED,
                                 "Upload cannot be admitted.");
    }

    @Override
    protected PhaseOutcome<String> process(MediaItem item) {
        Path mediaPath = Paths.get(item.getSourcePath());
        if (item.isSourceRemoved() || !Files.isRegularFile(mediaPath)) {
            throw new PermanentCollaboratorException("Extracted file is missing: " + mediaPath);
        }
        String remoteId = photoUploader.upload(mediaPath, new LinkedHashSet<>(item.getAlbumNames()));

        TransitionResult result = stateStore.updateItem(item.getId(), MediaPhase.UPLOADING, uploaded -> {
            uploaded.setPhase(MediaPhase.UPLOADED);
            uploaded.setRemoteId(remoteId);
            uploaded.setRetry(RetryRecord.clean());
        });
        if (!result.isSuccess()) {
            log.error("CRITICAL: [{}] Uploaded as '{}' but the item was moved concurrently ({}).", item.getId(),
                      remoteId, result);
        } else {
            log.info("[{}] Uploaded to albums {}.", item.getId(), item.getAlbumNames());
        }
        return PhaseOutcome.success(remoteId);
    }

    @Override
    protected void recordFailure(MediaItem item, Throwable error) {
        failureRecorder.recordItemFailure(item.getId(), MediaPhase.UPLOADING, MediaPhase.ALBUM_RESOLVED, error);
    }
}
