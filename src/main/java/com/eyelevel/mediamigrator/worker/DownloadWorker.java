package com.eyelevel.mediamigrator.worker;

import com.eyelevel.mediamigrator.collaborator.source.ArchiveSource;
import com.eyelevel.mediamigrator.collaborator.source.ArchiveVerifier;
import com.eyelevel.mediamigrator.collaborator.source.RemoteArchive;
import com.eyelevel.mediamigrator.config.MigrationProperties;
import com.eyelevel.mediamigrator.exception.CorruptInputException;
import com.eyelevel.mediamigrator.exception.TransientCollaboratorException;
import com.eyelevel.mediamigrator.model.ArchivePhase;
import com.eyelevel.mediamigrator.model.ArchiveUnit;
import com.eyelevel.mediamigrator.model.FailureKind;
import com.eyelevel.mediamigrator.model.RetryRecord;
import com.eyelevel.mediamigrator.service.disk.DiskBudgetGovernor;
import com.eyelevel.mediamigrator.service.failure.FailureRecorder;
import com.eyelevel.mediamigrator.service.state.StateStore;
import com.eyelevel.mediamigrator.service.state.TransitionResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * {@code DISCOVERED → DOWNLOADING → DOWNLOADED}: fetches an archive, verifies it and records its fingerprint.
 */
@Slf4j
@Component
public class DownloadWorker extends PhaseWorker<ArchiveUnit, Path> {

    private final StateStore stateStore;
    private final ArchiveSource archiveSource;
    private final ArchiveVerifier archiveVerifier;
    private final FailureRecorder failureRecorder;
    private final PhaseExecutors phaseExecutors;
    private final MigrationProperties properties;

    public DownloadWorker(DiskBudgetGovernor diskBudgetGovernor, InfrastructureFaultLatch faultLatch,
                          StateStore stateStore, ArchiveSource archiveSource, ArchiveVerifier archiveVerifier,
                          FailureRecorder failureRecorder, PhaseExecutors phaseExecutors,
                          MigrationProperties properties) {
        super(diskBudgetGovernor, faultLatch);
        this.stateStore = stateStore;
        this.archiveSource = archiveSource;
        this.archiveVerifier = archiveVerifier;
        this.failureRecorder = failureRecorder;
        this.phaseExecutors = phaseExecutors;
        this.properties = properties;
    }

    @Override
    public String phaseName() {
        return "download";
    }

    @Override
    public String unitId(ArchiveUnit unit) {
        return unit.getId();
    }

    @Override
    public TaskExecutor executor() {
        return phaseExecutors.download();
    }

    @Override
    public int capacity() {
        return properties.getConcurrency().getDownload();
    }

    @Override
    public long inFlightCount() {
        return stateStore.countArchives(ArchivePhase.DOWNLOADING);
    }

    @Override
    public List<ArchiveUnit> findCandidates(int limit) {
        return stateStore.findEligibleArchives(ArchivePhase.DISCOVERED, limit);
    }

    @Override
    public long estimateBytes(ArchiveUnit unit) {
        return unit.getExpectedSize() > 0 ? unit.getExpectedSize()
                                          : properties.getDisk().getUnknownSizeEstimateBytes();
    }

    @Override
    public TransitionResult claim(ArchiveUnit unit) {
        return stateStore.transitionArchive(unit.getId(), ArchivePhase.DISCOVERED, ArchivePhase.DOWNLOADING);
    }

    @Override
    public void releaseClaim(ArchiveUnit unit) {
        stateStore.transitionArchive(unit.getId(), ArchivePhase.DOWNLOADING, ArchivePhase.DISCOVERED);
    }

    @Override
    public void rejectOversized(ArchiveUnit unit, long estimatedBytes) {
        failureRecorder.failArchive(unit.getId(), ArchivePhase.DISCOVERED, FailureKind.RESOURCE_EXHAUSTED,
                                    "Archive needs " + FileUtils.byteCountToDisplaySize(estimatedBytes)
                                    + ", more than the whole disk budget.");
    }

    @Override
    protected PhaseOutcome<Path> process(ArchiveUnit unit) {
        RemoteArchive remote = new RemoteArchive(unit.getId(), unit.getDisplayName(), unit.getExpectedSize());
        Path zipDir = Paths.get(properties.getZipDir()).toAbsolutePath().normalize();
        Path archivePath = zipDir.resolve(remote.localFileName());

        long bytesWritten = 0L;
        if (isCompleteLocalCopy(archivePath, unit.getExpectedSize())) {
            log.info("[{}] Archive already present at '{}', skipping download.", unit.getId(), archivePath);
        } else {
            archivePath = archiveSource.fetch(remote, zipDir);
            bytesWritten = sizeOf(archivePath);
        }

        String fingerprint;
        try {
            fingerprint = archiveVerifier.verify(archivePath, unit.getExpectedSize(), unit.getId());
        } catch (TransientCollaboratorException | CorruptInputException e) {
            // A failed copy is never trusted as a complete local copy on the next attempt.
            deleteQuietly(archivePath, unit.getId());
            throw e;
        }
        if (unit.getContentFingerprint() != null && !unit.getContentFingerprint().equals(fingerprint)) {
            log.warn("[{}] Archive content changed since it was last downloaded ({} -> {}).", unit.getId(),
                     unit.getContentFingerprint(), fingerprint);
        }

        String localPath = archivePath.toString();
        TransitionResult result = stateStore.updateArchive(unit.getId(), ArchivePhase.DOWNLOADING, archive -> {
            archive.setPhase(ArchivePhase.DOWNLOADED);
            archive.setLocalPath(localPath);
            archive.setContentFingerprint(fingerprint);
            archive.setRetry(RetryRecord.clean());
        });
        if (!result.isSuccess()) {
            log.warn("[{}] Download finished but the archive was moved concurrently: {}", unit.getId(), result);
        } else {
            log.info("[{}] Downloaded and verified '{}'.", unit.getId(), unit.getDisplayName());
        }
        return PhaseOutcome.success(archivePath, bytesWritten);
    }

    @Override
    protected void recordFailure(ArchiveUnit unit, Throwable error) {
        failureRecorder.recordArchiveFailure(unit.getId(), ArchivePhase.DOWNLOADING, ArchivePhase.DISCOVERED, error);
    }

    private static boolean isCompleteLocalCopy(Path archivePath, long expectedSize) {
        return Files.isRegularFile(archivePath) && expectedSize > 0 && sizeOf(archivePath) == expectedSize;
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return 0L;
        }
    }

    private static void deleteQuietly(Path file, String unitId) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("[{}] Failed to delete incomplete archive '{}'.", unitId, file, e);
        }
    }
}
