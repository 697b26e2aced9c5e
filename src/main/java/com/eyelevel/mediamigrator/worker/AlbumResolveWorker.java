package com.eyelevel.mediamigrator.worker;

import com.eyelevel.mediamigrator.collaborator.metadata.SidecarMetadata;
import com.eyelevel.mediamigrator.collaborator.metadata.SidecarMetadataReader;
import com.eyelevel.mediamigrator.exception.DiskBudgetException;
import com.eyelevel.mediamigrator.exception.StateStoreException;
import com.eyelevel.mediamigrator.model.MediaItem;
import com.eyelevel.mediamigrator.model.MediaPhase;
import com.eyelevel.mediamigrator.model.RetryRecord;
import com.eyelevel.mediamigrator.service.album.AlbumResolver;
import com.eyelevel.mediamigrator.service.failure.FailureRecorder;
import com.eyelevel.mediamigrator.service.state.StateStore;
import com.eyelevel.mediamigrator.service.state.TransitionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@code METADATA_MERGED → ALBUM_RESOLVED}. Runs right after a metadata merge and, for items left in
 * {@code METADATA_MERGED} by an interruption, from the orchestrator.
 * <p>
 * Album resolution is cheap and idempotent, so it has no in-flight phase of its own: if the final transition
 * loses a race, the albums and memberships written are exactly those another resolution would write.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlbumResolveWorker {

    private final StateStore stateStore;
    private final AlbumResolver albumResolver;
    private final SidecarMetadataReader sidecarMetadataReader;
    private final FailureRecorder failureRecorder;

    public List<MediaItem> findCandidates(int limit) {
        return stateStore.findEligibleItems(MediaPhase.METADATA_MERGED, limit);
    }

    public PhaseOutcome<Set<String>> process(MediaItem item) {
        SidecarMetadata sidecar = item.getSidecarPath() == null
                                  ? SidecarMetadata.EMPTY
                                  : sidecarMetadataReader.read(Paths.get(item.getSidecarPath()));
        return process(item, sidecar);
    }

    public PhaseOutcome<Set<String>> process(MediaItem item, SidecarMetadata sidecar) {
        try {
            String directory = FilenameUtils.getPathNoEndSeparator(item.getRelativePath());
            Set<String> albums = albumResolver.resolve(item, directory, sidecar);
            TransitionResult result = stateStore.updateItem(item.getId(), MediaPhase.METADATA_MERGED, merged -> {
                merged.setPhase(MediaPhase.ALBUM_RESOLVED);
                merged.setAlbumNames(new LinkedHashSet<>(albums));
                merged.setRetry(RetryRecord.clean());
            });
            if (!result.isSuccess()) {
                log.debug("[{}] Album resolution already recorded elsewhere: {}", item.getId(), result);
            }
            return PhaseOutcome.success(albums);
        } catch (StateStoreException | DiskBudgetException | DataAccessException e) {
            throw e;
        } catch (RuntimeException e) {
            failureRecorder.recordItemFailure(item.getId(), MediaPhase.METADATA_MERGED, MediaPhase.METADATA_MERGED,
                                              e);
            return PhaseOutcome.failure(e);
        }
    }
}
