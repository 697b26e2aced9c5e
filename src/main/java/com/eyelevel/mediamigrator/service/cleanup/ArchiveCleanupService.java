package com.eyelevel.mediamigrator.service.cleanup;

import com.eyelevel.mediamigrator.model.ArchivePhase;
import com.eyelevel.mediamigrator.model.ArchiveUnit;
import com.eyelevel.mediamigrator.model.MediaItem;
import com.eyelevel.mediamigrator.model.MediaPhase;
import com.eyelevel.mediamigrator.service.disk.DiskBudgetGovernor;
import com.eyelevel.mediamigrator.service.state.StateStore;
import com.eyelevel.mediamigrator.service.state.TransitionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Iterator;

/**
 * Removes local copies whose content has been durably migrated.
 * <p>
 * Files are deleted first and the archive is marked {@code CLEANED} afterwards, so an interruption leaves a
 * {@code PROCESSED} archive whose cleanup simply runs again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArchiveCleanupService {

    private final StateStore stateStore;
    private final DiskBudgetGovernor diskBudgetGovernor;

    /**
     * @return {@code true} if every item of the archive is {@code UPLOADED} or {@code SKIPPED}.
     */
    public boolean isCleanable(ArchiveUnit archive) {
        long total = stateStore.countItemsOfArchive(archive.getId());
        long done = stateStore.countItemsOfArchiveIn(archive.getId(), MediaPhase.CLEANABLE);
        return total == done;
    }

    /**
     * Cleans every {@code PROCESSED} archive that {@link #isCleanable is cleanable}.
     *
     * @return the number of archives cleaned.
     */
    public int cleanEligibleArchives(int pageSize) {
        Iterator<ArchiveUnit> processed = stateStore.streamArchivesByPhase(ArchivePhase.PROCESSED, pageSize)
                                                    .iterator();
        int cleaned = 0;
        while (processed.hasNext()) {
            ArchiveUnit archive = processed.next();
            if (isCleanable(archive) && clean(archive)) {
                cleaned++;
            }
        }
        return cleaned;
    }

    /**
     * Deletes the archive's local copy and extracted files and marks it {@code CLEANED}.
     */
    public boolean clean(ArchiveUnit archive) {
        long freed;
        try {
            freed = deleteLocalCopies(archive);
        } catch (IOException | UncheckedIOException e) {
            log.warn("[{}] Cleanup failed, will retry: {}", archive.getId(), e.getMessage());
            return false;
        }
        TransitionResult result = stateStore.updateArchive(archive.getId(), ArchivePhase.PROCESSED, unit -> {
            unit.setPhase(ArchivePhase.CLEANED);
            unit.setLocalPath(null);
            unit.setExtractedPath(null);
        });
        if (result.isSuccess()) {
            log.info("[{}] Archive cleaned, {} freed.", archive.getId(), FileUtils.byteCountToDisplaySize(freed));
            return true;
        }
        log.warn("[{}] Files removed but the archive was moved concurrently: {}", archive.getId(), result);
        return false;
    }

    /**
     * Deletes the extracted files of individually uploaded items, regardless of their siblings.
     *
     * @return the number of items pruned.
     */
    public int pruneUploadedItems(int limit) {
        int pruned = 0;
        for (MediaItem item : stateStore.findPrunableItems(limit)) {
            long freed = 0L;
            try {
                freed += deleteFile(item.getSourcePath());
                freed += deleteFile(item.getSidecarPath());
            } catch (IOException e) {
                log.warn("[{}] Could not remove uploaded file: {}", item.getId(), e.getMessage());
                continue;
            }
            diskBudgetGovernor.recordFreed(freed);
            TransitionResult result = stateStore.updateItem(item.getId(), MediaPhase.UPLOADED,
                                                            uploaded -> uploaded.setSourceRemoved(true));
            if (result.isSuccess()) {
                pruned++;
            }
        }
        if (pruned > 0) {
            log.info("Removed extracted files of {} uploaded items to relieve disk pressure.", pruned);
        }
        return pruned;
    }

    /**
     * Deletes the archive's downloaded file and extraction directory.
     *
     * @return bytes freed.
     */
    public long deleteLocalCopies(ArchiveUnit archive) throws IOException {
        long freed = 0L;
        if (archive.getExtractedPath() != null) {
            Path extracted = Paths.get(archive.getExtractedPath());
            if (Files.isDirectory(extracted)) {
                freed += FileUtils.sizeOfDirectory(extracted.toFile());
                FileUtils.deleteDirectory(extracted.toFile());
            }
        }
        freed += deleteFile(archive.getLocalPath());
        diskBudgetGovernor.recordFreed(freed);
        return freed;
    }

    private static long deleteFile(String path) throws IOException {
        if (path == null) {
            return 0L;
        }
        Path file = Paths.get(path);
        if (!Files.isRegularFile(file)) {
            return 0L;
        }
        long size = Files.size(file);
        Files.delete(file);
        return size;
    }
}
