package com.eyelevel.mediamigrator.service.state;

import com.eyelevel.mediamigrator.exception.StateStoreException;
import com.eyelevel.mediamigrator.repository.AlbumMembershipRepository;
import com.eyelevel.mediamigrator.repository.AlbumRepository;
import com.eyelevel.mediamigrator.repository.ArchiveUnitRepository;
import com.eyelevel.mediamigrator.repository.MediaItemRepository;
import com.eyelevel.mediamigrator.repository.MigrationRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Opens the State Store at startup and checks that it can be read and that its cross-table invariants hold.
 * Any failure aborts application startup; a damaged store is never reset or overwritten.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class StateStoreIntegrityVerifier implements ApplicationRunner {

    private final ArchiveUnitRepository archiveUnitRepository;
    private final MediaItemRepository mediaItemRepository;
    private final AlbumRepository albumRepository;
    private final AlbumMembershipRepository albumMembershipRepository;
    private final MigrationRunRepository migrationRunRepository;

    @Override
    public void run(ApplicationArguments args) {
        verify();
    }

    public void verify() {
        log.info("Verifying State Store integrity...");
        try {
            long archives = archiveUnitRepository.count();
            long items = mediaItemRepository.count();
            long albums = albumRepository.count();
            long memberships = albumMembershipRepository.count();
            long runs = migrationRunRepository.count();

            long orphanItems = mediaItemRepository.countOrphans();
            if (orphanItems > 0) {
                throw new StateStoreException(
                        orphanItems + " media item(s) reference archives missing from the State Store.");
            }
            long uploadedWithoutRemoteId = mediaItemRepository.countUploadedWithoutRemoteId();
            if (uploadedWithoutRemoteId > 0) {
                throw new StateStoreException(
                        uploadedWithoutRemoteId + " media item(s) are marked uploaded without a remote id.");
            }

            log.info("State Store verified: {} archives, {} items, {} albums, {} memberships, {} runs.",
                     archives, items, albums, memberships, runs);
        } catch (DataAccessException e) {
            log.error("CRITICAL: State Store could not be read. Refusing to start; the store will not be reset.", e);
            throw new StateStoreException("State Store is unreadable: " + e.getMessage(), e);
        } catch (StateStoreException e) {
            log.error("CRITICAL: State Store integrity check failed: {}. Refusing to start.", e.getMessage());
            throw e;
        }
    }
}
