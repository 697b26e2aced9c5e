package com.eyelevel.mediamigrator.service.state;

import com.eyelevel.mediamigrator.exception.StateStoreException;
import com.eyelevel.mediamigrator.model.ArchivePhase;
import com.eyelevel.mediamigrator.model.ArchiveUnit;
import com.eyelevel.mediamigrator.model.MediaItem;
import com.eyelevel.mediamigrator.model.MediaPhase;
import com.eyelevel.mediamigrator.model.RetryRecord;
import com.eyelevel.mediamigrator.repository.ArchiveUnitRepository;
import com.eyelevel.mediamigrator.repository.MediaItemRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Durable record of every archive and media item.
 * <p>
 * Every mutation runs in its own {@code REQUIRES_NEW} transaction and is committed before the method returns,
 * so no caller ever observes a partial write. Phase changes are compare-and-set: a plain transition is a single
 * conditional {@code UPDATE ... WHERE phase = :expected}; a transition that also carries data is a versioned
 * read-modify-write that reports {@link TransitionResult#CONFLICT} when another writer got there first.
 * <p>
 * Storage failures surface as {@link StateStoreException}, which is fatal to the run.
 */
@Slf4j
@Service
public class StateStore {

    private final ArchiveUnitRepository archiveUnitRepository;
    private final MediaItemRepository mediaItemRepository;
    private final Clock clock;
    private final TransactionTemplate writeTransaction;
    private final TransactionTemplate readTransaction;

    public StateStore(ArchiveUnitRepository archiveUnitRepository,
                      MediaItemRepository mediaItemRepository,
                      Clock clock,
                      PlatformTransactionManager transactionManager) {
        this.archiveUnitRepository = archiveUnitRepository;
        this.mediaItemRepository = mediaItemRepository;
        this.clock = clock;
        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.writeTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.readTransaction = new TransactionTemplate(transactionManager);
        this.readTransaction.setReadOnly(true);
    }

    //<editor-fold desc="Archives">

    public Optional<ArchiveUnit> findArchive(String id) {
        return read("findArchive", () -> archiveUnitRepository.findById(id));
    }

    public ArchiveUnit upsertArchive(ArchiveUnit unit) {
        return write("upsertArchive", status -> archiveUnitRepository.saveAndFlush(unit));
    }

    /**
     * Records a newly listed archive as {@link ArchivePhase#DISCOVERED}. Archives already known are left untouched,
     * whatever their phase.
     *
     * @return {@code true} if a new record was created.
     */
    public boolean registerDiscovered(String id, String displayName, long expectedSize) {
        try {
            return write("registerDiscovered", status -> {
                if (archiveUnitRepository.existsById(id)) {
                    return false;
                }
                archiveUnitRepository.saveAndFlush(ArchiveUnit.builder()
                                                              .id(id)
                                                              .displayName(displayName)
                                                              .expectedSize(expectedSize)
                                                              .phase(ArchivePhase.DISCOVERED)
                                                              .build());
                return true;
            });
        } catch (DataIntegrityViolationException e) {
            log.debug("[{}] Archive registered concurrently by another writer.", id);
            return false;
        }
    }

    public TransitionResult transitionArchive(String id, ArchivePhase from, ArchivePhase to) {
        TransitionResult result = write("transitionArchive", status -> {
            int updated = archiveUnitRepository.updatePhaseIfExpected(id, to, from, now());
            if (updated > 0) {
                return TransitionResult.SUCCESS;
            }
            return archiveUnitRepository.existsById(id) ? TransitionResult.CONFLICT : TransitionResult.NOT_FOUND;
        });
        log.debug("[{}] Archive transition {} -> {}: {}", id, from, to, result);
        return result;
    }

    /**
     * Applies {@code mutation} to the archive if, and only if, it is still in {@code expectedPhase}.
     * The mutation is expected to set the new phase itself.
     */
    public TransitionResult updateArchive(String id, ArchivePhase expectedPhase, Consumer<ArchiveUnit> mutation) {
        try {
            TransitionResult result = write("updateArchive", status -> {
                Optional<ArchiveUnit> found = archiveUnitRepository.findById(id);
                if (found.isEmpty()) {
                    return TransitionResult.NOT_FOUND;
                }
                ArchiveUnit unit = found.get();
                if (unit.getPhase() != expectedPhase) {
                    return TransitionResult.CONFLICT;
                }
                mutation.accept(unit);
                archiveUnitRepository.saveAndFlush(unit);
                return TransitionResult.SUCCESS;
            });
            log.debug("[{}] Archive update from {}: {}", id, expectedPhase, result);
            return result;
        } catch (OptimisticLockingFailureException e) {
            log.debug("[{}] Archive update from {} lost a concurrent write.", id, expectedPhase);
            return TransitionResult.CONFLICT;
        }
    }

    /**
     * Atomically completes an extraction: moves the archive from {@code EXTRACTING} to {@code EXTRACTED} and
     * persists the extracted items in the same transaction. Items that already exist are handed to
     * {@code refreshExisting} together with the freshly extracted version instead of being replaced.
     */
    public TransitionResult commitExtraction(String archiveId, String extractedPath, List<MediaItem> extracted,
                                             BiConsumer<MediaItem, MediaItem> refreshExisting) {
        try {
            return write("commitExtraction", status -> {
                Optional<ArchiveUnit> found = archiveUnitRepository.findById(archiveId);
                if (found.isEmpty()) {
                    return TransitionResult.NOT_FOUND;
                }
                ArchiveUnit unit = found.get();
                if (unit.getPhase() != ArchivePhase.EXTRACTING) {
                    return TransitionResult.CONFLICT;
                }
                for (MediaItem fresh : extracted) {
                    Optional<MediaItem> existing = mediaItemRepository.findById(fresh.getId());
                    if (existing.isPresent()) {
                        refreshExisting.accept(existing.get(), fresh);
                        mediaItemRepository.save(existing.get());
                    } else {
                        mediaItemRepository.save(fresh);
                    }
                }
                unit.setPhase(ArchivePhase.EXTRACTED);
                unit.setExtractedPath(extractedPath);
                unit.setRetry(RetryRecord.clean());
                archiveUnitRepository.saveAndFlush(unit);
                return TransitionResult.SUCCESS;
            });
        } catch (OptimisticLockingFailureException e) {
            log.debug("[{}] Extraction commit lost a concurrent write.", archiveId);
            return TransitionResult.CONFLICT;
        }
    }

    public List<ArchiveUnit> listArchivesByPhase(ArchivePhase phase, String afterId, int pageSize) {
        return read("listArchivesByPhase", () -> archiveUnitRepository.findPageByPhaseAfterId(
                phase, afterId == null ? "" : afterId, PageRequest.ofSize(pageSize)));
    }

    /**
     * A lazy, restartable walk over every archive in {@code phase}, one keyset page at a time.
     */
    public Stream<ArchiveUnit> streamArchivesByPhase(ArchivePhase phase, int pageSize) {
        return lazyStream(new KeysetPageIterator<>(afterId -> listArchivesByPhase(phase, afterId, pageSize),
                                                   ArchiveUnit::getId, pageSize));
    }

    /**
     * Archives in {@code phase} whose retry back-off, if any, has elapsed; ordered by id.
     */
    public List<ArchiveUnit> findEligibleArchives(ArchivePhase phase, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return read("findEligibleArchives",
                    () -> archiveUnitRepository.findEligibleByPhase(phase, now(), PageRequest.ofSize(limit)));
    }

    public List<ArchiveUnit> findArchivesIn(Collection<ArchivePhase> phases) {
        return read("findArchivesIn", () -> archiveUnitRepository.findByPhaseInOrderByIdAsc(phases));
    }

    public long countArchives(ArchivePhase phase) {
        return read("countArchives", () -> archiveUnitRepository.countByPhase(phase));
    }

    public long countArchivesIn(Collection<ArchivePhase> phases) {
        return read("countArchivesIn", () -> archiveUnitRepository.countByPhaseIn(phases));
    }

    public Map<ArchivePhase, Long> countArchivesByPhase() {
        return read("countArchivesByPhase", () -> {
            Map<ArchivePhase, Long> counts = new EnumMap<>(ArchivePhase.class);
            for (Object[] row : archiveUnitRepository.countGroupedByPhase()) {
                counts.put((ArchivePhase) row[0], ((Number) row[1]).longValue());
            }
            return counts;
        });
    }

    /**
     * Moves every archive found in {@code inFlightPhase} back to {@code resetPhase}.
     *
     * @return the number of archives reset.
     */
    public int resetArchives(ArchivePhase inFlightPhase, ArchivePhase resetPhase) {
        return write("resetArchives", status -> archiveUnitRepository.resetPhase(inFlightPhase, resetPhase, now()));
    }
    //</editor-fold>

    //<editor-fold desc="Media items">

    public Optional<MediaItem> findItem(String id) {
        return read("findItem", () -> mediaItemRepository.findById(id));
    }

    public MediaItem upsertItem(MediaItem item) {
        return write("upsertItem", status -> mediaItemRepository.saveAndFlush(item));
    }

    public TransitionResult transitionItem(String id, MediaPhase from, MediaPhase to) {
        TransitionResult result = write("transitionItem", status -> {
            int updated = mediaItemRepository.updatePhaseIfExpected(id, to, from, now());
            if (updated > 0) {
                return TransitionResult.SUCCESS;
            }
            return mediaItemRepository.existsById(id) ? TransitionResult.CONFLICT : TransitionResult.NOT_FOUND;
        });
        log.debug("[{}] Item transition {} -> {}: {}", id, from, to, result);
        return result;
    }

    /**
     * Applies {@code mutation} to the item if, and only if, it is still in {@code expectedPhase}.
     * The mutation is expected to set the new phase itself.
     */
    public TransitionResult updateItem(String id, MediaPhase expectedPhase, Consumer<MediaItem> mutation) {
        try {
            TransitionResult result = write("updateItem", status -> {
                Optional<MediaItem> found = mediaItemRepository.findById(id);
                if (found.isEmpty()) {
                    return TransitionResult.NOT_FOUND;
                }
                MediaItem item = found.get();
                if (item.getPhase() != expectedPhase) {
                    return TransitionResult.CONFLICT;
                }
                mutation.accept(item);
                mediaItemRepository.saveAndFlush(item);
                return TransitionResult.SUCCESS;
            });
            log.debug("[{}] Item update from {}: {}", id, expectedPhase, result);
            return result;
        } catch (OptimisticLockingFailureException e) {
            log.debug("[{}] Item update from {} lost a concurrent write.", id, expectedPhase);
            return TransitionResult.CONFLICT;
        }
    }

    public List<MediaItem> listItemsByPhase(MediaPhase phase, String afterId, int pageSize) {
        return read("listItemsByPhase", () -> mediaItemRepository.findPageByPhaseAfterId(
                phase, afterId == null ? "" : afterId, PageRequest.ofSize(pageSize)));
    }

    public Stream<MediaItem> streamItemsByPhase(MediaPhase phase, int pageSize) {
        return lazyStream(new KeysetPageIterator<>(afterId -> listItemsByPhase(phase, afterId, pageSize),
                                                   MediaItem::getId, pageSize));
    }

    public List<MediaItem> findEligibleItems(MediaPhase phase, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return read("findEligibleItems",
                    () -> mediaItemRepository.findEligibleByPhase(phase, now(), PageRequest.ofSize(limit)));
    }

    public List<MediaItem> findItemsOfArchive(String archiveId) {
        return read("findItemsOfArchive", () -> mediaItemRepository.findByArchiveIdOrderByIdAsc(archiveId));
    }

    public List<MediaItem> findItemsInPhase(MediaPhase phase, int limit) {
        return read("findItemsInPhase",
                    () -> mediaItemRepository.findByPhaseOrderByIdAsc(phase, PageRequest.ofSize(limit)));
    }

    /**
     * Uploaded items whose extracted file is still on disk.
     */
    public List<MediaItem> findPrunableItems(int limit) {
        return read("findPrunableItems", () -> mediaItemRepository.findPrunable(PageRequest.ofSize(limit)));
    }

    public long countItems(MediaPhase phase) {
        return read("countItems", () -> mediaItemRepository.countByPhase(phase));
    }

    /**
     * Items that became FAILED strictly after {@code since}.
     */
    public long countItemsFailedSince(LocalDateTime since) {
        return read("countItemsFailedSince",
                    () -> mediaItemRepository.countByPhaseAndRetryFailedAtAfter(MediaPhase.FAILED, since));
    }

    public long countItemsIn(Collection<MediaPhase> phases) {
        return read("countItemsIn", () -> mediaItemRepository.countByPhaseIn(phases));
    }

    public long countItemsOfArchive(String archiveId) {
        return read("countItemsOfArchive", () -> mediaItemRepository.countByArchiveId(archiveId));
    }

    public long countItemsOfArchiveIn(String archiveId, Collection<MediaPhase> phases) {
        return read("countItemsOfArchiveIn",
                    () -> mediaItemRepository.countByArchiveIdAndPhaseIn(archiveId, phases));
    }

    public Map<MediaPhase, Long> countItemsByPhase() {
        return read("countItemsByPhase", () -> {
            Map<MediaPhase, Long> counts = new EnumMap<>(MediaPhase.class);
            for (Object[] row : mediaItemRepository.countGroupedByPhase()) {
                counts.put((MediaPhase) row[0], ((Number) row[1]).longValue());
            }
            return counts;
        });
    }

    public int resetItems(MediaPhase inFlightPhase, MediaPhase resetPhase) {
        return write("resetItems", status -> mediaItemRepository.resetPhase(inFlightPhase, resetPhase, now()));
    }
    //</editor-fold>

    //<editor-fold desc="Private Helper Methods">

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private <T> T write(String operation, TransactionCallback<T> callback) {
        try {
            return writeTransaction.execute(callback);
        } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
            throw e;
        } catch (DataAccessException | TransactionException e) {
            log.error("CRITICAL: State Store write '{}' failed.", operation, e);
            throw new StateStoreException("State Store write '" + operation + "' failed: " + e.getMessage(), e);
        }
    }

    private <T> T read(String operation, Supplier<T> query) {
        try {
            return readTransaction.execute(status -> query.get());
        } catch (DataAccessException | TransactionException e) {
            log.error("CRITICAL: State Store read '{}' failed.", operation, e);
            throw new StateStoreException("State Store read '" + operation + "' failed: " + e.getMessage(), e);
        }
    }

    private static <T> Stream<T> lazyStream(KeysetPageIterator<T> iterator) {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false);
    }
    //</editor-fold>
}
