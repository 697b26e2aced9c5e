package com.eyelevel.mediamigrator.repository;

import com.eyelevel.mediamigrator.model.MediaItem;
import com.eyelevel.mediamigrator.model.MediaPhase;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Spring Data JPA repository for the {@link MediaItem} entity.
 * JPQL queries are defined in META-INF/media-item-orm.xml.
 */
@Repository
public interface MediaItemRepository extends JpaRepository<MediaItem, String> {

    @Modifying
    @Query(name = "MediaItem.updatePhaseIfExpected")
    int updatePhaseIfExpected(@Param("id") String id, @Param("newPhase") MediaPhase newPhase,
                              @Param("expectedPhase") MediaPhase expectedPhase, @Param("now") LocalDateTime now);

    @Modifying
    @Query(name = "MediaItem.resetPhase")
    int resetPhase(@Param("inFlightPhase") MediaPhase inFlightPhase, @Param("resetPhase") MediaPhase resetPhase,
                   @Param("now") LocalDateTime now);

    @Query(name = "MediaItem.findEligibleByPhase")
    List<MediaItem> findEligibleByPhase(@Param("phase") MediaPhase phase, @Param("now") LocalDateTime now,
                                        Pageable pageable);

    @Query(name = "MediaItem.findPageByPhaseAfterId")
    List<MediaItem> findPageByPhaseAfterId(@Param("phase") MediaPhase phase, @Param("afterId") String afterId,
                                           Pageable pageable);

    @Query(name = "MediaItem.findPrunable")
    List<MediaItem> findPrunable(Pageable pageable);

    @Query(name = "MediaItem.countGroupedByPhase")
    List<Object[]> countGroupedByPhase();

    @Query(name = "MediaItem.countOrphans")
    long countOrphans();

    @Query(name = "MediaItem.countUploadedWithoutRemoteId")
    long countUploadedWithoutRemoteId();

    long countByPhase(MediaPhase phase);

    long countByPhaseIn(Collection<MediaPhase> phases);

    long countByPhaseAndRetryFailedAtAfter(MediaPhase phase, LocalDateTime since);

    long countByArchiveId(String archiveId);

    long countByArchiveIdAndPhaseIn(String archiveId, Collection<MediaPhase> phases);

    List<MediaItem> findByArchiveIdOrderByIdAsc(String archiveId);

    List<MediaItem> findByPhaseOrderByIdAsc(MediaPhase phase, Pageable pageable);
}
