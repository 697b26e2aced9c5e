package com.eyelevel.mediamigrator.repository;

import com.eyelevel.mediamigrator.model.ArchivePhase;
import com.eyelevel.mediamigrator.model.ArchiveUnit;
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
 * Spring Data JPA repository for the {@link ArchiveUnit} entity.
 * JPQL queries are defined in META-INF/archive-unit-orm.xml.
 */
@Repository
public interface ArchiveUnitRepository extends JpaRepository<ArchiveUnit, String> {

    @Modifying
    @Query(name = "ArchiveUnit.updatePhaseIfExpected")
    int updatePhaseIfExpected(@Param("id") String id, @Param("newPhase") ArchivePhase newPhase,
                              @Param("expectedPhase") ArchivePhase expectedPhase, @Param("now") LocalDateTime now);

    @Modifying
    @Query(name = "ArchiveUnit.resetPhase")
    int resetPhase(@Param("inFlightPhase") ArchivePhase inFlightPhase, @Param("resetPhase") ArchivePhase resetPhase,
                   @Param("now") LocalDateTime now);

    @Query(name = "ArchiveUnit.findEligibleByPhase")
    List<ArchiveUnit> findEligibleByPhase(@Param("phase") ArchivePhase phase, @Param("now") LocalDateTime now,
                                          Pageable pageable);

    @Query(name = "ArchiveUnit.findPageByPhaseAfterId")
    List<ArchiveUnit> findPageByPhaseAfterId(@Param("phase") ArchivePhase phase, @Param("afterId") String afterId,
                                             Pageable pageable);

    @Query(name = "ArchiveUnit.countGroupedByPhase")
    List<Object[]> countGroupedByPhase();

    long countByPhase(ArchivePhase phase);

    long countByPhaseIn(Collection<ArchivePhase> phases);

    List<ArchiveUnit> findByPhaseInOrderByIdAsc(Collection<ArchivePhase> phases);
}
