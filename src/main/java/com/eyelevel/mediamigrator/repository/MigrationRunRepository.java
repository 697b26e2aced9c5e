package com.eyelevel.mediamigrator.repository;

import com.eyelevel.mediamigrator.model.MigrationRun;
import com.eyelevel.mediamigrator.model.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;

/**
 * Spring Data JPA repository for the {@link MigrationRun} entity.
 * JPQL queries are defined in META-INF/migration-run-orm.xml.
 */
@Repository
public interface MigrationRunRepository extends JpaRepository<MigrationRun, Long> {

    Optional<MigrationRun> findFirstByStatusInOrderByIdDesc(Collection<RunStatus> statuses);

    Optional<MigrationRun> findFirstByOrderByIdDesc();

    @Modifying
    @Query(name = "MigrationRun.updateStatusIfExpected")
    int updateStatusIfExpected(@Param("id") Long id, @Param("newStatus") RunStatus newStatus,
                               @Param("expectedStatus") RunStatus expectedStatus,
                               @Param("reason") String reason, @Param("finishedAt") LocalDateTime finishedAt);

    /**
     * Moves a paused run back to RUNNING, adding the failures the operator accepted and restarting the failure
     * window at {@code since}.
     */
    @Modifying
    @Query(name = "MigrationRun.resumeAcknowledging")
    int resumeAcknowledging(@Param("id") Long id, @Param("acknowledgedFailures") long acknowledgedFailures,
                            @Param("since") LocalDateTime since);

    @Modifying
    @Query(name = "MigrationRun.markDiscoveryCompleted")
    int markDiscoveryCompleted(@Param("id") Long id);
}
