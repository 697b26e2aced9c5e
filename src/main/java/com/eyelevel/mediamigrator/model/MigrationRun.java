package com.eyelevel.mediamigrator.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.ColumnDefault;

import java.time.LocalDateTime;

@Entity
@Table(name = "migration_run")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MigrationRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private RunStatus status;

    /**
     * Total of failed items the operator accepted with "proceed" during this run.
     */
    @ColumnDefault("0")
    @Column(nullable = false)
    private long acknowledgedFailures;

    /**
     * Only items failed after this instant count toward the failure threshold. Moved forward on "proceed".
     */
    private LocalDateTime failuresCountedSince;

    @ColumnDefault("false")
    @Column(nullable = false)
    private boolean discoveryCompleted;

    /**
     * Why the run is paused or was stopped.
     */
    @Column(columnDefinition = "TEXT")
    private String statusReason;

    @Column(nullable = false)
    private LocalDateTime startedAt;

    private LocalDateTime finishedAt;
}
