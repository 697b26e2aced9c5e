package com.eyelevel.mediamigrator.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "archive_unit", indexes = @Index(name = "idx_archive_unit_phase", columnList = "phase"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArchiveUnit {

    /**
     * Remote file id or source path, as reported by the archive source.
     */
    @Id
    @Column(length = 1024)
    private String id;

    @Column(nullable = false, length = 512)
    private String displayName;

    private long expectedSize;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ArchivePhase phase;

    @Column(length = 2048)
    private String localPath;

    @Column(length = 2048)
    private String extractedPath;

    @Column(length = 64)
    private String contentFingerprint;

    @Embedded
    @Builder.Default
    private RetryRecord retry = RetryRecord.clean();

    @Version
    private Long version;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    public RetryRecord getRetry() {
        if (retry == null) {
            retry = RetryRecord.clean();
        }
        return retry;
    }
}
