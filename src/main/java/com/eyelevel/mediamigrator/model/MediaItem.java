package com.eyelevel.mediamigrator.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(name = "media_item", indexes = {
        @Index(name = "idx_media_item_phase", columnList = "phase"),
        @Index(name = "idx_media_item_archive", columnList = "archive_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaItem {

    public static final String ID_SEPARATOR = "::";

    /**
     * {@code <archiveId>::<relativePath>}, stable across restarts and re-extraction.
     */
    @Id
    @Column(length = 3072)
    private String id;

    @Column(name = "archive_id", nullable = false, length = 1024)
    private String archiveId;

    @Column(nullable = false, length = 2048)
    private String relativePath;

    @Column(length = 2048)
    private String sourcePath;

    @Column(length = 2048)
    private String sidecarPath;

    private long fileSize;

    @Column(length = 64)
    private String contentFingerprint;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private MediaPhase phase;

    private LocalDateTime takenAt;
    private Double latitude;
    private Double longitude;
    private Double altitude;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(length = 1024)
    private String title;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "media_item_album_name", joinColumns = @JoinColumn(name = "media_item_id"))
    @Column(name = "album_name", length = 512)
    @Builder.Default
    private Set<String> albumNames = new LinkedHashSet<>();

    @Column(length = 512)
    private String remoteId;

    /**
     * Set once the extracted file has been deleted to relieve disk pressure after upload.
     */
    @ColumnDefault("false")
    @Column(nullable = false)
    private boolean sourceRemoved;

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

    public static String idFor(String archiveId, String relativePath) {
        return archiveId + ID_SEPARATOR + relativePath;
    }

    public RetryRecord getRetry() {
        if (retry == null) {
            retry = RetryRecord.clean();
        }
        return retry;
    }
}
