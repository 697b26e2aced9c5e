package com.eyelevel.mediamigrator.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "album", uniqueConstraints = @UniqueConstraint(name = "uk_album_canonical_key",
                                                             columnNames = "canonical_key"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Album {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "canonical_key", nullable = false, length = 512)
    private String canonicalKey;

    /**
     * Casing of the first observed name for the key. Never overwritten.
     */
    @Column(nullable = false, length = 512, updatable = false)
    private String displayName;

    private Long createdInRunId;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
