package com.eyelevel.mediamigrator.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "album_membership", uniqueConstraints = @UniqueConstraint(name = "uk_album_membership",
                                                                        columnNames = {"album_id",
                                                                                       "media_item_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlbumMembership {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "album_id", nullable = false)
    private Long albumId;

    @Column(name = "media_item_id", nullable = false, length = 3072)
    private String mediaItemId;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;
}
