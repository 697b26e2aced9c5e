package com.eyelevel.mediamigrator.collaborator.metadata;

import java.time.Instant;
import java.util.List;

/**
 * Metadata recovered from a Takeout sidecar, already normalised. Absent values are {@code null}.
 */
public record SidecarMetadata(Instant takenAt,
                              Double latitude,
                              Double longitude,
                              Double altitude,
                              String description,
                              String title,
                              List<String> albumHints) {

    public static final SidecarMetadata EMPTY = new SidecarMetadata(null, null, null, null, null, null, List.of());

    public SidecarMetadata {
        albumHints = albumHints == null ? List.of() : List.copyOf(albumHints);
    }

    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }
}
