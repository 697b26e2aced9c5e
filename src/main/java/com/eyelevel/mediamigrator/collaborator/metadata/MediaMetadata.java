package com.eyelevel.mediamigrator.collaborator.metadata;

import java.time.Instant;

/**
 * The tags to write into a media file. Any field may be {@code null}, meaning "leave as is".
 */
public record MediaMetadata(Instant takenAt,
                            Double latitude,
                            Double longitude,
                            Double altitude,
                            String description,
                            String title) {

    public boolean isEmpty() {
        return takenAt == null && latitude == null && longitude == null && altitude == null
               && description == null && title == null;
    }
}
