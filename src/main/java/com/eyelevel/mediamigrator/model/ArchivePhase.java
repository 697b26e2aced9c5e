package com.eyelevel.mediamigrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a downloaded Takeout archive.
 */
public enum ArchivePhase {
    DISCOVERED,
    DOWNLOADING,
    DOWNLOADED,
    EXTRACTING,
    EXTRACTED,
    PROCESSED,
    CLEANED,
    CORRUPTED,
    FAILED,
    SKIPPED;

    public static final Set<ArchivePhase> IN_FLIGHT = EnumSet.of(DOWNLOADING, EXTRACTING);

    /**
     * Phases with work still ahead of them in the pipeline.
     */
    public static final Set<ArchivePhase> PENDING = EnumSet.of(DISCOVERED, DOWNLOADING, DOWNLOADED, EXTRACTING,
                                                               EXTRACTED);

    public boolean isInFlight() {
        return IN_FLIGHT.contains(this);
    }
}
