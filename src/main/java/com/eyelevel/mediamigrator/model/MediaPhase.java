package com.eyelevel.mediamigrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a single media item extracted from an archive.
 */
public enum MediaPhase {
    EXTRACTED,
    MERGING_METADATA,
    METADATA_MERGED,
    ALBUM_RESOLVED,
    UPLOADING,
    UPLOADED,
    FAILED,
    SKIPPED;

    public static final Set<MediaPhase> TERMINAL = EnumSet.of(UPLOADED, FAILED, SKIPPED);

    /**
     * Terminal phases after which the item's extracted file may be deleted.
     */
    public static final Set<MediaPhase> CLEANABLE = EnumSet.of(UPLOADED, SKIPPED);

    public static final Set<MediaPhase> IN_FLIGHT = EnumSet.of(MERGING_METADATA, UPLOADING);

    public static final Set<MediaPhase> NON_TERMINAL = EnumSet.complementOf(EnumSet.copyOf(TERMINAL));

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
