package com.eyelevel.mediamigrator.collaborator.extract;

import org.apache.commons.io.FilenameUtils;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * File-name rules for Takeout exports: which entries are photos or videos, and where their sidecars are.
 */
public final class MediaFileTypes {

    public static final Set<String> MEDIA_EXTENSIONS = Set.of("jpg", "jpeg", "heic", "png", "gif", "bmp", "tiff",
                                                              "tif", "webp", "avi", "mov", "mp4", "m4v", "3gp",
                                                              "mkv");
    public static final String SIDECAR_EXTENSION = "json";
    private static final String SUPPLEMENTAL_SUFFIX = ".supplemental-metadata.json";

    private MediaFileTypes() {
    }

    public static boolean isMedia(String path) {
        return MEDIA_EXTENSIONS.contains(FilenameUtils.getExtension(path).toLowerCase(Locale.ROOT));
    }

    public static boolean isSidecar(String path) {
        return SIDECAR_EXTENSION.equals(FilenameUtils.getExtension(path).toLowerCase(Locale.ROOT));
    }

    /**
     * Sidecar paths to look for, best match first: {@code IMG.jpg.json}, {@code IMG.json} and
     * {@code IMG.jpg.supplemental-metadata.json}.
     */
    public static List<String> sidecarCandidates(String mediaRelativePath) {
        String withoutExtension = FilenameUtils.removeExtension(mediaRelativePath);
        return List.of(mediaRelativePath + "." + SIDECAR_EXTENSION,
                       withoutExtension + "." + SIDECAR_EXTENSION,
                       mediaRelativePath + SUPPLEMENTAL_SUFFIX);
    }
}
