package com.eyelevel.mediamigrator.service.album;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns raw directory names and sidecar hints into album display names and canonical lookup keys.
 */
@Component
public class AlbumNameNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TAKEOUT_ROOT = Pattern.compile("^takeout(-.*)?$", Pattern.CASE_INSENSITIVE);
    private static final String DATE_BUCKET_PREFIX = "photos from ";
    private static final String GOOGLE_PHOTOS_PREFIX = "google photos ";
    private static final Set<String> CONTAINER_NAMES = Set.of("google photos", "google fotos", "photos", "photos from");

    /**
     * Cleans a directory name or sidecar hint into an album display name.
     *
     * @return empty when the name denotes a Takeout container or a bare date bucket rather than an album.
     */
    public Optional<String> clean(String rawName) {
        if (!StringUtils.hasText(rawName)) {
            return Optional.empty();
        }
        String name = collapse(rawName);
        if (name.length() > GOOGLE_PHOTOS_PREFIX.length()
            && name.toLowerCase(Locale.ROOT).startsWith(GOOGLE_PHOTOS_PREFIX)) {
            name = name.substring(GOOGLE_PHOTOS_PREFIX.length()).trim();
        }
        if (name.toLowerCase(Locale.ROOT).startsWith(DATE_BUCKET_PREFIX)) {
            name = albumAfterDate(name);
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (name.isEmpty() || ".".equals(name) || CONTAINER_NAMES.contains(lower)
            || TAKEOUT_ROOT.matcher(name).matches()) {
            return Optional.empty();
        }
        return Optional.of(name);
    }

    /**
     * "Photos from 2024-01-01 Album Name" names the album after the date; a bare date bucket names none.
     */
    private static String albumAfterDate(String name) {
        String[] parts = name.split(" ");
        if (parts.length <= 3) {
            return "";
        }
        return String.join(" ", Arrays.copyOfRange(parts, 3, parts.length));
    }

    /**
     * Case-insensitive key under which albums are matched across archives and runs.
     */
    public String canonicalKey(String displayName) {
        return collapse(displayName).toLowerCase(Locale.ROOT);
    }

    private static String collapse(String value) {
        return WHITESPACE.matcher(value.trim()).replaceAll(" ");
    }
}
