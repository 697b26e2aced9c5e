package com.eyelevel.mediamigrator.collaborator.metadata;

import com.eyelevel.mediamigrator.common.json.JsonParser;
import com.eyelevel.mediamigrator.exception.json.JsonParsingException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads Google Takeout {@code .json} sidecars into {@link SidecarMetadata}.
 * <p>
 * A missing or unreadable sidecar is not an error: the media file is still migrated, only without the
 * recovered metadata.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SidecarMetadataReader {

    private final JsonParser jsonParser;

    public SidecarMetadata read(Path sidecarPath) {
        if (sidecarPath == null || !Files.isRegularFile(sidecarPath)) {
            return SidecarMetadata.EMPTY;
        }
        TakeoutSidecar sidecar;
        try {
            sidecar = jsonParser.parseObject(sidecarPath, TakeoutSidecar.class);
        } catch (JsonParsingException e) {
            log.warn("Ignoring unreadable sidecar '{}': {}", sidecarPath, e.getMessage());
            return SidecarMetadata.EMPTY;
        }
        if (sidecar == null) {
            return SidecarMetadata.EMPTY;
        }

        Instant takenAt = parseTime(sidecar.getPhotoTakenTime());
        if (takenAt == null) {
            takenAt = parseTime(sidecar.getCreationTime());
        }

        TakeoutSidecar.GeoField geo = usableGeo(sidecar.getGeoData());
        if (geo == null) {
            geo = usableGeo(sidecar.getGeoDataExif());
        }

        return new SidecarMetadata(takenAt,
                                   geo == null ? null : geo.getLatitude(),
                                   geo == null ? null : geo.getLongitude(),
                                   geo == null ? null : geo.getAltitude(),
                                   trimToNull(sidecar.getDescription()),
                                   trimToNull(sidecar.getTitle()),
                                   albumHints(sidecar));
    }

    static Instant parseTime(TakeoutSidecar.TimeField field) {
        if (field == null || !StringUtils.hasText(field.getTimestamp())) {
            return null;
        }
        String raw = field.getTimestamp().trim();
        if (raw.chars().allMatch(Character::isDigit)) {
            try {
                return Instant.ofEpochSecond(Long.parseLong(raw));
            } catch (NumberFormatException | DateTimeException e) {
                log.debug("Sidecar timestamp '{}' is out of range.", raw);
                return null;
            }
        }
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(raw);
            } catch (DateTimeParseException ignored) {
                log.debug("Unrecognised sidecar timestamp '{}'.", raw);
                return null;
            }
        }
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    private static TakeoutSidecar.GeoField usableGeo(TakeoutSidecar.GeoField geo) {
        if (geo == null || geo.getLatitude() == null || geo.getLongitude() == null) {
            return null;
        }
        // Takeout writes 0,0 when the location is unknown.
        if (geo.getLatitude() == 0.0d && geo.getLongitude() == 0.0d) {
            return null;
        }
        return geo;
    }

    private static List<String> albumHints(TakeoutSidecar sidecar) {
        List<String> hints = new ArrayList<>();
        JsonNode albumData = sidecar.getAlbumData();
        if (albumData != null) {
            if (albumData.isTextual()) {
                addHint(hints, albumData.asText());
            } else {
                addHint(hints, titleOrName(albumData));
            }
        }
        JsonNode origin = sidecar.getGooglePhotosOrigin();
        if (origin != null && origin.hasNonNull("albumTitle")) {
            addHint(hints, origin.get("albumTitle").asText());
        }
        if (sidecar.getAlbums() != null) {
            for (JsonNode album : sidecar.getAlbums()) {
                addHint(hints, album == null ? null : album.isTextual() ? album.asText() : titleOrName(album));
            }
        }
        return hints;
    }

    private static String titleOrName(JsonNode node) {
        if (node.hasNonNull("title")) {
            return node.get("title").asText();
        }
        return node.hasNonNull("name") ? node.get("name").asText() : null;
    }

    private static void addHint(List<String> hints, String hint) {
        String trimmed = trimToNull(hint);
        if (trimmed != null && !hints.contains(trimmed)) {
            hints.add(trimmed);
        }
    }
}
