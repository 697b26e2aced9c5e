package com.eyelevel.mediamigrator.service.album;

import com.eyelevel.mediamigrator.collaborator.metadata.SidecarMetadata;
import com.eyelevel.mediamigrator.model.Album;
import com.eyelevel.mediamigrator.model.MediaItem;
import com.eyelevel.mediamigrator.service.orchestrator.RunLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Derives the albums of a media item and records its memberships.
 * <p>
 * Candidates come from the item's immediate directory and the sidecar's album hints. Names are matched by
 * canonical key, so {@code Family} and {@code family} land in one album whose display name is the casing
 * observed first. Resolution is idempotent: albums and memberships are created at most once, whoever wins a
 * concurrent insert.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlbumResolver {

    private final AlbumNameNormalizer normalizer;
    private final AlbumAtomicService albumAtomicService;
    private final RunLifecycleService runLifecycleService;

    /**
     * @param directoryPath the item's directory relative to the archive root
     * @return display names of every album the item belongs to, in discovery order
     */
    public Set<String> resolve(MediaItem mediaItem, String directoryPath, SidecarMetadata sidecarMetadata) {
        Map<String, String> candidates = new LinkedHashMap<>();
        addCandidate(candidates, immediateDirectory(directoryPath));
        for (String hint : sidecarMetadata.albumHints()) {
            addCandidate(candidates, hint);
        }

        Set<String> displayNames = new LinkedHashSet<>();
        for (Map.Entry<String, String> candidate : candidates.entrySet()) {
            Album album = findOrCreate(candidate.getKey(), candidate.getValue());
            attach(album, mediaItem.getId());
            displayNames.add(album.getDisplayName());
        }
        log.debug("[{}] Resolved albums {}", mediaItem.getId(), displayNames);
        return displayNames;
    }

    private void addCandidate(Map<String, String> candidates, String rawName) {
        normalizer.clean(rawName)
                  .ifPresent(name -> candidates.putIfAbsent(normalizer.canonicalKey(name), name));
    }

    private Album findOrCreate(String canonicalKey, String displayName) {
        return albumAtomicService.findByCanonicalKey(canonicalKey).orElseGet(() -> {
            try {
                Album created = albumAtomicService.attemptToCreate(Album.builder()
                                                                        .canonicalKey(canonicalKey)
                                                                        .displayName(displayName)
                                                                        .createdInRunId(
                                                                                runLifecycleService.currentRunId())
                                                                        .build());
                log.info("Created album '{}' (key '{}').", created.getDisplayName(), canonicalKey);
                return created;
            } catch (DataIntegrityViolationException e) {
                log.warn("Race condition: album with key '{}' was created concurrently.", canonicalKey);
                return albumAtomicService.findByCanonicalKey(canonicalKey)
                                         .orElseThrow(() -> new IllegalStateException(
                                                 "Album creation raced but no winner found for key " + canonicalKey,
                                                 e));
            }
        });
    }

    private void attach(Album album, String mediaItemId) {
        try {
            albumAtomicService.attemptToAttach(album.getId(), mediaItemId);
        } catch (DataIntegrityViolationException e) {
            log.debug("[{}] Membership in album #{} already recorded concurrently.", mediaItemId, album.getId());
        }
    }

    private static String immediateDirectory(String directoryPath) {
        if (!StringUtils.hasText(directoryPath)) {
            return null;
        }
        String normalized = FilenameUtils.separatorsToUnix(directoryPath);
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return FilenameUtils.getName(normalized);
    }
}
