package com.eyelevel.mediamigrator.service.state;

import com.eyelevel.mediamigrator.model.ArchivePhase;
import com.eyelevel.mediamigrator.model.ArchiveUnit;
import com.eyelevel.mediamigrator.model.MediaItem;
import com.eyelevel.mediamigrator.model.MediaPhase;
import com.eyelevel.mediamigrator.model.RetryRecord;
import com.eyelevel.mediamigrator.support.MigrationIntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class StateStoreTest extends MigrationIntegrationTestSupport {

    @Autowired
    private StateStore stateStore;

    @Test
    void registerDiscoveredLeavesKnownArchivesAlone() {
        assertThat(stateStore.registerDiscovered("takeout-001.zip", "takeout-001.zip", 1024)).isTrue();
        assertThat(stateStore.transitionArchive("takeout-001.zip", ArchivePhase.DISCOVERED,
                                                ArchivePhase.DOWNLOADING)).isEqualTo(TransitionResult.SUCCESS);

        assertThat(stateStore.registerDiscovered("takeout-001.zip", "takeout-001.zip", 2048)).isFalse();

        ArchiveUnit archive = stateStore.findArchive("takeout-001.zip").orElseThrow();
        assertThat(archive.getPhase()).isEqualTo(ArchivePhase.DOWNLOADING);
        assertThat(archive.getExpectedSize()).isEqualTo(1024);
    }

    @Test
    void transitionIsCompareAndSet() {
        stateStore.registerDiscovered("a.zip", "a.zip", 10);

        assertThat(stateStore.transitionArchive("a.zip", ArchivePhase.DISCOVERED, ArchivePhase.DOWNLOADING))
                .isEqualTo(TransitionResult.SUCCESS);
        assertThat(stateStore.transitionArchive("a.zip", ArchivePhase.DISCOVERED, ArchivePhase.DOWNLOADING))
                .isEqualTo(TransitionResult.CONFLICT);
        assertThat(stateStore.transitionArchive("missing.zip", ArchivePhase.DISCOVERED, ArchivePhase.DOWNLOADING))
                .isEqualTo(TransitionResult.NOT_FOUND);
    }

    @Test
    void updateFromStalePhaseIsNotApplied() {
        stateStore.upsertItem(item("a.zip", "Takeout/Google Photos/Trip/1.jpg", MediaPhase.UPLOADED));
        String id = MediaItem.idFor("a.zip", "Takeout/Google Photos/Trip/1.jpg");

        TransitionResult result = stateStore.updateItem(id, MediaPhase.ALBUM_RESOLVED, item -> {
            item.setPhase(MediaPhase.UPLOADING);
            item.setRemoteId("should-not-stick");
        });

        assertThat(result).isEqualTo(TransitionResult.CONFLICT);
        MediaItem stored = stateStore.findItem(id).orElseThrow();
        assertThat(stored.getPhase()).isEqualTo(MediaPhase.UPLOADED);
        assertThat(stored.getRemoteId()).isNull();
    }

    @Test
    void commitExtractionCreatesItemsAndKeepsProgressOfKnownOnes() {
        stateStore.registerDiscovered("a.zip", "a.zip", 10);
        stateStore.transitionArchive("a.zip", ArchivePhase.DISCOVERED, ArchivePhase.DOWNLOADING);
        stateStore.transitionArchive("a.zip", ArchivePhase.DOWNLOADING, ArchivePhase.DOWNLOADED);
        stateStore.transitionArchive("a.zip", ArchivePhase.DOWNLOADED, ArchivePhase.EXTRACTING);

        MediaItem uploaded = item("a.zip", "Takeout/Google Photos/Trip/1.jpg", MediaPhase.UPLOADED);
        uploaded.setRemoteId("remote-1");
        stateStore.upsertItem(uploaded);

        List<MediaItem> extracted = List.of(item("a.zip", "Takeout/Google Photos/Trip/1.jpg", MediaPhase.EXTRACTED),
                                            item("a.zip", "Takeout/Google Photos/Trip/2.jpg", MediaPhase.EXTRACTED));
        List<String> refreshed = new ArrayList<>();

        TransitionResult result = stateStore.commitExtraction("a.zip", "/work/extracted/a", extracted,
                                                              (existing, fresh) -> refreshed.add(existing.getId()));

        assertThat(result).isEqualTo(TransitionResult.SUCCESS);
        assertThat(refreshed).containsExactly(uploaded.getId());
        assertThat(stateStore.findArchive("a.zip").orElseThrow())
                .extracting(ArchiveUnit::getPhase, ArchiveUnit::getExtractedPath)
                .containsExactly(ArchivePhase.EXTRACTED, "/work/extracted/a");
        assertThat(stateStore.findItem(uploaded.getId()).orElseThrow().getRemoteId()).isEqualTo("remote-1");
        assertThat(stateStore.countItemsOfArchive("a.zip")).isEqualTo(2);
    }

    @Test
    void commitExtractionRequiresTheArchiveToBeExtracting() {
        stateStore.registerDiscovered("a.zip", "a.zip", 10);

        TransitionResult result = stateStore.commitExtraction(
                "a.zip", "/x", List.of(item("a.zip", "1.jpg", MediaPhase.EXTRACTED)), (existing, fresh) -> {
                });

        assertThat(result).isEqualTo(TransitionResult.CONFLICT);
        assertThat(stateStore.countItemsOfArchive("a.zip")).isZero();
    }

    @Test
    void resetMovesOnlyTheInFlightPhase() {
        stateStore.upsertItem(item("a.zip", "1.jpg", MediaPhase.UPLOADING));
        stateStore.upsertItem(item("a.zip", "2.jpg", MediaPhase.UPLOADED));

        assertThat(stateStore.resetItems(MediaPhase.UPLOADING, MediaPhase.ALBUM_RESOLVED)).isEqualTo(1);

        assertThat(stateStore.countItems(MediaPhase.ALBUM_RESOLVED)).isEqualTo(1);
        assertThat(stateStore.countItems(MediaPhase.UPLOADED)).isEqualTo(1);
    }

    @Test
    void eligibilityHonoursTheRetryBackoff() {
        MediaItem waiting = item("a.zip", "1.jpg", MediaPhase.ALBUM_RESOLVED);
        waiting.setRetry(RetryRecord.builder().attempts(1).nextEligibleAt(LocalDateTime.now().plusHours(1)).build());
        stateStore.upsertItem(waiting);
        stateStore.upsertItem(item("a.zip", "2.jpg", MediaPhase.ALBUM_RESOLVED));

        assertThat(stateStore.findEligibleItems(MediaPhase.ALBUM_RESOLVED, 10))
                .extracting(MediaItem::getRelativePath)
                .containsExactly("2.jpg");
    }

    @Test
    void streamWalksEveryPage() {
        for (int i = 0; i < 5; i++) {
            stateStore.upsertItem(item("a.zip", i + ".jpg", MediaPhase.EXTRACTED));
        }

        List<String> paths = stateStore.streamItemsByPhase(MediaPhase.EXTRACTED, 2)
                                       .map(MediaItem::getRelativePath)
                                       .collect(Collectors.toList());

        assertThat(paths).containsExactly("0.jpg", "1.jpg", "2.jpg", "3.jpg", "4.jpg");
    }

    @Test
    void listingResumesAfterTheLastIdSeen() {
        for (String id : List.of("c.zip", "a.zip", "b.zip")) {
            stateStore.upsertArchive(ArchiveUnit.builder()
                                                .id(id)
                                                .displayName(id)
                                                .expectedSize(1)
                                                .phase(ArchivePhase.DOWNLOADED)
                                                .build());
        }
        stateStore.upsertArchive(ArchiveUnit.builder()
                                            .id("d.zip")
                                            .displayName("d.zip")
                                            .phase(ArchivePhase.CLEANED)
                                            .build());

        List<ArchiveUnit> first = stateStore.listArchivesByPhase(ArchivePhase.DOWNLOADED, null, 2);
        List<ArchiveUnit> rest = stateStore.listArchivesByPhase(ArchivePhase.DOWNLOADED,
                                                                first.get(first.size() - 1).getId(), 2);

        assertThat(first).extracting(ArchiveUnit::getId).containsExactly("a.zip", "b.zip");
        assertThat(rest).extracting(ArchiveUnit::getId).containsExactly("c.zip");
        assertThat(stateStore.listItemsByPhase(MediaPhase.EXTRACTED, null, 10)).isEmpty();
    }

    private static MediaItem item(String archiveId, String relativePath, MediaPhase phase) {
        return MediaItem.builder()
                        .id(MediaItem.idFor(archiveId, relativePath))
                        .archiveId(archiveId)
                        .relativePath(relativePath)
                        .phase(phase)
                        .build();
    }
}
