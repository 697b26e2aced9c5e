package com.eyelevel.mediamigrator.service.orchestrator;

import com.eyelevel.mediamigrator.config.MigrationProperties;
import com.eyelevel.mediamigrator.model.Album;
import com.eyelevel.mediamigrator.model.ArchivePhase;
import com.eyelevel.mediamigrator.model.ArchiveUnit;
import com.eyelevel.mediamigrator.model.FailureKind;
import com.eyelevel.mediamigrator.model.MediaItem;
import com.eyelevel.mediamigrator.model.MediaPhase;
import com.eyelevel.mediamigrator.model.RunStatus;
import com.eyelevel.mediamigrator.service.disk.DiskBudgetGovernor;
import com.eyelevel.mediamigrator.service.operator.OperatorActionService;
import com.eyelevel.mediamigrator.service.state.StateStore;
import com.eyelevel.mediamigrator.support.MigrationIntegrationTestSupport;
import com.eyelevel.mediamigrator.support.TakeoutZips;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Predicate;

import static com.eyelevel.mediamigrator.support.TakeoutZips.PHOTOS_ROOT;
import static org.assertj.core.api.Assertions.assertThat;

class PipelineOrchestratorIntegrationTest extends MigrationIntegrationTestSupport {

    private static final int MAX_STEPS = 60;
    private static final int FILLER_LENGTH = 20_000;
    private static final String FILLER_ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/";

    @Autowired
    private PipelineOrchestrator orchestrator;

    @Autowired
    private RunLifecycleService runLifecycleService;

    @Autowired
    private OperatorActionService operatorActionService;

    @Autowired
    private StateStore stateStore;

    @Autowired
    private DiskBudgetGovernor diskBudgetGovernor;

    @Test
    void permanentFailureDoesNotBlockSiblingsButHoldsBackCleanup() throws Exception {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put(PHOTOS_ROOT + "Trip/1.jpg", "one");
        entries.put(PHOTOS_ROOT + "Trip/1.jpg.json",
                    "{\"title\":\"Beach\",\"photoTakenTime\":{\"timestamp\":\"1562942400\"}}");
        entries.put(PHOTOS_ROOT + "Trip/2.jpg", "two");
        entries.put(PHOTOS_ROOT + "Trip/3.jpg", "three");
        TakeoutZips.write(sourceDir().resolve("a.zip"), entries);
        photoUploader.failPermanently("2.jpg");

        RunState run = runUntil(runLifecycleService.startOrResume(), state -> !state.isActive());

        assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(itemPhase("a.zip", "Trip/1.jpg")).isEqualTo(MediaPhase.UPLOADED);
        assertThat(itemPhase("a.zip", "Trip/3.jpg")).isEqualTo(MediaPhase.UPLOADED);
        MediaItem failed = item("a.zip", "Trip/2.jpg");
        assertThat(failed.getPhase()).isEqualTo(MediaPhase.FAILED);
        assertThat(failed.getRetry().getFailureKind()).isEqualTo(FailureKind.PERMANENT);
        assertThat(archivePhase("a.zip")).isEqualTo(ArchivePhase.PROCESSED);
        assertThat(metadataTagger.applied()).containsKey("1.jpg");
        assertThat(metadataTagger.applied().get("1.jpg").title()).isEqualTo("Beach");

        operatorActionService.skipItem(failed.getId());
        run = runUntil(runLifecycleService.startOrResume(), state -> !state.isActive());

        assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(archivePhase("a.zip")).isEqualTo(ArchivePhase.CLEANED);
        assertThat(Files.exists(Paths.get(item("a.zip", "Trip/1.jpg").getSourcePath()))).isFalse();
        assertThat(photoUploader.callsFor("1.jpg")).isEqualTo(1);
    }

    @Test
    void albumsDifferingOnlyInCaseAreMergedAcrossArchives() throws Exception {
        TakeoutZips.write(sourceDir().resolve("a.zip"), Map.of(PHOTOS_ROOT + "Family/a1.jpg", "a1"));
        TakeoutZips.write(sourceDir().resolve("b.zip"), Map.of(PHOTOS_ROOT + "family/b1.jpg", "b1"));

        RunState run = runUntil(runLifecycleService.startOrResume(), state -> !state.isActive());

        assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
        List<Album> albums = albumRepository.findAll();
        assertThat(albums).hasSize(1);
        assertThat(albums.get(0).getDisplayName()).isEqualTo("Family");
        assertThat(albumMembershipRepository.countByAlbumId(albums.get(0).getId())).isEqualTo(2);
        assertThat(item("a.zip", "Family/a1.jpg").getAlbumNames()).containsExactly("Family");
        assertThat(item("b.zip", "family/b1.jpg").getAlbumNames()).containsExactly("Family");
    }

    @Test
    void restartNeverUploadsAnItemTwice() throws Exception {
        Map<String, String> entries = new LinkedHashMap<>();
        for (int i = 0; i < 100; i++) {
            entries.put(String.format("%sBulk/IMG_%03d.jpg", PHOTOS_ROOT, i), "photo " + i);
        }
        TakeoutZips.write(sourceDir().resolve("bulk.zip"), entries);

        properties.getConcurrency().setUpload(0);
        RunState run = runUntil(runLifecycleService.startOrResume(),
                                state -> stateStore.countItems(MediaPhase.ALBUM_RESOLVED) == 100);
        assertThat(stateStore.countItems(MediaPhase.ALBUM_RESOLVED)).isEqualTo(100);

        // 40 uploads finished and 2 were cut off mid-call when the process died.
        List<String> alreadyUploaded = new ArrayList<>();
        for (MediaItem item : stateStore.findItemsInPhase(MediaPhase.ALBUM_RESOLVED, 40)) {
            String fileName = Paths.get(item.getRelativePath()).getFileName().toString();
            stateStore.updateItem(item.getId(), MediaPhase.ALBUM_RESOLVED, uploaded -> {
                uploaded.setPhase(MediaPhase.UPLOADED);
                uploaded.setRemoteId("remote-" + fileName);
            });
            alreadyUploaded.add(fileName);
        }
        for (MediaItem item : stateStore.findItemsInPhase(MediaPhase.ALBUM_RESOLVED, 2)) {
            stateStore.transitionItem(item.getId(), MediaPhase.ALBUM_RESOLVED, MediaPhase.UPLOADING);
        }

        assertThat(orchestrator.recoverInFlight()).isEqualTo(2);
        properties.getConcurrency().setUpload(4);
        run = runUntil(runLifecycleService.startOrResume(), state -> !state.isActive());

        assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(photoUploader.uploadedFileNames()).hasSize(60)
                                                     .doesNotHaveDuplicates()
                                                     .doesNotContainAnyElementsOf(alreadyUploaded);
        assertThat(stateStore.countItems(MediaPhase.UPLOADED)).isEqualTo(100);
    }

    @Test
    void transientFailuresStopAtTheAttemptBudget() throws Exception {
        TakeoutZips.write(sourceDir().resolve("a.zip"), Map.of(PHOTOS_ROOT + "Trip/flaky.jpg", "x"));
        photoUploader.failTransiently("flaky.jpg");

        RunState run = runUntil(runLifecycleService.startOrResume(), state -> !state.isActive());

        assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(photoUploader.callsFor("flaky.jpg")).isEqualTo(properties.getRetry().getMaxAttempts());
        MediaItem item = item("a.zip", "Trip/flaky.jpg");
        assertThat(item.getPhase()).isEqualTo(MediaPhase.FAILED);
        assertThat(item.getRetry().getAttempts()).isEqualTo(properties.getRetry().getMaxAttempts());
        assertThat(item.getRetry().getFailedInPhase()).isEqualTo(MediaPhase.ALBUM_RESOLVED.name());
    }

    @Test
    void tooManyFailuresPauseTheRunAndCleanupUntilTheOperatorProceeds() throws Exception {
        Map<String, String> failing = new LinkedHashMap<>();
        for (int i = 1; i <= 4; i++) {
            failing.put(PHOTOS_ROOT + "Trip/fail" + i + ".jpg", "fail " + i);
            photoUploader.failPermanently("fail" + i + ".jpg");
        }
        TakeoutZips.write(sourceDir().resolve("a.zip"), failing);
        TakeoutZips.write(sourceDir().resolve("b.zip"), Map.of(PHOTOS_ROOT + "Trip/ok5.jpg", "ok 5",
                                                               PHOTOS_ROOT + "Trip/ok6.jpg", "ok 6"));

        RunState run = runUntil(runLifecycleService.startOrResume(),
                                state -> state.is(RunStatus.PAUSED_FOR_RETRIES) || !state.isActive());
        assertThat(run.status()).isEqualTo(RunStatus.PAUSED_FOR_RETRIES);
        assertThat(run.statusReason()).contains("finished items failed");

        run = runUntil(run, state -> archivePhase("b.zip") == ArchivePhase.PROCESSED);
        run = orchestrator.step(run);
        assertThat(run.status()).isEqualTo(RunStatus.PAUSED_FOR_RETRIES);
        assertThat(archivePhase("b.zip")).isEqualTo(ArchivePhase.PROCESSED);
        assertThat(photoUploader.callsFor("ok5.jpg")).isEqualTo(1);

        assertThat(operatorActionService.proceed().getAcknowledgedFailures()).isEqualTo(4);
        run = runUntil(runLifecycleService.refresh(run.runId()), state -> !state.isActive());

        assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(archivePhase("b.zip")).isEqualTo(ArchivePhase.CLEANED);
        assertThat(archivePhase("a.zip")).isEqualTo(ArchivePhase.PROCESSED);
    }

    @Test
    void failuresAfterProceedPauseTheRunAgain() throws Exception {
        Map<String, String> failing = new LinkedHashMap<>();
        for (int i = 1; i <= 4; i++) {
            failing.put(PHOTOS_ROOT + "Trip/fail" + i + ".jpg", "fail " + i);
            photoUploader.failPermanently("fail" + i + ".jpg");
        }
        TakeoutZips.write(sourceDir().resolve("a.zip"), failing);
        TakeoutZips.write(sourceDir().resolve("b.zip"), Map.of(PHOTOS_ROOT + "Trip/ok5.jpg", "ok 5",
                                                               PHOTOS_ROOT + "Trip/ok6.jpg", "ok 6"));
        RunState run = runUntil(runLifecycleService.startOrResume(),
                                state -> state.is(RunStatus.PAUSED_FOR_RETRIES) || !state.isActive());
        assertThat(run.status()).isEqualTo(RunStatus.PAUSED_FOR_RETRIES);

        assertThat(operatorActionService.proceed().getAcknowledgedFailures()).isEqualTo(4);
        for (int i = 1; i <= 4; i++) {
            operatorActionService.skipItem(item("a.zip", "Trip/fail" + i + ".jpg").getId());
        }

        Map<String, String> moreFailing = new LinkedHashMap<>();
        for (int i = 1; i <= 8; i++) {
            moreFailing.put(PHOTOS_ROOT + "Later/late" + i + ".jpg", "late " + i);
            photoUploader.failPermanently("late" + i + ".jpg");
        }
        TakeoutZips.write(sourceDir().resolve("c.zip"), moreFailing);
        operatorActionService.discover();

        run = runUntil(runLifecycleService.refresh(run.runId()),
                       state -> state.is(RunStatus.PAUSED_FOR_RETRIES) || !state.isActive());

        assertThat(run.status()).isEqualTo(RunStatus.PAUSED_FOR_RETRIES);
        assertThat(stateStore.countItems(MediaPhase.FAILED)).isEqualTo(8);
        assertThat(operatorActionService.proceed().getAcknowledgedFailures()).isEqualTo(12);
    }

    @Test
    void failuresLeftByAnEarlierRunDoNotPauseANewOne() throws Exception {
        Map<String, String> failing = new LinkedHashMap<>();
        for (int i = 1; i <= 4; i++) {
            failing.put(PHOTOS_ROOT + "Trip/fail" + i + ".jpg", "fail " + i);
            photoUploader.failPermanently("fail" + i + ".jpg");
        }
        TakeoutZips.write(sourceDir().resolve("a.zip"), failing);
        properties.getOrchestrator().setMinItemsForThreshold(100);
        try {
            RunState first = runUntil(runLifecycleService.startOrResume(), state -> !state.isActive());
            assertThat(first.status()).isEqualTo(RunStatus.COMPLETED);
        } finally {
            properties.getOrchestrator().setMinItemsForThreshold(4);
        }

        TakeoutZips.write(sourceDir().resolve("b.zip"), Map.of(PHOTOS_ROOT + "Trip/ok5.jpg", "ok 5"));
        RunState second = runUntil(runLifecycleService.startOrResume(), state -> !state.isActive());

        assertThat(second.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(archivePhase("b.zip")).isEqualTo(ArchivePhase.CLEANED);
        assertThat(stateStore.countItems(MediaPhase.FAILED)).isEqualTo(4);
    }

    @Test
    void downloadThatDoesNotFitIsDeferredUntilCleanupFreesSpace() throws Exception {
        Path a = TakeoutZips.write(sourceDir().resolve("a.zip"), withFiller("Trip/a1.jpg", 1L));
        Path b = TakeoutZips.write(sourceDir().resolve("b.zip"), withFiller("Trip/b1.jpg", 2L));
        long ceiling = measuredBaseline() + Files.size(a) + Files.size(b) / 2;

        MigrationProperties.Disk disk = properties.getDisk();
        long originalCeiling = disk.getCeilingBytes();
        double originalFactor = disk.getExtractionFactor();
        disk.setCeilingBytes(ceiling);
        disk.setExtractionFactor(0.01);
        try {
            RunState run = runUntil(runLifecycleService.startOrResume(),
                                    state -> archiveIs("a.zip", ArchivePhase.EXTRACTED));
            assertThat(archivePhase("b.zip")).isEqualTo(ArchivePhase.DISCOVERED);

            run = runUntil(run, state -> archiveIs("a.zip", ArchivePhase.CLEANED));
            assertThat(photoUploader.uploadedFileNames()).containsExactly("a1.jpg");

            run = runUntil(run, state -> !state.isActive());

            assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(archivePhase("b.zip")).isEqualTo(ArchivePhase.CLEANED);
            assertThat(photoUploader.uploadedFileNames()).containsExactly("a1.jpg", "b1.jpg");
        } finally {
            disk.setCeilingBytes(originalCeiling);
            disk.setExtractionFactor(originalFactor);
        }
    }

    @Test
    void deferredAdmissionBelowTheCleanupThresholdRemovesUploadedFiles() throws Exception {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put(PHOTOS_ROOT + "Trip/1.jpg", "one");
        entries.put(PHOTOS_ROOT + "Trip/2.jpg", "two");
        Path a = TakeoutZips.write(sourceDir().resolve("a.zip"), entries);
        Path b = TakeoutZips.write(sourceDir().resolve("b.zip"), withFiller("Trip/b1.jpg", 3L));
        photoUploader.failPermanently("2.jpg");
        long ceiling = measuredBaseline() + Files.size(a) + Files.size(b) / 2;

        MigrationProperties.Disk disk = properties.getDisk();
        long originalCeiling = disk.getCeilingBytes();
        long originalThreshold = disk.getCleanupThresholdBytes();
        disk.setCeilingBytes(ceiling);
        disk.setCleanupThresholdBytes(ceiling);
        try {
            RunState run = runUntil(runLifecycleService.startOrResume(),
                                    state -> stateStore.findItem(MediaItem.idFor("a.zip", PHOTOS_ROOT + "Trip/1.jpg"))
                                                       .map(MediaItem::isSourceRemoved)
                                                       .orElse(false));

            MediaItem uploaded = item("a.zip", "Trip/1.jpg");
            assertThat(uploaded.isSourceRemoved()).isTrue();
            assertThat(uploaded.getPhase()).isEqualTo(MediaPhase.UPLOADED);
            assertThat(Files.exists(Paths.get(uploaded.getSourcePath()))).isFalse();
            assertThat(Files.exists(Paths.get(item("a.zip", "Trip/2.jpg").getSourcePath()))).isTrue();
            assertThat(archivePhase("a.zip")).isEqualTo(ArchivePhase.PROCESSED);
            assertThat(archivePhase("b.zip")).isEqualTo(ArchivePhase.DISCOVERED);
            assertThat(run.status()).isEqualTo(RunStatus.RUNNING);

            operatorActionService.skipItem(item("a.zip", "Trip/2.jpg").getId());
            run = runUntil(runLifecycleService.refresh(run.runId()), state -> !state.isActive());

            assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
            assertThat(archivePhase("a.zip")).isEqualTo(ArchivePhase.CLEANED);
            assertThat(archivePhase("b.zip")).isEqualTo(ArchivePhase.CLEANED);
            assertThat(photoUploader.callsFor("1.jpg")).isEqualTo(1);
        } finally {
            disk.setCeilingBytes(originalCeiling);
            disk.setCleanupThresholdBytes(originalThreshold);
        }
    }

    @Test
    void archiveLargerThanTheWholeBudgetFailsWithoutBlockingTheRun() throws Exception {
        Path big = TakeoutZips.write(sourceDir().resolve("big.zip"), withFiller("Trip/big.jpg", 4L));
        TakeoutZips.write(sourceDir().resolve("small.zip"), Map.of(PHOTOS_ROOT + "Trip/small.jpg", "small"));

        MigrationProperties.Disk disk = properties.getDisk();
        long originalCeiling = disk.getCeilingBytes();
        disk.setCeilingBytes(Files.size(big) - 1);
        try {
            RunState run = runUntil(runLifecycleService.startOrResume(), state -> !state.isActive());

            assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
            ArchiveUnit rejected = stateStore.findArchive("big.zip").orElseThrow();
            assertThat(rejected.getPhase()).isEqualTo(ArchivePhase.FAILED);
            assertThat(rejected.getRetry().getFailureKind()).isEqualTo(FailureKind.RESOURCE_EXHAUSTED);
            assertThat(rejected.getRetry().getAttempts()).isZero();
            assertThat(stateStore.countItemsOfArchive("big.zip")).isZero();
            assertThat(archivePhase("small.zip")).isEqualTo(ArchivePhase.CLEANED);
            assertThat(photoUploader.uploadedFileNames()).containsExactly("small.jpg");
        } finally {
            disk.setCeilingBytes(originalCeiling);
        }
    }

    @Test
    void corruptArchiveIsQuarantinedUntilReacquired() throws Exception {
        Path source = TakeoutZips.write(sourceDir().resolve("c.zip"), Map.of(PHOTOS_ROOT + "Trip/c1.jpg", "c1"));
        byte[] intact = Files.readAllBytes(source);
        TakeoutZips.breakCentralDirectory(source);

        RunState run = runUntil(runLifecycleService.startOrResume(), state -> !state.isActive());

        assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(archivePhase("c.zip")).isEqualTo(ArchivePhase.CORRUPTED);
        assertThat(stateStore.findArchive("c.zip").orElseThrow().getRetry().getFailureKind())
                .isEqualTo(FailureKind.CORRUPT_INPUT);
        assertThat(stateStore.countItemsOfArchive("c.zip")).isZero();

        Files.write(source, intact);
        assertThat(operatorActionService.reacquireArchive("c.zip").phase()).isEqualTo(ArchivePhase.DISCOVERED.name());
        run = runUntil(runLifecycleService.startOrResume(), state -> !state.isActive());

        assertThat(run.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(archivePhase("c.zip")).isEqualTo(ArchivePhase.CLEANED);
        assertThat(photoUploader.uploadedFileNames()).containsExactly("c1.jpg");
    }

    @Test
    void stopFinishesOnceNothingIsInFlight() throws Exception {
        TakeoutZips.write(sourceDir().resolve("a.zip"), Map.of(PHOTOS_ROOT + "Trip/1.jpg", "one"));
        RunState run = orchestrator.step(runLifecycleService.startOrResume());

        operatorActionService.stop();
        run = orchestrator.step(runLifecycleService.refresh(run.runId()));

        assertThat(run.status()).isEqualTo(RunStatus.STOPPED);
        assertThat(run.finishedAt()).isNotNull();
        assertThat(photoUploader.uploadedFileNames()).isEmpty();
    }

    private long measuredBaseline() {
        diskBudgetGovernor.recompute();
        return diskBudgetGovernor.snapshot().usedBytes();
    }

    /**
     * One small photo plus a large entry the extractor skips, so the archive is far bigger than what it extracts.
     */
    private static Map<String, String> withFiller(String relativeToPhotos, long seed) {
        Random random = new Random(seed);
        StringBuilder filler = new StringBuilder(FILLER_LENGTH);
        for (int i = 0; i < FILLER_LENGTH; i++) {
            filler.append(FILLER_ALPHABET.charAt(random.nextInt(FILLER_ALPHABET.length())));
        }
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put(PHOTOS_ROOT + relativeToPhotos, "photo " + relativeToPhotos);
        entries.put("Takeout/archive_browser.html", filler.toString());
        return entries;
    }

    private RunState runUntil(RunState run, Predicate<RunState> done) {
        RunState current = run;
        for (int i = 0; i < MAX_STEPS && !done.test(current); i++) {
            current = orchestrator.step(current);
        }
        return current;
    }

    private MediaItem item(String archiveId, String relativeToPhotos) {
        return stateStore.findItem(MediaItem.idFor(archiveId, PHOTOS_ROOT + relativeToPhotos)).orElseThrow();
    }

    private MediaPhase itemPhase(String archiveId, String relativeToPhotos) {
        return item(archiveId, relativeToPhotos).getPhase();
    }

    private boolean archiveIs(String archiveId, ArchivePhase phase) {
        return stateStore.findArchive(archiveId).map(ArchiveUnit::getPhase).orElse(null) == phase;
    }

    private ArchivePhase archivePhase(String archiveId) {
        return stateStore.findArchive(archiveId).orElseThrow().getPhase();
    }
}
