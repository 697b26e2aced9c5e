package com.eyelevel.mediamigrator.collaborator.metadata;

import com.eyelevel.mediamigrator.common.processexec.ProcessExecutor;
import com.eyelevel.mediamigrator.common.processexec.ProcessExecutor.ProcessResult;
import com.eyelevel.mediamigrator.config.MigrationProperties;
import com.eyelevel.mediamigrator.exception.CorruptInputException;
import com.eyelevel.mediamigrator.exception.PermanentCollaboratorException;
import com.eyelevel.mediamigrator.exception.TransientCollaboratorException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ExifToolMetadataTaggerTest {

    @TempDir
    Path tempDir;

    private final ProcessExecutor processExecutor = mock(ProcessExecutor.class);
    private MigrationProperties properties;
    private Path photo;

    @BeforeEach
    void setUp() throws IOException {
        properties = new MigrationProperties();
        properties.getMetadata().setTimeZone("UTC");
        photo = Files.writeString(tempDir.resolve("IMG_0001.jpg"), "jpeg");
    }

    private ExifToolMetadataTagger tagger() {
        return new ExifToolMetadataTagger(properties, processExecutor);
    }

    @Test
    void buildsTheFullArgumentList() {
        MediaMetadata metadata = new MediaMetadata(Instant.parse("2019-07-12T14:40:00Z"), -33.8688, 151.2093, -4.0,
                                                   "Harbour\nat dusk", "Sydney");

        List<String> args = tagger().buildArguments(photo, metadata);

        assertThat(args).containsExactly("exiftool", "-overwrite_original", "-preserve",
                                         "-DateTimeOriginal=2019:07:12 14:40:00",
                                         "-CreateDate=2019:07:12 14:40:00",
                                         "-ModifyDate=2019:07:12 14:40:00",
                                         "-GPSLatitude=33.868800",
                                         "-GPSLongitude=151.209300",
                                         "-GPSLatitudeRef=S",
                                         "-GPSLongitudeRef=E",
                                         "-GPSAltitude=4.00",
                                         "-GPSAltitudeRef=1",
                                         "-Description=Harbour at dusk",
                                         "-Caption-Abstract=Harbour at dusk",
                                         "-UserComment=Harbour at dusk",
                                         "-Title=Sydney",
                                         photo.toAbsolutePath().toString());
    }

    @Test
    void disabledGroupsAreLeftOut() {
        properties.getMetadata().setPreserveGps(false);
        properties.getMetadata().setPreserveDescriptions(false);
        MediaMetadata metadata = new MediaMetadata(Instant.parse("2019-07-12T14:40:00Z"), 1.0, 2.0, null,
                                                   "text", null);

        List<String> args = tagger().buildArguments(photo, metadata);

        assertThat(args).noneMatch(arg -> arg.startsWith("-GPS") || arg.startsWith("-Description"))
                        .contains("-DateTimeOriginal=2019:07:12 14:40:00");
    }

    @Test
    void nothingToWriteSkipsTheProcess() {
        tagger().applyMetadata(photo, new MediaMetadata(null, null, null, null, null, null));

        verifyNoInteractions(processExecutor);
    }

    @Test
    void exitCodesMapToTheFailureTaxonomy() throws Exception {
        MediaMetadata metadata = new MediaMetadata(null, null, null, null, null, "Title");

        when(processExecutor.execute(anyList(), anyString(), anyLong(), anyString()))
                .thenReturn(new ProcessResult(1, "", "Error: File format error - IMG_0001.jpg"));
        assertThatThrownBy(() -> tagger().applyMetadata(photo, metadata)).isInstanceOf(CorruptInputException.class);

        when(processExecutor.execute(anyList(), anyString(), anyLong(), anyString()))
                .thenReturn(new ProcessResult(2, "", "Warning: something else"));
        assertThatThrownBy(() -> tagger().applyMetadata(photo, metadata))
                .isInstanceOf(PermanentCollaboratorException.class);

        when(processExecutor.execute(anyList(), anyString(), anyLong(), anyString()))
                .thenThrow(new ProcessExecutor.ProcessTimeoutException("timed out"));
        assertThatThrownBy(() -> tagger().applyMetadata(photo, metadata))
                .isInstanceOf(TransientCollaboratorException.class);
    }

    @Test
    void missingFileIsPermanent() {
        Path missing = tempDir.resolve("gone.jpg");

        assertThatThrownBy(() -> tagger().applyMetadata(missing, new MediaMetadata(null, null, null, null, null, "t")))
                .isInstanceOf(PermanentCollaboratorException.class);
    }
}
