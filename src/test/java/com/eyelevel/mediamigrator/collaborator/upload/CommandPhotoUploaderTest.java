package com.eyelevel.mediamigrator.collaborator.upload;

import com.eyelevel.mediamigrator.common.processexec.ProcessExecutor;
import com.eyelevel.mediamigrator.common.processexec.ProcessExecutor.ProcessResult;
import com.eyelevel.mediamigrator.config.MigrationProperties;
import com.eyelevel.mediamigrator.exception.PermanentCollaboratorException;
import com.eyelevel.mediamigrator.exception.TransientCollaboratorException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CommandPhotoUploaderTest {

    @TempDir
    Path tempDir;

    private final ProcessExecutor processExecutor = mock(ProcessExecutor.class);
    private MigrationProperties properties;
    private CommandPhotoUploader uploader;
    private Path photo;

    @BeforeEach
    void setUp() throws IOException {
        properties = new MigrationProperties();
        properties.getUploader().setCommand(List.of("gphotos-upload", "--albums={albums}", "{file}"));
        uploader = new CommandPhotoUploader(properties, processExecutor);
        photo = Files.writeString(tempDir.resolve("IMG_0001.jpg"), "jpeg");
    }

    @Test
    void substitutesFileAndAlbumsIntoTheCommand() {
        Set<String> albums = new LinkedHashSet<>(List.of("Family", "Summer"));

        List<String> command = uploader.buildCommand(properties.getUploader(), photo, albums);

        assertThat(command).containsExactly("gphotos-upload", "--albums=Family|Summer",
                                            photo.toAbsolutePath().toString());
    }

    @Test
    void remoteIdIsTheLastNonBlankStdoutLine() throws Exception {
        List<String> expected = uploader.buildCommand(properties.getUploader(), photo, Set.of());
        when(processExecutor.execute(eq(expected), anyString(), anyLong(), anyString()))
                .thenReturn(new ProcessResult(0, "uploading...\nAF1QipN-remote-id\n\n", ""));

        assertThat(uploader.upload(photo, Set.of())).isEqualTo("AF1QipN-remote-id");
    }

    @Test
    void configuredExitCodesAreTransientOthersPermanent() throws Exception {
        when(processExecutor.execute(org.mockito.ArgumentMatchers.anyList(), anyString(), anyLong(), anyString()))
                .thenReturn(new ProcessResult(75, "", "rate limited"))
                .thenReturn(new ProcessResult(1, "", "rejected"));

        assertThatThrownBy(() -> uploader.upload(photo, Set.of())).isInstanceOf(TransientCollaboratorException.class);
        assertThatThrownBy(() -> uploader.upload(photo, Set.of())).isInstanceOf(PermanentCollaboratorException.class);
    }

    @Test
    void successWithoutRemoteIdIsPermanent() throws Exception {
        when(processExecutor.execute(org.mockito.ArgumentMatchers.anyList(), anyString(), anyLong(), anyString()))
                .thenReturn(new ProcessResult(0, "  ", ""));

        assertThatThrownBy(() -> uploader.upload(photo, Set.of())).isInstanceOf(PermanentCollaboratorException.class)
                                                                  .hasMessageContaining("no remote id");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void remoteIdSurvivesLongProgressOutput() {
        properties.getUploader().setCommand(List.of(
                "sh", "-c",
                "i=1; while [ $i -le 2000 ]; do echo progress-line-$i; i=$((i+1)); done; echo REMOTE-ID-42",
                "{file}"));
        CommandPhotoUploader realUploader = new CommandPhotoUploader(properties, new ProcessExecutor());

        assertThat(realUploader.upload(photo, Set.of("Trip"))).isEqualTo("REMOTE-ID-42");
    }

    @Test
    void unconfiguredCommandIsPermanent() {
        properties.getUploader().setCommand(List.of());

        assertThatThrownBy(() -> uploader.upload(photo, Set.of())).isInstanceOf(PermanentCollaboratorException.class);
    }
}
