package com.eyelevel.mediamigrator.collaborator.upload;

import com.eyelevel.mediamigrator.common.processexec.ProcessExecutor;
import com.eyelevel.mediamigrator.common.processexec.ProcessExecutor.ProcessResult;
import com.eyelevel.mediamigrator.config.MigrationProperties;
import com.eyelevel.mediamigrator.exception.PermanentCollaboratorException;
import com.eyelevel.mediamigrator.exception.TransientCollaboratorException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Uploads by running an external command, e.g. a photo-library import script.
 * <p>
 * In the configured command, {@code {file}} is replaced by the absolute media path and {@code {albums}} by the
 * album names joined with the configured separator. The last non-blank line the command prints is taken as the
 * remote id. Exit codes listed as transient (by default 75, {@code EX_TEMPFAIL}) are retried; any other non-zero
 * exit is permanent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommandPhotoUploader implements PhotoUploader {

    static final String FILE_PLACEHOLDER = "{file}";
    static final String ALBUMS_PLACEHOLDER = "{albums}";

    private final MigrationProperties properties;
    private final ProcessExecutor processExecutor;

    @Override
    public String upload(Path mediaPath, Set<String> albumNames) {
        MigrationProperties.Uploader config = properties.getUploader();
        if (config.getCommand() == null || config.getCommand().isEmpty()) {
            throw new PermanentCollaboratorException("app.migration.uploader.command is not configured.");
        }
        if (!Files.isRegularFile(mediaPath)) {
            throw new PermanentCollaboratorException("Media file to upload does not exist: " + mediaPath);
        }

        List<String> command = buildCommand(config, mediaPath, albumNames);
        String contextInfo = mediaPath.getFileName().toString();
        ProcessResult result;
        try {
            result = processExecutor.execute(command, contextInfo, config.getTimeoutMinutes(), "uploader");
        } catch (ProcessExecutor.ProcessTimeoutException e) {
            throw new TransientCollaboratorException("Upload command timed out for " + contextInfo, e);
        } catch (IOException e) {
            throw new PermanentCollaboratorException("Upload command could not be started: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientCollaboratorException("Interrupted while uploading " + contextInfo, e);
        }

        if (result.exitCode() != 0) {
            String message = String.format("Upload command failed for '%s' (exit %d): %s", contextInfo,
                                           result.exitCode(), result.stderr());
            if (config.getTransientExitCodes().contains(result.exitCode())) {
                throw new TransientCollaboratorException(message);
            }
            throw new PermanentCollaboratorException(message);
        }

        String remoteId = lastLine(result.stdout());
        if (remoteId == null) {
            throw new PermanentCollaboratorException("Upload command printed no remote id for " + contextInfo);
        }
        log.info("[{}] Uploaded as '{}'.", contextInfo, remoteId);
        return remoteId;
    }

    List<String> buildCommand(MigrationProperties.Uploader config, Path mediaPath, Set<String> albumNames) {
        String albums = String.join(config.getAlbumSeparator(), albumNames);
        List<String> command = new ArrayList<>(config.getCommand().size());
        for (String part : config.getCommand()) {
            command.add(part.replace(FILE_PLACEHOLDER, mediaPath.toAbsolutePath().toString())
                            .replace(ALBUMS_PLACEHOLDER, albums));
        }
        return command;
    }

    private static String lastLine(String stdout) {
        if (!StringUtils.hasText(stdout)) {
            return null;
        }
        String[] lines = stdout.split("\\R");
        for (int i = lines.length - 1; i >= 0; i--) {
            if (StringUtils.hasText(lines[i])) {
                return lines[i].trim();
            }
        }
        return null;
    }
}
