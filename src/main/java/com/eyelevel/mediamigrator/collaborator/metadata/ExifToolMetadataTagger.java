package com.eyelevel.mediamigrator.collaborator.metadata;

import com.eyelevel.mediamigrator.common.processexec.ProcessExecutor;
import com.eyelevel.mediamigrator.common.processexec.ProcessExecutor.ProcessResult;
import com.eyelevel.mediamigrator.config.MigrationProperties;
import com.eyelevel.mediamigrator.exception.CorruptInputException;
import com.eyelevel.mediamigrator.exception.PermanentCollaboratorException;
import com.eyelevel.mediamigrator.exception.TransientCollaboratorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Writes capture metadata into media files by running ExifTool in place.
 */
@Slf4j
@Service
public class ExifToolMetadataTagger implements MetadataTagger {

    private static final DateTimeFormatter EXIF_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");
    private static final Pattern CORRUPT_FILE_PATTERN = Pattern.compile(
            "(file format error|not a valid|corrupted|unknown file type|error reading)", Pattern.CASE_INSENSITIVE);

    private static final int FIXED_ARGUMENTS = 3;

    private final MigrationProperties.Metadata config;
    private final ProcessExecutor processExecutor;
    private final ZoneId zone;

    public ExifToolMetadataTagger(MigrationProperties properties, ProcessExecutor processExecutor) {
        this.config = properties.getMetadata();
        this.processExecutor = processExecutor;
        this.zone = StringUtils.hasText(config.getTimeZone()) ? ZoneId.of(config.getTimeZone())
                                                              : ZoneId.systemDefault();
    }

    @Override
    public void applyMetadata(Path mediaPath, MediaMetadata metadata) {
        if (!Files.isRegularFile(mediaPath)) {
            throw new PermanentCollaboratorException("Media file does not exist: " + mediaPath);
        }
        List<String> command = buildArguments(mediaPath, metadata);
        if (command.size() == FIXED_ARGUMENTS + 1) {
            log.debug("[{}] No metadata to write, skipping exiftool.", mediaPath.getFileName());
            return;
        }

        ProcessResult result;
        try {
            result = processExecutor.execute(command, mediaPath.getFileName().toString(),
                                             config.getTimeoutMinutes(), "exiftool");
        } catch (ProcessExecutor.ProcessTimeoutException e) {
            throw new TransientCollaboratorException("exiftool timed out on " + mediaPath.getFileName(), e);
        } catch (IOException e) {
            throw new PermanentCollaboratorException("exiftool could not be started: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientCollaboratorException("Interrupted while running exiftool", e);
        }

        if (result.exitCode() != 0) {
            String detail = StringUtils.hasText(result.stderr()) ? result.stderr() : result.stdout();
            if (CORRUPT_FILE_PATTERN.matcher(detail).find()) {
                throw new CorruptInputException(
                        String.format("exiftool rejected '%s' as unreadable: %s", mediaPath.getFileName(), detail));
            }
            throw new PermanentCollaboratorException(
                    String.format("exiftool failed for '%s' (exit %d): %s", mediaPath.getFileName(),
                                  result.exitCode(), detail));
        }
        log.debug("[{}] exiftool: {}", mediaPath.getFileName(), result.stdout());
    }

    /**
     * Builds the ExifTool command line: {@value #FIXED_ARGUMENTS} leading elements (executable and fixed
     * options), one argument per tag, and the media path last.
     */
    List<String> buildArguments(Path mediaPath, MediaMetadata metadata) {
        List<String> args = new ArrayList<>(List.of(config.getExiftoolPath(), "-overwrite_original", "-preserve"));

        if (config.isPreserveDates() && metadata.takenAt() != null) {
            String date = EXIF_DATE_FORMAT.format(metadata.takenAt().atZone(zone));
            args.add("-DateTimeOriginal=" + date);
            args.add("-CreateDate=" + date);
            args.add("-ModifyDate=" + date);
        }

        if (config.isPreserveGps() && metadata.latitude() != null && metadata.longitude() != null) {
            double latitude = metadata.latitude();
            double longitude = metadata.longitude();
            args.add(String.format(Locale.ROOT, "-GPSLatitude=%.6f", Math.abs(latitude)));
            args.add(String.format(Locale.ROOT, "-GPSLongitude=%.6f", Math.abs(longitude)));
            args.add("-GPSLatitudeRef=" + (latitude >= 0 ? "N" : "S"));
            args.add("-GPSLongitudeRef=" + (longitude >= 0 ? "E" : "W"));
            if (metadata.altitude() != null) {
                args.add(String.format(Locale.ROOT, "-GPSAltitude=%.2f", Math.abs(metadata.altitude())));
                args.add("-GPSAltitudeRef=" + (metadata.altitude() >= 0 ? "0" : "1"));
            }
        }

        if (config.isPreserveDescriptions() && StringUtils.hasText(metadata.description())) {
            String description = singleLine(metadata.description());
            args.add("-Description=" + description);
            args.add("-Caption-Abstract=" + description);
            args.add("-UserComment=" + description);
        }

        if (StringUtils.hasText(metadata.title())) {
            args.add("-Title=" + singleLine(metadata.title()));
        }

        args.add(mediaPath.toAbsolutePath().toString());
        return args;
    }

    private static String singleLine(String value) {
        return value.replace('\n', ' ').replace('\r', ' ').trim();
    }
}
