package com.eyelevel.mediamigrator.collaborator.source;

import com.eyelevel.mediamigrator.config.MigrationProperties;
import com.eyelevel.mediamigrator.exception.PermanentCollaboratorException;
import com.eyelevel.mediamigrator.exception.TransientCollaboratorException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOCase;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads archives from a local drop directory, e.g. a mounted drive holding a Takeout export.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "app.migration.source", name = "type", havingValue = "local", matchIfMissing = true)
public class LocalDirectoryArchiveSource implements ArchiveSource {

    private final Path sourceDir;
    private final String pattern;

    public LocalDirectoryArchiveSource(MigrationProperties properties) {
        this.sourceDir = Paths.get(properties.getSource().getLocalDir()).toAbsolutePath().normalize();
        this.pattern = properties.getSource().getPattern();
        log.info("Local archive source initialized for '{}' (pattern '{}').", sourceDir, pattern);
    }

    @Override
    public List<RemoteArchive> listAvailable() {
        if (!Files.isDirectory(sourceDir)) {
            throw new PermanentCollaboratorException("Archive source directory does not exist: " + sourceDir);
        }
        try (Stream<Path> files = Files.list(sourceDir)) {
            return files.filter(Files::isRegularFile)
                        .filter(file -> FilenameUtils.wildcardMatch(file.getFileName().toString(), pattern,
                                                                    IOCase.INSENSITIVE))
                        .sorted(Comparator.comparing(Path::getFileName))
                        .map(this::describe)
                        .toList();
        } catch (IOException e) {
            throw new TransientCollaboratorException("Unable to list archive source directory " + sourceDir, e);
        }
    }

    @Override
    public Path fetch(RemoteArchive archive, Path targetDir) {
        Path source = sourceDir.resolve(archive.id()).normalize();
        if (!source.startsWith(sourceDir) || !Files.isRegularFile(source)) {
            throw new PermanentCollaboratorException("Archive is no longer available: " + archive.id());
        }
        Path target = targetDir.resolve(archive.localFileName());
        Path partial = targetDir.resolve(archive.localFileName() + ".part");
        try {
            Files.createDirectories(targetDir);
            Files.copy(source, partial, StandardCopyOption.REPLACE_EXISTING);
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("[{}] Copied archive to '{}'.", archive.id(), target);
            return target;
        } catch (IOException e) {
            deleteQuietly(partial);
            throw new TransientCollaboratorException("Failed to copy archive " + archive.id(), e);
        }
    }

    private RemoteArchive describe(Path file) {
        String name = file.getFileName().toString();
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            log.warn("Unable to read size of '{}', treating as unknown.", file);
            size = 0L;
        }
        return new RemoteArchive(name, name, size);
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete partial copy '{}'.", file, e);
        }
    }
}
