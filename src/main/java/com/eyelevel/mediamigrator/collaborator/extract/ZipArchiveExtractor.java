package com.eyelevel.mediamigrator.collaborator.extract;

import com.eyelevel.mediamigrator.exception.CorruptInputException;
import com.eyelevel.mediamigrator.exception.TransientCollaboratorException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestOutputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;

/**
 * Streams a ZIP archive to disk entry by entry, hashing each file while it is written.
 * <p>
 * Only media files and {@code .json} sidecars are kept. The output directory is all or nothing: if the archive
 * turns out to be unreadable halfway through, everything written so far is removed.
 */
@Slf4j
@Component
public class ZipArchiveExtractor implements ArchiveExtractor {

    //<editor-fold desc="Constants">
    /**
     * macOS resource forks and Windows thumbnail caches.
     */
    private static final Set<String> IGNORED_ENTRIES = Set.of("__MACOSX", ".DS_Store", "Thumbs.db");
    //</editor-fold>

    @Override
    public List<ExtractedEntry> extract(Path archivePath, Path targetDir) {
        String contextInfo = archivePath.getFileName().toString();
        try {
            prepareTargetDirectory(targetDir);
        } catch (IOException e) {
            throw new TransientCollaboratorException("Unable to prepare extraction directory " + targetDir, e);
        }

        Path root = targetDir.toAbsolutePath().normalize();
        List<ExtractedEntry> extracted = new ArrayList<>();
        int skipped = 0;
        try (ZipInputStream zis = new ZipInputStream(new BufferedInputStream(Files.newInputStream(archivePath)))) {
            ZipEntry currentEntry;
            while ((currentEntry = zis.getNextEntry()) != null) {
                try {
                    String normalizedPath = currentEntry.getName().replace('\\', '/');
                    if (shouldSkipEntry(currentEntry, normalizedPath)) {
                        skipped++;
                        continue;
                    }
                    ExtractedEntry entry = extractSingleEntry(zis, root, normalizedPath);
                    if (entry != null) {
                        extracted.add(entry);
                    }
                } finally {
                    zis.closeEntry();
                }
            }
        } catch (ZipException | EOFException | CorruptInputException | IllegalArgumentException e) {
            // IllegalArgumentException: an entry name that is not valid UTF-8, or not a valid path.
            removePartialOutput(targetDir, contextInfo);
            log.error("[{}] Archive is corrupt, extraction aborted: {}", contextInfo, e.getMessage());
            if (e instanceof CorruptInputException corrupt) {
                throw corrupt;
            }
            throw new CorruptInputException("Archive " + contextInfo + " is corrupt: " + e.getMessage(), e);
        } catch (IOException e) {
            removePartialOutput(targetDir, contextInfo);
            throw new TransientCollaboratorException("I/O error while extracting " + contextInfo, e);
        } catch (RuntimeException e) {
            removePartialOutput(targetDir, contextInfo);
            throw e;
        }

        if (extracted.isEmpty() && skipped == 0) {
            removePartialOutput(targetDir, contextInfo);
            throw new CorruptInputException("Archive " + contextInfo + " contains no entries.");
        }
        log.info("[{}] Extracted {} files to '{}' ({} entries skipped).", contextInfo, extracted.size(), targetDir,
                 skipped);
        return extracted;
    }

    //<editor-fold desc="Private Helper Methods">

    private ExtractedEntry extractSingleEntry(ZipInputStream zis, Path root, String normalizedPath)
            throws IOException {
        Path target = root.resolve(normalizedPath).normalize();
        if (!target.startsWith(root) || target.equals(root)) {
            throw new CorruptInputException("Entry escapes the extraction directory: " + normalizedPath);
        }
        Files.createDirectories(target.getParent());

        MessageDigest sha256 = newSha256();
        long fileSize;
        try (OutputStream fileOut = Files.newOutputStream(target);
             DigestOutputStream digestOut = new DigestOutputStream(fileOut, sha256)) {
            fileSize = zis.transferTo(digestOut);
        }

        if (fileSize == 0) {
            Files.delete(target);
            log.debug("Skipping empty entry '{}'.", normalizedPath);
            return null;
        }
        return new ExtractedEntry(normalizedPath, target, Hex.encodeHexString(sha256.digest()), fileSize);
    }

    /**
     * Directories, system files, AppleDouble forks ({@code ._*}) and anything that is neither media nor sidecar.
     */
    private boolean shouldSkipEntry(ZipEntry entry, String normalizedPath) {
        if (entry.isDirectory() || normalizedPath.endsWith("/")) {
            return true;
        }
        String fileName = FilenameUtils.getName(normalizedPath);
        String rootDir = normalizedPath.contains("/") ? normalizedPath.substring(0, normalizedPath.indexOf('/')) : "";
        if (IGNORED_ENTRIES.contains(fileName) || IGNORED_ENTRIES.contains(rootDir) || fileName.startsWith("._")) {
            return true;
        }
        return !MediaFileTypes.isMedia(normalizedPath) && !MediaFileTypes.isSidecar(normalizedPath);
    }

    private static void prepareTargetDirectory(Path targetDir) throws IOException {
        if (Files.exists(targetDir)) {
            FileUtils.deleteDirectory(targetDir.toFile());
        }
        Files.createDirectories(targetDir);
    }

    private static void removePartialOutput(Path targetDir, String contextInfo) {
        try {
            FileUtils.deleteDirectory(targetDir.toFile());
        } catch (IOException cleanupEx) {
            log.warn("[{}] Failed to remove partial extraction output '{}'.", contextInfo, targetDir, cleanupEx);
        }
    }

    private static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available.", e);
        }
    }
    //</editor-fold>
}
