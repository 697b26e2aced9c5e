package com.eyelevel.mediamigrator.collaborator.source;

import com.eyelevel.mediamigrator.exception.CorruptInputException;
import com.eyelevel.mediamigrator.exception.TransientCollaboratorException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Enumeration;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Checks a fetched archive before anything is extracted from it.
 * <p>
 * A size mismatch means the transfer was cut short and is worth repeating. A ZIP whose directory or entry
 * CRCs do not check out is corrupt: downloading the same bytes again cannot help.
 */
@Slf4j
@Component
public class ArchiveVerifier {

    private static final int BUFFER_SIZE = 64 * 1024;

    /**
     * Verifies {@code archive} and returns its SHA-256 fingerprint.
     *
     * @param expectedSize size announced by the source, or {@code 0} if unknown
     */
    public String verify(Path archive, long expectedSize, String contextInfo) {
        long actualSize;
        try {
            actualSize = Files.size(archive);
        } catch (IOException e) {
            throw new TransientCollaboratorException("Unable to stat downloaded archive " + archive, e);
        }
        if (expectedSize > 0 && actualSize != expectedSize) {
            throw new TransientCollaboratorException(
                    String.format("Archive '%s' is %d bytes, expected %d.", archive.getFileName(), actualSize,
                                  expectedSize));
        }

        int entries = readAllEntries(archive, contextInfo);

        try (InputStream in = Files.newInputStream(archive)) {
            String fingerprint = DigestUtils.sha256Hex(in);
            log.info("[{}] Archive verified: {} entries, {} bytes, sha256 {}.", contextInfo, entries, actualSize,
                     fingerprint);
            return fingerprint;
        } catch (IOException e) {
            throw new TransientCollaboratorException("Unable to fingerprint archive " + archive, e);
        }
    }

    /**
     * Reads every entry to the end so the JDK validates each CRC.
     */
    private int readAllEntries(Path archive, String contextInfo) {
        byte[] buffer = new byte[BUFFER_SIZE];
        int count = 0;
        try (ZipFile zipFile = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> entries = zipFile.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                count++;
                if (entry.isDirectory()) {
                    continue;
                }
                try (InputStream in = zipFile.getInputStream(entry)) {
                    while (in.read(buffer) != -1) {
                        // drain
                    }
                }
            }
            return count;
        } catch (ZipException | EOFException e) {
            log.error("[{}] Archive '{}' failed integrity verification: {}", contextInfo, archive.getFileName(),
                      e.getMessage());
            throw new CorruptInputException("Archive " + archive.getFileName() + " is corrupt: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new TransientCollaboratorException("I/O error while verifying archive " + archive, e);
        }
    }
}
