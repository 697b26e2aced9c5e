package com.eyelevel.mediamigrator.support;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds small Takeout-shaped archives for tests.
 */
public final class TakeoutZips {

    public static final String PHOTOS_ROOT = "Takeout/Google Photos/";

    private TakeoutZips() {
    }

    /**
     * Writes a zip whose entries are the map keys with the values as UTF-8 content.
     */
    public static Path write(Path zip, Map<String, String> entries) throws IOException {
        Files.createDirectories(zip.getParent());
        try (OutputStream out = Files.newOutputStream(zip); ZipOutputStream zipOut = new ZipOutputStream(out)) {
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                zipOut.putNextEntry(new ZipEntry(entry.getKey()));
                zipOut.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
                zipOut.closeEntry();
            }
        }
        return zip;
    }

    /**
     * Overwrites the end-of-central-directory record with zeros, keeping the file size.
     */
    public static void breakCentralDirectory(Path zip) throws IOException {
        byte[] bytes = Files.readAllBytes(zip);
        for (int i = Math.max(0, bytes.length - 22); i < bytes.length; i++) {
            bytes[i] = 0;
        }
        Files.write(zip, bytes);
    }
}
