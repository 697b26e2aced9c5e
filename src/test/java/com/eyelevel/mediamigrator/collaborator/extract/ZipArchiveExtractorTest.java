package com.eyelevel.mediamigrator.collaborator.extract;

import com.eyelevel.mediamigrator.exception.CorruptInputException;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ZipArchiveExtractorTest {

    @TempDir
    Path tempDir;

    private final ZipArchiveExtractor extractor = new ZipArchiveExtractor();

    @Test
    void extractsMediaAndSidecarsAndSkipsEverythingElse() throws IOException {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("Takeout/Google Photos/Family/IMG_0001.jpg", "jpeg bytes");
        entries.put("Takeout/Google Photos/Family/IMG_0001.jpg.json", "{\"title\":\"IMG_0001.jpg\"}");
        entries.put("Takeout/Google Photos/Family/metadata.csv", "not media");
        entries.put("Takeout/Google Photos/Family/._IMG_0001.jpg", "apple double");
        entries.put("__MACOSX/Takeout/IMG_0001.jpg", "resource fork");
        entries.put("Takeout/Google Photos/Family/.DS_Store", "finder");
        entries.put("Takeout/Google Photos/Family/empty.png", "");
        Path archive = zip("takeout-001.zip", entries);
        Path target = tempDir.resolve("out");

        List<ExtractedEntry> extracted = extractor.extract(archive, target);

        assertThat(extracted).extracting(ExtractedEntry::relativePath)
                             .containsExactly("Takeout/Google Photos/Family/IMG_0001.jpg",
                                              "Takeout/Google Photos/Family/IMG_0001.jpg.json");
        ExtractedEntry media = extracted.get(0);
        assertThat(media.path()).hasContent("jpeg bytes");
        assertThat(media.size()).isEqualTo("jpeg bytes".length());
        assertThat(media.sha256()).isEqualTo(DigestUtils.sha256Hex("jpeg bytes"));
        assertThat(target.resolve("Takeout/Google Photos/Family/metadata.csv")).doesNotExist();
    }

    @Test
    void reExtractionReplacesPreviousOutput() throws IOException {
        Path target = tempDir.resolve("out");
        Files.createDirectories(target);
        Files.writeString(target.resolve("stale.jpg"), "left over");
        Path archive = zip("takeout-002.zip", Map.of("Takeout/a.jpg", "a"));

        extractor.extract(archive, target);

        assertThat(target.resolve("stale.jpg")).doesNotExist();
        assertThat(target.resolve("Takeout/a.jpg")).exists();
    }

    @Test
    void zipSlipEntryIsCorruptInputAndLeavesNoOutput() throws IOException {
        Path archive = zip("evil.zip", Map.of("Takeout/ok.jpg", "fine", "../../escape.jpg", "evil"));
        Path target = tempDir.resolve("out");

        assertThatThrownBy(() -> extractor.extract(archive, target)).isInstanceOf(CorruptInputException.class);

        assertThat(target).doesNotExist();
        assertThat(tempDir.resolve("escape.jpg")).doesNotExist();
    }

    @Test
    void truncatedArchiveIsCorruptInputAndLeavesNoOutput() throws IOException {
        Path complete = zip("full.zip", Map.of("Takeout/a.jpg", "a".repeat(10_000), "Takeout/b.jpg", "b"));
        byte[] bytes = Files.readAllBytes(complete);
        Path truncated = tempDir.resolve("truncated.zip");
        Files.write(truncated, Arrays.copyOf(bytes, 60));
        Path target = tempDir.resolve("out");

        assertThatThrownBy(() -> extractor.extract(truncated, target)).isInstanceOf(CorruptInputException.class);

        assertThat(target).doesNotExist();
    }

    @Test
    void fileThatIsNotAZipIsCorruptInput() throws IOException {
        Path notZip = tempDir.resolve("notes.zip");
        Files.writeString(notZip, "this is plain text, not a zip archive");

        assertThatThrownBy(() -> extractor.extract(notZip, tempDir.resolve("out")))
                .isInstanceOf(CorruptInputException.class);
    }

    @Test
    void entryNameThatIsNotUtf8IsCorruptInput() throws IOException {
        Path archive = tempDir.resolve("latin1.zip");
        try (OutputStream out = Files.newOutputStream(archive);
             ZipOutputStream zip = new ZipOutputStream(out, StandardCharsets.ISO_8859_1)) {
            zip.putNextEntry(new ZipEntry("Takeout/ok.jpg"));
            zip.write("fine".getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
            zip.putNextEntry(new ZipEntry("Takeout/café.jpg"));
            zip.write("latin".getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
        }
        Path target = tempDir.resolve("out");

        assertThatThrownBy(() -> extractor.extract(archive, target)).isInstanceOf(CorruptInputException.class);

        assertThat(target).doesNotExist();
    }

    private Path zip(String name, Map<String, String> entries) throws IOException {
        Path archive = tempDir.resolve(name);
        try (OutputStream out = Files.newOutputStream(archive); ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(entry.getKey()));
                zip.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
                zip.closeEntry();
            }
        }
        return archive;
    }
}
