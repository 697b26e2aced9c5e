package com.eyelevel.mediamigrator.collaborator.metadata;

import com.eyelevel.mediamigrator.common.json.jackson.JacksonJsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SidecarMetadataReaderTest {

    @TempDir
    Path tempDir;

    private final SidecarMetadataReader reader = new SidecarMetadataReader(new JacksonJsonParser(new ObjectMapper()));

    @Test
    void readsTakeoutSidecar() throws IOException {
        Path sidecar = write("""
                {
                  "title": "IMG_0001.jpg",
                  "description": "  Beach day  ",
                  "photoTakenTime": { "timestamp": "1562942400", "formatted": "Jul 12, 2019, 2:40:00 PM UTC" },
                  "creationTime": { "timestamp": "1600000000" },
                  "geoData": { "latitude": 41.3851, "longitude": 2.1734, "altitude": 12.5 },
                  "albumData": { "title": "Barcelona" },
                  "googlePhotosOrigin": { "albumTitle": "Summer" },
                  "people": [ { "name": "Someone" } ]
                }
                """);

        SidecarMetadata metadata = reader.read(sidecar);

        assertThat(metadata.takenAt()).isEqualTo(Instant.ofEpochSecond(1562942400L));
        assertThat(metadata.latitude()).isEqualTo(41.3851);
        assertThat(metadata.longitude()).isEqualTo(2.1734);
        assertThat(metadata.altitude()).isEqualTo(12.5);
        assertThat(metadata.description()).isEqualTo("Beach day");
        assertThat(metadata.title()).isEqualTo("IMG_0001.jpg");
        assertThat(metadata.albumHints()).containsExactly("Barcelona", "Summer");
    }

    @Test
    void fallsBackToCreationTimeAndExifLocation() throws IOException {
        Path sidecar = write("""
                {
                  "creationTime": { "timestamp": "2019-07-12T14:40:00Z" },
                  "geoData": { "latitude": 0.0, "longitude": 0.0, "altitude": 0.0 },
                  "geoDataExif": { "latitude": -33.8688, "longitude": 151.2093 }
                }
                """);

        SidecarMetadata metadata = reader.read(sidecar);

        assertThat(metadata.takenAt()).isEqualTo(Instant.parse("2019-07-12T14:40:00Z"));
        assertThat(metadata.latitude()).isEqualTo(-33.8688);
        assertThat(metadata.longitude()).isEqualTo(151.2093);
        assertThat(metadata.altitude()).isNull();
    }

    @Test
    void zeroLocationWithoutExifIsAbsent() throws IOException {
        Path sidecar = write("{ \"geoData\": { \"latitude\": 0.0, \"longitude\": 0.0 } }");

        assertThat(reader.read(sidecar).hasLocation()).isFalse();
    }

    @Test
    void albumHintsAreDeduplicated() throws IOException {
        Path sidecar = write("""
                { "albumData": "Trip", "albums": [ "Trip", { "name": "Friends" } ] }
                """);

        assertThat(reader.read(sidecar).albumHints()).containsExactly("Trip", "Friends");
    }

    @Test
    void missingOrMalformedSidecarYieldsEmptyMetadata() throws IOException {
        assertThat(reader.read(null)).isEqualTo(SidecarMetadata.EMPTY);
        assertThat(reader.read(tempDir.resolve("absent.json"))).isEqualTo(SidecarMetadata.EMPTY);
        assertThat(reader.read(write("{ not json"))).isEqualTo(SidecarMetadata.EMPTY);
    }

    @Test
    void unparseableTimestampIsIgnored() {
        TakeoutSidecar.TimeField field = new TakeoutSidecar.TimeField();
        field.setTimestamp("yesterday");

        assertThat(SidecarMetadataReader.parseTime(field)).isNull();
    }

    @Test
    void outOfRangeTimestampsAreAbsentAndFallBack() throws IOException {
        Path overflowing = write("""
                { "photoTakenTime": { "timestamp": "99999999999999999999" },
                  "creationTime": { "timestamp": "1562942400" } }
                """);
        Path beyondInstant = write("{ \"photoTakenTime\": { \"timestamp\": \"99999999999999999\" }, \"title\": \"x\" }");

        assertThat(reader.read(overflowing).takenAt()).isEqualTo(Instant.ofEpochSecond(1562942400L));
        SidecarMetadata metadata = reader.read(beyondInstant);
        assertThat(metadata.takenAt()).isNull();
        assertThat(metadata.title()).isEqualTo("x");
    }

    private Path write(String json) throws IOException {
        Path file = Files.createTempFile(tempDir, "sidecar", ".json");
        Files.writeString(file, json);
        return file;
    }
}
