package com.eyelevel.mediamigrator.collaborator.metadata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

import java.util.List;

/**
 * Raw shape of a Google Takeout {@code .json} sidecar. Only the fields the pipeline reads are mapped.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TakeoutSidecar {

    private String title;
    private String description;
    private TimeField photoTakenTime;
    private TimeField creationTime;
    private GeoField geoData;
    private GeoField geoDataExif;

    /**
     * Either an object with {@code title}/{@code name} or a bare string.
     */
    private JsonNode albumData;
    private JsonNode googlePhotosOrigin;
    private List<JsonNode> albums;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TimeField {
        private String timestamp;
        private String formatted;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GeoField {
        private Double latitude;
        private Double longitude;
        private Double altitude;
    }
}
