package com.eyelevel.mediamigrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Binds application properties under the "app.migration" prefix to a strongly-typed
 * configuration object. This provides centralized control over the migration pipeline.
 */
@Data
@ConfigurationProperties(prefix = "app.migration")
public class MigrationProperties {

    private String workDir = "./work";
    private String zipDir = "./work/zips";
    private String extractedDir = "./work/extracted";
    private String reportsDir = "./work/reports";

    private Source source = new Source();
    private Concurrency concurrency = new Concurrency();
    private Disk disk = new Disk();
    private Retry retry = new Retry();
    private Orchestrator orchestrator = new Orchestrator();
    private Metadata metadata = new Metadata();
    private Uploader uploader = new Uploader();
    private Scheduler scheduler = new Scheduler();

    @Data
    public static class RetryConfig {
        private int attempts;
        private long delayMs;
    }

    @Data
    public static class Source {
        /**
         * Either "local" or "s3".
         */
        private String type = "local";
        private String localDir = "./takeout";
        private String pattern = "*.zip";
        private S3 s3 = new S3();

        @Data
        public static class S3 {
            private String bucket;
            private String prefix = "";
            private String region = "us-east-1";
            private String accessKey;
            private String secretKey;
            private int sdkRetryCount = 4;
            private RetryConfig retry = new RetryConfig();
        }
    }

    @Data
    public static class Concurrency {
        private int download = 2;
        private int extract = 1;
        private int metadata = 4;
        private int upload = 4;
    }

    @Data
    public static class Disk {
        /**
         * Hard ceiling for bytes held in the work directory. -1 means bounded by the filesystem only.
         */
        private long ceilingBytes = -1;
        private long minFreeBytes = 5L * 1024 * 1024 * 1024;
        private long cleanupThresholdBytes = 10L * 1024 * 1024 * 1024;
        private long recomputeIntervalMs = 60_000;
        private double extractionFactor = 1.05;
        private long unknownSizeEstimateBytes = 2L * 1024 * 1024 * 1024;
    }

    @Data
    public static class Retry {
        private int maxAttempts = 5;
        private long initialDelayMs = 2_000;
        private long maxDelayMs = 300_000;
        private double multiplier = 2.0;
        private double jitter = 0.2;
    }

    @Data
    public static class Orchestrator {
        private double failureThreshold = 0.1;
        private int minItemsForThreshold = 20;
        private boolean cleanupAfterUpload = true;
        private int pageSize = 200;
        private int failureListLimit = 50;
    }

    @Data
    public static class Metadata {
        private String exiftoolPath = "exiftool";
        private long timeoutMinutes = 2;
        private boolean preserveDates = true;
        private boolean preserveGps = true;
        private boolean preserveDescriptions = true;
        /**
         * Zone used to render capture timestamps into EXIF local date-time fields. Empty means the system zone.
         */
        private String timeZone = "";
    }

    @Data
    public static class Uploader {
        /**
         * Command template. "{file}" is replaced with the media path and "{albums}" with the joined album names.
         */
        private List<String> command = new ArrayList<>();
        private String albumSeparator = "|";
        private long timeoutMinutes = 10;
        private Set<Integer> transientExitCodes = Set.of(75);
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        private long stepDelayMs = 5_000;
        private boolean autoStart = true;
    }
}
