package com.eyelevel.mediamigrator;

import com.eyelevel.mediamigrator.config.MigrationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Media Migrator Spring Boot application.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link SpringBootApplication}: auto-configuration, component scanning and property support.</li>
 *     <li>{@link EnableConfigurationProperties}: binds the "app.migration" properties to
 *     {@link MigrationProperties}.</li>
 *     <li>{@link EnableScheduling}: drives the pipeline orchestrator and the disk usage recomputation.</li>
 *     <li>{@link EnableRetry}: in-call retries for archive fetches from remote storage.</li>
 * </ul>
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(value = MigrationProperties.class)
@EnableRetry
public class MediaMigratorApplication {

    /**
     * Launches the application and logs key environment information upon startup.
     *
     * @param args Command-line arguments passed to the application.
     */
    public static void main(final String[] args) {
        log.info("🚀 Starting MediaMigratorApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(MediaMigratorApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "MediaMigrator"));
        log.info("  - Operator API: http://localhost:{}/migration/v1", env.getProperty("server.port", "8080"));
        log.info("  - Work dir:     {}", env.getProperty("app.migration.work-dir"));
        log.info("  - Profile(s):   {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
