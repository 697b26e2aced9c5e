package com.eyelevel.mediamigrator.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        String appName = buildProperties.map(BuildProperties::getName).orElse("Media Migrator API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                Operator API for the Takeout media migration pipeline.
                                The pipeline runs unattended; these endpoints let an operator observe
                                a run and make the decisions it cannot make on its own.

                                Key features include:
                                * **Run control:** start or resume a run, re-list the archive source, stop gracefully.
                                * **Failure review:** proceed out of a paused run after reviewing failed items.
                                * **Per-unit actions:** retry or skip failed items, re-acquire or skip corrupted archives.
                                * **Reporting:** counts per phase, album statistics and the precise failure list.
                                """)
                        .contact(new Contact()
                                .name("EyeLevel.ai Support")
                                .url("https://www.eyelevel.ai")));
    }
}
