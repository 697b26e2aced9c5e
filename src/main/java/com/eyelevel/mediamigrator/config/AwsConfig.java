package com.eyelevel.mediamigrator.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryMode;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Configures the AWS S3 client used when archives are read from a bucket.
 * Only active with {@code app.migration.source.type=s3}.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.migration.source", name = "type", havingValue = "s3")
public class AwsConfig {

    private final MigrationProperties properties;

    /**
     * Determines which credentials provider to use based on the active Spring profile.
     */
    @Bean
    public AwsCredentialsProvider awsCredentialsProvider(Environment environment) {
        MigrationProperties.Source.S3 s3 = properties.getSource().getS3();
        if (environment.acceptsProfiles(Profiles.of("local"))) {
            log.info("Local profile active. Using StaticCredentialsProvider.");
            if (!StringUtils.hasText(s3.getAccessKey()) || !StringUtils.hasText(s3.getSecretKey())) {
                throw new IllegalArgumentException(
                        "app.migration.source.s3.access-key and secret-key must be set for the 'local' profile.");
            }
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(s3.getAccessKey(), s3.getSecretKey()));
        }
        log.info("Non-local profile active. Using DefaultCredentialsProvider.");
        return DefaultCredentialsProvider.create();
    }

    /**
     * Shared ClientOverrideConfiguration with an adaptive retry policy for the S3 client.
     */
    @Bean
    public ClientOverrideConfiguration clientOverrideConfiguration() {
        RetryPolicy adaptiveRetryPolicy = RetryPolicy.forRetryMode(RetryMode.ADAPTIVE).toBuilder()
                                                     .numRetries(properties.getSource().getS3().getSdkRetryCount())
                                                     .build();
        return ClientOverrideConfiguration.builder().retryPolicy(adaptiveRetryPolicy).build();
    }

    @Bean
    public S3Client s3Client(AwsCredentialsProvider credentialsProvider,
                             ClientOverrideConfiguration clientOverrideConfig) {
        String region = properties.getSource().getS3().getRegion();
        log.info("Configuring AWS S3Client for region: {}", region);
        return S3Client.builder().credentialsProvider(credentialsProvider)
                       .region(Region.of(region)).overrideConfiguration(clientOverrideConfig).build();
    }
}
