package com.eyelevel.mediamigrator.collaborator.source;

import com.eyelevel.mediamigrator.config.MigrationProperties;
import com.eyelevel.mediamigrator.exception.PermanentCollaboratorException;
import com.eyelevel.mediamigrator.exception.TransientCollaboratorException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOCase;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;

/**
 * Lists and downloads Takeout archives stored under a bucket prefix.
 * <p>
 * The SDK retries individual requests on its own; {@link Retryable} adds a short outer retry around whole
 * listings and downloads. Anything still failing afterwards is reported as transient and falls back to the
 * pipeline's persistent retry budget.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "app.migration.source", name = "type", havingValue = "s3")
public class S3ArchiveSource implements ArchiveSource {

    private final S3Client s3Client;
    private final String bucketName;
    private final String prefix;
    private final String pattern;

    public S3ArchiveSource(S3Client s3Client, MigrationProperties properties) {
        MigrationProperties.Source source = properties.getSource();
        if (source.getS3().getBucket() == null || source.getS3().getBucket().isBlank()) {
            throw new IllegalArgumentException("app.migration.source.s3.bucket must be set for the s3 source.");
        }
        this.s3Client = s3Client;
        this.bucketName = source.getS3().getBucket();
        this.prefix = source.getS3().getPrefix() == null ? "" : source.getS3().getPrefix();
        this.pattern = source.getPattern();
        log.info("S3 archive source initialized for bucket '{}' and prefix '{}'.", bucketName, prefix);
    }

    @Override
    @Retryable(retryFor = {TransientCollaboratorException.class},
            maxAttemptsExpression = "#{${app.migration.source.s3.retry.attempts} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.migration.source.s3.retry.delay-ms}}"),
            listeners = {"archiveFetchRetryListener"})
    public List<RemoteArchive> listAvailable() {
        log.debug("Listing archives in s3://{}/{}", bucketName, prefix);
        ListObjectsV2Request request = ListObjectsV2Request.builder().bucket(bucketName).prefix(prefix).build();
        try {
            return s3Client.listObjectsV2Paginator(request).contents().stream()
                           .filter(object -> !object.key().endsWith("/"))
                           .filter(object -> FilenameUtils.wildcardMatch(FilenameUtils.getName(object.key()),
                                                                         pattern, IOCase.INSENSITIVE))
                           .map(S3ArchiveSource::describe)
                           .sorted(Comparator.comparing(RemoteArchive::id))
                           .toList();
        } catch (S3Exception e) {
            throw translate(e, "list s3://" + bucketName + "/" + prefix);
        } catch (SdkClientException e) {
            throw new TransientCollaboratorException("Unable to reach S3 while listing archives", e);
        }
    }

    @Override
    @Retryable(retryFor = {TransientCollaboratorException.class},
            maxAttemptsExpression = "#{${app.migration.source.s3.retry.attempts} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.migration.source.s3.retry.delay-ms}}"),
            listeners = {"archiveFetchRetryListener"})
    public Path fetch(RemoteArchive archive, Path targetDir) {
        Path target = targetDir.resolve(archive.localFileName());
        Path partial = targetDir.resolve(archive.localFileName() + ".part");
        log.info("[{}] Downloading s3://{}/{} ({} bytes).", archive.id(), bucketName, archive.id(), archive.size());
        try {
            Files.createDirectories(targetDir);
            Files.deleteIfExists(partial);
            GetObjectRequest request = GetObjectRequest.builder().bucket(bucketName).key(archive.id()).build();
            s3Client.getObject(request, ResponseTransformer.toFile(partial));
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("[{}] Download complete: '{}'.", archive.id(), target);
            return target;
        } catch (S3Exception e) {
            deleteQuietly(partial);
            throw translate(e, "download " + archive.id());
        } catch (SdkClientException | IOException e) {
            deleteQuietly(partial);
            throw new TransientCollaboratorException("Download of " + archive.id() + " failed", e);
        }
    }

    @Recover
    public List<RemoteArchive> recoverListing(TransientCollaboratorException e) {
        log.error("Listing s3://{}/{} failed after all retry attempts.", bucketName, prefix, e);
        throw e;
    }

    @Recover
    public Path recoverFetch(TransientCollaboratorException e, RemoteArchive archive, Path targetDir) {
        log.error("[{}] Download failed after all retry attempts.", archive.id(), e);
        throw e;
    }

    @Recover
    public List<RemoteArchive> recoverListing(PermanentCollaboratorException e) {
        log.error("Listing s3://{}/{} failed permanently: {}", bucketName, prefix, e.getMessage());
        throw e;
    }

    @Recover
    public Path recoverFetch(PermanentCollaboratorException e, RemoteArchive archive, Path targetDir) {
        log.error("[{}] Download failed permanently: {}", archive.id(), e.getMessage());
        throw e;
    }

    private static RemoteArchive describe(S3Object object) {
        long size = object.size() == null ? 0L : object.size();
        return new RemoteArchive(object.key(), FilenameUtils.getName(object.key()), size);
    }

    private static RuntimeException translate(S3Exception e, String operation) {
        int status = e.statusCode();
        if (e instanceof NoSuchKeyException || status == 403 || status == 404) {
            return new PermanentCollaboratorException("S3 refused to " + operation + ": " + e.getMessage(), e);
        }
        return new TransientCollaboratorException("S3 failed to " + operation + " (HTTP " + status + ")", e);
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete partial download '{}'.", file, e);
        }
    }
}
