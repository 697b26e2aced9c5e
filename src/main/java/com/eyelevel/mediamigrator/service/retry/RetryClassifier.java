package com.eyelevel.mediamigrator.service.retry;

import com.eyelevel.mediamigrator.exception.CorruptInputException;
import com.eyelevel.mediamigrator.exception.InsufficientDiskSpaceException;
import com.eyelevel.mediamigrator.exception.PermanentCollaboratorException;
import com.eyelevel.mediamigrator.exception.TransientCollaboratorException;
import com.eyelevel.mediamigrator.model.FailureKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystemException;
import java.util.Locale;
import java.util.zip.ZipException;

/**
 * Maps any failure raised while processing a unit onto the closed {@link FailureKind} taxonomy.
 * <p>
 * Boundary exceptions thrown by the collaborator adapters decide directly. A few raw JDK exceptions that can
 * escape an adapter are recognised as well; everything else, including programming errors, is
 * {@link FailureKind#PERMANENT}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetryClassifier {

    private static final int MAX_CAUSE_DEPTH = 8;

    private final BackoffPolicy backoffPolicy;

    public FailureKind classify(Throwable error, FailureContext context) {
        FailureKind kind = classifyChain(error);
        log.debug("[{}] {} failure classified as {}: {}", context.unitId(), context.stage(), kind,
                  error == null ? "<none>" : error.toString());
        return kind;
    }

    public RetryDecision decide(FailureKind kind, int attempts) {
        return backoffPolicy.decide(kind, attempts);
    }

    private FailureKind classifyChain(Throwable error) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            FailureKind kind = classifySingle(current);
            if (kind != null) {
                return kind;
            }
            current = current.getCause();
        }
        return FailureKind.PERMANENT;
    }

    private FailureKind classifySingle(Throwable error) {
        if (error instanceof TransientCollaboratorException) {
            return FailureKind.TRANSIENT;
        }
        if (error instanceof PermanentCollaboratorException) {
            return FailureKind.PERMANENT;
        }
        if (error instanceof CorruptInputException || error instanceof ZipException) {
            return FailureKind.CORRUPT_INPUT;
        }
        if (error instanceof InsufficientDiskSpaceException || isOutOfSpace(error)) {
            return FailureKind.RESOURCE_EXHAUSTED;
        }
        if (error instanceof UncheckedIOException) {
            return null;
        }
        if (error instanceof IOException || error instanceof InterruptedException) {
            return FailureKind.TRANSIENT;
        }
        return null;
    }

    private static boolean isOutOfSpace(Throwable error) {
        if (!(error instanceof IOException)) {
            return false;
        }
        String message = error instanceof FileSystemException fse ? fse.getReason() : error.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains("no space left on device");
    }
}
