package com.eyelevel.mediamigrator.service.retry;

/**
 * Where a failure happened, for classification and log context.
 *
 * @param unitId archive or media item id
 * @param stage  pipeline stage that failed (e.g. "download", "upload")
 */
public record FailureContext(String unitId, String stage) {
}
