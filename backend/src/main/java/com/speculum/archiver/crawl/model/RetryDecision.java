package com.speculum.archiver.crawl.model;

import java.time.Instant;

/**
 * Next persisted state of a job after a failed attempt. {@code nextAttemptAt} is null
 * unless the status is {@link JobStatus#RETRY_PENDING}.
 */
public record RetryDecision(
    JobStatus status,
    int retryCount,
    Instant nextAttemptAt,
    ErrorClass errorClass
) {
}
