package com.speculum.archiver.crawl.model;

import java.time.Instant;

public record CrawlAttempt(
    long id,
    long jobId,
    Instant startedAt,
    Instant finishedAt,
    AttemptOutcome outcome,
    int itemsCrawled,
    long bytesTransferred,
    String logTail,
    String errorMessage,
    ErrorClass errorClass
) {
}
