package com.speculum.archiver.crawl.model;

import java.time.Instant;

public record CrawlJob(
    long id,
    String url,
    JobKind kind,
    int depth,
    boolean includeExternal,
    int intervalDays,
    JobStatus status,
    String lastError,
    int retryCount,
    long sizeBytes,
    int itemCount,
    String channelId,
    Instant lastCrawlAt,
    Instant nextCrawlAt,
    Instant updatedAt
) {
}
