package com.speculum.archiver.crawl.model;

import java.time.Instant;

public record LiveCrawlView(
    long jobId,
    String target,
    JobKind kind,
    Instant startedAt,
    long elapsedSeconds,
    long logLineCount
) {
}
