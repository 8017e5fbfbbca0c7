package com.speculum.archiver.crawl.model;

import java.util.List;

/**
 * Result of one handler run. Exactly one of the three shapes is produced:
 * success with stats, failure with a kind and message, or cancelled.
 */
public record CrawlOutcome(
    Result result,
    CrawlStats stats,
    CrawlFailureKind failureKind,
    String errorMessage,
    List<String> log
) {
    public enum Result {
        SUCCESS,
        FAILED,
        CANCELLED
    }

    public CrawlOutcome {
        stats = stats == null ? CrawlStats.EMPTY : stats;
        log = log == null ? List.of() : List.copyOf(log);
    }

    public static CrawlOutcome success(CrawlStats stats, List<String> log) {
        return new CrawlOutcome(Result.SUCCESS, stats, null, null, log);
    }

    public static CrawlOutcome failed(CrawlFailureKind kind, String message, List<String> log) {
        return new CrawlOutcome(Result.FAILED, CrawlStats.EMPTY, kind, message, log);
    }

    public static CrawlOutcome cancelled(List<String> log) {
        return new CrawlOutcome(Result.CANCELLED, CrawlStats.EMPTY, null, "manually interrupted", log);
    }
}
