package com.speculum.archiver.crawl.model;

public record NewCrawlJob(
    String url,
    JobKind kind,
    int depth,
    boolean includeExternal,
    int intervalDays
) {
}
