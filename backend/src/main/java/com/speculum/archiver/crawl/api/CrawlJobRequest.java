package com.speculum.archiver.crawl.api;

import com.speculum.archiver.crawl.model.JobKind;

public record CrawlJobRequest(
    String url,
    JobKind kind,
    Integer depth,
    Boolean includeExternal,
    Integer intervalDays
) {
}
