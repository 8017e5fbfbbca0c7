package com.speculum.archiver.crawl.model;

public enum CrawlFailureKind {
    TIMEOUT,
    STALLED,
    TOOL_FAILURE,
    EMPTY_RESULT
}
