package com.speculum.archiver.crawl.model;

public enum JobKind {
    PAGE_MIRROR,
    VIDEO_CHANNEL,
    BROWSER_SNAPSHOT
}
