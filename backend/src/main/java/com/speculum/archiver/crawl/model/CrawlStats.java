package com.speculum.archiver.crawl.model;

public record CrawlStats(long sizeBytes, int itemCount) {
    public static final CrawlStats EMPTY = new CrawlStats(0L, 0);

    public boolean isEmpty() {
        return sizeBytes <= 0 && itemCount <= 0;
    }
}
