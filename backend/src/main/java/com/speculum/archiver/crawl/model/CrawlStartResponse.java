package com.speculum.archiver.crawl.model;

/**
 * {@code started} is false when the job was already crawling and nothing new was started.
 */
public record CrawlStartResponse(long jobId, boolean started, String message) {
}
