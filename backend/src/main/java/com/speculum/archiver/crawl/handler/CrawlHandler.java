package com.speculum.archiver.crawl.handler;

import com.speculum.archiver.crawl.live.LiveJobEntry;
import com.speculum.archiver.crawl.model.CrawlJob;
import com.speculum.archiver.crawl.model.CrawlOutcome;

/**
 * Runs the tool(s) for one kind of job. Expected failures come back as
 * {@link CrawlOutcome} values; the entry is the process monitor for every tool started.
 */
public interface CrawlHandler {
    CrawlOutcome crawl(CrawlJob job, LiveJobEntry entry);
}
