package com.speculum.archiver.crawl.service;

import com.speculum.archiver.crawl.live.LiveJobEntry;
import com.speculum.archiver.crawl.live.LiveJobRegistry;
import com.speculum.archiver.crawl.model.AttemptOutcome;
import com.speculum.archiver.crawl.model.CancelResult;
import com.speculum.archiver.crawl.model.CrawlStats;
import com.speculum.archiver.crawl.persistence.CrawlJobRepository;
import com.speculum.archiver.crawl.util.LogTail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Manual cancellation of a running crawl. The crawl's own task observes the killed process
 * and finishes its cleanup; this path records the cancellation immediately.
 */
@Service
public class CrawlCancellationService {
    private static final Logger log = LoggerFactory.getLogger(CrawlCancellationService.class);

    private final LiveJobRegistry registry;
    private final CrawlJobRepository repository;
    private final Clock clock;

    public CrawlCancellationService(LiveJobRegistry registry, CrawlJobRepository repository, Clock clock) {
        this.registry = registry;
        this.repository = repository;
        this.clock = clock;
    }

    public CancelResult cancelCrawl(long jobId) {
        Optional<LiveJobEntry> entry = registry.find(jobId);
        CancelResult result = registry.terminate(jobId);
        if (!result.ok()) {
            return result;
        }

        Long attemptId = entry.map(LiveJobEntry::attemptId).orElse(null);
        String logTail = entry.map(value -> LogTail.of(value.log().all())).orElse(null);
        Instant now = clock.instant();
        repository.markCancelled(jobId, CrawlDispatcher.CANCELLED_MESSAGE);
        if (attemptId != null) {
            repository.finalizeAttempt(
                attemptId,
                now,
                AttemptOutcome.CANCELLED,
                CrawlStats.EMPTY,
                logTail,
                CrawlDispatcher.CANCELLED_MESSAGE,
                null
            );
        } else {
            repository.finalizeOpenAttempts(jobId, now, AttemptOutcome.CANCELLED, logTail, CrawlDispatcher.CANCELLED_MESSAGE);
        }
        log.info("Cancelled crawl of job {}: {}", jobId, result.message());
        return result;
    }
}
