package com.speculum.archiver.crawl.service;

import com.speculum.archiver.crawl.live.LiveJobRegistry;
import com.speculum.archiver.crawl.model.AttemptOutcome;
import com.speculum.archiver.crawl.model.CrawlJob;
import com.speculum.archiver.crawl.model.JobStatus;
import com.speculum.archiver.crawl.persistence.CrawlJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Moves jobs stuck in {@code crawling} without a live process (left behind by a restart or a
 * crash) to {@code error}. Runs at startup and before every trigger cycle.
 */
@Component
public class StaleCrawlReconciler implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StaleCrawlReconciler.class);
    static final String INTERRUPTED_MESSAGE = "Crawl interrupted: no live process (reset by reconciler)";

    private final CrawlJobRepository repository;
    private final LiveJobRegistry registry;
    private final Clock clock;

    public StaleCrawlReconciler(CrawlJobRepository repository, LiveJobRegistry registry, Clock clock) {
        this.repository = repository;
        this.registry = registry;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        reconcile();
    }

    /**
     * @return number of jobs moved to {@code error}
     */
    public int reconcile() {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping stale crawl reconciliation because database is unreachable");
            return 0;
        }

        int reconciled = 0;
        List<CrawlJob> crawling = repository.findJobsInStatus(JobStatus.CRAWLING);
        for (CrawlJob job : crawling) {
            if (registry.isLive(job.id())) {
                continue;
            }
            if (repository.markCancelled(job.id(), INTERRUPTED_MESSAGE)) {
                repository.finalizeOpenAttempts(
                    job.id(),
                    clock.instant(),
                    AttemptOutcome.ERROR,
                    null,
                    INTERRUPTED_MESSAGE
                );
                reconciled++;
                log.info("Reset orphaned crawl of job {} url={} updatedAt={}", job.id(), job.url(), job.updatedAt());
            }
        }
        return reconciled;
    }
}
