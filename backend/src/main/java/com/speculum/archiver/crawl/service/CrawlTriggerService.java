package com.speculum.archiver.crawl.service;

import com.speculum.archiver.config.ArchiverProperties;
import com.speculum.archiver.crawl.live.LiveJobRegistry;
import com.speculum.archiver.crawl.model.TriggerCycleSummary;
import com.speculum.archiver.crawl.model.TriggerStatusResponse;
import com.speculum.archiver.crawl.persistence.CrawlJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically starts crawls that are due: never-crawled and recrawl-due jobs first, then
 * jobs whose retry delay has passed.
 */
@Service
public class CrawlTriggerService {
    private static final Logger log = LoggerFactory.getLogger(CrawlTriggerService.class);

    private final CrawlJobRepository repository;
    private final CrawlDispatcher dispatcher;
    private final LiveJobRegistry registry;
    private final StaleCrawlReconciler reconciler;
    private final ArchiverProperties properties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ExecutorService executor;
    private volatile Instant lastCycleAt;
    private volatile int lastCycleEnqueued;

    public CrawlTriggerService(
        CrawlJobRepository repository,
        CrawlDispatcher dispatcher,
        LiveJobRegistry registry,
        StaleCrawlReconciler reconciler,
        ArchiverProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.dispatcher = dispatcher;
        this.registry = registry;
        this.reconciler = reconciler;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getTrigger().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public TriggerStatusResponse getStatus() {
        return new TriggerStatusResponse(running.get(), registry.size(), lastCycleAt, lastCycleEnqueued);
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            int pollIntervalSeconds = properties.getTrigger().getPollIntervalSeconds();
            executor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("crawl-trigger");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            executor.submit(() -> triggerLoop(pollIntervalSeconds));
            log.info("Crawl trigger started, polling every {}s", pollIntervalSeconds);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            log.info("Crawl trigger stopped");
        }
    }

    /**
     * One trigger cycle: reconcile orphans, then enqueue due crawls and due retries. Jobs
     * already live are skipped.
     */
    public TriggerCycleSummary runOnce() {
        int reconciled = reconciler.reconcile();
        Instant now = clock.instant();
        ArchiverProperties.Trigger trigger = properties.getTrigger();
        int dueEnqueued = enqueueAll(repository.findDueForCrawl(now, trigger.getDueBatchLimit()));
        int retriesEnqueued = enqueueAll(repository.findDueForRetry(now, trigger.getRetryBatchLimit()));
        TriggerCycleSummary summary = new TriggerCycleSummary(reconciled, dueEnqueued, retriesEnqueued);
        lastCycleAt = now;
        lastCycleEnqueued = summary.totalEnqueued();
        if (summary.totalEnqueued() > 0 || reconciled > 0) {
            log.info(
                "Trigger cycle: reconciled={} due={} retries={}",
                reconciled,
                dueEnqueued,
                retriesEnqueued
            );
        }
        return summary;
    }

    private int enqueueAll(List<Long> jobIds) {
        int enqueued = 0;
        for (Long jobId : jobIds) {
            if (registry.isLive(jobId)) {
                continue;
            }
            dispatcher.enqueueCrawl(jobId);
            enqueued++;
        }
        return enqueued;
    }

    private void triggerLoop(int pollIntervalSeconds) {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                runOnce();
            } catch (Exception e) {
                log.warn("Crawl trigger cycle failed", e);
            }
            sleep(pollIntervalSeconds);
        }
    }

    private void sleep(int pollIntervalSeconds) {
        try {
            TimeUnit.SECONDS.sleep(Math.max(1, pollIntervalSeconds));
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
