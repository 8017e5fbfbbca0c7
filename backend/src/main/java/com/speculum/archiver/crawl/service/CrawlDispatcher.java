package com.speculum.archiver.crawl.service;

import com.speculum.archiver.crawl.handler.BrowserSnapshotHandler;
import com.speculum.archiver.crawl.handler.CrawlHandler;
import com.speculum.archiver.crawl.handler.PageMirrorHandler;
import com.speculum.archiver.crawl.handler.VideoChannelHandler;
import com.speculum.archiver.crawl.live.LiveJobEntry;
import com.speculum.archiver.crawl.live.LiveJobRegistry;
import com.speculum.archiver.crawl.model.AttemptOutcome;
import com.speculum.archiver.crawl.model.CrawlFailureKind;
import com.speculum.archiver.crawl.model.CrawlJob;
import com.speculum.archiver.crawl.model.CrawlOutcome;
import com.speculum.archiver.crawl.model.CrawlStats;
import com.speculum.archiver.crawl.model.JobStatus;
import com.speculum.archiver.crawl.model.RetryDecision;
import com.speculum.archiver.crawl.persistence.CrawlJobRepository;
import com.speculum.archiver.crawl.policy.RetryPolicy;
import com.speculum.archiver.crawl.util.ErrorClassifier;
import com.speculum.archiver.crawl.util.LogTail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Starts crawls in the background and commits their outcome.
 *
 * <p>A job is registered in the {@link LiveJobRegistry} before its task is submitted and
 * unregistered only after the outcome has been written, so at most one crawl per job runs in
 * this process and a finished crawl is never reported as live.
 */
@Service
public class CrawlDispatcher {
    private static final Logger log = LoggerFactory.getLogger(CrawlDispatcher.class);
    static final String EMPTY_RESULT_MESSAGE = "No content downloaded";
    static final String CANCELLED_MESSAGE = "manually interrupted";
    private static final int MAX_ERROR_LENGTH = 1000;

    private final LiveJobRegistry registry;
    private final CrawlJobRepository repository;
    private final RetryPolicy retryPolicy;
    private final PageMirrorHandler pageMirrorHandler;
    private final VideoChannelHandler videoChannelHandler;
    private final BrowserSnapshotHandler browserSnapshotHandler;
    private final ExecutorService crawlExecutor;
    private final Clock clock;

    public CrawlDispatcher(
        LiveJobRegistry registry,
        CrawlJobRepository repository,
        RetryPolicy retryPolicy,
        PageMirrorHandler pageMirrorHandler,
        VideoChannelHandler videoChannelHandler,
        BrowserSnapshotHandler browserSnapshotHandler,
        @Qualifier("crawlExecutor") ExecutorService crawlExecutor,
        Clock clock
    ) {
        this.registry = registry;
        this.repository = repository;
        this.retryPolicy = retryPolicy;
        this.pageMirrorHandler = pageMirrorHandler;
        this.videoChannelHandler = videoChannelHandler;
        this.browserSnapshotHandler = browserSnapshotHandler;
        this.crawlExecutor = crawlExecutor;
        this.clock = clock;
    }

    /**
     * Starts a crawl of the job unless one is already running. Never blocks on the crawl.
     *
     * @return completes with the job's status after the crawl, or with {@code null} when the job
     *     does not exist; completes exceptionally when the outcome could not be recorded
     */
    public CompletableFuture<JobStatus> enqueueCrawl(long jobId) {
        Optional<LiveJobEntry> registered = registry.register(jobId);
        if (registered.isEmpty()) {
            log.info("Job {} is already crawling, not starting another crawl", jobId);
            return registry.find(jobId)
                .map(LiveJobEntry::completion)
                .orElseGet(() -> CompletableFuture.completedFuture(null));
        }
        LiveJobEntry entry = registered.get();
        try {
            crawlExecutor.execute(() -> runCrawl(entry));
        } catch (RejectedExecutionException e) {
            registry.unregister(entry);
            entry.completion().completeExceptionally(e);
            log.warn("Crawl executor rejected job {}", jobId, e);
        }
        return entry.completion();
    }

    void runCrawl(LiveJobEntry entry) {
        JobStatus status = null;
        RuntimeException fault = null;
        try {
            status = crawl(entry);
        } catch (RuntimeException e) {
            fault = e;
            log.error("Engine fault while crawling job {}", entry.jobId(), e);
        } finally {
            registry.unregister(entry);
            if (fault != null) {
                entry.completion().completeExceptionally(fault);
            } else {
                entry.completion().complete(status);
            }
        }
    }

    private JobStatus crawl(LiveJobEntry entry) {
        long jobId = entry.jobId();
        CrawlJob job = repository.findJob(jobId);
        if (job == null) {
            log.warn("Crawl job {} not found", jobId);
            return null;
        }
        entry.describe(job.url(), job.kind());
        if (!repository.markCrawling(jobId)) {
            log.warn("Job {} is {} and cannot be crawled", jobId, job.status().dbValue());
            return job.status();
        }
        long attemptId = repository.insertAttempt(jobId, clock.instant());
        entry.attemptStarted(attemptId);
        log.info("Crawling job {} kind={} url={} attempt={}", jobId, job.kind(), job.url(), attemptId);

        CrawlOutcome outcome = runHandler(job, entry);
        if (entry.isCancelled() || outcome.result() == CrawlOutcome.Result.CANCELLED) {
            return commitCancelled(job, attemptId, outcome);
        }
        if (outcome.result() == CrawlOutcome.Result.SUCCESS && outcome.stats().isEmpty()) {
            outcome = CrawlOutcome.failed(CrawlFailureKind.EMPTY_RESULT, EMPTY_RESULT_MESSAGE, outcome.log());
        }
        return switch (outcome.result()) {
            case SUCCESS -> commitSuccess(job, attemptId, outcome);
            case FAILED -> commitFailure(job, attemptId, outcome);
            case CANCELLED -> commitCancelled(job, attemptId, outcome);
        };
    }

    private CrawlOutcome runHandler(CrawlJob job, LiveJobEntry entry) {
        CrawlHandler handler = switch (job.kind()) {
            case PAGE_MIRROR -> pageMirrorHandler;
            case VIDEO_CHANNEL -> videoChannelHandler;
            case BROWSER_SNAPSHOT -> browserSnapshotHandler;
        };
        try {
            return handler.crawl(job, entry);
        } catch (DataAccessException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Handler for job {} failed unexpectedly", job.id(), e);
            String message = e.getClass().getSimpleName() + ": " + e.getMessage();
            return CrawlOutcome.failed(
                CrawlFailureKind.TOOL_FAILURE,
                ErrorClassifier.truncate(message, MAX_ERROR_LENGTH),
                entry.log().all()
            );
        }
    }

    private JobStatus commitSuccess(CrawlJob job, long attemptId, CrawlOutcome outcome) {
        Instant finishedAt = clock.instant();
        Instant nextCrawlAt = finishedAt.plus(Duration.ofDays(job.intervalDays()));
        CrawlStats stats = outcome.stats();
        boolean applied = repository.markSuccess(job.id(), stats, finishedAt, nextCrawlAt);
        repository.finalizeAttempt(
            attemptId,
            finishedAt,
            AttemptOutcome.SUCCESS,
            stats,
            LogTail.of(outcome.log()),
            null,
            null
        );
        if (!applied) {
            log.warn("Job {} left crawling before its success was recorded", job.id());
            return currentStatus(job.id());
        }
        log.info(
            "Crawl of job {} succeeded: {} items, {} bytes, next crawl at {}",
            job.id(),
            stats.itemCount(),
            stats.sizeBytes(),
            nextCrawlAt
        );
        return JobStatus.READY;
    }

    private JobStatus commitFailure(CrawlJob job, long attemptId, CrawlOutcome outcome) {
        String message = ErrorClassifier.truncate(outcome.errorMessage(), MAX_ERROR_LENGTH);
        RetryDecision decision = retryPolicy.onFailure(job.retryCount(), message);
        boolean applied = repository.markFailure(job.id(), decision, message);
        repository.finalizeAttempt(
            attemptId,
            clock.instant(),
            AttemptOutcome.ERROR,
            CrawlStats.EMPTY,
            LogTail.of(outcome.log()),
            message,
            decision.errorClass()
        );
        if (!applied) {
            log.warn("Job {} left crawling before its failure was recorded", job.id());
            return currentStatus(job.id());
        }
        log.warn(
            "Crawl of job {} failed ({}, {}), now {} retry={} next={}: {}",
            job.id(),
            outcome.failureKind(),
            decision.errorClass(),
            decision.status().dbValue(),
            decision.retryCount(),
            decision.nextAttemptAt(),
            message
        );
        return decision.status();
    }

    private JobStatus commitCancelled(CrawlJob job, long attemptId, CrawlOutcome outcome) {
        repository.markCancelled(job.id(), CANCELLED_MESSAGE);
        repository.finalizeAttempt(
            attemptId,
            clock.instant(),
            AttemptOutcome.CANCELLED,
            CrawlStats.EMPTY,
            LogTail.of(outcome.log()),
            CANCELLED_MESSAGE,
            null
        );
        log.info("Crawl of job {} was cancelled", job.id());
        return currentStatus(job.id());
    }

    private JobStatus currentStatus(long jobId) {
        CrawlJob current = repository.findJob(jobId);
        return current == null ? null : current.status();
    }
}
