package com.speculum.archiver.crawl.service;

import com.speculum.archiver.crawl.live.LiveJobRegistry;
import com.speculum.archiver.crawl.model.CancelResult;
import com.speculum.archiver.crawl.model.CrawlAttempt;
import com.speculum.archiver.crawl.model.CrawlJob;
import com.speculum.archiver.crawl.model.CrawlProgress;
import com.speculum.archiver.crawl.model.CrawlStartResponse;
import com.speculum.archiver.crawl.model.JobKind;
import com.speculum.archiver.crawl.model.JobStatus;
import com.speculum.archiver.crawl.model.LiveCrawlView;
import com.speculum.archiver.crawl.model.NewCrawlJob;
import com.speculum.archiver.crawl.persistence.CrawlJobRepository;
import com.speculum.archiver.crawl.storage.MirrorStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for everything outside the engine: the REST layer and the trigger.
 */
@Service
public class CrawlEngineService {
    private static final Logger log = LoggerFactory.getLogger(CrawlEngineService.class);
    static final int DEFAULT_INTERVAL_DAYS = 30;
    private static final List<String> VIDEO_HOSTS = List.of("youtube.com", "youtu.be");

    private final CrawlDispatcher dispatcher;
    private final CrawlCancellationService cancellationService;
    private final LiveJobRegistry registry;
    private final CrawlJobRepository repository;
    private final MirrorStorage mirrorStorage;

    public CrawlEngineService(
        CrawlDispatcher dispatcher,
        CrawlCancellationService cancellationService,
        LiveJobRegistry registry,
        CrawlJobRepository repository,
        MirrorStorage mirrorStorage
    ) {
        this.dispatcher = dispatcher;
        this.cancellationService = cancellationService;
        this.registry = registry;
        this.repository = repository;
        this.mirrorStorage = mirrorStorage;
    }

    /**
     * Registers a new job in {@code pending}. A missing kind is inferred from the URL host.
     */
    public CrawlJob createJob(String url, JobKind kind, Integer depth, Boolean includeExternal, Integer intervalDays) {
        if (url == null || MirrorStorage.hostOf(url) == null) {
            throw new IllegalArgumentException("A crawl job needs an absolute URL with a host: " + url);
        }
        NewCrawlJob job = new NewCrawlJob(
            url.trim(),
            kind == null ? inferKind(url) : kind,
            depth == null ? 0 : Math.max(0, depth),
            includeExternal != null && includeExternal,
            intervalDays == null || intervalDays < 1 ? DEFAULT_INTERVAL_DAYS : intervalDays
        );
        long jobId = repository.insertJob(job);
        log.info("Created crawl job {} kind={} url={}", jobId, job.kind(), job.url());
        return repository.findJob(jobId);
    }

    public CrawlJob getJob(long jobId) {
        CrawlJob job = repository.findJob(jobId);
        if (job == null) {
            throw new CrawlJobNotFoundException(jobId);
        }
        return job;
    }

    public CompletableFuture<JobStatus> enqueueCrawl(long jobId) {
        getJob(jobId);
        return dispatcher.enqueueCrawl(jobId);
    }

    public CrawlStartResponse startCrawl(long jobId) {
        CrawlJob job = getJob(jobId);
        if (registry.isLive(jobId)) {
            return new CrawlStartResponse(jobId, false, "Crawl already running");
        }
        if (job.status() == JobStatus.ERROR || job.status() == JobStatus.DEAD) {
            throw new CrawlJobStateException(
                "Job " + jobId + " is " + job.status().dbValue() + "; reset it before crawling again"
            );
        }
        dispatcher.enqueueCrawl(jobId);
        return new CrawlStartResponse(jobId, true, "Crawl started");
    }

    public CancelResult cancelCrawl(long jobId) {
        return cancellationService.cancelCrawl(jobId);
    }

    public List<LiveCrawlView> listLiveCrawls() {
        return registry.snapshot();
    }

    public Optional<CrawlProgress> getProgress(long jobId) {
        return registry.progress(jobId);
    }

    public Optional<List<String>> getLiveLogTail(long jobId, int lines) {
        return registry.tailLog(jobId, lines);
    }

    public List<CrawlAttempt> getAttempts(long jobId, int limit) {
        getJob(jobId);
        return repository.findAttempts(jobId, limit);
    }

    /**
     * Returns an {@code error} or {@code dead} job to {@code pending} with a fresh retry count.
     */
    public CrawlJob resetJob(long jobId) {
        CrawlJob job = getJob(jobId);
        if (!repository.resetToPending(jobId)) {
            throw new CrawlJobStateException(
                "Job " + jobId + " is " + job.status().dbValue() + "; only error or dead jobs can be reset"
            );
        }
        log.info("Reset job {} from {} to pending", jobId, job.status().dbValue());
        return repository.findJob(jobId);
    }

    public boolean deleteMirror(long jobId) {
        CrawlJob job = getJob(jobId);
        if (registry.isLive(jobId)) {
            throw new CrawlJobStateException("Job " + jobId + " is crawling; cancel it before deleting its mirror");
        }
        return mirrorStorage.delete(mirrorDirOf(job));
    }

    Path mirrorDirOf(CrawlJob job) {
        return switch (job.kind()) {
            case PAGE_MIRROR -> mirrorStorage.pageMirrorDir(job.url());
            case BROWSER_SNAPSHOT -> mirrorStorage.snapshotDir(job.url());
            case VIDEO_CHANNEL -> mirrorStorage.channelDir(
                job.channelId() == null || job.channelId().isBlank() ? MirrorStorage.slugOf(job.url()) : job.channelId()
            );
        };
    }

    static JobKind inferKind(String url) {
        String host = MirrorStorage.hostOf(url);
        if (host != null) {
            for (String videoHost : VIDEO_HOSTS) {
                if (host.equals(videoHost) || host.endsWith("." + videoHost)) {
                    return JobKind.VIDEO_CHANNEL;
                }
            }
        }
        return JobKind.PAGE_MIRROR;
    }
}
