package com.speculum.archiver.crawl.handler;

import com.speculum.archiver.crawl.live.LiveJobEntry;
import com.speculum.archiver.crawl.model.CrawlFailureKind;
import com.speculum.archiver.crawl.model.CrawlJob;
import com.speculum.archiver.crawl.model.CrawlOutcome;
import com.speculum.archiver.crawl.model.JobKind;
import com.speculum.archiver.crawl.persistence.CrawlJobRepository;
import com.speculum.archiver.crawl.policy.TimeoutPolicy;
import com.speculum.archiver.crawl.process.ProcessResult;
import com.speculum.archiver.crawl.process.ProcessRunner;
import com.speculum.archiver.crawl.storage.MirrorStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Downloads a video channel or playlist with yt-dlp into {@code <mirrors>/youtube/<channelId>}
 * and catalogs every new item from its sidecar metadata.
 */
@Component
public class VideoChannelHandler implements CrawlHandler {
    private static final Logger log = LoggerFactory.getLogger(VideoChannelHandler.class);
    private static final String TOOL = "yt-dlp";
    private static final List<Integer> SUCCESS_CODES = List.of(0);

    private final ProcessRunner processRunner;
    private final ToolCommands toolCommands;
    private final TimeoutPolicy timeoutPolicy;
    private final MirrorStorage mirrorStorage;
    private final ChannelProbe channelProbe;
    private final VideoSidecarScanner sidecarScanner;
    private final CrawlJobRepository repository;

    public VideoChannelHandler(
        ProcessRunner processRunner,
        ToolCommands toolCommands,
        TimeoutPolicy timeoutPolicy,
        MirrorStorage mirrorStorage,
        ChannelProbe channelProbe,
        VideoSidecarScanner sidecarScanner,
        CrawlJobRepository repository
    ) {
        this.processRunner = processRunner;
        this.toolCommands = toolCommands;
        this.timeoutPolicy = timeoutPolicy;
        this.mirrorStorage = mirrorStorage;
        this.channelProbe = channelProbe;
        this.sidecarScanner = sidecarScanner;
        this.repository = repository;
    }

    @Override
    public CrawlOutcome crawl(CrawlJob job, LiveJobEntry entry) {
        String channelId = resolveChannelId(job, entry);
        if (entry.isCancelled()) {
            return CrawlOutcome.cancelled(entry.log().all());
        }
        String directoryName = channelId != null ? channelId : MirrorStorage.slugOf(job.url());
        Path channelDir = mirrorStorage.channelDir(directoryName);
        try {
            Files.createDirectories(channelDir);
        } catch (IOException e) {
            return ToolRunOutcomes.failed(
                CrawlFailureKind.TOOL_FAILURE,
                "Cannot create " + channelDir + ": " + e.getMessage(),
                List.of()
            );
        }

        Duration budget = timeoutPolicy.totalBudget(job);
        entry.note("--- yt-dlp " + job.url());
        ProcessResult result = processRunner.run(
            toolCommands.ytDlp(job.url(), channelDir),
            budget,
            timeoutPolicy.stallBudget(),
            entry
        );

        if (result.status() != ProcessResult.Status.CANCELLED && result.status() != ProcessResult.Status.LAUNCH_FAILED) {
            sidecarScanner.scan(job.id(), entry.attemptId(), channelDir);
        }

        Optional<CrawlOutcome> failure = ToolRunOutcomes.failureOf(TOOL, result, SUCCESS_CODES, budget, result.log());
        if (failure.isPresent()) {
            return failure.get();
        }
        return CrawlOutcome.success(mirrorStorage.measure(channelDir, JobKind.VIDEO_CHANNEL), result.log());
    }

    private String resolveChannelId(CrawlJob job, LiveJobEntry entry) {
        if (job.channelId() != null && !job.channelId().isBlank()) {
            return job.channelId();
        }
        entry.note("--- probing channel of " + job.url());
        Optional<String> probed = channelProbe.probe(job.url(), entry);
        if (probed.isEmpty()) {
            log.warn("No channel id for job {}, falling back to a directory named after the URL", job.id());
            return null;
        }
        repository.updateChannelId(job.id(), probed.get());
        log.info("Job {} resolved to channel {}", job.id(), probed.get());
        return probed.get();
    }
}
