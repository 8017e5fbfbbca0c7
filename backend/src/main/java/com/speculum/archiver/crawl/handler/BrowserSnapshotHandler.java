package com.speculum.archiver.crawl.handler;

import com.speculum.archiver.crawl.live.LiveJobEntry;
import com.speculum.archiver.crawl.model.CrawlFailureKind;
import com.speculum.archiver.crawl.model.CrawlJob;
import com.speculum.archiver.crawl.model.CrawlOutcome;
import com.speculum.archiver.crawl.model.JobKind;
import com.speculum.archiver.crawl.policy.TimeoutPolicy;
import com.speculum.archiver.crawl.process.ProcessResult;
import com.speculum.archiver.crawl.process.ProcessRunner;
import com.speculum.archiver.crawl.storage.MirrorStorage;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Captures the live page as a single self-contained HTML file.
 */
@Component
public class BrowserSnapshotHandler implements CrawlHandler {
    private static final String TOOL = "single-file";
    private static final List<Integer> SUCCESS_CODES = List.of(0);

    private final ProcessRunner processRunner;
    private final ToolCommands toolCommands;
    private final TimeoutPolicy timeoutPolicy;
    private final MirrorStorage mirrorStorage;

    public BrowserSnapshotHandler(
        ProcessRunner processRunner,
        ToolCommands toolCommands,
        TimeoutPolicy timeoutPolicy,
        MirrorStorage mirrorStorage
    ) {
        this.processRunner = processRunner;
        this.toolCommands = toolCommands;
        this.timeoutPolicy = timeoutPolicy;
        this.mirrorStorage = mirrorStorage;
    }

    @Override
    public CrawlOutcome crawl(CrawlJob job, LiveJobEntry entry) {
        Path snapshotDir = mirrorStorage.snapshotDir(job.url());
        try {
            Files.createDirectories(snapshotDir);
        } catch (IOException e) {
            return ToolRunOutcomes.failed(
                CrawlFailureKind.TOOL_FAILURE,
                "Cannot create " + snapshotDir + ": " + e.getMessage(),
                List.of()
            );
        }

        Duration budget = timeoutPolicy.totalBudget(job);
        entry.note("--- single-file " + job.url());
        ProcessResult result = processRunner.run(
            toolCommands.singleFile(job.url(), snapshotDir),
            budget,
            timeoutPolicy.stallBudget(),
            entry
        );
        Optional<CrawlOutcome> failure = ToolRunOutcomes.failureOf(TOOL, result, SUCCESS_CODES, budget, result.log());
        if (failure.isPresent()) {
            return failure.get();
        }
        return CrawlOutcome.success(mirrorStorage.measure(snapshotDir, JobKind.BROWSER_SNAPSHOT), result.log());
    }
}
