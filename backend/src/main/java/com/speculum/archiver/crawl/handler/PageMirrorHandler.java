package com.speculum.archiver.crawl.handler;

import com.speculum.archiver.config.ArchiverProperties;
import com.speculum.archiver.crawl.live.LiveJobEntry;
import com.speculum.archiver.crawl.model.CrawlFailureKind;
import com.speculum.archiver.crawl.model.CrawlJob;
import com.speculum.archiver.crawl.model.CrawlOutcome;
import com.speculum.archiver.crawl.model.JobKind;
import com.speculum.archiver.crawl.policy.TimeoutPolicy;
import com.speculum.archiver.crawl.process.ProcessResult;
import com.speculum.archiver.crawl.process.ProcessRunner;
import com.speculum.archiver.crawl.storage.MirrorStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Mirrors a website with wget. The domain root is fetched first so that a deep link still
 * yields a browsable site, then the requested URL; both runs share one total budget.
 */
@Component
public class PageMirrorHandler implements CrawlHandler {
    private static final Logger log = LoggerFactory.getLogger(PageMirrorHandler.class);
    private static final String TOOL = "wget";

    private final ProcessRunner processRunner;
    private final ToolCommands toolCommands;
    private final TimeoutPolicy timeoutPolicy;
    private final MirrorStorage mirrorStorage;
    private final ArchiverProperties properties;

    public PageMirrorHandler(
        ProcessRunner processRunner,
        ToolCommands toolCommands,
        TimeoutPolicy timeoutPolicy,
        MirrorStorage mirrorStorage,
        ArchiverProperties properties
    ) {
        this.processRunner = processRunner;
        this.toolCommands = toolCommands;
        this.timeoutPolicy = timeoutPolicy;
        this.mirrorStorage = mirrorStorage;
        this.properties = properties;
    }

    @Override
    public CrawlOutcome crawl(CrawlJob job, LiveJobEntry entry) {
        Path mirrorDir = mirrorStorage.pageMirrorDir(job.url());
        Duration budget = timeoutPolicy.totalBudget(job);
        long startNanos = System.nanoTime();
        List<String> targets = crawlTargets(job.url());
        List<String> captured = new ArrayList<>();

        for (int i = 0; i < targets.size(); i++) {
            String target = targets.get(i);
            boolean last = i == targets.size() - 1;
            Duration remaining = budget.minusNanos(System.nanoTime() - startNanos);
            if (remaining.isNegative() || remaining.isZero()) {
                return ToolRunOutcomes.failed(CrawlFailureKind.TIMEOUT, ToolRunOutcomes.timeoutMessage(budget), captured);
            }

            entry.note("--- wget " + target);
            ProcessResult result = processRunner.run(
                toolCommands.wget(target, mirrorStorage.mirrorsRoot(), job.depth(), job.includeExternal()),
                remaining,
                timeoutPolicy.stallBudget(),
                entry
            );
            captured.addAll(result.log());

            Optional<CrawlOutcome> failure = ToolRunOutcomes.failureOf(
                TOOL,
                result,
                properties.getTools().getWgetSuccessCodes(),
                budget,
                captured
            );
            if (failure.isPresent()) {
                CrawlOutcome outcome = failure.get();
                if (!last && outcome.failureKind() == CrawlFailureKind.TOOL_FAILURE) {
                    captured.add("Root crawl failed, continuing with " + job.url() + ": " + outcome.errorMessage());
                    log.warn("Root crawl of job {} failed: {}", job.id(), outcome.errorMessage());
                    continue;
                }
                return outcome;
            }
        }

        return CrawlOutcome.success(mirrorStorage.measure(mirrorDir, JobKind.PAGE_MIRROR), captured);
    }

    /**
     * @return the domain root followed by the URL itself, or just the URL when it is the root
     */
    static List<String> crawlTargets(String url) {
        String root = rootOf(url);
        if (root == null || root.equals(url) || root.equals(url + "/")) {
            return List.of(url);
        }
        return List.of(root, url);
    }

    static String rootOf(String url) {
        try {
            URI uri = URI.create(url.trim());
            if (uri.getScheme() == null || uri.getRawAuthority() == null) {
                return null;
            }
            return uri.getScheme() + "://" + uri.getRawAuthority() + "/";
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
