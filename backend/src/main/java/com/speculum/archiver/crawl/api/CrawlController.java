package com.speculum.archiver.crawl.api;

import com.speculum.archiver.crawl.model.CancelResult;
import com.speculum.archiver.crawl.model.CrawlAttempt;
import com.speculum.archiver.crawl.model.CrawlJob;
import com.speculum.archiver.crawl.model.CrawlProgress;
import com.speculum.archiver.crawl.model.CrawlStartResponse;
import com.speculum.archiver.crawl.model.LiveCrawlView;
import com.speculum.archiver.crawl.model.LiveLogTail;
import com.speculum.archiver.crawl.model.MirrorDeleteResponse;
import com.speculum.archiver.crawl.service.CrawlEngineService;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api/crawls")
public class CrawlController {
    private static final int MAX_LOG_LINES = 500;
    private static final int MAX_ATTEMPTS = 200;

    private final CrawlEngineService engineService;

    public CrawlController(CrawlEngineService engineService) {
        this.engineService = engineService;
    }

    @PostMapping
    public CrawlJob createJob(@RequestBody CrawlJobRequest request) {
        if (request == null || request.url() == null || request.url().isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "url is required");
        }
        return engineService.createJob(
            request.url(),
            request.kind(),
            request.depth(),
            request.includeExternal(),
            request.intervalDays()
        );
    }

    @GetMapping("/{jobId}")
    public CrawlJob job(@PathVariable("jobId") long jobId) {
        return engineService.getJob(jobId);
    }

    @GetMapping("/active")
    public List<LiveCrawlView> active() {
        return engineService.listLiveCrawls();
    }

    @GetMapping("/{jobId}/progress")
    public CrawlProgress progress(@PathVariable("jobId") long jobId) {
        return engineService.getProgress(jobId)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "No active crawl for job " + jobId));
    }

    @GetMapping("/{jobId}/log")
    public LiveLogTail log(
        @PathVariable("jobId") long jobId,
        @RequestParam(name = "lines", required = false, defaultValue = "100") int lines
    ) {
        int safeLines = Math.max(1, Math.min(lines, MAX_LOG_LINES));
        return engineService.getLiveLogTail(jobId, safeLines)
            .map(tail -> new LiveLogTail(jobId, tail))
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "No active crawl for job " + jobId));
    }

    @PostMapping("/{jobId}/start")
    public CrawlStartResponse start(@PathVariable("jobId") long jobId) {
        return engineService.startCrawl(jobId);
    }

    @PostMapping("/{jobId}/cancel")
    public CancelResult cancel(@PathVariable("jobId") long jobId) {
        return engineService.cancelCrawl(jobId);
    }

    @PostMapping("/{jobId}/reset")
    public CrawlJob reset(@PathVariable("jobId") long jobId) {
        return engineService.resetJob(jobId);
    }

    @GetMapping("/{jobId}/attempts")
    public List<CrawlAttempt> attempts(
        @PathVariable("jobId") long jobId,
        @RequestParam(name = "limit", required = false, defaultValue = "20") int limit
    ) {
        return engineService.getAttempts(jobId, Math.max(1, Math.min(limit, MAX_ATTEMPTS)));
    }

    @DeleteMapping("/{jobId}/mirror")
    public MirrorDeleteResponse deleteMirror(@PathVariable("jobId") long jobId) {
        return new MirrorDeleteResponse(jobId, engineService.deleteMirror(jobId));
    }
}
