package com.speculum.archiver.crawl.service;

import com.speculum.archiver.config.ArchiverProperties;
import com.speculum.archiver.crawl.handler.BrowserSnapshotHandler;
import com.speculum.archiver.crawl.handler.PageMirrorHandler;
import com.speculum.archiver.crawl.handler.ToolCommands;
import com.speculum.archiver.crawl.handler.VideoChannelHandler;
import com.speculum.archiver.crawl.live.LiveJobEntry;
import com.speculum.archiver.crawl.live.LiveJobRegistry;
import com.speculum.archiver.crawl.model.AttemptOutcome;
import com.speculum.archiver.crawl.model.CancelResult;
import com.speculum.archiver.crawl.model.CrawlStats;
import com.speculum.archiver.crawl.model.JobKind;
import com.speculum.archiver.crawl.model.JobStatus;
import com.speculum.archiver.crawl.persistence.CrawlJobRepository;
import com.speculum.archiver.crawl.policy.RetryPolicy;
import com.speculum.archiver.crawl.policy.TimeoutPolicy;
import com.speculum.archiver.crawl.process.ProcessRunner;
import com.speculum.archiver.crawl.process.ProcessTerminator;
import com.speculum.archiver.crawl.storage.MirrorStorage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.speculum.archiver.crawl.TestJobs.job;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Cancellation against a real tool process that ignores the terminate signal.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
@ExtendWith(MockitoExtension.class)
class CrawlCancellationProcessTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path workDir;

    @Mock
    private CrawlJobRepository repository;
    @Mock
    private VideoChannelHandler videoChannelHandler;
    @Mock
    private BrowserSnapshotHandler browserSnapshotHandler;

    private final ExecutorService crawlExecutor = Executors.newSingleThreadExecutor();
    private final ExecutorService outputExecutor = Executors.newCachedThreadPool();
    private LiveJobRegistry registry;
    private CrawlDispatcher dispatcher;
    private CrawlCancellationService cancellationService;

    @BeforeEach
    void setUp() throws IOException {
        ArchiverProperties properties = new ArchiverProperties();
        properties.setMirrorsPath(workDir.resolve("mirrors").toString());
        properties.getTools().setWget(stubbornTool().toString());
        properties.getTimeouts().setPollIntervalMs(20);
        properties.getTimeouts().setTerminateGraceSeconds(1);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

        ProcessTerminator terminator = new ProcessTerminator(properties);
        registry = new LiveJobRegistry(terminator, clock, properties);
        PageMirrorHandler pageMirrorHandler = new PageMirrorHandler(
            new ProcessRunner(outputExecutor, terminator, properties),
            new ToolCommands(properties),
            new TimeoutPolicy(properties),
            new MirrorStorage(properties),
            properties
        );
        dispatcher = new CrawlDispatcher(
            registry,
            repository,
            new RetryPolicy(properties, clock),
            pageMirrorHandler,
            videoChannelHandler,
            browserSnapshotHandler,
            crawlExecutor,
            clock
        );
        cancellationService = new CrawlCancellationService(registry, repository, clock);
    }

    @AfterEach
    void tearDown() {
        crawlExecutor.shutdownNow();
        outputExecutor.shutdownNow();
    }

    @Test
    void cancelKillsAToolThatIgnoresTerminate() throws Exception {
        when(repository.findJob(1L)).thenReturn(job(1, "https://example.com/", JobKind.PAGE_MIRROR));
        when(repository.markCrawling(1L)).thenReturn(true);
        when(repository.insertAttempt(1L, NOW)).thenReturn(11L);

        CompletableFuture<JobStatus> completion = dispatcher.enqueueCrawl(1L);
        Process process = awaitToolStarted(1L);

        long startNanos = System.nanoTime();
        CancelResult result = cancellationService.cancelCrawl(1L);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        completion.get(10, TimeUnit.SECONDS);

        assertTrue(result.ok());
        assertEquals("Crawl stopped", result.message());
        assertThat(elapsedMillis).isGreaterThanOrEqualTo(900L);
        process.onExit().get(5, TimeUnit.SECONDS);
        assertFalse(process.isAlive());
        assertFalse(registry.isLive(1L));
        verify(repository, atLeastOnce()).markCancelled(1L, "manually interrupted");
        verify(repository, atLeastOnce()).finalizeAttempt(
            eq(11L),
            eq(NOW),
            eq(AttemptOutcome.CANCELLED),
            eq(CrawlStats.EMPTY),
            anyString(),
            eq("manually interrupted"),
            isNull()
        );
        verify(repository, never()).markFailure(anyLong(), any(), any());
        verify(repository, never()).markSuccess(anyLong(), any(), any(), any());
    }

    private Process awaitToolStarted(long jobId) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (System.nanoTime() < deadline) {
            LiveJobEntry entry = registry.find(jobId).orElse(null);
            if (entry != null && entry.process() != null && entry.log().all().contains("started")) {
                return entry.process();
            }
            Thread.sleep(20);
        }
        Process process = registry.find(jobId).map(LiveJobEntry::process).orElse(null);
        assertNotNull(process, "tool never started");
        return process;
    }

    private Path stubbornTool() throws IOException {
        Path script = workDir.resolve("wget");
        Files.writeString(script, "#!/bin/sh\ntrap '' TERM\necho started\nwhile true; do sleep 1; done\n", StandardCharsets.UTF_8);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
        return script;
    }
}
