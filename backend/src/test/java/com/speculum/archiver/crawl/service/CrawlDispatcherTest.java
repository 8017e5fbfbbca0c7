package com.speculum.archiver.crawl.service;

import com.speculum.archiver.config.ArchiverProperties;
import com.speculum.archiver.crawl.handler.BrowserSnapshotHandler;
import com.speculum.archiver.crawl.handler.PageMirrorHandler;
import com.speculum.archiver.crawl.handler.VideoChannelHandler;
import com.speculum.archiver.crawl.live.LiveJobRegistry;
import com.speculum.archiver.crawl.model.AttemptOutcome;
import com.speculum.archiver.crawl.model.CrawlFailureKind;
import com.speculum.archiver.crawl.model.CrawlJob;
import com.speculum.archiver.crawl.model.CrawlOutcome;
import com.speculum.archiver.crawl.model.CrawlStats;
import com.speculum.archiver.crawl.model.ErrorClass;
import com.speculum.archiver.crawl.model.JobKind;
import com.speculum.archiver.crawl.model.JobStatus;
import com.speculum.archiver.crawl.model.RetryDecision;
import com.speculum.archiver.crawl.persistence.CrawlJobRepository;
import com.speculum.archiver.crawl.policy.RetryPolicy;
import com.speculum.archiver.crawl.process.ProcessTerminator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.speculum.archiver.crawl.TestJobs.job;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrawlDispatcherTest {
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String URL = "https://example.com/";

    @Mock
    private CrawlJobRepository repository;
    @Mock
    private PageMirrorHandler pageMirrorHandler;
    @Mock
    private VideoChannelHandler videoChannelHandler;
    @Mock
    private BrowserSnapshotHandler browserSnapshotHandler;
    @Mock
    private ProcessTerminator terminator;

    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private LiveJobRegistry registry;
    private CrawlDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        ArchiverProperties properties = new ArchiverProperties();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        registry = new LiveJobRegistry(terminator, clock, properties);
        dispatcher = new CrawlDispatcher(
            registry,
            repository,
            new RetryPolicy(properties, clock),
            pageMirrorHandler,
            videoChannelHandler,
            browserSnapshotHandler,
            executor,
            clock
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void successfulMirrorBecomesReady() throws Exception {
        CrawlStats stats = new CrawlStats(50_000L, 3);
        startableJob(job(1, URL, JobKind.PAGE_MIRROR), 11L);
        when(pageMirrorHandler.crawl(any(), any())).thenReturn(CrawlOutcome.success(stats, List.of("FINISHED")));
        when(repository.markSuccess(1L, stats, NOW, NOW.plus(Duration.ofDays(7)))).thenReturn(true);

        JobStatus status = dispatcher.enqueueCrawl(1L).get(5, TimeUnit.SECONDS);

        assertEquals(JobStatus.READY, status);
        verify(repository).finalizeAttempt(11L, NOW, AttemptOutcome.SUCCESS, stats, "FINISHED", null, null);
        verify(repository, never()).markFailure(anyLong(), any(), any());
        assertThat(registry.snapshot()).isEmpty();
    }

    @Test
    void stalledToolIsRetriedAfterFiveMinutes() throws Exception {
        String message = "Tool stalled: no output within the stall budget";
        startableJob(job(1, URL, JobKind.PAGE_MIRROR), 11L);
        when(pageMirrorHandler.crawl(any(), any()))
            .thenReturn(CrawlOutcome.failed(CrawlFailureKind.STALLED, message, List.of("start")));
        when(repository.markFailure(eq(1L), any(), eq(message))).thenReturn(true);

        JobStatus status = dispatcher.enqueueCrawl(1L).get(5, TimeUnit.SECONDS);

        assertEquals(JobStatus.RETRY_PENDING, status);
        ArgumentCaptor<RetryDecision> decision = ArgumentCaptor.forClass(RetryDecision.class);
        verify(repository).markFailure(eq(1L), decision.capture(), eq(message));
        assertEquals(1, decision.getValue().retryCount());
        assertEquals(NOW.plus(Duration.ofMinutes(5)), decision.getValue().nextAttemptAt());
        assertEquals(ErrorClass.UNKNOWN, decision.getValue().errorClass());
        verify(repository).finalizeAttempt(
            11L,
            NOW,
            AttemptOutcome.ERROR,
            CrawlStats.EMPTY,
            "start",
            message,
            ErrorClass.UNKNOWN
        );
    }

    @Test
    void threeRefusedConnectionsEndInError() throws Exception {
        String message = "wget failed with exit code 4: Connection refused";
        when(repository.findJob(1L)).thenReturn(
            job(1, URL, JobKind.PAGE_MIRROR, JobStatus.PENDING, 0, 0L),
            job(1, URL, JobKind.PAGE_MIRROR, JobStatus.RETRY_PENDING, 1, 0L),
            job(1, URL, JobKind.PAGE_MIRROR, JobStatus.RETRY_PENDING, 2, 0L)
        );
        when(repository.markCrawling(1L)).thenReturn(true);
        when(repository.insertAttempt(1L, NOW)).thenReturn(21L, 22L, 23L);
        when(pageMirrorHandler.crawl(any(), any()))
            .thenReturn(CrawlOutcome.failed(CrawlFailureKind.TOOL_FAILURE, message, List.of("Connection refused")));
        when(repository.markFailure(eq(1L), any(), eq(message))).thenReturn(true);

        List<JobStatus> statuses = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            statuses.add(dispatcher.enqueueCrawl(1L).get(5, TimeUnit.SECONDS));
        }

        assertEquals(List.of(JobStatus.RETRY_PENDING, JobStatus.RETRY_PENDING, JobStatus.ERROR), statuses);
        ArgumentCaptor<RetryDecision> decisions = ArgumentCaptor.forClass(RetryDecision.class);
        verify(repository, times(3)).markFailure(eq(1L), decisions.capture(), eq(message));
        RetryDecision last = decisions.getAllValues().get(2);
        assertEquals(3, last.retryCount());
        assertEquals(ErrorClass.RECOVERABLE, last.errorClass());
        assertNull(last.nextAttemptAt());
    }

    @Test
    void emptyMirrorIsNeverReady() throws Exception {
        startableJob(job(1, URL, JobKind.PAGE_MIRROR), 11L);
        when(pageMirrorHandler.crawl(any(), any())).thenReturn(CrawlOutcome.success(CrawlStats.EMPTY, List.of()));
        when(repository.markFailure(eq(1L), any(), eq(CrawlDispatcher.EMPTY_RESULT_MESSAGE))).thenReturn(true);

        JobStatus status = dispatcher.enqueueCrawl(1L).get(5, TimeUnit.SECONDS);

        assertEquals(JobStatus.RETRY_PENDING, status);
        verify(repository, never()).markSuccess(anyLong(), any(), any(), any());
        verify(repository).finalizeAttempt(
            eq(11L),
            eq(NOW),
            eq(AttemptOutcome.ERROR),
            eq(CrawlStats.EMPTY),
            isNull(),
            eq("No content downloaded"),
            eq(ErrorClass.UNKNOWN)
        );
    }

    @Test
    void handlerExceptionIsRecordedAsToolFailureAndCleanedUp() throws Exception {
        startableJob(job(1, URL, JobKind.BROWSER_SNAPSHOT), 11L);
        when(browserSnapshotHandler.crawl(any(), any())).thenThrow(new IllegalStateException("boom"));
        when(repository.markFailure(eq(1L), any(), eq("IllegalStateException: boom"))).thenReturn(true);

        JobStatus status = dispatcher.enqueueCrawl(1L).get(5, TimeUnit.SECONDS);

        assertEquals(JobStatus.RETRY_PENDING, status);
        assertThat(registry.snapshot()).isEmpty();
    }

    @Test
    void dispatchUsesTheHandlerForTheJobKind() throws Exception {
        startableJob(job(1, "https://www.youtube.com/@chan", JobKind.VIDEO_CHANNEL), 11L);
        when(videoChannelHandler.crawl(any(), any()))
            .thenReturn(CrawlOutcome.success(new CrawlStats(10L, 1), List.of()));
        when(repository.markSuccess(eq(1L), any(), eq(NOW), any())).thenReturn(true);

        assertEquals(JobStatus.READY, dispatcher.enqueueCrawl(1L).get(5, TimeUnit.SECONDS));
        verify(pageMirrorHandler, never()).crawl(any(), any());
        verify(browserSnapshotHandler, never()).crawl(any(), any());
    }

    @Test
    void databaseFaultCompletesExceptionallyAndCleansUp() {
        when(repository.findJob(1L)).thenReturn(job(1, URL, JobKind.PAGE_MIRROR));
        when(repository.markCrawling(1L)).thenThrow(new DataAccessResourceFailureException("db down"));

        CompletableFuture<JobStatus> future = dispatcher.enqueueCrawl(1L);

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(DataAccessResourceFailureException.class);
        assertThat(registry.snapshot()).isEmpty();
    }

    @Test
    void secondEnqueueOfALiveJobStartsNothing() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        startableJob(job(1, URL, JobKind.PAGE_MIRROR), 11L);
        when(pageMirrorHandler.crawl(any(), any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return CrawlOutcome.success(new CrawlStats(100L, 1), List.of());
        });
        when(repository.markSuccess(eq(1L), any(), any(), any())).thenReturn(true);

        CompletableFuture<JobStatus> first = dispatcher.enqueueCrawl(1L);
        CompletableFuture<JobStatus> second = dispatcher.enqueueCrawl(1L);
        release.countDown();

        assertSame(first, second);
        assertEquals(JobStatus.READY, first.get(5, TimeUnit.SECONDS));
        verify(pageMirrorHandler, times(1)).crawl(any(), any());
    }

    @Test
    void jobOutsideDispatchableStatusIsLeftAlone() throws Exception {
        when(repository.findJob(1L)).thenReturn(job(1, URL, JobKind.PAGE_MIRROR, JobStatus.DEAD, 1, 0L));
        when(repository.markCrawling(1L)).thenReturn(false);

        assertEquals(JobStatus.DEAD, dispatcher.enqueueCrawl(1L).get(5, TimeUnit.SECONDS));
        verify(repository, never()).insertAttempt(anyLong(), any());
        verify(pageMirrorHandler, never()).crawl(any(), any());
    }

    @Test
    void missingJobCompletesWithoutStatus() throws Exception {
        assertNull(dispatcher.enqueueCrawl(404L).get(5, TimeUnit.SECONDS));
        verify(repository, never()).markCrawling(anyLong());
    }

    private void startableJob(CrawlJob job, long attemptId) {
        when(repository.findJob(job.id())).thenReturn(job);
        when(repository.markCrawling(job.id())).thenReturn(true);
        when(repository.insertAttempt(job.id(), NOW)).thenReturn(attemptId);
    }
}
