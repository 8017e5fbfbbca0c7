package com.speculum.archiver.crawl.live;

import com.speculum.archiver.config.ArchiverProperties;
import com.speculum.archiver.crawl.model.CancelResult;
import com.speculum.archiver.crawl.model.CrawlProgress;
import com.speculum.archiver.crawl.model.LiveCrawlView;
import com.speculum.archiver.crawl.process.ProcessTerminator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Table of crawls running in this process, keyed by job id.
 *
 * <p>A single lock guards the table shape. Log lines are appended through the entry itself by
 * the job's own supervising thread and never take the table lock; process termination always
 * happens after the lock has been released.
 */
@Component
public class LiveJobRegistry {
    private static final Logger log = LoggerFactory.getLogger(LiveJobRegistry.class);

    private final Object lock = new Object();
    private final Map<Long, LiveJobEntry> entries = new HashMap<>();
    private final ProcessTerminator terminator;
    private final Clock clock;
    private final int logBufferLines;
    private final int progressTailLines;

    public LiveJobRegistry(ProcessTerminator terminator, Clock clock, ArchiverProperties properties) {
        this.terminator = terminator;
        this.clock = clock;
        this.logBufferLines = properties.getLive().getLogBufferLines();
        this.progressTailLines = properties.getLive().getProgressTailLines();
    }

    /**
     * @return the new entry, or empty when the job already has one
     */
    public Optional<LiveJobEntry> register(long jobId) {
        synchronized (lock) {
            if (entries.containsKey(jobId)) {
                return Optional.empty();
            }
            LiveJobEntry entry = new LiveJobEntry(jobId, clock.instant(), logBufferLines);
            entries.put(jobId, entry);
            return Optional.of(entry);
        }
    }

    public Optional<LiveJobEntry> find(long jobId) {
        synchronized (lock) {
            return Optional.ofNullable(entries.get(jobId));
        }
    }

    public boolean isLive(long jobId) {
        synchronized (lock) {
            return entries.containsKey(jobId);
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    public boolean appendLog(long jobId, String line) {
        Optional<LiveJobEntry> entry = find(jobId);
        entry.ifPresent(value -> value.note(line));
        return entry.isPresent();
    }

    public List<LiveCrawlView> snapshot() {
        List<LiveJobEntry> current;
        synchronized (lock) {
            current = new ArrayList<>(entries.values());
        }
        Instant now = clock.instant();
        List<LiveCrawlView> views = new ArrayList<>(current.size());
        for (LiveJobEntry entry : current) {
            views.add(new LiveCrawlView(
                entry.jobId(),
                entry.target(),
                entry.kind(),
                entry.startedAt(),
                elapsedSeconds(entry, now),
                entry.log().totalLines()
            ));
        }
        views.sort(Comparator.comparing(LiveCrawlView::startedAt).thenComparing(LiveCrawlView::jobId));
        return views;
    }

    public Optional<List<String>> tailLog(long jobId, int lines) {
        return find(jobId).map(entry -> entry.log().tail(Math.max(0, lines)));
    }

    public Optional<CrawlProgress> progress(long jobId) {
        return find(jobId).map(entry -> {
            List<String> buffered = entry.log().all();
            CrawlLogParser.Guess guess = CrawlLogParser.guess(buffered);
            int from = Math.max(0, buffered.size() - progressTailLines);
            return new CrawlProgress(
                entry.jobId(),
                entry.target(),
                elapsedSeconds(entry, clock.instant()),
                guess.currentFile(),
                guess.itemsSoFar(),
                guess.itemsTotal(),
                entry.outputBytes(),
                buffered.subList(from, buffered.size())
            );
        });
    }

    /**
     * Removes the given entry if it is still the one registered for its job. A newer entry
     * for the same job is left alone.
     */
    public boolean unregister(LiveJobEntry entry) {
        synchronized (lock) {
            return entries.remove(entry.jobId(), entry);
        }
    }

    public CancelResult terminate(long jobId) {
        LiveJobEntry entry;
        synchronized (lock) {
            entry = entries.remove(jobId);
            if (entry != null) {
                entry.markCancelled();
            }
        }
        if (entry == null) {
            return new CancelResult(false, "No active crawl for job " + jobId);
        }
        Process process = entry.process();
        if (process == null || !process.isAlive()) {
            log.info("Cancelled job {} between tool invocations", jobId);
            return new CancelResult(true, "Crawl cancelled");
        }
        boolean stopped = terminator.terminate(process);
        log.info("Terminated process {} of job {} (stopped={})", process.pid(), jobId, stopped);
        return new CancelResult(true, stopped ? "Crawl stopped" : "Crawl cancelled; process still exiting");
    }

    private long elapsedSeconds(LiveJobEntry entry, Instant now) {
        return Math.max(0L, Duration.between(entry.startedAt(), now).toSeconds());
    }
}
