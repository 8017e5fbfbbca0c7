package com.speculum.archiver.crawl.live;

import com.speculum.archiver.crawl.model.JobKind;
import com.speculum.archiver.crawl.model.JobStatus;
import com.speculum.archiver.crawl.process.ProcessMonitor;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory state of one running crawl. Lives from registration until the dispatcher's
 * cleanup step (or a forced termination) and is never persisted.
 */
public class LiveJobEntry implements ProcessMonitor {
    private final long jobId;
    private final Instant startedAt;
    private final RollingLog log;
    private final AtomicLong outputBytes = new AtomicLong();
    private final CompletableFuture<JobStatus> completion = new CompletableFuture<>();

    private volatile String target;
    private volatile JobKind kind;
    private volatile Process process;
    private volatile Long attemptId;
    private volatile boolean cancelled;

    LiveJobEntry(long jobId, Instant startedAt, int logCapacity) {
        this.jobId = jobId;
        this.startedAt = startedAt;
        this.log = new RollingLog(logCapacity);
    }

    public long jobId() {
        return jobId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public String target() {
        return target;
    }

    public JobKind kind() {
        return kind;
    }

    public void describe(String target, JobKind kind) {
        this.target = target;
        this.kind = kind;
    }

    public Long attemptId() {
        return attemptId;
    }

    public void attemptStarted(long attemptId) {
        this.attemptId = attemptId;
    }

    public Process process() {
        return process;
    }

    public RollingLog log() {
        return log;
    }

    public long outputBytes() {
        return outputBytes.get();
    }

    public CompletableFuture<JobStatus> completion() {
        return completion;
    }

    void markCancelled() {
        this.cancelled = true;
    }

    /**
     * Adds a line produced outside a subprocess (dispatcher notes, separators).
     */
    public void note(String line) {
        lineRead(line);
    }

    @Override
    public void processStarted(Process process) {
        this.process = process;
    }

    @Override
    public void lineRead(String line) {
        log.append(line);
        outputBytes.addAndGet(line == null ? 1 : line.length() + 1L);
    }

    @Override
    public void processFinished(Process process) {
        if (this.process == process) {
            this.process = null;
        }
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }
}
