package com.speculum.archiver.crawl.process;

import com.speculum.archiver.config.ArchiverProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one external tool under supervision.
 *
 * <p>stdout and stderr are merged and read on a separate task from
 * {@code processOutputExecutor}; the calling thread only polls the line queue with a bounded
 * wait, so the total and stall clocks are checked at least once per poll interval no matter
 * what the tool does with its output.
 */
@Component
public class ProcessRunner {
    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);
    private static final long EXIT_DRAIN_NANOS = TimeUnit.SECONDS.toNanos(2);

    private final ExecutorService outputExecutor;
    private final ProcessTerminator terminator;
    private final int capturedLogLines;
    private final long pollIntervalMs;

    public ProcessRunner(
        @Qualifier("processOutputExecutor") ExecutorService outputExecutor,
        ProcessTerminator terminator,
        ArchiverProperties properties
    ) {
        this.outputExecutor = outputExecutor;
        this.terminator = terminator;
        this.capturedLogLines = properties.getLive().getCapturedLogLines();
        this.pollIntervalMs = properties.getTimeouts().getPollIntervalMs();
    }

    public ProcessResult run(List<String> command, Duration totalTimeout, Duration stallTimeout) {
        return run(command, totalTimeout, stallTimeout, ProcessMonitor.NONE);
    }

    public ProcessResult run(
        List<String> command,
        Duration totalTimeout,
        Duration stallTimeout,
        ProcessMonitor monitor
    ) {
        ProcessMonitor sink = monitor == null ? ProcessMonitor.NONE : monitor;
        if (command == null || command.isEmpty()) {
            return ProcessResult.launchFailed("empty command");
        }
        if (sink.isCancelled()) {
            return ProcessResult.cancelledBeforeStart();
        }

        Process process;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(true).start();
        } catch (IOException e) {
            log.warn("Failed to start {}: {}", command.get(0), e.getMessage());
            return ProcessResult.launchFailed(e.getMessage());
        }
        log.debug("Started pid={} command={}", process.pid(), command);
        sink.processStarted(process);

        BlockingQueue<String> lines = new LinkedBlockingQueue<>();
        AtomicBoolean outputClosed = new AtomicBoolean(false);
        try {
            outputExecutor.execute(() -> readOutput(process, lines, outputClosed));
        } catch (RejectedExecutionException e) {
            terminator.terminate(process);
            sink.processFinished(process);
            return ProcessResult.launchFailed("output reader rejected: " + e.getMessage());
        }

        long totalNanos = totalTimeout.toNanos();
        long stallNanos = stallTimeout.toNanos();
        long startNanos = System.nanoTime();
        long lastOutputNanos = startNanos;
        long exitSeenNanos = -1L;
        Deque<String> captured = new ArrayDeque<>();
        ProcessResult.Status status;

        try {
            while (true) {
                String line = lines.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
                long now = System.nanoTime();
                if (line != null) {
                    lastOutputNanos = now;
                    capture(captured, line);
                    sink.lineRead(line);
                } else if (!process.isAlive()) {
                    if (exitSeenNanos < 0) {
                        exitSeenNanos = now;
                    }
                    if (outputClosed.get() || now - exitSeenNanos >= EXIT_DRAIN_NANOS) {
                        drainRemaining(lines, captured, sink);
                        status = ProcessResult.Status.EXITED;
                        break;
                    }
                }
                if (sink.isCancelled()) {
                    status = ProcessResult.Status.CANCELLED;
                    break;
                }
                if (now - startNanos >= totalNanos) {
                    status = ProcessResult.Status.TIMEOUT;
                    break;
                }
                if (now - lastOutputNanos >= stallNanos) {
                    status = ProcessResult.Status.STALLED;
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status = ProcessResult.Status.CANCELLED;
        } finally {
            if (process.isAlive()) {
                terminator.terminate(process);
            }
            sink.processFinished(process);
        }

        if (status == ProcessResult.Status.EXITED && sink.isCancelled()) {
            status = ProcessResult.Status.CANCELLED;
        }
        Integer exitCode = process.isAlive() ? null : process.exitValue();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        if (status != ProcessResult.Status.EXITED) {
            log.info("Process pid={} ended as {} after {}s", process.pid(), status, elapsed.toSeconds());
        }
        return new ProcessResult(status, exitCode, new ArrayList<>(captured), null, elapsed);
    }

    private void readOutput(Process process, BlockingQueue<String> lines, AtomicBoolean outputClosed) {
        try (BufferedReader reader = new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                lines.offer(line);
            }
        } catch (IOException e) {
            log.debug("Output stream of pid={} closed: {}", process.pid(), e.getMessage());
        } finally {
            outputClosed.set(true);
        }
    }

    private void drainRemaining(BlockingQueue<String> lines, Deque<String> captured, ProcessMonitor sink) {
        List<String> rest = new ArrayList<>();
        lines.drainTo(rest);
        for (String line : rest) {
            capture(captured, line);
            sink.lineRead(line);
        }
    }

    private void capture(Deque<String> captured, String line) {
        captured.addLast(line);
        while (captured.size() > capturedLogLines) {
            captured.removeFirst();
        }
    }
}
