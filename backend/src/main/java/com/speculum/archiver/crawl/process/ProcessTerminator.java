package com.speculum.archiver.crawl.process;

import com.speculum.archiver.config.ArchiverProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Stops a process tree: terminate signal first, kill after the grace period.
 */
@Component
public class ProcessTerminator {
    private static final Logger log = LoggerFactory.getLogger(ProcessTerminator.class);

    private final Duration grace;

    public ProcessTerminator(ArchiverProperties properties) {
        this.grace = Duration.ofSeconds(properties.getTimeouts().getTerminateGraceSeconds());
    }

    public boolean terminate(Process process) {
        if (process == null) {
            return true;
        }
        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        process.destroy();
        descendants.forEach(ProcessHandle::destroy);

        if (!awaitExit(process, grace)) {
            log.warn("Process {} ignored terminate signal for {}s, killing", process.pid(), grace.toSeconds());
            process.destroyForcibly();
        }
        for (ProcessHandle child : descendants) {
            if (child.isAlive()) {
                child.destroyForcibly();
            }
        }
        return awaitExit(process, Duration.ofSeconds(1)) || !process.isAlive();
    }

    private boolean awaitExit(Process process, Duration timeout) {
        try {
            return process.waitFor(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !process.isAlive();
        }
    }
}
