package com.speculum.archiver.crawl.process;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

public record ProcessResult(
    Status status,
    Integer exitCode,
    List<String> log,
    String launchError,
    Duration elapsed
) {
    public enum Status {
        EXITED,
        TIMEOUT,
        STALLED,
        CANCELLED,
        LAUNCH_FAILED
    }

    public ProcessResult {
        log = log == null ? List.of() : List.copyOf(log);
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public static ProcessResult launchFailed(String message) {
        return new ProcessResult(Status.LAUNCH_FAILED, null, List.of(), message, Duration.ZERO);
    }

    public static ProcessResult cancelledBeforeStart() {
        return new ProcessResult(Status.CANCELLED, null, List.of(), null, Duration.ZERO);
    }

    public boolean exitedWith(Collection<Integer> successCodes) {
        return status == Status.EXITED && exitCode != null && successCodes.contains(exitCode);
    }
}
