package com.speculum.archiver.crawl.process;

/**
 * Receives the lifecycle and output of one supervised subprocess. Callbacks run on the
 * supervising thread, never on the output reader.
 */
public interface ProcessMonitor {
    ProcessMonitor NONE = new ProcessMonitor() {
    };

    default void processStarted(Process process) {
    }

    default void lineRead(String line) {
    }

    default void processFinished(Process process) {
    }

    default boolean isCancelled() {
        return false;
    }
}
