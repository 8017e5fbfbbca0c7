package com.speculum.archiver.crawl.live;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded FIFO of output lines. One writer (the job's supervising thread), any number of
 * readers.
 */
public class RollingLog {
    private final int capacity;
    private final Deque<String> lines;
    private long totalLines;

    public RollingLog(int capacity) {
        this.capacity = Math.max(1, capacity);
        this.lines = new ArrayDeque<>(Math.min(this.capacity, 1024));
    }

    public synchronized void append(String line) {
        lines.addLast(line == null ? "" : line);
        totalLines++;
        while (lines.size() > capacity) {
            lines.removeFirst();
        }
    }

    public synchronized List<String> tail(int n) {
        if (n <= 0 || lines.isEmpty()) {
            return List.of();
        }
        List<String> all = new ArrayList<>(lines);
        int from = Math.max(0, all.size() - n);
        return List.copyOf(all.subList(from, all.size()));
    }

    public synchronized List<String> all() {
        return List.copyOf(lines);
    }

    public synchronized int size() {
        return lines.size();
    }

    public synchronized long totalLines() {
        return totalLines;
    }

    public int capacity() {
        return capacity;
    }
}
