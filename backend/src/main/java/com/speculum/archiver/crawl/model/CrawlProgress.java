package com.speculum.archiver.crawl.model;

import java.util.List;

/**
 * Best-effort view of a running crawl, derived from the tool's recent output.
 *
 * @param currentFile last file the tool reported saving, or null
 * @param itemsSoFar  items the tool reported so far (0 when nothing recognizable was printed)
 * @param itemsTotal  total announced by the tool, or null when it never said
 */
public record CrawlProgress(
    long jobId,
    String target,
    long elapsedSeconds,
    String currentFile,
    int itemsSoFar,
    Integer itemsTotal,
    long outputBytes,
    List<String> recentLines
) {
    public CrawlProgress {
        recentLines = recentLines == null ? List.of() : List.copyOf(recentLines);
    }
}
