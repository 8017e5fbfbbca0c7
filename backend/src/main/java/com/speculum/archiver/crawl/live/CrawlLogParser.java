package com.speculum.archiver.crawl.live;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Guesses progress from tool output. Only recognizes what wget and yt-dlp print by default;
 * anything else yields an empty guess.
 */
public final class CrawlLogParser {
    private static final Pattern WGET_SAVING = Pattern.compile("Saving to:\\s*[‘'`\"]?(.+?)[’'`\"]?\\s*$");
    private static final Pattern YTDLP_DESTINATION = Pattern.compile("^\\[download\\]\\s+Destination:\\s*(.+?)\\s*$");
    private static final Pattern YTDLP_MERGING = Pattern.compile("^\\[Merger\\]\\s+Merging formats into\\s+\"(.+)\"\\s*$");
    private static final Pattern YTDLP_ITEM = Pattern.compile("Downloading (?:item|video) (\\d{1,9}) of (\\d{1,9})");

    private CrawlLogParser() {
    }

    public static Guess guess(List<String> lines) {
        String currentFile = null;
        int savedFiles = 0;
        Integer itemIndex = null;
        Integer itemTotal = null;
        if (lines == null) {
            return new Guess(null, 0, null);
        }
        for (String line : lines) {
            if (line == null || line.isEmpty()) {
                continue;
            }
            Matcher saving = WGET_SAVING.matcher(line);
            if (saving.find()) {
                currentFile = saving.group(1);
                savedFiles++;
                continue;
            }
            Matcher destination = YTDLP_DESTINATION.matcher(line);
            if (destination.find()) {
                currentFile = destination.group(1);
                continue;
            }
            Matcher merging = YTDLP_MERGING.matcher(line);
            if (merging.find()) {
                currentFile = merging.group(1);
                continue;
            }
            Matcher item = YTDLP_ITEM.matcher(line);
            if (item.find()) {
                itemIndex = Integer.parseInt(item.group(1));
                itemTotal = Integer.parseInt(item.group(2));
            }
        }
        int itemsSoFar = itemIndex != null ? itemIndex : savedFiles;
        return new Guess(currentFile, itemsSoFar, itemTotal);
    }

    public record Guess(String currentFile, int itemsSoFar, Integer itemsTotal) {
    }
}
