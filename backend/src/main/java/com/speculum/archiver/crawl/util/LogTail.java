package com.speculum.archiver.crawl.util;

import java.util.List;

public final class LogTail {
  public static final int MAX_STORED_CHARS = 10_000;

  private LogTail() {
  }

  /**
   * Joins captured output lines, keeping only the last {@code maxChars} characters.
   */
  public static String of(List<String> lines, int maxChars) {
    if (lines == null || lines.isEmpty()) {
      return null;
    }
    String joined = String.join("\n", lines);
    if (joined.length() <= maxChars) {
      return joined;
    }
    return joined.substring(joined.length() - maxChars);
  }

  public static String of(List<String> lines) {
    return of(lines, MAX_STORED_CHARS);
  }
}
