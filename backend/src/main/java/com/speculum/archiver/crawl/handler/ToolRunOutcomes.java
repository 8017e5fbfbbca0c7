package com.speculum.archiver.crawl.handler;

import com.speculum.archiver.crawl.model.CrawlFailureKind;
import com.speculum.archiver.crawl.model.CrawlOutcome;
import com.speculum.archiver.crawl.process.ProcessResult;
import com.speculum.archiver.crawl.util.ErrorClassifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

final class ToolRunOutcomes {
  static final int MAX_ERROR_LENGTH = 1000;
  static final String STALL_MESSAGE = "Tool stalled: no output within the stall budget";
  private static final int ERROR_TAIL_LINES = 5;

  private ToolRunOutcomes() {
  }

  /**
   * @return empty when the tool exited with one of {@code successCodes}
   */
  static Optional<CrawlOutcome> failureOf(
      String tool,
      ProcessResult result,
      Collection<Integer> successCodes,
      Duration budget,
      List<String> log
  ) {
    return switch (result.status()) {
      case EXITED -> result.exitedWith(successCodes)
          ? Optional.empty()
          : Optional.of(failed(CrawlFailureKind.TOOL_FAILURE,
              tool + " failed with exit code " + result.exitCode() + ": " + lastLines(result.log()), log));
      case TIMEOUT -> Optional.of(failed(CrawlFailureKind.TIMEOUT, timeoutMessage(budget), log));
      case STALLED -> Optional.of(failed(CrawlFailureKind.STALLED, STALL_MESSAGE, log));
      case CANCELLED -> Optional.of(CrawlOutcome.cancelled(log));
      case LAUNCH_FAILED -> Optional.of(failed(CrawlFailureKind.TOOL_FAILURE,
          tool + " could not be started: " + result.launchError(), log));
    };
  }

  static String timeoutMessage(Duration budget) {
    return "Crawl timed out after " + budget.toSeconds() + " seconds";
  }

  static CrawlOutcome failed(CrawlFailureKind kind, String message, List<String> log) {
    return CrawlOutcome.failed(kind, ErrorClassifier.truncate(message, MAX_ERROR_LENGTH), log);
  }

  static String lastLines(List<String> lines) {
    List<String> tail = new ArrayList<>();
    for (int i = lines.size() - 1; i >= 0 && tail.size() < ERROR_TAIL_LINES; i--) {
      String line = lines.get(i);
      if (line != null && !line.isBlank()) {
        tail.add(0, line.trim());
      }
    }
    return tail.isEmpty() ? "(no output)" : String.join(" | ", tail);
  }
}
