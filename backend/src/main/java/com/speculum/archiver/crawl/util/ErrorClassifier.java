package com.speculum.archiver.crawl.util;

import com.speculum.archiver.crawl.model.ErrorClass;
import java.util.List;
import java.util.Locale;

public final class ErrorClassifier {
  static final List<String> PERMANENT_MARKERS =
      List.of(
          "401",
          "403",
          "404",
          "not found",
          "forbidden",
          "unauthorized",
          "name or service not known",
          "unable to resolve host",
          "could not resolve",
          "no such host",
          "unknownhost",
          "nodename nor servname",
          "certificate",
          "ssl",
          "tls handshake");

  static final List<String> RECOVERABLE_MARKERS =
      List.of(
          "timeout",
          "timed out",
          "connection reset",
          "connection refused",
          "429",
          "502",
          "503",
          "504",
          "temporary failure",
          "too many requests",
          "service unavailable",
          "bad gateway",
          "gateway timeout");

  private ErrorClassifier() {}

  public static ErrorClass classify(String message) {
    if (message == null || message.isBlank()) {
      return ErrorClass.UNKNOWN;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    for (String marker : PERMANENT_MARKERS) {
      if (containsMarker(lower, marker)) {
        return ErrorClass.PERMANENT;
      }
    }
    for (String marker : RECOVERABLE_MARKERS) {
      if (containsMarker(lower, marker)) {
        return ErrorClass.RECOVERABLE;
      }
    }
    return ErrorClass.UNKNOWN;
  }

  /**
   * Status-code markers count only as whole numbers, so "14040 seconds" does not read as a 404.
   */
  static boolean containsMarker(String lower, String marker) {
    if (!isNumeric(marker)) {
      return lower.contains(marker);
    }
    int from = 0;
    while (true) {
      int index = lower.indexOf(marker, from);
      if (index < 0) {
        return false;
      }
      int end = index + marker.length();
      boolean digitBefore = index > 0 && Character.isDigit(lower.charAt(index - 1));
      boolean digitAfter = end < lower.length() && Character.isDigit(lower.charAt(end));
      if (!digitBefore && !digitAfter) {
        return true;
      }
      from = index + 1;
    }
  }

  private static boolean isNumeric(String marker) {
    for (int i = 0; i < marker.length(); i++) {
      if (!Character.isDigit(marker.charAt(i))) {
        return false;
      }
    }
    return !marker.isEmpty();
  }

  /** Only permanent failures are final; unknown ones are retried. */
  public static boolean isRetryable(ErrorClass errorClass) {
    return errorClass != ErrorClass.PERMANENT;
  }

  public static String truncate(String message, int maxLength) {
    if (message == null || message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }
}
