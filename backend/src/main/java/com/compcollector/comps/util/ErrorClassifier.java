package com.compcollector.comps.util;

import com.compcollector.comps.model.ErrorKind;
import com.compcollector.comps.service.JobConfigurationException;
import com.compcollector.comps.browser.SourceAutomationException;
import com.microsoft.playwright.TimeoutError;

import java.util.Locale;

public final class ErrorClassifier {
  private static final int MAX_CAUSE_DEPTH = 8;

  private ErrorClassifier() {}

  public static ErrorKind classify(Throwable error) {
    Throwable current = error;
    int depth = 0;
    while (current != null && depth < MAX_CAUSE_DEPTH) {
      if (current instanceof SourceAutomationException automation) {
        return automation.kind();
      }
      if (current instanceof JobConfigurationException) {
        return ErrorKind.CONFIGURATION;
      }
      if (current instanceof TimeoutError) {
        return ErrorKind.NAVIGATION_TIMEOUT;
      }
      ErrorKind fromMessage = fromMessage(current.getMessage());
      if (fromMessage != ErrorKind.OTHER) {
        return fromMessage;
      }
      current = current.getCause();
      depth++;
    }
    return ErrorKind.OTHER;
  }

  public static ErrorKind fromMessage(String message) {
    if (message == null || message.isBlank()) {
      return ErrorKind.OTHER;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    if (lower.contains("target crashed")
        || lower.contains("page crashed")
        || lower.contains("has been closed")
        || lower.contains("target closed")
        || lower.contains("browser has disconnected")
        || lower.contains("browser closed")) {
      return ErrorKind.SESSION_CRASHED;
    }
    if (lower.contains("execution context was destroyed")
        || lower.contains("context destroyed")) {
      return ErrorKind.CONTEXT_DESTROYED;
    }
    if (lower.contains("timeout") && lower.contains("exceeded")) {
      return ErrorKind.NAVIGATION_TIMEOUT;
    }
    return ErrorKind.OTHER;
  }

  public static boolean isRetryable(Throwable error) {
    return classify(error).isRetryable();
  }

  public static String describe(Throwable error) {
    if (error == null) {
      return "unknown_error";
    }
    String message = error.getMessage();
    if (message == null || message.isBlank()) {
      return error.getClass().getSimpleName();
    }
    String firstLine = message.strip().lines().findFirst().orElse(message.strip());
    return firstLine.length() > 500 ? firstLine.substring(0, 500) : firstLine;
  }
}
