package com.gentorox.navigation.exception;

import java.time.Instant;
import java.util.Map;

/** Structured error information for logs and HTTP responses. */
public record ErrorDetails(
    String type,
    String message,
    NavigationErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. A {@link NavigationException} keeps its
   * code and context; anything else is reported as {@link NavigationErrorCode#UNKNOWN}.
   */
  public static ErrorDetails of(Throwable t) {
    String message = t.getMessage() == null ? "" : t.getMessage();
    if (t instanceof NavigationException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(), message, ex.getCode(), ex.getContext(), Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(), message, NavigationErrorCode.UNKNOWN, Map.of(), Instant.now());
  }
}
