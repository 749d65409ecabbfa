package com.gentorox.navigation.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Failure while building or serving the navigation structure. The {@link NavigationErrorCode}
 * classifies it for callers and HTTP responses; the context names what was being processed
 * (source, command, id) and is fixed at construction.
 */
public class NavigationException extends RuntimeException {
  private final NavigationErrorCode code;
  private final Map<String, Object> context;

  public NavigationException(NavigationErrorCode code, String message, Map<String, ?> context) {
    this(code, message, context, null);
  }

  public NavigationException(NavigationErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.context = context == null || context.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  public NavigationErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return context;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName())
        .append('[').append(code).append("] ").append(getMessage());
    if (!context.isEmpty()) {
      sb.append(' ').append(context);
    }
    return sb.toString();
  }
}
