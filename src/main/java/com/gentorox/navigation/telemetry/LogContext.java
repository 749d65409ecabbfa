package com.gentorox.navigation.telemetry;

import org.slf4j.MDC;

/**
 * MDC scope putting the id of the running reload into every log line written during it.
 */
public final class LogContext implements AutoCloseable {
  public LogContext(String reloadId) {
    if (reloadId != null) MDC.put(TelemetryConstants.MDC_RELOAD_ID, reloadId);
  }
  @Override public void close() { MDC.remove(TelemetryConstants.MDC_RELOAD_ID); }
}
