package com.gentorox.navigation.telemetry;

/**
 * Centralized telemetry constants for tracer/meter names and attribute keys.
 */
public final class TelemetryConstants {
  private TelemetryConstants() {}

  /** Tracer name used for manual spans. */
  public static final String TRACER = "com.gentorox.navigation";
  /** Meter name used for navigation metrics. */
  public static final String METER  = "com.gentorox.navigation";

  /** MDC key carrying the id of the reload in progress. */
  public static final String MDC_RELOAD_ID = "reloadId";

  public static final String METRIC_RELOADS = "com.gentorox.navigation.reloads.total";
  public static final String METRIC_NODES   = "com.gentorox.navigation.nodes";

  /** Attribute keys used across spans/metrics. */
  public static final String ATTR_RELOAD_ID = "navigation.reload.id";
  public static final String ATTR_OUTCOME   = "navigation.reload.outcome";
  public static final String ATTR_SOURCES   = "navigation.reload.sources";
}
