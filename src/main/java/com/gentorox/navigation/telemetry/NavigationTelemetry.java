package com.gentorox.navigation.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import static com.gentorox.navigation.telemetry.TelemetryConstants.*;

/**
 * Spans and metrics for navigation reloads: one span per reload, a counter of reloads by outcome
 * and a gauge with the number of published nodes.
 */
public class NavigationTelemetry {
  public static final String OUTCOME_SUCCESS = "success";
  public static final String OUTCOME_FAILURE = "failure";

  private final Tracer tracer;
  private final LongCounter reloadsTotal;
  private final AtomicLong publishedNodes = new AtomicLong();

  public NavigationTelemetry(OpenTelemetry openTelemetry) {
    Objects.requireNonNull(openTelemetry, "openTelemetry");
    this.tracer = openTelemetry.getTracer(TRACER);
    Meter meter = openTelemetry.meterBuilder(METER).build();
    this.reloadsTotal = meter
        .counterBuilder(METRIC_RELOADS)
        .setDescription("Navigation reloads by outcome")
        .build();
    meter.gaugeBuilder(METRIC_NODES)
        .ofLongs()
        .setDescription("Scopes and nodes in the published navigation structure")
        .buildWithCallback(m -> m.record(publishedNodes.get()));
  }

  public static NavigationTelemetry noop() {
    return new NavigationTelemetry(OpenTelemetry.noop());
  }

  /** Runs a reload inside a span, recording the failure on the span before rethrowing. */
  public <T> T inReloadSpan(String reloadId, Supplier<T> body) {
    Objects.requireNonNull(body, "body");
    Span span = tracer.spanBuilder("navigation.reload")
        .setSpanKind(SpanKind.INTERNAL)
        .setAttribute(ATTR_RELOAD_ID, reloadId)
        .startSpan();
    try (Scope ignored = span.makeCurrent()) {
      return body.get();
    } catch (RuntimeException e) {
      span.recordException(e);
      span.setStatus(StatusCode.ERROR);
      throw e;
    } finally {
      span.end();
    }
  }

  public void reloadSucceeded(int sources, int nodes) {
    publishedNodes.set(nodes);
    reloadsTotal.add(1, Attributes.of(
        AttributeKey.stringKey(ATTR_OUTCOME), OUTCOME_SUCCESS,
        AttributeKey.longKey(ATTR_SOURCES), (long) sources));
  }

  public void reloadFailed() {
    reloadsTotal.add(1, Attributes.of(AttributeKey.stringKey(ATTR_OUTCOME), OUTCOME_FAILURE));
  }
}
