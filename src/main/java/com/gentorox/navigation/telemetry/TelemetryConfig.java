package com.gentorox.navigation.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenTelemetry configuration.
 *
 * <p>When {@code otel.exporter.otlp.endpoint} is set, traces and metrics are exported over OTLP
 * gRPC to that endpoint. Otherwise a no-op {@link OpenTelemetry} is used so the application runs
 * without a collector.
 */
@Configuration
public class TelemetryConfig {

  @Bean
  @ConditionalOnProperty(name = "otel.exporter.otlp.endpoint")
  public Resource otelResource(@Value("${otel.service.name:navigation}") String serviceName) {
    return Resource.getDefault().merge(Resource.create(
        Attributes.builder()
            .put("service.name", serviceName)
            .put("service.version", System.getenv().getOrDefault("BUILD_VERSION", "dev"))
            .build()));
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(name = "otel.exporter.otlp.endpoint")
  public SdkTracerProvider sdkTracerProvider(
      Resource otelResource,
      @Value("${otel.exporter.otlp.endpoint}") String otlpEndpoint) {

    var spanExporter = OtlpGrpcSpanExporter.builder().setEndpoint(otlpEndpoint).build();
    return SdkTracerProvider.builder()
        .addSpanProcessor(BatchSpanProcessor.builder(spanExporter).build())
        .setResource(otelResource)
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnProperty(name = "otel.exporter.otlp.endpoint")
  public SdkMeterProvider sdkMeterProvider(
      Resource otelResource,
      @Value("${otel.exporter.otlp.endpoint}") String otlpEndpoint) {

    var metricExporter = OtlpGrpcMetricExporter.builder().setEndpoint(otlpEndpoint).build();
    return SdkMeterProvider.builder()
        .setResource(otelResource)
        .registerMetricReader(PeriodicMetricReader.builder(metricExporter).build())
        .build();
  }

  @Bean
  @ConditionalOnProperty(name = "otel.exporter.otlp.endpoint")
  public OpenTelemetry openTelemetry(SdkTracerProvider sdkTracerProvider,
                                     SdkMeterProvider sdkMeterProvider) {
    return OpenTelemetrySdk.builder()
        .setTracerProvider(sdkTracerProvider)
        .setMeterProvider(sdkMeterProvider)
        .build();
  }

  @Bean
  @ConditionalOnMissingBean(OpenTelemetry.class)
  public OpenTelemetry noopOpenTelemetry() {
    return OpenTelemetry.noop();
  }

  @Bean
  public NavigationTelemetry navigationTelemetry(OpenTelemetry openTelemetry) {
    return new NavigationTelemetry(openTelemetry);
  }
}
