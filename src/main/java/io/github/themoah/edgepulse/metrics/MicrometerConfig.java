package io.github.themoah.edgepulse.metrics;

import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.micrometer.registry.otlp.AggregationTemporality;
import io.micrometer.registry.otlp.OtlpConfig;
import io.micrometer.registry.otlp.OtlpMeterRegistry;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating Micrometer registries.
 */
public final class MicrometerConfig {

  private static final Logger log = LoggerFactory.getLogger(MicrometerConfig.class);

  private static final String DEFAULT_OTLP_URL = "http://localhost:4318/v1/metrics";
  private static final String DEFAULT_SERVICE_NAME = "edgepulse";

  private MicrometerConfig() {}

  /**
   * Creates a Prometheus meter registry.
   */
  public static PrometheusMeterRegistry createPrometheusRegistry() {
    log.info("Creating Prometheus meter registry");
    return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
  }

  /**
   * Creates an OTLP meter registry configured from environment variables.
   * Reads OTLP_* variables first, then the standard OTEL_* ones.
   *
   * Protocol: HTTP only (port 4318). Temporality: cumulative.
   */
  public static MeterRegistry createOtlpRegistry() {
    log.info("Creating OTLP meter registry");

    OtlpConfig config = new OtlpConfig() {
      @Override
      public String url() {
        String url = firstNonBlank("OTLP_ENDPOINT", "OTEL_EXPORTER_OTLP_METRICS_ENDPOINT");
        if (url == null) {
          String baseEndpoint = System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT");
          if (baseEndpoint != null && !baseEndpoint.isBlank()) {
            url = baseEndpoint.endsWith("/v1/metrics") ? baseEndpoint : baseEndpoint + "/v1/metrics";
          }
        }
        return url != null ? url : DEFAULT_OTLP_URL;
      }

      @Override
      public AggregationTemporality aggregationTemporality() {
        return AggregationTemporality.CUMULATIVE;
      }

      @Override
      public Duration step() {
        String stepMs = firstNonBlank("OTLP_STEP_MS", "OTEL_METRIC_EXPORT_INTERVAL");
        if (stepMs != null) {
          try {
            return Duration.ofMillis(Long.parseLong(stepMs));
          } catch (NumberFormatException e) {
            log.warn("Invalid OTLP export interval: {}, using default 60s", stepMs);
          }
        }
        return Duration.ofSeconds(60);
      }

      @Override
      public Map<String, String> headers() {
        String headers = firstNonBlank("OTLP_HEADERS", "OTEL_EXPORTER_OTLP_METRICS_HEADERS",
          "OTEL_EXPORTER_OTLP_HEADERS");
        return headers == null ? Map.of() : parseKeyValues(headers);
      }

      @Override
      public Map<String, String> resourceAttributes() {
        Map<String, String> attributes = new HashMap<>();
        String serviceName = System.getenv("OTEL_SERVICE_NAME");
        if (serviceName != null && !serviceName.isBlank()) {
          attributes.put("service.name", serviceName);
        }
        String otelAttrs = System.getenv("OTEL_RESOURCE_ATTRIBUTES");
        if (otelAttrs != null && !otelAttrs.isBlank()) {
          attributes.putAll(parseKeyValues(otelAttrs));
        }
        String customAttrs = System.getenv("OTLP_RESOURCE_ATTRIBUTES");
        if (customAttrs != null && !customAttrs.isBlank()) {
          attributes.putAll(parseKeyValues(customAttrs));
        }
        attributes.putIfAbsent("service.name", DEFAULT_SERVICE_NAME);
        return attributes;
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    OtlpMeterRegistry registry = new OtlpMeterRegistry(config, Clock.SYSTEM);
    log.info("OTLP registry created - endpoint: {}, temporality: {}",
             config.url(), config.aggregationTemporality());
    return registry;
  }

  /**
   * Creates a meter registry based on the reporter type.
   *
   * @param reporterType "prometheus" or "otlp"
   * @return the configured MeterRegistry, or null if type is unknown
   */
  public static MeterRegistry createRegistry(String reporterType) {
    if (reporterType == null) {
      return null;
    }

    return switch (reporterType.toLowerCase(Locale.ROOT)) {
      case "prometheus" -> createPrometheusRegistry();
      case "otlp" -> createOtlpRegistry();
      default -> {
        log.warn("Unknown reporter type: {}", reporterType);
        yield null;
      }
    };
  }

  /**
   * Binds JVM metrics (memory, GC, threads, CPU) to the given registry.
   *
   * @param registry the meter registry to bind JVM metrics to
   */
  public static void bindJvmMetrics(MeterRegistry registry) {
    log.info("Binding JVM metrics to registry");
    new JvmMemoryMetrics().bindTo(registry);
    new JvmGcMetrics().bindTo(registry);
    new JvmThreadMetrics().bindTo(registry);
    new ProcessorMetrics().bindTo(registry);
  }

  /**
   * Parses "key1=value1,key2=value2". Malformed pairs are skipped with a warning.
   */
  static Map<String, String> parseKeyValues(String value) {
    Map<String, String> result = new HashMap<>();
    for (String pair : value.split(",")) {
      String[] parts = pair.trim().split("=", 2);
      if (parts.length == 2) {
        result.put(parts[0].trim(), parts[1].trim());
      } else if (!pair.isBlank()) {
        log.warn("Invalid key=value pair: {}", pair);
      }
    }
    return result;
  }

  private static String firstNonBlank(String... envVars) {
    for (String envVar : envVars) {
      String value = System.getenv(envVar);
      if (value != null && !value.isBlank()) {
        return value;
      }
    }
    return null;
  }
}
