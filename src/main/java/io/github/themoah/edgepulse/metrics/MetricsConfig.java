package io.github.themoah.edgepulse.metrics;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics reporting configuration.
 *
 * @param reporterType "prometheus", "otlp" or "none"
 * @param jvmMetricsEnabled bind JVM memory, GC, thread and CPU metrics
 */
public record MetricsConfig(
  String reporterType,
  boolean jvmMetricsEnabled
) {

  private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

  private static final String DEFAULT_REPORTER = "prometheus";
  private static final String DISABLED = "none";

  public boolean isEnabled() {
    return reporterType != null && !DISABLED.equals(reporterType);
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>METRICS_REPORTER - prometheus, otlp or none (default: prometheus)</li>
   *   <li>METRICS_JVM_ENABLED - Bind JVM metrics (default: false)</li>
   * </ul>
   */
  public static MetricsConfig fromEnvironment() {
    String reporter = System.getenv().getOrDefault("METRICS_REPORTER", DEFAULT_REPORTER);
    reporter = reporter.isBlank() ? DEFAULT_REPORTER : reporter.trim().toLowerCase(Locale.ROOT);
    boolean jvm = "true".equalsIgnoreCase(System.getenv("METRICS_JVM_ENABLED"));

    log.info("Metrics config: reporter={}, jvmMetrics={}", reporter, jvm);
    return new MetricsConfig(reporter, jvm);
  }
}
