package io.github.themoah.edgepulse.config;

import io.github.themoah.edgepulse.cache.CacheConfig;
import io.github.themoah.edgepulse.detection.DetectionConfig;
import io.github.themoah.edgepulse.metrics.MetricsConfig;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings of one edgepulse instance: the HTTP server itself plus the detection, cache
 * and metrics sections, each loaded from its own environment variables.
 *
 * <p>Server environment variables:
 * <ul>
 *   <li>EDGEPULSE_HTTP_PORT - HTTP port, 0 picks a free one (default: 8888)</li>
 *   <li>EDGEPULSE_MAX_BODY_BYTES - Largest accepted request body (default: 1048576)</li>
 *   <li>EDGEPULSE_METRICS_PATH - Prometheus scrape path (default: /metrics)</li>
 *   <li>CLICKHOUSE_HEALTH_CHECK_INTERVAL_MS - ClickHouse ping interval (default: 30000)</li>
 * </ul>
 *
 * @param httpPort HTTP server port
 * @param maxBodyBytes body limit of the /api routes
 * @param metricsPath route of the Prometheus scrape endpoint
 * @param healthCheckIntervalMs ClickHouse health check interval in milliseconds
 * @param detection step detection defaults
 * @param cache investigation cache settings
 * @param metrics metrics reporter settings
 */
public record AppConfig(
  int httpPort,
  long maxBodyBytes,
  String metricsPath,
  long healthCheckIntervalMs,
  DetectionConfig detection,
  CacheConfig cache,
  MetricsConfig metrics
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  static final int DEFAULT_HTTP_PORT = 8888;
  static final long DEFAULT_MAX_BODY_BYTES = 1024 * 1024;
  static final String DEFAULT_METRICS_PATH = "/metrics";
  static final long DEFAULT_HEALTH_CHECK_INTERVAL_MS = 30_000L;

  public static AppConfig fromEnvironment() {
    return fromEnvironment(System.getenv(),
      DetectionConfig.fromEnvironment(), CacheConfig.fromEnvironment(), MetricsConfig.fromEnvironment());
  }

  static AppConfig fromEnvironment(
      Map<String, String> env, DetectionConfig detection, CacheConfig cache, MetricsConfig metrics) {
    int port = getInt(env, "EDGEPULSE_HTTP_PORT", DEFAULT_HTTP_PORT);
    if (port < 0 || port > 65535) {
      log.warn("EDGEPULSE_HTTP_PORT out of range: {}, using default: {}", port, DEFAULT_HTTP_PORT);
      port = DEFAULT_HTTP_PORT;
    }
    long maxBody = getLong(env, "EDGEPULSE_MAX_BODY_BYTES", DEFAULT_MAX_BODY_BYTES);
    if (maxBody <= 0) {
      log.warn("EDGEPULSE_MAX_BODY_BYTES must be positive: {}, using default: {}", maxBody, DEFAULT_MAX_BODY_BYTES);
      maxBody = DEFAULT_MAX_BODY_BYTES;
    }
    String metricsPath = normalizePath(env.get("EDGEPULSE_METRICS_PATH"));
    long interval = getLong(env, "CLICKHOUSE_HEALTH_CHECK_INTERVAL_MS", DEFAULT_HEALTH_CHECK_INTERVAL_MS);

    log.info("AppConfig loaded: httpPort={}, maxBodyBytes={}, metricsPath={}, healthCheckIntervalMs={}",
      port, maxBody, metricsPath, interval);
    return new AppConfig(port, maxBody, metricsPath, interval, detection, cache, metrics);
  }

  private static String normalizePath(String value) {
    if (value == null || value.isBlank()) {
      return DEFAULT_METRICS_PATH;
    }
    String path = value.trim();
    return path.startsWith("/") ? path : "/" + path;
  }

  private static int getInt(Map<String, String> env, String name, int defaultValue) {
    String value = env.get(name);
    if (value != null && !value.isBlank()) {
      try {
        return Integer.parseInt(value.trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  private static long getLong(Map<String, String> env, String name, long defaultValue) {
    String value = env.get(name);
    if (value != null && !value.isBlank()) {
      try {
        return Long.parseLong(value.trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid long for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }
}
