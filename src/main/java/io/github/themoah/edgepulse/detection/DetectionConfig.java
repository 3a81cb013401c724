package io.github.themoah.edgepulse.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for step detection.
 *
 * @param maxCount maximum anomalies returned by multi-anomaly detection (default 5)
 * @param options default margins and gap applied when a caller passes none
 */
public record DetectionConfig(int maxCount, DetectionOptions options) {

  private static final Logger log = LoggerFactory.getLogger(DetectionConfig.class);

  private static final int DEFAULT_MAX_COUNT = 5;

  public static DetectionConfig defaults() {
    return new DetectionConfig(DEFAULT_MAX_COUNT, DetectionOptions.defaults());
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>DETECTION_MAX_COUNT - Maximum anomalies per chart (default: 5)</li>
   *   <li>DETECTION_START_MARGIN - Leading buckets to ignore (default: 2)</li>
   *   <li>DETECTION_END_MARGIN - Trailing buckets to ignore (default: 2)</li>
   *   <li>DETECTION_MIN_GAP - Minimum bucket gap between anomalies (default: 2)</li>
   * </ul>
   */
  public static DetectionConfig fromEnvironment() {
    int maxCount = parseInt("DETECTION_MAX_COUNT", DEFAULT_MAX_COUNT);
    int startMargin = parseInt("DETECTION_START_MARGIN", DetectionOptions.DEFAULT_MARGIN);
    int endMargin = parseInt("DETECTION_END_MARGIN", DetectionOptions.DEFAULT_MARGIN);
    int minGap = parseInt("DETECTION_MIN_GAP", DetectionOptions.DEFAULT_MIN_GAP);

    DetectionConfig config = new DetectionConfig(maxCount, new DetectionOptions(startMargin, endMargin, minGap));
    log.info("Detection config: maxCount={}, startMargin={}, endMargin={}, minGap={}",
      maxCount, startMargin, endMargin, minGap);

    return config;
  }

  private static int parseInt(String envVar, int defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }
}
