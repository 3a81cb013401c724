package io.github.themoah.edgepulse.detection;

/**
 * Per-call tuning of the step detector.
 *
 * @param startMargin leading buckets excluded from baseline, threshold and scanning
 * @param endMargin trailing buckets excluded (ingestion delay of the newest buckets)
 * @param minGap minimum buffer, in buckets, between two selected anomalies
 */
public record DetectionOptions(int startMargin, int endMargin, int minGap) {

  public static final int DEFAULT_MARGIN = 2;
  public static final int DEFAULT_MIN_GAP = 2;

  public DetectionOptions {
    if (startMargin < 0 || endMargin < 0 || minGap < 0) {
      throw new IllegalArgumentException(String.format(
        "Detection options must be non-negative: startMargin=%d, endMargin=%d, minGap=%d",
        startMargin, endMargin, minGap));
    }
  }

  public static DetectionOptions defaults() {
    return new DetectionOptions(DEFAULT_MARGIN, DEFAULT_MARGIN, DEFAULT_MIN_GAP);
  }

  public DetectionOptions withEndMargin(int endMargin) {
    return new DetectionOptions(startMargin, endMargin, minGap);
  }
}
