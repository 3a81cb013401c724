package io.github.themoah.edgepulse.model;

/**
 * A maximal run of consecutive buckets whose deviation crosses the threshold
 * in one direction.
 *
 * @param start first bucket index (inclusive)
 * @param end last bucket index (inclusive)
 * @param duration number of buckets
 * @param totalDeviation sum of absolute deviations
 * @param peakDeviation largest absolute deviation
 * @param avgDeviation totalDeviation / duration
 */
public record AnomalyRegion(
  int start,
  int end,
  int duration,
  double totalDeviation,
  double peakDeviation,
  double avgDeviation
) {}
