package io.github.themoah.edgepulse.detection;

import java.util.Arrays;

/**
 * Statistical helpers for baseline and threshold computation.
 *
 * <p>All range arguments are half-open: {@code [from, to)}.
 */
public final class StatisticalUtils {

  private StatisticalUtils() {}

  /**
   * Calculates the median of {@code values[from..to)}.
   *
   * @return the median, or 0 for an empty range
   */
  public static double median(double[] values, int from, int to) {
    if (to <= from) {
      return 0.0;
    }
    double[] sorted = Arrays.copyOfRange(values, from, to);
    Arrays.sort(sorted);
    int mid = sorted.length / 2;
    return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
  }

  /**
   * Calculates the population standard deviation (divide by n) of {@code values[from..to)}.
   * The valid range is the whole population we look at, not a sample of it.
   *
   * @return the standard deviation, or 0 for an empty range
   */
  public static double stdDev(double[] values, int from, int to) {
    int n = to - from;
    if (n <= 0) {
      return 0.0;
    }
    double sum = 0.0;
    for (int i = from; i < to; i++) {
      sum += values[i];
    }
    double mean = sum / n;

    double sumSquaredDiffs = 0.0;
    for (int i = from; i < to; i++) {
      double diff = values[i] - mean;
      sumSquaredDiffs += diff * diff;
    }
    return Math.sqrt(sumSquaredDiffs / n);
  }

  /**
   * Converts values to deviation ratios {@code (v - baseline) / baseline}.
   * A non-positive baseline yields all zeros, so an all-zero category never deviates.
   */
  public static double[] deviationRatios(double[] values, double baseline) {
    double[] deviations = new double[values.length];
    if (baseline <= 0) {
      return deviations;
    }
    for (int i = 0; i < values.length; i++) {
      deviations[i] = (values[i] - baseline) / baseline;
    }
    return deviations;
  }

  /**
   * Rounds half-up to one decimal place. Non-finite values are returned unchanged.
   */
  public static double roundOneDecimal(double value) {
    if (!Double.isFinite(value)) {
      return value;
    }
    return Math.round(value * 10) / 10.0;
  }
}
