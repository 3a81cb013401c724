package io.github.themoah.edgepulse.detection;

import io.github.themoah.edgepulse.model.AnomalyRegion;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds maximal runs of buckets whose deviation crosses a threshold in one direction.
 */
public final class RegionFinder {

  private RegionFinder() {}

  /**
   * Scans {@code deviations[startMargin .. length - endMargin)} for contiguous anomalous runs.
   *
   * <p>A run still open at the end of the scan is closed at the last valid index.
   *
   * @param deviations deviation ratios per bucket
   * @param threshold non-negative threshold
   * @param direction ABOVE for spikes, BELOW for dips
   * @param startMargin leading buckets to skip
   * @param endMargin trailing buckets to skip
   * @return regions in index order
   */
  public static List<AnomalyRegion> findRegions(
      double[] deviations,
      double threshold,
      Direction direction,
      int startMargin,
      int endMargin) {

    List<AnomalyRegion> regions = new ArrayList<>();
    int limit = deviations.length - endMargin;

    boolean inRegion = false;
    int regionStart = 0;
    double totalDeviation = 0;
    double peakDeviation = 0;

    for (int i = startMargin; i < limit; i++) {
      double dev = deviations[i];
      boolean anomalous = direction.isAnomalous(dev, threshold);
      double absDev = Math.abs(dev);

      if (anomalous && !inRegion) {
        inRegion = true;
        regionStart = i;
        totalDeviation = absDev;
        peakDeviation = absDev;
      } else if (anomalous) {
        totalDeviation += absDev;
        peakDeviation = Math.max(peakDeviation, absDev);
      } else if (inRegion) {
        regions.add(region(regionStart, i - 1, totalDeviation, peakDeviation));
        inRegion = false;
      }
    }

    if (inRegion) {
      regions.add(region(regionStart, limit - 1, totalDeviation, peakDeviation));
    }

    return regions;
  }

  private static AnomalyRegion region(int start, int end, double totalDeviation, double peakDeviation) {
    int duration = end - start + 1;
    return new AnomalyRegion(start, end, duration, totalDeviation, peakDeviation, totalDeviation / duration);
  }
}
