package io.github.themoah.edgepulse.model;

/**
 * A scored region competing for a slot in the detection result.
 */
public record AnomalyCandidate(
  AnomalyRegion region,
  TrafficCategory category,
  AnomalyType type,
  double score
) {

  public int start() {
    return region.start();
  }

  public int end() {
    return region.end();
  }
}
