package io.github.themoah.edgepulse.detection;

/**
 * Which side of the threshold counts as anomalous.
 */
public enum Direction {
  /** deviation &gt; threshold */
  ABOVE,
  /** deviation &lt; -threshold */
  BELOW;

  boolean isAnomalous(double deviation, double threshold) {
    return this == ABOVE ? deviation > threshold : deviation < -threshold;
  }
}
