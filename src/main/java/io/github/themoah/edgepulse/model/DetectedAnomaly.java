package io.github.themoah.edgepulse.model;

import io.vertx.core.json.JsonObject;
import java.util.Locale;

/**
 * An anomaly returned to the caller.
 *
 * @param startIndex first bucket index (inclusive)
 * @param endIndex last bucket index (inclusive)
 * @param type spike or dip
 * @param magnitude peak deviation ratio from baseline
 * @param category traffic category
 * @param duration number of buckets
 * @param score significance score used for ranking
 * @param rank 1-based rank, 1 = most significant
 */
public record DetectedAnomaly(
  int startIndex,
  int endIndex,
  AnomalyType type,
  double magnitude,
  TrafficCategory category,
  int duration,
  double score,
  int rank
) {

  /**
   * Creates the public anomaly for a selected candidate.
   *
   * @param candidate the winning candidate
   * @param rank 1-based rank
   * @return detected anomaly
   */
  public static DetectedAnomaly of(AnomalyCandidate candidate, int rank) {
    AnomalyRegion region = candidate.region();
    return new DetectedAnomaly(
      region.start(),
      region.end(),
      candidate.type(),
      region.peakDeviation(),
      candidate.category(),
      region.duration(),
      candidate.score(),
      rank
    );
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("startIndex", startIndex)
      .put("endIndex", endIndex)
      .put("type", type.getValue())
      .put("magnitude", magnitude)
      .put("category", category.getValue())
      .put("duration", duration)
      .put("score", score)
      .put("rank", rank);
  }

  public static DetectedAnomaly fromJson(JsonObject json) {
    return new DetectedAnomaly(
      json.getInteger("startIndex"),
      json.getInteger("endIndex"),
      AnomalyType.valueOf(json.getString("type").toUpperCase(Locale.ROOT)),
      json.getDouble("magnitude", 0.0),
      TrafficCategory.fromValue(json.getString("category")),
      json.getInteger("duration", 0),
      json.getDouble("score", 0.0),
      json.getInteger("rank", 0)
    );
  }
}
