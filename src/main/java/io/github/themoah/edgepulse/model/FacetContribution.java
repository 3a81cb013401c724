package io.github.themoah.edgepulse.model;

import io.vertx.core.json.JsonObject;

/**
 * How one dimension value behaved inside a window compared with the rest of the range.
 *
 * <p>Rates are requests per minute, shares and the error signals are percentages, and
 * the changes are percentage points, except {@code rateChange} which is a percent change.
 * When the baseline rate is zero but the window rate is not, {@code rateChange} is
 * {@link Double#POSITIVE_INFINITY} and {@link #newDuringWindow()} is true.
 *
 * @param dim the dimension value
 * @param windowRate rate per minute inside the window
 * @param baselineRate rate per minute outside the window
 * @param rateChange percent change of the rate
 * @param windowShare share of the window total
 * @param baselineShare share of the baseline total
 * @param shareChange windowShare - baselineShare
 * @param errorRateChange change of this value's category (or error) rate
 * @param errShareChange change of this value's share of all errors (selection mode only)
 * @param dominantChange the signed signal with the largest magnitude
 * @param maxChange magnitude of the dominant signal, used for ordering
 */
public record FacetContribution(
  String dim,
  double windowRate,
  double baselineRate,
  double rateChange,
  double windowShare,
  double baselineShare,
  double shareChange,
  double errorRateChange,
  double errShareChange,
  double dominantChange,
  double maxChange
) {

  public boolean newDuringWindow() {
    return Double.isInfinite(rateChange);
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("dim", dim)
      .put("windowRate", windowRate)
      .put("baselineRate", baselineRate)
      .put("rateChange", newDuringWindow() ? null : rateChange)
      .put("newDuringWindow", newDuringWindow())
      .put("windowShare", windowShare)
      .put("baselineShare", baselineShare)
      .put("shareChange", shareChange)
      .put("errorRateChange", errorRateChange)
      .put("errShareChange", errShareChange)
      .put("dominantChange", dominantChange)
      .put("maxChange", maxChange);
  }

  public static FacetContribution fromJson(JsonObject json) {
    boolean isNew = json.getBoolean("newDuringWindow", false);
    Double rateChange = json.getDouble("rateChange");
    return new FacetContribution(
      json.getString("dim"),
      json.getDouble("windowRate", 0.0),
      json.getDouble("baselineRate", 0.0),
      isNew ? Double.POSITIVE_INFINITY : (rateChange == null ? 0.0 : rateChange),
      json.getDouble("windowShare", 0.0),
      json.getDouble("baselineShare", 0.0),
      json.getDouble("shareChange", 0.0),
      json.getDouble("errorRateChange", 0.0),
      json.getDouble("errShareChange", 0.0),
      json.getDouble("dominantChange", 0.0),
      json.getDouble("maxChange", 0.0)
    );
  }
}
