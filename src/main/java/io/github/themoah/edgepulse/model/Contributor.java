package io.github.themoah.edgepulse.model;

import io.vertx.core.json.JsonObject;

/**
 * A facet contribution attributed to the anomaly it explains.
 *
 * @param anomalyId id of the anomaly, null for selections
 * @param facetId facet the dimension value belongs to
 * @param category category of the anomaly
 * @param rank rank of the anomaly, 0 for selections
 * @param contribution the per-value analysis
 */
public record Contributor(
  String anomalyId,
  String facetId,
  TrafficCategory category,
  int rank,
  FacetContribution contribution
) {

  public String dim() {
    return contribution.dim();
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("anomalyId", anomalyId)
      .put("facetId", facetId)
      .put("category", category.getValue())
      .put("rank", rank)
      .put("contribution", contribution.toJson());
  }

  public static Contributor fromJson(JsonObject json) {
    return new Contributor(
      json.getString("anomalyId"),
      json.getString("facetId"),
      TrafficCategory.fromValue(json.getString("category")),
      json.getInteger("rank", 0),
      FacetContribution.fromJson(json.getJsonObject("contribution"))
    );
  }
}
