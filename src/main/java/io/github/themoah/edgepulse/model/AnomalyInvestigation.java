package io.github.themoah.edgepulse.model;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Investigation of one detected anomaly: its id, window and top contributing values per facet.
 *
 * @param anomaly the detected anomaly
 * @param anomalyId stable identifier of the anomaly
 * @param window wall-clock window of the anomaly
 * @param facets facet id to contributions, only facets with results
 */
public record AnomalyInvestigation(
  DetectedAnomaly anomaly,
  String anomalyId,
  TimeWindow window,
  Map<String, List<FacetContribution>> facets
) {

  public AnomalyInvestigation {
    facets = Collections.unmodifiableMap(new LinkedHashMap<>(facets));
  }

  public JsonObject toJson() {
    JsonObject facetJson = new JsonObject();
    facets.forEach((facetId, contributions) -> {
      JsonArray items = new JsonArray();
      contributions.forEach(c -> items.add(c.toJson()));
      facetJson.put(facetId, items);
    });
    return new JsonObject()
      .put("anomaly", anomaly.toJson())
      .put("anomalyId", anomalyId)
      .put("start", window.start().toString())
      .put("end", window.end().toString())
      .put("facets", facetJson);
  }

  public static AnomalyInvestigation fromJson(JsonObject json) {
    Map<String, List<FacetContribution>> facets = new LinkedHashMap<>();
    JsonObject facetJson = json.getJsonObject("facets", new JsonObject());
    for (String facetId : facetJson.fieldNames()) {
      List<FacetContribution> contributions = new ArrayList<>();
      JsonArray items = facetJson.getJsonArray(facetId);
      for (int i = 0; i < items.size(); i++) {
        contributions.add(FacetContribution.fromJson(items.getJsonObject(i)));
      }
      facets.put(facetId, contributions);
    }
    return new AnomalyInvestigation(
      DetectedAnomaly.fromJson(json.getJsonObject("anomaly")),
      json.getString("anomalyId"),
      new TimeWindow(Instant.parse(json.getString("start")), Instant.parse(json.getString("end"))),
      facets
    );
  }
}
