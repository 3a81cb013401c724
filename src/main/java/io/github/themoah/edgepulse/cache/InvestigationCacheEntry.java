package io.github.themoah.edgepulse.cache;

import io.github.themoah.edgepulse.model.AnomalyInvestigation;
import io.github.themoah.edgepulse.model.Contributor;
import io.github.themoah.edgepulse.model.QueryContext;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;

/**
 * Stored investigation.
 *
 * @param investigations per-anomaly results
 * @param topContributors best contributors across all anomalies, sorted by share change
 * @param context scope the investigation ran under, null for entries written before
 *                contexts were recorded
 * @param version format version
 * @param timestamp write time in epoch millis
 */
public record InvestigationCacheEntry(
  List<AnomalyInvestigation> investigations,
  List<Contributor> topContributors,
  QueryContext context,
  int version,
  long timestamp
) {

  public InvestigationCacheEntry {
    investigations = List.copyOf(investigations);
    topContributors = List.copyOf(topContributors);
  }

  public boolean isLegacy() {
    return context == null;
  }

  public JsonObject toJson() {
    JsonArray results = new JsonArray();
    investigations.forEach(i -> results.add(i.toJson()));
    JsonArray top = new JsonArray();
    topContributors.forEach(c -> top.add(c.toJson()));

    JsonObject json = new JsonObject()
      .put("results", results)
      .put("topContributors", top)
      .put("version", version)
      .put("timestamp", timestamp);
    if (context != null) {
      json.put("context", context.toJson());
    }
    return json;
  }

  /**
   * Parses a stored entry.
   *
   * @throws io.vertx.core.json.DecodeException if the text is not valid JSON
   * @throws RuntimeException if fields are missing or have unexpected types or formats
   */
  public static InvestigationCacheEntry fromJson(String encoded) {
    JsonObject json = new JsonObject(encoded);

    List<AnomalyInvestigation> investigations = new ArrayList<>();
    JsonArray results = json.getJsonArray("results", new JsonArray());
    for (int i = 0; i < results.size(); i++) {
      investigations.add(AnomalyInvestigation.fromJson(results.getJsonObject(i)));
    }

    List<Contributor> top = new ArrayList<>();
    JsonArray contributors = json.getJsonArray("topContributors", new JsonArray());
    for (int i = 0; i < contributors.size(); i++) {
      top.add(Contributor.fromJson(contributors.getJsonObject(i)));
    }

    JsonObject context = json.getJsonObject("context");
    return new InvestigationCacheEntry(
      investigations,
      top,
      context == null ? null : QueryContext.fromJson(context),
      json.getInteger("version", 0),
      json.getLong("timestamp", 0L)
    );
  }
}
