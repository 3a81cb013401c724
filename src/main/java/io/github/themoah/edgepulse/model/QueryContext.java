package io.github.themoah.edgepulse.model;

import io.vertx.core.json.JsonObject;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of the scope a time series or investigation was computed under.
 *
 * <p>A snapshot is captured when an investigation is cached and compared
 * structurally against a freshly built snapshot when the cache is read.
 *
 * @param timeFilter the SQL time filter of the loaded window
 * @param hostFilter the SQL host filter (empty when unscoped)
 * @param filterMap compiled facet filters keyed by SQL column
 */
public record QueryContext(
  String timeFilter,
  String hostFilter,
  Map<String, FilterGroup> filterMap
) {

  public QueryContext {
    timeFilter = timeFilter == null ? "" : timeFilter;
    hostFilter = hostFilter == null ? "" : hostFilter;
    filterMap = filterMap == null ? Map.of() : Map.copyOf(filterMap);
  }

  public static QueryContext of(String timeFilter, String hostFilter) {
    return new QueryContext(timeFilter, hostFilter, Map.of());
  }

  public int filterCount() {
    return filterMap.size();
  }

  public JsonObject toJson() {
    JsonObject filters = new JsonObject();
    filterMap.forEach((column, group) -> filters.put(column, group.toJson()));
    return new JsonObject()
      .put("timeFilter", timeFilter)
      .put("hostFilter", hostFilter)
      .put("filterMap", filters);
  }

  public static QueryContext fromJson(JsonObject json) {
    Map<String, FilterGroup> filterMap = new LinkedHashMap<>();
    JsonObject filters = json.getJsonObject("filterMap", new JsonObject());
    for (String column : filters.fieldNames()) {
      filterMap.put(column, FilterGroup.fromJson(filters.getJsonObject(column)));
    }
    return new QueryContext(json.getString("timeFilter"), json.getString("hostFilter"), filterMap);
  }
}
