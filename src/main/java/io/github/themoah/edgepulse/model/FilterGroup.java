package io.github.themoah.edgepulse.model;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;

/**
 * Active filter values for one SQL column.
 *
 * <p>Values are either {@link String} or {@link Number}; superset checks compare
 * their string forms.
 *
 * @param sqlColumn the SQL column expression the values apply to
 * @param includes values the column must equal (OR-ed)
 * @param excludes values the column must not equal (AND-ed)
 */
public record FilterGroup(
  String sqlColumn,
  List<Object> includes,
  List<Object> excludes
) {

  public FilterGroup {
    includes = List.copyOf(includes);
    excludes = List.copyOf(excludes);
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("sqlCol", sqlColumn)
      .put("includes", new JsonArray(new ArrayList<>(includes)))
      .put("excludes", new JsonArray(new ArrayList<>(excludes)));
  }

  public static FilterGroup fromJson(JsonObject json) {
    JsonArray includes = json.getJsonArray("includes", new JsonArray());
    JsonArray excludes = json.getJsonArray("excludes", new JsonArray());
    return new FilterGroup(json.getString("sqlCol"), includes.getList(), excludes.getList());
  }
}
