package io.github.themoah.edgepulse.filter;

import io.vertx.core.json.JsonObject;
import java.util.Objects;

/**
 * One active facet filter.
 *
 * <p>{@code filterCol}/{@code filterValue} override the displayed column and value for SQL
 * when they differ, e.g. the ASN facet displays {@code "13335 cloudflare"} but filters on
 * the numeric {@code client.asn}.
 *
 * @param col facet column expression
 * @param value displayed value
 * @param exclude true for a negative filter
 * @param filterCol SQL column override, may be null
 * @param filterValue SQL value override ({@link String} or {@link Number}), may be null
 */
public record Filter(
  String col,
  Object value,
  boolean exclude,
  String filterCol,
  Object filterValue
) {

  public Filter {
    Objects.requireNonNull(col, "col cannot be null");
    Objects.requireNonNull(value, "value cannot be null");
  }

  public static Filter include(String col, Object value) {
    return new Filter(col, value, false, null, null);
  }

  public static Filter exclude(String col, Object value) {
    return new Filter(col, value, true, null, null);
  }

  public String sqlColumn() {
    return filterCol == null || filterCol.isEmpty() ? col : filterCol;
  }

  public Object sqlValue() {
    return filterValue != null ? filterValue : value;
  }

  public static Filter fromJson(JsonObject json) {
    return new Filter(
      json.getString("col"),
      json.getValue("value"),
      json.getBoolean("exclude", false),
      json.getString("filterCol"),
      json.getValue("filterValue")
    );
  }
}
