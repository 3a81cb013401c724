package io.github.themoah.edgepulse.investigation;

import java.util.Objects;

/**
 * A facet (dimension) that investigations break traffic down by.
 *
 * @param id facet id, e.g. "hosts"
 * @param column SQL expression producing the dimension value
 * @param extraFilter additional {@code AND ...} condition, empty if none
 */
public record FacetDefinition(String id, String column, String extraFilter) {

  public FacetDefinition {
    Objects.requireNonNull(id, "id cannot be null");
    Objects.requireNonNull(column, "column cannot be null");
    extraFilter = extraFilter == null ? "" : extraFilter;
  }

  public static FacetDefinition of(String id, String column) {
    return new FacetDefinition(id, column, "");
  }
}
