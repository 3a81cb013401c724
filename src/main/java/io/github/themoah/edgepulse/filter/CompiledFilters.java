package io.github.themoah.edgepulse.filter;

import io.github.themoah.edgepulse.model.FilterGroup;
import java.util.Map;

/**
 * Result of compiling a filter list.
 *
 * @param sql SQL fragment of {@code AND <clause>} parts, empty when there are no filters
 * @param map the same filters grouped by SQL column, insertion ordered
 */
public record CompiledFilters(String sql, Map<String, FilterGroup> map) {

  public static CompiledFilters empty() {
    return new CompiledFilters("", Map.of());
  }
}
