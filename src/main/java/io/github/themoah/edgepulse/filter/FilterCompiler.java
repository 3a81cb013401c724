package io.github.themoah.edgepulse.filter;

import io.github.themoah.edgepulse.model.FilterGroup;
import java.util.List;
import java.util.Map;

/**
 * Turns active facet filters into SQL and decides whether one filter set contains another.
 */
public interface FilterCompiler {

  CompiledFilters compile(List<Filter> filters);

  /**
   * Returns true if {@code current} constrains at least everything {@code cached} does:
   * every cached column is present and every cached include and exclude value appears in
   * the current column's includes and excludes.
   */
  boolean isSuperset(Map<String, FilterGroup> current, Map<String, FilterGroup> cached);
}
