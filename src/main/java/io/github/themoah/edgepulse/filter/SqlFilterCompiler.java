package io.github.themoah.edgepulse.filter;

import io.github.themoah.edgepulse.model.FilterGroup;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * ClickHouse filter compiler.
 *
 * <p>Filters on the same column are combined: includes are OR-ed, excludes AND-ed, and
 * both parts of one column are AND-ed together. Strings are single-quoted with embedded
 * quotes escaped as {@code \'}; numbers are emitted bare.
 */
public class SqlFilterCompiler implements FilterCompiler {

  @Override
  public CompiledFilters compile(List<Filter> filters) {
    if (filters == null || filters.isEmpty()) {
      return CompiledFilters.empty();
    }

    Map<String, FilterGroup> map = groupByColumn(filters);
    List<String> columnClauses = new ArrayList<>();

    for (FilterGroup group : map.values()) {
      List<String> parts = new ArrayList<>();

      if (!group.includes().isEmpty()) {
        List<String> includeParts = group.includes().stream()
          .map(value -> group.sqlColumn() + " = " + literal(value))
          .collect(Collectors.toList());
        parts.add(includeParts.size() == 1
          ? includeParts.get(0)
          : "(" + String.join(" OR ", includeParts) + ")");
      }

      if (!group.excludes().isEmpty()) {
        parts.add(group.excludes().stream()
          .map(value -> group.sqlColumn() + " != " + literal(value))
          .collect(Collectors.joining(" AND ")));
      }

      if (parts.size() == 1) {
        columnClauses.add(parts.get(0));
      } else if (parts.size() > 1) {
        columnClauses.add("(" + String.join(" AND ", parts) + ")");
      }
    }

    String sql = columnClauses.stream()
      .map(clause -> "AND " + clause)
      .collect(Collectors.joining(" "));
    return new CompiledFilters(sql, Collections.unmodifiableMap(map));
  }

  @Override
  public boolean isSuperset(Map<String, FilterGroup> current, Map<String, FilterGroup> cached) {
    if (cached == null || cached.isEmpty()) {
      return true;
    }
    Map<String, FilterGroup> currentMap = current == null ? Map.of() : current;

    for (Map.Entry<String, FilterGroup> entry : cached.entrySet()) {
      FilterGroup currentGroup = currentMap.get(entry.getKey());
      if (currentGroup == null) {
        return false;
      }
      if (!asStrings(currentGroup.includes()).containsAll(asStrings(entry.getValue().includes()))) {
        return false;
      }
      if (!asStrings(currentGroup.excludes()).containsAll(asStrings(entry.getValue().excludes()))) {
        return false;
      }
    }
    return true;
  }

  static Map<String, FilterGroup> groupByColumn(List<Filter> filters) {
    Map<String, List<Object>> includes = new LinkedHashMap<>();
    Map<String, List<Object>> excludes = new LinkedHashMap<>();

    for (Filter filter : filters) {
      String column = filter.sqlColumn();
      includes.computeIfAbsent(column, c -> new ArrayList<>());
      excludes.computeIfAbsent(column, c -> new ArrayList<>());
      (filter.exclude() ? excludes : includes).get(column).add(filter.sqlValue());
    }

    Map<String, FilterGroup> map = new LinkedHashMap<>();
    includes.forEach((column, values) -> map.put(column, new FilterGroup(column, values, excludes.get(column))));
    return map;
  }

  static String literal(Object value) {
    if (value instanceof Number) {
      return formatNumber((Number) value);
    }
    return "'" + String.valueOf(value).replace("'", "\\'") + "'";
  }

  private static String formatNumber(Number number) {
    double d = number.doubleValue();
    if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
      return Long.toString((long) d);
    }
    return number.toString();
  }

  private static Set<String> asStrings(List<Object> values) {
    Set<String> strings = new HashSet<>();
    for (Object value : values) {
      strings.add(value instanceof Number ? formatNumber((Number) value) : String.valueOf(value));
    }
    return strings;
  }
}
