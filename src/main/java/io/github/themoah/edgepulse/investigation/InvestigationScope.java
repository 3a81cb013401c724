package io.github.themoah.edgepulse.investigation;

import io.github.themoah.edgepulse.filter.CompiledFilters;
import io.github.themoah.edgepulse.filter.Filter;
import io.github.themoah.edgepulse.filter.FilterCompiler;
import io.github.themoah.edgepulse.model.QueryContext;
import java.util.List;

/**
 * The scope an investigation runs under: the context snapshot used for caching and the
 * compiled facet filter SQL applied to every facet query.
 *
 * @param context time filter, host filter and structured filters
 * @param filterSql compiled facet filters ({@code AND ...} clauses), empty if none
 */
public record InvestigationScope(QueryContext context, String filterSql) {

  public InvestigationScope {
    filterSql = filterSql == null ? "" : filterSql;
  }

  public static InvestigationScope of(
      String timeFilter, String hostFilter, List<Filter> filters, FilterCompiler compiler) {
    CompiledFilters compiled = compiler.compile(filters);
    return new InvestigationScope(new QueryContext(timeFilter, hostFilter, compiled.map()), compiled.sql());
  }
}
