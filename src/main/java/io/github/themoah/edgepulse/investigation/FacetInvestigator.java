package io.github.themoah.edgepulse.investigation;

import io.github.themoah.edgepulse.metrics.InvestigationMetrics;
import io.github.themoah.edgepulse.model.FacetContribution;
import io.github.themoah.edgepulse.model.TimeWindow;
import io.github.themoah.edgepulse.model.TrafficCategory;
import io.github.themoah.edgepulse.query.ClickHouseConfig;
import io.github.themoah.edgepulse.query.QueryCancelledException;
import io.github.themoah.edgepulse.query.QueryExecutor;
import io.github.themoah.edgepulse.query.QueryOptions;
import io.github.themoah.edgepulse.query.SqlTemplates;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares one facet's dimension values inside a window with the rest of the range.
 *
 * <p>Every call issues a single aggregation query. A failed query only empties that
 * facet's result: the returned Future always succeeds, so concurrent facets never
 * affect each other.
 */
public class FacetInvestigator {

  private static final Logger log = LoggerFactory.getLogger(FacetInvestigator.class);

  static final String MODE_ANOMALY = "anomaly";
  static final String MODE_SELECTION = "selection";

  private static final String ANOMALY_TEMPLATE = "investigate-facet";
  private static final String SELECTION_TEMPLATE = "investigate-selection";

  private final QueryExecutor executor;
  private final SqlTemplates templates;
  private final ClickHouseConfig config;
  private final InvestigationMetrics metrics;

  public FacetInvestigator(
      QueryExecutor executor,
      SqlTemplates templates,
      ClickHouseConfig config,
      InvestigationMetrics metrics) {
    this.executor = executor;
    this.templates = templates;
    this.config = config;
    this.metrics = metrics;
  }

  /**
   * Finds the values of {@code facet} over-represented in an anomaly's category.
   *
   * @param facet the facet to break down
   * @param category category of the anomaly, selects the counted status class
   * @param window the anomaly window
   * @param fullRange the analysed range, the baseline is everything outside the window
   * @param scope host and facet filters
   * @param options cancellation and cache options
   * @return at most 5 contributions, empty on failure or cancellation
   */
  public Future<List<FacetContribution>> investigateAnomaly(
      FacetDefinition facet,
      TrafficCategory category,
      TimeWindow window,
      TimeWindow fullRange,
      InvestigationScope scope,
      QueryOptions options) {

    return run(facet, MODE_ANOMALY,
      () -> anomalySql(facet, category, window, fullRange, scope),
      rows -> ContributionAnalyzer.analyzeAnomaly(rows, window, fullRange),
      options);
  }

  /**
   * Finds the values of {@code facet} whose traffic or error behavior changed during an
   * operator selection, in either direction.
   *
   * @return at most 5 contributions, empty on failure or cancellation
   */
  public Future<List<FacetContribution>> investigateSelection(
      FacetDefinition facet,
      TimeWindow selection,
      TimeWindow fullRange,
      InvestigationScope scope,
      QueryOptions options) {

    return run(facet, MODE_SELECTION,
      () -> selectionSql(facet, selection, fullRange, scope),
      rows -> ContributionAnalyzer.analyzeSelection(rows, selection, fullRange),
      options);
  }

  String anomalySql(
      FacetDefinition facet,
      TrafficCategory category,
      TimeWindow window,
      TimeWindow fullRange,
      InvestigationScope scope) {

    Map<String, String> params = baseParams(facet, fullRange, scope);
    params.put("anomalyMinuteFilter", FacetQueries.minuteFilter(window));
    params.put("catCountExpr", FacetQueries.categoryCountColumn(category));
    return templates.render(ANOMALY_TEMPLATE, params);
  }

  String selectionSql(FacetDefinition facet, TimeWindow selection, TimeWindow fullRange, InvestigationScope scope) {
    Map<String, String> params = baseParams(facet, fullRange, scope);
    params.put("selectionMinuteFilter", FacetQueries.minuteFilter(selection));
    return templates.render(SELECTION_TEMPLATE, params);
  }

  private Map<String, String> baseParams(FacetDefinition facet, TimeWindow fullRange, InvestigationScope scope) {
    Map<String, String> params = new HashMap<>();
    params.put("col", facet.column());
    params.put("database", config.getDatabase());
    params.put("table", config.getTable());
    String scopeTimeFilter = scope.context().timeFilter();
    params.put("timeFilter", scopeTimeFilter.isEmpty() ? FacetQueries.timeFilter(fullRange) : scopeTimeFilter);
    params.put("hostFilter", scope.context().hostFilter());
    params.put("facetFilters", scope.filterSql());
    params.put("extra", facet.extraFilter());
    return params;
  }

  private Future<List<FacetContribution>> run(
      FacetDefinition facet,
      String mode,
      SqlSupplier sql,
      Function<List<JsonObject>, List<FacetContribution>> analyzer,
      QueryOptions options) {

    long startNanos = System.nanoTime();
    Future<List<JsonObject>> rows;
    try {
      rows = executor.runAggregation(sql.get(), options);
    } catch (RuntimeException e) {
      rows = Future.failedFuture(e);
    }

    return rows
      .map(analyzer)
      .map(results -> {
        metrics.recordFacetQuery(facet.id(), mode, "success", elapsedSince(startNanos));
        log.debug("Facet {} ({}): {} contributions", facet.id(), mode, results.size());
        return results;
      })
      .recover(err -> {
        if (err instanceof QueryCancelledException) {
          metrics.recordFacetQuery(facet.id(), mode, "cancelled", elapsedSince(startNanos));
          log.debug("Facet {} ({}) cancelled", facet.id(), mode);
        } else {
          metrics.recordFacetQuery(facet.id(), mode, "failure", elapsedSince(startNanos));
          log.error("Investigation error for facet {} ({}): {}", facet.id(), mode, err.getMessage());
        }
        return Future.succeededFuture(List.of());
      });
  }

  private static Duration elapsedSince(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }

  @FunctionalInterface
  private interface SqlSupplier {
    String get();
  }
}
