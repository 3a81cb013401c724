package io.github.themoah.edgepulse.investigation;

import io.github.themoah.edgepulse.cache.InvestigationCache;
import io.github.themoah.edgepulse.cache.InvestigationCacheEntry;
import io.github.themoah.edgepulse.identity.AnomalyIdGenerator;
import io.github.themoah.edgepulse.metrics.InvestigationMetrics;
import io.github.themoah.edgepulse.model.AnomalyInvestigation;
import io.github.themoah.edgepulse.model.Contributor;
import io.github.themoah.edgepulse.model.DetectedAnomaly;
import io.github.themoah.edgepulse.model.FacetContribution;
import io.github.themoah.edgepulse.model.InvestigationReport;
import io.github.themoah.edgepulse.model.InvestigationReport.Status;
import io.github.themoah.edgepulse.model.QueryContext;
import io.github.themoah.edgepulse.model.TimeWindow;
import io.github.themoah.edgepulse.model.TrafficCategory;
import io.github.themoah.edgepulse.query.QueryOptions;
import io.vertx.core.CompositeFuture;
import io.vertx.core.Future;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Investigates detected anomalies and operator selections across all facets.
 *
 * <p>Anomaly investigations are served from the session memory first, then from the
 * persistent cache, and only then computed. A run that is superseded while its queries
 * are in flight, by a newer run or by a cache hit, is discarded.
 */
public class AnomalyInvestigationService {

  private static final Logger log = LoggerFactory.getLogger(AnomalyInvestigationService.class);

  private static final Duration DEFAULT_STEP = Duration.ofMinutes(1);

  private static final Comparator<Contributor> BY_SHARE_CHANGE =
    Comparator.comparingDouble((Contributor c) -> c.contribution().shareChange()).reversed();
  private static final Comparator<Contributor> BY_MAX_CHANGE =
    Comparator.comparingDouble((Contributor c) -> c.contribution().maxChange()).reversed();

  private final FacetInvestigator investigator;
  private final InvestigationCache cache;
  private final InvestigationMetrics metrics;
  private final List<FacetDefinition> facets;

  public AnomalyInvestigationService(
      FacetInvestigator investigator, InvestigationCache cache, InvestigationMetrics metrics) {
    this(investigator, cache, metrics, FacetCatalog.INVESTIGATED);
  }

  public AnomalyInvestigationService(
      FacetInvestigator investigator,
      InvestigationCache cache,
      InvestigationMetrics metrics,
      List<FacetDefinition> facets) {
    this.investigator = investigator;
    this.cache = cache;
    this.metrics = metrics;
    this.facets = List.copyOf(facets);
  }

  /**
   * Investigates every anomaly of a chart.
   *
   * @param session the operator session
   * @param scope query scope of the chart
   * @param anomalies ranked anomalies, bucket-indexed
   * @param timeline start instant of every bucket, ascending
   * @return the report, never a failed future
   */
  public Future<InvestigationReport> investigateAnomalies(
      InvestigationSession session,
      InvestigationScope scope,
      List<DetectedAnomaly> anomalies,
      List<Instant> timeline) {

    if (anomalies.isEmpty() || timeline.isEmpty()) {
      return complete(InvestigationReport.empty());
    }

    QueryContext context = scope.context();
    String cacheKey = InvestigationCache.cacheKey(context);

    Optional<InvestigationSession.MemoryEntry> memory = session.memory(cacheKey)
      .filter(entry -> cache.isCacheEligible(context, entry.context()))
      .filter(entry -> hasSufficientCoverage(entry.topContributors()));
    metrics.recordCacheLookup("memory", memory.isPresent());
    if (memory.isPresent()) {
      session.anomalyRuns().cancel();
      log.info("Using in-memory investigation ({} contributors)", memory.get().topContributors().size());
      return complete(new InvestigationReport(
        Status.CACHED, memory.get().investigations(), memory.get().topContributors()));
    }

    if (!session.isForceRefresh()) {
      Optional<InvestigationCacheEntry> cached = cache.load(context)
        .filter(entry -> hasSufficientCoverage(entry.topContributors()));
      metrics.recordCacheLookup("store", cached.isPresent());
      if (cached.isPresent()) {
        InvestigationCacheEntry entry = cached.get();
        session.anomalyRuns().cancel();
        log.info("Using cached investigation ({} contributors)", entry.topContributors().size());
        session.remember(cacheKey, context, entry.investigations(), entry.topContributors());
        return complete(new InvestigationReport(Status.CACHED, entry.investigations(), entry.topContributors()));
      }
    }

    RunTracker.Run run = session.anomalyRuns().begin();
    QueryOptions options = new QueryOptions(run.token(), session.isForceRefresh());
    TimeWindow fullRange = fullRange(timeline);
    log.info("Investigating {} anomalies across {} facets", anomalies.size(), facets.size());

    List<AnomalyInvestigation> investigations = new ArrayList<>();
    Future<Boolean> chain = Future.succeededFuture(true);
    for (DetectedAnomaly anomaly : anomalies) {
      chain = chain.compose(current -> {
        if (!current || !session.anomalyRuns().isCurrent(run)) {
          return Future.succeededFuture(false);
        }
        return investigateOne(anomaly, scope, timeline, fullRange, options)
          .map(investigation -> {
            investigations.add(investigation);
            return true;
          });
      });
    }

    return chain.map(current -> {
      if (!current || !session.anomalyRuns().isCurrent(run)) {
        log.info("Investigation run {} superseded, discarding results", run.generation());
        return record(InvestigationReport.superseded());
      }

      List<Contributor> all = new ArrayList<>();
      for (AnomalyInvestigation investigation : investigations) {
        investigation.facets().forEach((facetId, contributions) -> contributions.forEach(c ->
          all.add(new Contributor(
            investigation.anomalyId(), facetId, investigation.anomaly().category(),
            investigation.anomaly().rank(), c))));
      }
      all.sort(BY_SHARE_CHANGE);
      List<Contributor> top = List.copyOf(all.subList(0, Math.min(InvestigationCache.CACHE_TOP_N, all.size())));

      cache.save(context, investigations, top);
      cache.cleanupOldEntries();
      session.remember(cacheKey, context, investigations, top);
      log.info("Investigation complete: {} anomalies, {} contributors", investigations.size(), top.size());
      return record(new InvestigationReport(Status.FRESH, investigations, top));
    });
  }

  /**
   * Investigates an operator-selected window across all facets. Results are not cached.
   *
   * @param session the operator session
   * @param scope query scope of the chart
   * @param selection the selected window
   * @param fullRange the loaded range
   * @return contributors sorted by their largest change, or a superseded report
   */
  public Future<InvestigationReport> investigateSelection(
      InvestigationSession session,
      InvestigationScope scope,
      TimeWindow selection,
      TimeWindow fullRange) {

    RunTracker.Run run = session.selectionRuns().begin();
    QueryOptions options = new QueryOptions(run.token(), session.isForceRefresh());
    log.info("Investigating selection {} - {}", selection.start(), selection.end());

    List<Future<List<FacetContribution>>> futures = new ArrayList<>();
    for (FacetDefinition facet : facets) {
      futures.add(investigator.investigateSelection(facet, selection, fullRange, scope, options));
    }

    return Future.all(futures).map(done -> {
      if (!session.selectionRuns().isCurrent(run)) {
        log.info("Selection run {} superseded, discarding results", run.generation());
        return record(InvestigationReport.superseded());
      }
      List<Contributor> contributors = new ArrayList<>();
      for (int i = 0; i < facets.size(); i++) {
        String facetId = facets.get(i).id();
        List<FacetContribution> contributions = done.resultAt(i);
        contributions.forEach(c -> contributors.add(new Contributor(null, facetId, TrafficCategory.SELECTION, 0, c)));
      }
      contributors.sort(BY_MAX_CHANGE);
      return record(new InvestigationReport(Status.FRESH, List.of(), contributors));
    });
  }

  private Future<AnomalyInvestigation> investigateOne(
      DetectedAnomaly anomaly,
      InvestigationScope scope,
      List<Instant> timeline,
      TimeWindow fullRange,
      QueryOptions options) {

    TimeWindow window = windowOf(anomaly, timeline);
    String anomalyId = AnomalyIdGenerator.generateId(
      scope.context().timeFilter(), scope.filterSql(), window.start(), window.end(), anomaly.category());

    List<Future<List<FacetContribution>>> futures = new ArrayList<>();
    for (FacetDefinition facet : facets) {
      futures.add(investigator.investigateAnomaly(facet, anomaly.category(), window, fullRange, scope, options));
    }

    return Future.all(futures).map(done -> toInvestigation(anomaly, anomalyId, window, done));
  }

  private AnomalyInvestigation toInvestigation(
      DetectedAnomaly anomaly, String anomalyId, TimeWindow window, CompositeFuture done) {
    Map<String, List<FacetContribution>> byFacet = new LinkedHashMap<>();
    for (int i = 0; i < facets.size(); i++) {
      List<FacetContribution> contributions = done.resultAt(i);
      if (!contributions.isEmpty()) {
        byFacet.put(facets.get(i).id(), contributions);
      }
    }
    log.debug("Anomaly {} (rank {}): {} facets with contributors", anomalyId, anomaly.rank(), byFacet.size());
    return new AnomalyInvestigation(anomaly, anomalyId, window, byFacet);
  }

  /**
   * Wall-clock window of an anomaly: from the start of its first bucket to the end of its
   * last bucket.
   */
  static TimeWindow windowOf(DetectedAnomaly anomaly, List<Instant> timeline) {
    return new TimeWindow(timeline.get(anomaly.startIndex()), bucketEnd(anomaly.endIndex(), timeline));
  }

  static TimeWindow fullRange(List<Instant> timeline) {
    return new TimeWindow(timeline.get(0), bucketEnd(timeline.size() - 1, timeline));
  }

  private static Instant bucketEnd(int index, List<Instant> timeline) {
    if (index + 1 < timeline.size()) {
      return timeline.get(index + 1);
    }
    Duration step = timeline.size() > 1
      ? Duration.between(timeline.get(timeline.size() - 2), timeline.get(timeline.size() - 1))
      : DEFAULT_STEP;
    return timeline.get(index).plus(step);
  }

  /**
   * A cached result only counts when it can fill the highlight slots. An empty list is
   * accepted as written by older versions that did not record contributors.
   */
  static boolean hasSufficientCoverage(List<Contributor> topContributors) {
    return topContributors.isEmpty() || topContributors.size() >= InvestigationCache.HIGHLIGHT_TOP_N;
  }

  private InvestigationReport record(InvestigationReport report) {
    metrics.recordRun(report.status());
    return report;
  }

  private Future<InvestigationReport> complete(InvestigationReport report) {
    return Future.succeededFuture(record(report));
  }
}
