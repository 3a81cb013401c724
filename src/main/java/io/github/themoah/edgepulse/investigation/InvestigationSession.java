package io.github.themoah.edgepulse.investigation;

import io.github.themoah.edgepulse.model.AnomalyInvestigation;
import io.github.themoah.edgepulse.model.Contributor;
import io.github.themoah.edgepulse.model.QueryContext;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable state of one operator session: the force-refresh flag, the run trackers and the
 * last investigation kept in memory.
 */
public class InvestigationSession {

  private final RunTracker anomalyRuns = new RunTracker();
  private final RunTracker selectionRuns = new RunTracker();

  private volatile boolean forceRefresh;

  private String lastCacheKey;
  private QueryContext lastContext;
  private List<AnomalyInvestigation> lastResults = List.of();
  private List<Contributor> lastTopContributors = List.of();
  private final Map<String, AnomalyInvestigation> byAnomalyId = new HashMap<>();
  private final Map<Integer, String> idByRank = new HashMap<>();

  public boolean isForceRefresh() {
    return forceRefresh;
  }

  public void setForceRefresh(boolean forceRefresh) {
    this.forceRefresh = forceRefresh;
  }

  RunTracker anomalyRuns() {
    return anomalyRuns;
  }

  RunTracker selectionRuns() {
    return selectionRuns;
  }

  /**
   * Last investigation if it was stored under {@code cacheKey}.
   */
  synchronized Optional<MemoryEntry> memory(String cacheKey) {
    if (lastCacheKey == null || !lastCacheKey.equals(cacheKey) || lastContext == null) {
      return Optional.empty();
    }
    return Optional.of(new MemoryEntry(lastContext, lastResults, lastTopContributors));
  }

  synchronized void remember(
      String cacheKey,
      QueryContext context,
      List<AnomalyInvestigation> investigations,
      List<Contributor> topContributors) {

    lastCacheKey = cacheKey;
    lastContext = context;
    lastResults = List.copyOf(investigations);
    lastTopContributors = List.copyOf(topContributors);
    byAnomalyId.clear();
    idByRank.clear();
    for (AnomalyInvestigation investigation : investigations) {
      byAnomalyId.put(investigation.anomalyId(), investigation);
      idByRank.put(investigation.anomaly().rank(), investigation.anomalyId());
    }
  }

  /**
   * Drops the in-memory investigation and cancels any run in flight.
   */
  public synchronized void invalidate() {
    lastCacheKey = null;
    lastContext = null;
    lastResults = List.of();
    lastTopContributors = List.of();
    byAnomalyId.clear();
    idByRank.clear();
    anomalyRuns.cancel();
    selectionRuns.cancel();
  }

  public synchronized Optional<AnomalyInvestigation> getInvestigation(String anomalyId) {
    return Optional.ofNullable(byAnomalyId.get(anomalyId));
  }

  public synchronized Optional<String> getAnomalyIdByRank(int rank) {
    return Optional.ofNullable(idByRank.get(rank));
  }

  public synchronized List<AnomalyInvestigation> getLastResults() {
    return lastResults;
  }

  public synchronized List<Contributor> getLastTopContributors() {
    return lastTopContributors;
  }

  record MemoryEntry(QueryContext context, List<AnomalyInvestigation> investigations, List<Contributor> topContributors) {
  }
}
