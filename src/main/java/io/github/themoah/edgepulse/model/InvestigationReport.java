package io.github.themoah.edgepulse.model;

import java.util.List;

/**
 * Outcome of one investigation request.
 *
 * @param status how the result was obtained
 * @param investigations per-anomaly investigations (empty for selections)
 * @param contributors contributors sorted by significance
 */
public record InvestigationReport(
  Status status,
  List<AnomalyInvestigation> investigations,
  List<Contributor> contributors
) {

  /**
   * Where an investigation result came from.
   */
  public enum Status {
    /** Computed by a fresh run of facet queries. */
    FRESH,
    /** Served from the session memory or the persistent cache. */
    CACHED,
    /** Discarded because the query scope changed while queries were in flight. */
    SUPERSEDED,
    /** Nothing to investigate. */
    EMPTY
  }

  public InvestigationReport {
    investigations = List.copyOf(investigations);
    contributors = List.copyOf(contributors);
  }

  public static InvestigationReport empty() {
    return new InvestigationReport(Status.EMPTY, List.of(), List.of());
  }

  public static InvestigationReport superseded() {
    return new InvestigationReport(Status.SUPERSEDED, List.of(), List.of());
  }

  public boolean isSuperseded() {
    return status == Status.SUPERSEDED;
  }
}
