package io.github.themoah.edgepulse.metrics;

import io.github.themoah.edgepulse.model.DetectedAnomaly;
import io.github.themoah.edgepulse.model.InvestigationReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Micrometer instrumentation of detection and investigation.
 *
 * <p>Meters:
 * <ul>
 *   <li>{@code edgepulse.anomalies.detected} counter, tags category and type</li>
 *   <li>{@code edgepulse.facet.query} timer, tags facet, mode and outcome (success, failure, cancelled)</li>
 *   <li>{@code edgepulse.investigation.cache} counter, tags source (memory, store) and result (hit, miss)</li>
 *   <li>{@code edgepulse.investigation.runs} counter, tag status</li>
 * </ul>
 */
public class InvestigationMetrics {

  public static final String ANOMALIES_DETECTED = "edgepulse.anomalies.detected";
  public static final String FACET_QUERY = "edgepulse.facet.query";
  public static final String CACHE_LOOKUPS = "edgepulse.investigation.cache";
  public static final String RUNS = "edgepulse.investigation.runs";

  private final MeterRegistry registry;

  public InvestigationMetrics(MeterRegistry registry) {
    this.registry = registry;
  }

  /**
   * Metrics backed by a private in-memory registry, for callers that report nowhere.
   */
  public static InvestigationMetrics noop() {
    return new InvestigationMetrics(new SimpleMeterRegistry());
  }

  public MeterRegistry registry() {
    return registry;
  }

  public void recordDetected(List<DetectedAnomaly> anomalies) {
    for (DetectedAnomaly anomaly : anomalies) {
      Counter.builder(ANOMALIES_DETECTED)
        .tags(Tags.of("category", anomaly.category().getValue(), "type", anomaly.type().getValue()))
        .register(registry)
        .increment();
    }
  }

  public void recordFacetQuery(String facetId, String mode, String outcome, Duration elapsed) {
    Timer.builder(FACET_QUERY)
      .tags(Tags.of("facet", facetId, "mode", mode, "outcome", outcome))
      .register(registry)
      .record(elapsed);
  }

  public void recordCacheLookup(String source, boolean hit) {
    Counter.builder(CACHE_LOOKUPS)
      .tags(Tags.of("source", source, "result", hit ? "hit" : "miss"))
      .register(registry)
      .increment();
  }

  public void recordRun(InvestigationReport.Status status) {
    Counter.builder(RUNS)
      .tag("status", status.name().toLowerCase(Locale.ROOT))
      .register(registry)
      .increment();
  }
}
