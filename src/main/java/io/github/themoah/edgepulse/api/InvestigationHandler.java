package io.github.themoah.edgepulse.api;

import io.github.themoah.edgepulse.cache.InvestigationCache;
import io.github.themoah.edgepulse.filter.FilterCompiler;
import io.github.themoah.edgepulse.investigation.AnomalyInvestigationService;
import io.github.themoah.edgepulse.investigation.InvestigationScope;
import io.github.themoah.edgepulse.investigation.InvestigationSession;
import io.github.themoah.edgepulse.model.AnomalyInvestigation;
import io.github.themoah.edgepulse.model.Contributor;
import io.github.themoah.edgepulse.model.DetectedAnomaly;
import io.github.themoah.edgepulse.model.InvestigationReport;
import io.github.themoah.edgepulse.model.TimeWindow;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP adapter for anomaly and selection investigations.
 *
 * <p>Requests carry an optional {@code sessionId}; each id gets its own
 * {@link InvestigationSession}, so a new request supersedes only the runs of its own session.
 */
public class InvestigationHandler {

  private static final Logger log = LoggerFactory.getLogger(InvestigationHandler.class);

  static final String DEFAULT_SESSION = "default";

  private final AnomalyInvestigationService service;
  private final InvestigationCache cache;
  private final FilterCompiler filterCompiler;
  private final Map<String, InvestigationSession> sessions = new ConcurrentHashMap<>();

  public InvestigationHandler(
      AnomalyInvestigationService service, InvestigationCache cache, FilterCompiler filterCompiler) {
    this.service = service;
    this.cache = cache;
    this.filterCompiler = filterCompiler;
  }

  public void registerRoutes(Router router) {
    router.post("/api/investigations/anomalies").handler(this::handleAnomalies);
    router.post("/api/investigations/selection").handler(this::handleSelection);
    router.post("/api/investigations/invalidate").handler(this::handleInvalidate);
    router.delete("/api/investigations/cache").handler(this::handleClearCache);
    router.get("/api/investigations/last").handler(this::handleLast);
    router.get("/api/investigations/anomalies/:anomalyId").handler(this::handleByAnomalyId);
    router.get("/api/investigations/rank/:rank").handler(this::handleByRank);
    log.info("Investigation routes registered under /api/investigations");
  }

  private void handleAnomalies(RoutingContext ctx) {
    try {
      JsonObject body = ApiResponses.body(ctx);
      InvestigationSession session = session(body);
      session.setForceRefresh(body.getBoolean("forceRefresh", false));

      List<DetectedAnomaly> anomalies = new ArrayList<>();
      JsonArray anomalyJson = body.getJsonArray("anomalies", new JsonArray());
      for (int i = 0; i < anomalyJson.size(); i++) {
        anomalies.add(DetectedAnomaly.fromJson(anomalyJson.getJsonObject(i)));
      }
      List<Instant> timeline = new ArrayList<>();
      JsonArray timelineJson = body.getJsonArray("timeline", new JsonArray());
      for (int i = 0; i < timelineJson.size(); i++) {
        timeline.add(Instant.parse(timelineJson.getString(i)));
      }
      validateIndices(anomalies, timeline.size());

      service.investigateAnomalies(session, scope(body), anomalies, timeline)
        .onSuccess(report -> ApiResponses.ok(ctx, toJson(report).encode()))
        .onFailure(err -> ApiResponses.fail(ctx, err));
    } catch (RuntimeException e) {
      ApiResponses.fail(ctx, e);
    }
  }

  private void handleSelection(RoutingContext ctx) {
    try {
      JsonObject body = ApiResponses.body(ctx);
      InvestigationSession session = session(body);
      session.setForceRefresh(body.getBoolean("forceRefresh", false));

      TimeWindow selection = new TimeWindow(
        ApiResponses.requireInstant(body, "start"), ApiResponses.requireInstant(body, "end"));
      TimeWindow fullRange = new TimeWindow(
        ApiResponses.requireInstant(body, "rangeStart"), ApiResponses.requireInstant(body, "rangeEnd"));

      service.investigateSelection(session, scope(body), selection, fullRange)
        .onSuccess(report -> ApiResponses.ok(ctx, toJson(report).encode()))
        .onFailure(err -> ApiResponses.fail(ctx, err));
    } catch (RuntimeException e) {
      ApiResponses.fail(ctx, e);
    }
  }

  private void handleInvalidate(RoutingContext ctx) {
    try {
      InvestigationSession session = sessions.get(sessionId(ApiResponses.body(ctx)));
      if (session != null) {
        session.invalidate();
      }
      ApiResponses.ok(ctx, new JsonObject().put("invalidated", session != null).encode());
    } catch (RuntimeException e) {
      ApiResponses.fail(ctx, e);
    }
  }

  private void handleClearCache(RoutingContext ctx) {
    int removed = cache.clearAll();
    sessions.values().forEach(InvestigationSession::invalidate);
    ApiResponses.ok(ctx, new JsonObject().put("removed", removed).encode());
  }

  /**
   * Latest anomaly investigation of a session, whether computed or served from cache.
   */
  private void handleLast(RoutingContext ctx) {
    InvestigationSession session = sessions.get(sessionId(ctx));
    List<AnomalyInvestigation> investigations = session == null ? List.of() : session.getLastResults();
    List<Contributor> contributors = session == null ? List.of() : session.getLastTopContributors();
    ApiResponses.ok(ctx, toJson(investigations, contributors).encode());
  }

  private void handleByAnomalyId(RoutingContext ctx) {
    InvestigationSession session = sessions.get(sessionId(ctx));
    String anomalyId = ctx.pathParam("anomalyId");
    respondWith(ctx, session == null ? Optional.empty() : session.getInvestigation(anomalyId), anomalyId);
  }

  private void handleByRank(RoutingContext ctx) {
    try {
      int rank = Integer.parseInt(ctx.pathParam("rank"));
      InvestigationSession session = sessions.get(sessionId(ctx));
      Optional<AnomalyInvestigation> investigation = session == null
        ? Optional.empty()
        : session.getAnomalyIdByRank(rank).flatMap(session::getInvestigation);
      respondWith(ctx, investigation, "rank " + rank);
    } catch (RuntimeException e) {
      ApiResponses.fail(ctx, e);
    }
  }

  private static void respondWith(RoutingContext ctx, Optional<AnomalyInvestigation> investigation, String what) {
    if (investigation.isPresent()) {
      ApiResponses.ok(ctx, investigation.get().toJson().encode());
    } else {
      ApiResponses.error(ctx, 404, "No investigation for " + what);
    }
  }

  InvestigationSession session(JsonObject body) {
    return sessions.computeIfAbsent(sessionId(body), id -> new InvestigationSession());
  }

  private static String sessionId(JsonObject body) {
    return sessionId(body.getString("sessionId"));
  }

  private static String sessionId(RoutingContext ctx) {
    return sessionId(ctx.queryParams().get("sessionId"));
  }

  private static String sessionId(String id) {
    return id == null || id.isBlank() ? DEFAULT_SESSION : id;
  }

  private InvestigationScope scope(JsonObject body) {
    return InvestigationScope.of(
      ApiResponses.requireString(body, "timeFilter"),
      body.getString("hostFilter", ""),
      AnomalyHandler.filters(body.getJsonArray("filters")),
      filterCompiler);
  }

  private static void validateIndices(List<DetectedAnomaly> anomalies, int buckets) {
    for (DetectedAnomaly anomaly : anomalies) {
      if (anomaly.startIndex() < 0 || anomaly.endIndex() >= buckets || anomaly.startIndex() > anomaly.endIndex()) {
        throw new IllegalArgumentException(String.format(
          "Anomaly rank %d spans %d..%d outside a timeline of %d buckets",
          anomaly.rank(), anomaly.startIndex(), anomaly.endIndex(), buckets));
      }
    }
  }

  static JsonObject toJson(InvestigationReport report) {
    return toJson(report.investigations(), report.contributors())
      .put("status", report.status().name().toLowerCase(Locale.ROOT));
  }

  private static JsonObject toJson(List<AnomalyInvestigation> investigations, List<Contributor> contributors) {
    JsonArray investigationJson = new JsonArray();
    for (AnomalyInvestigation investigation : investigations) {
      investigationJson.add(investigation.toJson());
    }
    JsonArray contributorJson = new JsonArray();
    for (Contributor contributor : contributors) {
      contributorJson.add(contributor.toJson());
    }
    return new JsonObject()
      .put("investigations", investigationJson)
      .put("contributors", contributorJson);
  }
}
