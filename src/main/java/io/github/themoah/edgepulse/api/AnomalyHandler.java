package io.github.themoah.edgepulse.api;

import io.github.themoah.edgepulse.detection.DetectionConfig;
import io.github.themoah.edgepulse.detection.DetectionOptions;
import io.github.themoah.edgepulse.detection.StepDetector;
import io.github.themoah.edgepulse.filter.Filter;
import io.github.themoah.edgepulse.filter.FilterCompiler;
import io.github.themoah.edgepulse.identity.AnomalyIdGenerator;
import io.github.themoah.edgepulse.metrics.InvestigationMetrics;
import io.github.themoah.edgepulse.model.DetectedAnomaly;
import io.github.themoah.edgepulse.model.TrafficCategory;
import io.github.themoah.edgepulse.model.TrafficSeries;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP adapter for anomaly detection and anomaly ids.
 */
public class AnomalyHandler {

  private static final Logger log = LoggerFactory.getLogger(AnomalyHandler.class);

  private final StepDetector detector;
  private final DetectionConfig detectionConfig;
  private final FilterCompiler filterCompiler;
  private final InvestigationMetrics metrics;

  public AnomalyHandler(
      DetectionConfig detectionConfig, FilterCompiler filterCompiler, InvestigationMetrics metrics) {
    this.detector = new StepDetector(detectionConfig);
    this.detectionConfig = detectionConfig;
    this.filterCompiler = filterCompiler;
    this.metrics = metrics;
  }

  public void registerRoutes(Router router) {
    router.post("/api/anomalies/detect").handler(this::handleDetect);
    router.post("/api/anomalies/detect-step").handler(this::handleDetectStep);
    router.post("/api/anomalies/id").handler(this::handleId);
    log.info("Anomaly routes registered: /api/anomalies/detect, /api/anomalies/detect-step, /api/anomalies/id");
  }

  private void handleDetect(RoutingContext ctx) {
    try {
      JsonObject body = ApiResponses.body(ctx);
      int maxCount = body.getInteger("maxCount", detectionConfig.maxCount());
      List<DetectedAnomaly> anomalies = detector.detectSteps(series(body), maxCount, options(body));
      metrics.recordDetected(anomalies);

      JsonArray result = new JsonArray();
      anomalies.forEach(a -> result.add(a.toJson()));
      ApiResponses.ok(ctx, result.encode());
    } catch (RuntimeException e) {
      ApiResponses.fail(ctx, e);
    }
  }

  private void handleDetectStep(RoutingContext ctx) {
    try {
      JsonObject body = ApiResponses.body(ctx);
      DetectedAnomaly anomaly = detector.detectStep(series(body), options(body));
      if (anomaly != null) {
        metrics.recordDetected(List.of(anomaly));
      }
      ApiResponses.ok(ctx, anomaly == null ? "null" : anomaly.toJson().encode());
    } catch (RuntimeException e) {
      ApiResponses.fail(ctx, e);
    }
  }

  private void handleId(RoutingContext ctx) {
    try {
      JsonObject body = ApiResponses.body(ctx);
      String filterSql = filterCompiler.compile(filters(body.getJsonArray("filters"))).sql();
      String id = AnomalyIdGenerator.generateId(
        body.getString("timeFilter", ""),
        filterSql,
        ApiResponses.requireInstant(body, "start"),
        ApiResponses.requireInstant(body, "end"),
        TrafficCategory.fromValue(ApiResponses.requireString(body, "category")));
      ApiResponses.ok(ctx, new JsonObject().put("id", id).encode());
    } catch (RuntimeException e) {
      ApiResponses.fail(ctx, e);
    }
  }

  private static TrafficSeries series(JsonObject body) {
    return new TrafficSeries(
      ApiResponses.longs(body, "ok"),
      ApiResponses.longs(body, "client"),
      ApiResponses.longs(body, "server"));
  }

  private DetectionOptions options(JsonObject body) {
    DetectionOptions defaults = detectionConfig.options();
    return new DetectionOptions(
      body.getInteger("startMargin", defaults.startMargin()),
      body.getInteger("endMargin", defaults.endMargin()),
      body.getInteger("minGap", defaults.minGap()));
  }

  static List<Filter> filters(JsonArray array) {
    List<Filter> filters = new ArrayList<>();
    if (array != null) {
      for (int i = 0; i < array.size(); i++) {
        filters.add(Filter.fromJson(array.getJsonObject(i)));
      }
    }
    return filters;
  }
}
