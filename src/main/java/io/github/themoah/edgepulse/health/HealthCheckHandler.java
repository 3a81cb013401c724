package io.github.themoah.edgepulse.health;

import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP handler for the liveness and readiness probes.
 */
public class HealthCheckHandler {

  private static final Logger log = LoggerFactory.getLogger(HealthCheckHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final ClickHouseHealthMonitor healthMonitor;

  public HealthCheckHandler(ClickHouseHealthMonitor healthMonitor) {
    this.healthMonitor = healthMonitor;
  }

  public void registerRoutes(Router router) {
    router.get("/healthz").handler(this::handleLiveness);
    router.get("/readyz").handler(this::handleReadiness);
    log.info("Health check routes registered: /healthz, /readyz");
  }

  private void handleLiveness(RoutingContext ctx) {
    respond(ctx, HealthCheckResponse.liveness());
  }

  /**
   * 200 while ClickHouse answers pings, 503 otherwise.
   */
  private void handleReadiness(RoutingContext ctx) {
    respond(ctx, HealthCheckResponse.readiness(healthMonitor.isClickHouseReachable()));
  }

  private static void respond(RoutingContext ctx, HealthCheckResponse response) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(response.status().httpStatus())
      .end(response.toJson().encode());
  }
}
