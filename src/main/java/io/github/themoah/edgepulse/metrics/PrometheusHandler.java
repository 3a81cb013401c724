package io.github.themoah.edgepulse.metrics;

import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.util.HashSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the Prometheus scrape endpoint for the detection and investigation metrics.
 *
 * <p>Repeated {@code name[]} query parameters restrict the output to those sample
 * names, e.g. {@code /metrics?name[]=edgepulse_investigation_runs_total}.
 */
public class PrometheusHandler {

  private static final Logger log = LoggerFactory.getLogger(PrometheusHandler.class);
  private static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";
  private static final String NAME_PARAM = "name[]";

  private final PrometheusMeterRegistry registry;
  private final String path;

  public PrometheusHandler(PrometheusMeterRegistry registry, String path) {
    this.registry = registry;
    this.path = path;
  }

  public void registerRoutes(Router router) {
    router.get(path).handler(this::handleMetrics);
    log.info("Registered Prometheus metrics endpoint at {}", path);
  }

  private void handleMetrics(RoutingContext ctx) {
    List<String> names = ctx.queryParam(NAME_PARAM);
    String body;
    try {
      body = names.isEmpty()
        ? registry.scrape()
        : registry.scrape(PROMETHEUS_CONTENT_TYPE, new HashSet<>(names));
    } catch (RuntimeException e) {
      log.error("Failed to scrape metrics", e);
      ctx.response().setStatusCode(500).end();
      return;
    }
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, PROMETHEUS_CONTENT_TYPE)
      .end(body);
  }
}
