package io.github.themoah.edgepulse.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * HTTP tests for PrometheusHandler.
 */
@ExtendWith(VertxExtension.class)
public class PrometheusHandlerTest {

  private HttpServer server;
  private WebClient client;

  @BeforeEach
  void startServer(Vertx vertx, VertxTestContext ctx) {
    PrometheusMeterRegistry registry = MicrometerConfig.createPrometheusRegistry();
    InvestigationMetrics metrics = new InvestigationMetrics(registry);
    metrics.recordCacheLookup("memory", true);
    metrics.recordCacheLookup("store", false);

    Router router = Router.router(vertx);
    new PrometheusHandler(registry, "/internal/metrics").registerRoutes(router);

    client = WebClient.create(vertx);
    vertx.createHttpServer()
      .requestHandler(router)
      .listen(0)
      .onComplete(ctx.succeeding(s -> {
        server = s;
        ctx.completeNow();
      }));
  }

  @AfterEach
  void stopServer(VertxTestContext ctx) {
    client.close();
    server.close().onComplete(ctx.succeedingThenComplete());
  }

  @Test
  void scrape_servesConfiguredPath(VertxTestContext ctx) {
    client.get(server.actualPort(), "localhost", "/internal/metrics").send()
      .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
        assertEquals(200, response.statusCode());
        assertTrue(response.getHeader("content-type").startsWith("text/plain"));
        assertTrue(response.bodyAsString().contains("edgepulse_investigation_cache_total"));
        ctx.completeNow();
      })));
  }

  @Test
  void scrape_filtersBySampleName(VertxTestContext ctx) {
    client.get(server.actualPort(), "localhost", "/internal/metrics")
      .addQueryParam("name[]", "edgepulse_no_such_metric")
      .send()
      .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
        assertEquals(200, response.statusCode());
        assertFalse(response.bodyAsString().contains("edgepulse_investigation_cache_total"));
        ctx.completeNow();
      })));
  }

  @Test
  void scrape_defaultPathNotRegistered(VertxTestContext ctx) {
    client.get(server.actualPort(), "localhost", "/metrics").send()
      .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
        assertEquals(404, response.statusCode());
        ctx.completeNow();
      })));
  }
}
