package io.github.themoah.edgepulse.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.edgepulse.query.QueryException;
import io.github.themoah.edgepulse.query.QueryExecutor;
import io.github.themoah.edgepulse.query.QueryOptions;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Tests for ClickHouseHealthMonitor and the probes served from it.
 */
@ExtendWith(VertxExtension.class)
public class ClickHouseHealthMonitorTest {

  @Test
  void start_reachableStoreIsUp(Vertx vertx, VertxTestContext ctx) {
    ClickHouseHealthMonitor monitor = new ClickHouseHealthMonitor(vertx, new PingExecutor(true), 60_000);

    monitor.start().onComplete(ctx.succeeding(v -> ctx.verify(() -> {
      assertTrue(monitor.isClickHouseReachable());
      assertEquals(HealthStatus.UP, monitor.getClickHouseStatus());
      monitor.stop();
      assertFalse(monitor.isClickHouseReachable());
      ctx.completeNow();
    })));
  }

  @Test
  void start_unreachableStoreStillStarts(Vertx vertx, VertxTestContext ctx) {
    ClickHouseHealthMonitor monitor = new ClickHouseHealthMonitor(vertx, new PingExecutor(false), 60_000);

    monitor.start().onComplete(ctx.succeeding(v -> ctx.verify(() -> {
      assertEquals(HealthStatus.DOWN, monitor.getClickHouseStatus());
      monitor.stop();
      ctx.completeNow();
    })));
  }

  @Test
  void periodicCheckPicksUpRecovery(Vertx vertx, VertxTestContext ctx) {
    PingExecutor executor = new PingExecutor(false);
    ClickHouseHealthMonitor monitor = new ClickHouseHealthMonitor(vertx, executor, 50);

    monitor.start().onComplete(ctx.succeeding(v -> {
      executor.reachable = true;
      vertx.setTimer(300, id -> ctx.verify(() -> {
        assertTrue(monitor.isClickHouseReachable());
        monitor.stop();
        ctx.completeNow();
      }));
    }));
  }

  @Test
  void readiness_reflectsMonitor(Vertx vertx, VertxTestContext ctx) {
    ClickHouseHealthMonitor monitor = new ClickHouseHealthMonitor(vertx, new PingExecutor(false), 60_000);
    Router router = Router.router(vertx);
    new HealthCheckHandler(monitor).registerRoutes(router);
    WebClient client = WebClient.create(vertx);

    monitor.start()
      .compose(v -> vertx.createHttpServer().requestHandler(router).listen(0))
      .compose((HttpServer server) -> client.get(server.actualPort(), "localhost", "/readyz").send()
        .compose(ready -> {
          ctx.verify(() -> {
            assertEquals(503, ready.statusCode());
            JsonObject json = ready.bodyAsJsonObject();
            assertEquals("DOWN", json.getString("status"));
            assertEquals("unreachable", json.getString("clickhouse"));
          });
          return client.get(server.actualPort(), "localhost", "/healthz").send();
        }))
      .onComplete(ctx.succeeding(live -> ctx.verify(() -> {
        assertEquals(200, live.statusCode());
        assertEquals("UP", live.bodyAsJsonObject().getString("status"));
        monitor.stop();
        ctx.completeNow();
      })));
  }

  private static class PingExecutor implements QueryExecutor {

    volatile boolean reachable;

    PingExecutor(boolean reachable) {
      this.reachable = reachable;
    }

    @Override
    public Future<List<JsonObject>> runAggregation(String sql, QueryOptions options) {
      return Future.succeededFuture(List.of());
    }

    @Override
    public Future<Void> ping() {
      return reachable
        ? Future.succeededFuture()
        : Future.failedFuture(new QueryException("Connection refused"));
    }
  }
}
