package io.github.themoah.edgepulse.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.edgepulse.cache.CacheConfig;
import io.github.themoah.edgepulse.cache.InMemoryKeyValueStore;
import io.github.themoah.edgepulse.cache.InvestigationCache;
import io.github.themoah.edgepulse.filter.SqlFilterCompiler;
import io.github.themoah.edgepulse.investigation.AnomalyInvestigationService;
import io.github.themoah.edgepulse.investigation.FacetInvestigator;
import io.github.themoah.edgepulse.metrics.InvestigationMetrics;
import io.github.themoah.edgepulse.query.ClickHouseConfig;
import io.github.themoah.edgepulse.query.QueryExecutor;
import io.github.themoah.edgepulse.query.QueryOptions;
import io.github.themoah.edgepulse.query.SqlTemplates;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * HTTP tests for InvestigationHandler, backed by canned query results.
 */
@ExtendWith(VertxExtension.class)
public class InvestigationHandlerTest {

  private static final Instant T0 = Instant.parse("2025-01-15T11:00:00Z");
  private static final String TIME_FILTER = "timestamp >= now() - INTERVAL 1 HOUR";

  private final CannedQueryExecutor executor = new CannedQueryExecutor();
  private HttpServer server;
  private WebClient client;

  @BeforeEach
  void startServer(Vertx vertx, VertxTestContext ctx) {
    SqlFilterCompiler filterCompiler = new SqlFilterCompiler();
    InvestigationMetrics metrics = InvestigationMetrics.noop();
    InvestigationCache cache = new InvestigationCache(
      new InMemoryKeyValueStore(), filterCompiler, CacheConfig.defaults());
    FacetInvestigator investigator = new FacetInvestigator(
      executor, new SqlTemplates(), ClickHouseConfig.builder().build(), metrics);
    AnomalyInvestigationService service = new AnomalyInvestigationService(investigator, cache, metrics);

    Router router = Router.router(vertx);
    router.route("/api/*").handler(BodyHandler.create());
    new InvestigationHandler(service, cache, filterCompiler).registerRoutes(router);

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
  void anomalies_freshThenCached(VertxTestContext ctx) {
    JsonObject body = anomaliesBody("ops");

    post("/api/investigations/anomalies", body)
      .compose(first -> {
        ctx.verify(() -> {
          assertEquals(200, first.statusCode());
          JsonObject json = first.bodyAsJsonObject();
          assertEquals("fresh", json.getString("status"));
          assertEquals(1, json.getJsonArray("investigations").size());
          JsonObject top = json.getJsonArray("contributors").getJsonObject(0);
          assertEquals("red", top.getString("category"));
          assertEquals("a.com", top.getJsonObject("contribution").getString("dim"));
        });
        return post("/api/investigations/anomalies", body);
      })
      .onComplete(ctx.succeeding(second -> ctx.verify(() -> {
        assertEquals("cached", second.bodyAsJsonObject().getString("status"));
        assertEquals(11, executor.calls.get());
        ctx.completeNow();
      })));
  }

  @Test
  void anomalies_indexOutsideTimelineIsBadRequest(VertxTestContext ctx) {
    JsonObject body = anomaliesBody("ops");
    body.getJsonArray("anomalies").getJsonObject(0).put("endIndex", 60);

    post("/api/investigations/anomalies", body)
      .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
        assertEquals(400, response.statusCode());
        assertTrue(response.bodyAsJsonObject().getString("error").contains("outside a timeline of 60 buckets"));
        assertEquals(0, executor.calls.get());
        ctx.completeNow();
      })));
  }

  @Test
  void anomalies_missingTimeFilterIsBadRequest(VertxTestContext ctx) {
    JsonObject body = anomaliesBody("ops");
    body.remove("timeFilter");

    post("/api/investigations/anomalies", body)
      .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
        assertEquals(400, response.statusCode());
        assertEquals("Missing field: timeFilter", response.bodyAsJsonObject().getString("error"));
        ctx.completeNow();
      })));
  }

  @Test
  void anomalies_emptyListIsEmptyReport(VertxTestContext ctx) {
    JsonObject body = anomaliesBody("ops").put("anomalies", new JsonArray());

    post("/api/investigations/anomalies", body)
      .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
        assertEquals(200, response.statusCode());
        assertEquals("empty", response.bodyAsJsonObject().getString("status"));
        ctx.completeNow();
      })));
  }

  @Test
  void selection_returnsFreshContributors(VertxTestContext ctx) {
    JsonObject body = new JsonObject()
      .put("timeFilter", TIME_FILTER)
      .put("start", T0.plusSeconds(600).toString())
      .put("end", T0.plusSeconds(1200).toString())
      .put("rangeStart", T0.toString())
      .put("rangeEnd", T0.plusSeconds(3600).toString());

    post("/api/investigations/selection", body)
      .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
        assertEquals(200, response.statusCode());
        JsonObject json = response.bodyAsJsonObject();
        assertEquals("fresh", json.getString("status"));
        assertTrue(json.getJsonArray("investigations").isEmpty());
        ctx.completeNow();
      })));
  }

  @Test
  void selection_endBeforeStartIsBadRequest(VertxTestContext ctx) {
    JsonObject body = new JsonObject()
      .put("timeFilter", TIME_FILTER)
      .put("start", T0.plusSeconds(1200).toString())
      .put("end", T0.plusSeconds(600).toString())
      .put("rangeStart", T0.toString())
      .put("rangeEnd", T0.plusSeconds(3600).toString());

    post("/api/investigations/selection", body)
      .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
        assertEquals(400, response.statusCode());
        ctx.completeNow();
      })));
  }

  @Test
  void invalidate_forgetsSessionMemory(VertxTestContext ctx) {
    JsonObject body = anomaliesBody("ops");

    post("/api/investigations/anomalies", body)
      .compose(first -> post("/api/investigations/invalidate", new JsonObject().put("sessionId", "ops")))
      .compose(invalidated -> {
        ctx.verify(() -> assertTrue(invalidated.bodyAsJsonObject().getBoolean("invalidated")));
        return post("/api/investigations/anomalies", body);
      })
      .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
        // memory is gone but the persistent cache still answers
        assertEquals("cached", response.bodyAsJsonObject().getString("status"));
        assertEquals(11, executor.calls.get());
        ctx.completeNow();
      })));
  }

  @Test
  void invalidate_unknownSession(VertxTestContext ctx) {
    post("/api/investigations/invalidate", new JsonObject().put("sessionId", "nobody"))
      .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
        assertEquals(200, response.statusCode());
        assertFalse(response.bodyAsJsonObject().getBoolean("invalidated"));
        ctx.completeNow();
      })));
  }

  @Test
  void clearCache_forcesRecomputation(VertxTestContext ctx) {
    JsonObject body = anomaliesBody("ops");

    post("/api/investigations/anomalies", body)
      .compose(first -> client.delete(server.actualPort(), "localhost", "/api/investigations/cache").send())
      .compose(cleared -> {
        ctx.verify(() -> assertEquals(1, cleared.bodyAsJsonObject().getInteger("removed")));
        return post("/api/investigations/anomalies", body);
      })
      .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
        assertEquals("fresh", response.bodyAsJsonObject().getString("status"));
        assertEquals(22, executor.calls.get());
        ctx.completeNow();
      })));
  }

  @Test
  void lookups_followLatestInvestigation(VertxTestContext ctx) {
    post("/api/investigations/anomalies", anomaliesBody("ops"))
      .compose(report -> {
        String anomalyId = report.bodyAsJsonObject().getJsonArray("investigations")
          .getJsonObject(0).getString("anomalyId");
        return get("/api/investigations/last?sessionId=ops")
          .compose(last -> {
            ctx.verify(() -> {
              assertEquals(200, last.statusCode());
              JsonObject json = last.bodyAsJsonObject();
              assertEquals(anomalyId, json.getJsonArray("investigations").getJsonObject(0).getString("anomalyId"));
              assertEquals(11, json.getJsonArray("contributors").size());
            });
            return get("/api/investigations/rank/1?sessionId=ops");
          })
          .compose(byRank -> {
            ctx.verify(() -> {
              assertEquals(200, byRank.statusCode());
              assertEquals(anomalyId, byRank.bodyAsJsonObject().getString("anomalyId"));
            });
            return get("/api/investigations/anomalies/" + anomalyId + "?sessionId=ops");
          })
          .map(byId -> {
            ctx.verify(() -> {
              assertEquals(200, byId.statusCode());
              assertEquals(10, byId.bodyAsJsonObject().getJsonObject("anomaly").getInteger("startIndex"));
            });
            return byId;
          });
      })
      .onComplete(ctx.succeeding(done -> ctx.completeNow()));
  }

  @Test
  void lookups_unknownSessionOrRank(VertxTestContext ctx) {
    get("/api/investigations/last?sessionId=nobody")
      .compose(last -> {
        ctx.verify(() -> {
          assertEquals(200, last.statusCode());
          assertTrue(last.bodyAsJsonObject().getJsonArray("investigations").isEmpty());
        });
        return get("/api/investigations/rank/2?sessionId=nobody");
      })
      .compose(byRank -> {
        ctx.verify(() -> assertEquals(404, byRank.statusCode()));
        return get("/api/investigations/rank/first");
      })
      .onComplete(ctx.succeeding(badRank -> ctx.verify(() -> {
        assertEquals(400, badRank.statusCode());
        ctx.completeNow();
      })));
  }

  private Future<HttpResponse<Buffer>> get(String uri) {
    return client.get(server.actualPort(), "localhost", uri).send();
  }

  private Future<HttpResponse<Buffer>> post(String path, JsonObject body) {
    return client.post(server.actualPort(), "localhost", path).sendJsonObject(body);
  }

  private static JsonObject anomaliesBody(String sessionId) {
    JsonArray timeline = new JsonArray();
    for (int i = 0; i < 60; i++) {
      timeline.add(T0.plusSeconds(60L * i).toString());
    }
    JsonObject anomaly = new JsonObject()
      .put("startIndex", 10)
      .put("endIndex", 14)
      .put("type", "spike")
      .put("magnitude", 3.0)
      .put("category", "red")
      .put("duration", 5)
      .put("score", 10.0)
      .put("rank", 1);
    return new JsonObject()
      .put("sessionId", sessionId)
      .put("timeFilter", TIME_FILTER)
      .put("hostFilter", "")
      .put("anomalies", new JsonArray().add(anomaly))
      .put("timeline", timeline);
  }

  private static class CannedQueryExecutor implements QueryExecutor {

    final AtomicInteger calls = new AtomicInteger();

    @Override
    public Future<List<JsonObject>> runAggregation(String sql, QueryOptions options) {
      calls.incrementAndGet();
      if (sql.contains("selection_cnt")) {
        return Future.succeededFuture(List.of(new JsonObject()
          .put("dim", "x").put("selection_cnt", 1000).put("baseline_cnt", 5000)
          .put("selection_err_cnt", 500).put("baseline_err_cnt", 50)));
      }
      return Future.succeededFuture(List.of(
        new JsonObject().put("dim", "a.com").put("anomaly_cat_cnt", 500).put("baseline_cat_cnt", 550)
          .put("anomaly_total_cnt", 1000).put("baseline_total_cnt", 11000),
        new JsonObject().put("dim", "b.com").put("anomaly_cat_cnt", 100).put("baseline_cat_cnt", 4950)
          .put("anomaly_total_cnt", 5000).put("baseline_total_cnt", 110000)));
    }

    @Override
    public Future<Void> ping() {
      return Future.succeededFuture();
    }
  }
}
