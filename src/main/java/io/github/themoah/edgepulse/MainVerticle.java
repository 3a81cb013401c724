package io.github.themoah.edgepulse;

import io.github.themoah.edgepulse.api.AnomalyHandler;
import io.github.themoah.edgepulse.api.InvestigationHandler;
import io.github.themoah.edgepulse.cache.CacheConfig;
import io.github.themoah.edgepulse.cache.InMemoryKeyValueStore;
import io.github.themoah.edgepulse.cache.InvestigationCache;
import io.github.themoah.edgepulse.config.AppConfig;
import io.github.themoah.edgepulse.filter.FilterCompiler;
import io.github.themoah.edgepulse.filter.SqlFilterCompiler;
import io.github.themoah.edgepulse.health.ClickHouseHealthMonitor;
import io.github.themoah.edgepulse.health.HealthCheckHandler;
import io.github.themoah.edgepulse.investigation.AnomalyInvestigationService;
import io.github.themoah.edgepulse.investigation.FacetInvestigator;
import io.github.themoah.edgepulse.metrics.InvestigationMetrics;
import io.github.themoah.edgepulse.metrics.MetricsConfig;
import io.github.themoah.edgepulse.metrics.MicrometerConfig;
import io.github.themoah.edgepulse.metrics.PrometheusHandler;
import io.github.themoah.edgepulse.query.ClickHouseConfig;
import io.github.themoah.edgepulse.query.ClickHouseQueryExecutor;
import io.github.themoah.edgepulse.query.QueryExecutor;
import io.github.themoah.edgepulse.query.SqlTemplates;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main verticle for edgepulse.
 * Wires the ClickHouse executor, investigation cache and services, health monitoring
 * and the HTTP server.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);

  private QueryExecutor queryExecutor;
  private ClickHouseHealthMonitor healthMonitor;
  private HttpServer httpServer;

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting edgepulse MainVerticle");

    AppConfig appConfig = AppConfig.fromEnvironment();
    CacheConfig cacheConfig = appConfig.cache();
    ClickHouseConfig clickHouseConfig = loadClickHouseConfig();

    queryExecutor = new ClickHouseQueryExecutor(vertx, clickHouseConfig);
    healthMonitor = new ClickHouseHealthMonitor(vertx, queryExecutor, appConfig.healthCheckIntervalMs());

    Router router = Router.router(vertx);
    router.route("/api/*").handler(BodyHandler.create().setBodyLimit(appConfig.maxBodyBytes()));

    new HealthCheckHandler(healthMonitor).registerRoutes(router);
    InvestigationMetrics metrics = createMetrics(appConfig, router);

    FilterCompiler filterCompiler = new SqlFilterCompiler();
    InvestigationCache cache = new InvestigationCache(
      new InMemoryKeyValueStore(cacheConfig.storeQuota()), filterCompiler, cacheConfig);
    FacetInvestigator investigator = new FacetInvestigator(
      queryExecutor, new SqlTemplates(), clickHouseConfig, metrics);
    AnomalyInvestigationService service = new AnomalyInvestigationService(investigator, cache, metrics);

    new AnomalyHandler(appConfig.detection(), filterCompiler, metrics).registerRoutes(router);
    new InvestigationHandler(service, cache, filterCompiler).registerRoutes(router);

    router.route().handler(ctx -> {
      ctx.response()
        .setStatusCode(404)
        .putHeader("content-type", "application/json")
        .end("{\"error\": \"Not Found\"}");
    });

    healthMonitor.start()
      .compose(v -> startHttpServer(router, appConfig.httpPort()))
      .onSuccess(server -> {
        httpServer = server;
        log.info("edgepulse started successfully on port {}", server.actualPort());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start edgepulse", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping edgepulse MainVerticle");

    Future<Void> stopHealthMonitor = (healthMonitor != null)
      ? healthMonitor.stop()
      : Future.succeededFuture();

    Future<Void> stopHttpServer = (httpServer != null)
      ? httpServer.close()
      : Future.succeededFuture();

    Future<Void> closeExecutor = (queryExecutor != null)
      ? queryExecutor.close()
      : Future.succeededFuture();

    stopHealthMonitor
      .compose(v -> stopHttpServer)
      .compose(v -> closeExecutor)
      .onSuccess(v -> {
        log.info("edgepulse stopped successfully");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during edgepulse shutdown", err);
        stopPromise.fail(err);
      });
  }

  private Future<HttpServer> startHttpServer(Router router, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port)
      .onSuccess(server -> log.info("HTTP server started on port {}", server.actualPort()))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }

  private ClickHouseConfig loadClickHouseConfig() {
    try {
      return ClickHouseConfig.fromClasspath();
    } catch (Exception e) {
      log.info("No classpath config found, loading from environment: {}", e.getMessage());
      return ClickHouseConfig.fromEnvironment();
    }
  }

  private InvestigationMetrics createMetrics(AppConfig appConfig, Router router) {
    MetricsConfig config = appConfig.metrics();
    if (!config.isEnabled()) {
      log.info("Metrics reporting is disabled");
      return InvestigationMetrics.noop();
    }

    MeterRegistry registry = MicrometerConfig.createRegistry(config.reporterType());
    if (registry == null) {
      log.warn("Failed to create meter registry for type: {}", config.reporterType());
      return InvestigationMetrics.noop();
    }

    if (config.jvmMetricsEnabled()) {
      MicrometerConfig.bindJvmMetrics(registry);
      log.info("JVM metrics enabled");
    }

    if (registry instanceof PrometheusMeterRegistry prometheusRegistry) {
      new PrometheusHandler(prometheusRegistry, appConfig.metricsPath()).registerRoutes(router);
    }
    return new InvestigationMetrics(registry);
  }
}
