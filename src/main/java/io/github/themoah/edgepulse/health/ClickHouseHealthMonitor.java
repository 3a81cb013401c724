package io.github.themoah.edgepulse.health;

import io.github.themoah.edgepulse.query.QueryExecutor;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks ClickHouse reachability with a periodic ping.
 */
public class ClickHouseHealthMonitor {

  private static final Logger log = LoggerFactory.getLogger(ClickHouseHealthMonitor.class);

  private static final long DEFAULT_INTERVAL_MS = 30_000L;

  private final Vertx vertx;
  private final QueryExecutor executor;
  private final long intervalMs;
  private final AtomicReference<HealthStatus> status;

  private Long timerId;

  public ClickHouseHealthMonitor(Vertx vertx, QueryExecutor executor) {
    this(vertx, executor, DEFAULT_INTERVAL_MS);
  }

  public ClickHouseHealthMonitor(Vertx vertx, QueryExecutor executor, long intervalMs) {
    this.vertx = vertx;
    this.executor = executor;
    this.intervalMs = intervalMs;
    this.status = new AtomicReference<>(HealthStatus.DOWN);
  }

  /**
   * Runs a first check and schedules the periodic one. Completes even when ClickHouse is
   * down, the readiness probe reports it.
   */
  public Future<Void> start() {
    log.info("Starting ClickHouse health monitor with interval: {}ms", intervalMs);

    return check()
      .onComplete(ar -> {
        timerId = vertx.setPeriodic(intervalMs, id -> check());
        log.info("ClickHouse health monitor started, timer ID: {}", timerId);
      })
      .otherwiseEmpty();
  }

  public Future<Void> stop() {
    log.info("Stopping ClickHouse health monitor");
    if (timerId != null) {
      vertx.cancelTimer(timerId);
      timerId = null;
    }
    status.set(HealthStatus.DOWN);
    return Future.succeededFuture();
  }

  public HealthStatus getClickHouseStatus() {
    return status.get();
  }

  public boolean isClickHouseReachable() {
    return status.get().isUp();
  }

  private Future<Void> check() {
    log.debug("Performing ClickHouse health check");

    return executor.ping()
      .onSuccess(v -> {
        HealthStatus previous = status.getAndSet(HealthStatus.UP);
        if (previous == HealthStatus.DOWN) {
          log.info("ClickHouse connection restored");
        } else {
          log.debug("ClickHouse health check passed");
        }
      })
      .onFailure(err -> {
        HealthStatus previous = status.getAndSet(HealthStatus.DOWN);
        if (previous == HealthStatus.UP) {
          log.warn("ClickHouse connection lost: {}", err.getMessage());
        } else {
          log.debug("ClickHouse health check failed: {}", err.getMessage());
        }
      });
  }
}
