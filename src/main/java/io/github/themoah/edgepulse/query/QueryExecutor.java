package io.github.themoah.edgepulse.query;

import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import java.util.List;

/**
 * Executes aggregation queries against the log store.
 * All methods return Vert.x Futures for async, non-blocking execution.
 */
public interface QueryExecutor {

  /**
   * Runs an aggregation query.
   *
   * @param sql the query, without a FORMAT clause
   * @param options cancellation and cache options
   * @return Future with one JsonObject per result row; fails with {@link QueryException},
   *         or {@link QueryCancelledException} once the token is cancelled
   */
  Future<List<JsonObject>> runAggregation(String sql, QueryOptions options);

  default Future<List<JsonObject>> runAggregation(String sql, CancellationToken cancellation) {
    return runAggregation(sql, QueryOptions.of(cancellation));
  }

  /**
   * Lightweight round trip used by readiness checks.
   *
   * @return Future that succeeds if the store answered
   */
  Future<Void> ping();

  /**
   * Releases client resources.
   */
  default Future<Void> close() {
    return Future.succeededFuture();
  }
}
