package io.github.themoah.edgepulse.investigation;

import io.github.themoah.edgepulse.query.QueryCancelledException;
import io.github.themoah.edgepulse.query.QueryExecutor;
import io.github.themoah.edgepulse.query.QueryOptions;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * QueryExecutor answering from a function of the SQL text. Records every query it is asked
 * to run; honours pre-cancelled tokens like the real executor.
 */
class FakeQueryExecutor implements QueryExecutor {

  final List<String> queries = Collections.synchronizedList(new ArrayList<>());
  volatile Function<String, Future<List<JsonObject>>> responder = sql -> Future.succeededFuture(List.of());

  static FakeQueryExecutor returning(List<JsonObject> rows) {
    FakeQueryExecutor executor = new FakeQueryExecutor();
    executor.responder = sql -> Future.succeededFuture(rows);
    return executor;
  }

  @Override
  public Future<List<JsonObject>> runAggregation(String sql, QueryOptions options) {
    if (options.cancellation().isCancelled()) {
      return Future.failedFuture(new QueryCancelledException());
    }
    queries.add(sql);
    return responder.apply(sql);
  }

  @Override
  public Future<Void> ping() {
    return Future.succeededFuture();
  }
}
