package io.github.themoah.edgepulse.query;

/**
 * Raised when a query's cancellation token was cancelled before its result was delivered.
 */
public class QueryCancelledException extends QueryException {

  public QueryCancelledException() {
    super("Query cancelled");
  }
}
