package io.github.themoah.edgepulse.query;

/**
 * Failure of an aggregation query. The message carries the server's error text.
 */
public class QueryException extends RuntimeException {

  private final int statusCode;

  public QueryException(String message) {
    this(message, 0);
  }

  public QueryException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public QueryException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = 0;
  }

  /**
   * @return HTTP status of the failed request, 0 when no response was received
   */
  public int getStatusCode() {
    return statusCode;
  }
}
