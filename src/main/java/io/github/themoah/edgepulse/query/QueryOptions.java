package io.github.themoah.edgepulse.query;

import java.util.Objects;

/**
 * Per-query execution options.
 *
 * @param cancellation token checked before sending and before delivering the result
 * @param forceRefresh bypass the server-side query cache (short cache TTL)
 */
public record QueryOptions(CancellationToken cancellation, boolean forceRefresh) {

  public QueryOptions {
    Objects.requireNonNull(cancellation, "cancellation cannot be null");
  }

  public static QueryOptions of(CancellationToken cancellation) {
    return new QueryOptions(cancellation, false);
  }
}
