package io.github.themoah.edgepulse.query;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared by the queries of one investigation run.
 */
public class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  /** Token that is never cancelled. */
  public static CancellationToken none() {
    return new CancellationToken();
  }

  /**
   * Cancels the token.
   *
   * @return true if this call cancelled it, false if it already was
   */
  public boolean cancel() {
    return cancelled.compareAndSet(false, true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * @throws QueryCancelledException if the token is cancelled
   */
  public void throwIfCancelled() {
    if (cancelled.get()) {
      throw new QueryCancelledException();
    }
  }
}
