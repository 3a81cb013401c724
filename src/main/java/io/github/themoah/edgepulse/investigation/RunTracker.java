package io.github.themoah.edgepulse.investigation;

import io.github.themoah.edgepulse.query.CancellationToken;

/**
 * Generation counter for investigation runs. Beginning a run cancels the token of the
 * previous one, so its in-flight queries stop and its results can be recognised as stale.
 */
public class RunTracker {

  private long generation;
  private CancellationToken active;

  /**
   * A started run.
   *
   * @param generation generation number of the run
   * @param token cancellation token shared by the run's queries
   */
  public record Run(long generation, CancellationToken token) {
  }

  public synchronized Run begin() {
    if (active != null) {
      active.cancel();
    }
    generation++;
    active = new CancellationToken();
    return new Run(generation, active);
  }

  public synchronized boolean isCurrent(Run run) {
    return run.generation() == generation && !run.token().isCancelled();
  }

  /**
   * Cancels the active run, if any, without starting a new one.
   */
  public synchronized void cancel() {
    if (active != null) {
      active.cancel();
      active = null;
    }
    generation++;
  }

  public synchronized long generation() {
    return generation;
  }
}
