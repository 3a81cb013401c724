package io.github.themoah.edgepulse.investigation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for RunTracker.
 */
public class RunTrackerTest {

  @Test
  void begin_cancelsPreviousRun() {
    RunTracker tracker = new RunTracker();

    RunTracker.Run first = tracker.begin();
    assertTrue(tracker.isCurrent(first));

    RunTracker.Run second = tracker.begin();
    assertTrue(first.token().isCancelled());
    assertFalse(tracker.isCurrent(first));
    assertTrue(tracker.isCurrent(second));
    assertEquals(2, tracker.generation());
  }

  @Test
  void cancel_invalidatesActiveRunWithoutStartingOne() {
    RunTracker tracker = new RunTracker();
    RunTracker.Run run = tracker.begin();

    tracker.cancel();

    assertTrue(run.token().isCancelled());
    assertFalse(tracker.isCurrent(run));
    assertEquals(2, tracker.generation());
  }

  @Test
  void cancel_withoutRunOnlyAdvancesGeneration() {
    RunTracker tracker = new RunTracker();

    tracker.cancel();
    RunTracker.Run run = tracker.begin();

    assertEquals(2, run.generation());
    assertTrue(tracker.isCurrent(run));
  }
}
