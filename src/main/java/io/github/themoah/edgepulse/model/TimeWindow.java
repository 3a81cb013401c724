package io.github.themoah.edgepulse.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Closed time interval used for anomaly windows, selections and the full analysis range.
 *
 * @param start window start
 * @param end window end, not before start
 */
public record TimeWindow(Instant start, Instant end) {

  private static final double MILLIS_PER_MINUTE = 60_000.0;

  public TimeWindow {
    Objects.requireNonNull(start, "start cannot be null");
    Objects.requireNonNull(end, "end cannot be null");
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("Window end " + end + " is before start " + start);
    }
  }

  public Duration duration() {
    return Duration.between(start, end);
  }

  public double minutes() {
    return duration().toMillis() / MILLIS_PER_MINUTE;
  }
}
