package io.github.themoah.edgepulse.investigation;

import io.github.themoah.edgepulse.model.TimeWindow;
import io.github.themoah.edgepulse.model.TrafficCategory;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * SQL fragments shared by the facet queries. Filters are minute aligned so ClickHouse can
 * answer from minute-level projections.
 */
final class FacetQueries {

  private static final DateTimeFormatter SQL_DATE_TIME =
    DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

  private FacetQueries() {
  }

  /**
   * Row filter for the whole analysed range, end exclusive. Used when the scope carries
   * no time filter of its own.
   */
  static String timeFilter(TimeWindow range) {
    return "toStartOfMinute(timestamp) BETWEEN toStartOfMinute(toDateTime('" + format(range.start())
      + "')) AND toStartOfMinute(toDateTime('" + format(lastIncluded(range)) + "'))";
  }

  /**
   * Condition on the inner {@code minute} column selecting the minutes of a window.
   * The window end is exclusive.
   */
  static String minuteFilter(TimeWindow window) {
    return "minute BETWEEN toStartOfMinute(toDateTime('" + format(window.start())
      + "')) AND toStartOfMinute(toDateTime('" + format(lastIncluded(window)) + "'))";
  }

  /**
   * Column of the inner query that counts the anomaly's category.
   */
  static String categoryCountColumn(TrafficCategory category) {
    return switch (category) {
      case RED -> "cnt_5xx";
      case YELLOW -> "cnt_4xx";
      case GREEN -> "cnt_ok";
      default -> "cnt";
    };
  }

  private static Instant lastIncluded(TimeWindow window) {
    return window.end().isAfter(window.start()) ? window.end().minusSeconds(1) : window.end();
  }

  private static String format(Instant instant) {
    return SQL_DATE_TIME.format(instant);
  }
}
