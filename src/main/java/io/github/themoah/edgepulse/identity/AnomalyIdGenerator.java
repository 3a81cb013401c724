package io.github.themoah.edgepulse.identity;

import io.github.themoah.edgepulse.model.TrafficCategory;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Derives stable, human-readable ids such as {@code opulent-crimson-miata} for anomalies.
 *
 * <p>The id depends only on the time scope, the active filters and the anomaly window
 * rounded to the nearest minute, so re-detecting the same anomaly after a reload or a
 * small chart shift yields the same id. The category picks the color palette and is
 * therefore visible in the id, but it is not part of the hashed input.
 */
public final class AnomalyIdGenerator {

  private static final String SEPARATOR = "|";

  private static final DateTimeFormatter ISO_MILLIS =
    DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  private AnomalyIdGenerator() {
  }

  /**
   * Generates the id of an anomaly.
   *
   * @param timeFilter SQL time filter of the loaded range
   * @param filterString compiled facet filter SQL
   * @param start anomaly start
   * @param end anomaly end
   * @param category anomaly category, selects the color palette
   * @return three-word id joined by dashes
   */
  public static String generateId(
      String timeFilter,
      String filterString,
      Instant start,
      Instant end,
      TrafficCategory category) {

    String input = String.join(SEPARATOR,
      nullToEmpty(timeFilter),
      nullToEmpty(filterString),
      roundToMinute(start),
      roundToMinute(end));

    long hash = simpleHash(input);
    List<String> colors = colorsFor(category);
    int adjectiveCount = CarWords.ADJECTIVES.size();

    String adjective = CarWords.ADJECTIVES.get((int) (hash % adjectiveCount));
    String color = colors.get((int) ((hash / adjectiveCount) % colors.size()));
    String model = CarWords.MODELS.get(
      (int) ((hash / ((long) adjectiveCount * colors.size())) % CarWords.MODELS.size()));

    return adjective + "-" + color + "-" + model;
  }

  /**
   * Cache key suffix for a time and host scope, base-36 encoded.
   */
  public static String cacheKey(String timeFilter, String hostFilter) {
    return Long.toString(simpleHash(nullToEmpty(timeFilter) + SEPARATOR + nullToEmpty(hostFilter)), 36);
  }

  /**
   * 32-bit polynomial string hash ({@code h = 31 * h + c} over UTF-16 code units),
   * returned as its non-negative magnitude. {@code Integer.MIN_VALUE} maps to 2^31.
   */
  public static long simpleHash(String value) {
    return Math.abs((long) value.hashCode());
  }

  /**
   * Rounds to the nearest minute (30 seconds and above round up) and renders the result
   * as an ISO-8601 UTC timestamp with milliseconds.
   */
  public static String roundToMinute(Instant instant) {
    Instant floored = instant.truncatedTo(ChronoUnit.MINUTES);
    long secondOfMinute = instant.getEpochSecond() - floored.getEpochSecond();
    Instant rounded = secondOfMinute >= 30 ? floored.plus(1, ChronoUnit.MINUTES) : floored;
    return ISO_MILLIS.format(rounded);
  }

  static List<String> colorsFor(TrafficCategory category) {
    if (category == TrafficCategory.RED) {
      return CarWords.RED_COLORS;
    }
    if (category == TrafficCategory.YELLOW) {
      return CarWords.ORANGE_COLORS;
    }
    return CarWords.COOL_COLORS;
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
