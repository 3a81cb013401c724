package io.github.themoah.edgepulse.identity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.edgepulse.model.TrafficCategory;
import java.time.Instant;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AnomalyIdGenerator.
 */
public class AnomalyIdGeneratorTest {

  private static final String TIME_FILTER =
    "toStartOfMinute(timestamp) BETWEEN toStartOfMinute(toDateTime('2025-01-15 12:00:00') - INTERVAL 1 HOUR)"
      + " AND toStartOfMinute(toDateTime('2025-01-15 12:00:00'))";
  private static final String HOST_FILTER = "AND `request.host` = 'www.example.com'";
  private static final Instant START = Instant.parse("2025-01-15T11:20:00Z");
  private static final Instant END = Instant.parse("2025-01-15T11:25:00Z");

  @Test
  void generateId_knownValues() {
    assertEquals("speedy-claret-thunderbird",
      AnomalyIdGenerator.generateId(TIME_FILTER, HOST_FILTER, START, END, TrafficCategory.RED));
    assertEquals("speedy-caramel-outback",
      AnomalyIdGenerator.generateId(TIME_FILTER, HOST_FILTER, START, END, TrafficCategory.YELLOW));
    assertEquals("speedy-pine-impala",
      AnomalyIdGenerator.generateId(TIME_FILTER, HOST_FILTER, START, END, TrafficCategory.GREEN));
  }

  @Test
  void generateId_emptyFilterString() {
    assertEquals("crimson-wine-safari",
      AnomalyIdGenerator.generateId(TIME_FILTER, "", START, END, TrafficCategory.RED));
  }

  @Test
  void generateId_nullFilterSameAsEmpty() {
    assertEquals(
      AnomalyIdGenerator.generateId(TIME_FILTER, "", START, END, TrafficCategory.RED),
      AnomalyIdGenerator.generateId(TIME_FILTER, null, START, END, TrafficCategory.RED));
  }

  @Test
  void generateId_stableWithinSameMinute() {
    String id = AnomalyIdGenerator.generateId(TIME_FILTER, HOST_FILTER, START, END, TrafficCategory.RED);

    assertEquals(id, AnomalyIdGenerator.generateId(TIME_FILTER, HOST_FILTER,
      START.minusSeconds(15), END.plusSeconds(29), TrafficCategory.RED));
    assertNotEquals(id, AnomalyIdGenerator.generateId(TIME_FILTER, HOST_FILTER,
      START, END.plusSeconds(30), TrafficCategory.RED));
  }

  @Test
  void generateId_categoryOnlyChangesColor() {
    String red = AnomalyIdGenerator.generateId(TIME_FILTER, HOST_FILTER, START, END, TrafficCategory.RED);
    String green = AnomalyIdGenerator.generateId(TIME_FILTER, HOST_FILTER, START, END, TrafficCategory.GREEN);

    assertEquals(red.split("-")[0], green.split("-")[0]);
    assertTrue(CarWords.RED_COLORS.contains(red.split("-")[1]));
    assertTrue(CarWords.COOL_COLORS.contains(green.split("-")[1]));
  }

  @Test
  void colorsFor_palettes() {
    assertSame(CarWords.RED_COLORS, AnomalyIdGenerator.colorsFor(TrafficCategory.RED));
    assertSame(CarWords.ORANGE_COLORS, AnomalyIdGenerator.colorsFor(TrafficCategory.YELLOW));
    assertSame(CarWords.COOL_COLORS, AnomalyIdGenerator.colorsFor(TrafficCategory.GREEN));
    assertSame(CarWords.COOL_COLORS, AnomalyIdGenerator.colorsFor(TrafficCategory.SELECTION));
  }

  @Test
  void wordTables_sizes() {
    assertEquals(81, CarWords.ADJECTIVES.size());
    assertEquals(20, CarWords.RED_COLORS.size());
    assertEquals(28, CarWords.ORANGE_COLORS.size());
    assertEquals(27, CarWords.COOL_COLORS.size());
    assertEquals(73, CarWords.MODELS.size());
  }

  @Test
  void simpleHash_matchesPolynomialHash() {
    assertEquals(97, AnomalyIdGenerator.simpleHash("a"));
    assertEquals(0, AnomalyIdGenerator.simpleHash(""));
    assertEquals(1635523309L, AnomalyIdGenerator.simpleHash(String.join("|",
      TIME_FILTER, HOST_FILTER, "2025-01-15T11:20:00.000Z", "2025-01-15T11:25:00.000Z")));
  }

  @Test
  void cacheKey_base36() {
    assertEquals("fs92ah", AnomalyIdGenerator.cacheKey(TIME_FILTER, ""));
    assertEquals("vhwebv", AnomalyIdGenerator.cacheKey(TIME_FILTER, "AND (`request.host` LIKE '%example%')"));
    // hash("|") = 124
    assertEquals("3g", AnomalyIdGenerator.cacheKey("", ""));
  }

  @Test
  void roundToMinute_halfUp() {
    assertEquals("2025-01-15T11:20:00.000Z", AnomalyIdGenerator.roundToMinute(Instant.parse("2025-01-15T11:20:29.999Z")));
    assertEquals("2025-01-15T11:21:00.000Z", AnomalyIdGenerator.roundToMinute(Instant.parse("2025-01-15T11:20:30Z")));
    assertEquals("2025-01-16T00:00:00.000Z", AnomalyIdGenerator.roundToMinute(Instant.parse("2025-01-15T23:59:45Z")));
  }
}
