package io.github.themoah.edgepulse.investigation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.edgepulse.model.FacetContribution;
import io.github.themoah.edgepulse.model.TimeWindow;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ContributionAnalyzer.
 */
public class ContributionAnalyzerTest {

  private static final double DELTA = 1e-9;
  private static final Instant RANGE_START = Instant.parse("2025-01-15T11:00:00Z");
  private static final TimeWindow FULL_RANGE = new TimeWindow(RANGE_START, RANGE_START.plusSeconds(3600));

  @Test
  void analyzeAnomaly_keepsValuesThatGotWorse() {
    TimeWindow window = new TimeWindow(RANGE_START.plusSeconds(600), RANGE_START.plusSeconds(900));
    List<JsonObject> rows = List.of(
      anomalyRow("a.com", 500, 550, 1000, 11000),
      anomalyRow("b.com", 100, 4950, 5000, 110000),
      anomalyRow("tiny.com", 1, 0, 10, 0));

    List<FacetContribution> result = ContributionAnalyzer.analyzeAnomaly(rows, window, FULL_RANGE);

    assertEquals(1, result.size());
    FacetContribution a = result.get(0);
    assertEquals("a.com", a.dim());
    assertEquals(100.0, a.windowRate(), DELTA);
    assertEquals(10.0, a.baselineRate(), DELTA);
    assertEquals(900.0, a.rateChange(), DELTA);
    assertEquals(83.2, a.windowShare(), DELTA);
    assertEquals(10.0, a.baselineShare(), DELTA);
    assertEquals(73.2, a.shareChange(), DELTA);
    assertEquals(45.0, a.errorRateChange(), DELTA);
    assertEquals(73.2, a.maxChange(), DELTA);
  }

  @Test
  void analyzeAnomaly_countsMayBeQuotedStrings() {
    TimeWindow window = new TimeWindow(RANGE_START.plusSeconds(600), RANGE_START.plusSeconds(900));
    JsonObject row = new JsonObject()
      .put("dim", "a.com")
      .put("anomaly_cat_cnt", "500")
      .put("baseline_cat_cnt", "550")
      .put("anomaly_total_cnt", "1000")
      .put("baseline_total_cnt", "11000");

    List<FacetContribution> result = ContributionAnalyzer.analyzeAnomaly(
      List.of(row, anomalyRow("b.com", 100, 4950, 5000, 110000)), window, FULL_RANGE);

    assertEquals(1, result.size());
    assertEquals(73.3, result.get(0).shareChange(), DELTA);
  }

  @Test
  void analyzeAnomaly_newValueHasInfiniteRateChange() {
    TimeWindow window = new TimeWindow(RANGE_START.plusSeconds(600), RANGE_START.plusSeconds(900));
    List<JsonObject> rows = List.of(
      anomalyRow("new.com", 300, 0, 300, 0),
      anomalyRow("old.com", 300, 5500, 3000, 55000));

    List<FacetContribution> result = ContributionAnalyzer.analyzeAnomaly(rows, window, FULL_RANGE);

    assertEquals("new.com", result.get(0).dim());
    assertTrue(result.get(0).newDuringWindow());
    assertTrue(result.get(0).toJson().containsKey("rateChange"));
    assertNull(result.get(0).toJson().getValue("rateChange"));
  }

  @Test
  void analyzeAnomaly_limitsToFiveSortedByShareChange() {
    TimeWindow window = new TimeWindow(RANGE_START.plusSeconds(600), RANGE_START.plusSeconds(900));
    List<JsonObject> rows = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      // every value gets 100% of its category in the window vs 0% before
      rows.add(anomalyRow("v" + i, 100 + i * 10, 0, 200, 1000));
    }
    rows.add(anomalyRow("bulk", 0, 10000, 0, 100000));

    List<FacetContribution> result = ContributionAnalyzer.analyzeAnomaly(rows, window, FULL_RANGE);

    assertEquals(ContributionAnalyzer.MAX_RESULTS, result.size());
    assertEquals("v7", result.get(0).dim());
    for (int i = 1; i < result.size(); i++) {
      assertTrue(result.get(i - 1).shareChange() >= result.get(i).shareChange());
    }
  }

  @Test
  void analyzeAnomaly_noRows() {
    TimeWindow window = new TimeWindow(RANGE_START.plusSeconds(600), RANGE_START.plusSeconds(900));

    assertTrue(ContributionAnalyzer.analyzeAnomaly(List.of(), window, FULL_RANGE).isEmpty());
  }

  @Test
  void analyzeSelection_changesInEitherDirection() {
    TimeWindow selection = new TimeWindow(RANGE_START.plusSeconds(600), RANGE_START.plusSeconds(1200));
    List<JsonObject> rows = List.of(
      selectionRow("x", 1000, 5000, 500, 50),
      selectionRow("y", 1000, 5000, 10, 50),
      selectionRow("z", 0, 100, 0, 0),
      selectionRow("q", 2, 10, 0, 0));

    List<FacetContribution> result = ContributionAnalyzer.analyzeSelection(rows, selection, FULL_RANGE);

    assertEquals(2, result.size());

    FacetContribution x = result.get(0);
    assertEquals("x", x.dim());
    assertEquals(0.5, x.shareChange(), DELTA);
    assertEquals(48.0, x.errShareChange(), DELTA);
    assertEquals(49.0, x.errorRateChange(), DELTA);
    assertEquals(49.0, x.dominantChange(), DELTA);
    assertEquals(49.0, x.maxChange(), DELTA);

    FacetContribution y = result.get(1);
    assertEquals("y", y.dim());
    assertEquals(-48.0, y.errShareChange(), DELTA);
    assertEquals(-48.0, y.dominantChange(), DELTA);
    assertEquals(48.0, y.maxChange(), DELTA);
  }

  @Test
  void dominant_earliestWinsTies() {
    assertEquals(-7.0, ContributionAnalyzer.dominant(-7.0, 7.0, 3.0), DELTA);
    assertEquals(0.0, ContributionAnalyzer.dominant(0.0, 0.0), DELTA);
  }

  @Test
  void rateChange_edgeCases() {
    assertEquals(100.0, ContributionAnalyzer.rateChange(20, 10), DELTA);
    assertEquals(Double.POSITIVE_INFINITY, ContributionAnalyzer.rateChange(5, 0));
    assertEquals(0.0, ContributionAnalyzer.rateChange(0, 0), DELTA);
  }

  @Test
  void count_toleratesJunk() {
    JsonObject row = new JsonObject().put("a", 3).put("b", " 42 ").put("c", "n/a");

    assertEquals(3, ContributionAnalyzer.count(row, "a"));
    assertEquals(42, ContributionAnalyzer.count(row, "b"));
    assertEquals(0, ContributionAnalyzer.count(row, "c"));
    assertEquals(0, ContributionAnalyzer.count(row, "missing"));
  }

  private static JsonObject anomalyRow(String dim, long window, long baseline, long windowTotal, long baselineTotal) {
    return new JsonObject()
      .put("dim", dim)
      .put("anomaly_cat_cnt", window)
      .put("baseline_cat_cnt", baseline)
      .put("anomaly_total_cnt", windowTotal)
      .put("baseline_total_cnt", baselineTotal);
  }

  private static JsonObject selectionRow(String dim, long selection, long baseline, long selectionErr, long baselineErr) {
    return new JsonObject()
      .put("dim", dim)
      .put("selection_cnt", selection)
      .put("baseline_cnt", baseline)
      .put("selection_err_cnt", selectionErr)
      .put("baseline_err_cnt", baselineErr);
  }
}
