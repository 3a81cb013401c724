package io.github.themoah.edgepulse.investigation;

import static io.github.themoah.edgepulse.detection.StatisticalUtils.roundOneDecimal;

import io.github.themoah.edgepulse.model.FacetContribution;
import io.github.themoah.edgepulse.model.TimeWindow;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns per-dimension window/baseline counts into ranked contributions.
 *
 * <p>Counts are normalized to rates per minute so windows of different length compare
 * fairly. The baseline is the analysed range minus the window. All reported values are
 * rounded to one decimal, and the significance rules apply to the rounded values.
 */
public final class ContributionAnalyzer {

  /** Maximum contributions returned per facet. */
  public static final int MAX_RESULTS = 5;

  static final double MIN_RATE_PER_MINUTE = 0.5;
  static final double MIN_CHANGE_POINTS = 5.0;

  private static final double MILLIS_PER_MINUTE = 60_000.0;

  private ContributionAnalyzer() {
  }

  /**
   * Analyses anomaly-mode rows ({@code dim, anomaly_cat_cnt, baseline_cat_cnt,
   * anomaly_total_cnt, baseline_total_cnt}).
   *
   * <p>Keeps values with a window rate above 0.5/min that got worse: their share of the
   * category grew by more than 5 points, or their own category rate grew by more than 5
   * points. Sorted by share change, descending.
   */
  public static List<FacetContribution> analyzeAnomaly(List<JsonObject> rows, TimeWindow window, TimeWindow fullRange) {
    double windowMinutes = window.minutes();
    double baselineMinutes = baselineMinutes(window, fullRange);

    long totalWindow = 0;
    long totalBaseline = 0;
    for (JsonObject row : rows) {
      totalWindow += count(row, "anomaly_cat_cnt");
      totalBaseline += count(row, "baseline_cat_cnt");
    }

    List<FacetContribution> analyzed = new ArrayList<>(rows.size());
    for (JsonObject row : rows) {
      long windowCnt = count(row, "anomaly_cat_cnt");
      long baselineCnt = count(row, "baseline_cat_cnt");
      long windowTotal = count(row, "anomaly_total_cnt");
      long baselineTotal = count(row, "baseline_total_cnt");

      double windowRate = rate(windowCnt, windowMinutes);
      double baselineRate = rate(baselineCnt, baselineMinutes);
      double shareChange = roundOneDecimal(percent(windowCnt, totalWindow) - percent(baselineCnt, totalBaseline));
      double errorRateChange = roundOneDecimal(percent(windowCnt, windowTotal) - percent(baselineCnt, baselineTotal));

      analyzed.add(new FacetContribution(
        dim(row),
        roundOneDecimal(windowRate),
        roundOneDecimal(baselineRate),
        roundOneDecimal(rateChange(windowRate, baselineRate)),
        roundOneDecimal(percent(windowCnt, totalWindow)),
        roundOneDecimal(percent(baselineCnt, totalBaseline)),
        shareChange,
        errorRateChange,
        0.0,
        shareChange,
        Math.abs(shareChange)
      ));
    }

    return analyzed.stream()
      .filter(c -> c.windowRate() > MIN_RATE_PER_MINUTE
        && (c.shareChange() > MIN_CHANGE_POINTS || c.errorRateChange() > MIN_CHANGE_POINTS))
      .sorted(Comparator.comparingDouble(FacetContribution::shareChange).reversed())
      .limit(MAX_RESULTS)
      .collect(Collectors.toList());
  }

  /**
   * Analyses selection-mode rows ({@code dim, selection_cnt, baseline_cnt,
   * selection_err_cnt, baseline_err_cnt}).
   *
   * <p>Changes count in either direction. Keeps values with volume (0.5/min inside or
   * outside the selection) where traffic share, error share or error rate moved by more
   * than 5 points. The largest of the three magnitudes orders the result.
   */
  public static List<FacetContribution> analyzeSelection(List<JsonObject> rows, TimeWindow selection, TimeWindow fullRange) {
    double selectionMinutes = selection.minutes();
    double baselineMinutes = baselineMinutes(selection, fullRange);

    long totalSelection = 0;
    long totalBaseline = 0;
    long totalSelectionErr = 0;
    long totalBaselineErr = 0;
    for (JsonObject row : rows) {
      totalSelection += count(row, "selection_cnt");
      totalBaseline += count(row, "baseline_cnt");
      totalSelectionErr += count(row, "selection_err_cnt");
      totalBaselineErr += count(row, "baseline_err_cnt");
    }

    List<FacetContribution> significant = new ArrayList<>();
    for (JsonObject row : rows) {
      long selectionCnt = count(row, "selection_cnt");
      long baselineCnt = count(row, "baseline_cnt");
      long selectionErr = count(row, "selection_err_cnt");
      long baselineErr = count(row, "baseline_err_cnt");

      double selectionRate = roundOneDecimal(rate(selectionCnt, selectionMinutes));
      double baselineRate = roundOneDecimal(rate(baselineCnt, baselineMinutes));
      double shareChange = roundOneDecimal(percent(selectionCnt, totalSelection) - percent(baselineCnt, totalBaseline));
      double errShareChange = roundOneDecimal(
        percent(selectionErr, totalSelectionErr) - percent(baselineErr, totalBaselineErr));
      double errRateChange = roundOneDecimal(percent(selectionErr, selectionCnt) - percent(baselineErr, baselineCnt));

      boolean hasVolume = selectionRate > MIN_RATE_PER_MINUTE || baselineRate > MIN_RATE_PER_MINUTE;
      double maxChange = Math.max(Math.abs(shareChange), Math.max(Math.abs(errShareChange), Math.abs(errRateChange)));
      if (!hasVolume || maxChange <= MIN_CHANGE_POINTS) {
        continue;
      }

      significant.add(new FacetContribution(
        dim(row),
        selectionRate,
        baselineRate,
        roundOneDecimal(rateChange(rate(selectionCnt, selectionMinutes), rate(baselineCnt, baselineMinutes))),
        roundOneDecimal(percent(selectionCnt, totalSelection)),
        roundOneDecimal(percent(baselineCnt, totalBaseline)),
        shareChange,
        errRateChange,
        errShareChange,
        dominant(shareChange, errShareChange, errRateChange),
        maxChange
      ));
    }

    return significant.stream()
      .sorted(Comparator.comparingDouble(FacetContribution::maxChange).reversed())
      .limit(MAX_RESULTS)
      .collect(Collectors.toList());
  }

  /**
   * Signed value with the largest magnitude; the earliest wins ties.
   */
  static double dominant(double... values) {
    double best = 0.0;
    for (double value : values) {
      if (Math.abs(value) > Math.abs(best)) {
        best = value;
      }
    }
    return best;
  }

  /**
   * Percent change of the rate; {@link Double#POSITIVE_INFINITY} when the value is new
   * during the window, 0 when it has no traffic at all.
   */
  static double rateChange(double windowRate, double baselineRate) {
    if (baselineRate > 0) {
      return (windowRate - baselineRate) / baselineRate * 100;
    }
    return windowRate > 0 ? Double.POSITIVE_INFINITY : 0.0;
  }

  /**
   * Reads a count column. ClickHouse quotes 64-bit integers in JSON output, so both
   * numbers and numeric strings are accepted; anything else counts as 0.
   */
  static long count(JsonObject row, String field) {
    Object value = row.getValue(field);
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    if (value instanceof String) {
      try {
        return Long.parseLong(((String) value).trim());
      } catch (NumberFormatException e) {
        return 0L;
      }
    }
    return 0L;
  }

  private static String dim(JsonObject row) {
    Object value = row.getValue("dim");
    return value == null ? "" : String.valueOf(value);
  }

  private static double baselineMinutes(TimeWindow window, TimeWindow fullRange) {
    long baselineMillis = fullRange.duration().toMillis() - window.duration().toMillis();
    return baselineMillis / MILLIS_PER_MINUTE;
  }

  private static double rate(long count, double minutes) {
    return minutes > 0 ? count / minutes : 0.0;
  }

  private static double percent(long part, long total) {
    return total > 0 ? (double) part / total * 100 : 0.0;
  }
}
