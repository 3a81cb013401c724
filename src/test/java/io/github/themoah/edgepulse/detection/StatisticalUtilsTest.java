package io.github.themoah.edgepulse.detection;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for StatisticalUtils.
 */
public class StatisticalUtilsTest {

  private static final double DELTA = 1e-9;

  @Test
  void median_oddCount() {
    assertEquals(3.0, StatisticalUtils.median(new double[]{5, 1, 3}, 0, 3), DELTA);
  }

  @Test
  void median_evenCount_averagesMiddlePair() {
    assertEquals(2.5, StatisticalUtils.median(new double[]{4, 1, 3, 2}, 0, 4), DELTA);
  }

  @Test
  void median_onlyLooksAtRange() {
    double[] values = {1000, 1, 2, 3, -1000};
    assertEquals(2.0, StatisticalUtils.median(values, 1, 4), DELTA);
  }

  @Test
  void median_emptyRange() {
    assertEquals(0.0, StatisticalUtils.median(new double[]{1, 2}, 1, 1), DELTA);
  }

  @Test
  void stdDev_isPopulationStdDev() {
    // mean 5, squared diffs sum 32, n = 8
    double[] values = {2, 4, 4, 4, 5, 5, 7, 9};
    assertEquals(2.0, StatisticalUtils.stdDev(values, 0, values.length), DELTA);
  }

  @Test
  void stdDev_constantValues_isZero() {
    assertEquals(0.0, StatisticalUtils.stdDev(new double[]{7, 7, 7}, 0, 3), DELTA);
  }

  @Test
  void deviationRatios_relativeToBaseline() {
    double[] ratios = StatisticalUtils.deviationRatios(new double[]{50, 100, 150}, 100);
    assertArrayEquals(new double[]{-0.5, 0.0, 0.5}, ratios, DELTA);
  }

  @Test
  void deviationRatios_zeroBaseline_allZeros() {
    double[] ratios = StatisticalUtils.deviationRatios(new double[]{0, 5, 0}, 0);
    assertArrayEquals(new double[]{0, 0, 0}, ratios, DELTA);
  }

  @Test
  void roundOneDecimal_halfUp() {
    assertEquals(1.3, StatisticalUtils.roundOneDecimal(1.25), DELTA);
    assertEquals(-1.2, StatisticalUtils.roundOneDecimal(-1.25), DELTA);
    assertEquals(Double.POSITIVE_INFINITY, StatisticalUtils.roundOneDecimal(Double.POSITIVE_INFINITY));
  }
}
