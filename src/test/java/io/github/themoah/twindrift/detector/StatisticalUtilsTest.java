package io.github.themoah.twindrift.detector;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for StatisticalUtils.
 */
public class StatisticalUtilsTest {

  private static final double DELTA = 1e-9;

  @Test
  void mean_emptyIsZero() {
    assertEquals(0.0, StatisticalUtils.mean(new double[0]));
  }

  @Test
  void mean_arithmetic() {
    assertEquals(2.5, StatisticalUtils.mean(new double[] {1, 2, 3, 4}), DELTA);
  }

  @Test
  void stdDev_population() {
    // Classic example: population stddev of this set is exactly 2
    double[] values = {2, 4, 4, 4, 5, 5, 7, 9};
    assertEquals(2.0, StatisticalUtils.stdDev(values), DELTA);
    assertEquals(2.0, StatisticalUtils.stdDev(values, 5.0), DELTA);
  }

  @Test
  void stdDev_emptyIsZero() {
    assertEquals(0.0, StatisticalUtils.stdDev(new double[0]));
  }

  @Test
  void mean_sumBeyondDoubleRange_staysFinite() {
    assertEquals(1e308, StatisticalUtils.mean(new double[] {1e308, 1e308}));
    assertEquals(1e308, StatisticalUtils.mean(new double[] {1e308, 1e308, 1e308}), 1e293);
  }

  @Test
  void stdDev_squaredDiffsBeyondDoubleRange_staysFinite() {
    assertEquals(1e308, StatisticalUtils.stdDev(new double[] {1e308, -1e308}));
    assertEquals(0.0, StatisticalUtils.stdDev(new double[] {1e308, 1e308}));
  }

  @Test
  void rootMeanSquare_largeDeviations() {
    assertEquals(Math.sqrt(12.5), StatisticalUtils.rootMeanSquare(new double[] {3, -4}), DELTA);
    assertEquals(2e200, StatisticalUtils.rootMeanSquare(new double[] {2e200, -2e200}), 1e186);
    assertEquals(0.0, StatisticalUtils.rootMeanSquare(new double[0]));
  }

  @Test
  void zScore_zeroStdDev_returnsZero() {
    assertEquals(0.0, StatisticalUtils.zScore(5.0, 3.0, 0.0));
    assertEquals(1.0, StatisticalUtils.zScore(7.0, 5.0, 2.0), DELTA);
    assertEquals(-1.5, StatisticalUtils.zScore(2.0, 5.0, 2.0), DELTA);
  }

  @Test
  void standardError_combinesBothSamples() {
    assertEquals(Math.sqrt(2.0), StatisticalUtils.standardError(2.0, 4, 3.0, 9), DELTA);
  }

  @Test
  void standardError_hugeStdDevs_staysFinite() {
    double standardError = StatisticalUtils.standardError(1e308, 1, 1e308, 1);
    assertEquals(Math.sqrt(2.0) * 1e308, standardError, 1e294);
  }

  @Test
  void standardError_emptySample_returnsZero() {
    assertEquals(0.0, StatisticalUtils.standardError(2.0, 0, 3.0, 9));
    assertEquals(0.0, StatisticalUtils.standardError(2.0, 4, 3.0, 0));
  }

  @Test
  void zValueForConfidence_lookupTable() {
    assertEquals(2.576, StatisticalUtils.zValueForConfidence(0.99));
    assertEquals(1.96, StatisticalUtils.zValueForConfidence(0.95));
    assertEquals(1.645, StatisticalUtils.zValueForConfidence(0.90));
    assertEquals(1.44, StatisticalUtils.zValueForConfidence(0.85));
    assertEquals(1.28, StatisticalUtils.zValueForConfidence(0.80));
    assertEquals(1.96, StatisticalUtils.zValueForConfidence(0.5));
  }

  @Test
  void zValueForConfidence_betweenLevels_usesLowerLevel() {
    assertEquals(2.576, StatisticalUtils.zValueForConfidence(0.999));
    assertEquals(1.96, StatisticalUtils.zValueForConfidence(0.97));
    assertEquals(1.645, StatisticalUtils.zValueForConfidence(0.92));
    assertEquals(1.28, StatisticalUtils.zValueForConfidence(0.81));
    assertEquals(1.96, StatisticalUtils.zValueForConfidence(0.79));
  }

  @Test
  void correlation_perfectPositiveAndNegative() {
    double[] x = {1, 2, 3, 4, 5};
    assertEquals(1.0, StatisticalUtils.correlation(x, new double[] {2, 4, 6, 8, 10}), DELTA);
    assertEquals(-1.0, StatisticalUtils.correlation(x, new double[] {5, 4, 3, 2, 1}), DELTA);
  }

  @Test
  void correlation_zeroVariance_returnsZero() {
    assertEquals(0.0, StatisticalUtils.correlation(new double[] {1, 2, 3}, new double[] {7, 7, 7}));
    assertEquals(0.0, StatisticalUtils.correlation(new double[] {7, 7, 7}, new double[] {1, 2, 3}));
  }

  @Test
  void correlation_empty_returnsZero() {
    assertEquals(0.0, StatisticalUtils.correlation(new double[0], new double[] {1, 2}));
  }

  @Test
  void correlation_truncatesLongerSeries() {
    // 100 is beyond the shorter series and must be ignored
    double[] x = {1, 2, 3, 100};
    double[] y = {2, 4, 6};
    assertEquals(1.0, StatisticalUtils.correlation(x, y), DELTA);
  }

  @Test
  void safeDivide_guardsZeroAndOverflow() {
    assertEquals(0.0, StatisticalUtils.safeDivide(1.0, 0.0));
    assertEquals(0.0, StatisticalUtils.safeDivide(1.0, 1e-320));
    assertEquals(2.5, StatisticalUtils.safeDivide(5.0, 2.0), DELTA);
  }

  @Test
  void minMax_emptyIsZero() {
    assertEquals(0.0, StatisticalUtils.min(new double[0]));
    assertEquals(0.0, StatisticalUtils.max(new double[0]));
    assertEquals(-3.0, StatisticalUtils.min(new double[] {4, -3, 8}));
    assertEquals(8.0, StatisticalUtils.max(new double[] {4, -3, 8}));
  }
}
