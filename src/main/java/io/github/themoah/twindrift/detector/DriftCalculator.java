package io.github.themoah.twindrift.detector;

import io.github.themoah.twindrift.model.DriftMetrics;
import io.github.themoah.twindrift.model.TrendDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes index-aligned drift statistics between twin and baseline values.
 *
 * <p>Deviations are paired by position, not by timestamp: callers must supply
 * co-sampled series. The longer series is truncated to the shorter one.
 */
public final class DriftCalculator {

  private static final Logger log = LoggerFactory.getLogger(DriftCalculator.class);

  static final double MAD_WEIGHT = 0.4;
  static final double RMSD_WEIGHT = 0.4;
  static final double DISSIMILARITY_WEIGHT = 0.2;
  static final double TREND_THRESHOLD_RATIO = 0.01;

  private DriftCalculator() {}

  /**
   * Calculates drift metrics for the aligned prefix of both value arrays.
   *
   * @param twin twin values in series order
   * @param baseline baseline values in series order
   * @return drift metrics, zeroed with STABLE trend if either array is empty
   */
  public static DriftMetrics calculate(double[] twin, double[] baseline) {
    int n = Math.min(twin.length, baseline.length);
    if (n == 0) {
      return DriftMetrics.empty();
    }

    double[] deviations = new double[n];
    double[] absDeviations = new double[n];
    double maxDeviation = 0.0;
    for (int i = 0; i < n; i++) {
      double d = twin[i] - baseline[i];
      deviations[i] = d;
      absDeviations[i] = Math.abs(d);
      maxDeviation = Math.max(maxDeviation, absDeviations[i]);
    }

    double mad = StatisticalUtils.mean(absDeviations);
    double rmsd = StatisticalUtils.rootMeanSquare(deviations);
    double correlation = StatisticalUtils.correlation(twin, baseline);
    TrendDirection trend = trendDirection(deviations, mad);
    double score = driftScore(mad, rmsd, correlation, baseline);

    log.debug("Drift over {} aligned points: mad={}, rmsd={}, max={}, correlation={}, trend={}, score={}",
      n, String.format("%.4f", mad), String.format("%.4f", rmsd), String.format("%.4f", maxDeviation),
      String.format("%.4f", correlation), trend.getValue(), String.format("%.4f", score));

    return new DriftMetrics(score, mad, rmsd, maxDeviation, correlation, trend);
  }

  /**
   * Blends normalized MAD, normalized RMSD and correlation dissimilarity into a score in [0, 1].
   *
   * <p>The normalizer is the baseline range, falling back to |baseline mean| and then to 1.
   * When MAD and RMSD are both zero the aligned values are identical, and the
   * dissimilarity term is dropped because the correlation is undefined for constant series.
   *
   * @param mad mean absolute deviation
   * @param rmsd root mean square deviation
   * @param correlation Pearson correlation of the aligned values
   * @param baseline baseline values used for normalization
   * @return drift score, or 0 for an empty baseline
   */
  static double driftScore(double mad, double rmsd, double correlation, double[] baseline) {
    if (baseline.length == 0) {
      return 0.0;
    }

    double normalizer = normalizer(baseline);
    double normalizedMad = Math.min(1.0, StatisticalUtils.safeDivide(mad, normalizer));
    double normalizedRmsd = Math.min(1.0, StatisticalUtils.safeDivide(rmsd, normalizer));
    double dissimilarity = (mad == 0.0 && rmsd == 0.0) ? 0.0 : 1.0 - Math.abs(correlation);

    double score = MAD_WEIGHT * normalizedMad
      + RMSD_WEIGHT * normalizedRmsd
      + DISSIMILARITY_WEIGHT * dissimilarity;
    return StatisticalUtils.clamp(score, 0.0, 1.0);
  }

  static double normalizer(double[] baseline) {
    double range = StatisticalUtils.max(baseline) - StatisticalUtils.min(baseline);
    if (range > 0.0) {
      return range;
    }
    double absMean = Math.abs(StatisticalUtils.mean(baseline));
    if (absMean > 0.0) {
      return absMean;
    }
    return 1.0;
  }

  /**
   * Classifies the least-squares slope of the deviations against their index.
   *
   * @param deviations pointwise twin-minus-baseline deviations
   * @param mad mean absolute deviation, scales the stability band
   * @return INCREASING or DECREASING when the slope leaves the band of 1% of MAD, else STABLE
   */
  static TrendDirection trendDirection(double[] deviations, double mad) {
    if (deviations.length < 2) {
      return TrendDirection.STABLE;
    }

    // Ordinary least squares of (i, d[i]):
    //   m = (Σ(i × dᵢ) - n × mean_i × mean_d) / (Σ(i²) - n × mean_i²)
    int n = deviations.length;
    double sumX = 0.0;
    double sumY = 0.0;
    double sumXY = 0.0;
    double sumXSquared = 0.0;
    for (int i = 0; i < n; i++) {
      double x = i;
      double y = deviations[i];
      sumX += x;
      sumY += y;
      sumXY += x * y;
      sumXSquared += x * x;
    }

    double meanX = sumX / n;
    double meanY = sumY / n;
    double numerator = sumXY - n * meanX * meanY;
    double denominator = sumXSquared - n * meanX * meanX;
    double slope = StatisticalUtils.safeDivide(numerator, denominator);

    double threshold = TREND_THRESHOLD_RATIO * mad;
    if (slope > threshold) {
      return TrendDirection.INCREASING;
    }
    if (slope < -threshold) {
      return TrendDirection.DECREASING;
    }
    return TrendDirection.STABLE;
  }
}
