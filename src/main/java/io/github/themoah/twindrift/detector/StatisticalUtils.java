package io.github.themoah.twindrift.detector;

import java.util.Arrays;

/**
 * Statistical primitives used by divergence detection.
 *
 * <p>Every method returns 0 instead of NaN or Infinity for degenerate input
 * (empty arrays, zero variance, zero denominators).
 *
 * <p>Sums that overflow are recomputed on values scaled by the largest magnitude,
 * so mean, standard deviation and standard error stay finite for any finite input.
 * Callers that subtract two series pointwise need inputs within
 * ±{@code Double.MAX_VALUE / 2} for the differences themselves to be finite.
 */
public final class StatisticalUtils {

  private StatisticalUtils() {}

  /**
   * Divides numerator by denominator, returning 0 when the denominator is zero
   * or the quotient is not finite.
   */
  public static double safeDivide(double numerator, double denominator) {
    if (denominator == 0.0) {
      return 0.0;
    }
    double result = numerator / denominator;
    return Double.isFinite(result) ? result : 0.0;
  }

  /**
   * Arithmetic mean.
   *
   * @param values the values
   * @return mean, or 0 for an empty array
   */
  public static double mean(double[] values) {
    if (values.length == 0) {
      return 0.0;
    }
    double sum = 0.0;
    for (double value : values) {
      sum += value;
    }
    if (Double.isFinite(sum)) {
      return sum / values.length;
    }

    double scale = maxMagnitude(values, 0.0);
    double scaledSum = 0.0;
    for (double value : values) {
      scaledSum += value / scale;
    }
    return scaledSum / values.length * scale;
  }

  /**
   * Population standard deviation (divide by n, not n-1).
   *
   * @param values the values
   * @return standard deviation, or 0 for an empty array
   */
  public static double stdDev(double[] values) {
    return stdDev(values, mean(values));
  }

  /**
   * Population standard deviation around a precomputed mean.
   *
   * @param values the values
   * @param mean the mean to measure deviations from
   * @return standard deviation, or 0 for an empty array
   */
  public static double stdDev(double[] values, double mean) {
    if (values.length == 0) {
      return 0.0;
    }
    double sumSquaredDiffs = 0.0;
    for (double value : values) {
      double diff = value - mean;
      sumSquaredDiffs += diff * diff;
    }
    if (Double.isFinite(sumSquaredDiffs)) {
      return Math.sqrt(sumSquaredDiffs / values.length);
    }

    double scale = maxMagnitude(values, mean);
    double scaledMean = mean / scale;
    double scaledSum = 0.0;
    for (double value : values) {
      double diff = value / scale - scaledMean;
      scaledSum += diff * diff;
    }
    return Math.sqrt(scaledSum / values.length) * scale;
  }

  /**
   * Root mean square of the values, 0 for an empty array.
   */
  public static double rootMeanSquare(double[] values) {
    return stdDev(values, 0.0);
  }

  /**
   * Calculates the z-score for a value.
   *
   * @param value the value
   * @param mean the mean
   * @param stdDev the standard deviation
   * @return (value - mean) / stdDev, or 0 if stdDev is zero
   */
  public static double zScore(double value, double mean, double stdDev) {
    return safeDivide(value - mean, stdDev);
  }

  /**
   * Standard error of the difference between two sample means.
   *
   * @return sqrt(stdDev1^2 / n1 + stdDev2^2 / n2), or 0 if either sample is empty
   */
  public static double standardError(double stdDev1, int n1, double stdDev2, int n2) {
    if (n1 == 0 || n2 == 0) {
      return 0.0;
    }
    double standardError = Math.sqrt((stdDev1 * stdDev1) / n1 + (stdDev2 * stdDev2) / n2);
    if (Double.isFinite(standardError)) {
      return standardError;
    }
    return Math.hypot(stdDev1 / Math.sqrt(n1), stdDev2 / Math.sqrt(n2));
  }

  /**
   * Maps a confidence level to a two-sided critical z-value.
   *
   * <p>Discrete lookup over the supported levels, not an inverse normal CDF.
   * Levels below 0.80 fall back to the 95% value.
   *
   * @param confidence confidence level, e.g. 0.95
   * @return critical z-value
   */
  public static double zValueForConfidence(double confidence) {
    if (confidence >= 0.99) {
      return 2.576;
    }
    if (confidence >= 0.95) {
      return 1.96;
    }
    if (confidence >= 0.90) {
      return 1.645;
    }
    if (confidence >= 0.85) {
      return 1.44;
    }
    if (confidence >= 0.80) {
      return 1.28;
    }
    return 1.96;
  }

  /**
   * Pearson correlation over the first min(x.length, y.length) elements.
   *
   * @return correlation in [-1, 1], or 0 if there are no elements or either side has no variance
   */
  public static double correlation(double[] x, double[] y) {
    int n = Math.min(x.length, y.length);
    if (n == 0) {
      return 0.0;
    }

    double meanX = mean(Arrays.copyOf(x, n));
    double meanY = mean(Arrays.copyOf(y, n));

    double covariance = 0.0;
    double varianceX = 0.0;
    double varianceY = 0.0;
    for (int i = 0; i < n; i++) {
      double dx = x[i] - meanX;
      double dy = y[i] - meanY;
      covariance += dx * dy;
      varianceX += dx * dx;
      varianceY += dy * dy;
    }

    if (varianceX == 0.0 || varianceY == 0.0) {
      return 0.0;
    }
    double r = safeDivide(covariance, Math.sqrt(varianceX * varianceY));
    // Rounding can push |r| marginally past 1
    return Math.max(-1.0, Math.min(1.0, r));
  }

  public static double min(double[] values) {
    if (values.length == 0) {
      return 0.0;
    }
    double min = values[0];
    for (double value : values) {
      min = Math.min(min, value);
    }
    return min;
  }

  public static double max(double[] values) {
    if (values.length == 0) {
      return 0.0;
    }
    double max = values[0];
    for (double value : values) {
      max = Math.max(max, value);
    }
    return max;
  }

  // Largest magnitude among the values and the extra term, never 0
  private static double maxMagnitude(double[] values, double extra) {
    double scale = Math.abs(extra);
    for (double value : values) {
      scale = Math.max(scale, Math.abs(value));
    }
    return scale == 0.0 ? 1.0 : scale;
  }

  /**
   * Clamps a value to [lower, upper].
   */
  public static double clamp(double value, double lower, double upper) {
    return Math.max(lower, Math.min(upper, value));
  }
}
