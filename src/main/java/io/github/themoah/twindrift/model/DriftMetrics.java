package io.github.themoah.twindrift.model;

import io.vertx.core.json.JsonObject;

/**
 * Index-aligned drift statistics between a twin and a baseline series.
 *
 * @param driftScore composite score in [0, 1]
 * @param meanAbsoluteDeviation mean of |twin[i] - baseline[i]|
 * @param rootMeanSquareDeviation sqrt of the mean of (twin[i] - baseline[i])^2
 * @param maxDeviation largest |twin[i] - baseline[i]|
 * @param correlationCoefficient Pearson correlation of the aligned values
 * @param trendDirection direction of the deviation slope
 */
public record DriftMetrics(
  double driftScore,
  double meanAbsoluteDeviation,
  double rootMeanSquareDeviation,
  double maxDeviation,
  double correlationCoefficient,
  TrendDirection trendDirection
) {

  /**
   * Drift metrics for a pair with no aligned points.
   */
  public static DriftMetrics empty() {
    return new DriftMetrics(0.0, 0.0, 0.0, 0.0, 0.0, TrendDirection.STABLE);
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("driftScore", driftScore)
      .put("meanAbsoluteDeviation", meanAbsoluteDeviation)
      .put("rootMeanSquareDeviation", rootMeanSquareDeviation)
      .put("maxDeviation", maxDeviation)
      .put("correlationCoefficient", correlationCoefficient)
      .put("trendDirection", trendDirection.getValue());
  }
}
