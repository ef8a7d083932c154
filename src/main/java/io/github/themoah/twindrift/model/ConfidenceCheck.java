package io.github.themoah.twindrift.model;

import io.vertx.core.json.JsonObject;

/**
 * Outcome of the two-sample confidence-interval test.
 *
 * @param exceeded true if the twin mean falls outside [lowerBound, upperBound]
 * @param twinMean mean of the twin values
 * @param baselineMean mean of the baseline values
 * @param lowerBound baselineMean minus the margin of error
 * @param upperBound baselineMean plus the margin of error
 * @param zScore (twinMean - baselineMean) / standardError, or 0 if the standard error is 0
 * @param standardError standard error of the difference of means
 */
public record ConfidenceCheck(
  boolean exceeded,
  double twinMean,
  double baselineMean,
  double lowerBound,
  double upperBound,
  double zScore,
  double standardError
) {

  public JsonObject toJson() {
    return new JsonObject()
      .put("exceeded", exceeded)
      .put("twinMean", twinMean)
      .put("baselineMean", baselineMean)
      .put("lowerBound", lowerBound)
      .put("upperBound", upperBound)
      .put("zScore", zScore)
      .put("standardError", standardError);
  }
}
