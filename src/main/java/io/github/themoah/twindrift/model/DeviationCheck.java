package io.github.themoah.twindrift.model;

import io.vertx.core.json.JsonObject;

/**
 * Outcome of the early-deviation check over the most recent window.
 *
 * @param detected true if deviationPercent exceeds threshold
 * @param deviationPercent relative deviation of the twin window mean from the baseline window mean
 * @param windowHours window length the check was run with
 * @param twinWindowMean mean of the twin values inside the window
 * @param baselineWindowMean mean of the baseline values inside the window
 * @param threshold configured early deviation threshold
 */
public record DeviationCheck(
  boolean detected,
  double deviationPercent,
  double windowHours,
  double twinWindowMean,
  double baselineWindowMean,
  double threshold
) {

  public JsonObject toJson() {
    return new JsonObject()
      .put("detected", detected)
      .put("deviationPercent", deviationPercent)
      .put("windowHours", windowHours)
      .put("twinWindowMean", twinWindowMean)
      .put("baselineWindowMean", baselineWindowMean)
      .put("threshold", threshold);
  }
}
