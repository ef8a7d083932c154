package io.github.themoah.twindrift.model;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.util.List;

/**
 * Aggregated outcome of comparing a twin series against its baseline.
 *
 * @param detected true if any of the three checks flagged a divergence
 * @param twinName name of the twin series
 * @param baselineName name of the baseline series
 * @param confidenceCheck confidence-interval test result
 * @param earlyDeviation early-deviation check result
 * @param drift drift statistics
 * @param comparisons summary statistic comparisons (empty if either series is empty)
 * @param timestamp when the comparison was made
 */
public record DivergenceResult(
  boolean detected,
  String twinName,
  String baselineName,
  ConfidenceCheck confidenceCheck,
  DeviationCheck earlyDeviation,
  DriftMetrics drift,
  List<MetricComparison> comparisons,
  Instant timestamp
) {

  public DivergenceResult {
    comparisons = List.copyOf(comparisons);
  }

  public boolean confidenceIntervalExceeded() {
    return confidenceCheck.exceeded();
  }

  public boolean earlyDeviationDetected() {
    return earlyDeviation.detected();
  }

  public double driftScore() {
    return drift.driftScore();
  }

  /**
   * Converts to JSON for downstream consumers.
   *
   * @return JsonObject representation
   */
  public JsonObject toJson() {
    JsonArray comparisonsJson = new JsonArray();
    comparisons.forEach(comparison -> comparisonsJson.add(comparison.toJson()));

    return new JsonObject()
      .put("detected", detected)
      .put("twin", twinName)
      .put("baseline", baselineName)
      .put("confidenceIntervalExceeded", confidenceIntervalExceeded())
      .put("earlyDeviationDetected", earlyDeviationDetected())
      .put("driftScore", driftScore())
      .put("confidenceCheck", confidenceCheck.toJson())
      .put("earlyDeviation", earlyDeviation.toJson())
      .put("drift", drift.toJson())
      .put("comparisons", comparisonsJson)
      .put("timestamp", timestamp.toString());
  }
}
