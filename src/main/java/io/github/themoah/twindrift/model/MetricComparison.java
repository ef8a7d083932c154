package io.github.themoah.twindrift.model;

import io.vertx.core.json.JsonObject;

/**
 * One summary statistic compared between twin and baseline.
 *
 * @param metric statistic name (mean, stddev, min, max)
 * @param twinValue statistic computed over the twin values
 * @param baselineValue statistic computed over the baseline values
 * @param deviation (twinValue - baselineValue) / |baselineValue|, 0 when the baseline value is 0
 */
public record MetricComparison(
  String metric,
  double twinValue,
  double baselineValue,
  double deviation
) {

  public JsonObject toJson() {
    return new JsonObject()
      .put("metric", metric)
      .put("twinValue", twinValue)
      .put("baselineValue", baselineValue)
      .put("deviation", deviation);
  }
}
