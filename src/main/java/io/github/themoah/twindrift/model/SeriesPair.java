package io.github.themoah.twindrift.model;

import java.util.Objects;

/**
 * A twin series paired with the baseline it should be compared against.
 */
public record SeriesPair(MetricSeries twin, MetricSeries baseline) {

  public SeriesPair {
    Objects.requireNonNull(twin, "twin");
    Objects.requireNonNull(baseline, "baseline");
  }
}
