package io.github.themoah.twindrift;

import io.github.themoah.twindrift.model.MetricSeries;
import io.github.themoah.twindrift.model.TimeSeriesPoint;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds hourly metric series for tests.
 */
public final class SeriesFixtures {

  public static final Instant START = Instant.parse("2024-03-01T00:00:00Z");

  private SeriesFixtures() {}

  /**
   * Creates a series with one point per hour starting at {@link #START}.
   */
  public static MetricSeries hourly(String name, double... values) {
    List<TimeSeriesPoint> points = new ArrayList<>(values.length);
    for (int i = 0; i < values.length; i++) {
      points.add(TimeSeriesPoint.of(START.plus(Duration.ofHours(i)), values[i]));
    }
    return MetricSeries.of(name, points);
  }

  public static MetricSeries empty(String name) {
    return MetricSeries.of(name, List.of());
  }
}
