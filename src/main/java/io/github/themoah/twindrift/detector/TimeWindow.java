package io.github.themoah.twindrift.detector;

import io.github.themoah.twindrift.model.MetricSeries;
import io.github.themoah.twindrift.model.TimeSeriesPoint;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

/**
 * Helpers for extracting the recent part of a series.
 */
public final class TimeWindow {

  static final double HOURS_PER_DAY = 24.0;

  private TimeWindow() {}

  /**
   * Extracts the values whose timestamp lies in the trailing window [asOf - windowHours, asOf].
   * Points without a timestamp are never in a window.
   *
   * @param series the series, in ascending timestamp order
   * @param windowHours window length in hours
   * @param asOf end of the window
   * @return values inside the window, in series order
   */
  public static double[] valuesInWindow(MetricSeries series, double windowHours, Instant asOf) {
    Instant windowStart = asOf.minus(toDuration(windowHours));
    return series.data().stream()
      .filter(point -> isInWindow(point, windowStart, asOf))
      .mapToDouble(TimeSeriesPoint::value)
      .toArray();
  }

  /**
   * Number of trailing elements that stand in for a window of the given length,
   * proportional to a 24-hour series: max(1, floor(count * windowHours / 24)).
   */
  public static int proportionalWindowSize(int count, double windowHours) {
    return Math.max(1, (int) Math.floor(count * windowHours / HOURS_PER_DAY));
  }

  /**
   * Returns the last {@code size} elements, or the whole array if it is shorter.
   */
  public static double[] tail(double[] values, int size) {
    int from = Math.max(0, values.length - size);
    return Arrays.copyOfRange(values, from, values.length);
  }

  private static boolean isInWindow(TimeSeriesPoint point, Instant windowStart, Instant asOf) {
    Instant timestamp = point.timestamp();
    if (timestamp == null) {
      return false;
    }
    return !timestamp.isBefore(windowStart) && !timestamp.isAfter(asOf);
  }

  private static Duration toDuration(double hours) {
    return Duration.ofMillis(Math.round(hours * Duration.ofHours(1).toMillis()));
  }
}
