package io.github.themoah.twindrift.detector;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import io.github.themoah.twindrift.model.MetricSeries;
import io.github.themoah.twindrift.model.TimeSeriesPoint;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for TimeWindow.
 */
public class TimeWindowTest {

  private static final Instant AS_OF = Instant.parse("2024-03-02T00:00:00Z");

  @Test
  void proportionalWindowSize_scalesWith24Hours() {
    assertEquals(10, TimeWindow.proportionalWindowSize(10, 24));
    assertEquals(5, TimeWindow.proportionalWindowSize(10, 12));
    assertEquals(20, TimeWindow.proportionalWindowSize(10, 48));
  }

  @Test
  void proportionalWindowSize_neverBelowOne() {
    assertEquals(1, TimeWindow.proportionalWindowSize(10, 1));
    assertEquals(1, TimeWindow.proportionalWindowSize(0, 24));
    assertEquals(1, TimeWindow.proportionalWindowSize(10, 0));
  }

  @Test
  void tail_takesLastElements() {
    assertArrayEquals(new double[] {4, 5}, TimeWindow.tail(new double[] {1, 2, 3, 4, 5}, 2));
  }

  @Test
  void tail_shorterThanSize_returnsAll() {
    assertArrayEquals(new double[] {1, 2}, TimeWindow.tail(new double[] {1, 2}, 5));
    assertArrayEquals(new double[0], TimeWindow.tail(new double[0], 1));
  }

  @Test
  void valuesInWindow_keepsTrailingWindowInclusiveStart() {
    MetricSeries series = MetricSeries.of("latency", List.of(
      TimeSeriesPoint.of(AS_OF.minus(Duration.ofHours(30)), 1.0),
      TimeSeriesPoint.of(AS_OF.minus(Duration.ofHours(24)), 2.0),
      TimeSeriesPoint.of(AS_OF.minus(Duration.ofHours(1)), 3.0),
      TimeSeriesPoint.of(AS_OF.plus(Duration.ofHours(1)), 4.0)
    ));

    assertArrayEquals(new double[] {2.0, 3.0}, TimeWindow.valuesInWindow(series, 24, AS_OF));
  }

  @Test
  void valuesInWindow_excludesPointsWithoutTimestamp() {
    MetricSeries series = MetricSeries.of("latency", List.of(
      new TimeSeriesPoint(null, 9.0, "broken", Map.of()),
      TimeSeriesPoint.of(AS_OF.minus(Duration.ofMinutes(30)), 3.0)
    ));

    assertArrayEquals(new double[] {3.0}, TimeWindow.valuesInWindow(series, 24, AS_OF));
  }

  @Test
  void valuesInWindow_fractionalHours() {
    MetricSeries series = MetricSeries.of("latency", List.of(
      TimeSeriesPoint.of(AS_OF.minus(Duration.ofMinutes(45)), 1.0),
      TimeSeriesPoint.of(AS_OF.minus(Duration.ofMinutes(20)), 2.0)
    ));

    assertArrayEquals(new double[] {2.0}, TimeWindow.valuesInWindow(series, 0.5, AS_OF));
  }
}
