package io.github.themoah.twindrift.detector;

import io.github.themoah.twindrift.config.DivergenceConfig;
import io.github.themoah.twindrift.model.ConfidenceCheck;
import io.github.themoah.twindrift.model.DeviationCheck;
import io.github.themoah.twindrift.model.DivergenceResult;
import io.github.themoah.twindrift.model.DivergenceSeverity;
import io.github.themoah.twindrift.model.DriftMetrics;
import io.github.themoah.twindrift.model.MetricComparison;
import io.github.themoah.twindrift.model.MetricSeries;
import io.github.themoah.twindrift.model.SeriesPair;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects divergence of a twin metric series from its baseline.
 *
 * <p>Three independent checks feed the decision:
 * <ul>
 *   <li>a two-sample confidence-interval test on the series means</li>
 *   <li>an early-deviation check over the most recent part of the series</li>
 *   <li>index-aligned drift statistics blended into a score in [0, 1]</li>
 * </ul>
 *
 * <p>The detector holds only its configuration, so one instance can be shared
 * across threads and invoked any number of times.
 */
public class DivergenceDetector {

  private static final Logger log = LoggerFactory.getLogger(DivergenceDetector.class);

  static final double DETECTION_DRIFT_THRESHOLD = 0.5;
  static final double SIGNIFICANT_EARLY_DRIFT_THRESHOLD = 0.3;
  static final double SIGNIFICANT_DRIFT_THRESHOLD = 0.7;

  private final DivergenceConfig config;
  private final Clock clock;

  public DivergenceDetector(DivergenceConfig config) {
    this(config, Clock.systemUTC());
  }

  /**
   * Constructor for testing with a fixed clock.
   */
  DivergenceDetector(DivergenceConfig config, Clock clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public DivergenceConfig config() {
    return config;
  }

  /**
   * Compares a twin series against its baseline.
   *
   * <p>A divergence is detected when the confidence interval is exceeded, an early
   * deviation is detected, or the drift score is above 0.5.
   *
   * @param twin the observed or simulated series
   * @param baseline the reference series
   * @return aggregated result of all checks
   */
  public DivergenceResult detect(MetricSeries twin, MetricSeries baseline) {
    Objects.requireNonNull(twin, "twin");
    Objects.requireNonNull(baseline, "baseline");

    double[] twinValues = twin.values();
    double[] baselineValues = baseline.values();

    ConfidenceCheck confidenceCheck = checkConfidenceInterval(twinValues, baselineValues);
    DeviationCheck earlyDeviation = checkEarlyDeviation(
      twinValues, baselineValues, config.earlyDeviationWindowHours());
    DriftMetrics drift = DriftCalculator.calculate(twinValues, baselineValues);
    List<MetricComparison> comparisons = buildMetricsComparison(twinValues, baselineValues);

    boolean detected = confidenceCheck.exceeded()
      || earlyDeviation.detected()
      || drift.driftScore() > DETECTION_DRIFT_THRESHOLD;

    if (detected) {
      log.info("Divergence detected: twin={}, baseline={}, confidenceExceeded={}, earlyDeviation={}, driftScore={}",
        twin.name(), baseline.name(), confidenceCheck.exceeded(), earlyDeviation.detected(),
        String.format("%.3f", drift.driftScore()));
    } else {
      log.debug("No divergence: twin={}, baseline={}, driftScore={}",
        twin.name(), baseline.name(), String.format("%.3f", drift.driftScore()));
    }

    return new DivergenceResult(
      detected,
      twin.name(),
      baseline.name(),
      confidenceCheck,
      earlyDeviation,
      drift,
      comparisons,
      Instant.now(clock)
    );
  }

  /**
   * Runs {@link #detect} for every pair.
   *
   * @param pairs twin/baseline pairs
   * @return one result per pair, in input order
   */
  public List<DivergenceResult> detectAll(List<SeriesPair> pairs) {
    List<DivergenceResult> results = new ArrayList<>(pairs.size());
    for (SeriesPair pair : pairs) {
      results.add(detect(pair.twin(), pair.baseline()));
    }

    long detectedCount = results.stream().filter(DivergenceResult::detected).count();
    if (detectedCount > 0) {
      log.info("Detected divergence in {} of {} series pairs", detectedCount, results.size());
    }
    return results;
  }

  /**
   * Tests whether the twin mean lies outside the baseline-centered confidence interval.
   *
   * <p>The interval is baselineMean ± z * SE, where SE is the standard error of the
   * difference of means and z is the critical value for the configured confidence.
   *
   * @param twin twin values
   * @param baseline baseline values
   * @return confidence check result
   */
  public ConfidenceCheck checkConfidenceInterval(double[] twin, double[] baseline) {
    double twinMean = StatisticalUtils.mean(twin);
    double baselineMean = StatisticalUtils.mean(baseline);
    double twinStdDev = StatisticalUtils.stdDev(twin, twinMean);
    double baselineStdDev = StatisticalUtils.stdDev(baseline, baselineMean);

    double standardError = StatisticalUtils.standardError(
      twinStdDev, twin.length, baselineStdDev, baseline.length);
    double marginOfError = StatisticalUtils.zValueForConfidence(config.confidenceThreshold()) * standardError;

    // A margin near Double.MAX_VALUE overflows the bounds; keep them finite
    double lowerBound = Math.max(-Double.MAX_VALUE, baselineMean - marginOfError);
    double upperBound = Math.min(Double.MAX_VALUE, baselineMean + marginOfError);
    boolean exceeded = twinMean < lowerBound || twinMean > upperBound;
    double zScore = StatisticalUtils.safeDivide(twinMean - baselineMean, standardError);

    log.debug("Confidence check: twinMean={}, baselineMean={}, bounds=[{}, {}], zScore={}, exceeded={}",
      String.format("%.4f", twinMean), String.format("%.4f", baselineMean),
      String.format("%.4f", lowerBound), String.format("%.4f", upperBound),
      String.format("%.2f", zScore), exceeded);

    return new ConfidenceCheck(exceeded, twinMean, baselineMean, lowerBound, upperBound, zScore, standardError);
  }

  /**
   * Compares the means of the most recent values of both series.
   *
   * <p>The window is a proportional tail slice, not a time filter: it takes the last
   * max(1, floor(twin.length * windowHours / 24)) values of each array. Callers that
   * need a real time window should use {@link #checkEarlyDeviationInWindow}.
   *
   * @param twin twin values
   * @param baseline baseline values
   * @param windowHours window length in hours
   * @return deviation check result
   */
  public DeviationCheck checkEarlyDeviation(double[] twin, double[] baseline, double windowHours) {
    int windowSize = TimeWindow.proportionalWindowSize(twin.length, windowHours);
    double[] twinWindow = TimeWindow.tail(twin, windowSize);
    double[] baselineWindow = TimeWindow.tail(baseline, windowSize);
    return deviationCheck(twinWindow, baselineWindow, windowHours);
  }

  /**
   * Time-filtered variant of the early-deviation check: compares the values whose
   * timestamps fall in the configured window ending at {@code asOf}.
   *
   * @param twin twin series
   * @param baseline baseline series
   * @param asOf end of the window
   * @return deviation check result
   */
  public DeviationCheck checkEarlyDeviationInWindow(MetricSeries twin, MetricSeries baseline, Instant asOf) {
    double windowHours = config.earlyDeviationWindowHours();
    double[] twinWindow = TimeWindow.valuesInWindow(twin, windowHours, asOf);
    double[] baselineWindow = TimeWindow.valuesInWindow(baseline, windowHours, asOf);
    return deviationCheck(twinWindow, baselineWindow, windowHours);
  }

  /**
   * Calculates drift statistics between the two series.
   *
   * @param twin twin series
   * @param baseline baseline series
   * @return drift metrics
   */
  public DriftMetrics calculateStatisticalDrift(MetricSeries twin, MetricSeries baseline) {
    return DriftCalculator.calculate(twin.values(), baseline.values());
  }

  /**
   * Stricter escalation rule than {@link DivergenceResult#detected()}.
   *
   * <p>An exceeded confidence interval is sufficient on its own; otherwise an early
   * deviation needs a drift score above 0.3, and without one the drift score must
   * be above 0.7.
   *
   * @param result a detection result
   * @return true if the divergence should be escalated
   */
  public boolean isSignificantDivergence(DivergenceResult result) {
    if (result.confidenceIntervalExceeded()) {
      return true;
    }
    if (result.earlyDeviationDetected() && result.driftScore() > SIGNIFICANT_EARLY_DRIFT_THRESHOLD) {
      return true;
    }
    return result.driftScore() > SIGNIFICANT_DRIFT_THRESHOLD;
  }

  /**
   * Maps a result onto a severity using both decision rules.
   */
  public DivergenceSeverity classify(DivergenceResult result) {
    if (isSignificantDivergence(result)) {
      return DivergenceSeverity.SIGNIFICANT;
    }
    return result.detected() ? DivergenceSeverity.DIVERGED : DivergenceSeverity.NONE;
  }

  /**
   * Compares mean, standard deviation, min and max of both series.
   *
   * @return four comparisons, or an empty list if either series is empty
   */
  public List<MetricComparison> buildMetricsComparison(MetricSeries twin, MetricSeries baseline) {
    return buildMetricsComparison(twin.values(), baseline.values());
  }

  List<MetricComparison> buildMetricsComparison(double[] twin, double[] baseline) {
    if (twin.length == 0 || baseline.length == 0) {
      return List.of();
    }

    double twinMean = StatisticalUtils.mean(twin);
    double baselineMean = StatisticalUtils.mean(baseline);

    return List.of(
      comparison("mean", twinMean, baselineMean),
      comparison("stddev", StatisticalUtils.stdDev(twin, twinMean), StatisticalUtils.stdDev(baseline, baselineMean)),
      comparison("min", StatisticalUtils.min(twin), StatisticalUtils.min(baseline)),
      comparison("max", StatisticalUtils.max(twin), StatisticalUtils.max(baseline))
    );
  }

  private DeviationCheck deviationCheck(double[] twinWindow, double[] baselineWindow, double windowHours) {
    double twinWindowMean = StatisticalUtils.mean(twinWindow);
    double baselineWindowMean = StatisticalUtils.mean(baselineWindow);

    double deviationPercent;
    if (baselineWindowMean == 0.0) {
      deviationPercent = twinWindowMean != 0.0 ? 1.0 : 0.0;
    } else {
      deviationPercent = StatisticalUtils.safeDivide(
        Math.abs(twinWindowMean - baselineWindowMean), Math.abs(baselineWindowMean));
    }

    boolean detected = deviationPercent > config.earlyDeviationThreshold();

    log.debug("Early deviation check: window={}h, twinMean={}, baselineMean={}, deviation={}, detected={}",
      windowHours, String.format("%.4f", twinWindowMean), String.format("%.4f", baselineWindowMean),
      String.format("%.4f", deviationPercent), detected);

    return new DeviationCheck(
      detected,
      deviationPercent,
      windowHours,
      twinWindowMean,
      baselineWindowMean,
      config.earlyDeviationThreshold()
    );
  }

  private static MetricComparison comparison(String metric, double twinValue, double baselineValue) {
    double deviation = StatisticalUtils.safeDivide(twinValue - baselineValue, Math.abs(baselineValue));
    return new MetricComparison(metric, twinValue, baselineValue, deviation);
  }
}
