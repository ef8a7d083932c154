package io.github.themoah.twindrift;

import io.github.themoah.twindrift.config.DivergenceConfig;
import io.github.themoah.twindrift.detector.DivergenceDetector;
import io.github.themoah.twindrift.metrics.DivergenceReporter;
import io.github.themoah.twindrift.metrics.MetricsConfig;
import io.github.themoah.twindrift.model.DivergenceResult;
import io.github.themoah.twindrift.model.DivergenceSeverity;
import io.github.themoah.twindrift.model.MetricSeries;
import io.github.themoah.twindrift.model.SeriesPair;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.Future;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for comparison requests: runs the detector, classifies the
 * outcome and hands it to the reporter.
 */
public class DivergenceService {

  private static final Logger log = LoggerFactory.getLogger(DivergenceService.class);

  private final DivergenceDetector detector;
  private final DivergenceReporter reporter;

  public DivergenceService(DivergenceDetector detector, DivergenceReporter reporter) {
    this.detector = Objects.requireNonNull(detector, "detector");
    this.reporter = Objects.requireNonNull(reporter, "reporter");
  }

  /**
   * Creates a service configured from environment variables.
   *
   * @param registry meter registry for reporting (nullable)
   * @return configured service
   */
  public static DivergenceService fromEnvironment(MeterRegistry registry) {
    DivergenceConfig config = DivergenceConfig.fromEnvironment();
    MetricsConfig metricsConfig = MetricsConfig.fromEnvironment();
    return new DivergenceService(new DivergenceDetector(config), metricsConfig.createReporter(registry));
  }

  public DivergenceDetector detector() {
    return detector;
  }

  /**
   * Compares one twin/baseline pair and reports the result.
   *
   * @return Future completing with the result once it has been reported
   */
  public Future<DivergenceResult> compare(MetricSeries twin, MetricSeries baseline) {
    DivergenceResult result = detector.detect(twin, baseline);
    DivergenceSeverity severity = detector.classify(result);

    if (severity == DivergenceSeverity.SIGNIFICANT) {
      log.warn("Significant divergence: twin={}, baseline={}, driftScore={}, confidenceExceeded={}",
        twin.name(), baseline.name(), String.format("%.3f", result.driftScore()),
        result.confidenceIntervalExceeded());
    }

    return reporter.report(result, severity)
      .map(v -> result)
      .onFailure(err -> log.error("Failed to report divergence for twin={}", twin.name(), err));
  }

  /**
   * Compares every pair, reporting each result.
   *
   * <p>The batch is treated as the full set of monitored pairs: reporter state for
   * pairs missing from two consecutive batches is released.
   *
   * @return Future completing with the results in input order
   */
  public Future<List<DivergenceResult>> compareAll(List<SeriesPair> pairs) {
    List<DivergenceResult> results = detector.detectAll(pairs);
    List<Future<Void>> reports = results.stream()
      .map(result -> reporter.report(result, detector.classify(result)))
      .toList();
    return Future.all(reports)
      .map(v -> {
        reporter.cleanupStalePairs(results);
        return results;
      })
      .onFailure(err -> log.error("Failed to report divergence batch of {} pairs", results.size(), err));
  }

  public Future<Void> close() {
    return reporter.close();
  }
}
