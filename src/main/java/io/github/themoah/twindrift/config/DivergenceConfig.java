package io.github.themoah.twindrift.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for divergence detection.
 *
 * @param confidenceThreshold confidence level for the interval check (default 0.95)
 * @param earlyDeviationThreshold relative deviation that flags an early deviation (default 0.15)
 * @param minSampleSize minimum sample size, reserved for callers that gate on it (default 10)
 * @param earlyDeviationWindowHours window length for the early-deviation check (default 24)
 */
public record DivergenceConfig(
  double confidenceThreshold,
  double earlyDeviationThreshold,
  int minSampleSize,
  double earlyDeviationWindowHours
) {

  private static final Logger log = LoggerFactory.getLogger(DivergenceConfig.class);

  public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.95;
  public static final double DEFAULT_EARLY_DEVIATION_THRESHOLD = 0.15;
  public static final int DEFAULT_MIN_SAMPLE_SIZE = 10;
  public static final double DEFAULT_EARLY_DEVIATION_WINDOW_HOURS = 24.0;

  public DivergenceConfig {
    if (!(confidenceThreshold >= 0.0 && confidenceThreshold <= 1.0)) {
      throw new IllegalArgumentException("confidenceThreshold must be in [0, 1]: " + confidenceThreshold);
    }
    if (!(earlyDeviationThreshold >= 0.0)) {
      throw new IllegalArgumentException("earlyDeviationThreshold must be >= 0: " + earlyDeviationThreshold);
    }
    if (minSampleSize < 0) {
      throw new IllegalArgumentException("minSampleSize must be >= 0: " + minSampleSize);
    }
    if (!(earlyDeviationWindowHours >= 0.0)) {
      throw new IllegalArgumentException("earlyDeviationWindowHours must be >= 0: " + earlyDeviationWindowHours);
    }
  }

  /**
   * Returns a configuration with every field at its default.
   */
  public static DivergenceConfig defaults() {
    return new DivergenceConfig(
      DEFAULT_CONFIDENCE_THRESHOLD,
      DEFAULT_EARLY_DEVIATION_THRESHOLD,
      DEFAULT_MIN_SAMPLE_SIZE,
      DEFAULT_EARLY_DEVIATION_WINDOW_HOURS
    );
  }

  public DivergenceConfig withConfidenceThreshold(double value) {
    return new DivergenceConfig(value, earlyDeviationThreshold, minSampleSize, earlyDeviationWindowHours);
  }

  public DivergenceConfig withEarlyDeviationThreshold(double value) {
    return new DivergenceConfig(confidenceThreshold, value, minSampleSize, earlyDeviationWindowHours);
  }

  public DivergenceConfig withMinSampleSize(int value) {
    return new DivergenceConfig(confidenceThreshold, earlyDeviationThreshold, value, earlyDeviationWindowHours);
  }

  public DivergenceConfig withEarlyDeviationWindowHours(double value) {
    return new DivergenceConfig(confidenceThreshold, earlyDeviationThreshold, minSampleSize, value);
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>DIVERGENCE_CONFIDENCE_THRESHOLD - Confidence level for the interval check (default: 0.95)</li>
   *   <li>DIVERGENCE_EARLY_DEVIATION_THRESHOLD - Relative deviation for early detection (default: 0.15)</li>
   *   <li>DIVERGENCE_MIN_SAMPLE_SIZE - Reserved minimum sample size (default: 10)</li>
   *   <li>DIVERGENCE_EARLY_DEVIATION_WINDOW_HOURS - Early deviation window in hours (default: 24)</li>
   * </ul>
   */
  public static DivergenceConfig fromEnvironment() {
    return fromEnvironment(new EnvironmentReader());
  }

  static DivergenceConfig fromEnvironment(EnvironmentReader env) {
    double confidence = env.getDouble("DIVERGENCE_CONFIDENCE_THRESHOLD", DEFAULT_CONFIDENCE_THRESHOLD);
    double earlyThreshold = env.getDouble("DIVERGENCE_EARLY_DEVIATION_THRESHOLD", DEFAULT_EARLY_DEVIATION_THRESHOLD);
    int minSampleSize = env.getInt("DIVERGENCE_MIN_SAMPLE_SIZE", DEFAULT_MIN_SAMPLE_SIZE);
    double windowHours = env.getDouble("DIVERGENCE_EARLY_DEVIATION_WINDOW_HOURS", DEFAULT_EARLY_DEVIATION_WINDOW_HOURS);

    if (confidence < 0.0 || confidence > 1.0) {
      log.warn("Confidence threshold {} out of range [0, 1], using default: {}", confidence, DEFAULT_CONFIDENCE_THRESHOLD);
      confidence = DEFAULT_CONFIDENCE_THRESHOLD;
    }
    if (earlyThreshold < 0.0) {
      log.warn("Negative early deviation threshold {}, using default: {}", earlyThreshold, DEFAULT_EARLY_DEVIATION_THRESHOLD);
      earlyThreshold = DEFAULT_EARLY_DEVIATION_THRESHOLD;
    }
    if (minSampleSize < 0) {
      log.warn("Negative min sample size {}, using default: {}", minSampleSize, DEFAULT_MIN_SAMPLE_SIZE);
      minSampleSize = DEFAULT_MIN_SAMPLE_SIZE;
    }
    if (windowHours < 0.0) {
      log.warn("Negative early deviation window {}, using default: {}", windowHours, DEFAULT_EARLY_DEVIATION_WINDOW_HOURS);
      windowHours = DEFAULT_EARLY_DEVIATION_WINDOW_HOURS;
    }

    DivergenceConfig config = new DivergenceConfig(confidence, earlyThreshold, minSampleSize, windowHours);
    log.info("Divergence config: confidenceThreshold={}, earlyDeviationThreshold={}, minSampleSize={}, "
      + "earlyDeviationWindowHours={}", confidence, earlyThreshold, minSampleSize, windowHours);

    return config;
  }
}
