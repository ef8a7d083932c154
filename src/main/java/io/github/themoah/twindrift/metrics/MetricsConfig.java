package io.github.themoah.twindrift.metrics;

import io.github.themoah.twindrift.config.EnvironmentReader;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for divergence metrics reporting.
 *
 * @param enabled whether results are reported to a meter registry
 */
public record MetricsConfig(boolean enabled) {

  private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

  private static final boolean DEFAULT_ENABLED = true;

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>METRICS_ENABLED - Enable/disable metrics reporting (default: true)</li>
   * </ul>
   */
  public static MetricsConfig fromEnvironment() {
    return fromEnvironment(new EnvironmentReader());
  }

  static MetricsConfig fromEnvironment(EnvironmentReader env) {
    boolean enabled = env.getBoolean("METRICS_ENABLED", DEFAULT_ENABLED);
    log.info("Metrics config: enabled={}", enabled);
    return new MetricsConfig(enabled);
  }

  /**
   * Creates the reporter for this configuration.
   *
   * @param registry registry to report into; a SimpleMeterRegistry is used when null
   * @return Micrometer reporter when enabled, otherwise a no-op reporter
   */
  public DivergenceReporter createReporter(MeterRegistry registry) {
    if (!enabled) {
      log.info("Divergence metrics reporting is disabled");
      return DivergenceReporter.noop();
    }
    MeterRegistry target = registry != null ? registry : new SimpleMeterRegistry();
    return new MicrometerDivergenceReporter(target);
  }
}
