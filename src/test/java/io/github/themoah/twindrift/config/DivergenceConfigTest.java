package io.github.themoah.twindrift.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for DivergenceConfig.
 */
public class DivergenceConfigTest {

  @Test
  void defaults_values() {
    DivergenceConfig config = DivergenceConfig.defaults();

    assertEquals(0.95, config.confidenceThreshold());
    assertEquals(0.15, config.earlyDeviationThreshold());
    assertEquals(10, config.minSampleSize());
    assertEquals(24.0, config.earlyDeviationWindowHours());
  }

  @Test
  void fromEnvironment_noVariables_usesDefaults() {
    DivergenceConfig config = DivergenceConfig.fromEnvironment(new EnvironmentReader(Map.of()));

    assertEquals(DivergenceConfig.defaults(), config);
  }

  @Test
  void fromEnvironment_overridesEveryField() {
    DivergenceConfig config = DivergenceConfig.fromEnvironment(new EnvironmentReader(Map.of(
      "DIVERGENCE_CONFIDENCE_THRESHOLD", "0.99",
      "DIVERGENCE_EARLY_DEVIATION_THRESHOLD", "0.25",
      "DIVERGENCE_MIN_SAMPLE_SIZE", "30",
      "DIVERGENCE_EARLY_DEVIATION_WINDOW_HOURS", "6"
    )));

    assertEquals(new DivergenceConfig(0.99, 0.25, 30, 6.0), config);
  }

  @Test
  void fromEnvironment_invalidValues_fallBackToDefaults() {
    DivergenceConfig config = DivergenceConfig.fromEnvironment(new EnvironmentReader(Map.of(
      "DIVERGENCE_CONFIDENCE_THRESHOLD", "1.5",
      "DIVERGENCE_EARLY_DEVIATION_THRESHOLD", "-0.1",
      "DIVERGENCE_MIN_SAMPLE_SIZE", "lots",
      "DIVERGENCE_EARLY_DEVIATION_WINDOW_HOURS", "NaN"
    )));

    assertEquals(DivergenceConfig.defaults(), config);
  }

  @Test
  void constructor_rejectsOutOfRangeValues() {
    assertThrows(IllegalArgumentException.class, () -> new DivergenceConfig(1.2, 0.15, 10, 24));
    assertThrows(IllegalArgumentException.class, () -> new DivergenceConfig(0.95, -1, 10, 24));
    assertThrows(IllegalArgumentException.class, () -> new DivergenceConfig(0.95, 0.15, -1, 24));
    assertThrows(IllegalArgumentException.class, () -> new DivergenceConfig(0.95, 0.15, 10, -24));
    assertThrows(IllegalArgumentException.class, () -> new DivergenceConfig(Double.NaN, 0.15, 10, 24));
  }

  @Test
  void withMethods_replaceSingleField() {
    DivergenceConfig config = DivergenceConfig.defaults()
      .withConfidenceThreshold(0.9)
      .withEarlyDeviationThreshold(0.2)
      .withMinSampleSize(5)
      .withEarlyDeviationWindowHours(12);

    assertEquals(new DivergenceConfig(0.9, 0.2, 5, 12.0), config);
    assertEquals(0.95, DivergenceConfig.defaults().confidenceThreshold());
  }
}
