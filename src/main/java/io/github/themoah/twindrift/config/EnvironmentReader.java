package io.github.themoah.twindrift.config;

import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads typed values from environment variables, falling back to defaults
 * for missing, blank or unparseable values.
 */
public class EnvironmentReader {

  private static final Logger log = LoggerFactory.getLogger(EnvironmentReader.class);

  private final Function<String, String> lookup;

  public EnvironmentReader() {
    this(System::getenv);
  }

  /**
   * Reads from a fixed set of variables instead of the process environment.
   */
  public EnvironmentReader(Map<String, String> variables) {
    this(variables::get);
  }

  private EnvironmentReader(Function<String, String> lookup) {
    this.lookup = lookup;
  }

  public boolean getBoolean(String name, boolean defaultValue) {
    String value = lookup.apply(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  public int getInt(String name, int defaultValue) {
    String value = lookup.apply(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", name, value, defaultValue);
      return defaultValue;
    }
  }

  public double getDouble(String name, double defaultValue) {
    String value = lookup.apply(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      double parsed = Double.parseDouble(value.trim());
      if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
        log.warn("Non-finite value for {}: '{}', using default: {}", name, value, defaultValue);
        return defaultValue;
      }
      return parsed;
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", name, value, defaultValue);
      return defaultValue;
    }
  }
}
