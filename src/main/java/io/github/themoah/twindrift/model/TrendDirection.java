package io.github.themoah.twindrift.model;

/**
 * Direction of the least-squares slope of pointwise twin-minus-baseline deviations.
 */
public enum TrendDirection {
  INCREASING("increasing"),
  DECREASING("decreasing"),
  STABLE("stable");

  private final String value;

  TrendDirection(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
