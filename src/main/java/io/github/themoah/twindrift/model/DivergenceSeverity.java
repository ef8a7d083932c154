package io.github.themoah.twindrift.model;

/**
 * Severity of a comparison outcome, combining the loose and strict decision rules.
 */
public enum DivergenceSeverity {
  /** No check flagged a divergence. */
  NONE("none"),
  /** Something moved, but not enough to escalate. */
  DIVERGED("diverged"),
  /** Divergence that should be escalated. */
  SIGNIFICANT("significant");

  private final String value;

  DivergenceSeverity(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
