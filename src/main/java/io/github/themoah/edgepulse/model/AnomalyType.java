package io.github.themoah.edgepulse.model;

/**
 * Direction of an anomaly relative to its baseline.
 */
public enum AnomalyType {
  SPIKE("spike"),
  DIP("dip"),
  SELECTION("selection");

  private final String value;

  AnomalyType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }
}
