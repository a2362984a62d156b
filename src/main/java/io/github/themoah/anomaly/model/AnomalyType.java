package io.github.themoah.anomaly.model;

/**
 * Direction of an anomalous reading relative to its window mean.
 */
public enum AnomalyType {
  HIGH("high"),
  LOW("low");

  private final String value;

  AnomalyType(String value) {
    this.value = value;
  }

  public String getValue() {
    return value;
  }

  /**
   * Type for a signed z-score: positive is high, negative is low.
   *
   * @param score the z-score
   * @return the type, or null for a score of zero
   */
  public static AnomalyType fromScore(double score) {
    if (score > 0) {
      return HIGH;
    }
    if (score < 0) {
      return LOW;
    }
    return null;
  }

  public static AnomalyType fromValue(String value) {
    for (AnomalyType type : values()) {
      if (type.value.equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown anomaly type: " + value);
  }
}
