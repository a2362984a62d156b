package io.github.themoah.anomaly.health;

/**
 * Probe outcome, rendered in upper case on the wire.
 */
public enum HealthStatus {
  UP,
  DOWN;

  public static HealthStatus of(boolean healthy) {
    return healthy ? UP : DOWN;
  }

  public boolean isUp() {
    return this == UP;
  }

  public String getValue() {
    return name();
  }

  /**
   * HTTP status a probe answers with.
   */
  public int httpStatus() {
    return isUp() ? 200 : 503;
  }
}
