package io.github.themoah.anomaly.detection;

import java.util.Objects;

/**
 * Identity of one rolling window: a device and one of its metrics.
 */
public record WindowKey(String deviceId, String metricName) {

  public WindowKey {
    Objects.requireNonNull(deviceId, "deviceId");
    Objects.requireNonNull(metricName, "metricName");
  }

  @Override
  public String toString() {
    return deviceId + ":" + metricName;
  }
}
