package io.github.themoah.anomaly.model;

import io.github.themoah.anomaly.detection.WindowKey;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * One timestamped observation of a device metric.
 *
 * <p>Timestamps are kept at millisecond precision, the precision storage
 * retains. A null timestamp means "not supplied" and is resolved at ingestion.
 *
 * @param deviceId identifier of the reporting device
 * @param metricName name of the metric, e.g. temperature
 * @param value the observed value
 * @param unit unit of the value, null when not given
 * @param timestamp when the value was observed, null until resolved
 */
public record Reading(
  String deviceId,
  String metricName,
  double value,
  String unit,
  Instant timestamp
) {

  /** Earliest instant storage can represent as epoch milliseconds. */
  public static final Instant MIN_TIMESTAMP = Instant.ofEpochMilli(Long.MIN_VALUE);
  /** Latest instant storage can represent as epoch milliseconds. */
  public static final Instant MAX_TIMESTAMP = Instant.ofEpochMilli(Long.MAX_VALUE);

  public Reading {
    if (unit != null && unit.isBlank()) {
      unit = null;
    }
    if (timestamp != null) {
      timestamp = timestamp.truncatedTo(ChronoUnit.MILLIS);
    }
  }

  public static Reading of(String deviceId, String metricName, double value) {
    return new Reading(deviceId, metricName, value, null, null);
  }

  public static boolean isStorable(Instant instant) {
    return !instant.isBefore(MIN_TIMESTAMP) && !instant.isAfter(MAX_TIMESTAMP);
  }

  public Reading withTimestamp(Instant newTimestamp) {
    return new Reading(deviceId, metricName, value, unit, newTimestamp);
  }

  public WindowKey key() {
    return new WindowKey(deviceId, metricName);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("device_id", deviceId)
      .put("metric_name", metricName)
      .put("metric_value", value)
      .put("unit", unit);
    if (timestamp != null) {
      json.put("timestamp", timestamp.toString());
    }
    return json;
  }
}
