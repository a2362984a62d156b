package io.github.themoah.anomaly.model;

import io.vertx.core.json.JsonObject;

/**
 * Aggregate over all stored readings of one device metric.
 */
public record MetricSummary(
  String deviceId,
  String metricName,
  long count,
  double minValue,
  double maxValue,
  double avgValue
) {

  public JsonObject toJson() {
    return new JsonObject()
      .put("device_id", deviceId)
      .put("metric_name", metricName)
      .put("count", count)
      .put("min_value", minValue)
      .put("max_value", maxValue)
      .put("avg_value", avgValue);
  }
}
