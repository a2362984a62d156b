package io.github.themoah.anomaly.model;

import io.vertx.core.json.JsonObject;
import java.time.Instant;

/**
 * A persisted record of a reading whose z-score exceeded the threshold.
 *
 * @param deviceId device of the triggering reading
 * @param metricName metric of the triggering reading
 * @param value value of the triggering reading
 * @param unit unit of the triggering reading, may be null
 * @param timestamp timestamp of the triggering reading
 * @param score signed z-score of the value against the preceding window
 * @param type high or low, by the sign of the score
 * @param threshold z-score threshold in force when the reading was flagged
 */
public record Anomaly(
  String deviceId,
  String metricName,
  double value,
  String unit,
  Instant timestamp,
  double score,
  AnomalyType type,
  double threshold
) {

  public static Anomaly of(Reading reading, double score, AnomalyType type, double threshold) {
    return new Anomaly(
      reading.deviceId(),
      reading.metricName(),
      reading.value(),
      reading.unit(),
      reading.timestamp(),
      score,
      type,
      threshold
    );
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("device_id", deviceId)
      .put("metric_name", metricName)
      .put("metric_value", value)
      .put("unit", unit)
      .put("timestamp", timestamp.toString())
      .put("score", score)
      .put("anomaly_type", type.getValue())
      .put("threshold_used", threshold);
  }
}
