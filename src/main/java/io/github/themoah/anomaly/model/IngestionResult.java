package io.github.themoah.anomaly.model;

import io.vertx.core.json.JsonObject;

/**
 * Outcome of ingesting one reading.
 *
 * @param stored whether the reading was durably committed
 * @param reading the reading as stored, with its resolved timestamp
 * @param anomaly the anomaly recorded for it, null when not anomalous
 */
public record IngestionResult(
  boolean stored,
  Reading reading,
  Anomaly anomaly
) {

  public static IngestionResult normal(Reading reading) {
    return new IngestionResult(true, reading, null);
  }

  public static IngestionResult anomalous(Reading reading, Anomaly anomaly) {
    return new IngestionResult(true, reading, anomaly);
  }

  public boolean isAnomalous() {
    return anomaly != null;
  }

  public JsonObject toJson() {
    return reading.toJson()
      .put("stored", stored)
      .put("anomalous", isAnomalous())
      .put("anomaly", anomaly != null ? anomaly.toJson() : null);
  }
}
