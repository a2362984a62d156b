package io.github.themoah.anomaly.metrics;

import io.github.themoah.anomaly.model.AnomalyType;
import java.util.function.Supplier;

/**
 * Interface for reporting ingestion activity to external systems.
 */
public interface IngestionMetrics {

  /**
   * Implementation that records nothing, used when metrics are disabled.
   */
  IngestionMetrics NOOP = new IngestionMetrics() {};

  /**
   * A reading was committed.
   */
  default void readingIngested() {
  }

  /**
   * A reading was rejected by validation.
   */
  default void readingRejected() {
  }

  /**
   * An anomaly of the given type was committed.
   */
  default void anomalyDetected(AnomalyType type) {
  }

  /**
   * A write to storage failed after the window had been updated.
   */
  default void persistenceFailed() {
  }

  /**
   * Records the wall time of one ingest call.
   *
   * @param nanos elapsed nanoseconds
   */
  default void ingestDuration(long nanos) {
  }

  /**
   * Exposes the number of live windows.
   *
   * @param windowCount supplier polled by the backend
   */
  default void bindWindowCount(Supplier<Number> windowCount) {
  }

  /**
   * Releases the backend.
   */
  default void close() {
  }
}
