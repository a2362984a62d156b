package io.github.themoah.anomaly.storage;

import io.github.themoah.anomaly.detection.WindowKey;
import io.github.themoah.anomaly.model.Anomaly;
import io.github.themoah.anomaly.model.MetricSummary;
import io.github.themoah.anomaly.model.Reading;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only persistence for readings and anomalies.
 *
 * <p>Rows are never updated or deleted once written. All methods block on I/O
 * and throw {@link io.github.themoah.anomaly.exception.PersistenceException}
 * when the store fails.
 */
public interface TelemetryRepository extends AutoCloseable {

  /**
   * Creates tables and indexes if they do not exist yet.
   */
  void initialize();

  /**
   * Writes a reading and, if given, its anomaly as one unit. Either both rows
   * are committed or neither is.
   *
   * @param reading the reading, with a resolved timestamp
   * @param anomaly the anomaly raised by the reading, or null
   */
  void append(Reading reading, Anomaly anomaly);

  /**
   * Anomalies at or after {@code since}, newest first.
   *
   * @param since lower timestamp bound, null for none
   * @param skip rows to skip
   * @param limit maximum rows to return
   */
  List<Anomaly> findAnomalies(Instant since, int skip, int limit);

  /**
   * Anomalies of one device metric within [from, to], oldest first.
   */
  List<Anomaly> findAnomalies(WindowKey key, Instant from, Instant to);

  /**
   * Readings of one device metric within [from, to], oldest first.
   *
   * @param limit maximum rows to return, negative for no limit
   */
  List<Reading> findReadings(WindowKey key, Instant from, Instant to, int limit);

  /**
   * All readings, oldest first.
   */
  List<Reading> findReadings(int skip, int limit);

  /**
   * Readings of one device across its metrics, oldest first.
   */
  List<Reading> findReadingsByDevice(String deviceId, int skip, int limit);

  /**
   * The latest {@code count} readings of one device, newest first.
   */
  List<Reading> findRecentReadings(String deviceId, int count);

  /**
   * Count, min, max and average of one device metric; empty when it has no readings.
   */
  Optional<MetricSummary> summarize(WindowKey key);

  /**
   * Cheap round trip used by the readiness probe.
   *
   * @return true if the store answered
   */
  boolean ping();

  @Override
  void close();
}
