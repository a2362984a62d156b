package io.github.themoah.anomaly.query;

import io.github.themoah.anomaly.detection.WindowKey;
import io.github.themoah.anomaly.exception.ValidationException;
import io.github.themoah.anomaly.model.Anomaly;
import io.github.themoah.anomaly.model.MetricSummary;
import io.github.themoah.anomaly.model.Reading;
import io.github.themoah.anomaly.storage.TelemetryRepository;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read side over persisted readings and anomalies.
 *
 * <p>Every call goes to storage; nothing is cached and the in-memory windows
 * are never consulted, so results reflect exactly what has been committed.
 * An empty result is an empty list, not an error.
 */
public class QueryService {

  public static final int DEFAULT_LIMIT = 100;
  public static final int DEFAULT_RECENT_COUNT = 10;

  private final TelemetryRepository repository;

  public QueryService(TelemetryRepository repository) {
    this.repository = repository;
  }

  /**
   * Anomalies, newest first.
   *
   * @param limit maximum number to return, null for {@value #DEFAULT_LIMIT}
   * @param since only anomalies at or after this instant, null for all
   */
  public List<Anomaly> listAnomalies(Integer limit, Instant since) {
    return listAnomalies(0, limit, since);
  }

  /**
   * Anomalies, newest first, skipping the first {@code skip}.
   */
  public List<Anomaly> listAnomalies(int skip, Integer limit, Instant since) {
    return repository.findAnomalies(since, checkSkip(skip), checkLimit(limit));
  }

  public List<Anomaly> listAnomalies() {
    return listAnomalies(null, null);
  }

  /**
   * Readings of one device metric, oldest first, bounds inclusive.
   *
   * @param from lower bound, null for unbounded
   * @param to upper bound, null for unbounded
   */
  public List<Reading> timeSeries(String deviceId, String metricName, Instant from, Instant to) {
    return timeSeries(deviceId, metricName, from, to, null);
  }

  /**
   * Readings of one device metric, oldest first, capped at {@code limit} rows.
   *
   * @param limit maximum rows, null for no cap
   */
  public List<Reading> timeSeries(
      String deviceId, String metricName, Instant from, Instant to, Integer limit) {
    WindowKey key = key(deviceId, metricName);
    checkRange(from, to);
    int cap = limit == null ? -1 : checkLimit(limit);
    return repository.findReadings(key, from, to, cap);
  }

  public List<Reading> timeSeries(String deviceId, String metricName) {
    return timeSeries(deviceId, metricName, null, null);
  }

  /**
   * Anomalies of one device metric, oldest first, bounds inclusive.
   * Paired with {@link #timeSeries} to overlay anomalies on the trend.
   */
  public List<Anomaly> anomaliesFor(String deviceId, String metricName, Instant from, Instant to) {
    WindowKey key = key(deviceId, metricName);
    checkRange(from, to);
    return repository.findAnomalies(key, from, to);
  }

  /**
   * All readings, oldest first.
   */
  public List<Reading> listReadings(int skip, Integer limit) {
    return repository.findReadings(checkSkip(skip), checkLimit(limit));
  }

  /**
   * Readings of one device across all of its metrics, oldest first.
   */
  public List<Reading> readingsForDevice(String deviceId, int skip, Integer limit) {
    requireNonBlank(deviceId, "device_id");
    return repository.findReadingsByDevice(deviceId, checkSkip(skip), checkLimit(limit));
  }

  /**
   * The most recent readings of one device, newest first.
   *
   * @param count how many, null for {@value #DEFAULT_RECENT_COUNT}
   */
  public List<Reading> recentReadings(String deviceId, Integer count) {
    requireNonBlank(deviceId, "device_id");
    int n = count == null ? DEFAULT_RECENT_COUNT : count;
    if (n < 0) {
      throw ValidationException.invalidParameter("count", n, "a non-negative integer");
    }
    return repository.findRecentReadings(deviceId, n);
  }

  /**
   * Min, max and average of one device metric.
   *
   * @return the summary, or empty if the metric has no readings
   */
  public Optional<MetricSummary> metricSummary(String deviceId, String metricName) {
    return repository.summarize(key(deviceId, metricName));
  }

  private static WindowKey key(String deviceId, String metricName) {
    requireNonBlank(deviceId, "device_id");
    requireNonBlank(metricName, "metric_name");
    return new WindowKey(deviceId, metricName);
  }

  private static void requireNonBlank(String value, String field) {
    if (value == null || value.isBlank()) {
      throw ValidationException.blankField(field);
    }
  }

  private static int checkLimit(Integer limit) {
    int n = limit == null ? DEFAULT_LIMIT : limit;
    if (n < 0) {
      throw ValidationException.invalidParameter("limit", n, "a non-negative integer");
    }
    return n;
  }

  private static int checkSkip(int skip) {
    if (skip < 0) {
      throw ValidationException.invalidParameter("skip", skip, "a non-negative integer");
    }
    return skip;
  }

  private static void checkRange(Instant from, Instant to) {
    if (from != null && to != null && from.isAfter(to)) {
      throw ValidationException.invalidParameter("from", from, "an instant not after 'to' (" + to + ")");
    }
  }
}
