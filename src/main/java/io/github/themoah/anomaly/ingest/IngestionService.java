package io.github.themoah.anomaly.ingest;

import io.github.themoah.anomaly.detection.AnomalyDetector;
import io.github.themoah.anomaly.detection.Evaluation;
import io.github.themoah.anomaly.detection.WindowKey;
import io.github.themoah.anomaly.detection.WindowStats;
import io.github.themoah.anomaly.detection.WindowStore;
import io.github.themoah.anomaly.exception.PersistenceException;
import io.github.themoah.anomaly.exception.ValidationException;
import io.github.themoah.anomaly.metrics.IngestionMetrics;
import io.github.themoah.anomaly.model.Anomaly;
import io.github.themoah.anomaly.model.IngestionResult;
import io.github.themoah.anomaly.model.Reading;
import io.github.themoah.anomaly.storage.TelemetryRepository;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores each incoming reading against its device/metric window and stores it.
 *
 * <p>Per reading: validate, update the window (under the window's own lock),
 * score against the window's prior statistics, then write the reading and any
 * anomaly in one transaction. The call returns only after the commit, so a
 * reading can be queried as soon as {@link #ingest} returns.
 *
 * <p><b>Window/storage divergence.</b> The window is updated before the write.
 * If the write fails, the window is not rolled back and the in-memory
 * statistics include a value storage never saw. A retried reading is then
 * scored against a window that already contains it once. The window lock is
 * never held across database I/O.
 */
public class IngestionService {

  private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

  private final WindowStore windowStore;
  private final AnomalyDetector detector;
  private final TelemetryRepository repository;
  private final IngestionMetrics metrics;
  private final Clock clock;

  public IngestionService(
    WindowStore windowStore,
    AnomalyDetector detector,
    TelemetryRepository repository,
    IngestionMetrics metrics,
    Clock clock
  ) {
    this.windowStore = windowStore;
    this.detector = detector;
    this.repository = repository;
    this.metrics = metrics;
    this.clock = clock;
    metrics.bindWindowCount(windowStore::windowCount);
  }

  public IngestionService(WindowStore windowStore, AnomalyDetector detector, TelemetryRepository repository) {
    this(windowStore, detector, repository, IngestionMetrics.NOOP, Clock.systemUTC());
  }

  /**
   * Ingests one reading.
   *
   * @param submitted the reading; a null timestamp is set from the service clock
   * @return the stored reading and the anomaly, if one was recorded
   * @throws ValidationException if the reading is malformed; nothing is changed
   * @throws PersistenceException if storage fails; the window has already been updated
   */
  public IngestionResult ingest(Reading submitted) {
    long start = System.nanoTime();
    try {
      validate(submitted);
    } catch (ValidationException e) {
      metrics.readingRejected();
      throw e;
    }

    Reading reading = submitted.timestamp() != null
      ? submitted
      : submitted.withTimestamp(clock.instant());
    WindowKey key = reading.key();

    WindowStats prior = windowStore.updateAndStat(key, reading.value());
    Anomaly anomaly = null;
    if (prior.sufficientHistory()) {
      Evaluation evaluation = detector.evaluate(reading.value(), prior);
      if (evaluation.anomalous()) {
        anomaly = Anomaly.of(reading, evaluation.score(), evaluation.type(), detector.threshold());
      }
      log.debug("Scored {} value={} against n={} mean={} stdDev={}: score={}, anomalous={}",
        key, reading.value(), prior.priorCount(), prior.priorMean(), prior.priorStdDev(),
        evaluation.score(), evaluation.anomalous());
    } else {
      log.debug("Insufficient history for {} (n={}), value={} not scored",
        key, prior.priorCount(), reading.value());
    }

    try {
      repository.append(reading, anomaly);
    } catch (PersistenceException e) {
      metrics.persistenceFailed();
      log.warn("Failed to store reading for {}; window already includes value {}: {}",
        key, reading.value(), e.getMessage());
      throw e;
    }

    metrics.readingIngested();
    if (anomaly != null) {
      metrics.anomalyDetected(anomaly.type());
      log.info("Anomaly detected: device={}, metric={}, value={}, score={}, type={}",
        anomaly.deviceId(), anomaly.metricName(), anomaly.value(),
        String.format("%.2f", anomaly.score()), anomaly.type().getValue());
    }
    metrics.ingestDuration(System.nanoTime() - start);

    return anomaly != null
      ? IngestionResult.anomalous(reading, anomaly)
      : IngestionResult.normal(reading);
  }

  static void validate(Reading reading) {
    if (reading == null) {
      throw new ValidationException("Reading must not be null");
    }
    if (reading.deviceId() == null || reading.deviceId().isBlank()) {
      throw ValidationException.blankField("device_id");
    }
    if (reading.metricName() == null || reading.metricName().isBlank()) {
      throw ValidationException.blankField("metric_name");
    }
    if (!Double.isFinite(reading.value())) {
      throw ValidationException.invalidParameter("metric_value", reading.value(), "a finite number");
    }
    if (reading.timestamp() != null && !Reading.isStorable(reading.timestamp())) {
      throw ValidationException.invalidParameter("timestamp", reading.timestamp(),
        "an instant between " + Reading.MIN_TIMESTAMP + " and " + Reading.MAX_TIMESTAMP);
    }
  }
}
