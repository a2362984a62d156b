package io.github.themoah.anomaly.metrics;

import io.github.themoah.anomaly.model.AnomalyType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports ingestion metrics using a Micrometer MeterRegistry.
 * Works with any Micrometer-supported backend (Prometheus, Datadog, OTLP).
 *
 * <p>Anomalies are tagged by type only. Device ids are unbounded and stay out
 * of the tag set.
 */
public class MicrometerIngestionMetrics implements IngestionMetrics {

  private static final Logger log = LoggerFactory.getLogger(MicrometerIngestionMetrics.class);

  static final String READINGS_INGESTED = "telemetry.readings.ingested";
  static final String READINGS_REJECTED = "telemetry.readings.rejected";
  static final String ANOMALIES_DETECTED = "telemetry.anomalies.detected";
  static final String PERSISTENCE_FAILURES = "telemetry.persistence.failures";
  static final String INGEST_DURATION = "telemetry.ingest.duration";
  static final String WINDOWS_ACTIVE = "telemetry.windows.active";

  private final MeterRegistry registry;
  private final Counter ingested;
  private final Counter rejected;
  private final Counter persistenceFailures;
  private final Map<AnomalyType, Counter> anomalies = new EnumMap<>(AnomalyType.class);
  private final Timer ingestTimer;

  public MicrometerIngestionMetrics(MeterRegistry registry) {
    this.registry = registry;
    this.ingested = Counter.builder(READINGS_INGESTED)
      .description("Readings durably stored")
      .register(registry);
    this.rejected = Counter.builder(READINGS_REJECTED)
      .description("Readings rejected by validation")
      .register(registry);
    this.persistenceFailures = Counter.builder(PERSISTENCE_FAILURES)
      .description("Ingestions that failed to write to storage")
      .register(registry);
    for (AnomalyType type : AnomalyType.values()) {
      anomalies.put(type, Counter.builder(ANOMALIES_DETECTED)
        .description("Anomalies recorded")
        .tag("type", type.getValue())
        .register(registry));
    }
    this.ingestTimer = Timer.builder(INGEST_DURATION)
      .description("Time to score and store one reading")
      .register(registry);
  }

  @Override
  public void readingIngested() {
    ingested.increment();
  }

  @Override
  public void readingRejected() {
    rejected.increment();
  }

  @Override
  public void anomalyDetected(AnomalyType type) {
    anomalies.get(type).increment();
  }

  @Override
  public void persistenceFailed() {
    persistenceFailures.increment();
  }

  @Override
  public void ingestDuration(long nanos) {
    ingestTimer.record(nanos, TimeUnit.NANOSECONDS);
  }

  @Override
  public void bindWindowCount(Supplier<Number> windowCount) {
    Gauge.builder(WINDOWS_ACTIVE, windowCount)
      .description("Device/metric windows held in memory")
      .register(registry);
  }

  @Override
  public void close() {
    log.info("Closing meter registry");
    registry.close();
  }
}
