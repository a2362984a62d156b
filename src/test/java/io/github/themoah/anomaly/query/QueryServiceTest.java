package io.github.themoah.anomaly.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.anomaly.exception.ValidationException;
import io.github.themoah.anomaly.model.Anomaly;
import io.github.themoah.anomaly.model.AnomalyType;
import io.github.themoah.anomaly.model.Reading;
import io.github.themoah.anomaly.storage.SqliteTelemetryRepository;
import io.github.themoah.anomaly.storage.StorageConfig;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for QueryService over a real SQLite file.
 */
public class QueryServiceTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  @TempDir
  Path tempDir;

  private SqliteTelemetryRepository repository;
  private QueryService queryService;

  @BeforeEach
  void setUp() {
    repository = new SqliteTelemetryRepository(
      StorageConfig.forUrl("jdbc:sqlite:" + tempDir.resolve("query.db")));
    repository.initialize();
    queryService = new QueryService(repository);
  }

  @AfterEach
  void tearDown() {
    repository.close();
  }

  @Test
  void emptyStore_emptyResults() {
    assertTrue(queryService.listAnomalies().isEmpty());
    assertTrue(queryService.timeSeries("sensor-1", "temperature").isEmpty());
    assertTrue(queryService.metricSummary("sensor-1", "temperature").isEmpty());
  }

  @Test
  void listAnomalies_defaultLimit() {
    for (int i = 0; i < QueryService.DEFAULT_LIMIT + 5; i++) {
      Reading r = new Reading("sensor-1", "temperature", i, null, T0.plusSeconds(i));
      repository.append(r, Anomaly.of(r, 3.0, AnomalyType.HIGH, 2.5));
    }

    List<Anomaly> anomalies = queryService.listAnomalies();

    assertEquals(QueryService.DEFAULT_LIMIT, anomalies.size());
    assertEquals(QueryService.DEFAULT_LIMIT + 4, anomalies.get(0).value(), 0.0);
  }

  @Test
  void listAnomalies_zeroLimit_empty() {
    Reading r = new Reading("sensor-1", "temperature", 1.0, null, T0);
    repository.append(r, Anomaly.of(r, 3.0, AnomalyType.HIGH, 2.5));

    assertTrue(queryService.listAnomalies(0, null).isEmpty());
  }

  @Test
  void timeSeries_limitCapsOldestFirst() {
    for (int i = 0; i < 10; i++) {
      repository.append(new Reading("sensor-1", "temperature", i, null, T0.plusSeconds(i)), null);
    }

    List<Reading> capped = queryService.timeSeries("sensor-1", "temperature", null, null, 3);

    assertEquals(List.of(0.0, 1.0, 2.0), capped.stream().map(Reading::value).toList());
    assertEquals(10, queryService.timeSeries("sensor-1", "temperature").size());
  }

  @Test
  void recentReadings_defaultCount() {
    for (int i = 0; i < 15; i++) {
      repository.append(new Reading("sensor-1", "temperature", i, null, T0.plusSeconds(i)), null);
    }

    List<Reading> recent = queryService.recentReadings("sensor-1", null);

    assertEquals(QueryService.DEFAULT_RECENT_COUNT, recent.size());
    assertEquals(14.0, recent.get(0).value(), 0.0);
  }

  @Test
  void invalidArguments_rejected() {
    assertThrows(ValidationException.class, () -> queryService.listAnomalies(-1, null));
    assertThrows(ValidationException.class, () -> queryService.listAnomalies(-1, 10, null));
    assertThrows(ValidationException.class, () -> queryService.timeSeries("", "temperature"));
    assertThrows(ValidationException.class, () -> queryService.timeSeries("sensor-1", " "));
    assertThrows(ValidationException.class,
      () -> queryService.timeSeries("sensor-1", "temperature", T0.plusSeconds(1), T0));
    assertThrows(ValidationException.class, () -> queryService.recentReadings("sensor-1", -2));
    assertThrows(ValidationException.class, () -> queryService.readingsForDevice(null, 0, 10));
  }

  @Test
  void fromEqualsTo_returnsReadingsAtThatInstant() {
    repository.append(new Reading("sensor-1", "temperature", 5.0, null, T0), null);
    repository.append(new Reading("sensor-1", "temperature", 6.0, null, T0.plusSeconds(1)), null);

    List<Reading> exact = queryService.timeSeries("sensor-1", "temperature", T0, T0);

    assertEquals(1, exact.size());
    assertEquals(5.0, exact.get(0).value(), 0.0);
  }
}
