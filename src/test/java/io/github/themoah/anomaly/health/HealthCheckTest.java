package io.github.themoah.anomaly.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.anomaly.storage.SqliteTelemetryRepository;
import io.github.themoah.anomaly.storage.StorageConfig;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

/**
 * Unit tests for health check components.
 */
@ExtendWith(VertxExtension.class)
public class HealthCheckTest {

  private static final Instant CHECK_TIME = Instant.parse("2024-05-01T10:00:00Z");

  @TempDir
  Path tempDir;

  @Test
  void healthStatus_values() {
    assertEquals("UP", HealthStatus.UP.getValue());
    assertEquals("DOWN", HealthStatus.DOWN.getValue());
    assertEquals(HealthStatus.UP, HealthStatus.of(true));
    assertEquals(200, HealthStatus.UP.httpStatus());
    assertEquals(503, HealthStatus.DOWN.httpStatus());
  }

  @Test
  void healthCheckResponse_liveness() {
    HealthCheckResponse response = HealthCheckResponse.liveness();

    assertEquals(HealthStatus.UP, response.status());
    assertNull(response.database());

    JsonObject json = response.toJson();
    assertEquals("UP", json.getString("status"));
    assertFalse(json.containsKey("database"));
  }

  @Test
  void healthCheckResponse_readiness_reachable() {
    HealthCheckResponse response = HealthCheckResponse.readiness(true, null);

    assertEquals(HealthStatus.UP, response.status());
    assertEquals("reachable", response.database());
    assertEquals("reachable", response.toJson().getString("database"));
  }

  @Test
  void healthCheckResponse_readiness_unreachable() {
    HealthCheckResponse response = HealthCheckResponse.readiness(false, null);

    assertEquals(HealthStatus.DOWN, response.status());
    assertEquals("DOWN", response.toJson().getString("status"));
    assertEquals("unreachable", response.toJson().getString("database"));
    assertFalse(response.toJson().containsKey("checked_at"));
  }

  @Test
  void healthCheckResponse_readiness_withCheckTime() {
    JsonObject json = HealthCheckResponse.readiness(true, CHECK_TIME).toJson();

    assertEquals("2024-05-01T10:00:00Z", json.getString("checked_at"));
  }

  @Test
  void monitor_tracksRepositoryState(Vertx vertx, VertxTestContext testContext) {
    SqliteTelemetryRepository repository = new SqliteTelemetryRepository(
      StorageConfig.forUrl("jdbc:sqlite:" + tempDir.resolve("health.db")));
    DatabaseHealthMonitor monitor = new DatabaseHealthMonitor(
      vertx, repository, 60_000L, Clock.fixed(CHECK_TIME, ZoneOffset.UTC));

    assertFalse(monitor.isDatabaseReachable());
    assertNull(monitor.lastCheckedAt());

    monitor.start()
      .compose(v -> {
        testContext.verify(() -> {
          assertTrue(monitor.isDatabaseReachable());
          assertEquals(CHECK_TIME, monitor.lastCheckedAt());
        });
        repository.close();
        return monitor.check();
      })
      .compose(status -> {
        testContext.verify(() -> {
          assertEquals(HealthStatus.DOWN, status);
          assertFalse(monitor.isDatabaseReachable());
        });
        return monitor.stop();
      })
      .onComplete(testContext.succeedingThenComplete());
  }
}
