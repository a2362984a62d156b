package io.github.themoah.anomaly.health;

import io.github.themoah.anomaly.storage.TelemetryRepository;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pings storage periodically and remembers whether it answered.
 * The ping runs on a worker thread since JDBC blocks.
 */
public class DatabaseHealthMonitor {

  private static final Logger log = LoggerFactory.getLogger(DatabaseHealthMonitor.class);

  private final Vertx vertx;
  private final TelemetryRepository repository;
  private final long intervalMs;
  private final Clock clock;
  private final AtomicReference<HealthStatus> databaseStatus = new AtomicReference<>(HealthStatus.DOWN);
  private final AtomicReference<Instant> lastCheckedAt = new AtomicReference<>();

  private Long timerId;

  public DatabaseHealthMonitor(Vertx vertx, TelemetryRepository repository, long intervalMs) {
    this(vertx, repository, intervalMs, Clock.systemUTC());
  }

  public DatabaseHealthMonitor(Vertx vertx, TelemetryRepository repository, long intervalMs, Clock clock) {
    this.vertx = vertx;
    this.repository = repository;
    this.intervalMs = intervalMs;
    this.clock = clock;
  }

  /**
   * Runs an initial check, then schedules the periodic one.
   *
   * @return Future that completes when the initial check finishes
   */
  public Future<Void> start() {
    log.info("Starting database health monitor with interval: {}ms", intervalMs);

    return check()
      .onComplete(ar -> {
        timerId = vertx.setPeriodic(intervalMs, id -> check());
        log.info("Database health monitor started, timer ID: {}", timerId);
      })
      .mapEmpty();
  }

  public Future<Void> stop() {
    log.info("Stopping database health monitor");
    if (timerId != null) {
      vertx.cancelTimer(timerId);
      timerId = null;
    }
    databaseStatus.set(HealthStatus.DOWN);
    return Future.succeededFuture();
  }

  public boolean isDatabaseReachable() {
    return databaseStatus.get().isUp();
  }

  /**
   * When the last ping finished, or null before the first one.
   */
  public Instant lastCheckedAt() {
    return lastCheckedAt.get();
  }

  Future<HealthStatus> check() {
    return vertx.executeBlocking(repository::ping, false)
      .otherwise(err -> {
        log.debug("Database ping threw: {}", err.getMessage());
        return false;
      })
      .map(reachable -> {
        HealthStatus current = HealthStatus.of(reachable);
        lastCheckedAt.set(clock.instant());
        HealthStatus previous = databaseStatus.getAndSet(current);
        if (previous != current) {
          if (current.isUp()) {
            log.info("Database reachable");
          } else {
            log.warn("Database unreachable");
          }
        }
        return current;
      });
  }
}
