package io.github.themoah.anomaly.health;

import io.vertx.core.json.JsonObject;
import java.time.Instant;

/**
 * Body of the liveness and readiness probes.
 *
 * @param status overall status
 * @param database "reachable" or "unreachable"; null on the liveness probe
 * @param checkedAt when storage was last pinged; null if never, or on liveness
 */
public record HealthCheckResponse(
  HealthStatus status,
  String database,
  Instant checkedAt
) {

  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(HealthStatus.UP, null, null);
  }

  public static HealthCheckResponse readiness(boolean databaseReachable, Instant checkedAt) {
    return new HealthCheckResponse(
      HealthStatus.of(databaseReachable),
      databaseReachable ? "reachable" : "unreachable",
      checkedAt);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.getValue());
    if (database != null) {
      json.put("database", database);
    }
    if (checkedAt != null) {
      json.put("checked_at", checkedAt.toString());
    }
    return json;
  }
}
