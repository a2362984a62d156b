package io.github.themoah.anomaly.health;

import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves /healthz (process is up) and /readyz (storage answered its last ping).
 */
public class HealthCheckHandler {

  private static final Logger log = LoggerFactory.getLogger(HealthCheckHandler.class);

  private final DatabaseHealthMonitor healthMonitor;

  public HealthCheckHandler(DatabaseHealthMonitor healthMonitor) {
    this.healthMonitor = healthMonitor;
  }

  public void registerRoutes(Router router) {
    router.get("/healthz").handler(ctx -> write(ctx, HealthCheckResponse.liveness()));
    router.get("/readyz").handler(ctx -> write(ctx, HealthCheckResponse.readiness(
      healthMonitor.isDatabaseReachable(), healthMonitor.lastCheckedAt())));
    log.info("Health check routes registered: /healthz, /readyz");
  }

  private static void write(RoutingContext ctx, HealthCheckResponse response) {
    ctx.response()
      .setStatusCode(response.status().httpStatus())
      .putHeader(HttpHeaders.CONTENT_TYPE, "application/json")
      .putHeader(HttpHeaders.CACHE_CONTROL, "no-store")
      .end(response.toJson().encode());
  }
}
