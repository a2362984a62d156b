package io.github.themoah.anomaly;

import io.github.themoah.anomaly.config.AppConfig;
import io.github.themoah.anomaly.config.Env;
import io.github.themoah.anomaly.detection.AnomalyDetector;
import io.github.themoah.anomaly.detection.DetectionConfig;
import io.github.themoah.anomaly.detection.WindowStore;
import io.github.themoah.anomaly.health.DatabaseHealthMonitor;
import io.github.themoah.anomaly.health.HealthCheckHandler;
import io.github.themoah.anomaly.http.TelemetryHandler;
import io.github.themoah.anomaly.ingest.IngestionService;
import io.github.themoah.anomaly.metrics.IngestionMetrics;
import io.github.themoah.anomaly.metrics.MetricsConfig;
import io.github.themoah.anomaly.metrics.MicrometerConfig;
import io.github.themoah.anomaly.metrics.MicrometerIngestionMetrics;
import io.github.themoah.anomaly.metrics.PrometheusHandler;
import io.github.themoah.anomaly.query.QueryService;
import io.github.themoah.anomaly.storage.SqliteTelemetryRepository;
import io.github.themoah.anomaly.storage.StorageConfig;
import io.github.themoah.anomaly.storage.TelemetryRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main verticle: opens storage, wires the detection engine, and serves the
 * ingestion, query, health and metrics routes.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);

  private final AppConfig appConfig;
  private final DetectionConfig detectionConfig;
  private final StorageConfig storageConfig;
  private final MetricsConfig metricsConfig;

  private TelemetryRepository repository;
  private IngestionMetrics ingestionMetrics;
  private DatabaseHealthMonitor healthMonitor;
  private HttpServer httpServer;

  public MainVerticle() {
    this(
      AppConfig.fromEnvironment(),
      DetectionConfig.fromEnvironment(),
      StorageConfig.fromEnvironment(),
      MetricsConfig.fromEnvironment()
    );
  }

  public MainVerticle(
    AppConfig appConfig,
    DetectionConfig detectionConfig,
    StorageConfig storageConfig,
    MetricsConfig metricsConfig
  ) {
    this.appConfig = appConfig;
    this.detectionConfig = detectionConfig;
    this.storageConfig = storageConfig;
    this.metricsConfig = metricsConfig;
  }

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting telemetry anomaly MainVerticle");

    Router router = Router.router(vertx);
    ingestionMetrics = createIngestionMetrics(router);

    vertx.executeBlocking(this::openRepository, false)
      .compose(repo -> {
        repository = repo;
        wireRoutes(router, repo);
        healthMonitor = new DatabaseHealthMonitor(vertx, repo, appConfig.healthCheckIntervalMs());
        new HealthCheckHandler(healthMonitor).registerRoutes(router);
        router.route().handler(ctx -> ctx.response()
          .setStatusCode(404)
          .putHeader("content-type", "application/json")
          .end("{\"error\": \"Not Found\"}"));
        return healthMonitor.start();
      })
      .compose(v -> startHttpServer(router, appConfig.httpPort()))
      .onSuccess(server -> {
        httpServer = server;
        log.info("Telemetry anomaly service started on port {}", server.actualPort());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start telemetry anomaly service", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping telemetry anomaly MainVerticle");

    Future<Void> stopHealthMonitor = (healthMonitor != null)
      ? healthMonitor.stop()
      : Future.succeededFuture();

    Future<Void> stopHttpServer = (httpServer != null)
      ? httpServer.close()
      : Future.succeededFuture();

    stopHealthMonitor
      .compose(v -> stopHttpServer)
      .compose(v -> vertx.executeBlocking(() -> {
        if (repository != null) {
          repository.close();
        }
        if (ingestionMetrics != null) {
          ingestionMetrics.close();
        }
        return null;
      }, false))
      .onSuccess(v -> {
        log.info("Telemetry anomaly service stopped");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during shutdown", err);
        stopPromise.fail(err);
      });
  }

  /**
   * Actual listening port, useful when configured with port 0.
   */
  public int actualPort() {
    return httpServer != null ? httpServer.actualPort() : -1;
  }

  private TelemetryRepository openRepository() {
    TelemetryRepository repo = new SqliteTelemetryRepository(storageConfig);
    repo.initialize();
    return repo;
  }

  private void wireRoutes(Router router, TelemetryRepository repo) {
    WindowStore windowStore = new WindowStore(detectionConfig);
    AnomalyDetector detector = new AnomalyDetector(detectionConfig);
    IngestionService ingestionService = new IngestionService(
      windowStore, detector, repo, ingestionMetrics, Clock.systemUTC());
    QueryService queryService = new QueryService(repo);

    new TelemetryHandler(vertx, ingestionService, queryService).registerRoutes(router);
  }

  private Future<HttpServer> startHttpServer(Router router, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port)
      .onSuccess(server -> log.info("HTTP server started on port {}", server.actualPort()))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }

  private IngestionMetrics createIngestionMetrics(Router router) {
    Optional<MeterRegistry> registry = MicrometerConfig.createRegistry(metricsConfig, Env.system());
    if (registry.isEmpty()) {
      log.info("Metrics reporting is disabled");
      return IngestionMetrics.NOOP;
    }

    if (registry.get() instanceof PrometheusMeterRegistry prometheusRegistry) {
      new PrometheusHandler(prometheusRegistry).registerRoutes(router);
    }
    return new MicrometerIngestionMetrics(registry.get());
  }
}
