package io.github.themoah.anomaly;

import io.github.themoah.anomaly.config.AppConfig;
import io.github.themoah.anomaly.config.Env;
import io.github.themoah.anomaly.config.VertxConfig;
import io.github.themoah.anomaly.detection.DetectionConfig;
import io.github.themoah.anomaly.metrics.MetricsConfig;
import io.github.themoah.anomaly.storage.StorageConfig;
import io.vertx.core.Vertx;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point. Reads all configuration up front, so a bad setting stops the
 * process before any port or database file is opened.
 */
public class AnomalyLauncher {

  private static final Logger log = LoggerFactory.getLogger(AnomalyLauncher.class);

  private static final int EXIT_BAD_CONFIG = 2;
  private static final int EXIT_DEPLOY_FAILED = 1;
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

  public static void main(String[] args) {
    Env env = Env.system();

    MainVerticle verticle;
    try {
      verticle = new MainVerticle(
        AppConfig.from(env),
        DetectionConfig.from(env),
        StorageConfig.from(env),
        MetricsConfig.from(env));
    } catch (IllegalArgumentException e) {
      log.error("Invalid configuration: {}", e.getMessage());
      System.exit(EXIT_BAD_CONFIG);
      return;
    }

    Vertx vertx = Vertx.vertx(VertxConfig.createVertxOptions(env));
    vertx.deployVerticle(verticle, VertxConfig.createDeploymentOptions(env))
      .onSuccess(id -> log.info("Telemetry anomaly service deployed ({})", id))
      .onFailure(err -> {
        log.error("Failed to deploy MainVerticle", err);
        vertx.close().onComplete(ar -> System.exit(EXIT_DEPLOY_FAILED));
      });

    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      log.info("Shutdown signal received, undeploying");
      try {
        vertx.close().toCompletionStage().toCompletableFuture().get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
      } catch (TimeoutException e) {
        log.warn("Vert.x did not close within {}s", SHUTDOWN_TIMEOUT_SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (ExecutionException e) {
        log.error("Error while closing Vert.x", e.getCause());
      }
    }, "shutdown-hook"));
  }
}
