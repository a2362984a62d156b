package io.github.themoah.anomaly.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.anomaly.MainVerticle;
import io.github.themoah.anomaly.config.AppConfig;
import io.github.themoah.anomaly.detection.DetectionConfig;
import io.github.themoah.anomaly.storage.StorageConfig;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

/**
 * Checks that ingestion meters show up on the /metrics scrape endpoint.
 */
@ExtendWith(VertxExtension.class)
public class PrometheusEndpointTest {

  @TempDir
  Path tempDir;

  @Test
  void scrapeIncludesIngestionMeters(Vertx vertx, VertxTestContext testContext) {
    MainVerticle verticle = new MainVerticle(
      new AppConfig(0, 30_000L),
      DetectionConfig.defaults(),
      StorageConfig.forUrl("jdbc:sqlite:" + tempDir.resolve("metrics.db")),
      new MetricsConfig(true, "prometheus", false));
    HttpClient client = vertx.createHttpClient();
    JsonObject reading = new JsonObject()
      .put("device_id", "sensor-1")
      .put("metric_name", "temperature")
      .put("metric_value", 20.0);

    vertx.deployVerticle(verticle)
      .compose(id -> client.request(HttpMethod.POST, verticle.actualPort(), "localhost", "/telemetry"))
      .compose(req -> req.putHeader("content-type", "application/json").send(reading.toBuffer()))
      .compose(HttpClientResponse::body)
      .compose(ignored -> client.request(HttpMethod.GET, verticle.actualPort(), "localhost", "/metrics"))
      .compose(req -> req.send())
      .compose(resp -> {
        testContext.verify(() -> assertEquals(200, resp.statusCode()));
        return resp.body();
      })
      .onComplete(testContext.succeeding(body -> testContext.verify(() -> {
        String scrape = body.toString();
        assertEquals(" 1.0", valueSuffix(scrape, "telemetry_readings_ingested_total{"));
        assertEquals(" 1.0", valueSuffix(scrape, "telemetry_windows_active{"));
        testContext.completeNow();
      })));
  }

  @Test
  void openMetricsOnRequest(Vertx vertx, VertxTestContext testContext) {
    MainVerticle verticle = new MainVerticle(
      new AppConfig(0, 30_000L),
      DetectionConfig.defaults(),
      StorageConfig.forUrl("jdbc:sqlite:" + tempDir.resolve("openmetrics.db")),
      new MetricsConfig(true, "prometheus", false));
    HttpClient client = vertx.createHttpClient();

    vertx.deployVerticle(verticle)
      .compose(id -> client.request(HttpMethod.GET, verticle.actualPort(), "localhost", "/metrics"))
      .compose(req -> req.putHeader("accept", "application/openmetrics-text; version=1.0.0").send())
      .compose(resp -> {
        testContext.verify(() -> {
          assertEquals(200, resp.statusCode());
          assertTrue(resp.getHeader("content-type").startsWith("application/openmetrics-text"));
        });
        return resp.body();
      })
      .onComplete(testContext.succeeding(body -> testContext.verify(() -> {
        assertTrue(body.toString().trim().endsWith("# EOF"));
        testContext.completeNow();
      })));
  }

  /**
   * Text after the closing brace of the first sample line starting with the prefix.
   */
  private static String valueSuffix(String scrape, String prefix) {
    return scrape.lines()
      .filter(line -> line.startsWith(prefix))
      .map(line -> line.substring(line.lastIndexOf('}') + 1))
      .findFirst()
      .orElse("<missing " + prefix + ">");
  }
}
