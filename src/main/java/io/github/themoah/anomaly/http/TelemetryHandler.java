package io.github.themoah.anomaly.http;

import io.github.themoah.anomaly.exception.PersistenceException;
import io.github.themoah.anomaly.exception.ValidationException;
import io.github.themoah.anomaly.ingest.IngestionService;
import io.github.themoah.anomaly.model.Anomaly;
import io.github.themoah.anomaly.model.IngestionResult;
import io.github.themoah.anomaly.model.Reading;
import io.github.themoah.anomaly.query.QueryService;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP routes for ingesting readings and querying stored data.
 *
 * <p>Service calls block on JDBC and run on worker threads via unordered
 * {@code executeBlocking}.
 */
public class TelemetryHandler {

  private static final Logger log = LoggerFactory.getLogger(TelemetryHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";
  private static final int DEFAULT_SERIES_LIMIT = 200;
  private static final long MAX_BODY_BYTES = 64 * 1024;

  private final Vertx vertx;
  private final IngestionService ingestionService;
  private final QueryService queryService;

  public TelemetryHandler(Vertx vertx, IngestionService ingestionService, QueryService queryService) {
    this.vertx = vertx;
    this.ingestionService = ingestionService;
    this.queryService = queryService;
  }

  public void registerRoutes(Router router) {
    router.post("/telemetry")
      .handler(BodyHandler.create().setBodyLimit(MAX_BODY_BYTES))
      .handler(this::handleIngest);
    router.get("/telemetry").handler(this::handleListReadings);
    router.get("/telemetry/device/:deviceId").handler(this::handleDeviceReadings);
    router.get("/telemetry/recent/:deviceId").handler(this::handleRecentReadings);
    router.get("/telemetry/summary/:deviceId/:metricName").handler(this::handleSummary);
    router.get("/telemetry/series/:deviceId/:metricName").handler(this::handleSeries);
    router.get("/anomalies").handler(this::handleListAnomalies);
    log.info("Telemetry routes registered: /telemetry, /telemetry/device, /telemetry/recent, "
      + "/telemetry/summary, /telemetry/series, /anomalies");
  }

  private void handleIngest(RoutingContext ctx) {
    Reading reading;
    try {
      JsonObject body = ctx.body().asJsonObject();
      reading = ReadingRequestParser.parseReading(body);
    } catch (DecodeException | ClassCastException e) {
      respondError(ctx, 400, "Request body must be a JSON object");
      return;
    } catch (ValidationException e) {
      respondError(ctx, 400, e.getMessage());
      return;
    }

    respond(ctx, () -> ingestionService.ingest(reading), IngestionResult::toJson);
  }

  private void handleListReadings(RoutingContext ctx) {
    respond(ctx,
      () -> queryService.listReadings(skip(ctx), intParam(ctx, "limit")),
      TelemetryHandler::readingsJson);
  }

  private void handleDeviceReadings(RoutingContext ctx) {
    String deviceId = ctx.pathParam("deviceId");
    respondNonEmpty(ctx,
      () -> queryService.readingsForDevice(deviceId, skip(ctx), intParam(ctx, "limit")),
      TelemetryHandler::readingsJson,
      "No telemetry data found for this device.");
  }

  private void handleRecentReadings(RoutingContext ctx) {
    String deviceId = ctx.pathParam("deviceId");
    respondNonEmpty(ctx,
      () -> queryService.recentReadings(deviceId, intParam(ctx, "count")),
      TelemetryHandler::readingsJson,
      "No recent telemetry data found for this device.");
  }

  private void handleSummary(RoutingContext ctx) {
    String deviceId = ctx.pathParam("deviceId");
    String metricName = ctx.pathParam("metricName");
    vertx.executeBlocking(() -> queryService.metricSummary(deviceId, metricName), false)
      .onSuccess(summary -> {
        if (summary.isEmpty()) {
          respondError(ctx, 404, "No data found for this metric or device.");
        } else {
          respondJson(ctx, 200, summary.get().toJson().encode());
        }
      })
      .onFailure(err -> handleFailure(ctx, err));
  }

  /**
   * Ordered readings plus the anomalies among them, the data a plot of the
   * metric's trend needs.
   */
  private void handleSeries(RoutingContext ctx) {
    String deviceId = ctx.pathParam("deviceId");
    String metricName = ctx.pathParam("metricName");
    respond(ctx, () -> {
      Instant from = instantParam(ctx, "from");
      Instant to = instantParam(ctx, "to");
      Integer limit = intParam(ctx, "limit");
      List<Reading> readings = queryService.timeSeries(
        deviceId, metricName, from, to, limit != null ? limit : DEFAULT_SERIES_LIMIT);
      if (readings.isEmpty()) {
        return null;
      }
      Instant last = readings.get(readings.size() - 1).timestamp();
      List<Anomaly> anomalies = queryService.anomaliesFor(
        deviceId, metricName, readings.get(0).timestamp(), last);
      return new JsonObject()
        .put("device_id", deviceId)
        .put("metric_name", metricName)
        .put("readings", readingsJson(readings))
        .put("anomalies", anomaliesJson(anomalies));
    }, json -> json, "No telemetry data found for plotting.");
  }

  private void handleListAnomalies(RoutingContext ctx) {
    respond(ctx,
      () -> queryService.listAnomalies(skip(ctx), intParam(ctx, "limit"), instantParam(ctx, "since")),
      TelemetryHandler::anomaliesJson);
  }

  private <T> void respond(RoutingContext ctx, Callable<T> call, Function<T, Object> toJson) {
    respond(ctx, call, toJson, "Not Found");
  }

  /**
   * Runs the call on a worker and writes its JSON; a null result is a 404.
   */
  private <T> void respond(
      RoutingContext ctx, Callable<T> call, Function<T, Object> toJson, String notFound) {
    vertx.executeBlocking(call, false)
      .onSuccess(result -> {
        if (result == null) {
          respondError(ctx, 404, notFound);
        } else {
          respondJson(ctx, 200, encode(toJson.apply(result)));
        }
      })
      .onFailure(err -> handleFailure(ctx, err));
  }

  private <T> void respondNonEmpty(
      RoutingContext ctx, Callable<List<T>> call, Function<List<T>, JsonArray> toJson, String notFound) {
    vertx.executeBlocking(call, false)
      .onSuccess(rows -> {
        if (rows.isEmpty()) {
          respondError(ctx, 404, notFound);
        } else {
          respondJson(ctx, 200, toJson.apply(rows).encode());
        }
      })
      .onFailure(err -> handleFailure(ctx, err));
  }

  private void handleFailure(RoutingContext ctx, Throwable err) {
    if (err instanceof ValidationException) {
      respondError(ctx, 400, err.getMessage());
    } else if (err instanceof PersistenceException) {
      log.error("Storage failure on {} {}", ctx.request().method(), ctx.request().path(), err);
      respondError(ctx, 500, "Failed to process telemetry data: " + err.getMessage());
    } else {
      log.error("Unexpected failure on {} {}", ctx.request().method(), ctx.request().path(), err);
      respondError(ctx, 500, "Internal server error");
    }
  }

  private static String encode(Object json) {
    if (json instanceof JsonObject object) {
      return object.encode();
    }
    return ((JsonArray) json).encode();
  }

  private static void respondJson(RoutingContext ctx, int status, String body) {
    ctx.response()
      .setStatusCode(status)
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .end(body);
  }

  private static void respondError(RoutingContext ctx, int status, String message) {
    respondJson(ctx, status, new JsonObject().put("error", message).encode());
  }

  private static JsonArray readingsJson(List<Reading> readings) {
    JsonArray array = new JsonArray();
    readings.forEach(r -> array.add(r.toJson()));
    return array;
  }

  private static JsonArray anomaliesJson(List<Anomaly> anomalies) {
    JsonArray array = new JsonArray();
    anomalies.forEach(a -> array.add(a.toJson()));
    return array;
  }

  private static int skip(RoutingContext ctx) {
    Integer skip = intParam(ctx, "skip");
    return skip != null ? skip : 0;
  }

  private static Integer intParam(RoutingContext ctx, String name) {
    return ReadingRequestParser.parseInt(name, ctx.request().getParam(name));
  }

  private static Instant instantParam(RoutingContext ctx, String name) {
    return ReadingRequestParser.parseInstant(name, ctx.request().getParam(name));
  }
}
