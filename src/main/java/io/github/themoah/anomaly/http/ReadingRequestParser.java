package io.github.themoah.anomaly.http;

import io.github.themoah.anomaly.exception.ValidationException;
import io.github.themoah.anomaly.model.Reading;
import io.vertx.core.json.JsonObject;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Turns request JSON and query strings into typed values.
 *
 * <p>Body fields: device_id, metric_name, metric_value (number or numeric
 * string), optional unit, optional ISO-8601 timestamp. Timestamps without an
 * offset are taken as UTC.
 */
final class ReadingRequestParser {

  private ReadingRequestParser() {}

  static Reading parseReading(JsonObject body) {
    if (body == null) {
      throw new ValidationException("Request body must be a JSON object");
    }
    return new Reading(
      stringField(body, "device_id"),
      stringField(body, "metric_name"),
      numberField(body, "metric_value"),
      stringField(body, "unit"),
      parseInstant("timestamp", stringField(body, "timestamp"))
    );
  }

  static Instant parseInstant(String name, String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    Instant instant;
    try {
      instant = OffsetDateTime.parse(raw).toInstant();
    } catch (DateTimeParseException e) {
      try {
        instant = LocalDateTime.parse(raw).toInstant(ZoneOffset.UTC);
      } catch (DateTimeParseException inner) {
        throw ValidationException.invalidParameter(name, raw, "an ISO-8601 timestamp");
      }
    }
    if (!Reading.isStorable(instant)) {
      throw ValidationException.invalidParameter(name, raw, "a timestamp within the epoch-millisecond range");
    }
    return instant;
  }

  static Integer parseInt(String name, String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw ValidationException.invalidParameter(name, raw, "an integer");
    }
  }

  private static String stringField(JsonObject body, String name) {
    Object value = body.getValue(name);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String s)) {
      throw ValidationException.invalidParameter(name, value, "a string");
    }
    return s;
  }

  private static double numberField(JsonObject body, String name) {
    Object value = body.getValue(name);
    if (value instanceof Number n) {
      return n.doubleValue();
    }
    if (value instanceof String s) {
      try {
        return Double.parseDouble(s.trim());
      } catch (NumberFormatException e) {
        throw ValidationException.invalidParameter(name, s, "a number");
      }
    }
    if (value == null) {
      throw new ValidationException(String.format("Field '%s' is required", name));
    }
    throw ValidationException.invalidParameter(name, value, "a number");
  }
}
