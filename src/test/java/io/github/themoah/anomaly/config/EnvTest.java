package io.github.themoah.anomaly.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for Env lookups and AppConfig loading.
 */
public class EnvTest {

  private static Env env(Map<String, String> vars) {
    return new Env(vars::get);
  }

  @Test
  void missingOrBlank_usesDefault() {
    Env env = env(Map.of("BLANK", "  "));

    assertEquals("fallback", env.getString("MISSING", "fallback"));
    assertEquals("fallback", env.getString("BLANK", "fallback"));
    assertEquals(7, env.getInt("MISSING", 7));
    assertEquals(7L, env.getLong("BLANK", 7L));
    assertTrue(env.getBoolean("MISSING", true));
  }

  @Test
  void valuesAreTrimmedAndParsed() {
    Env env = env(Map.of(
      "PORT", " 9090 ",
      "INTERVAL", "15000",
      "RATIO", "0.75",
      "FLAG", "false",
      "NAME", " telemetry "
    ));

    assertEquals(9090, env.getInt("PORT", 0));
    assertEquals(15000L, env.getLong("INTERVAL", 0L));
    assertEquals(0.75, env.getDouble("RATIO", 0.0), 0.0);
    assertFalse(env.getBoolean("FLAG", true));
    assertEquals("telemetry", env.getString("NAME", null));
  }

  @Test
  void malformedNumbers_fallBackToDefault() {
    Env env = env(Map.of("PORT", "eighty", "RATIO", "NaN", "BIG", "Infinity", "LONG", "1.5"));

    assertEquals(8000, env.getInt("PORT", 8000));
    assertEquals(2.5, env.getDouble("RATIO", 2.5), 0.0);
    assertEquals(2.5, env.getDouble("BIG", 2.5), 0.0);
    assertEquals(3L, env.getLong("LONG", 3L));
  }

  @Test
  void appConfig_defaults() {
    AppConfig config = AppConfig.from(env(Map.of()));

    assertEquals(8000, config.httpPort());
    assertEquals(30_000L, config.healthCheckIntervalMs());
    assertEquals(AppConfig.defaults(), config);
  }

  @Test
  void appConfig_overrides() {
    AppConfig config = AppConfig.from(env(Map.of(
      "HTTP_PORT", "8081",
      "STORAGE_HEALTH_CHECK_INTERVAL_MS", "1000"
    )));

    assertEquals(8081, config.httpPort());
    assertEquals(1000L, config.healthCheckIntervalMs());
  }
}
