package io.github.themoah.anomaly.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application configuration loaded from environment variables.
 *
 * @param httpPort HTTP server port, 0 picks a free port
 * @param healthCheckIntervalMs storage health check interval in milliseconds
 */
public record AppConfig(
  int httpPort,
  long healthCheckIntervalMs
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  private static final int DEFAULT_HTTP_PORT = 8000;
  private static final long DEFAULT_HEALTH_CHECK_INTERVAL_MS = 30_000L;

  public static AppConfig defaults() {
    return new AppConfig(DEFAULT_HTTP_PORT, DEFAULT_HEALTH_CHECK_INTERVAL_MS);
  }

  /**
   * Loads configuration from environment variables with defaults.
   *
   * @return AppConfig instance
   */
  public static AppConfig fromEnvironment() {
    return from(Env.system());
  }

  public static AppConfig from(Env env) {
    int port = env.getInt("HTTP_PORT", DEFAULT_HTTP_PORT);
    long interval = env.getLong("STORAGE_HEALTH_CHECK_INTERVAL_MS", DEFAULT_HEALTH_CHECK_INTERVAL_MS);

    log.info("AppConfig loaded: httpPort={}, healthCheckIntervalMs={}", port, interval);
    return new AppConfig(port, interval);
  }
}
