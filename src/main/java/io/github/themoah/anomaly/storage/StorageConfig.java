package io.github.themoah.anomaly.storage;

import io.github.themoah.anomaly.config.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for the relational store.
 *
 * @param jdbcUrl JDBC URL of the SQLite database
 * @param queryTimeoutSeconds per-statement timeout, 0 disables it
 * @param busyTimeoutMs how long a write waits on a locked database before failing
 */
public record StorageConfig(
  String jdbcUrl,
  int queryTimeoutSeconds,
  int busyTimeoutMs
) {

  private static final Logger log = LoggerFactory.getLogger(StorageConfig.class);

  private static final String DEFAULT_JDBC_URL = "jdbc:sqlite:telemetry.db";
  private static final int DEFAULT_QUERY_TIMEOUT_SECONDS = 5;
  private static final int DEFAULT_BUSY_TIMEOUT_MS = 5000;

  public static StorageConfig forUrl(String jdbcUrl) {
    return new StorageConfig(jdbcUrl, DEFAULT_QUERY_TIMEOUT_SECONDS, DEFAULT_BUSY_TIMEOUT_MS);
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>STORAGE_JDBC_URL - JDBC URL (default: jdbc:sqlite:telemetry.db)</li>
   *   <li>STORAGE_QUERY_TIMEOUT_SECONDS - Statement timeout (default: 5)</li>
   *   <li>STORAGE_BUSY_TIMEOUT_MS - Lock wait before a write fails (default: 5000)</li>
   * </ul>
   */
  public static StorageConfig fromEnvironment() {
    return from(Env.system());
  }

  public static StorageConfig from(Env env) {
    String url = env.getString("STORAGE_JDBC_URL", DEFAULT_JDBC_URL);
    int queryTimeout = env.getInt("STORAGE_QUERY_TIMEOUT_SECONDS", DEFAULT_QUERY_TIMEOUT_SECONDS);
    int busyTimeout = env.getInt("STORAGE_BUSY_TIMEOUT_MS", DEFAULT_BUSY_TIMEOUT_MS);

    log.info("Storage config: jdbcUrl={}, queryTimeoutSeconds={}, busyTimeoutMs={}",
      url, queryTimeout, busyTimeout);
    return new StorageConfig(url, queryTimeout, busyTimeout);
  }
}
