package io.github.themoah.anomaly.storage;

import io.github.themoah.anomaly.detection.WindowKey;
import io.github.themoah.anomaly.exception.PersistenceException;
import io.github.themoah.anomaly.model.Anomaly;
import io.github.themoah.anomaly.model.AnomalyType;
import io.github.themoah.anomaly.model.MetricSummary;
import io.github.themoah.anomaly.model.Reading;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

/**
 * SQLite implementation of {@link TelemetryRepository}.
 *
 * <p>Readings and anomalies live in two append-only tables, both indexed on
 * (device_id, metric_name, ts). Timestamps are stored as epoch milliseconds.
 * A single connection is shared and guarded by a lock; SQLite serializes
 * writers anyway, and the lock keeps the manual commit/rollback of
 * {@link #append} from interleaving with other statements.
 */
public class SqliteTelemetryRepository implements TelemetryRepository {

  private static final Logger log = LoggerFactory.getLogger(SqliteTelemetryRepository.class);

  private static final String[] SCHEMA = {
    "CREATE TABLE IF NOT EXISTS readings ("
      + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
      + "device_id TEXT NOT NULL, "
      + "metric_name TEXT NOT NULL, "
      + "value REAL NOT NULL, "
      + "unit TEXT, "
      + "ts INTEGER NOT NULL)",
    "CREATE INDEX IF NOT EXISTS idx_readings_key_ts ON readings (device_id, metric_name, ts)",
    "CREATE TABLE IF NOT EXISTS anomalies ("
      + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
      + "reading_id INTEGER NOT NULL UNIQUE REFERENCES readings (id), "
      + "device_id TEXT NOT NULL, "
      + "metric_name TEXT NOT NULL, "
      + "value REAL NOT NULL, "
      + "unit TEXT, "
      + "ts INTEGER NOT NULL, "
      + "score REAL NOT NULL, "
      + "anomaly_type TEXT NOT NULL, "
      + "threshold REAL NOT NULL)",
    "CREATE INDEX IF NOT EXISTS idx_anomalies_key_ts ON anomalies (device_id, metric_name, ts)",
    "CREATE INDEX IF NOT EXISTS idx_anomalies_ts ON anomalies (ts)"
  };

  private static final String INSERT_READING =
    "INSERT INTO readings (device_id, metric_name, value, unit, ts) VALUES (?, ?, ?, ?, ?)";
  private static final String INSERT_ANOMALY =
    "INSERT INTO anomalies (reading_id, device_id, metric_name, value, unit, ts, score, anomaly_type, threshold) "
      + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";

  private static final String READING_COLUMNS = "device_id, metric_name, value, unit, ts";
  private static final String ANOMALY_COLUMNS =
    "device_id, metric_name, value, unit, ts, score, anomaly_type, threshold";

  private final StorageConfig config;
  private final Connection connection;
  private final Object lock = new Object();

  public SqliteTelemetryRepository(StorageConfig config) {
    this.config = config;
    try {
      SQLiteConfig sqliteConfig = new SQLiteConfig();
      sqliteConfig.enforceForeignKeys(true);
      sqliteConfig.setBusyTimeout(config.busyTimeoutMs());
      this.connection = DriverManager.getConnection(config.jdbcUrl(), sqliteConfig.toProperties());
    } catch (SQLException e) {
      throw new PersistenceException("Failed to open database " + config.jdbcUrl(), e);
    }
    log.info("SQLite repository opened: {}", config.jdbcUrl());
  }

  @Override
  public void initialize() {
    synchronized (lock) {
      try (Statement stmt = connection.createStatement()) {
        for (String ddl : SCHEMA) {
          stmt.executeUpdate(ddl);
        }
      } catch (SQLException e) {
        throw new PersistenceException("Failed to create schema", e);
      }
    }
    log.info("Database schema ready (tables: readings, anomalies)");
  }

  @Override
  public void append(Reading reading, Anomaly anomaly) {
    synchronized (lock) {
      try {
        connection.setAutoCommit(false);
        try {
          long readingId = insertReading(reading);
          if (anomaly != null) {
            insertAnomaly(readingId, anomaly);
          }
          connection.commit();
        } catch (SQLException | RuntimeException e) {
          rollbackQuietly(e);
          restoreAutoCommit(e);
          throw e;
        }
        connection.setAutoCommit(true);
      } catch (SQLException e) {
        throw new PersistenceException(
          "Failed to store reading for " + reading.deviceId() + ":" + reading.metricName(), e);
      }
    }
  }

  @Override
  public List<Anomaly> findAnomalies(Instant since, int skip, int limit) {
    String sql = "SELECT " + ANOMALY_COLUMNS + " FROM anomalies WHERE ts >= ? "
      + "ORDER BY ts DESC, id DESC LIMIT ? OFFSET ?";
    return query("list anomalies", sql, stmt -> {
      stmt.setLong(1, since != null ? since.toEpochMilli() : Long.MIN_VALUE);
      stmt.setInt(2, limit);
      stmt.setInt(3, skip);
    }, SqliteTelemetryRepository::mapAnomaly);
  }

  @Override
  public List<Anomaly> findAnomalies(WindowKey key, Instant from, Instant to) {
    String sql = "SELECT " + ANOMALY_COLUMNS + " FROM anomalies "
      + "WHERE device_id = ? AND metric_name = ? AND ts >= ? AND ts <= ? ORDER BY ts ASC, id ASC";
    return query("list anomalies for " + key, sql, stmt -> {
      stmt.setString(1, key.deviceId());
      stmt.setString(2, key.metricName());
      bindRange(stmt, 3, from, to);
    }, SqliteTelemetryRepository::mapAnomaly);
  }

  @Override
  public List<Reading> findReadings(WindowKey key, Instant from, Instant to, int limit) {
    String sql = "SELECT " + READING_COLUMNS + " FROM readings "
      + "WHERE device_id = ? AND metric_name = ? AND ts >= ? AND ts <= ? "
      + "ORDER BY ts ASC, id ASC LIMIT ?";
    return query("read time series for " + key, sql, stmt -> {
      stmt.setString(1, key.deviceId());
      stmt.setString(2, key.metricName());
      bindRange(stmt, 3, from, to);
      stmt.setInt(5, limit < 0 ? -1 : limit);
    }, SqliteTelemetryRepository::mapReading);
  }

  @Override
  public List<Reading> findReadings(int skip, int limit) {
    String sql = "SELECT " + READING_COLUMNS + " FROM readings ORDER BY ts ASC, id ASC LIMIT ? OFFSET ?";
    return query("list readings", sql, stmt -> {
      stmt.setInt(1, limit);
      stmt.setInt(2, skip);
    }, SqliteTelemetryRepository::mapReading);
  }

  @Override
  public List<Reading> findReadingsByDevice(String deviceId, int skip, int limit) {
    String sql = "SELECT " + READING_COLUMNS + " FROM readings WHERE device_id = ? "
      + "ORDER BY ts ASC, id ASC LIMIT ? OFFSET ?";
    return query("list readings for device " + deviceId, sql, stmt -> {
      stmt.setString(1, deviceId);
      stmt.setInt(2, limit);
      stmt.setInt(3, skip);
    }, SqliteTelemetryRepository::mapReading);
  }

  @Override
  public List<Reading> findRecentReadings(String deviceId, int count) {
    String sql = "SELECT " + READING_COLUMNS + " FROM readings WHERE device_id = ? "
      + "ORDER BY ts DESC, id DESC LIMIT ?";
    return query("list recent readings for device " + deviceId, sql, stmt -> {
      stmt.setString(1, deviceId);
      stmt.setInt(2, count);
    }, SqliteTelemetryRepository::mapReading);
  }

  @Override
  public Optional<MetricSummary> summarize(WindowKey key) {
    String sql = "SELECT COUNT(*) AS n, MIN(value) AS min_value, MAX(value) AS max_value, "
      + "AVG(value) AS avg_value FROM readings WHERE device_id = ? AND metric_name = ?";
    List<MetricSummary> rows = query("summarize " + key, sql, stmt -> {
      stmt.setString(1, key.deviceId());
      stmt.setString(2, key.metricName());
    }, rs -> {
      long n = rs.getLong("n");
      if (n == 0) {
        return null;
      }
      return new MetricSummary(
        key.deviceId(),
        key.metricName(),
        n,
        rs.getDouble("min_value"),
        rs.getDouble("max_value"),
        rs.getDouble("avg_value")
      );
    });
    return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
  }

  @Override
  public boolean ping() {
    synchronized (lock) {
      try (Statement stmt = connection.createStatement()) {
        stmt.setQueryTimeout(config.queryTimeoutSeconds());
        try (ResultSet rs = stmt.executeQuery("SELECT 1")) {
          return rs.next();
        }
      } catch (SQLException e) {
        log.debug("Database ping failed: {}", e.getMessage());
        return false;
      }
    }
  }

  @Override
  public void close() {
    synchronized (lock) {
      try {
        if (!connection.isClosed()) {
          connection.close();
          log.info("SQLite repository closed: {}", config.jdbcUrl());
        }
      } catch (SQLException e) {
        throw new PersistenceException("Failed to close database " + config.jdbcUrl(), e);
      }
    }
  }

  private long insertReading(Reading reading) throws SQLException {
    try (PreparedStatement stmt = connection.prepareStatement(INSERT_READING, Statement.RETURN_GENERATED_KEYS)) {
      stmt.setQueryTimeout(config.queryTimeoutSeconds());
      stmt.setString(1, reading.deviceId());
      stmt.setString(2, reading.metricName());
      stmt.setDouble(3, reading.value());
      setNullableString(stmt, 4, reading.unit());
      stmt.setLong(5, reading.timestamp().toEpochMilli());
      stmt.executeUpdate();

      try (ResultSet keys = stmt.getGeneratedKeys()) {
        if (!keys.next()) {
          throw new SQLException("No id generated for inserted reading");
        }
        return keys.getLong(1);
      }
    }
  }

  private void insertAnomaly(long readingId, Anomaly anomaly) throws SQLException {
    try (PreparedStatement stmt = connection.prepareStatement(INSERT_ANOMALY)) {
      stmt.setQueryTimeout(config.queryTimeoutSeconds());
      stmt.setLong(1, readingId);
      stmt.setString(2, anomaly.deviceId());
      stmt.setString(3, anomaly.metricName());
      stmt.setDouble(4, anomaly.value());
      setNullableString(stmt, 5, anomaly.unit());
      stmt.setLong(6, anomaly.timestamp().toEpochMilli());
      stmt.setDouble(7, anomaly.score());
      stmt.setString(8, anomaly.type().getValue());
      stmt.setDouble(9, anomaly.threshold());
      stmt.executeUpdate();
    }
  }

  private void rollbackQuietly(Exception cause) {
    try {
      connection.rollback();
    } catch (SQLException rollbackError) {
      cause.addSuppressed(rollbackError);
    }
  }

  private void restoreAutoCommit(Exception cause) {
    try {
      connection.setAutoCommit(true);
    } catch (SQLException restoreError) {
      cause.addSuppressed(restoreError);
    }
  }

  private <T> List<T> query(String operation, String sql, Binder binder, RowMapper<T> mapper) {
    synchronized (lock) {
      try (PreparedStatement stmt = connection.prepareStatement(sql)) {
        stmt.setQueryTimeout(config.queryTimeoutSeconds());
        binder.bind(stmt);
        try (ResultSet rs = stmt.executeQuery()) {
          List<T> rows = new ArrayList<>();
          while (rs.next()) {
            rows.add(mapper.map(rs));
          }
          return rows;
        }
      } catch (SQLException e) {
        throw new PersistenceException("Failed to " + operation, e);
      }
    }
  }

  private static void bindRange(PreparedStatement stmt, int index, Instant from, Instant to)
      throws SQLException {
    stmt.setLong(index, from != null ? from.toEpochMilli() : Long.MIN_VALUE);
    stmt.setLong(index + 1, to != null ? to.toEpochMilli() : Long.MAX_VALUE);
  }

  private static void setNullableString(PreparedStatement stmt, int index, String value)
      throws SQLException {
    if (value == null) {
      stmt.setNull(index, Types.VARCHAR);
    } else {
      stmt.setString(index, value);
    }
  }

  private static Reading mapReading(ResultSet rs) throws SQLException {
    return new Reading(
      rs.getString("device_id"),
      rs.getString("metric_name"),
      rs.getDouble("value"),
      rs.getString("unit"),
      Instant.ofEpochMilli(rs.getLong("ts"))
    );
  }

  private static Anomaly mapAnomaly(ResultSet rs) throws SQLException {
    return new Anomaly(
      rs.getString("device_id"),
      rs.getString("metric_name"),
      rs.getDouble("value"),
      rs.getString("unit"),
      Instant.ofEpochMilli(rs.getLong("ts")),
      rs.getDouble("score"),
      AnomalyType.fromValue(rs.getString("anomaly_type")),
      rs.getDouble("threshold")
    );
  }

  @FunctionalInterface
  private interface Binder {
    void bind(PreparedStatement stmt) throws SQLException;
  }

  @FunctionalInterface
  private interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }
}
