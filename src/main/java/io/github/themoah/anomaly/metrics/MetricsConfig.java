package io.github.themoah.anomaly.metrics;

import io.github.themoah.anomaly.config.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics reporting configuration.
 *
 * @param enabled whether metrics are reported at all
 * @param reporterType registry backend: prometheus, datadog or otlp
 * @param jvmMetricsEnabled whether JVM binders (memory, GC, threads, CPU) are attached
 */
public record MetricsConfig(
  boolean enabled,
  String reporterType,
  boolean jvmMetricsEnabled
) {

  private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

  private static final boolean DEFAULT_ENABLED = true;
  private static final String DEFAULT_REPORTER = "prometheus";
  private static final boolean DEFAULT_JVM_METRICS_ENABLED = true;

  public static MetricsConfig disabled() {
    return new MetricsConfig(false, DEFAULT_REPORTER, false);
  }

  public static MetricsConfig fromEnvironment() {
    return from(Env.system());
  }

  public static MetricsConfig from(Env env) {
    boolean enabled = env.getBoolean("METRICS_ENABLED", DEFAULT_ENABLED);
    String reporter = env.getString("METRICS_REPORTER", DEFAULT_REPORTER);
    boolean jvm = env.getBoolean("METRICS_JVM_ENABLED", DEFAULT_JVM_METRICS_ENABLED);

    log.info("Metrics config: enabled={}, reporter={}, jvmMetrics={}", enabled, reporter, jvm);
    return new MetricsConfig(enabled, reporter, jvm);
  }
}
