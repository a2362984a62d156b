package io.github.themoah.anomaly.metrics;

import io.github.themoah.anomaly.config.Env;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.datadog.DatadogConfig;
import io.micrometer.datadog.DatadogMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.micrometer.registry.otlp.OtlpConfig;
import io.micrometer.registry.otlp.OtlpMeterRegistry;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the meter registry selected by {@link MetricsConfig}.
 *
 * <p>Every registry carries a {@code service} common tag (SERVICE_NAME,
 * default telemetry-anomaly) so several instances can share one backend.
 */
public final class MicrometerConfig {

  private static final Logger log = LoggerFactory.getLogger(MicrometerConfig.class);

  static final String DEFAULT_SERVICE_NAME = "telemetry-anomaly";
  static final String DEFAULT_OTLP_URL = "http://localhost:4318/v1/metrics";

  private MicrometerConfig() {}

  /**
   * Creates and tags the configured registry, binding JVM meters if asked.
   *
   * @return the registry, or empty when metrics are off or the reporter is unknown
   */
  public static Optional<MeterRegistry> createRegistry(MetricsConfig config, Env env) {
    if (!config.enabled()) {
      return Optional.empty();
    }
    MeterRegistry registry = createBackend(config.reporterType(), env);
    if (registry == null) {
      return Optional.empty();
    }

    String serviceName = serviceName(env);
    registry.config().commonTags("service", serviceName);
    if (config.jvmMetricsEnabled()) {
      bindJvmMetrics(registry);
    }
    log.info("Meter registry ready: reporter={}, service={}, jvmMetrics={}",
      config.reporterType(), serviceName, config.jvmMetricsEnabled());
    return Optional.of(registry);
  }

  static MeterRegistry createBackend(String reporterType, Env env) {
    if (reporterType == null) {
      return null;
    }
    return switch (reporterType.toLowerCase()) {
      case "prometheus" -> new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
      case "datadog" -> new DatadogMeterRegistry(datadogConfig(env), Clock.SYSTEM);
      case "otlp" -> new OtlpMeterRegistry(otlpConfig(env), Clock.SYSTEM);
      default -> {
        log.warn("Unknown reporter type: {}", reporterType);
        yield null;
      }
    };
  }

  /**
   * Datadog settings: DD_API_KEY, DD_APP_KEY, DD_SITE (default datadoghq.com).
   */
  static DatadogConfig datadogConfig(Env env) {
    String apiKey = env.getString("DD_API_KEY", null);
    String appKey = env.getString("DD_APP_KEY", null);
    String uri = "https://api." + env.getString("DD_SITE", "datadoghq.com");
    if (apiKey == null) {
      log.warn("DD_API_KEY is not set, Datadog publishing will fail");
    }

    return new DatadogConfig() {
      @Override
      public String apiKey() {
        return apiKey;
      }

      @Override
      public String applicationKey() {
        return appKey;
      }

      @Override
      public String uri() {
        return uri;
      }

      @Override
      public String get(String key) {
        return null;
      }
    };
  }

  /**
   * OTLP over HTTP. Step from OTLP_STEP_MS (default 60s); the service name
   * is also sent as the service.name resource attribute.
   */
  static OtlpConfig otlpConfig(Env env) {
    String url = otlpUrl(env);
    Duration step = Duration.ofMillis(env.getLong("OTLP_STEP_MS", 60_000L));
    Map<String, String> attributes = Map.of("service.name", serviceName(env));
    log.info("OTLP endpoint: {}, step: {}", url, step);

    return new OtlpConfig() {
      @Override
      public String url() {
        return url;
      }

      @Override
      public Duration step() {
        return step;
      }

      @Override
      public Map<String, String> resourceAttributes() {
        return attributes;
      }

      @Override
      public String get(String key) {
        return null;
      }
    };
  }

  /**
   * OTLP_ENDPOINT, else OTEL_EXPORTER_OTLP_METRICS_ENDPOINT, else
   * OTEL_EXPORTER_OTLP_ENDPOINT with /v1/metrics appended, else localhost.
   */
  static String otlpUrl(Env env) {
    String url = env.getString("OTLP_ENDPOINT", null);
    if (url == null) {
      url = env.getString("OTEL_EXPORTER_OTLP_METRICS_ENDPOINT", null);
    }
    if (url == null) {
      String base = env.getString("OTEL_EXPORTER_OTLP_ENDPOINT", null);
      if (base != null) {
        url = base.endsWith("/v1/metrics") ? base : base + "/v1/metrics";
      }
    }
    return url != null ? url : DEFAULT_OTLP_URL;
  }

  static String serviceName(Env env) {
    String name = env.getString("SERVICE_NAME", null);
    return name != null ? name : env.getString("OTEL_SERVICE_NAME", DEFAULT_SERVICE_NAME);
  }

  private static void bindJvmMetrics(MeterRegistry registry) {
    new JvmMemoryMetrics().bindTo(registry);
    new JvmGcMetrics().bindTo(registry);
    new JvmThreadMetrics().bindTo(registry);
    new ProcessorMetrics().bindTo(registry);
  }
}
