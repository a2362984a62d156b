package io.github.themoah.anomaly.detection;

import io.github.themoah.anomaly.config.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for rolling-window z-score detection.
 *
 * @param windowCapacity number of recent values retained per device/metric (default 30)
 * @param minSamples prior values required before a reading is scored (default 2)
 * @param zScoreThreshold absolute z-score above which a reading is anomalous (default 2.5)
 * @param epsilon standard deviations at or below this are treated as zero variance (default 1e-10)
 */
public record DetectionConfig(
  int windowCapacity,
  int minSamples,
  double zScoreThreshold,
  double epsilon
) {

  private static final Logger log = LoggerFactory.getLogger(DetectionConfig.class);

  static final int DEFAULT_WINDOW_CAPACITY = 30;
  static final int DEFAULT_MIN_SAMPLES = 2;
  static final double DEFAULT_ZSCORE_THRESHOLD = 2.5;
  static final double DEFAULT_EPSILON = 1e-10;

  public DetectionConfig {
    if (windowCapacity < 1) {
      throw new IllegalArgumentException("windowCapacity must be >= 1, got " + windowCapacity);
    }
    if (minSamples < 1) {
      throw new IllegalArgumentException("minSamples must be >= 1, got " + minSamples);
    }
    if (windowCapacity < minSamples) {
      throw new IllegalArgumentException(
        "windowCapacity (" + windowCapacity + ") must be >= minSamples (" + minSamples + ")");
    }
    if (!(zScoreThreshold > 0) || Double.isInfinite(zScoreThreshold)) {
      throw new IllegalArgumentException("zScoreThreshold must be positive and finite, got " + zScoreThreshold);
    }
    if (epsilon < 0 || Double.isNaN(epsilon)) {
      throw new IllegalArgumentException("epsilon must be >= 0, got " + epsilon);
    }
  }

  public static DetectionConfig defaults() {
    return new DetectionConfig(
      DEFAULT_WINDOW_CAPACITY, DEFAULT_MIN_SAMPLES, DEFAULT_ZSCORE_THRESHOLD, DEFAULT_EPSILON);
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>DETECTION_WINDOW_CAPACITY - Values retained per device/metric (default: 30)</li>
   *   <li>DETECTION_MIN_SAMPLES - Prior values needed before scoring (default: 2)</li>
   *   <li>DETECTION_ZSCORE_THRESHOLD - Absolute z-score threshold (default: 2.5)</li>
   *   <li>DETECTION_EPSILON - Zero-variance cutoff for the standard deviation (default: 1e-10)</li>
   * </ul>
   */
  public static DetectionConfig fromEnvironment() {
    return from(Env.system());
  }

  public static DetectionConfig from(Env env) {
    int capacity = env.getInt("DETECTION_WINDOW_CAPACITY", DEFAULT_WINDOW_CAPACITY);
    int minSamples = env.getInt("DETECTION_MIN_SAMPLES", DEFAULT_MIN_SAMPLES);
    double threshold = env.getDouble("DETECTION_ZSCORE_THRESHOLD", DEFAULT_ZSCORE_THRESHOLD);
    double epsilon = env.getDouble("DETECTION_EPSILON", DEFAULT_EPSILON);

    DetectionConfig config = new DetectionConfig(capacity, minSamples, threshold, epsilon);
    log.info("Detection config: windowCapacity={}, minSamples={}, zScoreThreshold={}, epsilon={}",
      capacity, minSamples, threshold, epsilon);

    return config;
  }
}
