package io.github.themoah.anomaly.detection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.themoah.anomaly.config.Env;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for DetectionConfig.
 */
public class DetectionConfigTest {

  @Test
  void defaults() {
    DetectionConfig config = DetectionConfig.defaults();

    assertEquals(30, config.windowCapacity());
    assertEquals(2, config.minSamples());
    assertEquals(2.5, config.zScoreThreshold(), 0.0);
    assertEquals(1e-10, config.epsilon(), 0.0);
  }

  @Test
  void fromEnv_emptyEnvironment_usesDefaults() {
    DetectionConfig config = DetectionConfig.from(new Env(name -> null));

    assertEquals(DetectionConfig.defaults(), config);
  }

  @Test
  void fromEnv_overrides() {
    Map<String, String> vars = Map.of(
      "DETECTION_WINDOW_CAPACITY", "50",
      "DETECTION_MIN_SAMPLES", "5",
      "DETECTION_ZSCORE_THRESHOLD", "3.0",
      "DETECTION_EPSILON", "1e-6"
    );

    DetectionConfig config = DetectionConfig.from(new Env(vars::get));

    assertEquals(50, config.windowCapacity());
    assertEquals(5, config.minSamples());
    assertEquals(3.0, config.zScoreThreshold(), 0.0);
    assertEquals(1e-6, config.epsilon(), 0.0);
  }

  @Test
  void fromEnv_malformedValue_fallsBackToDefault() {
    Map<String, String> vars = Map.of("DETECTION_ZSCORE_THRESHOLD", "lots");

    DetectionConfig config = DetectionConfig.from(new Env(vars::get));

    assertEquals(2.5, config.zScoreThreshold(), 0.0);
  }

  @Test
  void capacityBelowMinSamples_rejected() {
    assertThrows(IllegalArgumentException.class, () -> new DetectionConfig(2, 3, 2.5, 1e-10));
  }

  @Test
  void nonPositiveThreshold_rejected() {
    assertThrows(IllegalArgumentException.class, () -> new DetectionConfig(30, 2, 0.0, 1e-10));
    assertThrows(IllegalArgumentException.class, () -> new DetectionConfig(30, 2, -1.0, 1e-10));
  }

  @Test
  void zeroMinSamples_rejected() {
    assertThrows(IllegalArgumentException.class, () -> new DetectionConfig(30, 0, 2.5, 1e-10));
  }

  @Test
  void negativeEpsilon_rejected() {
    assertThrows(IllegalArgumentException.class, () -> new DetectionConfig(30, 2, 2.5, -1.0));
  }
}
