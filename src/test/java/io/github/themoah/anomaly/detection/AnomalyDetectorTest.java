package io.github.themoah.anomaly.detection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.anomaly.model.AnomalyType;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AnomalyDetector.
 */
public class AnomalyDetectorTest {

  private final AnomalyDetector detector = new AnomalyDetector(DetectionConfig.defaults());

  @Test
  void highSpike_flaggedHigh() {
    Evaluation evaluation = detector.evaluate(17.5, 10.0, 2.0);

    assertEquals(3.75, evaluation.score(), 1e-12);
    assertTrue(evaluation.anomalous());
    assertEquals(AnomalyType.HIGH, evaluation.type());
  }

  @Test
  void lowDip_flaggedLow() {
    Evaluation evaluation = detector.evaluate(2.5, 10.0, 2.0);

    assertEquals(-3.75, evaluation.score(), 1e-12);
    assertTrue(evaluation.anomalous());
    assertEquals(AnomalyType.LOW, evaluation.type());
  }

  @Test
  void smallDeviation_notAnomalous() {
    Evaluation evaluation = detector.evaluate(11.0, 10.0, 2.0);

    assertEquals(0.5, evaluation.score(), 1e-12);
    assertFalse(evaluation.anomalous());
  }

  @Test
  void exactlyAtThreshold_notAnomalous() {
    // |z| must strictly exceed the threshold
    Evaluation evaluation = detector.evaluate(15.0, 10.0, 2.0);

    assertEquals(2.5, evaluation.score(), 1e-12);
    assertFalse(evaluation.anomalous());
  }

  @Test
  void zeroVariance_neverFlagged() {
    Evaluation evaluation = detector.evaluate(1_000_000.0, 5.0, 0.0);

    assertEquals(0.0, evaluation.score(), 0.0);
    assertFalse(evaluation.anomalous());
    assertNull(evaluation.type());
  }

  @Test
  void stdDevBelowEpsilon_treatedAsZeroVariance() {
    Evaluation evaluation = detector.evaluate(5.0 + 1e-6, 5.0, 1e-12);

    assertFalse(evaluation.anomalous());
    assertEquals(0.0, evaluation.score(), 0.0);
  }

  @Test
  void customThreshold_applied() {
    AnomalyDetector strict = new AnomalyDetector(1.0, 1e-10);

    assertTrue(strict.evaluate(13.0, 10.0, 2.0).anomalous());  // z = 1.5
    assertEquals(1.0, strict.threshold(), 0.0);
  }

  @Test
  void evaluateAgainstWindowStats() {
    WindowStats prior = WindowStats.of(5, 10.0, 2.0);

    Evaluation evaluation = detector.evaluate(17.5, prior);

    assertTrue(evaluation.anomalous());
    assertEquals(AnomalyType.HIGH, evaluation.type());
  }

  @Test
  void evaluateAgainstSentinel_rejected() {
    WindowStats sentinel = WindowStats.insufficient(1);

    assertThrows(IllegalArgumentException.class, () -> detector.evaluate(1.0, sentinel));
  }

  @Test
  void detectorOverWindow_flagsSpikeAfterStableHistory() {
    WindowStore store = new WindowStore(30, 2);
    WindowKey key = new WindowKey("sensor-1", "temperature");
    double[] history = {20.0, 21.0, 19.0, 20.5, 19.5, 20.0};
    for (double v : history) {
      store.updateAndStat(key, v);
    }

    WindowStats prior = store.updateAndStat(key, 35.0);
    Evaluation evaluation = detector.evaluate(35.0, prior);

    assertTrue(evaluation.anomalous());
    assertEquals(AnomalyType.HIGH, evaluation.type());
    assertTrue(evaluation.score() > 2.5);
  }
}
