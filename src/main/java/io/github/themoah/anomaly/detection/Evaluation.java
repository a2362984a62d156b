package io.github.themoah.anomaly.detection;

import io.github.themoah.anomaly.model.AnomalyType;

/**
 * Verdict for one value scored against its window.
 *
 * @param score signed z-score, 0 when the window had no variance
 * @param anomalous whether |score| exceeded the threshold
 * @param type direction of the deviation, null when the score is 0
 */
public record Evaluation(double score, boolean anomalous, AnomalyType type) {

  static final Evaluation ZERO_VARIANCE = new Evaluation(0.0, false, null);
}
