package io.github.themoah.anomaly.detection;

import io.github.themoah.anomaly.model.AnomalyType;

/**
 * Z-score classifier for a single value against the statistics of the values
 * that preceded it.
 *
 * <p>A window whose standard deviation is at or below epsilon has no spread
 * to measure against, so nothing is flagged for it: the score is reported as
 * 0 rather than a huge quotient of a near-zero denominator.
 */
public class AnomalyDetector {

  private final double threshold;
  private final double epsilon;

  public AnomalyDetector(double threshold, double epsilon) {
    this.threshold = threshold;
    this.epsilon = epsilon;
  }

  public AnomalyDetector(DetectionConfig config) {
    this(config.zScoreThreshold(), config.epsilon());
  }

  /**
   * Scores a value.
   *
   * @param value the new value
   * @param priorMean mean of the preceding window
   * @param priorStdDev standard deviation of the preceding window
   * @return score, verdict and direction
   */
  public Evaluation evaluate(double value, double priorMean, double priorStdDev) {
    if (!(priorStdDev > epsilon)) {
      return Evaluation.ZERO_VARIANCE;
    }
    double score = zScore(value, priorMean, priorStdDev);
    boolean anomalous = Math.abs(score) > threshold;
    return new Evaluation(score, anomalous, AnomalyType.fromScore(score));
  }

  /**
   * Scores a value against prior window statistics.
   * Callers must not pass the insufficient-history sentinel.
   */
  public Evaluation evaluate(double value, WindowStats prior) {
    if (!prior.sufficientHistory()) {
      throw new IllegalArgumentException("Cannot score against insufficient history: " + prior);
    }
    return evaluate(value, prior.priorMean(), prior.priorStdDev());
  }

  public double threshold() {
    return threshold;
  }

  static double zScore(double value, double mean, double stdDev) {
    return (value - mean) / stdDev;
  }
}
