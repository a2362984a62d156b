package io.github.themoah.anomaly.detection;

/**
 * Statistics of a window as they were before the latest value was inserted.
 *
 * <p>When {@code sufficientHistory} is false the window held fewer than the
 * configured minimum of values; mean and stdDev are then meaningless and the
 * reading must not be scored.
 *
 * @param priorCount number of values in the window before insertion
 * @param priorMean mean of those values
 * @param priorStdDev population standard deviation of those values
 * @param sufficientHistory whether priorCount reached the minimum sample count
 */
public record WindowStats(
  int priorCount,
  double priorMean,
  double priorStdDev,
  boolean sufficientHistory
) {

  public static WindowStats insufficient(int priorCount) {
    return new WindowStats(priorCount, Double.NaN, Double.NaN, false);
  }

  public static WindowStats of(int priorCount, double priorMean, double priorStdDev) {
    return new WindowStats(priorCount, priorMean, priorStdDev, true);
  }
}
