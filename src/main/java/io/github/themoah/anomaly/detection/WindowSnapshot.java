package io.github.themoah.anomaly.detection;

import java.util.List;

/**
 * Point-in-time copy of one window's contents and statistics.
 *
 * @param key the window identity
 * @param values current values, oldest first
 * @param mean mean of the values (NaN when empty)
 * @param variance population variance of the values (NaN when empty)
 * @param stdDev population standard deviation of the values (NaN when empty)
 */
public record WindowSnapshot(
  WindowKey key,
  List<Double> values,
  double mean,
  double variance,
  double stdDev
) {

  public int size() {
    return values.size();
  }
}
