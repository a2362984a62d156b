package io.github.themoah.anomaly.detection;

import java.util.Arrays;

/**
 * Bounded history of the most recent values for one device/metric pair, with
 * running mean and sum of squared deviations (M2) kept in step with the buffer.
 *
 * <p>Insertion uses Welford's online update; eviction of the oldest value
 * applies the inverse update, so both are O(1). Every {@code capacity}
 * evictions the aggregates are re-derived from the buffer to stop rounding
 * error from accumulating over a long-lived window. If an update overflows
 * (values near the limits of double), the aggregates are re-derived at once.
 * M2 can still be infinite when the true spread exceeds the double range.
 *
 * <p>Not thread-safe. {@link WindowStore} serializes access per window.
 */
public class RollingWindow {

  private final double[] values;
  private final int capacity;
  private final int minSamples;

  private int head;   // index of the oldest value
  private int count;
  private double mean;
  private double m2;
  private int evictionsSinceResync;

  public RollingWindow(int capacity, int minSamples) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
    }
    this.values = new double[capacity];
    this.capacity = capacity;
    this.minSamples = minSamples;
  }

  /**
   * Inserts a value, evicting the oldest one when full, and returns the
   * statistics of the window as it was before the insertion.
   *
   * @param value the new value
   * @return prior statistics, or the insufficient-history sentinel
   */
  public WindowStats addAndGetPrior(double value) {
    WindowStats prior = stats();

    if (count == capacity) {
      evictOldest();
    }
    append(value);

    return prior;
  }

  /**
   * Statistics over the current contents.
   */
  public WindowStats stats() {
    if (count < minSamples) {
      return WindowStats.insufficient(count);
    }
    return WindowStats.of(count, mean, stdDev());
  }

  public int size() {
    return count;
  }

  public double mean() {
    return count == 0 ? Double.NaN : mean;
  }

  /**
   * Population variance (M2 / n) of the current contents.
   */
  public double variance() {
    return count == 0 ? Double.NaN : m2 / count;
  }

  public double stdDev() {
    return count == 0 ? Double.NaN : Math.sqrt(m2 / count);
  }

  /**
   * Current contents, oldest first.
   */
  public double[] values() {
    double[] copy = new double[count];
    for (int i = 0; i < count; i++) {
      copy[i] = values[(head + i) % capacity];
    }
    return copy;
  }

  private void append(double value) {
    int tail = (head + count) % capacity;
    values[tail] = value;
    count++;

    double delta = value - mean;
    mean += delta / count;
    m2 += delta * (value - mean);
    if (!Double.isFinite(mean) || !Double.isFinite(m2)) {
      resync();
    }
  }

  private void evictOldest() {
    double oldest = values[head];
    values[head] = 0.0;
    head = (head + 1) % capacity;
    count--;

    if (count == 0) {
      mean = 0.0;
      m2 = 0.0;
    } else {
      double meanBefore = mean;
      mean = meanBefore - (oldest - meanBefore) / count;
      m2 -= (oldest - meanBefore) * (oldest - mean);
      if (m2 < 0.0) {
        m2 = 0.0;
      }
    }

    if (++evictionsSinceResync >= capacity || !Double.isFinite(mean) || !Double.isFinite(m2)) {
      resync();
    }
  }

  private void resync() {
    evictionsSinceResync = 0;
    if (count == 0) {
      mean = 0.0;
      m2 = 0.0;
      return;
    }
    double[] current = values();
    // divide before summing so the mean stays finite for any finite inputs
    double newMean = Arrays.stream(current).map(v -> v / count).sum();
    double sumSquaredDiffs = 0.0;
    for (double v : current) {
      double diff = v - newMean;
      sumSquaredDiffs += diff * diff;
    }
    mean = newMean;
    m2 = sumSquaredDiffs;
  }
}
