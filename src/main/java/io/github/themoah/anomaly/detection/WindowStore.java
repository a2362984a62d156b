package io.github.themoah.anomaly.detection;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds one {@link RollingWindow} per device/metric pair.
 *
 * <p>Windows are created lazily on the first value for a key and live for the
 * lifetime of the process. Updates to the same key are serialized on that
 * key's window; updates to different keys never share a lock.
 */
public class WindowStore {

  private static final Logger log = LoggerFactory.getLogger(WindowStore.class);

  private final Map<WindowKey, RollingWindow> windows = new ConcurrentHashMap<>();
  private final int capacity;
  private final int minSamples;

  public WindowStore(int capacity, int minSamples) {
    this.capacity = capacity;
    this.minSamples = minSamples;
  }

  public WindowStore(DetectionConfig config) {
    this(config.windowCapacity(), config.minSamples());
  }

  /**
   * Inserts a value into the key's window and returns the statistics the
   * window had before the insertion.
   *
   * @param key the device/metric pair
   * @param value the new value
   * @return prior statistics, or the insufficient-history sentinel when fewer
   *     than minSamples values preceded this one
   */
  public WindowStats updateAndStat(WindowKey key, double value) {
    RollingWindow window = windows.computeIfAbsent(key, k -> {
      log.debug("Creating window for {} (capacity={}, minSamples={})", k, capacity, minSamples);
      return new RollingWindow(capacity, minSamples);
    });

    synchronized (window) {
      return window.addAndGetPrior(value);
    }
  }

  /**
   * Returns a consistent copy of the key's window, if one exists.
   */
  public Optional<WindowSnapshot> snapshot(WindowKey key) {
    RollingWindow window = windows.get(key);
    if (window == null) {
      return Optional.empty();
    }
    synchronized (window) {
      return Optional.of(new WindowSnapshot(
        key,
        Arrays.stream(window.values()).boxed().collect(Collectors.toUnmodifiableList()),
        window.mean(),
        window.variance(),
        window.stdDev()
      ));
    }
  }

  /**
   * Number of windows currently held.
   */
  public int windowCount() {
    return windows.size();
  }
}
