package io.github.themoah.anomaly.config;

import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed lookups over an environment-like source.
 * Malformed values fall back to the default with a warning.
 */
public final class Env {

  private static final Logger log = LoggerFactory.getLogger(Env.class);

  private final Function<String, String> lookup;

  public Env(Function<String, String> lookup) {
    this.lookup = lookup;
  }

  /**
   * Env backed by the process environment.
   */
  public static Env system() {
    return new Env(System::getenv);
  }

  public String getString(String name, String defaultValue) {
    String value = lookup.apply(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return value.trim();
  }

  public boolean getBoolean(String name, boolean defaultValue) {
    String value = lookup.apply(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  public int getInt(String name, int defaultValue) {
    String value = lookup.apply(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid integer for {}: '{}', using default: {}", name, value, defaultValue);
      return defaultValue;
    }
  }

  public long getLong(String name, long defaultValue) {
    String value = lookup.apply(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      log.warn("Invalid long for {}: '{}', using default: {}", name, value, defaultValue);
      return defaultValue;
    }
  }

  public double getDouble(String name, double defaultValue) {
    String value = lookup.apply(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      double parsed = Double.parseDouble(value.trim());
      if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
        log.warn("Non-finite value for {}: '{}', using default: {}", name, value, defaultValue);
        return defaultValue;
      }
      return parsed;
    } catch (NumberFormatException e) {
      log.warn("Invalid double for {}: '{}', using default: {}", name, value, defaultValue);
      return defaultValue;
    }
  }
}
