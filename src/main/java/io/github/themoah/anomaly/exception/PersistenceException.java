package io.github.themoah.anomaly.exception;

/**
 * Storage was unavailable or a read/write against it failed.
 *
 * <p>Mapped to HTTP 500 by the transport layer.
 */
public class PersistenceException extends RuntimeException {

  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
