package io.github.themoah.anomaly.exception;

/**
 * A reading or query argument failed validation. Raised before any state is
 * touched, so the caller can correct the input and resubmit.
 *
 * <p>Mapped to HTTP 400 by the transport layer.
 */
public class ValidationException extends RuntimeException {

  public ValidationException(String message) {
    super(message);
  }

  public static ValidationException blankField(String field) {
    return new ValidationException(String.format("Field '%s' must not be empty", field));
  }

  public static ValidationException invalidParameter(String paramName, Object value, String expected) {
    return new ValidationException(
      String.format("Invalid parameter '%s': got '%s', expected %s", paramName, value, expected));
  }
}
