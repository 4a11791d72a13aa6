package com.gentoro.graphguard.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends GraphGuardException {
  public ValidationException(String message) {
    super(GraphGuardErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(GraphGuardErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
