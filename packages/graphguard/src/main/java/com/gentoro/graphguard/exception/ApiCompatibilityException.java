package com.gentoro.graphguard.exception;

/** A remote response could not be interpreted at all (not JSON, or no record list in it). */
public class ApiCompatibilityException extends GraphGuardException {
  public ApiCompatibilityException(String message) {
    super(GraphGuardErrorCode.API_COMPATIBILITY, message);
  }

  public ApiCompatibilityException(String message, Throwable cause) {
    super(GraphGuardErrorCode.API_COMPATIBILITY, message, cause);
  }
}
