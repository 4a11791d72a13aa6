package com.gentoro.graphguard.exception;

/** Resource requested was not found. */
public class NotFoundException extends GraphGuardException {
  public NotFoundException(String message) {
    super(GraphGuardErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(GraphGuardErrorCode.NOT_FOUND, message, cause);
  }
}
