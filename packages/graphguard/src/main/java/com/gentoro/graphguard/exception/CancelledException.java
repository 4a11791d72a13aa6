package com.gentoro.graphguard.exception;

/** The running operation was interrupted by the user. */
public class CancelledException extends GraphGuardException {
  public CancelledException(String message, Throwable cause) {
    super(GraphGuardErrorCode.CANCELLED, message, cause);
  }
}
