package com.gentoro.graphguard.exception;

/** Illegal state transition or use of a component in the wrong lifecycle phase. */
public class StateException extends GraphGuardException {
  public StateException(String message) {
    super(GraphGuardErrorCode.FAILED_PRECONDITION, message);
  }
}
