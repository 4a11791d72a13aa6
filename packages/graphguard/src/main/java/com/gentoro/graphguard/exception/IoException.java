package com.gentoro.graphguard.exception;

/** I/O operation failed (filesystem, classpath, streams). */
public class IoException extends GraphGuardException {
  public IoException(String message) {
    super(GraphGuardErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(GraphGuardErrorCode.IO_ERROR, message, cause);
  }
}
