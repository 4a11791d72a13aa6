package com.gentoro.graphguard.exception;

/** JSON/YAML serialization or deserialization failed. */
public class SerializationException extends GraphGuardException {
  public SerializationException(String message) {
    super(GraphGuardErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(GraphGuardErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
