package com.gentoro.graphguard.exception;

/** Configuration is missing, malformed, or cannot be loaded. */
public class ConfigException extends GraphGuardException {
  public ConfigException(String message) {
    super(GraphGuardErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(GraphGuardErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
