package com.gentoro.graphguard.exception;

import java.util.Map;

/** The remote API does not support the requested operation (HTTP 405/501). */
public class UnsupportedFeatureException extends GraphGuardException {
  public UnsupportedFeatureException(String message) {
    super(GraphGuardErrorCode.UNSUPPORTED_FEATURE, message);
  }

  public UnsupportedFeatureException(String message, int status) {
    super(GraphGuardErrorCode.UNSUPPORTED_FEATURE, message, Map.of("status", status));
  }
}
