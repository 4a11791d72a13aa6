package com.gentoro.graphguard.exception;

import java.util.Map;

/** The remote API refused the credentials (HTTP 401/403). Never retried. */
public class AuthException extends GraphGuardException {
  public AuthException(String message, int status) {
    super(
        status == 403 ? GraphGuardErrorCode.PERMISSION_DENIED : GraphGuardErrorCode.UNAUTHENTICATED,
        message,
        Map.of("status", status));
  }
}
