package com.gentoro.graphguard.exception;

import java.util.Map;

/**
 * Transient communication error with the remote graph API: unreachable host, timeout, or a
 * server-side status (408, 429, 5xx). These are the only failures the retry policy repeats.
 */
public class NetworkException extends GraphGuardException {
  private final int status;

  public NetworkException(String message) {
    super(GraphGuardErrorCode.NETWORK_ERROR, message);
    this.status = -1;
  }

  public NetworkException(String message, Throwable cause) {
    super(GraphGuardErrorCode.NETWORK_ERROR, message, cause);
    this.status = -1;
  }

  public NetworkException(String message, int status) {
    super(GraphGuardErrorCode.NETWORK_ERROR, message, Map.of("status", status));
    this.status = status;
  }

  /** HTTP status that caused the failure, or -1 when no response was received. */
  public int getStatus() {
    return status;
  }
}
