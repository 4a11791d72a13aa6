package com.gentoro.graphguard.exception;

import java.util.Map;

/** Client-side rejection from the remote API (4xx other than 401, 403, 404). Never retried. */
public class RemoteApiException extends GraphGuardException {
  private final int status;

  public RemoteApiException(String message, int status) {
    super(GraphGuardErrorCode.REMOTE_REJECTED, message, Map.of("status", status));
    this.status = status;
  }

  public int getStatus() {
    return status;
  }
}
