package com.gentoro.graphguard.maintenance;

import java.util.Objects;

public final class FailedDeletion {
  private final String uuid;
  private final String reason;

  public FailedDeletion(String uuid, String reason) {
    this.uuid = Objects.requireNonNull(uuid, "uuid");
    this.reason = reason == null ? "unknown error" : reason;
  }

  public String getUuid() {
    return uuid;
  }

  public String getReason() {
    return reason;
  }

  @Override
  public String toString() {
    return uuid + ": " + reason;
  }
}
