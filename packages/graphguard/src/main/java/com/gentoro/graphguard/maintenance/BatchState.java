package com.gentoro.graphguard.maintenance;

import java.util.EnumSet;
import java.util.Set;

/** Lifecycle of a deletion batch. */
public enum BatchState {
  PLANNED,
  CONFIRMED,
  EXECUTING,
  COMPLETED,
  PARTIAL,
  ABORTED;

  public boolean isTerminal() {
    return this == COMPLETED || this == PARTIAL || this == ABORTED;
  }

  Set<BatchState> successors() {
    return switch (this) {
      case PLANNED -> EnumSet.of(CONFIRMED, ABORTED);
      case CONFIRMED -> EnumSet.of(EXECUTING);
      case EXECUTING -> EnumSet.of(COMPLETED, PARTIAL);
      default -> EnumSet.noneOf(BatchState.class);
    };
  }
}
