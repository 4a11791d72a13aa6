package com.gentoro.graphguard.maintenance;

import com.gentoro.graphguard.exception.StateException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Mutable state of one deletion run. Owned by a single {@link DeletionExecutor} invocation and
 * frozen into a {@link DeletionSummary} at the end.
 */
final class DeletionBatch {
  private final DeletionPlan plan;
  private final List<BatchState> history = new ArrayList<>();
  private final List<String> succeeded = new ArrayList<>();
  private final List<FailedDeletion> failed = new ArrayList<>();
  private BatchState state = BatchState.PLANNED;
  private int edgesRemoved;

  DeletionBatch(DeletionPlan plan) {
    this.plan = Objects.requireNonNull(plan, "plan");
    history.add(state);
  }

  void transitionTo(BatchState next) {
    if (!state.successors().contains(next)) {
      throw new StateException("Illegal deletion batch transition " + state + " -> " + next);
    }
    state = next;
    history.add(next);
  }

  void recordSuccess(String uuid, int edgesRemovedByFallback) {
    requireExecuting();
    succeeded.add(uuid);
    edgesRemoved += edgesRemovedByFallback;
  }

  void recordFailure(String uuid, String reason, int edgesRemovedByFallback) {
    requireExecuting();
    failed.add(new FailedDeletion(uuid, reason));
    edgesRemoved += edgesRemovedByFallback;
  }

  boolean hasFailures() {
    return !failed.isEmpty();
  }

  DeletionSummary toSummary() {
    if (!state.isTerminal()) {
      throw new StateException("Deletion batch has not finished, state " + state);
    }
    return new DeletionSummary(
        plan.getKind(), plan.getGraphId(), state, plan.size(), succeeded, failed, edgesRemoved,
        history);
  }

  private void requireExecuting() {
    if (state != BatchState.EXECUTING) {
      throw new StateException("Deletion results can only be recorded while executing");
    }
  }
}
