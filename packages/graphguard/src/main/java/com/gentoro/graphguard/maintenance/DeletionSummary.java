package com.gentoro.graphguard.maintenance;

import java.util.List;

/**
 * Final report of a deletion batch, returned for every terminal state.
 *
 * <p>{@code edgesRemoved} counts edges deleted by the node-deletion fallback; those are side effects
 * and are not part of {@code succeeded}.
 */
public final class DeletionSummary {
  private final DeletionKind kind;
  private final String graphId;
  private final BatchState state;
  private final int candidateCount;
  private final List<String> succeeded;
  private final List<FailedDeletion> failed;
  private final int edgesRemoved;
  private final List<BatchState> history;

  DeletionSummary(
      DeletionKind kind,
      String graphId,
      BatchState state,
      int candidateCount,
      List<String> succeeded,
      List<FailedDeletion> failed,
      int edgesRemoved,
      List<BatchState> history) {
    this.kind = kind;
    this.graphId = graphId;
    this.state = state;
    this.candidateCount = candidateCount;
    this.succeeded = List.copyOf(succeeded);
    this.failed = List.copyOf(failed);
    this.edgesRemoved = edgesRemoved;
    this.history = List.copyOf(history);
  }

  public DeletionKind getKind() {
    return kind;
  }

  public String getGraphId() {
    return graphId;
  }

  public BatchState getState() {
    return state;
  }

  public int getCandidateCount() {
    return candidateCount;
  }

  public List<String> getSucceeded() {
    return succeeded;
  }

  public List<FailedDeletion> getFailed() {
    return failed;
  }

  public int getSucceededCount() {
    return succeeded.size();
  }

  public int getFailedCount() {
    return failed.size();
  }

  public int getEdgesRemoved() {
    return edgesRemoved;
  }

  /** States the batch went through, starting with {@link BatchState#PLANNED}. */
  public List<BatchState> getHistory() {
    return history;
  }

  @Override
  public String toString() {
    return "DeletionSummary{kind="
        + kind
        + ", graphId="
        + graphId
        + ", state="
        + state
        + ", candidates="
        + candidateCount
        + ", succeeded="
        + succeeded.size()
        + ", failed="
        + failed.size()
        + '}';
  }
}
