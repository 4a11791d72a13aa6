package com.gentoro.graphguard.maintenance;

import java.util.List;
import java.util.Objects;

/**
 * The candidate set of a deletion batch. {@code bulk} plans come from a scan; single-item plans
 * name one explicit uuid.
 */
public final class DeletionPlan {
  private final DeletionKind kind;
  private final String graphId;
  private final List<DeletionCandidate> candidates;
  private final boolean bulk;

  private DeletionPlan(
      DeletionKind kind, String graphId, List<DeletionCandidate> candidates, boolean bulk) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.graphId = Objects.requireNonNull(graphId, "graphId");
    this.candidates = List.copyOf(candidates);
    this.bulk = bulk;
  }

  public static DeletionPlan bulk(
      DeletionKind kind, String graphId, List<DeletionCandidate> candidates) {
    return new DeletionPlan(kind, graphId, candidates, true);
  }

  public static DeletionPlan single(DeletionKind kind, String graphId, DeletionCandidate candidate) {
    return new DeletionPlan(kind, graphId, List.of(candidate), false);
  }

  public DeletionKind getKind() {
    return kind;
  }

  public String getGraphId() {
    return graphId;
  }

  public List<DeletionCandidate> getCandidates() {
    return candidates;
  }

  public boolean isBulk() {
    return bulk;
  }

  public int size() {
    return candidates.size();
  }
}
