package com.gentoro.graphguard.maintenance;

import com.gentoro.graphguard.analysis.DanglingEdge;
import com.gentoro.graphguard.graph.GraphEdge;
import com.gentoro.graphguard.graph.GraphNode;
import java.util.Objects;

/** One record selected for deletion: its uuid plus a short label for previews. */
public final class DeletionCandidate {
  private final String uuid;
  private final String label;

  public DeletionCandidate(String uuid, String label) {
    this.uuid = Objects.requireNonNull(uuid, "uuid");
    this.label = label == null || label.isBlank() ? "Unknown" : label;
  }

  public static DeletionCandidate of(GraphNode node) {
    return new DeletionCandidate(node.getUuid(), node.getName());
  }

  public static DeletionCandidate of(GraphEdge edge) {
    String label = edge.getName() != null ? edge.getName() : edge.getFact();
    return new DeletionCandidate(edge.getUuid(), label);
  }

  public static DeletionCandidate of(DanglingEdge dangling) {
    return of(dangling.getEdge());
  }

  public String getUuid() {
    return uuid;
  }

  public String getLabel() {
    return label;
  }

  @Override
  public String toString() {
    return "UUID=" + uuid + ", Name=" + label;
  }
}
