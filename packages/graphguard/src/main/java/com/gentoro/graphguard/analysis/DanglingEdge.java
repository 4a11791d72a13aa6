package com.gentoro.graphguard.analysis;

import com.gentoro.graphguard.graph.GraphEdge;
import java.util.Objects;

/** An edge with at least one endpoint absent from the snapshot, and which endpoint(s) it is. */
public final class DanglingEdge {
  private final GraphEdge edge;
  private final boolean sourceMissing;
  private final boolean targetMissing;

  public DanglingEdge(GraphEdge edge, boolean sourceMissing, boolean targetMissing) {
    if (!sourceMissing && !targetMissing) {
      throw new IllegalArgumentException("Edge " + edge.getUuid() + " has both endpoints");
    }
    this.edge = Objects.requireNonNull(edge, "edge");
    this.sourceMissing = sourceMissing;
    this.targetMissing = targetMissing;
  }

  public GraphEdge getEdge() {
    return edge;
  }

  public boolean isSourceMissing() {
    return sourceMissing;
  }

  public boolean isTargetMissing() {
    return targetMissing;
  }

  @Override
  public String toString() {
    return "DanglingEdge{"
        + edge.getUuid()
        + ", sourceMissing="
        + sourceMissing
        + ", targetMissing="
        + targetMissing
        + '}';
  }
}
