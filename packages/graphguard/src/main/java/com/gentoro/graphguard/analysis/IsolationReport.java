package com.gentoro.graphguard.analysis;

import com.gentoro.graphguard.graph.GraphEdge;
import com.gentoro.graphguard.graph.GraphNode;
import java.util.List;

/** Output of {@link IsolationAnalyzer}; lists follow snapshot order. */
public final class IsolationReport {
  private final String graphId;
  private final List<GraphNode> isolatedNodes;
  private final List<DanglingEdge> danglingEdges;

  public IsolationReport(
      String graphId, List<GraphNode> isolatedNodes, List<DanglingEdge> danglingEdges) {
    this.graphId = graphId;
    this.isolatedNodes = List.copyOf(isolatedNodes);
    this.danglingEdges = List.copyOf(danglingEdges);
  }

  public String getGraphId() {
    return graphId;
  }

  public List<GraphNode> getIsolatedNodes() {
    return isolatedNodes;
  }

  /** Dangling edges with per-endpoint detail. */
  public List<DanglingEdge> getDanglingEdgeDetails() {
    return danglingEdges;
  }

  public List<GraphEdge> getDanglingEdges() {
    return danglingEdges.stream().map(DanglingEdge::getEdge).toList();
  }
}
