package com.gentoro.graphguard.graph;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable point-in-time view of one graph's nodes and edges, in the order the remote API
 * returned them. A snapshot is never updated: after any deletion, fetch a new one.
 */
public final class GraphSnapshot {
  private final String graphId;
  private final List<GraphNode> nodes;
  private final List<GraphEdge> edges;
  private final Instant fetchedAt;

  public GraphSnapshot(
      String graphId, List<GraphNode> nodes, List<GraphEdge> edges, Instant fetchedAt) {
    this.graphId = Objects.requireNonNull(graphId, "graphId");
    this.nodes = List.copyOf(nodes);
    this.edges = List.copyOf(edges);
    this.fetchedAt = Objects.requireNonNull(fetchedAt, "fetchedAt");
  }

  public String getGraphId() {
    return graphId;
  }

  public List<GraphNode> getNodes() {
    return nodes;
  }

  public List<GraphEdge> getEdges() {
    return edges;
  }

  public Instant getFetchedAt() {
    return fetchedAt;
  }

  @Override
  public String toString() {
    return "GraphSnapshot{graphId="
        + graphId
        + ", nodes="
        + nodes.size()
        + ", edges="
        + edges.size()
        + ", fetchedAt="
        + fetchedAt
        + '}';
  }
}
