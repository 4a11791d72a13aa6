package com.gentoro.graphguard.export;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gentoro.graphguard.graph.GraphEdge;
import com.gentoro.graphguard.graph.GraphNode;
import java.util.List;

/**
 * On-disk export format. {@code partial} is present only in files written from an interrupted
 * export.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"graph_id", "exported_at", "partial", "nodes", "edges"})
public final class GraphExportDocument {
  private final String graphId;
  private final String exportedAt;
  private final Boolean partial;
  private final List<GraphNode> nodes;
  private final List<GraphEdge> edges;

  @JsonCreator
  public GraphExportDocument(
      @JsonProperty("graph_id") String graphId,
      @JsonProperty("exported_at") String exportedAt,
      @JsonProperty("partial") Boolean partial,
      @JsonProperty("nodes") List<GraphNode> nodes,
      @JsonProperty("edges") List<GraphEdge> edges) {
    this.graphId = graphId;
    this.exportedAt = exportedAt;
    this.partial = partial;
    this.nodes = nodes == null ? List.of() : List.copyOf(nodes);
    this.edges = edges == null ? List.of() : List.copyOf(edges);
  }

  @JsonProperty("graph_id")
  public String getGraphId() {
    return graphId;
  }

  /** ISO-8601 instant of the export. */
  @JsonProperty("exported_at")
  public String getExportedAt() {
    return exportedAt;
  }

  @JsonProperty("partial")
  public Boolean getPartial() {
    return partial;
  }

  @JsonProperty("nodes")
  public List<GraphNode> getNodes() {
    return nodes;
  }

  @JsonProperty("edges")
  public List<GraphEdge> getEdges() {
    return edges;
  }
}
