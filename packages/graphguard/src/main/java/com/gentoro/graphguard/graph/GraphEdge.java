package com.gentoro.graphguard.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A directed relation between two node identifiers as observed in the remote graph.
 *
 * <p>The endpoints are plain identifiers and may not resolve to live nodes. An endpoint the remote
 * record left empty is kept as {@code null} and is never present in any node set, so the edge
 * classifies as dangling.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class GraphEdge {
  private final String uuid;
  private final String sourceUuid;
  private final String targetUuid;
  private final String fact;
  private final Map<String, Object> attributes;
  private final String name;
  private final String createdAt;

  public GraphEdge(
      String uuid,
      String sourceUuid,
      String targetUuid,
      String fact,
      Map<String, Object> attributes) {
    this(uuid, sourceUuid, targetUuid, fact, attributes, null, null);
  }

  @JsonCreator
  public GraphEdge(
      @JsonProperty("uuid") String uuid,
      @JsonProperty("source_node_uuid") String sourceUuid,
      @JsonProperty("target_node_uuid") String targetUuid,
      @JsonProperty("fact") String fact,
      @JsonProperty("attributes") Map<String, Object> attributes,
      @JsonProperty("name") String name,
      @JsonProperty("created_at") String createdAt) {
    this.uuid = Objects.requireNonNull(uuid, "uuid");
    this.sourceUuid = sourceUuid;
    this.targetUuid = targetUuid;
    this.fact = fact == null ? "" : fact;
    this.attributes =
        attributes == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    this.name = name;
    this.createdAt = createdAt;
  }

  @JsonProperty("uuid")
  public String getUuid() {
    return uuid;
  }

  @JsonProperty("source_node_uuid")
  public String getSourceUuid() {
    return sourceUuid;
  }

  @JsonProperty("target_node_uuid")
  public String getTargetUuid() {
    return targetUuid;
  }

  @JsonProperty("fact")
  public String getFact() {
    return fact;
  }

  @JsonProperty("attributes")
  public Map<String, Object> getAttributes() {
    return attributes;
  }

  /** Relation type reported by the remote graph, if any. */
  @JsonProperty("name")
  public String getName() {
    return name;
  }

  @JsonProperty("created_at")
  public String getCreatedAt() {
    return createdAt;
  }

  /** True when {@code nodeUuid} is the source or the target of this edge. */
  public boolean touches(String nodeUuid) {
    return nodeUuid != null && (nodeUuid.equals(sourceUuid) || nodeUuid.equals(targetUuid));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof GraphEdge other)) return false;
    return uuid.equals(other.uuid)
        && Objects.equals(sourceUuid, other.sourceUuid)
        && Objects.equals(targetUuid, other.targetUuid)
        && fact.equals(other.fact)
        && attributes.equals(other.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(uuid, sourceUuid, targetUuid, fact, attributes);
  }

  @Override
  public String toString() {
    return "GraphEdge{uuid=" + uuid + ", " + sourceUuid + " -> " + targetUuid + '}';
  }
}
