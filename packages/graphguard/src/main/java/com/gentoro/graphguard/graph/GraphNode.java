package com.gentoro.graphguard.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A named entity observed in the remote graph. Instances are immutable; the remote graph owns the
 * entity and this tool only observes or deletes it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class GraphNode {
  private final String uuid;
  private final String name;
  private final Set<String> labels;
  private final Map<String, Object> attributes;
  private final String summary;
  private final String createdAt;

  public GraphNode(String uuid, String name, Set<String> labels, Map<String, Object> attributes) {
    this(uuid, name, labels, attributes, null, null);
  }

  @JsonCreator
  public GraphNode(
      @JsonProperty("uuid") String uuid,
      @JsonProperty("name") String name,
      @JsonProperty("labels") Set<String> labels,
      @JsonProperty("attributes") Map<String, Object> attributes,
      @JsonProperty("summary") String summary,
      @JsonProperty("created_at") String createdAt) {
    this.uuid = Objects.requireNonNull(uuid, "uuid");
    this.name = name == null ? "" : name;
    this.labels =
        labels == null
            ? Collections.emptySet()
            : Collections.unmodifiableSet(new LinkedHashSet<>(labels));
    this.attributes =
        attributes == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    this.summary = summary;
    this.createdAt = createdAt;
  }

  @JsonProperty("uuid")
  public String getUuid() {
    return uuid;
  }

  @JsonProperty("name")
  public String getName() {
    return name;
  }

  @JsonProperty("labels")
  public Set<String> getLabels() {
    return labels;
  }

  @JsonProperty("attributes")
  public Map<String, Object> getAttributes() {
    return attributes;
  }

  @JsonProperty("summary")
  public String getSummary() {
    return summary;
  }

  @JsonProperty("created_at")
  public String getCreatedAt() {
    return createdAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof GraphNode other)) return false;
    return uuid.equals(other.uuid)
        && name.equals(other.name)
        && labels.equals(other.labels)
        && attributes.equals(other.attributes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(uuid, name, labels, attributes);
  }

  @Override
  public String toString() {
    return "GraphNode{uuid=" + uuid + ", name=" + name + ", labels=" + labels + '}';
  }
}
