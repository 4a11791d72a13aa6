package com.gentoro.graphguard.graph.client;

import static com.gentoro.graphguard.utility.ResultNormalizer.field;
import static com.gentoro.graphguard.utility.ResultNormalizer.map;
import static com.gentoro.graphguard.utility.ResultNormalizer.string;
import static com.gentoro.graphguard.utility.ResultNormalizer.stringList;

import com.gentoro.graphguard.graph.GraphEdge;
import com.gentoro.graphguard.graph.GraphNode;
import java.util.LinkedHashSet;
import java.util.Optional;

/**
 * Converts raw remote records into {@link GraphNode} and {@link GraphEdge}.
 *
 * <p>Missing optional fields fall back to defaults. Endpoint identifiers are read from {@code
 * source_node_uuid}/{@code target_node_uuid}, with {@code source_uuid}/{@code target_uuid} as
 * alternatives. A record without any identifier cannot be addressed and is skipped with a warning.
 */
final class GraphRecordMapper {
  private static final org.slf4j.Logger log =
      com.gentoro.graphguard.logging.LoggingService.getLogger(GraphRecordMapper.class);

  private GraphRecordMapper() {}

  static Optional<GraphNode> toNode(Object item) {
    String uuid = string(item, "uuid");
    if (uuid == null) {
      log.warn("Skipping node record without uuid: {}", describe(item));
      return Optional.empty();
    }
    String name = string(item, "name", "");
    if (field(item, "name") == null) {
      log.debug("Node {} has no name", uuid);
    }
    return Optional.of(
        new GraphNode(
            uuid,
            name,
            new LinkedHashSet<>(stringList(item, "labels")),
            map(item, "attributes"),
            string(item, "summary"),
            string(item, "created_at")));
  }

  static Optional<GraphEdge> toEdge(Object item) {
    String uuid = string(item, "uuid");
    if (uuid == null) {
      log.warn("Skipping edge record without uuid: {}", describe(item));
      return Optional.empty();
    }
    String source = endpoint(item, "source_node_uuid", "source_uuid");
    String target = endpoint(item, "target_node_uuid", "target_uuid");
    if (source == null || target == null) {
      log.warn(
          "Edge {} is missing an endpoint identifier (source={}, target={})", uuid, source, target);
    }
    return Optional.of(
        new GraphEdge(
            uuid,
            source,
            target,
            string(item, "fact", ""),
            map(item, "attributes"),
            string(item, "name"),
            string(item, "created_at")));
  }

  private static String endpoint(Object item, String primary, String alternative) {
    String value = string(item, primary);
    return value != null ? value : string(item, alternative);
  }

  private static String describe(Object item) {
    String text = String.valueOf(item);
    return text.length() > 200 ? text.substring(0, 200) + "..." : text;
  }
}
