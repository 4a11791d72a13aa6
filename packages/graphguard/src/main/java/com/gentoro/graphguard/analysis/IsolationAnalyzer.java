package com.gentoro.graphguard.analysis;

import com.gentoro.graphguard.graph.GraphEdge;
import com.gentoro.graphguard.graph.GraphNode;
import com.gentoro.graphguard.graph.GraphSnapshot;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies isolated nodes and dangling edges of a snapshot.
 *
 * <p>One pass over the nodes builds the identifier set, one pass over the edges counts references
 * to each endpoint, so the cost is O(N + E). Results keep the snapshot order.
 */
public final class IsolationAnalyzer {

  public IsolationReport analyze(GraphSnapshot snapshot) {
    List<GraphNode> nodes = snapshot.getNodes();
    List<GraphEdge> edges = snapshot.getEdges();

    Set<String> nodeUuids = new HashSet<>(nodes.size() * 2);
    for (GraphNode node : nodes) {
      nodeUuids.add(node.getUuid());
    }

    Map<String, Integer> references = new HashMap<>(nodes.size() * 2);
    List<DanglingEdge> dangling = new ArrayList<>();
    for (GraphEdge edge : edges) {
      String source = edge.getSourceUuid();
      String target = edge.getTargetUuid();
      if (source != null) references.merge(source, 1, Integer::sum);
      // A self-loop references its node once
      if (target != null && !target.equals(source)) references.merge(target, 1, Integer::sum);

      boolean sourceMissing = source == null || !nodeUuids.contains(source);
      boolean targetMissing = target == null || !nodeUuids.contains(target);
      if (sourceMissing || targetMissing) {
        dangling.add(new DanglingEdge(edge, sourceMissing, targetMissing));
      }
    }

    List<GraphNode> isolated = new ArrayList<>();
    for (GraphNode node : nodes) {
      if (!references.containsKey(node.getUuid())) {
        isolated.add(node);
      }
    }
    return new IsolationReport(snapshot.getGraphId(), isolated, dangling);
  }
}
