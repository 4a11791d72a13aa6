package com.gentoro.graphguard.analysis;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.graphguard.graph.GraphEdge;
import com.gentoro.graphguard.graph.GraphNode;
import com.gentoro.graphguard.graph.GraphSnapshot;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class IsolationAnalyzerTest {

  private final IsolationAnalyzer analyzer = new IsolationAnalyzer();

  private static GraphNode node(String uuid) {
    return new GraphNode(uuid, "Node " + uuid, Set.of(), Map.of());
  }

  private static GraphEdge edge(String uuid, String source, String target) {
    return new GraphEdge(uuid, source, target, source + " -> " + target, Map.of());
  }

  private static GraphSnapshot snapshot(List<GraphNode> nodes, List<GraphEdge> edges) {
    return new GraphSnapshot("g", nodes, edges, Instant.EPOCH);
  }

  private static List<String> nodeIds(List<GraphNode> nodes) {
    return nodes.stream().map(GraphNode::getUuid).collect(Collectors.toList());
  }

  private static List<String> edgeIds(List<GraphEdge> edges) {
    return edges.stream().map(GraphEdge::getUuid).collect(Collectors.toList());
  }

  @Test
  void referencedNodesAreNotIsolatedEvenWhenAnEdgeDangles() {
    IsolationReport report =
        analyzer.analyze(
            snapshot(
                List.of(node("A"), node("B"), node("C")),
                List.of(edge("ab", "A", "B"), edge("xc", "X", "C"))));

    assertTrue(report.getIsolatedNodes().isEmpty());
    assertEquals(List.of("xc"), edgeIds(report.getDanglingEdges()));
    DanglingEdge dangling = report.getDanglingEdgeDetails().get(0);
    assertTrue(dangling.isSourceMissing());
    assertFalse(dangling.isTargetMissing());
  }

  @Test
  void graphWithoutEdgesIsFullyIsolated() {
    IsolationReport report = analyzer.analyze(snapshot(List.of(node("A"), node("B")), List.of()));
    assertEquals(List.of("A", "B"), nodeIds(report.getIsolatedNodes()));
    assertTrue(report.getDanglingEdges().isEmpty());
  }

  @Test
  void selfLoopKeepsNodeConnected() {
    IsolationReport report =
        analyzer.analyze(snapshot(List.of(node("A"), node("B")), List.of(edge("aa", "A", "A"))));
    assertEquals(List.of("B"), nodeIds(report.getIsolatedNodes()));
    assertTrue(report.getDanglingEdges().isEmpty());
  }

  @Test
  void edgeWithBothEndpointsMissingIsDangling() {
    IsolationReport report =
        analyzer.analyze(snapshot(List.of(node("A")), List.of(edge("xy", "X", "Y"))));
    DanglingEdge dangling = report.getDanglingEdgeDetails().get(0);
    assertTrue(dangling.isSourceMissing());
    assertTrue(dangling.isTargetMissing());
    assertEquals(List.of("A"), nodeIds(report.getIsolatedNodes()));
  }

  @Test
  void missingEndpointIdentifierCountsAsAbsent() {
    IsolationReport report =
        analyzer.analyze(snapshot(List.of(node("A")), List.of(edge("a?", "A", null))));
    assertEquals(List.of("a?"), edgeIds(report.getDanglingEdges()));
    assertTrue(report.getDanglingEdgeDetails().get(0).isTargetMissing());
    assertTrue(report.getIsolatedNodes().isEmpty());
  }

  @Test
  void emptySnapshotYieldsEmptyReport() {
    IsolationReport report = analyzer.analyze(snapshot(List.of(), List.of()));
    assertTrue(report.getIsolatedNodes().isEmpty());
    assertTrue(report.getDanglingEdges().isEmpty());
  }

  @Test
  void matchesNaiveScanOnRandomGraphs() {
    Random random = new Random(20240611L);
    for (int round = 0; round < 20; round++) {
      int nodeCount = 50 + random.nextInt(400);
      int edgeCount = random.nextInt(nodeCount * 2);
      List<GraphNode> nodes = new ArrayList<>();
      for (int i = 0; i < nodeCount; i++) {
        nodes.add(node("n" + i));
      }
      List<GraphEdge> edges = new ArrayList<>();
      for (int i = 0; i < edgeCount; i++) {
        // endpoints drawn from a wider range so some edges dangle
        String source = "n" + random.nextInt(nodeCount + nodeCount / 10 + 1);
        String target = "n" + random.nextInt(nodeCount + nodeCount / 10 + 1);
        edges.add(edge("e" + i, source, target));
      }

      IsolationReport report = analyzer.analyze(snapshot(nodes, edges));

      String message = "round " + round;
      assertEquals(naiveIsolated(nodes, edges), nodeIds(report.getIsolatedNodes()), message);
      assertEquals(naiveDangling(nodes, edges), edgeIds(report.getDanglingEdges()), message);
    }
  }

  private static List<String> naiveIsolated(List<GraphNode> nodes, List<GraphEdge> edges) {
    List<String> isolated = new ArrayList<>();
    for (GraphNode n : nodes) {
      boolean referenced = false;
      for (GraphEdge e : edges) {
        if (n.getUuid().equals(e.getSourceUuid()) || n.getUuid().equals(e.getTargetUuid())) {
          referenced = true;
          break;
        }
      }
      if (!referenced) isolated.add(n.getUuid());
    }
    return isolated;
  }

  private static List<String> naiveDangling(List<GraphNode> nodes, List<GraphEdge> edges) {
    List<String> dangling = new ArrayList<>();
    for (GraphEdge e : edges) {
      boolean source = false;
      boolean target = false;
      for (GraphNode n : nodes) {
        source |= n.getUuid().equals(e.getSourceUuid());
        target |= n.getUuid().equals(e.getTargetUuid());
      }
      if (!source || !target) dangling.add(e.getUuid());
    }
    return dangling;
  }
}
