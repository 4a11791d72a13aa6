package com.gentoro.graphguard.maintenance;

import com.gentoro.graphguard.analysis.DanglingEdge;
import com.gentoro.graphguard.analysis.IsolationAnalyzer;
import com.gentoro.graphguard.analysis.IsolationReport;
import com.gentoro.graphguard.exception.AuthException;
import com.gentoro.graphguard.exception.GraphGuardException;
import com.gentoro.graphguard.exception.NetworkException;
import com.gentoro.graphguard.export.ExportResult;
import com.gentoro.graphguard.export.GraphExporter;
import com.gentoro.graphguard.graph.GraphNode;
import com.gentoro.graphguard.graph.client.GraphClient;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Maintenance actions on one graph. Every scan starts from a fresh snapshot, and every mutating
 * action probes the remote API first so that an unreachable service never leaves a half-started
 * batch behind.
 */
public class GraphMaintenanceService {
  private static final org.slf4j.Logger log =
      com.gentoro.graphguard.logging.LoggingService.getLogger(GraphMaintenanceService.class);

  static final String LABEL_NOT_FOUND = "(not found)";
  static final String LABEL_UNAVAILABLE = "(unavailable)";

  private final GraphClient client;
  private final IsolationAnalyzer analyzer;
  private final DeletionExecutor executor;
  private final GraphExporter exporter;

  public GraphMaintenanceService(
      GraphClient client,
      IsolationAnalyzer analyzer,
      DeletionExecutor executor,
      GraphExporter exporter) {
    this.client = Objects.requireNonNull(client, "client");
    this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.exporter = Objects.requireNonNull(exporter, "exporter");
  }

  /** Fresh snapshot of {@code graphId}, classified. */
  public IsolationReport inspect(String graphId) {
    return analyzer.analyze(client.fetchSnapshot(graphId));
  }

  public List<GraphNode> findIsolatedNodes(String graphId) {
    List<GraphNode> isolated = inspect(graphId).getIsolatedNodes();
    log.info("Found {} isolated nodes in graph {}", isolated.size(), graphId);
    return isolated;
  }

  public List<DanglingEdge> findDanglingEdges(String graphId) {
    List<DanglingEdge> dangling = inspect(graphId).getDanglingEdgeDetails();
    log.info("Found {} dangling edges in graph {}", dangling.size(), graphId);
    return dangling;
  }

  public DeletionSummary deleteNode(String graphId, String uuid, boolean skipConfirmation) {
    requireHealthy("delete node " + uuid);
    String label = describe(() -> client.findNode(uuid).map(GraphNode::getName));
    DeletionPlan plan =
        DeletionPlan.single(DeletionKind.NODE, graphId, new DeletionCandidate(uuid, label));
    return executor.execute(plan, skipConfirmation);
  }

  public DeletionSummary deleteEdge(String graphId, String uuid, boolean skipConfirmation) {
    requireHealthy("delete edge " + uuid);
    String label =
        describe(() -> client.findEdge(uuid).map(e -> DeletionCandidate.of(e).getLabel()));
    DeletionPlan plan =
        DeletionPlan.single(DeletionKind.EDGE, graphId, new DeletionCandidate(uuid, label));
    return executor.execute(plan, skipConfirmation);
  }

  public DeletionSummary deleteIsolatedNodes(String graphId, boolean skipConfirmation) {
    requireHealthy("delete isolated nodes of " + graphId);
    List<DeletionCandidate> candidates =
        findIsolatedNodes(graphId).stream()
            .map(DeletionCandidate::of)
            .collect(Collectors.toList());
    return executor.execute(
        DeletionPlan.bulk(DeletionKind.NODE, graphId, candidates), skipConfirmation);
  }

  public DeletionSummary deleteDanglingEdges(String graphId, boolean skipConfirmation) {
    requireHealthy("delete dangling edges of " + graphId);
    List<DeletionCandidate> candidates =
        findDanglingEdges(graphId).stream()
            .map(DeletionCandidate::of)
            .collect(Collectors.toList());
    return executor.execute(
        DeletionPlan.bulk(DeletionKind.EDGE, graphId, candidates), skipConfirmation);
  }

  public ExportResult export(String graphId, Path output, boolean keepPartial) {
    return exporter.export(graphId, output, keepPartial);
  }

  private void requireHealthy(String operation) {
    if (!client.healthCheck()) {
      throw new NetworkException(
          "Graph API health check failed before " + operation + "; no deletions attempted");
    }
  }

  /** Label for the confirmation prompt; lookup trouble never blocks the deletion itself. */
  private String describe(LabelLookup lookup) {
    try {
      return lookup.find().orElse(LABEL_NOT_FOUND);
    } catch (AuthException e) {
      throw e;
    } catch (GraphGuardException e) {
      log.warn("Could not look up record before deletion: {}", e.getMessage());
      return LABEL_UNAVAILABLE;
    }
  }

  @FunctionalInterface
  private interface LabelLookup {
    Optional<String> find();
  }
}
