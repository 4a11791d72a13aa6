package com.gentoro.graphguard;

import com.gentoro.graphguard.analysis.DanglingEdge;
import com.gentoro.graphguard.exception.ExportException;
import com.gentoro.graphguard.exception.GraphGuardException;
import com.gentoro.graphguard.exception.ValidationException;
import com.gentoro.graphguard.export.ExportResult;
import com.gentoro.graphguard.graph.GraphEdge;
import com.gentoro.graphguard.graph.GraphNode;
import com.gentoro.graphguard.maintenance.BatchState;
import com.gentoro.graphguard.maintenance.DeletionSummary;
import com.gentoro.graphguard.maintenance.FailedDeletion;
import com.gentoro.graphguard.maintenance.GraphMaintenanceService;
import com.gentoro.graphguard.utility.StdoutUtility;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Runs one parsed command line against the maintenance service; the result is an exit code. */
public class GraphGuardCommand {
  private static final org.slf4j.Logger log =
      com.gentoro.graphguard.logging.LoggingService.getLogger(GraphGuardCommand.class);

  public static final int EXIT_OK = 0;
  public static final int EXIT_FAILURE = 1;
  public static final int EXIT_USAGE = 2;
  public static final int EXIT_DECLINED = 3;

  /** Outcome of a deletion action that failed before any batch started. */
  static final String OUTCOME_FAILED = "FAILED";

  private final GraphMaintenanceService service;
  private final StdoutUtility console;
  private final String defaultGraphId;

  public GraphGuardCommand(
      GraphMaintenanceService service, StdoutUtility console, String defaultGraphId) {
    this.service = Objects.requireNonNull(service, "service");
    this.console = Objects.requireNonNull(console, "console");
    this.defaultGraphId = defaultGraphId;
  }

  public int execute(StartupParameters params) {
    Action action = params.action();
    if (action == Action.HELP) {
      console.printNewLine(usage());
      return EXIT_OK;
    }
    try {
      String graphId = resolveGraphId(params);
      log.debug("Running {} on graph {}", action.cliName(), graphId);
      switch (action) {
        case FIND_ISOLATED_NODES:
          printIsolatedNodes(service.findIsolatedNodes(graphId));
          return EXIT_OK;
        case FIND_ISOLATED_EDGES:
          printDanglingEdges(service.findDanglingEdges(graphId));
          return EXIT_OK;
        case DELETE_NODE:
          return report(
              service.deleteNode(graphId, params.uuid().orElseThrow(), params.skipConfirmation()));
        case DELETE_EDGE:
          return report(
              service.deleteEdge(graphId, params.uuid().orElseThrow(), params.skipConfirmation()));
        case DELETE_ISOLATED_NODES:
          return report(service.deleteIsolatedNodes(graphId, params.skipConfirmation()));
        case DELETE_ISOLATED_EDGES:
          return report(service.deleteDanglingEdges(graphId, params.skipConfirmation()));
        case EXPORT:
          return export(graphId, Path.of(params.output().orElseThrow()), params.keepPartial());
        default:
          throw new ValidationException("Unsupported action: " + action.cliName());
      }
    } catch (ValidationException e) {
      console.printError(e.getMessage(), null);
      console.printNewLine(usage());
      return EXIT_USAGE;
    } catch (GraphGuardException e) {
      log.error(
          "{} failed [{}]: {} {}", action.cliName(), e.getCode(), e.getMessage(), e.getContext());
      console.printError(e.getMessage(), params.verbose() ? e : null);
      if (action.isDeletion()) {
        // no batch was started, so nothing was deleted
        console.printWarningLine("Outcome: " + OUTCOME_FAILED);
      }
      return EXIT_FAILURE;
    }
  }

  private String resolveGraphId(StartupParameters params) {
    return params
        .graphId()
        .or(() -> Optional.ofNullable(defaultGraphId).filter(id -> !id.isBlank()))
        .orElseThrow(
            () -> new ValidationException("No --graph_id given and no default graph configured"));
  }

  private void printIsolatedNodes(List<GraphNode> nodes) {
    console.printNewLine("");
    console.printNewLine(
        "Found " + nodes.size() + " isolated nodes (nodes with no connections):");
    if (nodes.isEmpty()) {
      console.printNewLine("No isolated nodes found in the graph.");
      return;
    }
    int i = 1;
    for (GraphNode node : nodes) {
      String type = node.getLabels().isEmpty() ? "Unknown" : String.join(",", node.getLabels());
      String name = node.getName().isBlank() ? "Unknown" : node.getName();
      console.printNewLine(
          i++ + ". UUID: " + node.getUuid() + ", Type: " + type + ", Name: " + name);
    }
  }

  private void printDanglingEdges(List<DanglingEdge> edges) {
    console.printNewLine("");
    console.printNewLine(
        "Found " + edges.size() + " dangling edges (edges with missing source/target nodes):");
    if (edges.isEmpty()) {
      console.printNewLine("No dangling edges found in the graph.");
      return;
    }
    int i = 1;
    for (DanglingEdge dangling : edges) {
      GraphEdge edge = dangling.getEdge();
      String name = edge.getName() == null ? "Unknown" : edge.getName();
      console.printNewLine(i++ + ". ID: " + edge.getUuid() + ", Name: " + name);
      console.printNewLine(
          "   Source: "
              + endpoint(edge.getSourceUuid())
              + " (Exists: "
              + !dangling.isSourceMissing()
              + ")");
      console.printNewLine(
          "   Target: "
              + endpoint(edge.getTargetUuid())
              + " (Exists: "
              + !dangling.isTargetMissing()
              + ")");
    }
  }

  private static String endpoint(String uuid) {
    return uuid == null || uuid.isBlank() ? "Unknown" : uuid;
  }

  private int report(DeletionSummary summary) {
    String plural = summary.getKind().plural();
    BatchState state = summary.getState();
    if (state == BatchState.ABORTED) {
      console.printWarningLine("Deletion cancelled; no " + plural + " were deleted.");
      console.printNewLine("Outcome: " + state);
      return EXIT_DECLINED;
    }

    console.printNewLine(
        "Deleted "
            + summary.getSucceededCount()
            + " "
            + plural
            + ". Failed to delete "
            + summary.getFailedCount()
            + " "
            + plural
            + ".");
    if (summary.getEdgesRemoved() > 0) {
      console.printNewLine(
          "Removed " + summary.getEdgesRemoved() + " connected edges along the way.");
    }
    if (state == BatchState.PARTIAL) {
      for (String uuid : summary.getSucceeded()) {
        console.printNewLine("  + " + uuid);
      }
      for (FailedDeletion failure : summary.getFailed()) {
        console.printNewLine("  - " + failure.getUuid() + ": " + failure.getReason());
      }
      console.printWarningLine("Outcome: " + state);
      return EXIT_FAILURE;
    }
    console.printSuccessLine("Outcome: " + state);
    return EXIT_OK;
  }

  private int export(String graphId, Path output, boolean keepPartial) {
    try {
      ExportResult result = service.export(graphId, output, keepPartial);
      console.printSuccessLine(
          "Exported "
              + result.getNodeCount()
              + " nodes and "
              + result.getEdgeCount()
              + " edges from graph "
              + graphId
              + " to "
              + result.getPath());
      return EXIT_OK;
    } catch (ExportException e) {
      console.printError(e.getMessage(), null);
      if (keepPartial) {
        console.printWarningLine("Partial export written to " + output + ".partial");
      }
      return EXIT_FAILURE;
    }
  }

  public static String usage() {
    return String.join(
        "\n",
        "Usage: graphguard --action <action> [options]",
        "",
        "Actions: " + Action.choices(),
        "",
        "Options:",
        "  --graph_id <id>       graph to operate on (defaults to graph.defaultGraphId)",
        "  --uuid <uuid>         node or edge to delete (delete_node, delete_edge)",
        "  --no-confirm          skip the confirmation prompt",
        "  --output <file>       export destination (export)",
        "  --keep-partial        keep what was read when an export fails, as <file>.partial",
        "  --config-file <loc>   configuration location (default classpath:application.yaml)",
        "  --verbose             debug logging",
        "",
        "Exit codes: 0 success, 1 failure or partial deletion, 2 usage error, 3 declined");
  }
}
