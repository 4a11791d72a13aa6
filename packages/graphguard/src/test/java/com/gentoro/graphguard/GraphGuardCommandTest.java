package com.gentoro.graphguard;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.graphguard.analysis.IsolationAnalyzer;
import com.gentoro.graphguard.config.GraphGuardSettings;
import com.gentoro.graphguard.export.GraphExporter;
import com.gentoro.graphguard.graph.api.FakeGraphApi;
import com.gentoro.graphguard.graph.client.GraphClient;
import com.gentoro.graphguard.graph.client.RetryPolicy;
import com.gentoro.graphguard.maintenance.DeletionExecutor;
import com.gentoro.graphguard.maintenance.GraphMaintenanceService;
import com.gentoro.graphguard.maintenance.progress.ConsoleProgressSink;
import com.gentoro.graphguard.utility.StdoutUtility;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GraphGuardCommandTest {

  @TempDir Path dir;

  private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
  private FakeGraphApi api;
  private boolean confirm;

  @BeforeEach
  void setUp() {
    api =
        new FakeGraphApi()
            .addNode("a", "Alice", "Person")
            .addNode("b", "Bob")
            .addNode("lonely", "Lonely", "Entity")
            .addEdge("ab", "a", "b", "Alice knows Bob")
            .addEdge("ghost", "gone", "b", "ghost");
    confirm = true;
  }

  private GraphGuardCommand command(String defaultGraphId) {
    StdoutUtility console =
        new StdoutUtility(new PrintStream(buffer, true, StandardCharsets.UTF_8), false);
    GraphClient client =
        new GraphClient(
            api,
            GraphGuardSettings.builder().build(),
            new RetryPolicy(1, Duration.ZERO, Duration.ZERO, d -> {}),
            Clock.systemUTC());
    DeletionExecutor executor =
        new DeletionExecutor(
            client, (plan, examples) -> confirm, new ConsoleProgressSink(console.stream()));
    GraphMaintenanceService service =
        new GraphMaintenanceService(
            client, new IsolationAnalyzer(), executor, new GraphExporter(client));
    return new GraphGuardCommand(service, console, defaultGraphId);
  }

  private int run(String... args) {
    return command("kb").execute(new StartupParameters(args));
  }

  private String printed() {
    return buffer.toString(StandardCharsets.UTF_8);
  }

  @Test
  void findIsolatedNodesListsThem() {
    assertEquals(GraphGuardCommand.EXIT_OK, run("--action", "find_isolated_nodes"));
    assertTrue(printed().contains("Found 1 isolated nodes (nodes with no connections):"));
    assertTrue(printed().contains("1. UUID: lonely, Type: Entity, Name: Lonely"));
  }

  @Test
  void findDanglingEdgesShowsWhichEndpointExists() {
    assertEquals(GraphGuardCommand.EXIT_OK, run("--action", "find_isolated_edges"));
    assertTrue(printed().contains("1. ID: ghost, Name: RELATES_TO"));
    assertTrue(printed().contains("   Source: gone (Exists: false)"));
    assertTrue(printed().contains("   Target: b (Exists: true)"));
  }

  @Test
  void emptyResultsSaySo() {
    api = new FakeGraphApi();
    assertEquals(GraphGuardCommand.EXIT_OK, run("--action", "find_isolated_nodes"));
    assertTrue(printed().contains("No isolated nodes found in the graph."));
  }

  @Test
  void completedDeletionExitsZero() {
    assertEquals(
        GraphGuardCommand.EXIT_OK, run("--action", "delete_isolated_nodes", "--no-confirm"));
    assertTrue(printed().contains("Deleted 1 nodes. Failed to delete 0 nodes."));
    assertTrue(printed().contains("Outcome: COMPLETED"));
    assertFalse(api.hasNode("lonely"));
  }

  @Test
  void partialDeletionExitsOneAndListsFailures() {
    api.rejectDelete("ghost");
    assertEquals(
        GraphGuardCommand.EXIT_FAILURE, run("--action", "delete_isolated_edges", "--no-confirm"));
    assertTrue(printed().contains("Outcome: PARTIAL"));
    assertTrue(printed().contains("  - ghost: "));
  }

  @Test
  void declinedDeletionExitsThree() {
    confirm = false;
    assertEquals(
        GraphGuardCommand.EXIT_DECLINED, run("--action", "delete_node", "--uuid", "lonely"));
    assertTrue(printed().contains("Outcome: ABORTED"));
    assertTrue(api.hasNode("lonely"));
  }

  @Test
  void unreachableServiceExitsOne() {
    api.healthy(false);
    assertEquals(
        GraphGuardCommand.EXIT_FAILURE, run("--action", "delete_edge", "--uuid", "ab"));
    assertTrue(printed().contains("no deletions attempted"));
    assertTrue(api.getMutations().isEmpty());
  }

  @Test
  void unreachableServiceStillPrintsAnOutcome() {
    api.healthy(false);
    assertEquals(
        GraphGuardCommand.EXIT_FAILURE, run("--action", "delete_isolated_nodes", "--no-confirm"));
    assertTrue(printed().contains("Outcome: FAILED"));
  }

  @Test
  void credentialsRejectedMidBatchReportDeletedItems() {
    api.addNode("lonely2", "Lonely too").addNode("lonely3", "Lonely three");
    api.rejectCredentialsOnDelete("lonely2");

    assertEquals(
        GraphGuardCommand.EXIT_FAILURE, run("--action", "delete_isolated_nodes", "--no-confirm"));

    String out = printed();
    assertTrue(out.contains("Deleted 1 nodes. Failed to delete 2 nodes."));
    assertTrue(out.contains("  + lonely"));
    assertTrue(out.contains("  - lonely2: "));
    assertTrue(out.contains("  - lonely3: "));
    assertTrue(out.contains("Outcome: PARTIAL"));
    assertFalse(api.hasNode("lonely"));
    assertTrue(api.hasNode("lonely3"));
  }

  @Test
  void rejectedCredentialsExitOne() {
    api.rejectCredentials();
    assertEquals(GraphGuardCommand.EXIT_FAILURE, run("--action", "find_isolated_nodes"));
  }

  @Test
  void missingGraphIdIsUsageError() {
    StartupParameters params =
        new StartupParameters(new String[] {"--action", "find_isolated_nodes"});
    int code = command(null).execute(params);
    assertEquals(GraphGuardCommand.EXIT_USAGE, code);
    assertTrue(printed().contains("Usage: graphguard"));
  }

  @Test
  void exportWritesFile() {
    Path output = dir.resolve("graph.json");
    assertEquals(
        GraphGuardCommand.EXIT_OK,
        run("--action", "export", "--graph_id", "other", "--output", output.toString()));
    assertTrue(Files.exists(output));
    assertTrue(printed().contains("Exported 3 nodes and 2 edges from graph other"));
  }

  @Test
  void failedExportExitsOne() {
    api.failEdgeListingAfter(0);
    Path output = dir.resolve("graph.json");
    assertEquals(
        GraphGuardCommand.EXIT_FAILURE,
        run("--action", "export", "--output", output.toString(), "--keep-partial"));
    assertFalse(Files.exists(output));
    assertTrue(Files.exists(dir.resolve("graph.json.partial")));
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(GraphGuardCommand.EXIT_OK, run("--help"));
    assertTrue(printed().contains("Exit codes: 0 success"));
  }
}
