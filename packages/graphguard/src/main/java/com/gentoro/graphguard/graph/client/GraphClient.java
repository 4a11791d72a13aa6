package com.gentoro.graphguard.graph.client;

import com.gentoro.graphguard.config.GraphGuardSettings;
import com.gentoro.graphguard.exception.AuthException;
import com.gentoro.graphguard.exception.CancelledException;
import com.gentoro.graphguard.exception.ExceptionUtil;
import com.gentoro.graphguard.exception.GraphGuardException;
import com.gentoro.graphguard.exception.NotFoundException;
import com.gentoro.graphguard.exception.UnsupportedFeatureException;
import com.gentoro.graphguard.graph.GraphEdge;
import com.gentoro.graphguard.graph.GraphNode;
import com.gentoro.graphguard.graph.GraphSnapshot;
import com.gentoro.graphguard.graph.api.GraphApi;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Adapter between GraphGuard and the remote {@link GraphApi}: transparent pagination, retries for
 * transient failures, idempotent deletes and the node-deletion fallback.
 *
 * <p>Read failures propagate: a partial listing cannot be trusted. Delete failures are folded into a
 * {@link DeleteOutcome}, except {@link AuthException} and {@link CancelledException}, which abort
 * the whole operation.
 */
public class GraphClient {
  private static final org.slf4j.Logger log =
      com.gentoro.graphguard.logging.LoggingService.getLogger(GraphClient.class);

  private final GraphApi api;
  private final int pageSize;
  private final RetryPolicy retryPolicy;
  private final Clock clock;

  public GraphClient(GraphApi api, GraphGuardSettings settings) {
    this(
        api,
        settings,
        new RetryPolicy(
            settings.maxAttempts(), settings.initialBackoff(), settings.maxBackoff()),
        Clock.systemUTC());
  }

  public GraphClient(
      GraphApi api, GraphGuardSettings settings, RetryPolicy retryPolicy, Clock clock) {
    this.api = Objects.requireNonNull(api, "api");
    this.pageSize = settings.pageSize();
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** All nodes of the graph. Each iteration performs a fresh paginated read. */
  public Iterable<GraphNode> listNodes(String graphId) {
    return new PagedIterable<>(
        "nodes of " + graphId,
        pageSize,
        token ->
            retryPolicy.execute(
                "list nodes of " + graphId, () -> api.listNodes(graphId, token, pageSize)),
        GraphRecordMapper::toNode);
  }

  /** All edges of the graph. Each iteration performs a fresh paginated read. */
  public Iterable<GraphEdge> listEdges(String graphId) {
    return new PagedIterable<>(
        "edges of " + graphId,
        pageSize,
        token ->
            retryPolicy.execute(
                "list edges of " + graphId, () -> api.listEdges(graphId, token, pageSize)),
        GraphRecordMapper::toEdge);
  }

  public GraphSnapshot fetchSnapshot(String graphId) {
    return fetchSnapshot(graphId, SnapshotListener.NONE);
  }

  /** Full read of nodes, then edges. Any read failure aborts the snapshot. */
  public GraphSnapshot fetchSnapshot(String graphId, SnapshotListener listener) {
    List<GraphNode> nodes = new ArrayList<>();
    for (GraphNode node : listNodes(graphId)) {
      nodes.add(node);
      listener.onNode(node);
    }
    List<GraphEdge> edges = new ArrayList<>();
    for (GraphEdge edge : listEdges(graphId)) {
      edges.add(edge);
      listener.onEdge(edge);
    }
    GraphSnapshot snapshot = new GraphSnapshot(graphId, nodes, edges, clock.instant());
    log.info("Fetched {} nodes and {} edges from graph {}", nodes.size(), edges.size(), graphId);
    return snapshot;
  }

  /** Look up a single node; empty when the remote reports it does not exist. */
  public Optional<GraphNode> findNode(String uuid) {
    try {
      Object record = retryPolicy.execute("get node " + uuid, () -> api.getNode(uuid));
      return GraphRecordMapper.toNode(record);
    } catch (NotFoundException e) {
      return Optional.empty();
    }
  }

  /** Look up a single edge; empty when the remote reports it does not exist. */
  public Optional<GraphEdge> findEdge(String uuid) {
    try {
      Object record = retryPolicy.execute("get edge " + uuid, () -> api.getEdge(uuid));
      return GraphRecordMapper.toEdge(record);
    } catch (NotFoundException e) {
      return Optional.empty();
    }
  }

  public DeleteOutcome deleteEdge(String uuid) {
    try {
      retryPolicy.run("delete edge " + uuid, () -> api.deleteEdge(uuid));
      log.info("Deleted edge {}", uuid);
      return DeleteOutcome.success(uuid);
    } catch (NotFoundException e) {
      log.info("Edge {} already absent", uuid);
      return DeleteOutcome.notFound(uuid);
    } catch (AuthException | CancelledException e) {
      throw e;
    } catch (GraphGuardException e) {
      log.error("Failed to delete edge {}: {}", uuid, e.getMessage());
      return DeleteOutcome.failed(uuid, ExceptionUtil.describe(e));
    }
  }

  /**
   * Delete a node. When the remote rejects direct node deletion as unsupported, the connected edges
   * in {@code graphId} are deleted one by one and the node deletion is attempted once more. The
   * steps are independent: edges removed before a failure stay removed and are counted in the
   * outcome.
   */
  public DeleteOutcome deleteNode(String graphId, String uuid) {
    try {
      retryPolicy.run("delete node " + uuid, () -> api.deleteNode(uuid));
      log.info("Deleted node {}", uuid);
      return DeleteOutcome.success(uuid);
    } catch (NotFoundException e) {
      log.info("Node {} already absent", uuid);
      return DeleteOutcome.notFound(uuid);
    } catch (UnsupportedFeatureException e) {
      log.warn(
          "Direct deletion of node {} is not supported ({}); removing its edges first",
          uuid,
          e.getMessage());
      return deleteNodeAfterEdges(graphId, uuid);
    } catch (AuthException | CancelledException e) {
      throw e;
    } catch (GraphGuardException e) {
      log.error("Failed to delete node {}: {}", uuid, e.getMessage());
      return DeleteOutcome.failed(uuid, ExceptionUtil.describe(e));
    }
  }

  private DeleteOutcome deleteNodeAfterEdges(String graphId, String uuid) {
    List<GraphEdge> connected = new ArrayList<>();
    try {
      for (GraphEdge edge : listEdges(graphId)) {
        if (edge.touches(uuid)) {
          connected.add(edge);
        }
      }
    } catch (AuthException | CancelledException e) {
      throw e;
    } catch (GraphGuardException e) {
      return DeleteOutcome.failed(
          uuid, "could not list edges connected to the node: " + ExceptionUtil.describe(e), 0);
    }

    int removed = 0;
    for (GraphEdge edge : connected) {
      if (deleteEdge(edge.getUuid()).succeeded()) {
        removed++;
      }
    }
    log.info("Removed {}/{} edges connected to node {}", removed, connected.size(), uuid);

    try {
      retryPolicy.run("delete node " + uuid, () -> api.deleteNode(uuid));
      log.info("Deleted node {} after removing {} connected edges", uuid, removed);
      return DeleteOutcome.success(uuid, removed);
    } catch (NotFoundException e) {
      return DeleteOutcome.notFound(uuid, removed);
    } catch (AuthException | CancelledException e) {
      throw e;
    } catch (GraphGuardException e) {
      String reason =
          "node deletion still failing after removing "
              + removed
              + " of "
              + connected.size()
              + " connected edges: "
              + ExceptionUtil.describe(e);
      log.error("Failed to delete node {}: {}", uuid, reason);
      return DeleteOutcome.failed(uuid, reason, removed);
    }
  }

  /** Lightweight probe; any failure, including rejected credentials, yields {@code false}. */
  public boolean healthCheck() {
    try {
      api.healthCheck();
      return true;
    } catch (GraphGuardException e) {
      log.warn("Graph API health check failed: {}", e.getMessage());
      return false;
    }
  }
}
