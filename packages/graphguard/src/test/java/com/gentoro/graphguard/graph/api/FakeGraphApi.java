package com.gentoro.graphguard.graph.api;

import com.gentoro.graphguard.exception.AuthException;
import com.gentoro.graphguard.exception.GraphGuardException;
import com.gentoro.graphguard.exception.NetworkException;
import com.gentoro.graphguard.exception.NotFoundException;
import com.gentoro.graphguard.exception.RemoteApiException;
import com.gentoro.graphguard.exception.UnsupportedFeatureException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * In-memory {@link GraphApi} holding records as plain maps, the way the remote returns them. Uses
 * uuid-cursor pagination like the Zep API and can be told to fail in the ways the remote fails.
 */
public class FakeGraphApi implements GraphApi {
  private final Map<String, Map<String, Object>> nodes = new LinkedHashMap<>();
  private final Map<String, Map<String, Object>> edges = new LinkedHashMap<>();

  private final List<String> mutations = new ArrayList<>();
  private final Map<String, Integer> transientDeleteFailures = new HashMap<>();
  private final Set<String> rejectedDeletes = new HashSet<>();
  private final Set<String> unauthorizedDeletes = new HashSet<>();

  private boolean healthy = true;
  private boolean credentialsRejected;
  private boolean directNodeDeleteUnsupported;
  private int edgePagesBeforeFailure = -1;
  private GraphGuardException edgeListingFailure;
  private int nodeListCalls;
  private int edgeListCalls;

  public FakeGraphApi addNode(String uuid, String name, String... labels) {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put("uuid", uuid);
    record.put("name", name);
    record.put("labels", List.of(labels));
    record.put("attributes", Map.of());
    nodes.put(uuid, record);
    return this;
  }

  public FakeGraphApi addEdge(String uuid, String source, String target, String fact) {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put("uuid", uuid);
    record.put("source_node_uuid", source);
    record.put("target_node_uuid", target);
    record.put("fact", fact);
    record.put("name", "RELATES_TO");
    edges.put(uuid, record);
    return this;
  }

  /** Adds a raw record to the node listing, bypassing the usual shape. */
  public FakeGraphApi addRawNode(String key, Map<String, Object> record) {
    nodes.put(key, record);
    return this;
  }

  public FakeGraphApi healthy(boolean healthy) {
    this.healthy = healthy;
    return this;
  }

  public FakeGraphApi rejectCredentials() {
    this.credentialsRejected = true;
    return this;
  }

  /** Direct node deletion answers 405 while the node still has edges. */
  public FakeGraphApi directNodeDeleteUnsupported() {
    this.directNodeDeleteUnsupported = true;
    return this;
  }

  /** The next {@code times} deletes of {@code uuid} fail with HTTP 503. */
  public FakeGraphApi failDeleteTransiently(String uuid, int times) {
    transientDeleteFailures.put(uuid, times);
    return this;
  }

  /** Every delete of {@code uuid} fails with HTTP 400. */
  public FakeGraphApi rejectDelete(String uuid) {
    rejectedDeletes.add(uuid);
    return this;
  }

  /** Every delete of {@code uuid} fails with HTTP 401. */
  public FakeGraphApi rejectCredentialsOnDelete(String uuid) {
    unauthorizedDeletes.add(uuid);
    return this;
  }

  /** Edge listing serves {@code pages} pages, then fails with HTTP 503 on every further page. */
  public FakeGraphApi failEdgeListingAfter(int pages) {
    return failEdgeListingAfter(
        pages, new NetworkException("list edges failed with HTTP 503", 503));
  }

  /** Edge listing serves {@code pages} pages, then throws {@code failure} on every further page. */
  public FakeGraphApi failEdgeListingAfter(int pages, GraphGuardException failure) {
    this.edgePagesBeforeFailure = pages;
    this.edgeListingFailure = failure;
    return this;
  }

  public List<String> getMutations() {
    return mutations;
  }

  public int getNodeListCalls() {
    return nodeListCalls;
  }

  public int getEdgeListCalls() {
    return edgeListCalls;
  }

  public boolean hasNode(String uuid) {
    return nodes.containsKey(uuid);
  }

  public boolean hasEdge(String uuid) {
    return edges.containsKey(uuid);
  }

  @Override
  public ApiPage listNodes(String graphId, String pageToken, int limit) {
    checkCredentials();
    nodeListCalls++;
    return page(nodes, pageToken, limit);
  }

  @Override
  public ApiPage listEdges(String graphId, String pageToken, int limit) {
    checkCredentials();
    edgeListCalls++;
    if (edgePagesBeforeFailure >= 0
        && pageIndex(edges, pageToken, limit) >= edgePagesBeforeFailure) {
      throw edgeListingFailure;
    }
    return page(edges, pageToken, limit);
  }

  @Override
  public Object getNode(String uuid) {
    checkCredentials();
    Map<String, Object> record = nodes.get(uuid);
    if (record == null) throw new NotFoundException("node " + uuid + " not found");
    return record;
  }

  @Override
  public Object getEdge(String uuid) {
    checkCredentials();
    Map<String, Object> record = edges.get(uuid);
    if (record == null) throw new NotFoundException("edge " + uuid + " not found");
    return record;
  }

  @Override
  public void deleteNode(String uuid) {
    checkCredentials();
    mutations.add("delete node " + uuid);
    checkInjectedFailures(uuid);
    if (!nodes.containsKey(uuid)) {
      throw new NotFoundException("node " + uuid + " not found");
    }
    if (directNodeDeleteUnsupported
        && edges.values().stream().anyMatch(e -> touches(e, uuid))) {
      throw new UnsupportedFeatureException("delete node " + uuid + " failed with HTTP 405", 405);
    }
    nodes.remove(uuid);
  }

  @Override
  public void deleteEdge(String uuid) {
    checkCredentials();
    mutations.add("delete edge " + uuid);
    checkInjectedFailures(uuid);
    if (edges.remove(uuid) == null) {
      throw new NotFoundException("edge " + uuid + " not found");
    }
  }

  @Override
  public void healthCheck() {
    if (!healthy) {
      throw new NetworkException("health check failed with HTTP 503", 503);
    }
    checkCredentials();
  }

  private void checkCredentials() {
    if (credentialsRejected) {
      throw new AuthException("request failed with HTTP 401", 401);
    }
  }

  private void checkInjectedFailures(String uuid) {
    if (unauthorizedDeletes.contains(uuid)) {
      throw new AuthException("delete " + uuid + " failed with HTTP 401", 401);
    }
    if (rejectedDeletes.contains(uuid)) {
      throw new RemoteApiException("delete " + uuid + " failed with HTTP 400", 400);
    }
    int remaining = transientDeleteFailures.getOrDefault(uuid, 0);
    if (remaining > 0) {
      transientDeleteFailures.put(uuid, remaining - 1);
      throw new NetworkException("delete " + uuid + " failed with HTTP 503", 503);
    }
  }

  private static boolean touches(Map<String, Object> edge, String uuid) {
    return Objects.equals(edge.get("source_node_uuid"), uuid)
        || Objects.equals(edge.get("target_node_uuid"), uuid);
  }

  private static int pageIndex(Map<String, Map<String, Object>> records, String token, int limit) {
    if (token == null) return 0;
    List<String> keys = new ArrayList<>(records.keySet());
    return (keys.indexOf(token) + 1) / limit;
  }

  private static ApiPage page(Map<String, Map<String, Object>> records, String token, int limit) {
    List<String> keys = new ArrayList<>(records.keySet());
    int start = token == null ? 0 : keys.indexOf(token) + 1;
    int end = Math.min(keys.size(), start + limit);
    List<Object> items = new ArrayList<>();
    for (int i = start; i < end; i++) {
      items.add(records.get(keys.get(i)));
    }
    String next = items.size() == limit ? keys.get(end - 1) : null;
    return new ApiPage(items, next);
  }
}
