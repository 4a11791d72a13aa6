package com.gentoro.graphguard.graph.api;

/**
 * Raw surface of the remote graph API.
 *
 * <p>Records are returned in whatever shape the remote produced (JSON objects, maps, SDK objects);
 * callers read them through {@link com.gentoro.graphguard.utility.ResultNormalizer}. Failures are
 * reported with the GraphGuard exception taxonomy:
 *
 * <ul>
 *   <li>{@link com.gentoro.graphguard.exception.NetworkException} for transient failures
 *   <li>{@link com.gentoro.graphguard.exception.AuthException} for rejected credentials
 *   <li>{@link com.gentoro.graphguard.exception.NotFoundException} for unknown records
 *   <li>{@link com.gentoro.graphguard.exception.UnsupportedFeatureException} for unsupported calls
 *   <li>{@link com.gentoro.graphguard.exception.RemoteApiException} for other client errors
 *   <li>{@link com.gentoro.graphguard.exception.ApiCompatibilityException} for unreadable bodies
 * </ul>
 *
 * Implementations perform exactly one remote call per method; retries belong to the caller.
 */
public interface GraphApi {

  /** One page of nodes starting after {@code pageToken} (null for the first page). */
  ApiPage listNodes(String graphId, String pageToken, int limit);

  /** One page of edges starting after {@code pageToken} (null for the first page). */
  ApiPage listEdges(String graphId, String pageToken, int limit);

  Object getNode(String uuid);

  Object getEdge(String uuid);

  void deleteNode(String uuid);

  void deleteEdge(String uuid);

  /** Probe the remote service; throws when it is not reachable or not healthy. */
  void healthCheck();
}
