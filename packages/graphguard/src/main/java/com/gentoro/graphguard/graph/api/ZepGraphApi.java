package com.gentoro.graphguard.graph.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.graphguard.exception.ApiCompatibilityException;
import com.gentoro.graphguard.exception.AuthException;
import com.gentoro.graphguard.exception.NetworkException;
import com.gentoro.graphguard.exception.NotFoundException;
import com.gentoro.graphguard.exception.RemoteApiException;
import com.gentoro.graphguard.exception.UnsupportedFeatureException;
import com.gentoro.graphguard.utility.JacksonUtility;
import com.gentoro.graphguard.utility.ResultNormalizer;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * {@link GraphApi} over the Zep v2 REST API.
 *
 * <p>Listing uses cursor pagination: {@code POST graph/node/graph/{graphId}} (or {@code
 * graph/edge/graph/{graphId}}) with body {@code {"limit": n, "uuid_cursor": "<last uuid>"}}. A full
 * page yields the uuid of its last identifiable record as the next page token; a short page ends
 * the listing. A full page with no identifiable record is an error, never the end of the listing.
 * Responses are expected to be a JSON array, but an object wrapping the array under {@code nodes},
 * {@code edges}, {@code items} or {@code data} is accepted and logged.
 */
public class ZepGraphApi implements GraphApi {
  private static final org.slf4j.Logger log =
      com.gentoro.graphguard.logging.LoggingService.getLogger(ZepGraphApi.class);

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final List<String> WRAPPER_FIELDS = List.of("nodes", "edges", "items", "data");

  private final OkHttpClient client;
  private final HttpUrl baseUrl;
  private final String healthPath;

  public ZepGraphApi(OkHttpClient client, String baseUrl, String healthPath) {
    this.client = Objects.requireNonNull(client, "client");
    HttpUrl parsed = HttpUrl.parse(Objects.requireNonNull(baseUrl, "baseUrl"));
    if (parsed == null) {
      throw new IllegalArgumentException("Invalid Zep base URL: " + baseUrl);
    }
    this.baseUrl = parsed;
    this.healthPath = healthPath;
  }

  @Override
  public ApiPage listNodes(String graphId, String pageToken, int limit) {
    return listPage("graph/node/graph", graphId, pageToken, limit);
  }

  @Override
  public ApiPage listEdges(String graphId, String pageToken, int limit) {
    return listPage("graph/edge/graph", graphId, pageToken, limit);
  }

  @Override
  public Object getNode(String uuid) {
    String description = "get node " + uuid;
    return parse(execute(get(url("graph/node", uuid)), description), description);
  }

  @Override
  public Object getEdge(String uuid) {
    String description = "get edge " + uuid;
    return parse(execute(get(url("graph/edge", uuid)), description), description);
  }

  @Override
  public void deleteNode(String uuid) {
    execute(delete(url("graph/node", uuid)), "delete node " + uuid);
  }

  @Override
  public void deleteEdge(String uuid) {
    execute(delete(url("graph/edge", uuid)), "delete edge " + uuid);
  }

  @Override
  public void healthCheck() {
    HttpUrl url = baseUrl.newBuilder().addPathSegments(healthPath).build();
    execute(get(url), "health check");
  }

  private ApiPage listPage(String path, String graphId, String pageToken, int limit) {
    ObjectNode body = JacksonUtility.getJsonMapper().createObjectNode();
    body.put("limit", limit);
    if (pageToken != null) {
      body.put("uuid_cursor", pageToken);
    }
    Request request =
        new Request.Builder()
            .url(url(path, graphId))
            .header("Accept", "application/json")
            .post(RequestBody.create(JacksonUtility.toCompactJson(body), JSON))
            .build();

    String description = "list " + path + " for graph " + graphId;
    JsonNode response = parse(execute(request, description), description);
    List<JsonNode> items = extractItems(response, path);
    String next = null;
    if (items.size() >= limit && !items.isEmpty()) {
      next = lastUuid(items);
      if (next == null) {
        throw new ApiCompatibilityException(
            "Full page from " + path + " for graph " + graphId + " has no record with a uuid;"
                + " cannot continue pagination");
      }
    }
    return new ApiPage(items, next);
  }

  /** Cursor for the next page: the uuid of the last record on the page that has one. */
  private static String lastUuid(List<JsonNode> items) {
    for (int i = items.size() - 1; i >= 0; i--) {
      String uuid = ResultNormalizer.string(items.get(i), "uuid");
      if (uuid != null && !uuid.isBlank()) {
        if (i < items.size() - 1) {
          log.warn(
              "{} trailing record(s) without uuid; continuing from {}", items.size() - 1 - i, uuid);
        }
        return uuid;
      }
    }
    return null;
  }

  private List<JsonNode> extractItems(JsonNode response, String path) {
    JsonNode array = response;
    if (response == null || response.isMissingNode() || response.isNull()) {
      return List.of();
    }
    if (response.isObject()) {
      array = null;
      for (String wrapper : WRAPPER_FIELDS) {
        if (response.path(wrapper).isArray()) {
          log.warn(
              "Response from {} wraps records under '{}' instead of returning an array", path,
              wrapper);
          array = response.get(wrapper);
          break;
        }
      }
    }
    if (array == null || !array.isArray()) {
      throw new ApiCompatibilityException(
          "Unexpected response shape from " + path + ": " + response.getNodeType());
    }
    List<JsonNode> items = new ArrayList<>(array.size());
    array.forEach(items::add);
    return items;
  }

  private HttpUrl url(String path, String id) {
    return baseUrl.newBuilder().addPathSegments(path).addPathSegment(id).build();
  }

  private static Request get(HttpUrl url) {
    return new Request.Builder().url(url).header("Accept", "application/json").get().build();
  }

  private static Request delete(HttpUrl url) {
    return new Request.Builder().url(url).header("Accept", "application/json").delete().build();
  }

  /**
   * Run one request and map the HTTP outcome onto the exception taxonomy. Returns the response
   * body, which deletes and the health probe ignore.
   */
  private String execute(Request request, String description) {
    try (Response response = client.newCall(request).execute()) {
      int status = response.code();
      String body = readBody(response.body());
      if (response.isSuccessful()) {
        return body;
      }
      String message = description + " failed with HTTP " + status + detail(body);
      if (status == 401 || status == 403) {
        throw new AuthException(message, status);
      }
      if (status == 404) {
        throw new NotFoundException(message);
      }
      if (status == 405 || status == 501) {
        throw new UnsupportedFeatureException(message, status);
      }
      if (status == 408 || status == 429 || status >= 500) {
        throw new NetworkException(message, status);
      }
      throw new RemoteApiException(message, status);
    } catch (IOException e) {
      throw new NetworkException(description + " failed: " + e.getMessage(), e);
    }
  }

  private static String readBody(ResponseBody body) throws IOException {
    return body == null ? "" : body.string();
  }

  private static JsonNode parse(String body, String description) {
    if (body == null || body.isBlank()) {
      return MissingNode.getInstance();
    }
    try {
      return JacksonUtility.getJsonMapper().readTree(body);
    } catch (JsonProcessingException e) {
      throw new ApiCompatibilityException("Response to " + description + " is not valid JSON", e);
    }
  }

  private static String detail(String body) {
    if (body == null || body.isBlank()) return "";
    String trimmed = body.strip();
    return ": " + (trimmed.length() > 200 ? trimmed.substring(0, 200) + "..." : trimmed);
  }
}
