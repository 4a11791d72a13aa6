package com.gentoro.graphguard.graph.api;

import java.util.List;

/**
 * A page of raw records plus the token for the next page, or {@code null} when the remote signalled
 * that no further page exists.
 */
public final class ApiPage {
  private final List<?> items;
  private final String nextPageToken;

  public ApiPage(List<?> items, String nextPageToken) {
    this.items = items == null ? List.of() : List.copyOf(items);
    this.nextPageToken = nextPageToken;
  }

  public List<?> getItems() {
    return items;
  }

  public String getNextPageToken() {
    return nextPageToken;
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }
}
