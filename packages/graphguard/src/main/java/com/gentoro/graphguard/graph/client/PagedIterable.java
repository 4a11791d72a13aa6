package com.gentoro.graphguard.graph.client;

import com.gentoro.graphguard.exception.ApiCompatibilityException;
import com.gentoro.graphguard.graph.api.ApiPage;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Lazy view over a paginated listing. Every call to {@link #iterator()} starts again from the first
 * page; a page is fetched only when the previous one is exhausted.
 *
 * <p>Iteration ends on an empty page, a page shorter than the page size, or a page without next
 * token. A next token that repeats the previous one raises {@link ApiCompatibilityException}: a
 * truncated listing must never pass for a complete one.
 */
final class PagedIterable<T> implements Iterable<T> {
  private static final org.slf4j.Logger log =
      com.gentoro.graphguard.logging.LoggingService.getLogger(PagedIterable.class);

  /** Fetches one page given the token of the previous page (null for the first). */
  @FunctionalInterface
  interface PageFetcher {
    ApiPage fetch(String pageToken);
  }

  private final String description;
  private final int pageSize;
  private final PageFetcher fetcher;
  private final Function<Object, Optional<T>> mapper;

  PagedIterable(
      String description, int pageSize, PageFetcher fetcher, Function<Object, Optional<T>> mapper) {
    this.description = description;
    this.pageSize = pageSize;
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public Iterator<T> iterator() {
    return new PageIterator();
  }

  private final class PageIterator implements Iterator<T> {
    private final Deque<T> buffer = new ArrayDeque<>();
    private String token;
    private boolean exhausted;
    private int pages;

    @Override
    public boolean hasNext() {
      while (buffer.isEmpty() && !exhausted) {
        fetchNext();
      }
      return !buffer.isEmpty();
    }

    @Override
    public T next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return buffer.poll();
    }

    private void fetchNext() {
      ApiPage page = fetcher.fetch(token);
      pages++;
      for (Object item : page.getItems()) {
        mapper.apply(item).ifPresent(buffer::add);
      }
      String next = page.getNextPageToken();
      if (page.isEmpty() || page.getItems().size() < pageSize || next == null) {
        exhausted = true;
      } else if (next.equals(token)) {
        throw new ApiCompatibilityException(
            description + ": page token " + next + " repeated after page " + pages
                + "; the listing would be incomplete");
      }
      token = next;
      log.debug(
          "{}: fetched page {} with {} records{}",
          description,
          pages,
          page.getItems().size(),
          exhausted ? " (last)" : "");
    }
  }
}
