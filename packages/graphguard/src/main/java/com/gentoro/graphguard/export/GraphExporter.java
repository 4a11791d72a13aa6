package com.gentoro.graphguard.export;

import com.gentoro.graphguard.exception.AuthException;
import com.gentoro.graphguard.exception.ExportException;
import com.gentoro.graphguard.exception.GraphGuardException;
import com.gentoro.graphguard.exception.IoException;
import com.gentoro.graphguard.exception.SerializationException;
import com.gentoro.graphguard.graph.GraphEdge;
import com.gentoro.graphguard.graph.GraphNode;
import com.gentoro.graphguard.graph.GraphSnapshot;
import com.gentoro.graphguard.graph.client.GraphClient;
import com.gentoro.graphguard.graph.client.SnapshotListener;
import com.gentoro.graphguard.utility.JacksonUtility;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Read-only export of a full graph snapshot to a JSON file.
 *
 * <p>The file is written to a temporary sibling and renamed into place, so the target path either
 * holds a complete export or is left untouched. A read failure aborts the export with an {@link
 * ExportException} that reports how many records were collected; those records are written to
 * {@code <output>.partial} only when the caller asks for it. Rejected credentials are rethrown
 * unchanged after the same bookkeeping.
 */
public class GraphExporter {
  private static final org.slf4j.Logger log =
      com.gentoro.graphguard.logging.LoggingService.getLogger(GraphExporter.class);

  static final String PARTIAL_SUFFIX = ".partial";

  private final GraphClient client;
  private final Clock clock;

  public GraphExporter(GraphClient client) {
    this(client, Clock.systemUTC());
  }

  public GraphExporter(GraphClient client, Clock clock) {
    this.client = Objects.requireNonNull(client, "client");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public ExportResult export(String graphId, Path output, boolean keepPartial) {
    Objects.requireNonNull(output, "output");
    List<GraphNode> nodes = new ArrayList<>();
    List<GraphEdge> edges = new ArrayList<>();
    GraphSnapshot snapshot;
    try {
      snapshot =
          client.fetchSnapshot(
              graphId,
              new SnapshotListener() {
                @Override
                public void onNode(GraphNode node) {
                  nodes.add(node);
                }

                @Override
                public void onEdge(GraphEdge edge) {
                  edges.add(edge);
                }
              });
    } catch (GraphGuardException e) {
      log.error(
          "Export of graph {} failed after collecting {} nodes and {} edges: {}",
          graphId,
          nodes.size(),
          edges.size(),
          e.getMessage());
      if (keepPartial) {
        Path partialPath = output.resolveSibling(output.getFileName() + PARTIAL_SUFFIX);
        GraphExportDocument partial =
            new GraphExportDocument(graphId, clock.instant().toString(), true, nodes, edges);
        writeAtomically(partial, partialPath);
        log.warn("Partial export kept at {}", partialPath);
      }
      if (e instanceof AuthException) {
        throw e;
      }
      throw new ExportException(
          "Export of graph "
              + graphId
              + " failed after collecting "
              + nodes.size()
              + " nodes and "
              + edges.size()
              + " edges: "
              + e.getMessage(),
          nodes.size(),
          edges.size(),
          e);
    }

    GraphExportDocument document =
        new GraphExportDocument(
            snapshot.getGraphId(),
            clock.instant().toString(),
            null,
            snapshot.getNodes(),
            snapshot.getEdges());
    writeAtomically(document, output);
    log.info(
        "Exported {} nodes and {} edges of graph {} to {}",
        document.getNodes().size(),
        document.getEdges().size(),
        graphId,
        output.toAbsolutePath());
    return new ExportResult(output, document.getNodes().size(), document.getEdges().size());
  }

  /** Parse an export file written by {@link #export}. */
  public static GraphExportDocument read(Path path) {
    try {
      return JacksonUtility.getJsonMapper().readValue(path.toFile(), GraphExportDocument.class);
    } catch (IOException e) {
      throw new SerializationException("Failed to read graph export " + path, e);
    }
  }

  static void writeAtomically(GraphExportDocument document, Path target) {
    Path absolute = target.toAbsolutePath();
    Path dir = absolute.getParent();
    Path temp = null;
    try {
      Files.createDirectories(dir);
      temp = Files.createTempFile(dir, "." + absolute.getFileName(), ".tmp");
      try (OutputStream out = Files.newOutputStream(temp)) {
        JacksonUtility.getJsonMapper().writeValue(out, document);
      }
      try {
        Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        log.debug("Atomic move not supported in {}, replacing non-atomically", dir);
        Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
      }
      temp = null;
    } catch (IOException e) {
      throw new IoException("Failed to write graph export to " + absolute, e);
    } finally {
      if (temp != null) {
        try {
          Files.deleteIfExists(temp);
        } catch (IOException e) {
          log.warn("Could not remove temporary export file {}: {}", temp, e.getMessage());
        }
      }
    }
  }
}
