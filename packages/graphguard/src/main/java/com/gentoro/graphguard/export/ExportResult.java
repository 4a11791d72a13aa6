package com.gentoro.graphguard.export;

import java.nio.file.Path;

public final class ExportResult {
  private final Path path;
  private final int nodeCount;
  private final int edgeCount;

  public ExportResult(Path path, int nodeCount, int edgeCount) {
    this.path = path;
    this.nodeCount = nodeCount;
    this.edgeCount = edgeCount;
  }

  public Path getPath() {
    return path;
  }

  public int getNodeCount() {
    return nodeCount;
  }

  public int getEdgeCount() {
    return edgeCount;
  }
}
