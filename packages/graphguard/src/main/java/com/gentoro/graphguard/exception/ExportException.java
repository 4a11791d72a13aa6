package com.gentoro.graphguard.exception;

import java.util.Map;

/**
 * A graph export could not be completed. Carries how many records were collected before the
 * failure so the caller can report partial progress.
 */
public class ExportException extends GraphGuardException {
  private final int nodesCollected;
  private final int edgesCollected;

  public ExportException(String message, int nodesCollected, int edgesCollected, Throwable cause) {
    super(
        GraphGuardErrorCode.EXPORT_ERROR,
        message,
        Map.of("nodesCollected", nodesCollected, "edgesCollected", edgesCollected),
        cause);
    this.nodesCollected = nodesCollected;
    this.edgesCollected = edgesCollected;
  }

  public int getNodesCollected() {
    return nodesCollected;
  }

  public int getEdgesCollected() {
    return edgesCollected;
  }
}
