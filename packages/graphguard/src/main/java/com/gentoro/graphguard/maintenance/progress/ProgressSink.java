package com.gentoro.graphguard.maintenance.progress;

import java.util.Map;

/**
 * Progress reporting for long-running maintenance batches.
 *
 * <p>Decouples the {@code DeletionExecutor} (producer of progress events) from presentation
 * (console, logs). Implementations are expected to be lightweight and non-blocking.
 */
public interface ProgressSink {

  /**
   * Signal the beginning of a stage.
   *
   * @param id stable stage identifier (e.g. "delete-nodes")
   * @param label human-readable label for presentation
   * @param totalWork total work units; implementations should handle 0 gracefully
   */
  void beginStage(String id, String label, long totalWork);

  /**
   * Report an incremental step within a stage.
   *
   * @param id stage identifier
   * @param completed completed work units so far (monotonic, between 0..totalWork)
   * @param message short message describing the current step
   * @param attrs optional structured attributes (e.g. uuid, status)
   */
  void step(String id, long completed, String message, Map<String, Object> attrs);

  /** Mark a stage as successfully completed. */
  void endStageOk(String id, Map<String, Object> attrs);

  /** Mark a stage as failed with a short error summary. */
  void endStageError(String id, String errorSummary, Map<String, Object> attrs);

  /**
   * Return true if the current operation has been cancelled. Checked between items, never while a
   * remote call is in flight. Implementations without cancellation support return false.
   */
  default boolean isCancelled() {
    return false;
  }
}
