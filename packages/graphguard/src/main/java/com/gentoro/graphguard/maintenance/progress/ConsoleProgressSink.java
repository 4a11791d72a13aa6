package com.gentoro.graphguard.maintenance.progress;

import java.io.PrintStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Prints one line per processed item to the console and carries the cancellation flag raised by
 * the shutdown hook.
 */
public class ConsoleProgressSink implements ProgressSink {
  private final PrintStream out;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final Map<String, Long> totals = new HashMap<>();

  public ConsoleProgressSink(PrintStream out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  @Override
  public void beginStage(String id, String label, long totalWork) {
    totals.put(id, Math.max(0, totalWork));
    out.printf("%s (%d)%n", label, totalWork);
  }

  @Override
  public void step(String id, long completed, String message, Map<String, Object> attrs) {
    out.printf("  [%d/%d] %s%n", completed, totals.getOrDefault(id, 0L), message);
  }

  @Override
  public void endStageOk(String id, Map<String, Object> attrs) {
    out.flush();
  }

  @Override
  public void endStageError(String id, String errorSummary, Map<String, Object> attrs) {
    out.printf("  stopped: %s%n", errorSummary);
    out.flush();
  }

  /** Request cancellation; the running batch stops before its next item. */
  public void cancel() {
    cancelled.set(true);
  }

  @Override
  public boolean isCancelled() {
    return cancelled.get();
  }
}
