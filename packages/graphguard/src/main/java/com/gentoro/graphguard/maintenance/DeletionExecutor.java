package com.gentoro.graphguard.maintenance;

import com.gentoro.graphguard.exception.ExceptionUtil;
import com.gentoro.graphguard.exception.GraphGuardException;
import com.gentoro.graphguard.graph.client.DeleteOutcome;
import com.gentoro.graphguard.graph.client.GraphClient;
import com.gentoro.graphguard.maintenance.progress.ProgressSink;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Drives a deletion plan through {@code PLANNED -> CONFIRMED -> EXECUTING -> COMPLETED | PARTIAL},
 * or {@code PLANNED -> ABORTED} when the operator declines.
 *
 * <p>Items are deleted sequentially and a failed item never stops the batch. Retries happen inside
 * {@link GraphClient}; the executor itself never repeats an item. Cancellation is honoured between
 * items: whatever was not attempted is reported as failed with reason {@code cancelled}. A fatal
 * error from the client (rejected credentials) stops the batch at the failing item; that item and
 * the rest are reported as failed with the error as reason, and the batch ends {@code PARTIAL}.
 */
public class DeletionExecutor {
  private static final org.slf4j.Logger log =
      com.gentoro.graphguard.logging.LoggingService.getLogger(DeletionExecutor.class);

  /** Maximum number of candidates shown when asking for confirmation. */
  public static final int PREVIEW_LIMIT = 5;

  static final String CANCELLED_REASON = "cancelled";

  private final GraphClient client;
  private final ConfirmationPrompt prompt;
  private final ProgressSink progress;

  public DeletionExecutor(GraphClient client, ConfirmationPrompt prompt, ProgressSink progress) {
    this.client = Objects.requireNonNull(client, "client");
    this.prompt = Objects.requireNonNull(prompt, "prompt");
    this.progress = Objects.requireNonNull(progress, "progress");
  }

  public DeletionSummary execute(DeletionPlan plan, boolean skipConfirmation) {
    DeletionBatch batch = new DeletionBatch(plan);
    DeletionKind kind = plan.getKind();

    if (plan.size() == 0) {
      log.info("No {} to delete in graph {}", kind.plural(), plan.getGraphId());
      batch.transitionTo(BatchState.CONFIRMED);
      batch.transitionTo(BatchState.EXECUTING);
      batch.transitionTo(BatchState.COMPLETED);
      return batch.toSummary();
    }

    if (!skipConfirmation) {
      List<DeletionCandidate> examples =
          plan.getCandidates().subList(0, Math.min(PREVIEW_LIMIT, plan.size()));
      if (!prompt.confirm(plan, examples)) {
        log.info("Deletion of {} {} cancelled by user", plan.size(), kind.noun(plan.size()));
        batch.transitionTo(BatchState.ABORTED);
        return batch.toSummary();
      }
    } else {
      log.info("Confirmation skipped for deletion of {} {}", plan.size(), kind.noun(plan.size()));
    }
    batch.transitionTo(BatchState.CONFIRMED);
    batch.transitionTo(BatchState.EXECUTING);

    String stage = "delete-" + kind.plural();
    progress.beginStage(stage, "Deleting " + kind.plural(), plan.size());
    List<DeletionCandidate> candidates = plan.getCandidates();
    int processed = 0;
    String abortReason = null;
    for (DeletionCandidate candidate : candidates) {
      if (progress.isCancelled()) {
        break;
      }
      DeleteOutcome outcome;
      try {
        outcome = delete(plan, candidate.getUuid());
      } catch (GraphGuardException e) {
        abortReason = ExceptionUtil.describe(e);
        log.error(
            "Aborting deletion of {} after {} of {} items: {}",
            kind.plural(),
            processed,
            candidates.size(),
            e.getMessage());
        break;
      }
      processed++;
      if (outcome.succeeded()) {
        batch.recordSuccess(candidate.getUuid(), outcome.getEdgesRemoved());
        boolean absent = outcome.getStatus() == DeleteOutcome.Status.NOT_FOUND;
        progress.step(
            stage,
            processed,
            (absent ? "Already absent " : "Deleted ")
                + kind.singular()
                + ": UUID="
                + candidate.getUuid(),
            Map.of("uuid", candidate.getUuid(), "status", outcome.getStatus().name()));
      } else {
        batch.recordFailure(candidate.getUuid(), outcome.getReason(), outcome.getEdgesRemoved());
        progress.step(
            stage,
            processed,
            "Failed " + kind.singular() + ": UUID=" + candidate.getUuid(),
            Map.of("uuid", candidate.getUuid(), "status", outcome.getStatus().name()));
      }
    }

    if (processed < candidates.size()) {
      String reason = abortReason == null ? CANCELLED_REASON : abortReason;
      if (abortReason == null) {
        log.warn(
            "Deletion cancelled after {} of {} {}", processed, candidates.size(), kind.plural());
      }
      for (DeletionCandidate skipped : candidates.subList(processed, candidates.size())) {
        batch.recordFailure(skipped.getUuid(), reason, 0);
      }
    }

    batch.transitionTo(batch.hasFailures() ? BatchState.PARTIAL : BatchState.COMPLETED);
    DeletionSummary summary = batch.toSummary();
    if (summary.getState() == BatchState.COMPLETED) {
      progress.endStageOk(stage, Map.of("succeeded", summary.getSucceededCount()));
    } else {
      progress.endStageError(
          stage,
          summary.getFailedCount() + " " + kind.noun(summary.getFailedCount()) + " not deleted",
          Map.of("succeeded", summary.getSucceededCount(), "failed", summary.getFailedCount()));
    }
    log.info(
        "Deleted {} {}. Failed to delete {} {}.",
        summary.getSucceededCount(),
        kind.noun(summary.getSucceededCount()),
        summary.getFailedCount(),
        kind.noun(summary.getFailedCount()));
    return summary;
  }

  private DeleteOutcome delete(DeletionPlan plan, String uuid) {
    return plan.getKind() == DeletionKind.NODE
        ? client.deleteNode(plan.getGraphId(), uuid)
        : client.deleteEdge(uuid);
  }
}
