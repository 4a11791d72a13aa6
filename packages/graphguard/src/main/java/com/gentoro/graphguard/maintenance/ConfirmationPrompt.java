package com.gentoro.graphguard.maintenance;

import java.util.List;

/** Asks the operator to approve a deletion before anything is mutated. */
public interface ConfirmationPrompt {

  /**
   * @param plan the plan awaiting approval
   * @param examples representative candidates to display (never more than the executor's preview
   *     limit)
   * @return true only on an affirmative answer
   */
  boolean confirm(DeletionPlan plan, List<DeletionCandidate> examples);
}
