package com.gentoro.graphguard.maintenance;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Interactive prompt on the console; only "yes" or "y" (any case) approves. */
public class ConsoleConfirmationPrompt implements ConfirmationPrompt {
  private static final org.slf4j.Logger log =
      com.gentoro.graphguard.logging.LoggingService.getLogger(ConsoleConfirmationPrompt.class);

  private static final Set<String> AFFIRMATIVE = Set.of("yes", "y");

  private final BufferedReader in;
  private final PrintStream out;

  public ConsoleConfirmationPrompt(BufferedReader in, PrintStream out) {
    this.in = in;
    this.out = out;
  }

  @Override
  public boolean confirm(DeletionPlan plan, List<DeletionCandidate> examples) {
    DeletionKind kind = plan.getKind();
    int total = plan.size();
    if (plan.isBulk()) {
      out.printf("Found %d %s to delete in graph %s.%n", total, kind.noun(total), plan.getGraphId());
      out.printf("Example %s:%n", kind.plural());
    } else {
      out.printf("About to delete %s in graph %s:%n", kind.singular(), plan.getGraphId());
    }
    for (int i = 0; i < examples.size(); i++) {
      out.printf("  %d. %s%n", i + 1, examples.get(i));
    }
    if (total > examples.size()) {
      out.printf("  ... and %d more%n", total - examples.size());
    }
    String subject = total == 1 ? "this " + kind.singular() : "these " + kind.plural();
    out.printf("Do you want to delete %s? (yes/no): ", subject);
    out.flush();

    String answer;
    try {
      answer = in.readLine();
    } catch (IOException e) {
      log.warn("Could not read confirmation answer: {}", e.getMessage());
      return false;
    }
    if (answer == null) {
      out.println();
      return false;
    }
    return AFFIRMATIVE.contains(answer.trim().toLowerCase(Locale.ROOT));
  }
}
