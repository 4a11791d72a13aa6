package com.gentoro.graphguard;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.graphguard.exception.ValidationException;
import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void parsesOptionsAndSwitches() {
    StartupParameters params =
        new StartupParameters(
            new String[] {
              "--action", "delete_isolated_nodes", "--graph_id", "kb", "--no-confirm", "--verbose"
            });
    assertEquals(Action.DELETE_ISOLATED_NODES, params.action());
    assertEquals("kb", params.graphId().orElseThrow());
    assertTrue(params.skipConfirmation());
    assertTrue(params.verbose());
    assertFalse(params.keepPartial());
    assertEquals("classpath:application.yaml", params.configFile());
  }

  @Test
  void acceptsEqualsFormAndDashedGraphId() {
    StartupParameters params =
        new StartupParameters(
            new String[] {
              "--action=export", "--graph-id=kb", "--output=out.json", "--keep-partial"
            });
    assertEquals(Action.EXPORT, params.action());
    assertEquals("kb", params.graphId().orElseThrow());
    assertEquals("out.json", params.output().orElseThrow());
    assertTrue(params.keepPartial());
  }

  @Test
  void graphIdIsOptional() {
    StartupParameters params =
        new StartupParameters(new String[] {"--action", "find_isolated_edges"});
    assertTrue(params.graphId().isEmpty());
  }

  @Test
  void helpNeedsNothingElse() {
    assertEquals(Action.HELP, new StartupParameters(new String[] {"--help"}).action());
    assertEquals(Action.HELP, new StartupParameters(new String[] {"--action", "help"}).action());
  }

  @Test
  void rejectsMissingOrUnknownAction() {
    assertThrows(ValidationException.class, () -> new StartupParameters(new String[] {}));
    assertThrows(
        ValidationException.class,
        () -> new StartupParameters(new String[] {"--action", "drop_everything"}));
  }

  @Test
  void singleDeletesRequireUuid() {
    assertThrows(
        ValidationException.class,
        () -> new StartupParameters(new String[] {"--action", "delete_node"}));
    assertThrows(
        ValidationException.class,
        () -> new StartupParameters(new String[] {"--action", "delete_edge", "--uuid", " "}));
    assertEquals(
        "e1",
        new StartupParameters(new String[] {"--action", "delete_edge", "--uuid", "e1"})
            .uuid()
            .orElseThrow());
  }

  @Test
  void exportRequiresOutput() {
    assertThrows(
        ValidationException.class,
        () -> new StartupParameters(new String[] {"--action", "export"}));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(
        ValidationException.class,
        () -> new StartupParameters(new String[] {"--action", "export", "stray", "--output", "x"}));
    assertThrows(
        ValidationException.class,
        () -> new StartupParameters(new String[] {"--action", "help", "--colour", "red"}));
    assertThrows(
        ValidationException.class,
        () -> new StartupParameters(new String[] {"--action", "export", "--output"}));
    assertThrows(
        ValidationException.class,
        () -> new StartupParameters(new String[] {"--action", "help", "--verbose=yes"}));
  }
}
