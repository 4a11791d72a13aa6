package com.gentoro.graphguard;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/** Actions accepted by {@code --action}. */
public enum Action {
  FIND_ISOLATED_NODES("find_isolated_nodes"),
  FIND_ISOLATED_EDGES("find_isolated_edges"),
  DELETE_NODE("delete_node"),
  DELETE_EDGE("delete_edge"),
  DELETE_ISOLATED_NODES("delete_isolated_nodes"),
  DELETE_ISOLATED_EDGES("delete_isolated_edges"),
  EXPORT("export"),
  HELP("help");

  private final String cliName;

  Action(String cliName) {
    this.cliName = cliName;
  }

  public String cliName() {
    return cliName;
  }

  public boolean requiresUuid() {
    return this == DELETE_NODE || this == DELETE_EDGE;
  }

  public boolean isDeletion() {
    return this == DELETE_NODE
        || this == DELETE_EDGE
        || this == DELETE_ISOLATED_NODES
        || this == DELETE_ISOLATED_EDGES;
  }

  public static Optional<Action> fromCliName(String name) {
    if (name == null) return Optional.empty();
    String normalized = name.trim().replace('-', '_');
    return Arrays.stream(values()).filter(a -> a.cliName.equalsIgnoreCase(normalized)).findFirst();
  }

  public static String choices() {
    return Arrays.stream(values()).map(Action::cliName).collect(Collectors.joining(", "));
  }
}
