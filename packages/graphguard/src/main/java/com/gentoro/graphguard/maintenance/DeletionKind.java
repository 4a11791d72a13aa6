package com.gentoro.graphguard.maintenance;

/** What a deletion batch removes. */
public enum DeletionKind {
  NODE("node", "nodes"),
  EDGE("edge", "edges");

  private final String singular;
  private final String plural;

  DeletionKind(String singular, String plural) {
    this.singular = singular;
    this.plural = plural;
  }

  public String singular() {
    return singular;
  }

  public String plural() {
    return plural;
  }

  public String noun(long count) {
    return count == 1 ? singular : plural;
  }
}
