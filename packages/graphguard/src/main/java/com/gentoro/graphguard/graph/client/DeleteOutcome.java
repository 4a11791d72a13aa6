package com.gentoro.graphguard.graph.client;

import java.util.Objects;

/**
 * Result of deleting one node or edge.
 *
 * <p>{@link Status#NOT_FOUND} means the record was already gone; it counts as a successful delete.
 * {@code edgesRemoved} reports how many connected edges the node-deletion fallback removed, whether
 * or not the node itself could be deleted afterwards.
 */
public final class DeleteOutcome {

  public enum Status {
    SUCCESS,
    NOT_FOUND,
    FAILED
  }

  private final String uuid;
  private final Status status;
  private final String reason;
  private final int edgesRemoved;

  private DeleteOutcome(String uuid, Status status, String reason, int edgesRemoved) {
    this.uuid = Objects.requireNonNull(uuid, "uuid");
    this.status = Objects.requireNonNull(status, "status");
    this.reason = reason;
    this.edgesRemoved = edgesRemoved;
  }

  public static DeleteOutcome success(String uuid) {
    return new DeleteOutcome(uuid, Status.SUCCESS, null, 0);
  }

  public static DeleteOutcome success(String uuid, int edgesRemoved) {
    return new DeleteOutcome(uuid, Status.SUCCESS, null, edgesRemoved);
  }

  public static DeleteOutcome notFound(String uuid) {
    return new DeleteOutcome(uuid, Status.NOT_FOUND, null, 0);
  }

  public static DeleteOutcome notFound(String uuid, int edgesRemoved) {
    return new DeleteOutcome(uuid, Status.NOT_FOUND, null, edgesRemoved);
  }

  public static DeleteOutcome failed(String uuid, String reason) {
    return new DeleteOutcome(uuid, Status.FAILED, reason, 0);
  }

  public static DeleteOutcome failed(String uuid, String reason, int edgesRemoved) {
    return new DeleteOutcome(uuid, Status.FAILED, reason, edgesRemoved);
  }

  public String getUuid() {
    return uuid;
  }

  public Status getStatus() {
    return status;
  }

  /** True for {@link Status#SUCCESS} and {@link Status#NOT_FOUND}. */
  public boolean succeeded() {
    return status != Status.FAILED;
  }

  /** Failure reason, {@code null} unless {@link Status#FAILED}. */
  public String getReason() {
    return reason;
  }

  public int getEdgesRemoved() {
    return edgesRemoved;
  }

  @Override
  public String toString() {
    return "DeleteOutcome{uuid="
        + uuid
        + ", status="
        + status
        + (reason == null ? "" : ", reason=" + reason)
        + (edgesRemoved == 0 ? "" : ", edgesRemoved=" + edgesRemoved)
        + '}';
  }
}
