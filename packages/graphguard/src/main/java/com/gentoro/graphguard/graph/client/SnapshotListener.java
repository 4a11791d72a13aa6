package com.gentoro.graphguard.graph.client;

import com.gentoro.graphguard.graph.GraphEdge;
import com.gentoro.graphguard.graph.GraphNode;

/** Observes records as a snapshot is collected, page by page. */
public interface SnapshotListener {

  SnapshotListener NONE = new SnapshotListener() {};

  default void onNode(GraphNode node) {}

  default void onEdge(GraphEdge edge) {}
}
