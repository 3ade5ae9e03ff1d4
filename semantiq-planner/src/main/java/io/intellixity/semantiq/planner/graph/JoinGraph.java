package io.intellixity.semantiq.planner.graph;

import io.intellixity.semantiq.model.Relationship;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only adjacency snapshot over the joinable relationships of one catalog.
 * <p>
 * Each relationship contributes a forward and a reverse edge. Neighbor lists keep relationship order, so
 * among equally short paths the earliest-created relationship wins.
 */
public final class JoinGraph {
  private final Map<String, List<JoinEdge>> adjacency;

  private JoinGraph(Map<String, List<JoinEdge>> adjacency) {
    this.adjacency = adjacency;
  }

  public static JoinGraph of(List<Relationship> relationships) {
    Map<String, List<JoinEdge>> adj = new LinkedHashMap<>();
    for (Relationship r : relationships) {
      if (!r.isJoinable()) continue;
      adj.computeIfAbsent(r.fromTableId(), k -> new ArrayList<>()).add(new JoinEdge(r, r.toTableId(), false));
      adj.computeIfAbsent(r.toTableId(), k -> new ArrayList<>()).add(new JoinEdge(r, r.fromTableId(), true));
    }
    adj.replaceAll((k, v) -> Collections.unmodifiableList(v));
    return new JoinGraph(Collections.unmodifiableMap(adj));
  }

  public List<JoinEdge> neighbors(String tableId) {
    return adjacency.getOrDefault(tableId, List.of());
  }

  /**
   * Breadth-first shortest path from {@code startId} to {@code targetId}, as the edges walked in order.
   * Empty when start equals target; null when the target is unreachable.
   */
  public List<JoinEdge> shortestPath(String startId, String targetId) {
    if (startId.equals(targetId)) return List.of();

    Deque<String> queue = new ArrayDeque<>();
    Set<String> visited = new HashSet<>();
    Map<String, Step> parent = new HashMap<>();
    queue.add(startId);
    visited.add(startId);

    while (!queue.isEmpty()) {
      String current = queue.poll();
      if (current.equals(targetId)) break;
      for (JoinEdge e : neighbors(current)) {
        if (!visited.add(e.nextTableId())) continue;
        parent.put(e.nextTableId(), new Step(current, e));
        queue.add(e.nextTableId());
      }
    }
    if (!visited.contains(targetId)) return null;

    List<JoinEdge> path = new ArrayList<>();
    String cursor = targetId;
    while (!cursor.equals(startId)) {
      Step s = parent.get(cursor);
      path.add(s.edge);
      cursor = s.prev;
    }
    Collections.reverse(path);
    return path;
  }

  private record Step(String prev, JoinEdge edge) {}
}
