package io.intellixity.semantiq.planner.graph;

import io.intellixity.semantiq.model.Relationship;

/** Traversal edge: walking {@code relationship} leads to {@code nextTableId}. */
public record JoinEdge(Relationship relationship, String nextTableId, boolean reverse) {}
