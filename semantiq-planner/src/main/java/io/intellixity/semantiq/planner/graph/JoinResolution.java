package io.intellixity.semantiq.planner.graph;

import io.intellixity.semantiq.model.Relationship;

import java.util.List;
import java.util.Set;

/**
 * @param relationships distinct relationships to join on, first-seen order
 * @param skippedTableIds optional tables without a path from the root
 */
public record JoinResolution(List<Relationship> relationships, Set<String> skippedTableIds) {
  public JoinResolution {
    relationships = List.copyOf(relationships);
    skippedTableIds = Set.copyOf(skippedTableIds);
  }
}
