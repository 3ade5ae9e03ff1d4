package io.intellixity.semantiq.model;

import java.time.Instant;
import java.util.Objects;

/** Directed join definition fromTable.fromColumn -> toTable.toColumn. */
public record Relationship(String id,
                           String dataModelId,
                           String fromTableId,
                           String fromTable,
                           String fromColumn,
                           String toTableId,
                           String toTable,
                           String toColumn,
                           Cardinality cardinality,
                           CrossFilterDirection crossFilterDirection,
                           ValidationStatus validationStatus,
                           String invalidReason,
                           Instant createdAt) {
  public Relationship {
    Objects.requireNonNull(fromTableId, "fromTableId");
    Objects.requireNonNull(toTableId, "toTableId");
    Objects.requireNonNull(fromColumn, "fromColumn");
    Objects.requireNonNull(toColumn, "toColumn");
    cardinality = (cardinality == null) ? Cardinality.ONE_TO_MANY : cardinality;
    crossFilterDirection = (crossFilterDirection == null) ? CrossFilterDirection.SINGLE : crossFilterDirection;
    validationStatus = (validationStatus == null) ? ValidationStatus.VALID : validationStatus;
  }

  /**
   * Whether this relationship may be traversed when resolving join paths.
   * n-n needs a bridge table that the model does not carry.
   */
  public boolean isJoinable() {
    return validationStatus == ValidationStatus.VALID && cardinality != Cardinality.MANY_TO_MANY;
  }
}
