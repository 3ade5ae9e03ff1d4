package io.intellixity.semantiq.spi.sql;

import io.intellixity.semantiq.query.FilterSpec;

import java.util.Objects;

/** A filter whose table reference has been resolved to a statement alias. */
public record BoundFilter(String alias, FilterSpec filter) {
  public BoundFilter {
    Objects.requireNonNull(alias, "alias");
    Objects.requireNonNull(filter, "filter");
  }
}
