package io.intellixity.semantiq.model;

import java.util.List;
import java.util.Objects;

/** Snapshot of one data model as loaded for a single planning call. */
public record Catalog(DataModel model, List<ModelTable> tables, List<Relationship> relationships) {
  public Catalog {
    Objects.requireNonNull(model, "model");
    tables = List.copyOf(tables == null ? List.of() : tables);
    relationships = List.copyOf(relationships == null ? List.of() : relationships);
  }

  /** Resolve a table by model-table id or physical-table id; null if not in this model. */
  public ModelTable resolveTable(String ref) {
    if (ref == null) return null;
    for (ModelTable t : tables) {
      if (t.matchesRef(ref)) return t;
    }
    return null;
  }
}
