package io.intellixity.semantiq.model;

import java.util.Objects;

/** Tenant-scoped logical namespace grouping model tables and their relationships. */
public record DataModel(String id, String tenantId, String name, boolean isDefault) {
  public static final String DEFAULT_NAME = "Workspace Default Model";

  public DataModel {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(tenantId, "tenantId");
    name = (name == null || name.isBlank()) ? DEFAULT_NAME : name;
  }
}
