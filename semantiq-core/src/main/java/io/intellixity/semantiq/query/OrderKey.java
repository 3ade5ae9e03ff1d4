package io.intellixity.semantiq.query;

public record OrderKey(String tableRef, String column, HierarchyPart hierarchyPart, SortDirection direction) {
  public OrderKey {
    direction = (direction == null) ? SortDirection.ASC : direction;
  }
}
