package io.intellixity.semantiq.query;

public record GroupKey(String tableRef, String column, HierarchyPart hierarchyPart) {}
