package io.intellixity.semantiq.query;

/**
 * Single column predicate. {@code value2} is only read by {@link FilterOperator#BETWEEN};
 * {@code in}/{@code notIn} read a list (or a scalar) from {@code value}.
 * <p>
 * {@code connector} joins this filter to the accumulated expression of the filters before it and is
 * ignored on the first filter of a group.
 */
public record FilterSpec(String tableRef,
                         String column,
                         FilterOperator operator,
                         Object value,
                         Object value2,
                         HierarchyPart hierarchyPart,
                         Connector connector) {
  public FilterSpec {
    operator = (operator == null) ? FilterOperator.EQUALS : operator;
    connector = (connector == null) ? Connector.AND : connector;
  }

  public FilterSpec withTableRef(String ref) {
    return new FilterSpec(ref, column, operator, value, value2, hierarchyPart, connector);
  }
}
