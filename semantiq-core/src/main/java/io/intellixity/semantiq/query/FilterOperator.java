package io.intellixity.semantiq.query;

import com.fasterxml.jackson.annotation.JsonValue;

/** Closed set of filter operators a request may carry. */
public enum FilterOperator {
  EQUALS("equals"),
  NOT_EQUALS("notEquals"),
  CONTAINS("contains"),
  NOT_CONTAINS("notContains"),
  STARTS_WITH("startsWith"),
  ENDS_WITH("endsWith"),
  GREATER_THAN("greaterThan"),
  GREATER_OR_EQUAL("greaterOrEqual"),
  LESS_THAN("lessThan"),
  LESS_OR_EQUAL("lessOrEqual"),
  BETWEEN("between"),
  IN("in"),
  NOT_IN("notIn"),
  IS_NULL("isNull"),
  IS_NOT_NULL("isNotNull");

  private final String code;

  FilterOperator(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() { return code; }

  /** Exact (case-sensitive) code lookup. Unknown or missing codes behave as {@link #EQUALS}. */
  public static FilterOperator fromCode(String code) {
    if (code != null) {
      for (FilterOperator op : values()) {
        if (op.code.equals(code)) return op;
      }
    }
    return EQUALS;
  }

  /**
   * Maps the short operator codes used inside RLS rule documents
   * ({@code eq, neq, gt, gte, lt, lte, in, between, contains, startsWith, endsWith, isNull, isNotNull}).
   */
  public static FilterOperator fromRlsCode(String code) {
    if (code == null) return EQUALS;
    return switch (code) {
      case "eq" -> EQUALS;
      case "neq" -> NOT_EQUALS;
      case "gt" -> GREATER_THAN;
      case "gte" -> GREATER_OR_EQUAL;
      case "lt" -> LESS_THAN;
      case "lte" -> LESS_OR_EQUAL;
      case "in" -> IN;
      case "between" -> BETWEEN;
      case "contains" -> CONTAINS;
      case "startsWith" -> STARTS_WITH;
      case "endsWith" -> ENDS_WITH;
      case "isNull" -> IS_NULL;
      case "isNotNull" -> IS_NOT_NULL;
      default -> EQUALS;
    };
  }
}
