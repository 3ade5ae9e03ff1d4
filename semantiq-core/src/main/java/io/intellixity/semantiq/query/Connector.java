package io.intellixity.semantiq.query;

/** Logical connector joining a filter to everything before it. */
public enum Connector {
  AND,
  OR;

  public static Connector fromCode(String code) {
    return (code != null && code.trim().equalsIgnoreCase("OR")) ? OR : AND;
  }
}
