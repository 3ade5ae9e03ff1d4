package io.intellixity.semantiq.query;

public enum SortDirection {
  ASC,
  DESC;

  public static SortDirection fromCode(String code) {
    return (code != null && code.trim().equalsIgnoreCase("DESC")) ? DESC : ASC;
  }
}
