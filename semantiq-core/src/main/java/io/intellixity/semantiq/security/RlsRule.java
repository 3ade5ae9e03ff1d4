package io.intellixity.semantiq.security;

import io.intellixity.semantiq.query.Connector;

import java.util.List;

/** One RLS rule: its conditions are combined left to right with {@code combinator}. */
public record RlsRule(List<RlsCondition> conditions, Connector combinator) {
  public RlsRule {
    conditions = List.copyOf(conditions == null ? List.of() : conditions);
    combinator = (combinator == null) ? Connector.AND : combinator;
  }
}
