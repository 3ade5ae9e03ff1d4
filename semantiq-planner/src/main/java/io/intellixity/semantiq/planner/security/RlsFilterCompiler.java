package io.intellixity.semantiq.planner.security;

import io.intellixity.semantiq.model.ModelTable;
import io.intellixity.semantiq.query.Connector;
import io.intellixity.semantiq.query.FilterOperator;
import io.intellixity.semantiq.query.FilterSpec;
import io.intellixity.semantiq.security.RlsCondition;
import io.intellixity.semantiq.security.RlsRule;
import io.intellixity.semantiq.security.SharePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles RLS rules into filter groups, one group per rule.
 * <p>
 * A condition binds to the first candidate table having a column of exactly that name; conditions that
 * bind nowhere are skipped.
 */
public final class RlsFilterCompiler {
  private static final Logger log = LoggerFactory.getLogger(RlsFilterCompiler.class);

  public List<List<FilterSpec>> compile(SharePolicy policy, List<ModelTable> candidates) {
    if (policy == null || !policy.isRestricted()) return List.of();

    List<List<FilterSpec>> groups = new ArrayList<>();
    int unbound = 0;
    for (RlsRule rule : policy.rules()) {
      List<FilterSpec> group = new ArrayList<>();
      for (RlsCondition c : rule.conditions()) {
        String field = (c.field() == null) ? "" : c.field().trim();
        if (field.isEmpty()) continue;
        ModelTable bound = bind(candidates, field);
        if (bound == null) {
          unbound++;
          continue;
        }
        FilterOperator op = FilterOperator.fromRlsCode(c.operator());
        Object value = (op == FilterOperator.IN) ? (c.values() == null ? List.of() : c.values()) : c.value();
        Connector connector = group.isEmpty() ? Connector.AND : rule.combinator();
        group.add(new FilterSpec(bound.id(), field, op, value, c.value2(), null, connector));
      }
      if (!group.isEmpty()) groups.add(group);
    }
    if (unbound > 0 && log.isDebugEnabled()) {
      log.debug("semantiq.rls op=compile groups={} unboundConditions={}", groups.size(), unbound);
    }
    return groups;
  }

  private static ModelTable bind(List<ModelTable> candidates, String column) {
    for (ModelTable t : candidates) {
      if (t.hasColumn(column)) return t;
    }
    return null;
  }
}
