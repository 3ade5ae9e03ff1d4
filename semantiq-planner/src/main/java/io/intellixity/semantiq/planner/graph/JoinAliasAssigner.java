package io.intellixity.semantiq.planner.graph;

import io.intellixity.semantiq.error.ErrorCode;
import io.intellixity.semantiq.error.SemanticQueryException;
import io.intellixity.semantiq.model.ModelTable;
import io.intellixity.semantiq.model.Relationship;
import io.intellixity.semantiq.spi.sql.SqlDialect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Gives the root {@code t1} and every joined table the next {@code tN}, emitting one INNER JOIN per
 * relationship. A relationship is taken only once exactly one of its ends already has an alias.
 */
public final class JoinAliasAssigner {
  public static final String ROOT_ALIAS = "t1";

  public record Assignment(Map<String, String> aliasByTableId, List<String> joinClauses) {
    public String aliasOf(String tableId) { return aliasByTableId.get(tableId); }
  }

  public Assignment assign(String rootId,
                           List<Relationship> relationships,
                           Function<String, ModelTable> tableById,
                           SqlDialect dialect) {
    Map<String, String> aliases = new LinkedHashMap<>();
    aliases.put(rootId, ROOT_ALIAS);
    List<String> joins = new ArrayList<>();
    List<Relationship> pending = new ArrayList<>(relationships);
    int next = 2;

    while (!pending.isEmpty()) {
      int idx = -1;
      for (int i = 0; i < pending.size(); i++) {
        Relationship r = pending.get(i);
        if (aliases.containsKey(r.fromTableId()) != aliases.containsKey(r.toTableId())) {
          idx = i;
          break;
        }
      }
      if (idx < 0) {
        throw new SemanticQueryException(ErrorCode.JOIN_GRAPH_ERROR, "Cannot resolve join graph for selected tables");
      }

      Relationship r = pending.remove(idx);
      boolean forward = aliases.containsKey(r.fromTableId());
      String knownId = forward ? r.fromTableId() : r.toTableId();
      String newId = forward ? r.toTableId() : r.fromTableId();
      String knownColumn = forward ? r.fromColumn() : r.toColumn();
      String newColumn = forward ? r.toColumn() : r.fromColumn();

      String knownAlias = aliases.get(knownId);
      String newAlias = "t" + (next++);
      aliases.put(newId, newAlias);

      ModelTable table = tableById.apply(newId);
      if (table == null) {
        throw new SemanticQueryException(ErrorCode.JOIN_GRAPH_ERROR, "Joined table is not part of the data model: " + newId);
      }
      joins.add("INNER JOIN " + table.runtimeRef() + " " + newAlias
          + " ON " + dialect.columnRef(knownAlias, knownColumn) + " = " + dialect.columnRef(newAlias, newColumn));
    }
    return new Assignment(Collections.unmodifiableMap(aliases), List.copyOf(joins));
  }
}
