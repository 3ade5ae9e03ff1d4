package io.intellixity.semantiq.planner.graph;

import io.intellixity.semantiq.error.ErrorCode;
import io.intellixity.semantiq.error.SemanticQueryException;
import io.intellixity.semantiq.model.ModelTable;
import io.intellixity.semantiq.model.Relationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/** Picks the relationships connecting a root table to every table a request touches. */
public final class JoinPathResolver {
  private static final Logger log = LoggerFactory.getLogger(JoinPathResolver.class);

  /**
   * Required targets must be reachable from the root; optional targets that are not are reported as skipped.
   *
   * @param tableById lookup used to name unreachable tables in error messages
   */
  public JoinResolution resolve(JoinGraph graph,
                                String rootId,
                                Collection<String> requiredIds,
                                Collection<String> optionalIds,
                                Function<String, ModelTable> tableById) {
    Map<String, Relationship> selected = new LinkedHashMap<>();
    Set<String> skipped = new LinkedHashSet<>();

    for (String target : requiredIds) {
      if (target.equals(rootId)) continue;
      var path = graph.shortestPath(rootId, target);
      if (path == null) {
        ModelTable t = tableById.apply(target);
        String label = (t == null) ? target : t.label();
        throw new SemanticQueryException(ErrorCode.NO_RELATIONSHIP_PATH,
            "No valid relationship path from root table to target table (" + label + ")");
      }
      for (JoinEdge e : path) selected.putIfAbsent(e.relationship().id(), e.relationship());
    }

    for (String target : optionalIds) {
      if (target.equals(rootId) || requiredIds.contains(target)) continue;
      var path = graph.shortestPath(rootId, target);
      if (path == null) {
        skipped.add(target);
        continue;
      }
      for (JoinEdge e : path) selected.putIfAbsent(e.relationship().id(), e.relationship());
    }

    if (log.isDebugEnabled()) {
      log.debug("semantiq.graph op=resolve root={} required={} optional={} joins={} skipped={}",
          rootId, requiredIds.size(), optionalIds.size(), selected.size(), skipped.size());
    }
    return new JoinResolution(new ArrayList<>(selected.values()), skipped);
  }
}
