package io.intellixity.semantiq.spi.sql;

import io.intellixity.semantiq.error.ErrorCode;
import io.intellixity.semantiq.error.SemanticQueryException;
import io.intellixity.semantiq.model.RuntimeEngine;
import io.intellixity.semantiq.util.SemantiqFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dialect registry built via discovery ({@code META-INF/semantiq.factories}).
 * <p>
 * One dialect per engine; the first registration wins and later duplicates are ignored.
 */
public final class DiscoveredDialectRegistry {
  private static final Logger log = LoggerFactory.getLogger(DiscoveredDialectRegistry.class);

  private final Map<RuntimeEngine, SqlDialect> byEngine;

  public DiscoveredDialectRegistry() {
    this(SemantiqFactoriesLoader.load(SqlDialect.class));
  }

  public DiscoveredDialectRegistry(List<SqlDialect> dialects) {
    Map<RuntimeEngine, SqlDialect> m = new EnumMap<>(RuntimeEngine.class);
    for (SqlDialect d : dialects) {
      if (d == null || d.engine() == null) continue;
      SqlDialect prev = m.putIfAbsent(d.engine(), d);
      if (prev != null) {
        log.warn("semantiq.dialect op=register engine={} kept={} ignored={}",
            d.id(), prev.getClass().getName(), d.getClass().getName());
      }
    }
    this.byEngine = m;
    if (log.isDebugEnabled()) log.debug("semantiq.dialect op=discover engines={}", m.keySet());
  }

  public SqlDialect forEngine(RuntimeEngine engine) {
    SqlDialect d = byEngine.get(engine);
    if (d == null) {
      throw new SemanticQueryException(ErrorCode.ENGINE_NOT_SUPPORTED,
          "No SQL dialect registered for runtime engine: " + (engine == null ? null : engine.id()));
    }
    return d;
  }

  public Set<RuntimeEngine> engines() {
    return Set.copyOf(byEngine.keySet());
  }
}
