package io.intellixity.semantiq.config;

/**
 * Planner knobs. Passed explicitly to the components that need them.
 *
 * @param defaultLimit     LIMIT used when the request carries none
 * @param maxLimit         upper clamp for any requested LIMIT
 * @param aliasMaxLength   maximum length of a sanitized output alias
 * @param strictRlsBinding fail the request instead of dropping an RLS predicate whose table has no join path
 */
public record PlannerConfig(int defaultLimit, int maxLimit, int aliasMaxLength, boolean strictRlsBinding) {
  public static final int DEFAULT_LIMIT = 1000;
  public static final int MAX_LIMIT = 5000;
  public static final int ALIAS_MAX_LENGTH = 60;

  public PlannerConfig {
    if (maxLimit < 1) throw new IllegalArgumentException("maxLimit must be >= 1");
    if (defaultLimit < 1 || defaultLimit > maxLimit) {
      throw new IllegalArgumentException("defaultLimit must be within [1, maxLimit]");
    }
    if (aliasMaxLength < 1) throw new IllegalArgumentException("aliasMaxLength must be >= 1");
  }

  public static PlannerConfig defaults() {
    return new PlannerConfig(DEFAULT_LIMIT, MAX_LIMIT, ALIAS_MAX_LENGTH, false);
  }

  /** Null means "not given"; anything else is clamped to [1, maxLimit]. */
  public int effectiveLimit(Integer requested) {
    if (requested == null) return defaultLimit;
    return Math.max(1, Math.min(requested, maxLimit));
  }
}
