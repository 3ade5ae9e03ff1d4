package io.intellixity.semantiq.query;

import java.util.Locale;
import java.util.Set;

/** Values the UI sends to mean "no value". */
public final class NullLikeValues {
  private static final Set<String> TOKENS = Set.of("", "(blank)", "null", "undefined", "nan");

  private NullLikeValues() {}

  public static boolean isNullLike(Object v) {
    if (v == null) return true;
    if (!(v instanceof String s)) return false;
    return TOKENS.contains(s.trim().toLowerCase(Locale.ROOT));
  }
}
