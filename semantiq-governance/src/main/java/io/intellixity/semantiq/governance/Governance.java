package io.intellixity.semantiq.governance;

import java.util.Objects;
import java.util.function.Supplier;

/** Thread-bound governance context utilities. Nested boundaries restore the outer context on exit. */
public final class Governance {
  private Governance() {}

  private static final ThreadLocal<GovernanceContext> CTX = new ThreadLocal<>();

  /** Execute work within a governance context boundary. */
  public static <T> T inContext(GovernanceContext ctx, Supplier<T> work) {
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(work, "work");
    GovernanceContext previous = CTX.get();
    CTX.set(ctx);
    try {
      return work.get();
    } finally {
      if (previous == null) CTX.remove();
      else CTX.set(previous);
    }
  }

  public static GovernanceContext currentOrNull() {
    return CTX.get();
  }

  public static GovernanceContext currentOrThrow() {
    GovernanceContext c = currentOrNull();
    if (c == null) throw new IllegalStateException("No GovernanceContext bound in current scope");
    return c;
  }
}
