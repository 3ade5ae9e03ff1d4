package io.intellixity.semantiq.security;

import java.util.Locale;

/** Dashboard share permission, ordered by rank. */
public enum SharePermission {
  VIEW(1),
  EDIT(2),
  ADMIN(3);

  private final int rank;

  SharePermission(int rank) {
    this.rank = rank;
  }

  public int rank() { return rank; }

  /**
   * Accepts the canonical names plus their aliases ({@code viewer}/{@code read}, {@code editor}/{@code write},
   * {@code owner}). Returns null for anything else.
   */
  public static SharePermission fromValue(String value) {
    if (value == null) return null;
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "view", "viewer", "read" -> VIEW;
      case "edit", "editor", "write" -> EDIT;
      case "admin", "owner" -> ADMIN;
      default -> null;
    };
  }

  /** Rank of a stored permission value, aliases included; unrecognised values rank as view. */
  public static int rankOf(String stored) {
    SharePermission p = fromValue(stored);
    return (p == null) ? VIEW.rank : p.rank;
  }
}
