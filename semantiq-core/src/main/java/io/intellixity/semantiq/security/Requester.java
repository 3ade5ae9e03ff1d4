package io.intellixity.semantiq.security;

/**
 * Who is asking. Either identity may be null; without a user identity no share policy applies.
 *
 * @param userIdentity  user id or email, matched case-insensitively against user shares
 * @param groupIdentity group name, matched case-insensitively against group shares
 */
public record Requester(String userIdentity, String groupIdentity) {
  public Requester {
    userIdentity = blankToNull(userIdentity);
    groupIdentity = blankToNull(groupIdentity);
  }

  public static Requester anonymous() { return new Requester(null, null); }

  private static String blankToNull(String s) {
    if (s == null) return null;
    String t = s.trim();
    return t.isEmpty() ? null : t;
  }
}
