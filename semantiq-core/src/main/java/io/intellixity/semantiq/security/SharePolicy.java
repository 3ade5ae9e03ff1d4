package io.intellixity.semantiq.security;

import java.util.List;
import java.util.Objects;

/**
 * Effective policy for one requester on one dashboard.
 * An {@link SharePermission#ADMIN} policy carries no page or row restrictions.
 */
public record SharePolicy(SharePermission permission, List<String> allowedPageIds, List<RlsRule> rules) {
  public SharePolicy {
    Objects.requireNonNull(permission, "permission");
    allowedPageIds = List.copyOf(allowedPageIds == null ? List.of() : allowedPageIds);
    rules = List.copyOf(rules == null ? List.of() : rules);
  }

  public static SharePolicy unrestricted() {
    return new SharePolicy(SharePermission.ADMIN, List.of(), List.of());
  }

  public boolean isRestricted() { return permission != SharePermission.ADMIN; }
}
