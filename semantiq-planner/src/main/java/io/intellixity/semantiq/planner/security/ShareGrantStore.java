package io.intellixity.semantiq.planner.security;

import io.intellixity.semantiq.security.ShareGrant;

import java.util.List;

/** Dashboard share lookup. */
public interface ShareGrantStore {
  /**
   * Grants on {@code dashboardId} (a dashboard of the tenant) whose target is the user identity
   * (type user) or the group identity (type group), compared case-insensitively.
   * {@code groupIdentity} may be null, in which case group shares never match.
   */
  List<ShareGrant> findGrants(String tenantId, String dashboardId, String userIdentity, String groupIdentity);
}
