package io.intellixity.semantiq.planner.security;

import io.intellixity.semantiq.error.ErrorCode;
import io.intellixity.semantiq.error.SemanticQueryException;
import io.intellixity.semantiq.security.Requester;
import io.intellixity.semantiq.security.RlsConfigParser;
import io.intellixity.semantiq.security.ShareGrant;
import io.intellixity.semantiq.security.SharePermission;
import io.intellixity.semantiq.security.SharePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Turns the share rows of a dashboard into the effective policy for one requester.
 * <p>
 * Only the highest-ranked matching grant counts; grants are not merged.
 */
public final class SharePolicyResolver {
  private static final Logger log = LoggerFactory.getLogger(SharePolicyResolver.class);

  private final ShareGrantStore store;
  private final RlsConfigParser rlsParser;

  public SharePolicyResolver(ShareGrantStore store) {
    this(store, new RlsConfigParser());
  }

  public SharePolicyResolver(ShareGrantStore store, RlsConfigParser rlsParser) {
    this.store = Objects.requireNonNull(store, "store");
    this.rlsParser = Objects.requireNonNull(rlsParser, "rlsParser");
  }

  /** Null when no dashboard is named, the requester has no user identity, or nothing is shared with them. */
  public SharePolicy resolvePolicy(String tenantId, Requester requester, String dashboardId) {
    if (dashboardId == null || dashboardId.isBlank()) return null;
    if (requester == null || requester.userIdentity() == null) return null;

    List<ShareGrant> grants = store.findGrants(tenantId, dashboardId, requester.userIdentity(), requester.groupIdentity());
    ShareGrant best = grants.stream()
        .max(Comparator.comparingInt(g -> SharePermission.rankOf(g.permission())))
        .orElse(null);
    if (best == null) return null;

    SharePermission permission = SharePermission.fromValue(best.permission());
    if (permission == null) permission = SharePermission.VIEW;
    if (permission == SharePermission.ADMIN) return SharePolicy.unrestricted();

    List<String> allowed = best.allowedPageIds().isEmpty() ? best.dashboardPageIds() : best.allowedPageIds();
    SharePolicy policy = new SharePolicy(permission, allowed, rlsParser.parse(best.rlsConfig()));
    if (log.isDebugEnabled()) {
      log.debug("semantiq.rls op=resolvePolicy dashboard={} permission={} pages={} rules={}",
          dashboardId, permission, allowed.size(), policy.rules().size());
    }
    return policy;
  }

  /**
   * Denies when the request names no page while the policy has an allow-list, or names a page outside it.
   * Unrestricted or absent policies always pass.
   */
  public void checkPage(SharePolicy policy, String pageId) {
    if (policy == null || !policy.isRestricted()) return;
    List<String> allowed = policy.allowedPageIds();
    if (allowed.isEmpty()) return;
    boolean missing = (pageId == null || pageId.isBlank());
    if (missing || !allowed.contains(pageId)) {
      throw new SemanticQueryException(ErrorCode.RLS_PAGE_DENIED, "Access denied: page is not allowed by RLS policy");
    }
  }
}
