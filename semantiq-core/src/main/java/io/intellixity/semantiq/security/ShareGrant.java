package io.intellixity.semantiq.security;

import java.util.List;
import java.util.Objects;

/**
 * One dashboard share row as held by the policy store.
 *
 * @param permission       stored permission text (may be an alias)
 * @param rlsConfig        raw RLS rule document (JSON), may be null
 * @param dashboardPageIds ids of the dashboard's own pages, used when the grant lists no allowed pages
 */
public record ShareGrant(ShareTargetType targetType,
                         String targetId,
                         String permission,
                         List<String> allowedPageIds,
                         String rlsConfig,
                         List<String> dashboardPageIds) {
  public ShareGrant {
    Objects.requireNonNull(targetId, "targetId");
    targetType = (targetType == null) ? ShareTargetType.USER : targetType;
    allowedPageIds = List.copyOf(allowedPageIds == null ? List.of() : allowedPageIds);
    dashboardPageIds = List.copyOf(dashboardPageIds == null ? List.of() : dashboardPageIds);
  }
}
