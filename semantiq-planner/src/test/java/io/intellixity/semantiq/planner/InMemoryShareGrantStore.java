package io.intellixity.semantiq.planner;

import io.intellixity.semantiq.planner.security.ShareGrantStore;
import io.intellixity.semantiq.security.ShareGrant;
import io.intellixity.semantiq.security.ShareTargetType;

import java.util.ArrayList;
import java.util.List;

public final class InMemoryShareGrantStore implements ShareGrantStore {
  private record Row(String tenantId, String dashboardId, ShareGrant grant) {}

  private final List<Row> rows = new ArrayList<>();

  public InMemoryShareGrantStore add(String tenantId, String dashboardId, ShareGrant grant) {
    rows.add(new Row(tenantId, dashboardId, grant));
    return this;
  }

  @Override
  public List<ShareGrant> findGrants(String tenantId, String dashboardId, String userIdentity, String groupIdentity) {
    List<ShareGrant> out = new ArrayList<>();
    for (Row r : rows) {
      if (!r.tenantId.equals(tenantId) || !r.dashboardId.equals(dashboardId)) continue;
      ShareGrant g = r.grant;
      boolean match = (g.targetType() == ShareTargetType.USER)
          ? g.targetId().equalsIgnoreCase(userIdentity)
          : groupIdentity != null && g.targetId().equalsIgnoreCase(groupIdentity);
      if (match) out.add(g);
    }
    return out;
  }
}
