package io.intellixity.semantiq.governance;

import io.intellixity.semantiq.security.Requester;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-request governance context.
 *
 * Keys: {@code tenantId} (required by every governed call), {@code userId}, {@code groupId}.
 */
public interface GovernanceContext {
  String TENANT_ID = "tenantId";
  String USER_ID = "userId";
  String GROUP_ID = "groupId";

  /** Return a context value or null if absent. */
  Object get(String key);

  /** Return a required context value; throws if missing. */
  default Object getRequired(String key) {
    Objects.requireNonNull(key, "key");
    Object v = get(key);
    if (v == null) throw new IllegalStateException("Missing GovernanceContext key: " + key);
    return v;
  }

  default String tenantId() {
    return String.valueOf(getRequired(TENANT_ID));
  }

  /** The requester the share policy is resolved for; identities may be absent. */
  default Requester requester() {
    Object user = get(USER_ID);
    Object group = get(GROUP_ID);
    return new Requester(user == null ? null : user.toString(), group == null ? null : group.toString());
  }

  /** Simple map-backed context. */
  static GovernanceContext of(Map<String, ?> values) {
    Map<String, ?> m = values == null ? Map.of() : Map.copyOf(values);
    return m::get;
  }

  /** Context for one requester; null identities are left out. */
  static GovernanceContext of(String tenantId, String userId, String groupId) {
    Objects.requireNonNull(tenantId, "tenantId");
    Map<String, Object> m = new HashMap<>();
    m.put(TENANT_ID, tenantId);
    if (userId != null) m.put(USER_ID, userId);
    if (groupId != null) m.put(GROUP_ID, groupId);
    return of(m);
  }
}
