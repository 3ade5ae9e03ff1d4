package io.intellixity.semantiq.governance;

import io.intellixity.semantiq.security.Requester;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class GovernanceTest {

  @Test
  void contextIsBoundOnlyInsideBoundary() {
    assertNull(Governance.currentOrNull());
    String tenant = Governance.inContext(GovernanceContext.of("acme", "a@x.io", null),
        () -> Governance.currentOrThrow().tenantId());
    assertEquals("acme", tenant);
    assertNull(Governance.currentOrNull());
    assertThrows(IllegalStateException.class, Governance::currentOrThrow);
  }

  @Test
  void nestedBoundaryRestoresOuterContext() {
    GovernanceContext outer = GovernanceContext.of("outer", null, null);
    GovernanceContext inner = GovernanceContext.of("inner", null, null);

    Governance.inContext(outer, () -> {
      assertEquals("inner", Governance.inContext(inner, () -> Governance.currentOrThrow().tenantId()));
      assertSame(outer, Governance.currentOrThrow());
      return null;
    });
  }

  @Test
  void contextIsClearedWhenWorkFails() {
    assertThrows(IllegalArgumentException.class, () -> Governance.inContext(GovernanceContext.of("acme", null, null), () -> {
      throw new IllegalArgumentException("boom");
    }));
    assertNull(Governance.currentOrNull());
  }

  @Test
  void requesterAndRequiredKeys() {
    GovernanceContext ctx = GovernanceContext.of(Map.of("tenantId", "acme", "userId", "a@x.io", "groupId", " "));
    assertEquals(new Requester("a@x.io", null), ctx.requester());

    GovernanceContext noTenant = GovernanceContext.of(Map.of("userId", "a@x.io"));
    IllegalStateException e = assertThrows(IllegalStateException.class, noTenant::tenantId);
    assertEquals("Missing GovernanceContext key: tenantId", e.getMessage());
  }
}
