package io.intellixity.semantiq.planner.security;

import io.intellixity.semantiq.error.ErrorCode;
import io.intellixity.semantiq.error.SemanticQueryException;
import io.intellixity.semantiq.planner.InMemoryShareGrantStore;
import io.intellixity.semantiq.security.Requester;
import io.intellixity.semantiq.security.ShareGrant;
import io.intellixity.semantiq.security.SharePermission;
import io.intellixity.semantiq.security.SharePolicy;
import io.intellixity.semantiq.security.ShareTargetType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SharePolicyResolverTest {
  private static final String RLS_EU = "{\"rules\":[{\"conditions\":[{\"field\":\"region\",\"operator\":\"eq\",\"value\":\"EU\"}]}]}";

  private final InMemoryShareGrantStore grants = new InMemoryShareGrantStore();
  private final SharePolicyResolver resolver = new SharePolicyResolver(grants);
  private final Requester alice = new Requester("Alice@Example.com", "analysts");

  @Test
  void noDashboardOrNoIdentityMeansNoPolicy() {
    grants.add("acme", "d1", new ShareGrant(ShareTargetType.USER, "alice@example.com", "view", null, RLS_EU, null));

    assertNull(resolver.resolvePolicy("acme", alice, null));
    assertNull(resolver.resolvePolicy("acme", Requester.anonymous(), "d1"));
    assertNull(resolver.resolvePolicy("acme", new Requester("bob", null), "d1"));
  }

  @Test
  void highestRankedGrantWins() {
    grants.add("acme", "d1", new ShareGrant(ShareTargetType.USER, "alice@example.com", "view", List.of("p1"), RLS_EU, null))
        .add("acme", "d1", new ShareGrant(ShareTargetType.GROUP, "ANALYSTS", "edit", List.of("p2"), null, null));

    SharePolicy p = resolver.resolvePolicy("acme", alice, "d1");
    assertEquals(SharePermission.EDIT, p.permission());
    assertEquals(List.of("p2"), p.allowedPageIds());
    assertTrue(p.rules().isEmpty());
  }

  @Test
  void ownerAliasOutranksEdit() {
    grants.add("acme", "d1", new ShareGrant(ShareTargetType.GROUP, "analysts", "edit", List.of("p2"), RLS_EU, null))
        .add("acme", "d1", new ShareGrant(ShareTargetType.USER, "alice@example.com", "owner", List.of("p1"), null, null));

    SharePolicy p = resolver.resolvePolicy("acme", alice, "d1");
    assertFalse(p.isRestricted());
    assertDoesNotThrow(() -> resolver.checkPage(p, "p2"));
  }

  @Test
  void adminIsUnrestricted() {
    grants.add("acme", "d1", new ShareGrant(ShareTargetType.USER, "alice@example.com", "admin", List.of("p1"), RLS_EU, null));

    SharePolicy p = resolver.resolvePolicy("acme", alice, "d1");
    assertFalse(p.isRestricted());
    assertDoesNotThrow(() -> resolver.checkPage(p, "anything"));
  }

  @Test
  void dashboardPagesApplyWhenGrantListsNone() {
    grants.add("acme", "d1", new ShareGrant(ShareTargetType.USER, "alice@example.com", "view", List.of(), RLS_EU,
        List.of("p1", "p2")));

    SharePolicy p = resolver.resolvePolicy("acme", alice, "d1");
    assertEquals(List.of("p1", "p2"), p.allowedPageIds());
    assertEquals(1, p.rules().size());
  }

  @Test
  void pageCheck() {
    SharePolicy p = new SharePolicy(SharePermission.VIEW, List.of("p1"), List.of());

    assertDoesNotThrow(() -> resolver.checkPage(p, "p1"));
    SemanticQueryException outside = assertThrows(SemanticQueryException.class, () -> resolver.checkPage(p, "p2"));
    assertEquals(ErrorCode.RLS_PAGE_DENIED, outside.code());
    assertEquals(403, outside.httpStatus());
    assertThrows(SemanticQueryException.class, () -> resolver.checkPage(p, null));

    SharePolicy open = new SharePolicy(SharePermission.VIEW, List.of(), List.of());
    assertDoesNotThrow(() -> resolver.checkPage(open, null));
    assertDoesNotThrow(() -> resolver.checkPage(null, "p9"));
  }
}
