package io.intellixity.semantiq.jdbc;

import io.intellixity.semantiq.security.ShareGrant;
import io.intellixity.semantiq.security.ShareTargetType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.semantiq.jdbc.FakeJdbc.row;
import static org.junit.jupiter.api.Assertions.*;

final class JdbcShareGrantStoreTest {

  @Test
  void readsGrantsWithPageLists() {
    FakeJdbc jdbc = new FakeJdbc().returning(List.of(
        row("target_type", "group", "target_id", "Analysts", "permission", "view", "allowed_page_ids", "[]",
            "rls_config", "{\"rules\":[]}", "pages", "[{\"id\":\"p1\"},{\"id\":\"p2\"}]")));

    List<ShareGrant> grants = new JdbcShareGrantStore(jdbc.dataSource()).findGrants("ws-1", "d1", "a@x.io", " analysts ");

    assertEquals(1, grants.size());
    ShareGrant g = grants.get(0);
    assertEquals(ShareTargetType.GROUP, g.targetType());
    assertTrue(g.allowedPageIds().isEmpty());
    assertEquals(List.of("p1", "p2"), g.dashboardPageIds());
    assertEquals("{\"rules\":[]}", g.rlsConfig());

    assertEquals("d1", jdbc.binds.get(0).get(1));
    assertEquals("a@x.io", jdbc.binds.get(0).get(2));
    assertEquals("analysts", jdbc.binds.get(0).get(3));
    assertEquals("analysts", jdbc.binds.get(0).get(4));
    assertEquals("ws-1", jdbc.binds.get(0).get(5));
  }

  @Test
  void missingGroupBindsEmptyString() {
    FakeJdbc jdbc = new FakeJdbc();
    assertTrue(new JdbcShareGrantStore(jdbc.dataSource()).findGrants("ws-1", "d1", "a@x.io", null).isEmpty());
    assertEquals("", jdbc.binds.get(0).get(3));
  }
}
