package io.intellixity.semantiq.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.semantiq.planner.security.ShareGrantStore;
import io.intellixity.semantiq.security.ShareGrant;
import io.intellixity.semantiq.security.ShareTargetType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link ShareGrantStore} over {@code dashboard_shares} joined to {@code dashboards}.
 * Older share rows without target columns are read as user shares keyed by {@code user_id}.
 */
public final class JdbcShareGrantStore implements ShareGrantStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcShareGrantStore.class);

  static final String FIND_GRANTS = """
      SELECT COALESCE(to_jsonb(ds)->>'target_type', 'user') AS target_type,
             COALESCE(to_jsonb(ds)->>'target_id', ds.user_id::text) AS target_id,
             ds.permission, ds.allowed_page_ids, ds.rls_config, d.pages
      FROM dashboard_shares ds
      JOIN dashboards d ON d.id = ds.dashboard_id
      WHERE ds.dashboard_id = ?
        AND (
             (COALESCE(to_jsonb(ds)->>'target_type', 'user') = 'user'
              AND LOWER(COALESCE(to_jsonb(ds)->>'target_id', ds.user_id::text)) = LOWER(?))
          OR (COALESCE(to_jsonb(ds)->>'target_type', 'user') = 'group'
              AND ? <> ''
              AND LOWER(COALESCE(to_jsonb(ds)->>'target_id', ds.user_id::text)) = LOWER(?))
        )
        AND d.workspace_id = ?
      ORDER BY CASE WHEN LOWER(TRIM(ds.permission)) IN ('admin', 'owner') THEN 3
                    WHEN LOWER(TRIM(ds.permission)) IN ('edit', 'editor', 'write') THEN 2
                    ELSE 1 END DESC""";

  private final DataSource ds;
  private final ObjectMapper mapper;

  public JdbcShareGrantStore(DataSource ds) {
    this(ds, new ObjectMapper());
  }

  public JdbcShareGrantStore(DataSource ds, ObjectMapper mapper) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public List<ShareGrant> findGrants(String tenantId, String dashboardId, String userIdentity, String groupIdentity) {
    String group = (groupIdentity == null) ? "" : groupIdentity.trim();
    try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(FIND_GRANTS)) {
      JdbcCatalogStore.bind(ps, dashboardId, userIdentity, group, group, tenantId);
      try (ResultSet rs = ps.executeQuery()) {
        List<ShareGrant> out = new ArrayList<>();
        while (rs.next()) {
          out.add(new ShareGrant(
              ShareTargetType.fromValue(rs.getString("target_type")),
              rs.getString("target_id"),
              rs.getString("permission"),
              JsonArrays.strings(mapper, rs.getString("allowed_page_ids")),
              rs.getString("rls_config"),
              JsonArrays.ids(mapper, rs.getString("pages"))));
        }
        if (log.isDebugEnabled()) log.debug("semantiq.jdbc_done op=findGrants dashboard={} grants={}", dashboardId, out.size());
        return out;
      }
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }
}
