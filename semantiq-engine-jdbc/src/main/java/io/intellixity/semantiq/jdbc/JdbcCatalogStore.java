package io.intellixity.semantiq.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.semantiq.model.Cardinality;
import io.intellixity.semantiq.model.CrossFilterDirection;
import io.intellixity.semantiq.model.DataModel;
import io.intellixity.semantiq.model.ModelTable;
import io.intellixity.semantiq.model.PhysicalTable;
import io.intellixity.semantiq.model.Relationship;
import io.intellixity.semantiq.model.RuntimeEngine;
import io.intellixity.semantiq.model.ValidationStatus;
import io.intellixity.semantiq.planner.catalog.CatalogStore;
import io.intellixity.semantiq.planner.catalog.ModelTableUpsert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link CatalogStore} over the metadata schema ({@code data_models}, {@code synced_tables},
 * {@code connections}, {@code model_runtime_tables}, {@code model_tables}, {@code model_relationships}).
 * <p>
 * The tenant is the connection's {@code workspace_id}. Ids are bound as text.
 */
public final class JdbcCatalogStore implements CatalogStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcCatalogStore.class);

  static final String FIND_MODEL = """
      SELECT id, workspace_id, name, is_default
      FROM data_models
      WHERE id = ? AND workspace_id = ?
      LIMIT 1""";

  static final String FIND_DEFAULT_MODEL = """
      SELECT id, workspace_id, name, is_default
      FROM data_models
      WHERE workspace_id = ? AND is_default = TRUE
      ORDER BY created_at ASC
      LIMIT 1""";

  static final String INSERT_DEFAULT_MODEL = """
      INSERT INTO data_models (workspace_id, name, is_default)
      VALUES (?, ?, TRUE)""";

  static final String LIST_PHYSICAL = """
      SELECT st.id, st.table_name, st.dataset_name, st.schema_def,
             c.id AS source_id, c.type AS source_type, c.project_id,
             mrt.runtime_engine, mrt.runtime_ref, mrt.is_executable, mrt.executable_reason
      FROM synced_tables st
      JOIN connections c ON c.id = st.connection_id
      LEFT JOIN model_runtime_tables mrt ON mrt.synced_table_id = st.id
      WHERE st.is_deleted = FALSE
        AND c.is_deleted = FALSE
        AND c.workspace_id = ?
      ORDER BY st.dataset_name, st.table_name""";

  static final String UPSERT_MODEL_TABLE = """
      INSERT INTO model_tables (data_model_id, synced_table_id, table_name, dataset_name,
                                source_id, source_type, runtime_engine, runtime_ref)
      VALUES (?, ?, ?, ?, ?, ?, ?, ?)
      ON CONFLICT (data_model_id, synced_table_id)
      DO UPDATE SET
          table_name = EXCLUDED.table_name,
          dataset_name = EXCLUDED.dataset_name,
          source_id = EXCLUDED.source_id,
          source_type = EXCLUDED.source_type,
          runtime_engine = EXCLUDED.runtime_engine,
          runtime_ref = EXCLUDED.runtime_ref,
          updated_at = NOW()""";

  static final String LIST_MODEL_TABLES = """
      SELECT mt.id, mt.data_model_id, mt.synced_table_id, mt.table_name, mt.dataset_name,
             mt.source_id, mt.source_type, mt.runtime_engine, mt.runtime_ref,
             st.schema_def, mrt.is_executable, mrt.executable_reason
      FROM model_tables mt
      JOIN synced_tables st ON st.id = mt.synced_table_id
      JOIN connections c ON c.id = st.connection_id
      LEFT JOIN model_runtime_tables mrt ON mrt.synced_table_id = st.id
      WHERE mt.data_model_id = ?
        AND st.is_deleted = FALSE
        AND c.is_deleted = FALSE
        AND c.workspace_id = ?
      ORDER BY mt.dataset_name, mt.table_name""";

  static final String LIST_RELATIONSHIPS = """
      SELECT *
      FROM model_relationships
      WHERE data_model_id = ?
      ORDER BY created_at ASC""";

  static final String UPSERT_RELATIONSHIP = """
      INSERT INTO model_relationships (data_model_id, from_table, from_column, to_table, to_column,
                                       from_table_id, to_table_id, relationship_type,
                                       cross_filter_direction, validation_status, invalid_reason)
      VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
      ON CONFLICT (data_model_id, from_table_id, from_column, to_table_id, to_column)
      DO UPDATE SET
          relationship_type = EXCLUDED.relationship_type,
          cross_filter_direction = EXCLUDED.cross_filter_direction,
          validation_status = EXCLUDED.validation_status,
          invalid_reason = EXCLUDED.invalid_reason,
          updated_at = NOW()
      RETURNING *""";

  private final DataSource ds;
  private final ObjectMapper mapper;

  public JdbcCatalogStore(DataSource ds) {
    this(ds, new ObjectMapper());
  }

  public JdbcCatalogStore(DataSource ds, ObjectMapper mapper) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public DataModel findModel(String tenantId, String dataModelId) {
    return queryOne(FIND_MODEL, JdbcCatalogStore::model, dataModelId, tenantId);
  }

  @Override
  public DataModel findDefaultModel(String tenantId) {
    return queryOne(FIND_DEFAULT_MODEL, JdbcCatalogStore::model, tenantId);
  }

  @Override
  public DataModel createDefaultModel(String tenantId, String name) {
    update(INSERT_DEFAULT_MODEL, tenantId, name);
    // a concurrent creator may have won; the oldest default is the one everybody uses
    DataModel m = findDefaultModel(tenantId);
    if (m == null) throw new IllegalStateException("Default data model not visible after insert: tenant=" + tenantId);
    return m;
  }

  @Override
  public List<PhysicalTable> listPhysicalTables(String tenantId) {
    return query(LIST_PHYSICAL, rs -> {
      String engine = rs.getString("runtime_engine");
      return new PhysicalTable(
          rs.getString("id"),
          tenantId,
          rs.getString("table_name"),
          rs.getString("dataset_name"),
          rs.getString("source_id"),
          rs.getString("source_type"),
          rs.getString("project_id"),
          (engine == null || engine.isBlank()) ? null : RuntimeEngine.fromId(engine),
          rs.getString("runtime_ref"),
          executable(rs),
          rs.getString("executable_reason"),
          JsonArrays.columns(mapper, rs.getString("schema_def")));
    }, tenantId);
  }

  @Override
  public void upsertModelTable(ModelTableUpsert row) {
    update(UPSERT_MODEL_TABLE,
        row.dataModelId(), row.physicalTableId(), row.tableName(), row.datasetName(),
        row.sourceId(), row.sourceType(), row.runtimeEngine().id(), row.runtimeRef());
  }

  @Override
  public List<ModelTable> listModelTables(String tenantId, String dataModelId) {
    return query(LIST_MODEL_TABLES, rs -> {
      String engine = rs.getString("runtime_engine");
      return new ModelTable(
          rs.getString("id"),
          rs.getString("data_model_id"),
          rs.getString("synced_table_id"),
          rs.getString("table_name"),
          rs.getString("dataset_name"),
          rs.getString("source_id"),
          rs.getString("source_type"),
          (engine == null || engine.isBlank())
              ? RuntimeEngine.fromSourceType(rs.getString("source_type"))
              : RuntimeEngine.fromId(engine),
          rs.getString("runtime_ref"),
          executable(rs),
          rs.getString("executable_reason"),
          JsonArrays.columns(mapper, rs.getString("schema_def")));
    }, dataModelId, tenantId);
  }

  @Override
  public List<Relationship> listRelationships(String dataModelId) {
    return query(LIST_RELATIONSHIPS, JdbcCatalogStore::relationship, dataModelId);
  }

  @Override
  public Relationship upsertRelationship(Relationship r) {
    Relationship saved = queryOne(UPSERT_RELATIONSHIP, JdbcCatalogStore::relationship,
        r.dataModelId(), r.fromTable(), r.fromColumn(), r.toTable(), r.toColumn(),
        r.fromTableId(), r.toTableId(), r.cardinality().code(),
        r.crossFilterDirection().name().toLowerCase(), r.validationStatus().code(), r.invalidReason());
    if (saved == null) throw new IllegalStateException("Relationship upsert returned no row");
    return saved;
  }

  /** Missing runtime row counts as executable; a missing runtime ref is what blocks it. */
  private static boolean executable(ResultSet rs) throws SQLException {
    boolean v = rs.getBoolean("is_executable");
    return v || rs.wasNull();
  }

  private static DataModel model(ResultSet rs) throws SQLException {
    return new DataModel(rs.getString("id"), rs.getString("workspace_id"), rs.getString("name"), rs.getBoolean("is_default"));
  }

  private static Relationship relationship(ResultSet rs) throws SQLException {
    Timestamp created = rs.getTimestamp("created_at");
    return new Relationship(
        rs.getString("id"),
        rs.getString("data_model_id"),
        rs.getString("from_table_id"),
        rs.getString("from_table"),
        rs.getString("from_column"),
        rs.getString("to_table_id"),
        rs.getString("to_table"),
        rs.getString("to_column"),
        Cardinality.fromCode(rs.getString("relationship_type")),
        CrossFilterDirection.fromCode(rs.getString("cross_filter_direction")),
        ValidationStatus.fromCode(rs.getString("validation_status")),
        rs.getString("invalid_reason"),
        created == null ? null : created.toInstant());
  }

  @FunctionalInterface
  interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  private <T> List<T> query(String sql, RowMapper<T> rowMapper, Object... binds) {
    long start = System.nanoTime();
    try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
      bind(ps, binds);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> out = new ArrayList<>();
        while (rs.next()) out.add(rowMapper.map(rs));
        if (log.isDebugEnabled()) {
          log.debug("semantiq.jdbc_done op=catalogQuery durationMs={} rows={}", (System.nanoTime() - start) / 1_000_000.0, out.size());
        }
        return out;
      }
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  private <T> T queryOne(String sql, RowMapper<T> rowMapper, Object... binds) {
    List<T> rows = query(sql, rowMapper, binds);
    return rows.isEmpty() ? null : rows.get(0);
  }

  private void update(String sql, Object... binds) {
    try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
      bind(ps, binds);
      int n = ps.executeUpdate();
      if (log.isDebugEnabled()) log.debug("semantiq.jdbc_done op=catalogUpdate rows={}", n);
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  static void bind(PreparedStatement ps, Object... binds) throws SQLException {
    for (int i = 0; i < binds.length; i++) {
      Object v = binds[i];
      if (v == null) ps.setNull(i + 1, Types.VARCHAR);
      else ps.setObject(i + 1, v);
    }
  }
}
