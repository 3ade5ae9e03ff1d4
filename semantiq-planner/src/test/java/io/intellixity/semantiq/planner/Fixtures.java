package io.intellixity.semantiq.planner;

import io.intellixity.semantiq.bigquery.BigQueryDialect;
import io.intellixity.semantiq.config.PlannerConfig;
import io.intellixity.semantiq.jdbc.postgres.PostgresDialect;
import io.intellixity.semantiq.model.Cardinality;
import io.intellixity.semantiq.model.ColumnDef;
import io.intellixity.semantiq.model.DataModel;
import io.intellixity.semantiq.model.PhysicalTable;
import io.intellixity.semantiq.model.ValidationStatus;
import io.intellixity.semantiq.planner.catalog.CatalogLoader;
import io.intellixity.semantiq.planner.plan.SemanticQueryPlanner;
import io.intellixity.semantiq.planner.security.SharePolicyResolver;
import io.intellixity.semantiq.spi.sql.DiscoveredDialectRegistry;

import java.util.List;

/**
 * Sales fixture for tenant {@code acme}, model {@code dm}:
 * orders -> customers -> countries (valid), orders -> products (n-n, not joinable),
 * a warehouse table {@code events}, an unmaterialized table {@code broken} and an isolated table {@code notes}.
 */
public final class Fixtures {
  public static final String TENANT = "acme";
  public static final String MODEL = "dm";

  private Fixtures() {}

  public static String id(String physicalId) {
    return InMemoryCatalogStore.modelTableId(MODEL, physicalId);
  }

  public static PhysicalTable pg(String name, String... columns) {
    return new PhysicalTable(name, TENANT, name, "sales", "conn-pg", "PostgreSQL", null, null,
        "\"sales\".\"" + name + "\"", true, null, cols(columns));
  }

  public static List<ColumnDef> cols(String... nameTypePairs) {
    ColumnDef[] out = new ColumnDef[nameTypePairs.length / 2];
    for (int i = 0; i < out.length; i++) out[i] = new ColumnDef(nameTypePairs[2 * i], nameTypePairs[2 * i + 1]);
    return List.of(out);
  }

  public static InMemoryCatalogStore salesStore() {
    InMemoryCatalogStore s = new InMemoryCatalogStore()
        .addModel(new DataModel(MODEL, TENANT, "Sales", true))
        .addPhysical(pg("orders", "id", "int", "customer_id", "int", "region", "text", "revenue", "numeric",
            "status", "text", "created_at", "timestamp"))
        .addPhysical(pg("customers", "id", "int", "name", "text", "country_id", "int", "region", "text"))
        .addPhysical(pg("countries", "id", "int", "name", "text"))
        .addPhysical(pg("products", "id", "int", "order_id", "int"))
        .addPhysical(pg("notes", "id", "int", "body", "text"))
        .addPhysical(new PhysicalTable("broken", TENANT, "broken", "sales", "conn-pg", "PostgreSQL", null, null,
            null, false, "Snapshot not materialized", cols("id", "int")))
        .addPhysical(new PhysicalTable("events", TENANT, "events", "wh", "conn-bq", "BigQuery", "proj", null,
            null, true, null, cols("id", "int", "customer_id", "int", "kind", "STRING")));
    s.relate(MODEL, "orders", "customer_id", "customers", "id", Cardinality.MANY_TO_ONE, ValidationStatus.VALID);
    s.relate(MODEL, "customers", "country_id", "countries", "id", Cardinality.MANY_TO_ONE, ValidationStatus.VALID);
    s.relate(MODEL, "orders", "id", "products", "order_id", Cardinality.MANY_TO_MANY, ValidationStatus.VALID);
    return s;
  }

  public static DiscoveredDialectRegistry dialects() {
    return new DiscoveredDialectRegistry(List.of(new PostgresDialect(), new BigQueryDialect()));
  }

  public static SemanticQueryPlanner planner(InMemoryCatalogStore store, InMemoryShareGrantStore grants, PlannerConfig config) {
    return new SemanticQueryPlanner(new CatalogLoader(store), new SharePolicyResolver(grants), dialects(), config);
  }

  public static SemanticQueryPlanner planner(InMemoryCatalogStore store, InMemoryShareGrantStore grants) {
    return planner(store, grants, PlannerConfig.defaults());
  }
}
