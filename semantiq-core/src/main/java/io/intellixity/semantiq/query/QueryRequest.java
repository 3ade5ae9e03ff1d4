package io.intellixity.semantiq.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.util.List;

/**
 * Declarative query as sent by the report builder.
 * <p>
 * Table references ({@code tableRef}) may name either a model-table id or the physical table id it is
 * bound to. {@code rawSql} is only honoured by the execute path.
 */
@JsonDeserialize(using = QueryRequestJsonDeserializer.class)
public record QueryRequest(String dataModelId,
                           List<String> tableIds,
                           List<Projection> select,
                           List<GroupKey> groupBy,
                           List<OrderKey> orderBy,
                           List<FilterSpec> filters,
                           String dashboardId,
                           String pageId,
                           Integer limit,
                           String rawSql) {
  public QueryRequest {
    tableIds = List.copyOf(tableIds == null ? List.of() : tableIds);
    select = List.copyOf(select == null ? List.of() : select);
    groupBy = List.copyOf(groupBy == null ? List.of() : groupBy);
    orderBy = List.copyOf(orderBy == null ? List.of() : orderBy);
    filters = List.copyOf(filters == null ? List.of() : filters);
  }

  public static Builder builder() { return new Builder(); }

  public boolean hasRawSql() {
    return rawSql != null && !rawSql.isBlank();
  }

  public static final class Builder {
    private String dataModelId;
    private List<String> tableIds;
    private List<Projection> select;
    private List<GroupKey> groupBy;
    private List<OrderKey> orderBy;
    private List<FilterSpec> filters;
    private String dashboardId;
    private String pageId;
    private Integer limit;
    private String rawSql;

    private Builder() {}

    public Builder dataModelId(String v) { this.dataModelId = v; return this; }
    public Builder tableIds(List<String> v) { this.tableIds = v; return this; }
    public Builder select(List<Projection> v) { this.select = v; return this; }
    public Builder groupBy(List<GroupKey> v) { this.groupBy = v; return this; }
    public Builder orderBy(List<OrderKey> v) { this.orderBy = v; return this; }
    public Builder filters(List<FilterSpec> v) { this.filters = v; return this; }
    public Builder dashboardId(String v) { this.dashboardId = v; return this; }
    public Builder pageId(String v) { this.pageId = v; return this; }
    public Builder limit(Integer v) { this.limit = v; return this; }
    public Builder rawSql(String v) { this.rawSql = v; return this; }

    public QueryRequest build() {
      return new QueryRequest(dataModelId, tableIds, select, groupBy, orderBy, filters, dashboardId, pageId, limit, rawSql);
    }
  }
}
