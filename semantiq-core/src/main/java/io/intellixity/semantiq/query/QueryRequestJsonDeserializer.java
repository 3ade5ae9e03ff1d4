package io.intellixity.semantiq.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON deserializer for {@link QueryRequest}.
 * <p>
 * Lenient in the way the report builder needs: non-array list fields are treated as empty, items that
 * are not objects are skipped, and a few legacy keys are accepted ({@code tableId} for
 * {@code tableRef}, {@code logical} for {@code connector}, {@code dir} for {@code direction}).
 */
public final class QueryRequestJsonDeserializer extends JsonDeserializer<QueryRequest> {
  @Override
  public QueryRequest deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Query request JSON must be an object");

    QueryRequest.Builder b = QueryRequest.builder()
        .dataModelId(textOrNull(root.get("dataModelId")))
        .dashboardId(textOrNull(root.get("dashboardId")))
        .pageId(textOrNull(root.get("pageId")))
        .limit(limitOrNull(root.get("limit")))
        .rawSql(textOrNull(root.get("rawSql")));

    JsonNode ids = root.get("tableIds");
    if (ids != null && ids.isArray()) {
      List<String> out = new ArrayList<>();
      for (JsonNode x : ids) {
        String s = textOrNull(x);
        if (s != null && !s.isBlank()) out.add(s);
      }
      b.tableIds(out);
    }

    JsonNode select = root.get("select");
    if (select != null && select.isArray()) {
      List<Projection> out = new ArrayList<>();
      for (JsonNode s : select) {
        if (!s.isObject()) continue;
        String column = textOrNull(s.get("column"));
        if (column == null) continue;
        out.add(new Projection(tableRef(s), column,
            Aggregation.fromCode(textOrNull(s.get("aggregation"))),
            textOrNull(s.get("alias")),
            HierarchyPart.fromCode(textOrNull(s.get("hierarchyPart")))));
      }
      b.select(out);
    }

    JsonNode groupBy = root.get("groupBy");
    if (groupBy != null && groupBy.isArray()) {
      List<GroupKey> out = new ArrayList<>();
      for (JsonNode g : groupBy) {
        if (!g.isObject()) continue;
        out.add(new GroupKey(tableRef(g), textOrNull(g.get("column")),
            HierarchyPart.fromCode(textOrNull(g.get("hierarchyPart")))));
      }
      b.groupBy(out);
    }

    JsonNode orderBy = root.get("orderBy");
    if (orderBy != null && orderBy.isArray()) {
      List<OrderKey> out = new ArrayList<>();
      for (JsonNode o : orderBy) {
        if (!o.isObject()) continue;
        String dir = textOrNull(o.get("direction"));
        if (dir == null) dir = textOrNull(o.get("dir"));
        out.add(new OrderKey(tableRef(o), textOrNull(o.get("column")),
            HierarchyPart.fromCode(textOrNull(o.get("hierarchyPart"))),
            SortDirection.fromCode(dir)));
      }
      b.orderBy(out);
    }

    JsonNode filters = root.get("filters");
    if (filters != null && filters.isArray()) {
      List<FilterSpec> out = new ArrayList<>();
      for (JsonNode f : filters) {
        if (!f.isObject()) continue;
        String connector = textOrNull(f.get("connector"));
        if (connector == null) connector = textOrNull(f.get("logical"));
        out.add(new FilterSpec(tableRef(f), textOrNull(f.get("column")),
            FilterOperator.fromCode(textOrNull(f.get("operator"))),
            decodeValue(f.get("value"), codec),
            decodeValue(f.get("value2"), codec),
            HierarchyPart.fromCode(textOrNull(f.get("hierarchyPart"))),
            Connector.fromCode(connector)));
      }
      b.filters(out);
    }

    return b.build();
  }

  private static String tableRef(JsonNode n) {
    String ref = textOrNull(n.get("tableRef"));
    return (ref != null) ? ref : textOrNull(n.get("tableId"));
  }

  private static Object decodeValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    return codec.treeToValue(v, Object.class);
  }

  /** Numbers and numeric strings are truncated toward zero; anything else means "use the default". */
  private static Integer limitOrNull(JsonNode n) {
    if (n == null || n.isNull()) return null;
    double d;
    if (n.isNumber()) {
      d = n.doubleValue();
    } else if (n.isTextual()) {
      try {
        d = Double.parseDouble(n.asText().trim());
      } catch (NumberFormatException e) {
        return null;
      }
    } else {
      return null;
    }
    if (Double.isNaN(d) || Double.isInfinite(d)) return null;
    if (d >= Integer.MAX_VALUE) return Integer.MAX_VALUE;
    if (d <= Integer.MIN_VALUE) return Integer.MIN_VALUE;
    return (int) d;
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull() || n.isContainerNode()) ? null : n.asText();
  }
}
