package io.intellixity.semantiq.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.semantiq.model.ColumnDef;

import java.util.ArrayList;
import java.util.List;

/** Lenient readers for the JSON array columns of the metadata schema. Unreadable text reads as empty. */
final class JsonArrays {
  private JsonArrays() {}

  static JsonNode array(ObjectMapper mapper, String json) {
    if (json == null || json.isBlank()) return null;
    try {
      JsonNode n = mapper.readTree(json);
      return (n != null && n.isArray()) ? n : null;
    } catch (JsonProcessingException e) {
      return null;
    }
  }

  /** {@code [{"name":..,"type":..}]}; entries without a name are skipped. */
  static List<ColumnDef> columns(ObjectMapper mapper, String json) {
    JsonNode arr = array(mapper, json);
    if (arr == null) return List.of();
    List<ColumnDef> out = new ArrayList<>();
    for (JsonNode c : arr) {
      String name = text(c.get("name"));
      if (name == null || name.isBlank()) continue;
      out.add(new ColumnDef(name, text(c.get("type"))));
    }
    return out;
  }

  /** {@code ["p1", 2]} as strings. */
  static List<String> strings(ObjectMapper mapper, String json) {
    JsonNode arr = array(mapper, json);
    if (arr == null) return List.of();
    List<String> out = new ArrayList<>();
    for (JsonNode n : arr) {
      String s = text(n);
      if (s != null && !s.isBlank()) out.add(s);
    }
    return out;
  }

  /** {@code [{"id":"p1",...}]} as the trimmed non-blank ids. */
  static List<String> ids(ObjectMapper mapper, String json) {
    JsonNode arr = array(mapper, json);
    if (arr == null) return List.of();
    List<String> out = new ArrayList<>();
    for (JsonNode n : arr) {
      String id = (n != null && n.isObject()) ? text(n.get("id")) : null;
      if (id != null && !id.trim().isEmpty()) out.add(id.trim());
    }
    return out;
  }

  private static String text(JsonNode n) {
    return (n == null || n.isNull() || n.isContainerNode()) ? null : n.asText();
  }
}
