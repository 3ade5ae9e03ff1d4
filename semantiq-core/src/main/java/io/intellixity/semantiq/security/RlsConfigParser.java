package io.intellixity.semantiq.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.semantiq.query.Connector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses RLS rule documents of the form
 * <pre>
 * {"rules":[{"combinator":"AND","conditions":[{"field":"region","operator":"eq","value":"EU"}]}]}
 * </pre>
 * A rule without a non-empty {@code conditions} array is itself read as a single condition.
 * Malformed documents yield no rules.
 */
public final class RlsConfigParser {
  private static final Logger log = LoggerFactory.getLogger(RlsConfigParser.class);

  private final ObjectMapper mapper;

  public RlsConfigParser() {
    this(new ObjectMapper());
  }

  public RlsConfigParser(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public List<RlsRule> parse(String json) {
    if (json == null || json.isBlank()) return List.of();
    JsonNode root;
    try {
      root = mapper.readTree(json);
    } catch (JsonProcessingException e) {
      log.warn("semantiq.rls op=parse outcome=malformed chars={}", json.length());
      return List.of();
    }
    return parse(root);
  }

  public List<RlsRule> parse(JsonNode root) {
    if (root == null || !root.isObject()) return List.of();
    JsonNode rules = root.get("rules");
    if (rules == null || !rules.isArray()) return List.of();

    List<RlsRule> out = new ArrayList<>();
    for (JsonNode r : rules) {
      if (r == null || !r.isObject()) continue;
      String comb = text(r.get("combinator"));
      if (comb == null) comb = text(r.get("logical"));

      List<RlsCondition> conditions = new ArrayList<>();
      JsonNode cs = r.get("conditions");
      if (cs != null && cs.isArray() && cs.size() > 0) {
        for (JsonNode c : cs) {
          if (c != null && c.isObject()) conditions.add(condition(c));
        }
      } else {
        conditions.add(condition(r));
      }
      out.add(new RlsRule(conditions, Connector.fromCode(comb)));
    }
    return out;
  }

  private RlsCondition condition(JsonNode c) {
    List<Object> values = null;
    JsonNode vs = c.get("values");
    if (vs != null && vs.isArray()) {
      values = new ArrayList<>();
      for (JsonNode v : vs) values.add(value(v));
    }
    return new RlsCondition(text(c.get("field")), text(c.get("operator")), value(c.get("value")), value(c.get("value2")), values);
  }

  private Object value(JsonNode v) {
    if (v == null || v.isNull()) return null;
    try {
      return mapper.treeToValue(v, Object.class);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unreadable RLS value: " + v.getNodeType(), e);
    }
  }

  private static String text(JsonNode n) {
    return (n == null || n.isNull() || n.isContainerNode()) ? null : n.asText();
  }
}
