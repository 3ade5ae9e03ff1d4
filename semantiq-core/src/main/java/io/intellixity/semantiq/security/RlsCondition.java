package io.intellixity.semantiq.security;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Single RLS predicate. {@code operator} is the short rule code ({@code eq}, {@code in}, ...). */
public record RlsCondition(String field, String operator, Object value, Object value2, List<Object> values) {
  public RlsCondition {
    values = (values == null) ? null : Collections.unmodifiableList(new ArrayList<>(values));
  }
}
