package io.intellixity.semantiq.spi.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Collects positional parameters while one statement is rendered. */
public final class RenderCtx {
  private final List<Object> params = new ArrayList<>();

  /** Appends a bind value and returns its 1-based position. */
  public int add(Object value) {
    params.add(value);
    return params.size();
  }

  public List<Object> params() {
    return Collections.unmodifiableList(params);
  }
}
