package io.intellixity.semantiq.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Discovers extensions (SQL dialects) registered in {@code META-INF/semantiq.factories}:
 * <pre>
 * io.intellixity.semantiq.spi.sql.SqlDialect=io.intellixity.semantiq.jdbc.postgres.PostgresDialect
 * </pre>
 * An entry may list several comma-separated classes. A class registered by more than one jar is
 * instantiated once, at its first position.
 */
public final class SemantiqFactoriesLoader {
  private static final Logger log = LoggerFactory.getLogger(SemantiqFactoriesLoader.class);

  public static final String RESOURCE = "META-INF/semantiq.factories";

  private SemantiqFactoriesLoader() {}

  public static <T> List<T> load(Class<T> extensionType) {
    Objects.requireNonNull(extensionType, "extensionType");
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = SemantiqFactoriesLoader.class.getClassLoader();

    // class name -> resource that registered it first
    Map<String, URL> registered = new LinkedHashMap<>();
    for (URL url : resources(cl)) {
      String entry = read(url).getProperty(extensionType.getName(), "");
      for (String name : entry.split(",")) {
        String className = name.trim();
        if (className.isEmpty()) continue;
        URL first = registered.putIfAbsent(className, url);
        if (first != null && log.isDebugEnabled()) {
          log.debug("semantiq.factories op=dedupe class={} first={} again={}", className, first, url);
        }
      }
    }

    List<T> out = new ArrayList<>(registered.size());
    for (Map.Entry<String, URL> e : registered.entrySet()) {
      out.add(instantiate(extensionType, e.getKey(), e.getValue(), cl));
    }
    if (log.isDebugEnabled()) log.debug("semantiq.factories op=load type={} count={}", extensionType.getSimpleName(), out.size());
    return out;
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new RuntimeException("Cannot list " + RESOURCE, e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new RuntimeException("Cannot read " + url, e);
    }
    return p;
  }

  private static <T> T instantiate(Class<T> extensionType, String className, URL source, ClassLoader cl) {
    Class<?> type;
    try {
      type = Class.forName(className, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalArgumentException("Unknown class " + className + " registered in " + source, e);
    }
    if (!extensionType.isAssignableFrom(type)) {
      throw new IllegalArgumentException(className + " registered in " + source + " is not a " + extensionType.getName());
    }
    try {
      return extensionType.cast(type.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException("Cannot instantiate " + className + " (needs a public no-arg constructor)", e);
    }
  }
}
