package io.intellixity.sqlbuilder.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * spring.factories-style SPI loader.
 *
 * Reads every {@code META-INF/sqlbuilder.factories} on the classpath. Each is a Properties file mapping an SPI
 * interface name to comma-separated implementation class names:
 *
 * <pre>
 * io.intellixity.sqlbuilder.mapping.RowMapperProvider=com.acme.OrderMappers,com.acme.BillingMappers
 * </pre>
 *
 * Implementations need a public no-arg constructor. Order is classpath order, duplicates are dropped.
 */
public final class SqlBuilderFactoriesLoader {
  private static final Logger log = LoggerFactory.getLogger(SqlBuilderFactoriesLoader.class);

  public static final String RESOURCE = "META-INF/sqlbuilder.factories";

  private SqlBuilderFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    ClassLoader loader = (cl != null) ? cl : SqlBuilderFactoriesLoader.class.getClassLoader();

    Set<String> implNames = new LinkedHashSet<>();
    for (URL url : resources(loader)) {
      implNames.addAll(implNames(url, spiType.getName()));
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) {
      out.add(newInstance(implName, spiType, loader));
    }
    if (log.isDebugEnabled()) {
      log.debug("sqlbuilder.factories spi={} implementations={}", spiType.getName(), implNames);
    }
    return out;
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new RuntimeException("Failed to enumerate " + RESOURCE, e);
    }
  }

  static List<String> implNames(URL url, String key) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new RuntimeException("Failed to load " + RESOURCE + " from " + url, e);
    }

    String v = p.getProperty(key);
    if (v == null || v.isBlank()) return List.of();
    List<String> out = new ArrayList<>();
    for (String part : v.split(",")) {
      String name = part.trim();
      if (!name.isEmpty()) out.add(name);
    }
    return out;
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalArgumentException("Class " + implName + " listed in " + RESOURCE + " not found", e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalArgumentException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException("Failed to instantiate " + implName + " for SPI " + spiType.getName(), e);
    }
  }
}
