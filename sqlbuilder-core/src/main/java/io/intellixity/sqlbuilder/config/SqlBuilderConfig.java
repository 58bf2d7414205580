package io.intellixity.sqlbuilder.config;

import io.intellixity.sqlbuilder.flavor.Flavor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;

/**
 * Process-wide defaults.
 *
 * Resolution order for the default flavor:
 * <ol>
 *   <li>JVM system property {@code sqlbuilder.flavor}</li>
 *   <li>{@code sqlbuilder.flavor} in classpath resource {@code sqlbuilder.properties}</li>
 *   <li>{@link Flavor#MYSQL}</li>
 * </ol>
 * {@link #setDefaultFlavor} overrides all of them at runtime.
 */
public final class SqlBuilderConfig {
  private static final Logger log = LoggerFactory.getLogger(SqlBuilderConfig.class);

  public static final String RESOURCE = "sqlbuilder.properties";
  public static final String FLAVOR_KEY = "sqlbuilder.flavor";
  public static final Flavor FALLBACK_FLAVOR = Flavor.MYSQL;

  private static volatile Flavor defaultFlavor = load();

  private SqlBuilderConfig() {}

  public static Flavor defaultFlavor() {
    return defaultFlavor;
  }

  /** Returns the previous default. */
  public static Flavor setDefaultFlavor(Flavor flavor) {
    Flavor old = defaultFlavor;
    defaultFlavor = Objects.requireNonNull(flavor, "flavor");
    return old;
  }

  static Flavor resolve(Properties resource, String systemValue) {
    if (systemValue != null && !systemValue.isBlank()) return Flavor.of(systemValue);
    String v = (resource == null) ? null : resource.getProperty(FLAVOR_KEY);
    if (v != null && !v.isBlank()) return Flavor.of(v);
    return FALLBACK_FLAVOR;
  }

  private static Flavor load() {
    Properties p = readResource(SqlBuilderConfig.class.getClassLoader());
    String sys = System.getProperty(FLAVOR_KEY);
    Flavor f = resolve(p, sys);
    if (log.isDebugEnabled()) {
      log.debug("sqlbuilder.config defaultFlavor={} resourceFound={} systemProperty={}",
          f, p != null, sys);
    }
    return f;
  }

  static Properties readResource(ClassLoader cl) {
    if (cl == null) return null;
    try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
      if (in == null) return null;
      Properties p = new Properties();
      p.load(in);
      return p;
    } catch (IOException e) {
      throw new RuntimeException("Failed to load " + RESOURCE, e);
    }
  }
}
