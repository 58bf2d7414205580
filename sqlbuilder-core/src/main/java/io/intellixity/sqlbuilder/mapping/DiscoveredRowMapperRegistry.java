package io.intellixity.sqlbuilder.mapping;

import io.intellixity.sqlbuilder.util.SqlBuilderFactoriesLoader;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** RowMapper lookup built from {@link RowMapperProvider}s discovered via META-INF/sqlbuilder.factories. */
public final class DiscoveredRowMapperRegistry {
  private final Map<Class<?>, RowMapper<?>> byType;

  public DiscoveredRowMapperRegistry() {
    this(SqlBuilderFactoriesLoader.load(RowMapperProvider.class));
  }

  public DiscoveredRowMapperRegistry(List<RowMapperProvider> providers) {
    Map<Class<?>, RowMapper<?>> out = new HashMap<>();
    for (RowMapperProvider p : providers) {
      if (p == null) continue;
      Map<Class<?>, RowMapper<?>> m = p.rowMappersByType();
      if (m == null) continue;
      for (var e : m.entrySet()) {
        Class<?> type = e.getKey();
        RowMapper<?> mapper = e.getValue();
        if (type == null || mapper == null) continue;
        if (!type.equals(mapper.type())) {
          throw new IllegalArgumentException("RowMapper " + mapper.getClass().getName() + " maps " +
              mapper.type().getName() + " but is registered for " + type.getName());
        }
        RowMapper<?> existing = out.putIfAbsent(type, mapper);
        if (existing != null) {
          throw new IllegalArgumentException("Duplicate RowMapper for type '" + type.getName() + "'. Existing=" +
              existing.getClass().getName() + ", new=" + mapper.getClass().getName());
        }
      }
    }
    this.byType = Map.copyOf(out);
  }

  @SuppressWarnings("unchecked")
  public <T> RowMapper<T> get(Class<T> type) {
    Objects.requireNonNull(type, "type");
    RowMapper<?> m = byType.get(type);
    if (m == null) throw new IllegalArgumentException("No RowMapper registered for type: " + type.getName());
    return (RowMapper<T>) m;
  }

  public boolean contains(Class<?> type) {
    return byType.containsKey(type);
  }
}
