package io.intellixity.sqlbuilder.mapping;

import java.util.Map;

/**
 * Discovered provider of {@link RowMapper}s, keyed by record type.
 *
 * Listed in {@code META-INF/sqlbuilder.factories}.
 */
public interface RowMapperProvider {
  Map<Class<?>, RowMapper<?>> rowMappersByType();
}
