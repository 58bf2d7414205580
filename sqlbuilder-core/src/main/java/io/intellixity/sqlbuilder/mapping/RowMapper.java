package io.intellixity.sqlbuilder.mapping;

import java.util.List;

/**
 * Projects a record onto ordered (column, value, primaryKey) triples.
 *
 * Implementations are generated or registered explicitly; no reflection.
 */
public interface RowMapper<T> {
  Class<T> type();

  List<ColumnValue> columns(T row);
}
