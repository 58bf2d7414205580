package io.intellixity.sqlbuilder.mapping;

/** One mapped column of a record: name, value to bind, and whether it is (part of) the primary key. */
public record ColumnValue(String column, Object value, boolean primaryKey) {
  public ColumnValue {
    if (column == null || column.isBlank()) throw new IllegalArgumentException("column is blank");
  }

  public static ColumnValue of(String column, Object value) {
    return new ColumnValue(column, value, false);
  }
}
