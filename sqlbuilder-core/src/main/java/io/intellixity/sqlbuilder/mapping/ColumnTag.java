package io.intellixity.sqlbuilder.mapping;

/**
 * Per-field column metadata of the form {@code name[;primary_key]}.
 *
 * <p>Examples: {@code "tenant_id"}, {@code "id;primary_key"}.</p>
 */
public record ColumnTag(String column, boolean primaryKey) {
  public static final String PRIMARY_KEY = "primary_key";

  public ColumnTag {
    if (column == null || column.isBlank()) throw new IllegalArgumentException("column is blank");
  }

  public static ColumnTag parse(String tag) {
    if (tag == null || tag.isBlank()) throw new IllegalArgumentException("Column tag is blank");
    String[] parts = tag.split(";", -1);
    String name = parts[0].trim();
    if (name.isEmpty()) throw new IllegalArgumentException("Column tag has no column name: " + tag);

    boolean pk = false;
    for (int i = 1; i < parts.length; i++) {
      String opt = parts[i].trim();
      if (opt.isEmpty()) continue;
      if (!PRIMARY_KEY.equals(opt)) {
        throw new IllegalArgumentException("Unknown column tag option '" + opt + "' in: " + tag);
      }
      pk = true;
    }
    return new ColumnTag(name, pk);
  }

  @Override
  public String toString() {
    return primaryKey ? column + ";" + PRIMARY_KEY : column;
  }
}
