package io.intellixity.sqlbuilder.flavor;

import io.intellixity.sqlbuilder.dml.InsertBuilder;

import java.util.Locale;

/**
 * SQL dialect policy: placeholder syntax, identifier quoting and dialect-specific statement variants.
 *
 * <p>The set of flavors is closed. Builders never branch on dialect themselves; they ask their flavor.</p>
 */
public enum Flavor {
  MYSQL("MySQL", PlaceholderStyle.QUESTION, '`'),
  POSTGRESQL("PostgreSQL", PlaceholderStyle.DOLLAR, '"'),
  SQLITE("SQLite", PlaceholderStyle.QUESTION, '"'),
  SQLSERVER("SQLServer", PlaceholderStyle.AT_P, '"'),
  CQL("CQL", PlaceholderStyle.QUESTION, '\''),
  CLICKHOUSE("ClickHouse", PlaceholderStyle.QUESTION, '`'),
  PRESTO("Presto", PlaceholderStyle.QUESTION, '"'),
  ORACLE("Oracle", PlaceholderStyle.COLON, '"'),
  INFORMIX("Informix", PlaceholderStyle.QUESTION, '"'),
  DORIS("Doris", PlaceholderStyle.QUESTION, '`');

  private enum PlaceholderStyle {
    /** {@code ?} */
    QUESTION,
    /** {@code $1, $2, ...} */
    DOLLAR,
    /** {@code @p1, @p2, ...} */
    AT_P,
    /** {@code :1, :2, ...} */
    COLON
  }

  private final String displayName;
  private final PlaceholderStyle placeholders;
  private final char quote;

  Flavor(String displayName, PlaceholderStyle placeholders, char quote) {
    this.displayName = displayName;
    this.placeholders = placeholders;
    this.quote = quote;
  }

  /** Positional parameter for the 1-based {@code ordinal}. */
  public String placeholder(int ordinal) {
    if (ordinal < 1) throw new IllegalArgumentException("placeholder ordinal must be >= 1: " + ordinal);
    return switch (placeholders) {
      case QUESTION -> "?";
      case DOLLAR -> "$" + ordinal;
      case AT_P -> "@p" + ordinal;
      case COLON -> ":" + ordinal;
    };
  }

  /** Quote an identifier for this dialect, doubling any embedded quote character. */
  public String quote(String name) {
    if (name == null) return null;
    String q = String.valueOf(quote);
    return q + name.replace(q, q + q) + q;
  }

  /**
   * Configure {@code ib} as "insert, ignoring duplicates" into {@code table}.
   *
   * <p>MySQL/Oracle use a verb modifier, SQLite uses {@code INSERT OR IGNORE}, PostgreSQL appends
   * {@code ON CONFLICT DO NOTHING} after the values. ClickHouse, CQL, SQL Server and Doris have no native form and
   * fall back to a plain INSERT.</p>
   */
  public void prepareInsertIgnore(String table, InsertBuilder ib) {
    switch (this) {
      case MYSQL, ORACLE -> ib.intoTable("INSERT IGNORE", table);
      case POSTGRESQL -> {
        ib.sqlAt(InsertBuilder.Marker.AFTER_VALUES, "ON CONFLICT DO NOTHING");
        ib.intoTable("INSERT", table);
      }
      case SQLITE -> ib.intoTable("INSERT OR IGNORE", table);
      case CLICKHOUSE, CQL, SQLSERVER, DORIS -> ib.intoTable("INSERT", table);
      default -> throw new UnsupportedOperationException("INSERT IGNORE is not supported by flavor: " + displayName);
    }
  }

  public InsertBuilder newInsertBuilder() {
    return new InsertBuilder(this);
  }

  /** Parse a flavor name, ignoring case, '_', '-' and spaces ("postgresql", "SQL_SERVER", "ClickHouse"). */
  public static Flavor of(String name) {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("Flavor name is blank");
    String key = normalize(name);
    for (Flavor f : values()) {
      if (normalize(f.name()).equals(key)) return f;
    }
    throw new IllegalArgumentException("Unknown flavor: " + name.trim());
  }

  private static String normalize(String s) {
    return s.trim().toUpperCase(Locale.ROOT).replace("_", "").replace("-", "").replace(" ", "");
  }

  @Override
  public String toString() {
    return displayName;
  }
}
