package io.intellixity.sqlbuilder.dml;

import io.intellixity.sqlbuilder.Builder;
import io.intellixity.sqlbuilder.SqlStatement;
import io.intellixity.sqlbuilder.args.Args;
import io.intellixity.sqlbuilder.config.SqlBuilderConfig;
import io.intellixity.sqlbuilder.flavor.Flavor;
import io.intellixity.sqlbuilder.injection.Injection;
import io.intellixity.sqlbuilder.mapping.ColumnValue;
import io.intellixity.sqlbuilder.mapping.RowMapper;
import io.intellixity.sqlbuilder.util.Escapes;
import io.intellixity.sqlbuilder.util.SqlBuffer;

import java.util.*;

/**
 * INSERT / REPLACE builder.
 *
 * <p>Clauses always render in the same order (verb + table, column list, value rows) no matter which order
 * they were configured in. Table and column names are escaped when set. Values are bound through {@link Args}
 * and rendered as placeholders of the flavor passed to {@link #buildWithFlavor}.</p>
 *
 * <p>{@link #sql(String)} attaches a raw fragment at the furthest checkpoint reached so far (see {@link Marker}).
 * Single owner, not thread-safe; {@code build} does not mutate.</p>
 */
public final class InsertBuilder implements Builder {
  /** Render checkpoints, in render order. */
  public enum Marker {
    /** Before the verb. */
    INIT,
    AFTER_INSERT_INTO,
    /** Written only when a column list is present. */
    AFTER_COLS,
    AFTER_VALUES
  }

  private final Args args;
  private final Injection<Marker> injection = new Injection<>(Marker.class);

  private String verb = "INSERT";
  private String table = "";
  private List<String> cols = List.of();
  private final List<List<String>> values = new ArrayList<>();
  private Marker marker = Marker.INIT;

  public InsertBuilder() {
    this(SqlBuilderConfig.defaultFlavor());
  }

  public InsertBuilder(Flavor flavor) {
    this.args = new Args(flavor);
  }

  public InsertBuilder insertInto(String table) {
    return intoTable("INSERT", table);
  }

  /** INSERT that skips duplicate rows; the SQL form is decided by the builder's current flavor. */
  public InsertBuilder insertIgnoreInto(String table) {
    args.flavor().prepareInsertIgnore(table, this);
    return this;
  }

  /** REPLACE INTO is a MySQL extension. */
  public InsertBuilder replaceInto(String table) {
    return intoTable("REPLACE", table);
  }

  /** Set the verb ("INSERT", "REPLACE", "INSERT IGNORE", ...) and target table. */
  public InsertBuilder intoTable(String verb, String table) {
    this.verb = Objects.requireNonNull(verb, "verb");
    this.table = (table == null) ? "" : Escapes.escape(table);
    advance(Marker.AFTER_INSERT_INTO);
    return this;
  }

  /** Replace the column list. */
  public InsertBuilder cols(String... cols) {
    this.cols = Escapes.escapeAll(cols);
    advance(Marker.AFTER_COLS);
    return this;
  }

  /** Append one row of values. A lone {@code null} argument binds a single NULL. */
  public InsertBuilder values(Object... row) {
    Object[] vs = (row == null) ? new Object[] {null} : row;
    List<String> placeholders = new ArrayList<>(vs.length);
    for (Object v : vs) placeholders.add(args.add(v));
    values.add(placeholders);
    advance(Marker.AFTER_VALUES);
    return this;
  }

  /**
   * Set columns and append one row from {@code row} via {@code mapper}. Primary-key columns are skipped.
   */
  public <T> InsertBuilder insertRow(T row, RowMapper<? super T> mapper) {
    Objects.requireNonNull(row, "row");
    Objects.requireNonNull(mapper, "mapper");
    List<String> c = new ArrayList<>();
    List<Object> v = new ArrayList<>();
    for (ColumnValue cv : mapper.columns(row)) {
      if (cv.primaryKey()) continue;
      c.add(cv.column());
      v.add(cv.value());
    }
    return cols(c.toArray(new String[0])).values(v.toArray());
  }

  /** Multi-row variant of {@link #insertRow}; the column list comes from the first row. */
  public <T> InsertBuilder insertRows(Iterable<? extends T> rows, RowMapper<? super T> mapper) {
    Objects.requireNonNull(rows, "rows");
    boolean first = true;
    for (T row : rows) {
      if (first) {
        insertRow(row, mapper);
        first = false;
        continue;
      }
      List<Object> v = new ArrayList<>();
      for (ColumnValue cv : mapper.columns(row)) {
        if (!cv.primaryKey()) v.add(cv.value());
      }
      values(v.toArray());
    }
    return this;
  }

  /**
   * Append a raw fragment at the current checkpoint.
   *
   * <p>Fragments are not bound or escaped, but they are compiled with the rest of the statement: a literal '$'
   * must be written {@code $$}, and {@code $n} must be a token returned by {@link #var}. Any other {@code $n}
   * fails the build with {@link io.intellixity.sqlbuilder.args.ArgsCompileException}.</p>
   */
  public InsertBuilder sql(String sql) {
    injection.sql(marker, sql);
    return this;
  }

  /** Append a raw fragment at {@code at} without moving the checkpoint cursor. Same '$' rules as {@link #sql}. */
  public InsertBuilder sqlAt(Marker at, String sql) {
    injection.sql(at, sql);
    return this;
  }

  /** Bind {@code value} and return its token, for use inside {@link #sql(String)} fragments. */
  public String var(Object value) {
    return args.add(value);
  }

  public Marker marker() {
    return marker;
  }

  @Override
  public Flavor flavor() {
    return args.flavor();
  }

  /** Returns the previous flavor. Identifiers already set are not re-escaped. */
  public Flavor setFlavor(Flavor flavor) {
    return args.setFlavor(flavor);
  }

  @Override
  public SqlStatement build() {
    return buildWithFlavor(args.flavor());
  }

  /**
   * Render with {@code flavor}. Placeholders follow {@code flavor}; the insert-ignore form does not, it was fixed
   * by the builder's flavor when {@link #insertIgnoreInto} was called.
   */
  @Override
  public SqlStatement buildWithFlavor(Flavor flavor, Object... initialArgs) {
    SqlBuffer buf = new SqlBuffer();
    injection.writeTo(buf, Marker.INIT);

    if (!table.isEmpty()) {
      buf.writeLeading(verb);
      buf.write(" INTO ");
      buf.write(table);
    }
    injection.writeTo(buf, Marker.AFTER_INSERT_INTO);

    if (!cols.isEmpty()) {
      buf.writeLeading("(");
      buf.write(String.join(", ", cols));
      buf.write(")");
      injection.writeTo(buf, Marker.AFTER_COLS);
    }

    if (!values.isEmpty()) {
      buf.writeLeading("VALUES ");
      List<String> rows = new ArrayList<>(values.size());
      for (List<String> row : values) rows.add("(" + String.join(", ", row) + ")");
      buf.write(String.join(", ", rows));
    }
    injection.writeTo(buf, Marker.AFTER_VALUES);

    return args.compileWithFlavor(buf.toString(), flavor, initialArgs);
  }

  /** The compiled SQL only. */
  @Override
  public String toString() {
    return build().sql();
  }

  private void advance(Marker to) {
    if (to.compareTo(marker) > 0) marker = to;
  }
}
