package io.intellixity.sqlbuilder;

import io.intellixity.sqlbuilder.config.SqlBuilderConfig;
import io.intellixity.sqlbuilder.dml.InsertBuilder;

/** Entry points using the configured default flavor ({@link SqlBuilderConfig#defaultFlavor()}). */
public final class SqlBuilders {
  private SqlBuilders() {}

  public static InsertBuilder newInsertBuilder() {
    return SqlBuilderConfig.defaultFlavor().newInsertBuilder();
  }

  public static InsertBuilder insertInto(String table) {
    return newInsertBuilder().insertInto(table);
  }

  public static InsertBuilder insertIgnoreInto(String table) {
    return newInsertBuilder().insertIgnoreInto(table);
  }

  public static InsertBuilder replaceInto(String table) {
    return newInsertBuilder().replaceInto(table);
  }

  /** See {@link TemplateBuilder#of}. */
  public static TemplateBuilder build(String format, Object... values) {
    return TemplateBuilder.of(format, values);
  }

  /** See {@link TemplateBuilder#formatted}. */
  public static TemplateBuilder buildf(String format, Object... values) {
    return TemplateBuilder.formatted(format, values);
  }
}
