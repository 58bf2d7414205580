package io.intellixity.sqlbuilder;

import io.intellixity.sqlbuilder.args.Args;
import io.intellixity.sqlbuilder.config.SqlBuilderConfig;
import io.intellixity.sqlbuilder.flavor.Flavor;
import io.intellixity.sqlbuilder.util.Escapes;

import java.util.Objects;

/**
 * Free-form builder over a fixed template, for SQL the structured builders do not cover.
 *
 * <p>Usable on its own or as a bound value inside another builder (it is then inlined).</p>
 */
public final class TemplateBuilder implements Builder {
  private final String template;
  private final Args args;

  private TemplateBuilder(String template, Args args) {
    this.template = template;
    this.args = args;
  }

  /**
   * {@code format} uses Args token syntax: {@code $0}, {@code $1} refer to {@code values} by index,
   * {@code $?} to the next one, {@code $$} is a literal '$'.
   */
  public static TemplateBuilder of(String format, Object... values) {
    Objects.requireNonNull(format, "format");
    Args args = new Args(SqlBuilderConfig.defaultFlavor());
    if (values != null) {
      for (Object v : values) args.add(v);
    }
    return new TemplateBuilder(format, args);
  }

  /**
   * {@code format} is a {@link String#format} pattern whose {@code %s} directives receive the bound values.
   * '$' in the pattern is literal.
   */
  public static TemplateBuilder formatted(String format, Object... values) {
    Objects.requireNonNull(format, "format");
    Args args = new Args(SqlBuilderConfig.defaultFlavor());
    Object[] vs = (values == null) ? new Object[0] : values;
    Object[] tokens = new Object[vs.length];
    for (int i = 0; i < vs.length; i++) tokens[i] = args.add(vs[i]);
    return new TemplateBuilder(String.format(Escapes.escape(format), tokens), args);
  }

  @Override
  public Flavor flavor() {
    return args.flavor();
  }

  public Flavor setFlavor(Flavor flavor) {
    return args.setFlavor(flavor);
  }

  @Override
  public SqlStatement build() {
    return buildWithFlavor(args.flavor());
  }

  @Override
  public SqlStatement buildWithFlavor(Flavor flavor, Object... initialArgs) {
    return args.compileWithFlavor(template, flavor, initialArgs);
  }

  @Override
  public String toString() {
    return build().sql();
  }
}
