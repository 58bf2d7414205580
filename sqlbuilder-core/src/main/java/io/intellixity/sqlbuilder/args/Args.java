package io.intellixity.sqlbuilder.args;

import io.intellixity.sqlbuilder.Builder;
import io.intellixity.sqlbuilder.SqlStatement;
import io.intellixity.sqlbuilder.config.SqlBuilderConfig;
import io.intellixity.sqlbuilder.flavor.Flavor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.util.*;

/**
 * Deferred argument registry owned by a single builder.
 *
 * <p>{@link #add(Object)} stores a value and returns a token ({@code $0}, {@code $1}, ...) to embed in a
 * template. {@link #compileWithFlavor} rewrites the template into dialect SQL + ordered args.</p>
 *
 * Template syntax:
 * <ul>
 *   <li>{@code $<n>}: the value registered at index n</li>
 *   <li>{@code $?}: the value after the one referenced last (starts at 0)</li>
 *   <li>{@code $$}: a literal '$'</li>
 *   <li>any other '$' is written as-is</li>
 * </ul>
 *
 * <p>Every token occurrence takes one placeholder slot, so args follow template order, not {@code add} order.
 * Not thread-safe.</p>
 */
public final class Args {
  private static final Logger log = LoggerFactory.getLogger(Args.class);

  private final List<Object> values = new ArrayList<>();
  private Flavor flavor;

  public Args() {
    this(SqlBuilderConfig.defaultFlavor());
  }

  public Args(Flavor flavor) {
    this.flavor = Objects.requireNonNull(flavor, "flavor");
  }

  public Flavor flavor() {
    return flavor;
  }

  /** Swap the flavor used by {@link #compile}. Existing bindings are kept. Returns the previous flavor. */
  public Flavor setFlavor(Flavor flavor) {
    Flavor old = this.flavor;
    this.flavor = Objects.requireNonNull(flavor, "flavor");
    return old;
  }

  /** Register a value and return its token. */
  public String add(Object value) {
    values.add(value);
    return "$" + (values.size() - 1);
  }

  public int size() {
    return values.size();
  }

  public SqlStatement compile(String template, Object... initialArgs) {
    return compileWithFlavor(template, flavor, initialArgs);
  }

  /**
   * Compile {@code template} for {@code flavor}; a null flavor means the configured default.
   * {@code initialArgs} are emitted first and count towards placeholder ordinals.
   */
  public SqlStatement compileWithFlavor(String template, Flavor flavor, Object... initialArgs) {
    Flavor effective = (flavor == null) ? SqlBuilderConfig.defaultFlavor() : flavor;
    String t = (template == null) ? "" : template;
    CompileCtx ctx = new CompileCtx(effective, initialArgs, t.length());

    int next = 0;
    int i = 0;
    int n = t.length();
    while (i < n) {
      char ch = t.charAt(i);
      if (ch != '$') {
        ctx.out.append(ch);
        i++;
        continue;
      }
      // trailing '$' is a plain character
      if (i + 1 >= n) {
        ctx.out.append('$');
        break;
      }

      char r = t.charAt(i + 1);
      if (r == '$') {
        ctx.out.append('$');
        i += 2;
      } else if (isDigit(r)) {
        int end = i + 2;
        while (end < n && isDigit(t.charAt(end))) end++;
        int idx = parseIndex(t, i + 1, end);
        compileArg(ctx, valueAt(idx, t));
        next = idx + 1;
        i = end;
      } else if (r == '?') {
        compileArg(ctx, valueAt(next, t));
        next++;
        i += 2;
      } else {
        ctx.out.append('$');
        i++;
      }
    }

    SqlStatement out = new SqlStatement(ctx.out.toString(), ctx.values);
    if (log.isTraceEnabled()) {
      log.trace("sqlbuilder.compile flavor={} registered={} argCount={} sql={}",
          effective, values.size(), out.args().size(), out.sql());
    }
    return out;
  }

  /** A verbatim SQL expression; compiled in place instead of being bound. */
  public static Raw raw(String expr) {
    return new Raw(Objects.requireNonNull(expr, "expr"));
  }

  /**
   * Expand a collection or array into a comma-separated placeholder list ({@code ?, ?, ?}).
   * Any other value becomes a one-element list.
   */
  public static ListArg list(Object values) {
    return new ListArg(toList(values), false);
  }

  /** Like {@link #list} but parenthesized: {@code (?, ?)}. */
  public static ListArg tuple(Object... values) {
    return new ListArg(toList(values), true);
  }

  public record Raw(String expr) {}

  public record ListArg(List<Object> values, boolean tuple) {
    public ListArg {
      values = (values == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }
  }

  private static final class CompileCtx {
    private final Flavor flavor;
    private final StringBuilder out;
    private List<Object> values;

    private CompileCtx(Flavor flavor, Object[] initialArgs, int sizeHint) {
      this.flavor = flavor;
      this.out = new StringBuilder(sizeHint + 16);
      this.values = new ArrayList<>();
      if (initialArgs != null) values.addAll(Arrays.asList(initialArgs));
    }

    private void bind(Object value) {
      values.add(value);
      out.append(flavor.placeholder(values.size()));
    }
  }

  private static void compileArg(CompileCtx ctx, Object arg) {
    if (arg instanceof Builder b) {
      SqlStatement nested = b.buildWithFlavor(ctx.flavor, ctx.values.toArray());
      ctx.out.append(nested.sql());
      ctx.values = new ArrayList<>(nested.args());
      return;
    }
    if (arg instanceof Raw r) {
      ctx.out.append(r.expr());
      return;
    }
    if (arg instanceof ListArg l) {
      if (l.tuple()) ctx.out.append('(');
      for (int i = 0; i < l.values().size(); i++) {
        if (i > 0) ctx.out.append(", ");
        compileArg(ctx, l.values().get(i));
      }
      if (l.tuple()) ctx.out.append(')');
      return;
    }
    ctx.bind(arg);
  }

  private Object valueAt(int idx, String template) {
    if (idx < 0 || idx >= values.size()) {
      throw new ArgsCompileException("Template references unregistered placeholder $" + idx +
          " (registered=" + values.size() + "): " + template);
    }
    return values.get(idx);
  }

  private static int parseIndex(String t, int start, int end) {
    try {
      return Integer.parseInt(t, start, end, 10);
    } catch (NumberFormatException e) {
      throw new ArgsCompileException("Invalid placeholder $" + t.substring(start, end), e);
    }
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static List<Object> toList(Object v) {
    if (v == null) return Collections.singletonList(null);
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    if (v.getClass().isArray()) {
      int len = Array.getLength(v);
      List<Object> out = new ArrayList<>(len);
      for (int i = 0; i < len; i++) out.add(Array.get(v, i));
      return out;
    }
    return Collections.singletonList(v);
  }
}
