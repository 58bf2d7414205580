package io.intellixity.sqlbuilder.util;

/** StringBuilder wrapper that separates clauses with a single space. */
public final class SqlBuffer {
  private final StringBuilder sb = new StringBuilder(64);

  /** Append {@code s}, preceded by a space unless the buffer is still empty. */
  public SqlBuffer writeLeading(String s) {
    if (sb.length() > 0) sb.append(' ');
    sb.append(s);
    return this;
  }

  public SqlBuffer write(String s) {
    sb.append(s);
    return this;
  }

  public boolean isEmpty() {
    return sb.length() == 0;
  }

  @Override
  public String toString() {
    return sb.toString();
  }
}
