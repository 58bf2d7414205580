package io.intellixity.sqlbuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rendered SQL plus its ordered positional arguments.
 *
 * <p>{@code args} may contain {@code null} entries (bound SQL NULL). The list is suitable for
 * {@code PreparedStatement#setObject(index + 1, args.get(index))}.</p>
 */
public record SqlStatement(String sql, List<Object> args) {
  public SqlStatement {
    sql = (sql == null) ? "" : sql;
    args = (args == null || args.isEmpty())
        ? List.of()
        : Collections.unmodifiableList(new ArrayList<>(args));
  }

  /** Arguments as an array, in positional order. */
  public Object[] argsArray() {
    return args.toArray();
  }
}
