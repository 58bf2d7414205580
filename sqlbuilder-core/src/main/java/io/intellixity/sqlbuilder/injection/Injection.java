package io.intellixity.sqlbuilder.injection;

import io.intellixity.sqlbuilder.util.SqlBuffer;

import java.util.*;

/**
 * Raw SQL fragments keyed by render checkpoint.
 *
 * <p>{@code M} is the owning builder's checkpoint enum. Fragments are written verbatim (never escaped or
 * bound), space-joined, in registration order.</p>
 */
public final class Injection<M extends Enum<M>> {
  private final EnumMap<M, List<String>> byMarker;

  public Injection(Class<M> markerType) {
    this.byMarker = new EnumMap<>(Objects.requireNonNull(markerType, "markerType"));
  }

  public void sql(M marker, String sql) {
    Objects.requireNonNull(marker, "marker");
    Objects.requireNonNull(sql, "sql");
    byMarker.computeIfAbsent(marker, k -> new ArrayList<>()).add(sql);
  }

  public List<String> fragments(M marker) {
    List<String> l = byMarker.get(marker);
    return (l == null) ? List.of() : Collections.unmodifiableList(l);
  }

  public void writeTo(SqlBuffer buf, M marker) {
    List<String> l = byMarker.get(marker);
    if (l == null || l.isEmpty()) return;
    buf.writeLeading(String.join(" ", l));
  }
}
