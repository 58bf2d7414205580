package io.intellixity.sqlbuilder.mapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * {@link RowMapper} assembled from explicit (tag, getter) registrations.
 *
 * <pre>{@code
 * RowMapper<Order> m = DescriptorRowMapper.forType(Order.class)
 *     .field("id;primary_key", Order::id)
 *     .field("tenant_id", Order::tenantId)
 *     .build();
 * }</pre>
 */
public final class DescriptorRowMapper<T> implements RowMapper<T> {
  private final Class<T> type;
  private final List<Field<T>> fields;

  private record Field<T>(ColumnTag tag, Function<? super T, ?> getter) {}

  private DescriptorRowMapper(Class<T> type, List<Field<T>> fields) {
    this.type = type;
    this.fields = List.copyOf(fields);
  }

  public static <T> Definition<T> forType(Class<T> type) {
    return new Definition<>(Objects.requireNonNull(type, "type"));
  }

  @Override
  public Class<T> type() {
    return type;
  }

  @Override
  public List<ColumnValue> columns(T row) {
    Objects.requireNonNull(row, "row");
    List<ColumnValue> out = new ArrayList<>(fields.size());
    for (Field<T> f : fields) {
      out.add(new ColumnValue(f.tag().column(), f.getter().apply(row), f.tag().primaryKey()));
    }
    return out;
  }

  public static final class Definition<T> {
    private final Class<T> type;
    private final List<Field<T>> fields = new ArrayList<>();

    private Definition(Class<T> type) {
      this.type = type;
    }

    /** Register a field; {@code tag} uses the {@code name[;primary_key]} form. */
    public Definition<T> field(String tag, Function<? super T, ?> getter) {
      ColumnTag ct = ColumnTag.parse(tag);
      for (Field<T> f : fields) {
        if (f.tag().column().equals(ct.column())) {
          throw new IllegalArgumentException("Duplicate column '" + ct.column() + "' for type " + type.getName());
        }
      }
      fields.add(new Field<>(ct, Objects.requireNonNull(getter, "getter")));
      return this;
    }

    public DescriptorRowMapper<T> build() {
      if (fields.isEmpty()) throw new IllegalArgumentException("No fields registered for type " + type.getName());
      return new DescriptorRowMapper<>(type, fields);
    }
  }
}
