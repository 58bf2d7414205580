package io.intellixity.sqlbuilder.codegen;

import io.intellixity.sqlbuilder.codegen.internal.JavaFiles;
import io.intellixity.sqlbuilder.mapping.ColumnTag;

import javax.lang.model.SourceVersion;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * YAML row-mapper descriptor.
 *
 * <pre>
 * javaType: com.acme.Order
 * mapperName: OrderRowMapper   # optional
 * fields:
 *   - { field: id, column: "id;primary_key" }
 *   - { field: tenantId, column: tenant_id }
 * </pre>
 *
 * {@code field} is the record accessor name, {@code column} uses the {@code name[;primary_key]} tag form.
 */
public record RowMapperDescriptor(String javaType, String mapperName, List<FieldDescriptor> fields) {
  public record FieldDescriptor(String field, String column) {}

  public RowMapperDescriptor {
    if (javaType == null || javaType.isBlank()) throw new IllegalArgumentException("javaType is required");
    javaType = javaType.trim();
    if (!SourceVersion.isName(javaType)) throw new IllegalArgumentException("Invalid javaType: " + javaType);
    if (mapperName == null || mapperName.isBlank()) mapperName = JavaFiles.simple(javaType) + "RowMapper";
    if (!SourceVersion.isIdentifier(mapperName) || SourceVersion.isKeyword(mapperName)) {
      throw new IllegalArgumentException("Invalid mapperName: " + mapperName);
    }
    fields = (fields == null) ? List.of() : List.copyOf(fields);
    if (fields.isEmpty()) throw new IllegalArgumentException("No fields declared for " + javaType);

    Set<String> seen = new HashSet<>();
    for (FieldDescriptor f : fields) {
      if (f == null || f.field() == null || !SourceVersion.isIdentifier(f.field()) || SourceVersion.isKeyword(f.field())) {
        throw new IllegalArgumentException("Invalid field name in " + javaType + ": " + (f == null ? null : f.field()));
      }
      ColumnTag tag = ColumnTag.parse(f.column());
      if (!seen.add(tag.column())) {
        throw new IllegalArgumentException("Duplicate column '" + tag.column() + "' in " + javaType);
      }
    }
  }

  public String pkg() {
    return JavaFiles.pkg(javaType);
  }

  public String simpleType() {
    return JavaFiles.simple(javaType);
  }

  public String mapperFqcn() {
    String p = pkg();
    return p.isEmpty() ? mapperName : p + "." + mapperName;
  }
}
