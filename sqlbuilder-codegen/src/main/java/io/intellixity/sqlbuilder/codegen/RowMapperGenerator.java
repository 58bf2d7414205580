package io.intellixity.sqlbuilder.codegen;

import io.intellixity.sqlbuilder.codegen.internal.JavaFiles;
import io.intellixity.sqlbuilder.mapping.ColumnTag;

import java.io.IOException;
import java.nio.file.Path;

/** Writes a reflection-free {@code RowMapper} for one descriptor, in the record's own package. */
final class RowMapperGenerator {
  Path generate(RowMapperDescriptor d, Path outDir) throws IOException {
    String pkg = d.pkg();
    String type = d.simpleType();
    String name = d.mapperName();

    try (JavaFiles.IndentedWriter w = JavaFiles.open(outDir, pkg, name)) {
      if (!pkg.isEmpty()) {
        w.println("package " + pkg + ";");
        w.blank();
      }
      w.println("import io.intellixity.sqlbuilder.mapping.ColumnValue;");
      w.println("import io.intellixity.sqlbuilder.mapping.RowMapper;");
      w.blank();
      w.println("import java.util.ArrayList;");
      w.println("import java.util.List;");
      w.blank();

      w.block("public final class " + name + " implements RowMapper<" + type + ">");
      w.println("public static final " + name + " INSTANCE = new " + name + "();");
      w.blank();
      w.println("private " + name + "() {}");
      w.blank();

      w.println("@Override");
      w.block("public Class<" + type + "> type()");
      w.println("return " + type + ".class;");
      w.end();
      w.blank();

      w.println("@Override");
      w.block("public List<ColumnValue> columns(" + type + " row)");
      w.println("List<ColumnValue> out = new ArrayList<>(" + d.fields().size() + ");");
      for (RowMapperDescriptor.FieldDescriptor f : d.fields()) {
        ColumnTag tag = ColumnTag.parse(f.column());
        w.println("out.add(new ColumnValue(" + JavaFiles.literal(tag.column()) + ", row." + f.field() + "(), " +
            tag.primaryKey() + "));");
      }
      w.println("return out;");
      w.end();
      w.end();
    }
    return JavaFiles.filePath(outDir, pkg, name);
  }
}
