package io.intellixity.sqlbuilder.codegen;

import io.intellixity.sqlbuilder.codegen.internal.JavaFiles;
import io.intellixity.sqlbuilder.mapping.RowMapperProvider;
import io.intellixity.sqlbuilder.util.SqlBuilderFactoriesLoader;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Writes the provider that registers every generated mapper, plus its factories entry. */
final class RowMapperProviderGenerator {
  static final String PKG = "io.intellixity.sqlbuilder.generated";
  static final String TYPE = "GeneratedRowMapperProvider";

  private final List<RowMapperDescriptor> descriptors;

  RowMapperProviderGenerator(List<RowMapperDescriptor> descriptors) {
    this.descriptors = List.copyOf(descriptors);
  }

  Path generate(Path outDir) throws IOException {
    try (JavaFiles.IndentedWriter w = JavaFiles.open(outDir, PKG, TYPE)) {
      w.println("package " + PKG + ";");
      w.blank();
      w.println("import io.intellixity.sqlbuilder.mapping.RowMapper;");
      w.println("import io.intellixity.sqlbuilder.mapping.RowMapperProvider;");
      w.blank();
      w.println("import java.util.Collections;");
      w.println("import java.util.HashMap;");
      w.println("import java.util.Map;");
      w.blank();

      w.block("public final class " + TYPE + " implements RowMapperProvider");
      w.println("private final Map<Class<?>, RowMapper<?>> byType = new HashMap<>();");
      w.blank();
      w.block("public " + TYPE + "()");
      // fully-qualified: record simple names may clash across packages
      for (RowMapperDescriptor d : descriptors) {
        w.println("byType.put(" + d.javaType() + ".class, " + d.mapperFqcn() + ".INSTANCE);");
      }
      w.end();
      w.blank();

      w.println("@Override");
      w.block("public Map<Class<?>, RowMapper<?>> rowMappersByType()");
      w.println("return Collections.unmodifiableMap(byType);");
      w.end();
      w.end();
    }
    return JavaFiles.filePath(outDir, PKG, TYPE);
  }

  Path writeFactories(Path resourcesDir) throws IOException {
    Path file = resourcesDir.resolve(SqlBuilderFactoriesLoader.RESOURCE);
    Files.createDirectories(file.getParent());
    try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      w.write(RowMapperProvider.class.getName() + "=" + PKG + "." + TYPE + "\n");
    }
    return file;
  }
}
