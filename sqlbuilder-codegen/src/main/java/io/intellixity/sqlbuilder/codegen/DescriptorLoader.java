package io.intellixity.sqlbuilder.codegen;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;

/** Loads {@link RowMapperDescriptor}s from YAML files ({@code *.yaml}, {@code *.yml}). */
final class DescriptorLoader {
  private static final Logger log = LoggerFactory.getLogger(DescriptorLoader.class);

  private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

  /** All descriptors under {@code dir} (recursive), sorted by path. */
  List<RowMapperDescriptor> loadDir(Path dir) throws IOException {
    if (!Files.isDirectory(dir)) throw new IllegalArgumentException("Not a directory: " + dir);
    List<Path> files;
    try (Stream<Path> s = Files.walk(dir)) {
      files = s.filter(Files::isRegularFile)
          .filter(p -> {
            String n = p.getFileName().toString();
            return n.endsWith(".yaml") || n.endsWith(".yml");
          })
          .sorted()
          .toList();
    }

    List<RowMapperDescriptor> out = new ArrayList<>(files.size());
    Map<String, Path> byType = new HashMap<>();
    for (Path f : files) {
      RowMapperDescriptor d = load(f);
      Path prev = byType.putIfAbsent(d.javaType(), f);
      if (prev != null) {
        throw new IllegalArgumentException("Duplicate descriptor for " + d.javaType() + ": " + prev + ", " + f);
      }
      out.add(d);
    }
    log.debug("sqlbuilder.codegen descriptors={} dir={}", out.size(), dir);
    return out;
  }

  RowMapperDescriptor load(Path file) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      return read(in, file.toString());
    }
  }

  RowMapperDescriptor read(InputStream in, String source) throws IOException {
    try {
      RowMapperDescriptor d = yaml.readValue(in, RowMapperDescriptor.class);
      if (d == null) throw new IllegalArgumentException("Empty descriptor: " + source);
      return d;
    } catch (com.fasterxml.jackson.databind.exc.ValueInstantiationException e) {
      Throwable cause = (e.getCause() != null) ? e.getCause() : e;
      throw new IllegalArgumentException("Invalid descriptor " + source + ": " + cause.getMessage(), e);
    }
  }
}
