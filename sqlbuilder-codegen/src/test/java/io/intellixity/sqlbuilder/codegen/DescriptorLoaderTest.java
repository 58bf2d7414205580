package io.intellixity.sqlbuilder.codegen;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DescriptorLoaderTest {
  private static RowMapperDescriptor read(String yaml) throws Exception {
    return new DescriptorLoader().read(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "test.yaml");
  }

  @Test
  void readsDescriptor() throws Exception {
    RowMapperDescriptor d = read("""
        javaType: com.acme.Order
        fields:
          - { field: id, column: "id;primary_key" }
          - { field: tenantId, column: tenant_id }
        """);
    assertEquals("com.acme.Order", d.javaType());
    assertEquals("OrderRowMapper", d.mapperName());
    assertEquals("com.acme.OrderRowMapper", d.mapperFqcn());
    assertEquals(List.of(
        new RowMapperDescriptor.FieldDescriptor("id", "id;primary_key"),
        new RowMapperDescriptor.FieldDescriptor("tenantId", "tenant_id")
    ), d.fields());
  }

  @Test
  void rejectsInvalidDescriptors() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> read("""
        fields:
          - { field: id, column: id }
        """));
    assertTrue(ex.getMessage().contains("javaType is required"));

    assertThrows(IllegalArgumentException.class, () -> read("""
        javaType: com.acme.Order
        fields:
          - { field: id, column: "id;unique" }
        """));
    assertThrows(IllegalArgumentException.class, () -> read("""
        javaType: com.acme.Order
        fields:
          - { field: class, column: c }
        """));
    assertThrows(IllegalArgumentException.class, () -> read("""
        javaType: com.acme.Order
        fields:
          - { field: a, column: c }
          - { field: b, column: "c;primary_key" }
        """));
  }

  @Test
  void loadsDirectorySortedAndRejectsDuplicates(@TempDir Path dir) throws Exception {
    Files.writeString(dir.resolve("b.yml"), "javaType: com.acme.B\nfields:\n  - { field: x, column: x }\n");
    Files.writeString(dir.resolve("a.yaml"), "javaType: com.acme.A\nfields:\n  - { field: y, column: y }\n");
    Files.writeString(dir.resolve("notes.txt"), "ignored");

    List<RowMapperDescriptor> ds = new DescriptorLoader().loadDir(dir);
    assertEquals(List.of("com.acme.A", "com.acme.B"), ds.stream().map(RowMapperDescriptor::javaType).toList());

    Files.writeString(dir.resolve("c.yaml"), "javaType: com.acme.A\nfields:\n  - { field: z, column: z }\n");
    assertThrows(IllegalArgumentException.class, () -> new DescriptorLoader().loadDir(dir));
  }
}
