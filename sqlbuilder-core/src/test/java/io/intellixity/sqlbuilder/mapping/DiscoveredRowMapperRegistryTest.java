package io.intellixity.sqlbuilder.mapping;

import io.intellixity.sqlbuilder.mapping.SampleRowMapperProvider.Customer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class DiscoveredRowMapperRegistryTest {
  record Invoice(String number) {}

  private static final RowMapper<Invoice> INVOICES = DescriptorRowMapper.forType(Invoice.class)
      .field("number", Invoice::number)
      .build();

  @Test
  void discoversProvidersFromFactoriesResource() {
    DiscoveredRowMapperRegistry reg = new DiscoveredRowMapperRegistry();
    assertTrue(reg.contains(Customer.class));
    RowMapper<Customer> m = reg.get(Customer.class);
    assertSame(SampleRowMapperProvider.CUSTOMERS, m);
    assertEquals(List.of(new ColumnValue("id", 3L, true), ColumnValue.of("name", "Ada")),
        m.columns(new Customer(3, "Ada")));
  }

  @Test
  void unknownTypeFails() {
    DiscoveredRowMapperRegistry reg = new DiscoveredRowMapperRegistry(List.of());
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> reg.get(Invoice.class));
    assertTrue(ex.getMessage().contains("No RowMapper registered"));
  }

  @Test
  void rejectsDuplicateMappers() {
    RowMapperProvider p = () -> Map.of(Invoice.class, INVOICES);
    assertThrows(IllegalArgumentException.class, () -> new DiscoveredRowMapperRegistry(List.of(p, p)));
  }

  @Test
  void rejectsMapperRegisteredUnderWrongType() {
    RowMapperProvider p = () -> Map.of(Customer.class, INVOICES);
    assertThrows(IllegalArgumentException.class, () -> new DiscoveredRowMapperRegistry(List.of(p)));
  }
}
