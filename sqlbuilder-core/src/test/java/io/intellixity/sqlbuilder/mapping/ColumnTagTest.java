package io.intellixity.sqlbuilder.mapping;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ColumnTagTest {
  @Test
  void parsesPlainAndPrimaryKeyTags() {
    assertEquals(new ColumnTag("tenant_id", false), ColumnTag.parse("tenant_id"));
    assertEquals(new ColumnTag("id", true), ColumnTag.parse("id;primary_key"));
    assertEquals(new ColumnTag("id", true), ColumnTag.parse(" id ; primary_key "));
    assertEquals(new ColumnTag("id", false), ColumnTag.parse("id;"));
  }

  @Test
  void rejectsMalformedTags() {
    assertThrows(IllegalArgumentException.class, () -> ColumnTag.parse(""));
    assertThrows(IllegalArgumentException.class, () -> ColumnTag.parse(null));
    assertThrows(IllegalArgumentException.class, () -> ColumnTag.parse(";primary_key"));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> ColumnTag.parse("id;unique"));
    assertTrue(ex.getMessage().contains("'unique'"));
  }

  @Test
  void printsInTagForm() {
    assertEquals("id;primary_key", ColumnTag.parse("id ;primary_key").toString());
    assertEquals("status", ColumnTag.parse("status").toString());
  }
}
