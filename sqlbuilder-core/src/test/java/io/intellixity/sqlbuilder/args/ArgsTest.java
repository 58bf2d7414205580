package io.intellixity.sqlbuilder.args;

import io.intellixity.sqlbuilder.SqlStatement;
import io.intellixity.sqlbuilder.TemplateBuilder;
import io.intellixity.sqlbuilder.config.SqlBuilderConfig;
import io.intellixity.sqlbuilder.flavor.Flavor;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ArgsTest {
  @Test
  void ordersArgsByTemplateOccurrenceNotRegistration() {
    Args args = new Args(Flavor.POSTGRESQL);
    String x = args.add("x");
    String y = args.add("y");

    SqlStatement s = args.compile("SELECT " + y + ", " + x);
    assertEquals("SELECT $1, $2", s.sql());
    assertEquals(List.of("y", "x"), s.args());
  }

  @Test
  void eachOccurrenceTakesItsOwnSlot() {
    Args args = new Args(Flavor.MYSQL);
    String v = args.add(42);

    SqlStatement s = args.compile(v + " = " + v);
    assertEquals("? = ?", s.sql());
    assertEquals(List.of(42, 42), s.args());
  }

  @Test
  void unusedValueIsLegal() {
    Args args = new Args(Flavor.MYSQL);
    args.add("unused");
    String used = args.add("used");

    SqlStatement s = args.compile("a = " + used);
    assertEquals("a = ?", s.sql());
    assertEquals(List.of("used"), s.args());
  }

  @Test
  void handlesDollarEscapes() {
    Args args = new Args(Flavor.MYSQL);
    SqlStatement s = args.compile("price $$ 5, $x and $");
    assertEquals("price $ 5, $x and $", s.sql());
    assertTrue(s.args().isEmpty());
  }

  @Test
  void successivePlaceholderContinuesAfterLastIndex() {
    Args args = new Args(Flavor.MYSQL);
    args.add(1);
    args.add(2);
    args.add(3);

    SqlStatement s = args.compile("$? $2 $0 $?");
    assertEquals("? ? ? ?", s.sql());
    assertEquals(List.of(1, 3, 1, 2), s.args());
  }

  @Test
  void unregisteredTokenIsFatal() {
    Args args = new Args(Flavor.MYSQL);
    args.add(1);

    ArgsCompileException ex = assertThrows(ArgsCompileException.class, () -> args.compile("a = $3"));
    assertTrue(ex.getMessage().contains("$3"));
    assertThrows(ArgsCompileException.class, () -> args.compile("$0 $?"));
    assertThrows(ArgsCompileException.class, () -> args.compile("$99999999999"));
  }

  @Test
  void initialArgsComeFirstAndShiftOrdinals() {
    Args args = new Args(Flavor.POSTGRESQL);
    String v = args.add(5);

    SqlStatement s = args.compile("x = " + v, "a", "b");
    assertEquals("x = $3", s.sql());
    assertEquals(List.of("a", "b", 5), s.args());
  }

  @Test
  void inlinesNestedBuilderAndMergesItsArgs() {
    Args args = new Args(Flavor.POSTGRESQL);
    String a = args.add(1);
    String sub = args.add(TemplateBuilder.of("SELECT id FROM u WHERE k = $0", 2));
    String b = args.add(3);

    SqlStatement s = args.compile("a = " + a + " AND id IN (" + sub + ") AND b = " + b);
    assertEquals("a = $1 AND id IN (SELECT id FROM u WHERE k = $2) AND b = $3", s.sql());
    assertEquals(List.of(1, 2, 3), s.args());
  }

  @Test
  void rawListAndTupleAreCompiledInPlace() {
    Args args = new Args(Flavor.SQLSERVER);
    String now = args.add(Args.raw("NOW()"));
    String in = args.add(Args.list(List.of(1, 2, 3)));
    String tuple = args.add(Args.tuple("a", 1));

    SqlStatement s = args.compile(now + "; " + in + "; " + tuple);
    assertEquals("NOW(); @p1, @p2, @p3; (@p4, @p5)", s.sql());
    assertEquals(List.of(1, 2, 3, "a", 1), s.args());
  }

  @Test
  void listExpandsArrays() {
    Args args = new Args(Flavor.ORACLE);
    String in = args.add(Args.list(new int[] {7, 8}));

    SqlStatement s = args.compile("id IN (" + in + ")");
    assertEquals("id IN (:1, :2)", s.sql());
    assertEquals(List.of(7, 8), s.args());
  }

  @Test
  void bindsNullValues() {
    Args args = new Args(Flavor.MYSQL);
    String v = args.add(null);

    SqlStatement s = args.compile("a = " + v);
    assertEquals("a = ?", s.sql());
    assertEquals(Arrays.asList((Object) null), s.args());
  }

  @Test
  void nullFlavorFallsBackToDefault() {
    Args args = new Args(Flavor.POSTGRESQL);
    String v = args.add(1);

    SqlStatement s = args.compileWithFlavor("a = " + v, null);
    assertEquals("a = " + SqlBuilderConfig.defaultFlavor().placeholder(1), s.sql());
  }

  @Test
  void swappingFlavorKeepsBindings() {
    Args args = new Args(Flavor.MYSQL);
    String v = args.add("k");

    assertEquals(Flavor.MYSQL, args.setFlavor(Flavor.ORACLE));
    SqlStatement s = args.compile("a = " + v);
    assertEquals("a = :1", s.sql());
    assertEquals(List.of("k"), s.args());
    assertThrows(NullPointerException.class, () -> args.setFlavor(null));
  }

  @Test
  void compileIsRepeatable() {
    Args args = new Args(Flavor.POSTGRESQL);
    String template = "a = " + args.add(1) + " AND b = " + args.add("two");

    SqlStatement first = args.compile(template);
    SqlStatement second = args.compile(template);
    assertEquals(first, second);
    assertEquals(2, args.size());
  }
}
