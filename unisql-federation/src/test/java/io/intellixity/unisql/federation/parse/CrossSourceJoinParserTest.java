package io.intellixity.unisql.federation.parse;

import io.intellixity.unisql.query.QueryParseException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

final class CrossSourceJoinParserTest {
  private final CrossSourceJoinParser parser = new CrossSourceJoinParser();

  @Test
  void parsesFullExample() {
    JoinSpec spec = parser.parse("SELECT * FROM rs.public.orders o LEFT JOIN ss.[dbo].customers c "
        + "ON o.customer_id = c.id WHERE o.status = 'open' AND c.active = 1 LIMIT 5");

    assertEquals(new TableRef("public", "orders", "o"), spec.warehouse());
    assertEquals(new TableRef("dbo", "customers", "c"), spec.transactional());
    assertEquals(JoinType.LEFT, spec.joinType());
    assertEquals(new JoinPredicate("customer_id", "id"), spec.predicate());
    assertEquals("*", spec.selectColumns());
    assertEquals(List.of("status = 'open'"), spec.warehouseConjuncts());
    assertEquals(List.of("active = 1"), spec.transactionalConjuncts());
    assertEquals(OptionalInt.of(5), spec.limit());
  }

  @Test
  void defaultsToInner_withoutWhereOrLimit() {
    JoinSpec spec = parser.parse("select o.id, c.name from rs.public.orders o join ss.dbo.customers c on o.customer_id = c.id");
    assertEquals(JoinType.INNER, spec.joinType());
    assertEquals("o.id, c.name", spec.selectColumns());
    assertEquals(new TableRef("dbo", "customers", "c"), spec.transactional());
    assertTrue(spec.warehouseConjuncts().isEmpty());
    assertTrue(spec.transactionalConjuncts().isEmpty());
    assertTrue(spec.limit().isEmpty());
  }

  @Test
  void joinTypes_withOptionalOuter() {
    String tail = " JOIN ss.[dbo].c b ON a.id = b.id";
    assertEquals(JoinType.INNER, parser.parse("SELECT * FROM rs.s.t a INNER" + tail).joinType());
    assertEquals(JoinType.LEFT, parser.parse("SELECT * FROM rs.s.t a LEFT OUTER" + tail).joinType());
    assertEquals(JoinType.RIGHT, parser.parse("SELECT * FROM rs.s.t a right outer" + tail).joinType());
    assertEquals(JoinType.RIGHT, parser.parse("SELECT * FROM rs.s.t a RIGHT" + tail).joinType());
    assertEquals(JoinType.FULL, parser.parse("SELECT * FROM rs.s.t a FULL OUTER" + tail).joinType());
  }

  @Test
  void predicateOrientation_followsAliasNotPosition() {
    JoinSpec spec = parser.parse("SELECT * FROM rs.public.orders o JOIN ss.[dbo].customers c ON c.id = o.customer_id");
    assertEquals(new JoinPredicate("customer_id", "id"), spec.predicate());
  }

  @Test
  void whitespaceAndCase_areNormalised() {
    JoinSpec spec = parser.parse("  SELECT *\n\tFROM   RS.public.orders   AS o\n"
        + "FULL JOIN SS.[dbo].customers AS c\n  ON O.customer_id=C.id\n WHERE  o.total >  10 \n ORDER BY o.id DESC\n LIMIT 3 ;");
    assertEquals(JoinType.FULL, spec.joinType());
    assertEquals("o", spec.warehouse().alias());
    assertEquals(List.of("total > 10"), spec.warehouseConjuncts());
    assertEquals(OptionalInt.of(3), spec.limit());
  }

  @Test
  void keywordsInsideLiterals_doNotEndTheWhereClause() {
    JoinSpec spec = parser.parse("SELECT * FROM rs.public.orders o JOIN ss.[dbo].customers c ON o.cid = c.id "
        + "WHERE o.note = 'see limit 5' AND c.name IN ('a', 'b')");
    assertEquals(List.of("note = 'see limit 5'"), spec.warehouseConjuncts());
    assertEquals(List.of("name IN ('a', 'b')"), spec.transactionalConjuncts());
    assertTrue(spec.limit().isEmpty());
  }

  @Test
  void missingOn_isParseFailure() {
    QueryParseException ex = assertThrows(QueryParseException.class,
        () -> parser.parse("SELECT * FROM rs.public.orders o JOIN ss.[dbo].customers c WHERE o.id = 1"));
    assertTrue(ex.getMessage().startsWith("Could not parse cross-source query: missing ON clause"));
    assertTrue(ex.getMessage().contains(QueryParseException.SUPPORTED_FORMAT));
  }

  @Test
  void malformedInputs_areParseFailures() {
    List<String> bad = List.of(
        "UPDATE rs.public.orders SET x = 1",
        "SELECT FROM rs.public.orders o JOIN ss.[dbo].c c ON o.id = c.id",
        "SELECT * FROM ss.[dbo].customers c JOIN rs.public.orders o ON o.id = c.id",
        "SELECT * FROM rs.public.orders JOIN ss.[dbo].customers c ON orders.id = c.id",
        "SELECT * FROM rs.public.orders o JOIN ss.[dbo].customers ON o.id = customers.id",
        "SELECT * FROM rs.public.orders o, ss.[dbo].customers c WHERE o.id = c.id",
        "SELECT * FROM rs.public.orders o JOIN ss.[dbo].customers c ON o.id = x.id",
        "SELECT * FROM rs.public.orders o JOIN ss.[dbo].customers c ON o.id > c.id",
        "SELECT * FROM rs.public.orders o JOIN ss.[dbo].customers o ON o.id = o.id",
        "SELECT * FROM rs.public.orders o JOIN ss.[dbo].customers c ON o.id = c.id LIMIT ten",
        "SELECT * FROM rs.public.orders o JOIN ss.[dbo].customers c ON o.id = c.id LIMIT 5 OFFSET 2",
        "SELECT * FROM rs.public.orders o JOIN ss.[dbo].customers c ON o.id = c.id WHERE",
        "SELECT * FROM rs.public.orders o JOIN ss.[dbo.customers c ON o.id = c.id",
        "SELECT * FROM rs.public.orders o JOIN ss.[dbo].customers c ON o.id = c.id WHERE o.note = 'open");
    for (String sql : bad) {
      assertThrows(QueryParseException.class, () -> parser.parse(sql), sql);
    }
  }

  @Test
  void rejectPolicy_flowsThroughParser() {
    CrossSourceJoinParser strict = new CrossSourceJoinParser(new PredicateSplitter(UnmatchedConjunctPolicy.REJECT));
    String sql = "SELECT * FROM rs.public.orders o JOIN ss.[dbo].customers c ON o.id = c.id WHERE x.flag = 1";
    assertThrows(QueryParseException.class, () -> strict.parse(sql));
    assertTrue(parser.parse(sql).warehouseConjuncts().isEmpty());
  }
}
