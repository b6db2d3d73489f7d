package io.intellixity.unisql.federation.join;

import io.intellixity.unisql.federation.parse.JoinPredicate;
import io.intellixity.unisql.federation.parse.JoinSpec;
import io.intellixity.unisql.federation.parse.JoinType;
import io.intellixity.unisql.federation.parse.TableRef;
import io.intellixity.unisql.query.QueryResult;
import io.intellixity.unisql.query.Source;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import static io.intellixity.unisql.federation.FakeDriver.row;
import static org.junit.jupiter.api.Assertions.*;

final class HashJoinTest {
  private static JoinSpec spec(JoinType type, String wCol, String tCol, OptionalInt limit) {
    return new JoinSpec(new TableRef("public", "orders", "o"), new TableRef("dbo", "customers", "c"),
        type, new JoinPredicate(wCol, tCol), "*", Map.of(), limit);
  }

  private static JoinSpec spec(JoinType type) {
    return spec(type, "id", "cid", OptionalInt.empty());
  }

  private static QueryResult warehouse(List<Map<String, Object>> rows, String... columns) {
    return QueryResult.of(List.of(columns), rows, Source.WAREHOUSE);
  }

  private static QueryResult transactional(List<Map<String, Object>> rows, String... columns) {
    return QueryResult.of(List.of(columns), rows, Source.TRANSACTIONAL);
  }

  private final QueryResult ids = warehouse(List.of(row("id", 1), row("id", 2)), "id");
  private final QueryResult customers = transactional(List.of(row("cid", 1, "name", "A")), "cid", "name");

  @Test
  void inner_emitsOnlyMatches() {
    QueryResult r = HashJoin.join(spec(JoinType.INNER), ids, customers);
    assertEquals(Source.CROSS, r.source());
    assertEquals(List.of(row("o_id", 1, "c_cid", 1, "c_name", "A")), r.rows());
    assertEquals(List.of("o_id", "c_cid", "c_name"), r.columns());
    assertEquals(1, r.rowCount());
  }

  @Test
  void left_fillsMissingTransactionalSideWithNulls() {
    QueryResult r = HashJoin.join(spec(JoinType.LEFT), ids, customers);
    assertEquals(List.of(
        row("o_id", 1, "c_cid", 1, "c_name", "A"),
        row("o_id", 2, "c_cid", null, "c_name", null)), r.rows());
  }

  @Test
  void right_appendsUnmatchedTransactionalRowsAfterWarehouseRows() {
    QueryResult t = transactional(List.of(row("cid", 3, "name", "C"), row("cid", 1, "name", "A")), "cid", "name");
    QueryResult r = HashJoin.join(spec(JoinType.RIGHT), ids, t);
    assertEquals(List.of(
        row("o_id", 1, "c_cid", 1, "c_name", "A"),
        row("o_id", null, "c_cid", 3, "c_name", "C")), r.rows());
  }

  @Test
  void full_keepsBothUnmatchedSides() {
    QueryResult t = transactional(List.of(row("cid", 1, "name", "A"), row("cid", 9, "name", "Z")), "cid", "name");
    QueryResult r = HashJoin.join(spec(JoinType.FULL), ids, t);
    assertEquals(List.of(
        row("o_id", 1, "c_cid", 1, "c_name", "A"),
        row("o_id", 2, "c_cid", null, "c_name", null),
        row("o_id", null, "c_cid", 9, "c_name", "Z")), r.rows());
  }

  @Test
  void duplicateKeys_produceOneRowPerMatch_inTransactionalOrder() {
    QueryResult t = transactional(List.of(row("cid", 1, "name", "A"), row("cid", 1, "name", "B")), "cid", "name");
    QueryResult r = HashJoin.join(spec(JoinType.INNER), ids, t);
    assertEquals(2, r.rowCount());
    assertEquals("A", r.rows().get(0).get("c_name"));
    assertEquals("B", r.rows().get(1).get("c_name"));
  }

  @Test
  void limit_capsJoinedOutputNotInputs() {
    List<Map<String, Object>> many = new ArrayList<>();
    for (int i = 0; i < 50; i++) many.add(row("cid", 1, "name", "n" + i));
    QueryResult t = transactional(many, "cid", "name");

    QueryResult r = HashJoin.join(spec(JoinType.INNER, "id", "cid", OptionalInt.of(5)), ids, t);
    assertEquals(5, r.rowCount());

    QueryResult full = HashJoin.join(spec(JoinType.FULL, "id", "cid", OptionalInt.of(2)),
        warehouse(List.of(row("id", 7), row("id", 8), row("id", 9)), "id"), customers);
    assertEquals(2, full.rowCount());
    assertEquals(8, full.rows().get(1).get("o_id"));
  }

  @Test
  void limitZero_isEmpty() {
    QueryResult r = HashJoin.join(spec(JoinType.FULL, "id", "cid", OptionalInt.of(0)), ids, customers);
    assertEquals(0, r.rowCount());
    assertTrue(r.columns().isEmpty());
  }

  @Test
  void emptyResult_hasNoColumns() {
    QueryResult r = HashJoin.join(spec(JoinType.INNER), ids, transactional(List.of(), "cid", "name"));
    assertTrue(r.rows().isEmpty());
    assertTrue(r.columns().isEmpty());
  }

  @Test
  void keys_matchAcrossTypesAndCase() {
    QueryResult w = warehouse(List.of(row("id", "ABC"), row("id", 10L), row("id", "2.5"), row("id", "1.10")), "id");
    QueryResult t = transactional(List.of(
        row("cid", "abc", "name", "letters"),
        row("cid", new BigDecimal("10.00"), "name", "ten"),
        row("cid", 2.5d, "name", "half"),
        row("cid", new BigDecimal("1.1"), "name", "unmatched")), "cid", "name");
    QueryResult r = HashJoin.join(spec(JoinType.INNER), w, t);
    // Text "1.10" is not reinterpreted as a number, so it misses 1.1.
    assertEquals(List.of("letters", "ten", "half"), r.rows().stream().map(m -> m.get("c_name")).toList());
  }

  @Test
  void nullKeys_collapseToEmptyString() {
    QueryResult w = warehouse(List.of(row("id", null)), "id");
    QueryResult t = transactional(List.of(row("cid", "", "name", "blank")), "cid", "name");
    QueryResult r = HashJoin.join(spec(JoinType.INNER), w, t);
    assertEquals(1, r.rowCount());
    assertEquals("blank", r.rows().get(0).get("c_name"));
  }

  @Test
  void joinColumn_resolvedCaseInsensitively() {
    QueryResult t = transactional(List.of(row("CID", 1, "name", "A")), "CID", "name");
    QueryResult r = HashJoin.join(spec(JoinType.INNER, "ID", "cid", OptionalInt.empty()), ids, t);
    assertEquals(1, r.rowCount());
    assertEquals(1, r.rows().get(0).get("c_CID"));
  }
}
