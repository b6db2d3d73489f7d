package io.intellixity.unisql.federation.parse;

import io.intellixity.unisql.query.QueryParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PredicateSplitterTest {
  private final PredicateSplitter splitter = new PredicateSplitter();

  @Test
  void splitsByAliasAndStripsPrefix() {
    PredicateSplitter.Split s = splitter.split("o.status = 'open' and c.active = 1 AND o.total >= 10", "o", "c");
    assertEquals(List.of("status = 'open'", "total >= 10"), s.left());
    assertEquals(List.of("active = 1"), s.right());
    assertTrue(s.unmatched().isEmpty());
  }

  @Test
  void aliasMatch_isCaseInsensitiveAndWordBounded() {
    PredicateSplitter.Split s = splitter.split("O.id = 1 AND co.id = 2 AND C.id = 3", "o", "c");
    assertEquals(List.of("id = 1"), s.left());
    assertEquals(List.of("id = 3"), s.right());
    assertEquals(List.of("co.id = 2"), s.unmatched());
  }

  @Test
  void unmatchedConjuncts_areDroppedByDefault() {
    PredicateSplitter.Split s = splitter.split("1 = 1 AND o.id = 5", "o", "c");
    assertEquals(List.of("id = 5"), s.left());
    assertTrue(s.right().isEmpty());
    assertEquals(List.of("1 = 1"), s.unmatched());
  }

  @Test
  void unmatchedConjuncts_failUnderRejectPolicy() {
    PredicateSplitter strict = new PredicateSplitter(UnmatchedConjunctPolicy.REJECT);
    QueryParseException ex = assertThrows(QueryParseException.class, () -> strict.split("typo.id = 5", "o", "c"));
    assertTrue(ex.getMessage().contains("'typo.id = 5' references neither o nor c"));
  }

  @Test
  void conjunctOverBothTables_cannotBePushedDown() {
    assertThrows(QueryParseException.class, () -> splitter.split("o.region = c.region", "o", "c"));
  }

  @Test
  void emptyClause_yieldsNothing() {
    PredicateSplitter.Split s = splitter.split(null, "o", "c");
    assertTrue(s.left().isEmpty());
    assertTrue(s.right().isEmpty());
    assertTrue(splitter.split("   ", "o", "c").left().isEmpty());
  }

  @Test
  void splitIsLiteral_noBooleanStructure() {
    // BETWEEN's AND splits the range, which is the documented limitation
    PredicateSplitter.Split s = splitter.split("o.total BETWEEN 1 AND 5", "o", "c");
    assertEquals(List.of("total BETWEEN 1"), s.left());
    assertEquals(List.of("5"), s.unmatched());
  }
}
