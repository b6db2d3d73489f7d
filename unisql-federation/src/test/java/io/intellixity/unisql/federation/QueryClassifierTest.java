package io.intellixity.unisql.federation;

import io.intellixity.unisql.query.Source;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class QueryClassifierTest {
  private final QueryClassifier classifier = new QueryClassifier();

  @Test
  void warehousePrefixOnly() {
    assertEquals(QueryClassification.WAREHOUSE, classifier.classify("SELECT * FROM rs.public.orders LIMIT 10"));
    assertEquals(QueryClassification.WAREHOUSE, classifier.classify("select count(*) from RS.Sales.Daily_2024"));
  }

  @Test
  void transactionalPrefix_bracketedOrNot() {
    assertEquals(QueryClassification.TRANSACTIONAL, classifier.classify("SELECT TOP 5 * FROM ss.[dbo].customers"));
    assertEquals(QueryClassification.TRANSACTIONAL, classifier.classify("SELECT * FROM ss.dbo.customers"));
    assertEquals(QueryClassification.TRANSACTIONAL, classifier.classify("SELECT * FROM ss.[My Schema].customers"));
  }

  @Test
  void bothPrefixes_areCross() {
    assertEquals(QueryClassification.CROSS, classifier.classify(
        "SELECT * FROM rs.public.orders o JOIN ss.[dbo].customers c ON o.customer_id = c.id"));
  }

  @Test
  void noPrefix_isUnprefixed() {
    assertEquals(QueryClassification.UNPREFIXED, classifier.classify("SELECT * FROM public.orders"));
    // a two-part reference is not a prefixed table
    assertEquals(QueryClassification.UNPREFIXED, classifier.classify("SELECT rs.id FROM orders rs"));
    // prefix must start a word
    assertEquals(QueryClassification.UNPREFIXED, classifier.classify("SELECT * FROM xrs.public.orders"));
  }

  @Test
  void prefixInsideLiteral_stillCounts() {
    assertEquals(QueryClassification.WAREHOUSE, classifier.classify("SELECT 'rs.public.orders' AS label"));
  }

  @Test
  void unprefixedGuess() {
    assertEquals(Source.WAREHOUSE, classifier.guessUnprefixed("SELECT * FROM orders LIMIT 5"));
    assertEquals(Source.TRANSACTIONAL, classifier.guessUnprefixed("SELECT TOP 5 * FROM orders"));
    assertEquals(Source.TRANSACTIONAL, classifier.guessUnprefixed("SELECT * FROM [dbo].[orders]"));
    assertEquals(Source.TRANSACTIONAL, classifier.guessUnprefixed("SELECT 1"));
    assertEquals(Source.TRANSACTIONAL, classifier.guessUnprefixed("SELECT TOP 1 * FROM t LIMIT 5"));
  }
}
