package io.intellixity.unisql.federation;

import io.intellixity.unisql.exec.BackendDriver;
import io.intellixity.unisql.federation.join.FederatedJoinExecutor;
import io.intellixity.unisql.federation.parse.CrossSourceJoinParser;
import io.intellixity.unisql.query.QueryResult;
import io.intellixity.unisql.query.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point of the federation path: classify, then either rewrite and run on one backend, or parse and
 * run as a cross-source join.\n
 *
 * Failures propagate unchanged; there is no retry and no fallback from cross-source to single-source.\n
 */
public final class QueryRouter {
  private static final Logger log = LoggerFactory.getLogger(QueryRouter.class);

  private final BackendDriver<?> warehouse;
  private final BackendDriver<?> transactional;
  private final QueryClassifier classifier;
  private final IdentifierRewriter rewriter;
  private final CrossSourceJoinParser parser;
  private final FederatedJoinExecutor joinExecutor;

  public QueryRouter(BackendDriver<?> warehouse,
                     BackendDriver<?> transactional,
                     QueryClassifier classifier,
                     IdentifierRewriter rewriter,
                     CrossSourceJoinParser parser,
                     FederatedJoinExecutor joinExecutor) {
    this.warehouse = Objects.requireNonNull(warehouse, "warehouse");
    this.transactional = Objects.requireNonNull(transactional, "transactional");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.rewriter = Objects.requireNonNull(rewriter, "rewriter");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.joinExecutor = Objects.requireNonNull(joinExecutor, "joinExecutor");
  }

  /** Decide where a query goes without running it. */
  public RoutedQuery route(String sql) {
    Objects.requireNonNull(sql, "sql");
    if (sql.isBlank()) throw new IllegalArgumentException("sql is blank");
    QueryClassification c = classifier.classify(sql);
    RoutedQuery routed = switch (c) {
      case CROSS -> RoutedQuery.cross(parser.parse(sql));
      case WAREHOUSE -> RoutedQuery.single(c, Source.WAREHOUSE, rewriter.rewrite(sql, Source.WAREHOUSE));
      case TRANSACTIONAL -> RoutedQuery.single(c, Source.TRANSACTIONAL, rewriter.rewrite(sql, Source.TRANSACTIONAL));
      case UNPREFIXED -> RoutedQuery.single(c, classifier.guessUnprefixed(sql), sql);
    };
    log.debug("unisql.router op=ROUTE classification={} target={}", c, routed.target().wireName());
    return routed;
  }

  public QueryResult execute(String sql) {
    long start = System.nanoTime();
    RoutedQuery routed = route(sql);
    return switch (routed.target()) {
      case CROSS -> joinExecutor.execute(routed.join()).withExecutionTimeMs((System.nanoTime() - start) / 1_000_000);
      case WAREHOUSE -> warehouse.executeQuery(routed.backendSql());
      case TRANSACTIONAL -> transactional.executeQuery(routed.backendSql());
    };
  }
}
