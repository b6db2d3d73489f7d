package io.intellixity.unisql.server.web;

import io.intellixity.unisql.federation.QueryRouter;
import io.intellixity.unisql.federation.health.HealthProbe;
import io.intellixity.unisql.federation.schema.SchemaCatalog;
import io.intellixity.unisql.query.FederationException;
import io.intellixity.unisql.query.QueryResult;
import io.intellixity.unisql.query.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unified SQL surface: one execute endpoint for warehouse, transactional and cross-source queries, plus
 * schema browsing, cache administration, health and help.\n
 */
@RestController
@RequestMapping("/sqlv2")
public final class UnifiedSqlController {
  private static final Logger log = LoggerFactory.getLogger(UnifiedSqlController.class);

  static final String MISSING_QUERY = "Either 'query' or 'sql' must be provided";

  private final QueryRouter router;
  private final SchemaCatalog schemas;
  private final HealthProbe health;

  public UnifiedSqlController(QueryRouter router, SchemaCatalog schemas, HealthProbe health) {
    this.router = router;
    this.schemas = schemas;
    this.health = health;
  }

  /** {@code sql} is the legacy field name; {@code query} wins when both are present. */
  public record ExecuteQueryRequest(String query, String sql) {
    String text() {
      if (query != null && !query.isBlank()) return query;
      if (sql != null && !sql.isBlank()) return sql;
      return null;
    }
  }

  @PostMapping("/execute")
  public ResponseEntity<QueryResponse> execute(@RequestBody(required = false) ExecuteQueryRequest req) {
    String text = req == null ? null : req.text();
    if (text == null) return ResponseEntity.badRequest().body(QueryResponse.error(MISSING_QUERY));
    try {
      QueryResult r = router.execute(text);
      log.info("unisql.http op=EXECUTE source={} rows={} ms={}", r.source().wireName(), r.rowCount(), r.executionTimeMs());
      return ResponseEntity.ok(QueryResponse.success(r));
    } catch (FederationException | IllegalArgumentException e) {
      log.warn("unisql.http op=EXECUTE status=error error={}", e.getMessage());
      return ResponseEntity.badRequest().body(QueryResponse.error(message(e)));
    } catch (RuntimeException e) {
      log.error("unisql.http op=EXECUTE status=error", e);
      return ResponseEntity.badRequest().body(QueryResponse.error(message(e)));
    }
  }

  @GetMapping("/schema")
  public SchemaResponse schema(@RequestParam(name = "refresh", defaultValue = "false") boolean refresh) {
    Map<String, Map<String, List<String>>> byName = new LinkedHashMap<>();
    Map<String, SchemaResponse.Summary> summary = new LinkedHashMap<>();
    schemas.all(refresh).forEach((source, tables) -> {
      byName.put(source.wireName(), tables);
      summary.put(source.wireName(), new SchemaResponse.Summary(tables.size(), SchemaCatalog.tableCount(tables)));
    });
    return new SchemaResponse("success", byName, summary);
  }

  @GetMapping("/schema/cache")
  public Map<String, Object> cacheInfo() {
    Map<String, CacheInfoView> cache = new LinkedHashMap<>();
    for (Source s : schemas.sources()) cache.put(s.wireName(), CacheInfoView.of(schemas.info(s)));
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("status", "success");
    out.put("cache", cache);
    return out;
  }

  @DeleteMapping("/schema/cache")
  public ResponseEntity<Map<String, Object>> clearCache(@RequestParam(name = "source", required = false) String source) {
    Map<String, Object> out = new LinkedHashMap<>();
    try {
      List<Source> targets = source == null || source.isBlank() ? schemas.sources() : List.of(Source.fromWireName(source.trim()));
      Map<String, Boolean> cleared = new LinkedHashMap<>();
      for (Source s : targets) cleared.put(s.wireName(), schemas.clear(s));
      out.put("status", "success");
      out.put("cleared", cleared);
      return ResponseEntity.ok(out);
    } catch (IllegalArgumentException e) {
      out.put("status", "error");
      out.put("error", e.getMessage());
      return ResponseEntity.badRequest().body(out);
    }
  }

  @GetMapping("/health")
  public HealthResponse health() {
    return HealthResponse.of(health.check());
  }

  @GetMapping("/help")
  public HelpResponse help() {
    return HelpResponse.standard();
  }

  // Unreadable JSON on /execute still answers with the error shape.
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<QueryResponse> unreadable(HttpMessageNotReadableException e) {
    log.warn("unisql.http op=EXECUTE status=error error=unreadable body");
    return ResponseEntity.badRequest().body(QueryResponse.error("Malformed request body"));
  }

  private static String message(Throwable e) {
    return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
  }
}
