package io.intellixity.unisql.server.web;

import io.intellixity.unisql.query.Source;
import io.intellixity.unisql.query.SourcePrefix;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record HelpResponse(String status, Map<String, Prefix> prefixes, List<String> notes) {
  public record Prefix(String prefix, String format, String example) {}

  static HelpResponse standard() {
    Map<String, Prefix> prefixes = new LinkedHashMap<>();
    prefixes.put(Source.WAREHOUSE.wireName(), prefix(SourcePrefix.WAREHOUSE, "SELECT * FROM rs.public.customers LIMIT 10"));
    prefixes.put(Source.TRANSACTIONAL.wireName(), prefix(SourcePrefix.TRANSACTIONAL, "SELECT TOP 10 * FROM ss.dbo.orders"));
    return new HelpResponse("success", prefixes, List.of(
        "Use rs. prefix for Redshift tables",
        "Use ss. prefix for SQL Server tables",
        "Queries without prefix default to SQL Server",
        "Cross-source JOINs are executed client-side"));
  }

  private static Prefix prefix(SourcePrefix p, String example) {
    return new Prefix(p.token() + ".", p.format(), example);
  }
}
