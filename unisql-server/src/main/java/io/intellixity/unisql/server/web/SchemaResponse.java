package io.intellixity.unisql.server.web;

import java.util.List;
import java.util.Map;

/** Body of GET /sqlv2/schema, keyed by source wire name. */
public record SchemaResponse(String status,
                             Map<String, Map<String, List<String>>> schemas,
                             Map<String, Summary> summary) {
  public record Summary(int schemas, int tables) {}
}
