package io.intellixity.unisql.server.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.intellixity.unisql.query.QueryResult;
import io.intellixity.unisql.query.Source;

import java.util.List;
import java.util.Map;

/** Body of POST /sqlv2/execute. Success carries source and message, failure carries error. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryResponse(String status,
                            List<String> columns,
                            List<Map<String, Object>> rows,
                            @JsonProperty("row_count") long rowCount,
                            @JsonProperty("execution_time") long executionTime,
                            Source source,
                            String message,
                            String error) {

  public static QueryResponse success(QueryResult r) {
    return new QueryResponse("success", r.columns(), r.rows(), r.rowCount(), r.executionTimeMs(), r.source(),
        "Query executed successfully (" + r.rowCount() + " rows from " + r.source().wireName() + ")", null);
  }

  public static QueryResponse error(String error) {
    return new QueryResponse("error", List.of(), List.of(), 0, 0, null, null, error);
  }
}
