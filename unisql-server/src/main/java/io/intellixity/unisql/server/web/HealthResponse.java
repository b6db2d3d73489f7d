package io.intellixity.unisql.server.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.intellixity.unisql.federation.health.BackendHealth;
import io.intellixity.unisql.federation.health.HealthReport;

public record HealthResponse(String status, Backend redshift, Backend sqlserver) {

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Backend(boolean connected, String error) {
    static Backend of(BackendHealth h) {
      return new Backend(h.connected(), h.error());
    }
  }

  public static HealthResponse of(HealthReport report) {
    return new HealthResponse(report.status().wireName(),
        Backend.of(report.warehouse()),
        Backend.of(report.transactional()));
  }
}
