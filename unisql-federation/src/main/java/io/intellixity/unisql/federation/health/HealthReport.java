package io.intellixity.unisql.federation.health;

import java.util.Objects;

public record HealthReport(BackendHealth warehouse, BackendHealth transactional) {
  public HealthReport {
    Objects.requireNonNull(warehouse, "warehouse");
    Objects.requireNonNull(transactional, "transactional");
  }

  public ConnectivityStatus status() {
    return ConnectivityStatus.of(warehouse.connected(), transactional.connected());
  }
}
