package io.intellixity.unisql.federation.health;

public enum ConnectivityStatus {
  CONNECTED("connected"),
  PARTIAL("partial"),
  DISCONNECTED("disconnected");

  private final String wireName;

  ConnectivityStatus(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() { return wireName; }

  static ConnectivityStatus of(boolean warehouse, boolean transactional) {
    if (warehouse && transactional) return CONNECTED;
    if (warehouse || transactional) return PARTIAL;
    return DISCONNECTED;
  }
}
