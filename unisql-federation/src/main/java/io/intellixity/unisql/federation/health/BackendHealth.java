package io.intellixity.unisql.federation.health;

/** Probe outcome for one backend; error is null when connected. */
public record BackendHealth(boolean connected, String error) {
  public static BackendHealth up() {
    return new BackendHealth(true, null);
  }

  public static BackendHealth down(String error) {
    return new BackendHealth(false, error);
  }
}
