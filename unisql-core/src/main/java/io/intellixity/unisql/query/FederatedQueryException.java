package io.intellixity.unisql.query;

/** A cross-source join failed because one of its sub-queries failed. No partial rows are returned. */
public final class FederatedQueryException extends FederationException {
  public FederatedQueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
