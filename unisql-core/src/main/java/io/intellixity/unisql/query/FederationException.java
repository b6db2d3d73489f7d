package io.intellixity.unisql.query;

/**
 * Root of every failure the query path can raise.\n
 *
 * All subclasses are client-correctable query errors from the HTTP layer's point of view.\n
 */
public abstract class FederationException extends RuntimeException {
  protected FederationException(String message) {
    super(message);
  }

  protected FederationException(String message, Throwable cause) {
    super(message, cause);
  }
}
