package io.intellixity.unisql.exec;

import io.intellixity.unisql.query.FederationException;
import io.intellixity.unisql.query.Source;

import java.util.Objects;

/** Failure attributed to one backend. */
public abstract class BackendException extends FederationException {
  private final Source source;

  protected BackendException(Source source, String message, Throwable cause) {
    super(message, cause);
    this.source = Objects.requireNonNull(source, "source");
  }

  public Source source() { return source; }
}
