package io.intellixity.unisql.exec;

import io.intellixity.unisql.query.Source;

/** The backend could not be reached (connection refused, pool exhausted, client not configured). */
public final class BackendUnavailableException extends BackendException {
  public BackendUnavailableException(Source source, String message, Throwable cause) {
    super(source, message, cause);
  }

  public BackendUnavailableException(Source source, String message) {
    super(source, message, null);
  }
}
