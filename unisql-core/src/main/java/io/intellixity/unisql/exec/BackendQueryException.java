package io.intellixity.unisql.exec;

import io.intellixity.unisql.query.Source;

/** The backend accepted the connection but rejected or failed the statement. */
public class BackendQueryException extends BackendException {
  public BackendQueryException(Source source, String message, Throwable cause) {
    super(source, message, cause);
  }

  public BackendQueryException(Source source, String message) {
    super(source, message, null);
  }
}
