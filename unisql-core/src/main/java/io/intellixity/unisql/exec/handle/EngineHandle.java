package io.intellixity.unisql.exec.handle;

/**
 * Process-wide handle on one backend's native client, built once at startup and shared by every request.\n
 *
 * Example:\n
 * - SQL Server: client() is the pooled javax.sql.DataSource, namespace() is the default schema\n
 * - Redshift: client() is AWSRedshiftDataAPI, namespace() is the database\n
 */
public interface EngineHandle<TClient> {
  String id();

  TClient client();

  /** Default schema or database; may be null. */
  String namespace();

  /** Short form for log lines: {@code id} or {@code id/namespace}. */
  default String label() {
    String ns = namespace();
    return ns == null ? id() : id() + "/" + ns;
  }
}
