package io.intellixity.unisql.redshift;

import com.amazonaws.services.redshiftdataapi.AWSRedshiftDataAPI;
import io.intellixity.unisql.exec.handle.EngineHandle;

import java.util.Objects;

/**
 * Redshift Data API engine handle.\n
 *
 * Exactly one of workgroupName (Serverless) or clusterIdentifier (provisioned) addresses the warehouse.\n
 */
public final class RedshiftHandle implements EngineHandle<AWSRedshiftDataAPI> {
  private final String id;
  private final AWSRedshiftDataAPI client;
  private final String database;
  private final String workgroupName;
  private final String clusterIdentifier;

  public RedshiftHandle(String id, AWSRedshiftDataAPI client, String database, String workgroupName, String clusterIdentifier) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.database = Objects.requireNonNull(database, "database");
    this.workgroupName = blankToNull(workgroupName);
    this.clusterIdentifier = blankToNull(clusterIdentifier);
    if (this.workgroupName == null && this.clusterIdentifier == null) {
      throw new IllegalArgumentException("Either workgroupName or clusterIdentifier is required");
    }
  }

  /** Serverless workgroup handle. */
  public static RedshiftHandle serverless(String id, AWSRedshiftDataAPI client, String database, String workgroupName) {
    return new RedshiftHandle(id, client, database, workgroupName, null);
  }

  @Override public String id() { return id; }
  @Override public AWSRedshiftDataAPI client() { return client; }
  @Override public String namespace() { return database; }

  public String database() { return database; }
  public String workgroupName() { return workgroupName; }
  public String clusterIdentifier() { return clusterIdentifier; }

  private static String blankToNull(String s) {
    return (s == null || s.isBlank()) ? null : s;
  }
}
