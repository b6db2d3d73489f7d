package io.intellixity.unisql.redshift;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.SdkClientException;
import com.amazonaws.services.redshiftdataapi.AWSRedshiftDataAPI;
import com.amazonaws.services.redshiftdataapi.model.DescribeStatementRequest;
import com.amazonaws.services.redshiftdataapi.model.DescribeStatementResult;
import com.amazonaws.services.redshiftdataapi.model.ExecuteStatementRequest;
import com.amazonaws.services.redshiftdataapi.model.ExecuteStatementResult;
import com.amazonaws.services.redshiftdataapi.model.Field;
import com.amazonaws.services.redshiftdataapi.model.GetStatementResultRequest;
import com.amazonaws.services.redshiftdataapi.model.GetStatementResultResult;
import com.amazonaws.services.redshiftdataapi.model.ListTablesRequest;
import com.amazonaws.services.redshiftdataapi.model.ListTablesResult;
import com.amazonaws.services.redshiftdataapi.model.TableMember;
import io.intellixity.unisql.exec.BackendQueryException;
import io.intellixity.unisql.exec.BackendUnavailableException;
import io.intellixity.unisql.exec.StatementDescription;
import io.intellixity.unisql.exec.StatementHandle;
import io.intellixity.unisql.exec.StatementStatus;
import io.intellixity.unisql.exec.WarehouseDriver;
import io.intellixity.unisql.query.FederationException;
import io.intellixity.unisql.query.QueryResult;
import io.intellixity.unisql.query.Source;
import io.intellixity.unisql.spi.exec.AbstractBackendDriver;
import io.intellixity.unisql.spi.exec.PollingOptions;
import io.intellixity.unisql.spi.exec.StatementPoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Warehouse driver over the Redshift Data API.\n
 *
 * {@link #executeQuery(String)} is submit, poll until terminal, then one paged fetch.
 * Statements without a result set skip the fetch and report the backend's affected-row count.\n
 */
public final class RedshiftDataDriver extends AbstractBackendDriver<RedshiftHandle> implements WarehouseDriver<RedshiftHandle> {
  private static final Logger log = LoggerFactory.getLogger(RedshiftDataDriver.class);

  static final Duration PROBE_MAX_WAIT = Duration.ofSeconds(10);
  private static final Set<String> SYSTEM_SCHEMAS = Set.of("pg_catalog", "information_schema", "pg_internal");
  private static final String SYSTEM_TABLE = "SYSTEM TABLE";

  private final AWSRedshiftDataAPI client;
  private final StatementPoller poller;

  public RedshiftDataDriver(RedshiftHandle handle, PollingOptions options) {
    this(handle, new StatementPoller(Source.WAREHOUSE, Objects.requireNonNull(options, "options")));
  }

  public RedshiftDataDriver(RedshiftHandle handle, StatementPoller poller) {
    super(Objects.requireNonNull(handle, "handle"), Source.WAREHOUSE);
    this.client = handle.client();
    this.poller = Objects.requireNonNull(poller, "poller");
  }

  @Override
  public StatementHandle submitStatement(String sql) {
    Objects.requireNonNull(sql, "sql");
    ExecuteStatementRequest req = new ExecuteStatementRequest()
        .withSql(sql)
        .withDatabase(handle().database());
    if (handle().workgroupName() != null) req.withWorkgroupName(handle().workgroupName());
    else req.withClusterIdentifier(handle().clusterIdentifier());

    ExecuteStatementResult res = call(() -> client.executeStatement(req));
    if (res == null || res.getId() == null || res.getId().isBlank()) {
      throw new BackendQueryException(Source.WAREHOUSE, "Redshift query error: Failed to execute statement");
    }
    log.debug("unisql.redshift_submit statementId={}", res.getId());
    return new StatementHandle(res.getId());
  }

  @Override
  public StatementDescription pollStatus(StatementHandle handle) {
    Objects.requireNonNull(handle, "handle");
    DescribeStatementResult r = call(() -> client.describeStatement(new DescribeStatementRequest().withId(handle.id())));
    return switch (status(r.getStatus())) {
      // A missing hasResultSet flag means the service did not say; try the fetch.
      case FINISHED -> StatementDescription.finished(
          !Boolean.FALSE.equals(r.getHasResultSet()),
          r.getResultRows() == null ? -1 : r.getResultRows());
      case FAILED -> StatementDescription.failed(r.getError());
      case ABORTED -> StatementDescription.aborted();
      case RUNNING -> StatementDescription.running();
    };
  }

  @Override
  public QueryResult fetchResult(StatementHandle handle) {
    Objects.requireNonNull(handle, "handle");
    handle.claimFetch();

    List<String> columns = null;
    List<Map<String, Object>> rows = new ArrayList<>();
    long total = 0;
    String nextToken = null;
    int pages = 0;
    do {
      GetStatementResultRequest req = new GetStatementResultRequest().withId(handle.id()).withNextToken(nextToken);
      GetStatementResultResult page = call(() -> client.getStatementResult(req));
      pages++;
      if (columns == null) columns = RedshiftFields.columns(page.getColumnMetadata());
      if (page.getRecords() != null) {
        for (List<Field> record : page.getRecords()) rows.add(RedshiftFields.row(columns, record));
      }
      if (page.getTotalNumRows() != null) total = page.getTotalNumRows();
      nextToken = page.getNextToken();
    } while (nextToken != null && !nextToken.isEmpty());

    log.debug("unisql.redshift_fetch statementId={} pages={} rows={}", handle.id(), pages, rows.size());
    long rowCount = total > 0 ? total : rows.size();
    return new QueryResult(columns, rows, rowCount, 0, Source.WAREHOUSE);
  }

  /** Poll a submitted statement until it is terminal, bounded by the given wait instead of the configured one. */
  public StatementDescription awaitCompletion(StatementHandle handle, Duration maxWait) {
    return poller.await(handle, this::pollStatus, maxWait);
  }

  @Override
  protected QueryResult doExecute(String sql) {
    StatementHandle h = submitStatement(sql);
    StatementDescription d = poller.await(h, this::pollStatus);
    if (!d.hasResultSet()) return QueryResult.affected(d.resultRows(), Source.WAREHOUSE);
    return fetchResult(h);
  }

  @Override
  protected Map<String, List<String>> doListTables() {
    Map<String, TreeSet<String>> bySchema = new LinkedHashMap<>();
    String nextToken = null;
    do {
      ListTablesRequest req = new ListTablesRequest()
          .withDatabase(handle().database())
          .withNextToken(nextToken);
      if (handle().workgroupName() != null) req.withWorkgroupName(handle().workgroupName());
      else req.withClusterIdentifier(handle().clusterIdentifier());

      ListTablesResult page = call(() -> client.listTables(req));
      if (page.getTables() != null) {
        for (TableMember t : page.getTables()) {
          if (t.getSchema() == null || t.getName() == null) continue;
          if (SYSTEM_SCHEMAS.contains(t.getSchema())) continue;
          if (SYSTEM_TABLE.equals(t.getType())) continue;
          bySchema.computeIfAbsent(t.getSchema(), k -> new TreeSet<>()).add(t.getName());
        }
      }
      nextToken = page.getNextToken();
    } while (nextToken != null && !nextToken.isEmpty());

    Map<String, List<String>> out = new LinkedHashMap<>();
    bySchema.forEach((schema, tables) -> out.put(schema, new ArrayList<>(tables)));
    return out;
  }

  @Override
  protected void doProbe() {
    StatementHandle h = submitStatement("SELECT 1");
    Duration wait = poller.options().maxWait().compareTo(PROBE_MAX_WAIT) < 0 ? poller.options().maxWait() : PROBE_MAX_WAIT;
    awaitCompletion(h, wait);
  }

  static StatementStatus status(String raw) {
    if (raw == null) return StatementStatus.RUNNING;
    return switch (raw) {
      case "FINISHED" -> StatementStatus.FINISHED;
      case "FAILED" -> StatementStatus.FAILED;
      case "ABORTED" -> StatementStatus.ABORTED;
      // SUBMITTED, PICKED, STARTED and anything newer
      default -> StatementStatus.RUNNING;
    };
  }

  private static <T> T call(Supplier<T> op) {
    try {
      return op.get();
    } catch (AmazonServiceException e) {
      throw translate(e);
    } catch (SdkClientException e) {
      throw new BackendUnavailableException(Source.WAREHOUSE, "Redshift unavailable: " + messageOf(e), e);
    }
  }

  static FederationException translate(AmazonServiceException e) {
    String msg = e.getErrorMessage() != null ? e.getErrorMessage() : messageOf(e);
    if (e.getStatusCode() >= 500) {
      return new BackendUnavailableException(Source.WAREHOUSE, "Redshift unavailable: " + msg, e);
    }
    return new BackendQueryException(Source.WAREHOUSE, "Redshift query error: " + msg, e);
  }

  private static String messageOf(Exception e) {
    return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
  }
}
