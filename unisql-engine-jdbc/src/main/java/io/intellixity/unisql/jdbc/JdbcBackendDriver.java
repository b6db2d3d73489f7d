package io.intellixity.unisql.jdbc;

import io.intellixity.unisql.exec.BackendQueryException;
import io.intellixity.unisql.exec.BackendUnavailableException;
import io.intellixity.unisql.jdbc.dialect.JdbcDialect;
import io.intellixity.unisql.query.FederationException;
import io.intellixity.unisql.query.QueryResult;
import io.intellixity.unisql.query.Source;
import io.intellixity.unisql.spi.exec.AbstractBackendDriver;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Synchronous driver for the transactional backend.\n
 *
 * Each call borrows one connection from the shared pool and returns it before the call completes.
 * Borrowing may queue behind concurrent requests; the pool's connection timeout bounds the wait.\n
 */
public final class JdbcBackendDriver extends AbstractBackendDriver<JdbcHandle> {
  private final javax.sql.DataSource ds;
  private final JdbcDialect dialect;
  private final Duration queryTimeout;

  public JdbcBackendDriver(JdbcHandle handle, JdbcDialect dialect, Duration queryTimeout) {
    super(Objects.requireNonNull(handle, "handle"), Source.TRANSACTIONAL);
    this.ds = handle.client();
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.queryTimeout = queryTimeout;
  }

  @Override
  protected QueryResult doExecute(String sql) {
    try (Connection c = borrow(); Statement st = c.createStatement()) {
      applyTimeout(st);
      boolean isResultSet = st.execute(sql);
      long firstUpdateCount = -1;
      while (true) {
        if (isResultSet) {
          try (ResultSet rs = st.getResultSet()) {
            JdbcResultReader.Materialized m = JdbcResultReader.read(rs);
            return QueryResult.of(m.columns(), m.rows(), Source.TRANSACTIONAL);
          }
        }
        int uc = st.getUpdateCount();
        if (uc == -1) break;
        if (firstUpdateCount < 0) firstUpdateCount = uc;
        isResultSet = st.getMoreResults();
      }
      return QueryResult.affected(firstUpdateCount, Source.TRANSACTIONAL);
    } catch (SQLException e) {
      throw translate(e);
    }
  }

  @Override
  protected Map<String, List<String>> doListTables() {
    try (Connection c = borrow();
         Statement st = c.createStatement();
         ResultSet rs = st.executeQuery(dialect.tableCatalogSql())) {
      Map<String, List<String>> out = new LinkedHashMap<>();
      while (rs.next()) {
        String schema = rs.getString("schema_name");
        String table = rs.getString("table_name");
        if (schema == null || table == null) continue;
        out.computeIfAbsent(schema, k -> new ArrayList<>()).add(table);
      }
      return out;
    } catch (SQLException e) {
      throw translate(e);
    }
  }

  @Override
  protected void doProbe() {
    try (Connection c = borrow(); Statement st = c.createStatement()) {
      applyTimeout(st);
      st.execute(dialect.probeSql());
    } catch (SQLException e) {
      throw translate(e);
    }
  }

  private Connection borrow() throws SQLException {
    return ds.getConnection();
  }

  private void applyTimeout(Statement st) throws SQLException {
    if (queryTimeout == null || queryTimeout.isZero() || queryTimeout.isNegative()) return;
    st.setQueryTimeout((int) Math.min(Integer.MAX_VALUE, Math.max(1, queryTimeout.toSeconds())));
  }

  private FederationException translate(SQLException e) {
    String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    if (isConnectivity(e)) {
      return new BackendUnavailableException(Source.TRANSACTIONAL, dialect.displayName() + " unavailable: " + msg, e);
    }
    return new BackendQueryException(Source.TRANSACTIONAL, dialect.displayName() + " query error: " + msg, e);
  }

  static boolean isConnectivity(SQLException e) {
    if (e instanceof SQLTransientConnectionException || e instanceof SQLNonTransientConnectionException) return true;
    String state = e.getSQLState();
    return state != null && state.startsWith("08");
  }
}
