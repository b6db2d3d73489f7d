package io.intellixity.unisql.server.config;

import com.amazonaws.services.redshiftdataapi.AWSRedshiftDataAPI;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.unisql.federation.IdentifierRewriter;
import io.intellixity.unisql.federation.QueryClassifier;
import io.intellixity.unisql.federation.QueryRouter;
import io.intellixity.unisql.federation.health.HealthProbe;
import io.intellixity.unisql.federation.join.FederatedJoinExecutor;
import io.intellixity.unisql.federation.parse.CrossSourceJoinParser;
import io.intellixity.unisql.federation.parse.PredicateSplitter;
import io.intellixity.unisql.federation.parse.UnmatchedConjunctPolicy;
import io.intellixity.unisql.federation.schema.SchemaCatalog;
import io.intellixity.unisql.jdbc.JdbcBackendDriver;
import io.intellixity.unisql.jdbc.JdbcHandle;
import io.intellixity.unisql.jdbc.JdbcPoolSettings;
import io.intellixity.unisql.jdbc.JdbcPools;
import io.intellixity.unisql.jdbc.sqlserver.SqlServerDialect;
import io.intellixity.unisql.redshift.RedshiftClientConfig;
import io.intellixity.unisql.redshift.RedshiftDataDriver;
import io.intellixity.unisql.redshift.RedshiftHandle;
import io.intellixity.unisql.spi.exec.PollingOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(UnisqlProperties.class)
public class UnisqlConfig {
  private static final Logger log = LoggerFactory.getLogger(UnisqlConfig.class);

  @Bean(destroyMethod = "close")
  public HikariDataSource transactionalPool(UnisqlProperties props) {
    UnisqlProperties.Transactional t = props.getTransactional();
    if (t.getJdbcUrl() == null || t.getJdbcUrl().isBlank()) {
      throw new IllegalStateException("Missing unisql.transactional.jdbc-url");
    }
    return JdbcPools.create(new JdbcPoolSettings(
        "unisql-sqlserver",
        t.getJdbcUrl(),
        t.getUsername(),
        t.getPassword(),
        t.getMaximumPoolSize(),
        t.getMinimumIdle(),
        t.getIdleTimeout(),
        t.getConnectionTimeout()));
  }

  @Bean
  public JdbcBackendDriver transactionalDriver(HikariDataSource transactionalPool, UnisqlProperties props) {
    UnisqlProperties.Transactional t = props.getTransactional();
    JdbcHandle handle = new JdbcHandle("sqlserver", transactionalPool, t.getSchema());
    return new JdbcBackendDriver(handle, new SqlServerDialect(), t.getQueryTimeout());
  }

  @Bean(destroyMethod = "shutdown")
  public AWSRedshiftDataAPI redshiftDataClient(UnisqlProperties props) {
    UnisqlProperties.Warehouse w = props.getWarehouse();
    RedshiftClientConfig cfg = new RedshiftClientConfig(w.getEndpoint(), w.getRegion());
    cfg.setCredentials(w.getAccessKey(), w.getSecretKey(), w.getSessionToken());
    log.info("unisql.config op=REDSHIFT_CLIENT {}", cfg);
    return cfg.buildClient();
  }

  @Bean
  public RedshiftDataDriver warehouseDriver(AWSRedshiftDataAPI redshiftDataClient, UnisqlProperties props) {
    UnisqlProperties.Warehouse w = props.getWarehouse();
    String workgroup = w.getWorkgroupName() == null || w.getWorkgroupName().isBlank() ? null : w.getWorkgroupName();
    RedshiftHandle handle = new RedshiftHandle("redshift", redshiftDataClient, w.getDatabase(), workgroup,
        workgroup == null ? w.getClusterIdentifier() : null);
    return new RedshiftDataDriver(handle, new PollingOptions(w.getPollInterval(), w.getMaxWait()));
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService federationExecutor(UnisqlProperties props) {
    return fixedDaemonPool("unisql-federation-", props.getFederation().getSubQueryThreads());
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService probeExecutor(UnisqlProperties props) {
    return fixedDaemonPool("unisql-probe-", props.getHealth().getProbeThreads());
  }

  private static ExecutorService fixedDaemonPool(String prefix, int threads) {
    AtomicInteger seq = new AtomicInteger();
    return Executors.newFixedThreadPool(threads, r -> {
      Thread th = new Thread(r, prefix + seq.incrementAndGet());
      th.setDaemon(true);
      return th;
    });
  }

  @Bean
  public CrossSourceJoinParser crossSourceJoinParser(UnisqlProperties props) {
    UnmatchedConjunctPolicy policy = props.getFederation().isRejectUnmatchedConjuncts()
        ? UnmatchedConjunctPolicy.REJECT
        : UnmatchedConjunctPolicy.DROP;
    return new CrossSourceJoinParser(new PredicateSplitter(policy));
  }

  @Bean
  public FederatedJoinExecutor federatedJoinExecutor(RedshiftDataDriver warehouseDriver,
                                                     JdbcBackendDriver transactionalDriver,
                                                     @Qualifier("federationExecutor") ExecutorService federationExecutor) {
    return new FederatedJoinExecutor(warehouseDriver, transactionalDriver, federationExecutor);
  }

  @Bean
  public QueryRouter queryRouter(RedshiftDataDriver warehouseDriver,
                                 JdbcBackendDriver transactionalDriver,
                                 CrossSourceJoinParser crossSourceJoinParser,
                                 FederatedJoinExecutor federatedJoinExecutor) {
    return new QueryRouter(warehouseDriver, transactionalDriver, new QueryClassifier(), new IdentifierRewriter(),
        crossSourceJoinParser, federatedJoinExecutor);
  }

  @Bean
  public SchemaCatalog schemaCatalog(RedshiftDataDriver warehouseDriver,
                                     JdbcBackendDriver transactionalDriver,
                                     UnisqlProperties props) {
    return new SchemaCatalog(warehouseDriver, transactionalDriver, props.getSchema().getCacheTtl());
  }

  @Bean
  public HealthProbe healthProbe(RedshiftDataDriver warehouseDriver,
                                 JdbcBackendDriver transactionalDriver,
                                 @Qualifier("probeExecutor") ExecutorService probeExecutor,
                                 UnisqlProperties props) {
    return new HealthProbe(warehouseDriver, transactionalDriver, probeExecutor, props.getHealth().getProbeTimeout());
  }
}
