package io.intellixity.unisql.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "unisql")
public class UnisqlProperties {
  private final Warehouse warehouse = new Warehouse();
  private final Transactional transactional = new Transactional();
  private final Federation federation = new Federation();
  private final Schema schema = new Schema();
  private final Health health = new Health();
  private final Startup startup = new Startup();

  public Warehouse getWarehouse() { return warehouse; }
  public Transactional getTransactional() { return transactional; }
  public Federation getFederation() { return federation; }
  public Schema getSchema() { return schema; }
  public Health getHealth() { return health; }
  public Startup getStartup() { return startup; }

  /** Redshift Data API connection. Blank keys fall back to the default AWS credential chain. */
  public static class Warehouse {
    private String region;
    private String endpoint;
    private String accessKey;
    private String secretKey;
    private String sessionToken;
    private String database;
    private String workgroupName;
    /** Provisioned clusters only; ignored when workgroupName is set. */
    private String clusterIdentifier;
    private Duration pollInterval = Duration.ofMillis(500);
    private Duration maxWait = Duration.ofSeconds(60);

    public String getRegion() { return region; }
    public void setRegion(String region) { this.region = region; }
    public String getEndpoint() { return endpoint; }
    public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
    public String getAccessKey() { return accessKey; }
    public void setAccessKey(String accessKey) { this.accessKey = accessKey; }
    public String getSecretKey() { return secretKey; }
    public void setSecretKey(String secretKey) { this.secretKey = secretKey; }
    public String getSessionToken() { return sessionToken; }
    public void setSessionToken(String sessionToken) { this.sessionToken = sessionToken; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }
    public String getWorkgroupName() { return workgroupName; }
    public void setWorkgroupName(String workgroupName) { this.workgroupName = workgroupName; }
    public String getClusterIdentifier() { return clusterIdentifier; }
    public void setClusterIdentifier(String clusterIdentifier) { this.clusterIdentifier = clusterIdentifier; }
    public Duration getPollInterval() { return pollInterval; }
    public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
    public Duration getMaxWait() { return maxWait; }
    public void setMaxWait(Duration maxWait) { this.maxWait = maxWait; }
  }

  public static class Transactional {
    private String jdbcUrl;
    private String username;
    private String password;
    private String schema = "dbo";
    private int maximumPoolSize = 30;
    private int minimumIdle = 10;
    private Duration idleTimeout = Duration.ofHours(1);
    private Duration connectionTimeout = Duration.ofMinutes(10);
    private Duration queryTimeout = Duration.ofHours(1);

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
    public int getMinimumIdle() { return minimumIdle; }
    public void setMinimumIdle(int minimumIdle) { this.minimumIdle = minimumIdle; }
    public Duration getIdleTimeout() { return idleTimeout; }
    public void setIdleTimeout(Duration idleTimeout) { this.idleTimeout = idleTimeout; }
    public Duration getConnectionTimeout() { return connectionTimeout; }
    public void setConnectionTimeout(Duration connectionTimeout) { this.connectionTimeout = connectionTimeout; }
    public Duration getQueryTimeout() { return queryTimeout; }
    public void setQueryTimeout(Duration queryTimeout) { this.queryTimeout = queryTimeout; }
  }

  public static class Federation {
    /** Threads that run the two sides of a cross-source join. */
    private int subQueryThreads = 8;
    /** Fail instead of dropping WHERE conditions that reference neither join alias. */
    private boolean rejectUnmatchedConjuncts;

    public int getSubQueryThreads() { return subQueryThreads; }
    public void setSubQueryThreads(int subQueryThreads) { this.subQueryThreads = subQueryThreads; }
    public boolean isRejectUnmatchedConjuncts() { return rejectUnmatchedConjuncts; }
    public void setRejectUnmatchedConjuncts(boolean rejectUnmatchedConjuncts) { this.rejectUnmatchedConjuncts = rejectUnmatchedConjuncts; }
  }

  public static class Schema {
    private Duration cacheTtl = Duration.ofDays(30);

    public Duration getCacheTtl() { return cacheTtl; }
    public void setCacheTtl(Duration cacheTtl) { this.cacheTtl = cacheTtl; }
  }

  /** Probes get their own threads so a dead backend cannot starve federated sub-queries. */
  public static class Health {
    private int probeThreads = 4;
    private Duration probeTimeout = Duration.ofSeconds(15);

    public int getProbeThreads() { return probeThreads; }
    public void setProbeThreads(int probeThreads) { this.probeThreads = probeThreads; }
    public Duration getProbeTimeout() { return probeTimeout; }
    public void setProbeTimeout(Duration probeTimeout) { this.probeTimeout = probeTimeout; }
  }

  public static class Startup {
    private boolean probeEnabled = true;
    private int probeAttempts = 50;
    private Duration probeBackoff = Duration.ofMillis(100);

    public boolean isProbeEnabled() { return probeEnabled; }
    public void setProbeEnabled(boolean probeEnabled) { this.probeEnabled = probeEnabled; }
    public int getProbeAttempts() { return probeAttempts; }
    public void setProbeAttempts(int probeAttempts) { this.probeAttempts = probeAttempts; }
    public Duration getProbeBackoff() { return probeBackoff; }
    public void setProbeBackoff(Duration probeBackoff) { this.probeBackoff = probeBackoff; }
  }
}
