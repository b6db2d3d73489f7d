package io.intellixity.unisql.redshift;

import com.amazonaws.ClientConfiguration;
import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.auth.BasicSessionCredentials;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.client.builder.AwsClientBuilder;
import com.amazonaws.services.redshiftdataapi.AWSRedshiftDataAPI;
import com.amazonaws.services.redshiftdataapi.AWSRedshiftDataAPIClientBuilder;

/**
 * Connection settings for the Data API client.\n
 *
 * Without explicit keys the default provider chain is used (env, profile, instance role).\n
 */
public final class RedshiftClientConfig {
  private String endpoint;
  private String region;
  private String accessKey;
  private String secretKey;
  private String sessionToken;

  public RedshiftClientConfig() {}

  public RedshiftClientConfig(String endpoint, String region) {
    this.endpoint = endpoint;
    this.region = region;
  }

  public String getEndpoint() { return endpoint; }
  public void setEndpoint(String endpoint) { this.endpoint = blankToNull(endpoint); }

  public String getRegion() { return region; }
  public void setRegion(String region) { this.region = blankToNull(region); }

  public String getAccessKey() { return accessKey; }
  public String getSecretKey() { return secretKey; }
  public String getSessionToken() { return sessionToken; }

  public void setCredentials(String accessKey, String secretKey, String sessionToken) {
    accessKey = blankToNull(accessKey);
    secretKey = blankToNull(secretKey);
    if (accessKey == null ^ secretKey == null) {
      throw new IllegalArgumentException("AWS access and secret keys must be specified together");
    }
    this.accessKey = accessKey;
    this.secretKey = secretKey;
    this.sessionToken = accessKey == null ? null : blankToNull(sessionToken);
  }

  AWSCredentialsProvider credentialsProvider() {
    if (accessKey == null) return new DefaultAWSCredentialsProviderChain();
    if (sessionToken != null) {
      return new AWSStaticCredentialsProvider(new BasicSessionCredentials(accessKey, secretKey, sessionToken));
    }
    return new AWSStaticCredentialsProvider(new BasicAWSCredentials(accessKey, secretKey));
  }

  public AWSRedshiftDataAPI buildClient() {
    AWSRedshiftDataAPIClientBuilder builder = AWSRedshiftDataAPIClientBuilder.standard();
    if (endpoint == null) {
      if (region != null) builder.setRegion(region);
    } else {
      builder.withEndpointConfiguration(new AwsClientBuilder.EndpointConfiguration(endpoint, region));
    }
    builder.withCredentials(credentialsProvider());
    builder.withClientConfiguration(new ClientConfiguration());
    return builder.build();
  }

  @Override
  public String toString() {
    // Never print secrets.
    return "RedshiftClientConfig(endpoint: " + endpoint + ", region: " + region
        + ", credentials: " + (accessKey == null ? "default-chain" : "static") + ")";
  }

  private static String blankToNull(String s) {
    return (s == null || s.isBlank()) ? null : s;
  }
}
