package com.daveeberhart.backup_util.doksnap.config;

/**
 * Where backups go, and the credentials to put them there.
 *
 * @author deberhar
 */
public final class S3Settings {
  public static final String AWS_ENDPOINT = "s3.amazonaws.com";

  private final String bucket;
  private final String endpoint;
  private final String region;
  private final String accessKeyId;
  private final String secretAccessKey;

  public S3Settings(String p_bucket, String p_endpoint, String p_region, String p_accessKeyId, String p_secretAccessKey) {
    bucket = p_bucket;
    endpoint = p_endpoint;
    region = p_region;
    accessKeyId = p_accessKeyId;
    secretAccessKey = p_secretAccessKey;
  }

  public String getBucket() {
    return bucket;
  }

  /**
   * @return Bare hostname of the S3 endpoint.
   */
  public String getEndpoint() {
    return endpoint;
  }

  public String getRegion() {
    return region;
  }

  public String getAccessKeyId() {
    return accessKeyId;
  }

  public String getSecretAccessKey() {
    return secretAccessKey;
  }

  /**
   * @return True for S3-compatible stores (MinIO, Spaces, ...), which need path-style access.
   */
  public boolean isCustomEndpoint() {
    return !AWS_ENDPOINT.equals(endpoint);
  }

  @Override
  public String toString() {
    return "s3://" + bucket + " @ " + endpoint + " (" + region + ")";
  }
}
