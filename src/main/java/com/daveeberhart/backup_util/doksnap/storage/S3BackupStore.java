package com.daveeberhart.backup_util.doksnap.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazonaws.AmazonClientException;
import com.amazonaws.ClientConfiguration;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.client.builder.AwsClientBuilder.EndpointConfiguration;
import com.amazonaws.retry.PredefinedRetryPolicies;
import com.amazonaws.retry.RetryPolicy;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.AbortMultipartUploadRequest;
import com.amazonaws.services.s3.model.AmazonS3Exception;
import com.amazonaws.services.s3.model.CompleteMultipartUploadRequest;
import com.amazonaws.services.s3.model.InitiateMultipartUploadRequest;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.PartETag;
import com.amazonaws.services.s3.model.PutObjectRequest;
import com.amazonaws.services.s3.model.S3ObjectSummary;
import com.amazonaws.services.s3.model.UploadPartRequest;
import com.daveeberhart.backup_util.doksnap.archive.BackupMetadata;
import com.daveeberhart.backup_util.doksnap.config.S3Settings;
import com.daveeberhart.backup_util.doksnap.error.JobFailedException.RetentionException;
import com.daveeberhart.backup_util.doksnap.error.JobFailedException.UploadException;
import com.daveeberhart.backup_util.doksnap.progress.AwsProgressListener;

/**
 * Backups in an S3 (or S3-compatible) bucket.
 * <p>
 * Files up to {@value #MULTIPART_THRESHOLD} bytes go up in a single put.  Anything larger is a
 * multi-part upload in {@value #MULTIPART_CHUNK_SIZE}-byte parts; if any part fails the upload
 * is aborted so no orphaned parts are left billing in the bucket.
 * <p>
 * Every object is stored with server-side encryption (on top of our own) and user metadata
 * describing the backup.
 *
 * @author deberhar
 */
public class S3BackupStore implements BackupStore {
  private static final Logger logger = LoggerFactory.getLogger(S3BackupStore.class);

  /** 100MB */
  static final long MULTIPART_THRESHOLD = 100L * 1024L * 1024L;
  /** 100MB */
  static final long MULTIPART_CHUNK_SIZE = 100L * 1024L * 1024L;

  private static final int CONNECT_TIMEOUT_MILLIS = 30 * 1000;
  private static final int SOCKET_TIMEOUT_MILLIS = 300 * 1000;
  private static final int MAX_RETRIES = 3;

  private final AmazonS3 s3;
  private final String bucket;
  private final long multipartThreshold;
  private final long chunkSize;

  public S3BackupStore(AmazonS3 p_s3, String p_bucket) {
    this(p_s3, p_bucket, MULTIPART_THRESHOLD, MULTIPART_CHUNK_SIZE);
  }

  S3BackupStore(AmazonS3 p_s3, String p_bucket, long p_multipartThreshold, long p_chunkSize) {
    s3 = p_s3;
    bucket = p_bucket;
    multipartThreshold = p_multipartThreshold;
    chunkSize = p_chunkSize;
  }

  /**
   * Build an S3 client for the configured endpoint.
   */
  public static AmazonS3 createClient(S3Settings p_settings) {
    ClientConfiguration config = new ClientConfiguration()
        .withConnectionTimeout(CONNECT_TIMEOUT_MILLIS)
        .withSocketTimeout(SOCKET_TIMEOUT_MILLIS)
        .withRetryPolicy(new RetryPolicy(
            PredefinedRetryPolicies.DEFAULT_RETRY_CONDITION,
            PredefinedRetryPolicies.DEFAULT_BACKOFF_STRATEGY,
            MAX_RETRIES,
            false));

    AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard()
        .withClientConfiguration(config)
        .withCredentials(new AWSStaticCredentialsProvider(new BasicAWSCredentials(p_settings.getAccessKeyId(), p_settings.getSecretAccessKey())));

    if (p_settings.isCustomEndpoint()) {
      builder.withEndpointConfiguration(new EndpointConfiguration("https://" + p_settings.getEndpoint(), p_settings.getRegion()))
          .withPathStyleAccessEnabled(true);
    } else {
      builder.withRegion(p_settings.getRegion());
    }
    return builder.build();
  }

  /* (non-Javadoc)
   * @see com.daveeberhart.backup_util.doksnap.storage.BackupStore#upload(java.nio.file.Path, com.daveeberhart.backup_util.doksnap.archive.BackupMetadata)
   */
  @Override
  public UploadResult upload(Path p_file, BackupMetadata p_metadata) {
    String key = ObjectKeys.keyFor(p_metadata);
    try {
      long size = Files.size(p_file);
      AwsProgressListener progress = new AwsProgressListener(key, size);
      if (size <= multipartThreshold) {
        uploadSingle(p_file, key, p_metadata, progress);
      } else {
        uploadMultipart(p_file, size, key, p_metadata, progress);
      }
      progress.done();
      logger.info("[OK] Uploaded {} to s3://{}/{}", p_metadata.getFilename(), bucket, key);
      return UploadResult.success(key);
    } catch (IOException | RuntimeException e) {
      logger.error("Upload of {} failed: {}", key, e.getMessage());
      return UploadResult.failure(key, e);
    }
  }

  private void uploadSingle(Path p_file, String p_key, BackupMetadata p_metadata, AwsProgressListener p_progress) {
    PutObjectRequest req = new PutObjectRequest(bucket, p_key, p_file.toFile())
        .withMetadata(objectMetadata(p_metadata));
    req.setGeneralProgressListener(p_progress);
    s3.putObject(req);
  }

  private void uploadMultipart(Path p_file, long p_size, String p_key, BackupMetadata p_metadata, AwsProgressListener p_progress) {
    String uploadId = s3.initiateMultipartUpload(new InitiateMultipartUploadRequest(bucket, p_key, objectMetadata(p_metadata)))
        .getUploadId();
    logger.debug("Started multi-part upload {} for {}", uploadId, p_key);

    try {
      List<PartETag> parts = new ArrayList<>();
      long offset = 0;
      for (int partNumber = 1; offset < p_size; partNumber++) {
        long partSize = Math.min(chunkSize, p_size - offset);
        UploadPartRequest req = new UploadPartRequest()
            .withBucketName(bucket)
            .withKey(p_key)
            .withUploadId(uploadId)
            .withPartNumber(partNumber)
            .withFile(p_file.toFile())
            .withFileOffset(offset)
            .withPartSize(partSize);
        req.setGeneralProgressListener(p_progress);
        parts.add(s3.uploadPart(req).getPartETag());
        offset += partSize;
      }

      if (parts.isEmpty()) {
        throw new UploadException("No parts were uploaded for " + p_key);
      }
      s3.completeMultipartUpload(new CompleteMultipartUploadRequest(bucket, p_key, uploadId, parts));
    } catch (RuntimeException e) {
      abort(p_key, uploadId);
      throw e;
    }
  }

  private void abort(String p_key, String p_uploadId) {
    try {
      s3.abortMultipartUpload(new AbortMultipartUploadRequest(bucket, p_key, p_uploadId));
      logger.info("Aborted multi-part upload {} for {}", p_uploadId, p_key);
    } catch (AmazonClientException e) {
      logger.warn("Failed to abort multi-part upload {} for {}: {}", p_uploadId, p_key, e.getMessage());
    }
  }

  static ObjectMetadata objectMetadata(BackupMetadata p_metadata) {
    ObjectMetadata meta = new ObjectMetadata();
    meta.addUserMetadata("source-id", p_metadata.getSourceId());
    meta.addUserMetadata("timestamp", p_metadata.getTimestampIso());
    meta.addUserMetadata("size", Long.toString(p_metadata.getSize()));
    meta.addUserMetadata("checksum", p_metadata.getChecksum());
    meta.addUserMetadata("encryption-method", p_metadata.getEncryptionMethod().getId());
    meta.addUserMetadata("source-kind", p_metadata.getSourceKind().getId());
    meta.setSSEAlgorithm(ObjectMetadata.AES_256_SERVER_SIDE_ENCRYPTION);
    return meta;
  }

  /* (non-Javadoc)
   * @see com.daveeberhart.backup_util.doksnap.storage.BackupStore#listBackups(java.lang.String)
   */
  @Override
  public List<RemoteObject> listBackups(String p_sourceId) {
    String prefix = ObjectKeys.prefixFor(p_sourceId);
    List<RemoteObject> backups = new ArrayList<>();
    try {
      ListObjectsV2Request req = new ListObjectsV2Request()
          .withBucketName(bucket)
          .withPrefix(prefix);
      ListObjectsV2Result res;
      do {
        res = s3.listObjectsV2(req);
        for (S3ObjectSummary summary : res.getObjectSummaries()) {
          backups.add(new RemoteObject(
              summary.getKey(),
              summary.getSize(),
              summary.getLastModified().toInstant(),
              userMetadata(summary.getKey())));
        }
        req.setContinuationToken(res.getNextContinuationToken());
      } while (res.isTruncated());
    } catch (AmazonClientException e) {
      throw new RetentionException("Could not list backups for " + p_sourceId + ": " + e.getMessage(), e);
    }

    backups.sort(Comparator.comparing(RemoteObject::getLastModified, Comparator.<Instant>reverseOrder())
        .thenComparing(RemoteObject::getKey, Comparator.<String>reverseOrder()));
    return backups;
  }

  private Map<String, String> userMetadata(String p_key) {
    try {
      return s3.getObjectMetadata(bucket, p_key).getUserMetadata();
    } catch (AmazonS3Exception e) {
      if (e.getStatusCode() != 404) {
        throw e;
      }
      // Deleted or expired since the listing.
      logger.debug("No metadata for {}: object is gone", p_key);
      return Collections.emptyMap();
    }
  }

  /* (non-Javadoc)
   * @see com.daveeberhart.backup_util.doksnap.storage.BackupStore#deleteBackup(java.lang.String)
   */
  @Override
  public void deleteBackup(String p_key) {
    try {
      s3.deleteObject(bucket, p_key);
    } catch (AmazonClientException e) {
      throw new RetentionException(p_key, "Failed to delete " + p_key + ": " + e.getMessage(), e);
    }
  }

}
