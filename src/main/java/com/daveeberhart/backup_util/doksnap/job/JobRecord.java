package com.daveeberhart.backup_util.doksnap.job;

import java.time.Instant;

import com.daveeberhart.backup_util.doksnap.archive.BackupMetadata;

/**
 * One finished backup attempt, as kept in the job history.
 *
 * @author deberhar
 */
public final class JobRecord {
  private final String jobId;
  private final String sourceId;
  private final Instant startedAt;
  private final Instant completedAt;
  private final JobStatus status;
  private final BackupMetadata metadata;
  private final String objectKey;
  private final int retentionDeletions;
  private final String error;

  private JobRecord(String p_jobId, String p_sourceId, Instant p_startedAt, Instant p_completedAt, JobStatus p_status,
      BackupMetadata p_metadata, String p_objectKey, int p_retentionDeletions, String p_error) {
    jobId = p_jobId;
    sourceId = p_sourceId;
    startedAt = p_startedAt;
    completedAt = p_completedAt;
    status = p_status;
    metadata = p_metadata;
    objectKey = p_objectKey;
    retentionDeletions = p_retentionDeletions;
    error = p_error;
  }

  static JobRecord succeeded(RunningJobState p_job, Instant p_completedAt, BackupMetadata p_metadata, String p_objectKey, int p_retentionDeletions) {
    return new JobRecord(p_job.getJobId(), p_job.getSourceId(), p_job.getStartedAt(), p_completedAt, JobStatus.SUCCESS,
        p_metadata, p_objectKey, p_retentionDeletions, null);
  }

  static JobRecord failed(RunningJobState p_job, Instant p_completedAt, String p_error) {
    return new JobRecord(p_job.getJobId(), p_job.getSourceId(), p_job.getStartedAt(), p_completedAt, JobStatus.FAILED,
        null, null, 0, p_error);
  }

  /**
   * @return {@code <sourceId>_<epochSeconds>} of the trigger.
   */
  public String getJobId() {
    return jobId;
  }

  public String getSourceId() {
    return sourceId;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  /**
   * @return {@link JobStatus#SUCCESS} or {@link JobStatus#FAILED}; never running.
   */
  public JobStatus getStatus() {
    return status;
  }

  public boolean isSuccess() {
    return status == JobStatus.SUCCESS;
  }

  /**
   * @return The backup's metadata, or null for a failed job.
   */
  public BackupMetadata getMetadata() {
    return metadata;
  }

  public String getObjectKey() {
    return objectKey;
  }

  public int getRetentionDeletions() {
    return retentionDeletions;
  }

  /**
   * @return Sanitized failure message, or null for a successful job.
   */
  public String getError() {
    return error;
  }

  @Override
  public String toString() {
    return jobId + " " + status + (error == null ? "" : ": " + error);
  }
}
