package com.daveeberhart.backup_util.doksnap.job;

import java.time.Instant;

import com.daveeberhart.backup_util.doksnap.archive.BackupMetadata;

/**
 * The in-flight marker for one source.
 * <p>
 * Immutable: completing a job replaces the marker with a completed copy.
 *
 * @author deberhar
 */
public final class RunningJobState {
  private final String jobId;
  private final String sourceId;
  private final Instant startedAt;
  private final JobStatus status;
  private final Instant completedAt;
  private final BackupMetadata metadata;
  private final String error;

  private RunningJobState(String p_jobId, String p_sourceId, Instant p_startedAt, JobStatus p_status, Instant p_completedAt,
      BackupMetadata p_metadata, String p_error) {
    jobId = p_jobId;
    sourceId = p_sourceId;
    startedAt = p_startedAt;
    status = p_status;
    completedAt = p_completedAt;
    metadata = p_metadata;
    error = p_error;
  }

  static RunningJobState started(String p_jobId, String p_sourceId, Instant p_startedAt) {
    return new RunningJobState(p_jobId, p_sourceId, p_startedAt, JobStatus.RUNNING, null, null, null);
  }

  RunningJobState succeeded(Instant p_completedAt, BackupMetadata p_metadata) {
    return new RunningJobState(jobId, sourceId, startedAt, JobStatus.SUCCESS, p_completedAt, p_metadata, null);
  }

  RunningJobState failed(Instant p_completedAt, String p_error) {
    return new RunningJobState(jobId, sourceId, startedAt, JobStatus.FAILED, p_completedAt, null, p_error);
  }

  public String getJobId() {
    return jobId;
  }

  public String getSourceId() {
    return sourceId;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public JobStatus getStatus() {
    return status;
  }

  public boolean isRunning() {
    return status == JobStatus.RUNNING;
  }

  /**
   * @return When the job finished, or null while it's running.
   */
  public Instant getCompletedAt() {
    return completedAt;
  }

  public BackupMetadata getMetadata() {
    return metadata;
  }

  public String getError() {
    return error;
  }

  @Override
  public String toString() {
    return jobId + " " + status;
  }
}
