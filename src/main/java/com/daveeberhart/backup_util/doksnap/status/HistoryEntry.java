package com.daveeberhart.backup_util.doksnap.status;

import java.time.Instant;

import com.daveeberhart.backup_util.doksnap.job.JobStatus;

/**
 * A job record stripped of object keys and error text.
 *
 * @author deberhar
 */
public final class HistoryEntry {
  private final String jobId;
  private final String sourceId;
  private final Instant startedAt;
  private final Instant completedAt;
  private final JobStatus status;
  private final Double sizeMb;
  private final Double durationSeconds;

  public HistoryEntry(String p_jobId, String p_sourceId, Instant p_startedAt, Instant p_completedAt, JobStatus p_status,
      Double p_sizeMb, Double p_durationSeconds) {
    jobId = p_jobId;
    sourceId = p_sourceId;
    startedAt = p_startedAt;
    completedAt = p_completedAt;
    status = p_status;
    sizeMb = p_sizeMb;
    durationSeconds = p_durationSeconds;
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

  public Instant getCompletedAt() {
    return completedAt;
  }

  public JobStatus getStatus() {
    return status;
  }

  /**
   * @return Encrypted size, or null for a failed job.
   */
  public Double getSizeMb() {
    return sizeMb;
  }

  public Double getDurationSeconds() {
    return durationSeconds;
  }
}
