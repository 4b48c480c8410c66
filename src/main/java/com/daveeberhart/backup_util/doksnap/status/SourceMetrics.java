package com.daveeberhart.backup_util.doksnap.status;

import java.time.Instant;

/**
 * Backup counters for one source.
 * <p>
 * Totals come from the store, job counts from this daemon's history.
 *
 * @author deberhar
 */
public final class SourceMetrics {
  private static final double MEGABYTE = 1024d * 1024d;

  private final String sourceId;
  private final int totalBackups;
  private final long totalSizeBytes;
  private final int successfulJobs;
  private final int failedJobs;
  private final double successRate;
  private final double avgDurationSeconds;
  private final boolean currentlyRunning;
  private final Instant lastBackupTime;

  public SourceMetrics(String p_sourceId, int p_totalBackups, long p_totalSizeBytes, int p_successfulJobs, int p_failedJobs,
      double p_successRate, double p_avgDurationSeconds, boolean p_currentlyRunning, Instant p_lastBackupTime) {
    sourceId = p_sourceId;
    totalBackups = p_totalBackups;
    totalSizeBytes = p_totalSizeBytes;
    successfulJobs = p_successfulJobs;
    failedJobs = p_failedJobs;
    successRate = p_successRate;
    avgDurationSeconds = p_avgDurationSeconds;
    currentlyRunning = p_currentlyRunning;
    lastBackupTime = p_lastBackupTime;
  }

  public String getSourceId() {
    return sourceId;
  }

  public int getTotalBackups() {
    return totalBackups;
  }

  public long getTotalSizeBytes() {
    return totalSizeBytes;
  }

  public double getTotalSizeMb() {
    return Math.round(totalSizeBytes / MEGABYTE * 100d) / 100d;
  }

  public int getSuccessfulJobs() {
    return successfulJobs;
  }

  public int getFailedJobs() {
    return failedJobs;
  }

  /**
   * @return Percentage of successful jobs, two decimals; 0 with no history.
   */
  public double getSuccessRate() {
    return successRate;
  }

  public double getAvgDurationSeconds() {
    return avgDurationSeconds;
  }

  public boolean isCurrentlyRunning() {
    return currentlyRunning;
  }

  /**
   * @return Last-modified time of the newest stored backup, or null.
   */
  public Instant getLastBackupTime() {
    return lastBackupTime;
  }
}
