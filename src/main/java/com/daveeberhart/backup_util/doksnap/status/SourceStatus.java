package com.daveeberhart.backup_util.doksnap.status;

import java.time.Instant;

/**
 * Current state of one source.
 *
 * @author deberhar
 */
public final class SourceStatus {
  private final String sourceId;
  private final boolean running;
  private final Instant lastBackupAt;
  private final Double lastBackupSizeMb;
  private final Double lastBackupDurationSeconds;
  private final String schedule;

  public SourceStatus(String p_sourceId, boolean p_running, Instant p_lastBackupAt, Double p_lastBackupSizeMb,
      Double p_lastBackupDurationSeconds, String p_schedule) {
    sourceId = p_sourceId;
    running = p_running;
    lastBackupAt = p_lastBackupAt;
    lastBackupSizeMb = p_lastBackupSizeMb;
    lastBackupDurationSeconds = p_lastBackupDurationSeconds;
    schedule = p_schedule;
  }

  public String getSourceId() {
    return sourceId;
  }

  public boolean isRunning() {
    return running;
  }

  /**
   * @return Completion time of the last successful job this daemon ran, or null if none.
   */
  public Instant getLastBackupAt() {
    return lastBackupAt;
  }

  public Double getLastBackupSizeMb() {
    return lastBackupSizeMb;
  }

  public Double getLastBackupDurationSeconds() {
    return lastBackupDurationSeconds;
  }

  public String getSchedule() {
    return schedule;
  }
}
