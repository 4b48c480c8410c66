package com.daveeberhart.backup_util.doksnap.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.backup_util.doksnap.archive.ArchiveBuilder;
import com.daveeberhart.backup_util.doksnap.archive.BackupArtifact;
import com.daveeberhart.backup_util.doksnap.archive.BackupMetadata;
import com.daveeberhart.backup_util.doksnap.config.Source;
import com.daveeberhart.backup_util.doksnap.error.JobFailedException.RetentionException;
import com.daveeberhart.backup_util.doksnap.error.JobFailedException.UploadException;
import com.daveeberhart.backup_util.doksnap.retention.RetentionEnforcer;
import com.daveeberhart.backup_util.doksnap.retention.RetentionResult;
import com.daveeberhart.backup_util.doksnap.storage.BackupStore;
import com.daveeberhart.backup_util.doksnap.storage.UploadResult;

/**
 * Runs one backup of one source, start to finish: build, upload, retention, bookkeeping.
 * <p>
 * At most one job per source runs at a time.  A trigger that arrives while its source is busy
 * is dropped (logged, not queued, no history entry).  Whatever goes wrong inside a job ends
 * up as a failed {@link JobRecord}; it never escapes to the scheduler.
 *
 * @author deberhar
 */
public class BackupOrchestrator {
  private static final Logger logger = LoggerFactory.getLogger(BackupOrchestrator.class);

  private final ArchiveBuilder builder;
  private final BackupStore store;
  private final RetentionEnforcer retention;
  private final JobRegistry registry;

  public BackupOrchestrator(ArchiveBuilder p_builder, BackupStore p_store, RetentionEnforcer p_retention, JobRegistry p_registry) {
    builder = p_builder;
    store = p_store;
    retention = p_retention;
    registry = p_registry;
  }

  /**
   * Back up a source now, unless it's already being backed up.
   *
   * @return The job's record, or null if the trigger was skipped.
   */
  public JobRecord trigger(Source p_source) {
    RunningJobState job = registry.tryStart(p_source.getId());
    if (job == null) {
      logger.info("Skipping backup for {}: previous backup still running", p_source.getId());
      return null;
    }

    logger.info("[{}] Starting backup job {}", p_source.getId(), job.getJobId());
    try {
      BackupMetadata metadata;
      String key;
      try (BackupArtifact artifact = builder.build(p_source)) {
        metadata = artifact.getMetadata();
        UploadResult res = store.upload(artifact.getFile(), metadata);
        if (!res.isSuccess()) {
          throw new UploadException("Upload failed: " + res.getError().getMessage(), res.getError());
        }
        key = res.getKey();
      }

      int deletions = applyRetention(p_source);
      JobRecord record = registry.completeSuccess(job, metadata, key, deletions);
      logger.info("[{}] Backup job {} succeeded ({}, {} old backups removed)", p_source.getId(), job.getJobId(), metadata, deletions);
      return record;
    } catch (RuntimeException e) {
      return fail(p_source, job, e);
    } catch (Error e) {
      fail(p_source, job, e);
      throw e;
    }
  }

  private JobRecord fail(Source p_source, RunningJobState p_job, Throwable p_error) {
    String msg = ErrorMessages.sanitize(p_error);
    if (Boolean.getBoolean("verbose")) {
      logger.error("[" + p_source.getId() + "] Backup job " + p_job.getJobId() + " failed", p_error);
    } else {
      logger.error("[{}] Backup job {} failed: {}", p_source.getId(), p_job.getJobId(), msg);
    }
    return registry.completeFailure(p_job, msg);
  }

  /**
   * Retention problems never fail a backup that's already safely stored.
   */
  private int applyRetention(Source p_source) {
    try {
      RetentionResult result = retention.enforce(p_source);
      return result.getDeletedCount();
    } catch (RetentionException e) {
      logger.warn("[{}] Retention skipped: {}", p_source.getId(), e.getMessage());
      return 0;
    }
  }

}
