package com.daveeberhart.backup_util.doksnap.retention;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.backup_util.doksnap.config.Source;
import com.daveeberhart.backup_util.doksnap.error.JobFailedException.RetentionException;
import com.daveeberhart.backup_util.doksnap.storage.BackupStore;
import com.daveeberhart.backup_util.doksnap.storage.RemoteObject;

/**
 * Applies a source's retention policy to what's actually in the store.
 * <p>
 * Deletion is best-effort: a key that fails to delete is reported and the rest still go.
 *
 * @author deberhar
 */
public class RetentionEnforcer {
  private static final Logger logger = LoggerFactory.getLogger(RetentionEnforcer.class);

  private final BackupStore store;
  private final Clock clock;

  public RetentionEnforcer(BackupStore p_store) {
    this(p_store, Clock.systemUTC());
  }

  public RetentionEnforcer(BackupStore p_store, Clock p_clock) {
    store = p_store;
    clock = p_clock;
  }

  /**
   * @throws RetentionException if the store can't be listed.
   */
  public RetentionResult enforce(Source p_source) {
    if (p_source.getRetention().isEmpty()) {
      return RetentionResult.nothing();
    }

    List<RemoteObject> backups = store.listBackups(p_source.getId());
    if (backups.isEmpty()) {
      return RetentionResult.nothing();
    }

    Set<String> doomed = RetentionPlanner.plan(backups, p_source.getRetention(), LocalDate.now(clock.withZone(ZoneOffset.UTC)));
    List<String> deleted = new ArrayList<>();
    List<RetentionException> failures = new ArrayList<>();
    for (String key : doomed) {
      try {
        store.deleteBackup(key);
        deleted.add(key);
        logger.info("[{}] Retention deleted {}", p_source.getId(), key);
      } catch (RetentionException e) {
        logger.warn("[{}] {}", p_source.getId(), e.getMessage());
        failures.add(e);
      } catch (RuntimeException e) {
        logger.warn("[{}] Failed to delete {}: {}", p_source.getId(), key, e.getMessage());
        failures.add(new RetentionException(key, "Failed to delete " + key + ": " + e.getMessage(), e));
      }
    }

    logger.info("[{}] Retention kept {} of {} backups ({} delete failures)",
        p_source.getId(), backups.size() - deleted.size(), backups.size(), failures.size());
    return new RetentionResult(deleted, failures);
  }

}
