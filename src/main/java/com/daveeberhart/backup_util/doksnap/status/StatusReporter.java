package com.daveeberhart.backup_util.doksnap.status;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.backup_util.doksnap.archive.BackupMetadata;
import com.daveeberhart.backup_util.doksnap.config.Source;
import com.daveeberhart.backup_util.doksnap.error.JobFailedException;
import com.daveeberhart.backup_util.doksnap.error.JobFailedException.RetentionException;
import com.daveeberhart.backup_util.doksnap.job.JobRecord;
import com.daveeberhart.backup_util.doksnap.job.JobRegistry;
import com.daveeberhart.backup_util.doksnap.job.RunningJobState;
import com.daveeberhart.backup_util.doksnap.storage.BackupStore;
import com.daveeberhart.backup_util.doksnap.storage.RemoteObject;

/**
 * Read-only view of the daemon for a status page or metrics scraper.
 * <p>
 * Works on copies only: nothing here can change job state.  Object keys, paths and error
 * text are left out of job history.  A source id that isn't a plain identifier gets an empty
 * answer rather than an error.
 *
 * @author deberhar
 */
public class StatusReporter {
  private static final Logger logger = LoggerFactory.getLogger(StatusReporter.class);

  private static final Pattern SOURCE_ID = Pattern.compile("[a-zA-Z0-9_\\-]+");

  private final List<Source> sources;
  private final JobRegistry registry;
  private final BackupStore store;
  private final Clock clock;

  public StatusReporter(List<Source> p_sources, JobRegistry p_registry, BackupStore p_store) {
    this(p_sources, p_registry, p_store, Clock.systemUTC());
  }

  public StatusReporter(List<Source> p_sources, JobRegistry p_registry, BackupStore p_store, Clock p_clock) {
    sources = p_sources;
    registry = p_registry;
    store = p_store;
    clock = p_clock;
  }

  public Map<String, String> health() {
    Map<String, String> health = new LinkedHashMap<>();
    health.put("status", "healthy");
    health.put("timestamp", now());
    return health;
  }

  public List<SourceStatus> status() {
    Map<String, RunningJobState> running = registry.runningJobs();
    List<SourceStatus> status = new ArrayList<>();
    for (Source source : sources) {
      JobRecord last = lastSuccess(source.getId());
      BackupMetadata meta = last == null ? null : last.getMetadata();
      status.add(new SourceStatus(
          source.getId(),
          isRunning(running, source.getId()),
          last == null ? null : last.getCompletedAt(),
          meta == null ? null : meta.getSizeMb(),
          meta == null ? null : meta.getDurationSeconds(),
          source.getSchedule()));
    }
    return status;
  }

  public List<SourceMetrics> metrics() {
    Map<String, RunningJobState> running = registry.runningJobs();
    List<SourceMetrics> metrics = new ArrayList<>();
    for (Source source : sources) {
      List<RemoteObject> backups = listQuietly(source.getId());
      List<JobRecord> history = registry.jobHistory(source.getId(), JobRegistry.MAX_HISTORY);

      long totalSize = 0;
      for (RemoteObject backup : backups) {
        totalSize += backup.getSize();
      }

      int successful = 0;
      double durationSum = 0;
      for (JobRecord record : history) {
        if (record.isSuccess()) {
          successful++;
          durationSum += record.getMetadata().getDurationSeconds();
        }
      }
      int failed = history.size() - successful;

      metrics.add(new SourceMetrics(
          source.getId(),
          backups.size(),
          totalSize,
          successful,
          failed,
          history.isEmpty() ? 0d : round2(successful * 100d / history.size()),
          successful == 0 ? 0d : round2(durationSum / successful),
          isRunning(running, source.getId()),
          backups.isEmpty() ? null : backups.get(0).getLastModified()));
    }
    return metrics;
  }

  /**
   * @return Job history of every configured source, by source id.
   */
  public Map<String, List<HistoryEntry>> history() {
    Map<String, List<HistoryEntry>> history = new LinkedHashMap<>();
    for (Source source : sources) {
      history.put(source.getId(), history(source.getId()));
    }
    return history;
  }

  public List<HistoryEntry> history(String p_sourceId) {
    if (!isValidId(p_sourceId)) {
      return Collections.emptyList();
    }

    List<HistoryEntry> entries = new ArrayList<>();
    for (JobRecord record : registry.jobHistory(p_sourceId, JobRegistry.MAX_HISTORY)) {
      BackupMetadata meta = record.getMetadata();
      entries.add(new HistoryEntry(
          record.getJobId(),
          record.getSourceId(),
          record.getStartedAt(),
          record.getCompletedAt(),
          record.getStatus(),
          meta == null ? null : meta.getSizeMb(),
          meta == null ? null : meta.getDurationSeconds()));
    }
    return entries;
  }

  /**
   * Unlike {@link #metrics()}, a failed listing isn't hidden behind an empty list: an empty
   * answer here has to mean there are no backups.
   *
   * @return Stored backups of a source, newest first, without their metadata tags.
   * @throws RetentionException if the store can't be listed.
   */
  public List<RemoteObject> backups(String p_sourceId) {
    if (!isValidId(p_sourceId)) {
      return Collections.emptyList();
    }

    List<RemoteObject> backups = new ArrayList<>();
    for (RemoteObject backup : store.listBackups(p_sourceId)) {
      backups.add(new RemoteObject(backup.getKey(), backup.getSize(), backup.getLastModified(), null));
    }
    return backups;
  }

  private JobRecord lastSuccess(String p_sourceId) {
    JobRecord last = null;
    for (JobRecord record : registry.jobHistory(p_sourceId, JobRegistry.MAX_HISTORY)) {
      if (record.isSuccess() && (last == null || !record.getCompletedAt().isBefore(last.getCompletedAt()))) {
        last = record;
      }
    }
    return last;
  }

  private List<RemoteObject> listQuietly(String p_sourceId) {
    try {
      return store.listBackups(p_sourceId);
    } catch (JobFailedException e) {
      logger.warn("Could not list backups of {} for metrics: {}", p_sourceId, e.getMessage());
      return Collections.emptyList();
    }
  }

  private static boolean isRunning(Map<String, RunningJobState> p_running, String p_sourceId) {
    RunningJobState job = p_running.get(p_sourceId);
    return job != null && job.isRunning();
  }

  private static boolean isValidId(String p_sourceId) {
    return p_sourceId != null && SOURCE_ID.matcher(p_sourceId).matches();
  }

  private static double round2(double p_value) {
    return Math.round(p_value * 100d) / 100d;
  }

  private String now() {
    return DateTimeFormatter.ISO_INSTANT.format(Instant.now(clock).truncatedTo(ChronoUnit.SECONDS));
  }

}
