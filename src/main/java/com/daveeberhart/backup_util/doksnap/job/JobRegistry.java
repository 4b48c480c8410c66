package com.daveeberhart.backup_util.doksnap.job;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import com.daveeberhart.backup_util.doksnap.archive.BackupMetadata;

/**
 * Who's running, and what ran.
 * <p>
 * The running markers and the history share one lock.  It's only ever held for bookkeeping,
 * never across a backup, so readers are never stuck behind a slow upload.
 * <p>
 * A finished job's marker stays visible for {@link #GRACE_PERIOD}, then it's evicted.  A
 * finished marker never stops a new job for the same source from starting.
 *
 * @author deberhar
 */
public class JobRegistry {
  private static final Logger logger = LoggerFactory.getLogger(JobRegistry.class);

  public static final int MAX_HISTORY = 1000;
  public static final int DEFAULT_HISTORY_LIMIT = 100;
  static final Duration GRACE_PERIOD = Duration.ofHours(1);

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, RunningJobState> running = new LinkedHashMap<>();
  private final Deque<JobRecord> history = new ArrayDeque<>();

  private final TaskScheduler evictionScheduler;
  private final Clock clock;

  public JobRegistry(TaskScheduler p_evictionScheduler) {
    this(p_evictionScheduler, Clock.systemUTC());
  }

  public JobRegistry(TaskScheduler p_evictionScheduler, Clock p_clock) {
    evictionScheduler = p_evictionScheduler;
    clock = p_clock;
  }

  /**
   * Atomically claim the source.
   *
   * @return The new marker, or null if a job for the source is already running.
   */
  public RunningJobState tryStart(String p_sourceId) {
    lock.lock();
    try {
      RunningJobState current = running.get(p_sourceId);
      if (current != null && current.isRunning()) {
        return null;
      }

      Instant now = clock.instant();
      RunningJobState job = RunningJobState.started(p_sourceId + "_" + now.getEpochSecond(), p_sourceId, now);
      running.put(p_sourceId, job);
      return job;
    } finally {
      lock.unlock();
    }
  }

  public JobRecord completeSuccess(RunningJobState p_job, BackupMetadata p_metadata, String p_objectKey, int p_retentionDeletions) {
    Instant now = clock.instant();
    return complete(p_job.succeeded(now, p_metadata), JobRecord.succeeded(p_job, now, p_metadata, p_objectKey, p_retentionDeletions));
  }

  public JobRecord completeFailure(RunningJobState p_job, String p_error) {
    Instant now = clock.instant();
    return complete(p_job.failed(now, p_error), JobRecord.failed(p_job, now, p_error));
  }

  private JobRecord complete(RunningJobState p_marker, JobRecord p_record) {
    lock.lock();
    try {
      RunningJobState current = running.get(p_marker.getSourceId());
      if (current != null && current.getJobId().equals(p_marker.getJobId())) {
        running.put(p_marker.getSourceId(), p_marker);
      }

      history.addLast(p_record);
      while (history.size() > MAX_HISTORY) {
        history.removeFirst();
      }
    } finally {
      lock.unlock();
    }

    scheduleEviction(p_marker);
    return p_record;
  }

  private void scheduleEviction(RunningJobState p_marker) {
    try {
      evictionScheduler.schedule(() -> evict(p_marker.getSourceId(), p_marker.getJobId()), p_marker.getCompletedAt().plus(GRACE_PERIOD));
    } catch (TaskRejectedException e) {
      // Shutting down; the marker goes with the process.
      logger.debug("Not scheduling eviction of {}: {}", p_marker.getJobId(), e.getMessage());
    }
  }

  /**
   * Remove a finished marker, unless a newer job has replaced it.
   */
  void evict(String p_sourceId, String p_jobId) {
    lock.lock();
    try {
      RunningJobState current = running.get(p_sourceId);
      if (current != null && !current.isRunning() && current.getJobId().equals(p_jobId)) {
        running.remove(p_sourceId);
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return A copy of the current markers, running and recently finished, by source id.
   */
  public Map<String, RunningJobState> runningJobs() {
    lock.lock();
    try {
      return new LinkedHashMap<>(running);
    } finally {
      lock.unlock();
    }
  }

  public List<JobRecord> jobHistory() {
    return jobHistory(DEFAULT_HISTORY_LIMIT);
  }

  /**
   * @return The most recent {@code p_limit} records (capped at {@value #MAX_HISTORY}), oldest first.
   */
  public List<JobRecord> jobHistory(int p_limit) {
    return jobHistory(null, p_limit);
  }

  /**
   * @param p_sourceId Only this source's records, or null for all.
   * @return The most recent {@code p_limit} matching records, oldest first.
   */
  public List<JobRecord> jobHistory(String p_sourceId, int p_limit) {
    int limit = Math.max(0, Math.min(p_limit, MAX_HISTORY));
    List<JobRecord> newestFirst = new ArrayList<>();
    lock.lock();
    try {
      for (Iterator<JobRecord> it = history.descendingIterator(); it.hasNext() && newestFirst.size() < limit; ) {
        JobRecord record = it.next();
        if (p_sourceId == null || p_sourceId.equals(record.getSourceId())) {
          newestFirst.add(record);
        }
      }
    } finally {
      lock.unlock();
    }

    Collections.reverse(newestFirst);
    return newestFirst;
  }

}
