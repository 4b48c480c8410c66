package com.daveeberhart.backup_util.doksnap.job;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

import com.daveeberhart.backup_util.doksnap.archive.BackupMetadata;
import com.daveeberhart.backup_util.doksnap.config.SourceKind;
import com.daveeberhart.backup_util.doksnap.crypto.EncryptionMethod;

/**
 * @author deberhar
 */
public class JobRegistryTest {
  private static final Instant T0 = Instant.parse("2024-03-01T03:00:00Z");

  private final TaskScheduler evictions = Mockito.mock(TaskScheduler.class);
  private final SteppingClock clock = new SteppingClock(T0);
  private final JobRegistry registry = new JobRegistry(evictions, clock);

  private static BackupMetadata metadata(String p_sourceId) {
    return new BackupMetadata(p_sourceId, T0, p_sourceId + "_20240301_030000.tar.gz.enc", 2048, 1024, "abc123", 12.5d,
        EncryptionMethod.AES256, SourceKind.DIRECTORY);
  }

  private Runnable capturedEviction(Instant p_at) {
    ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
    Mockito.verify(evictions).schedule(task.capture(), Mockito.eq(p_at));
    return task.getValue();
  }

  @Test
  public void testTryStart() {
    RunningJobState job = registry.tryStart("blog");

    Assert.assertNotNull(job);
    Assert.assertEquals("blog_" + T0.getEpochSecond(), job.getJobId());
    Assert.assertEquals("blog", job.getSourceId());
    Assert.assertEquals(T0, job.getStartedAt());
    Assert.assertTrue(job.isRunning());
    Assert.assertNull(job.getCompletedAt());
    Assert.assertSame(job, registry.runningJobs().get("blog"));
  }

  @Test
  public void testSecondStartWhileRunningIsRefused() {
    Assert.assertNotNull(registry.tryStart("blog"));
    Assert.assertNull(registry.tryStart("blog"));

    // Other sources aren't affected.
    Assert.assertNotNull(registry.tryStart("api"));
    Assert.assertEquals(2, registry.runningJobs().size());
  }

  @Test
  public void testCompleteSuccess() {
    RunningJobState job = registry.tryStart("blog");
    clock.advance(Duration.ofMinutes(5));
    JobRecord record = registry.completeSuccess(job, metadata("blog"), "backups/blog/20240301_030000_blog.tar.gz.enc", 3);

    Assert.assertTrue(record.isSuccess());
    Assert.assertEquals(JobStatus.SUCCESS, record.getStatus());
    Assert.assertEquals(job.getJobId(), record.getJobId());
    Assert.assertEquals(T0, record.getStartedAt());
    Assert.assertEquals(T0.plus(Duration.ofMinutes(5)), record.getCompletedAt());
    Assert.assertEquals("backups/blog/20240301_030000_blog.tar.gz.enc", record.getObjectKey());
    Assert.assertEquals(3, record.getRetentionDeletions());
    Assert.assertNull(record.getError());

    RunningJobState marker = registry.runningJobs().get("blog");
    Assert.assertEquals(JobStatus.SUCCESS, marker.getStatus());
    Assert.assertFalse(marker.isRunning());
    Assert.assertEquals(record.getCompletedAt(), marker.getCompletedAt());
    Assert.assertNotNull(marker.getMetadata());

    Assert.assertEquals(1, registry.jobHistory().size());
    Assert.assertSame(record, registry.jobHistory().get(0));
  }

  @Test
  public void testCompleteFailure() {
    RunningJobState job = registry.tryStart("blog");
    JobRecord record = registry.completeFailure(job, "tar exited with code 2");

    Assert.assertFalse(record.isSuccess());
    Assert.assertEquals(JobStatus.FAILED, record.getStatus());
    Assert.assertEquals("tar exited with code 2", record.getError());
    Assert.assertNull(record.getMetadata());
    Assert.assertEquals(0, record.getRetentionDeletions());

    RunningJobState marker = registry.runningJobs().get("blog");
    Assert.assertEquals(JobStatus.FAILED, marker.getStatus());
    Assert.assertEquals("tar exited with code 2", marker.getError());
  }

  @Test
  public void testCompletedMarkerDoesNotBlock() {
    registry.completeFailure(registry.tryStart("blog"), "boom");
    clock.advance(Duration.ofMinutes(1));

    RunningJobState next = registry.tryStart("blog");
    Assert.assertNotNull(next);
    Assert.assertTrue(registry.runningJobs().get("blog").isRunning());
  }

  @Test
  public void testEvictionAfterGracePeriod() {
    RunningJobState job = registry.tryStart("blog");
    clock.advance(Duration.ofMinutes(2));
    JobRecord record = registry.completeSuccess(job, metadata("blog"), "key", 0);

    Runnable evict = capturedEviction(record.getCompletedAt().plus(JobRegistry.GRACE_PERIOD));
    Assert.assertTrue(registry.runningJobs().containsKey("blog"));

    evict.run();
    Assert.assertFalse(registry.runningJobs().containsKey("blog"));
    // History is kept.
    Assert.assertEquals(1, registry.jobHistory().size());
  }

  @Test
  public void testEvictionLeavesNewerJobAlone() {
    JobRecord first = registry.completeFailure(registry.tryStart("blog"), "boom");
    Runnable evictFirst = capturedEviction(first.getCompletedAt().plus(JobRegistry.GRACE_PERIOD));

    clock.advance(Duration.ofMinutes(10));
    RunningJobState second = registry.tryStart("blog");

    evictFirst.run();
    Assert.assertSame(second, registry.runningJobs().get("blog"));

    // Even after the second job finishes, the first job's eviction doesn't remove it.
    registry.completeSuccess(second, metadata("blog"), "key", 0);
    evictFirst.run();
    Assert.assertEquals(second.getJobId(), registry.runningJobs().get("blog").getJobId());
  }

  @Test
  public void testRejectedEvictionIsHarmless() {
    Mockito.when(evictions.schedule(Mockito.any(Runnable.class), Mockito.any(Instant.class)))
        .thenThrow(new TaskRejectedException("shut down"));

    JobRecord record = registry.completeFailure(registry.tryStart("blog"), "boom");
    Assert.assertNotNull(record);
    Assert.assertEquals(1, registry.jobHistory().size());
  }

  @Test
  public void testHistoryIsCapped() {
    for (int i = 0; i < JobRegistry.MAX_HISTORY + 5; i++) {
      registry.completeFailure(registry.tryStart("blog"), "failure " + i);
      clock.advance(Duration.ofSeconds(1));
    }

    List<JobRecord> all = registry.jobHistory(Integer.MAX_VALUE);
    Assert.assertEquals(JobRegistry.MAX_HISTORY, all.size());
    // Oldest were evicted first; what's left is oldest first.
    Assert.assertEquals("failure 5", all.get(0).getError());
    Assert.assertEquals("failure " + (JobRegistry.MAX_HISTORY + 4), all.get(all.size() - 1).getError());
  }

  @Test
  public void testHistoryLimits() {
    for (int i = 0; i < 150; i++) {
      registry.completeFailure(registry.tryStart(i % 2 == 0 ? "blog" : "api"), "failure " + i);
      clock.advance(Duration.ofSeconds(1));
    }

    Assert.assertEquals(JobRegistry.DEFAULT_HISTORY_LIMIT, registry.jobHistory().size());
    Assert.assertEquals("failure 149", registry.jobHistory().get(JobRegistry.DEFAULT_HISTORY_LIMIT - 1).getError());
    Assert.assertEquals(0, registry.jobHistory(-3).size());

    List<JobRecord> blog = registry.jobHistory("blog", 10);
    Assert.assertEquals(10, blog.size());
    for (JobRecord record : blog) {
      Assert.assertEquals("blog", record.getSourceId());
    }
    Assert.assertEquals("failure 148", blog.get(9).getError());
    Assert.assertEquals("failure 130", blog.get(0).getError());

    Assert.assertTrue(registry.jobHistory("nope", 10).isEmpty());
  }

  @Test
  public void testSnapshotsAreCopies() {
    registry.tryStart("blog");
    Map<String, RunningJobState> snapshot = registry.runningJobs();
    snapshot.clear();
    Assert.assertEquals(1, registry.runningJobs().size());

    registry.completeFailure(registry.runningJobs().get("blog"), "boom");
    registry.jobHistory().clear();
    Assert.assertEquals(1, registry.jobHistory().size());
  }

  /**
   * A clock the test can move forward.
   */
  private static class SteppingClock extends Clock {
    private Instant now;

    SteppingClock(Instant p_start) {
      now = p_start;
    }

    void advance(Duration p_by) {
      now = now.plus(p_by);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId p_zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }

}
