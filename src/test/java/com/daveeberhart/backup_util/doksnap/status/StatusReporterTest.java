package com.daveeberhart.backup_util.doksnap.status;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;
import org.mockito.Mockito;
import org.springframework.scheduling.TaskScheduler;

import com.daveeberhart.backup_util.doksnap.archive.BackupMetadata;
import com.daveeberhart.backup_util.doksnap.config.Source;
import com.daveeberhart.backup_util.doksnap.config.SourceKind;
import com.daveeberhart.backup_util.doksnap.crypto.EncryptionMethod;
import com.daveeberhart.backup_util.doksnap.error.JobFailedException.RetentionException;
import com.daveeberhart.backup_util.doksnap.job.JobRegistry;
import com.daveeberhart.backup_util.doksnap.job.JobStatus;
import com.daveeberhart.backup_util.doksnap.job.RunningJobState;
import com.daveeberhart.backup_util.doksnap.storage.BackupStore;
import com.daveeberhart.backup_util.doksnap.storage.RemoteObject;

/**
 * @author deberhar
 */
public class StatusReporterTest {
  private static final Instant NOW = Instant.parse("2024-03-01T03:00:00.250Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  private final Source blog = new Source("blog", SourceKind.DIRECTORY, Paths.get("/data/blog"), "0 3 * * *", null, null);
  private final Source api = new Source("api", SourceKind.VOLUME, Paths.get("/var/lib/docker/volumes/api"), "0 */6 * * *", null, null);

  private final BackupStore store = Mockito.mock(BackupStore.class);
  private final JobRegistry registry = new JobRegistry(Mockito.mock(TaskScheduler.class), CLOCK);
  private final StatusReporter reporter = new StatusReporter(Arrays.asList(blog, api), registry, store, CLOCK);

  private static BackupMetadata metadata(long p_size, double p_duration) {
    return new BackupMetadata("blog", NOW, "blog_20240301_030000.tar.gz.enc", p_size, p_size, "abc", p_duration,
        EncryptionMethod.GPG, SourceKind.DIRECTORY);
  }

  @Test
  public void testHealth() {
    Map<String, String> health = reporter.health();
    Assert.assertEquals("healthy", health.get("status"));
    Assert.assertEquals("2024-03-01T03:00:00Z", health.get("timestamp"));
  }

  @Test
  public void testStatusBeforeAnyBackup() {
    List<SourceStatus> status = reporter.status();

    Assert.assertEquals(2, status.size());
    SourceStatus first = status.get(0);
    Assert.assertEquals("blog", first.getSourceId());
    Assert.assertFalse(first.isRunning());
    Assert.assertNull(first.getLastBackupAt());
    Assert.assertNull(first.getLastBackupSizeMb());
    Assert.assertEquals("0 3 * * *", first.getSchedule());
  }

  @Test
  public void testStatus() {
    registry.completeSuccess(registry.tryStart("blog"), metadata(3L * 1024L * 1024L, 42.5d), "key", 0);
    registry.completeFailure(registry.tryStart("blog"), "boom");
    registry.tryStart("api");

    List<SourceStatus> status = reporter.status();

    SourceStatus blogStatus = status.get(0);
    Assert.assertFalse(blogStatus.isRunning());
    // The failure afterwards doesn't hide the last good backup.
    Assert.assertEquals(NOW, blogStatus.getLastBackupAt());
    Assert.assertEquals(3.0d, blogStatus.getLastBackupSizeMb(), 0.001d);
    Assert.assertEquals(42.5d, blogStatus.getLastBackupDurationSeconds(), 0.001d);

    Assert.assertTrue(status.get(1).isRunning());
  }

  @Test
  public void testMetrics() {
    registry.completeSuccess(registry.tryStart("blog"), metadata(100, 10d), "k1", 0);
    registry.completeSuccess(registry.tryStart("blog"), metadata(100, 20d), "k2", 0);
    registry.completeFailure(registry.tryStart("blog"), "boom");
    Instant newest = Instant.parse("2024-03-01T03:00:00Z");
    Mockito.when(store.listBackups("blog")).thenReturn(Arrays.asList(
        new RemoteObject("k2", 2L * 1024L * 1024L, newest, null),
        new RemoteObject("k1", 1024L * 1024L, newest.minusSeconds(86400), null)));
    Mockito.when(store.listBackups("api")).thenThrow(new RetentionException("Could not list backups for api: timeout", null));

    List<SourceMetrics> metrics = reporter.metrics();

    SourceMetrics blogMetrics = metrics.get(0);
    Assert.assertEquals(2, blogMetrics.getTotalBackups());
    Assert.assertEquals(3L * 1024L * 1024L, blogMetrics.getTotalSizeBytes());
    Assert.assertEquals(3.0d, blogMetrics.getTotalSizeMb(), 0.001d);
    Assert.assertEquals(2, blogMetrics.getSuccessfulJobs());
    Assert.assertEquals(1, blogMetrics.getFailedJobs());
    Assert.assertEquals(66.67d, blogMetrics.getSuccessRate(), 0.001d);
    Assert.assertEquals(15d, blogMetrics.getAvgDurationSeconds(), 0.001d);
    Assert.assertEquals(newest, blogMetrics.getLastBackupTime());

    // A store that can't be listed shows up as empty rather than failing the whole report.
    SourceMetrics apiMetrics = metrics.get(1);
    Assert.assertEquals(0, apiMetrics.getTotalBackups());
    Assert.assertEquals(0d, apiMetrics.getSuccessRate(), 0.001d);
    Assert.assertNull(apiMetrics.getLastBackupTime());
  }

  @Test
  public void testHistory() {
    registry.completeSuccess(registry.tryStart("blog"), metadata(1024L * 1024L, 5d), "backups/blog/secret-key", 1);
    registry.completeFailure(registry.tryStart("api"), "Source path does not exist: [path]");

    List<HistoryEntry> blogHistory = reporter.history("blog");
    Assert.assertEquals(1, blogHistory.size());
    HistoryEntry entry = blogHistory.get(0);
    Assert.assertEquals("blog", entry.getSourceId());
    Assert.assertEquals(JobStatus.SUCCESS, entry.getStatus());
    Assert.assertEquals(1.0d, entry.getSizeMb(), 0.001d);

    HistoryEntry failed = reporter.history("api").get(0);
    Assert.assertEquals(JobStatus.FAILED, failed.getStatus());
    Assert.assertNull(failed.getSizeMb());

    Map<String, List<HistoryEntry>> all = reporter.history();
    Assert.assertEquals(Arrays.asList("blog", "api"), Arrays.asList(all.keySet().toArray()));
  }

  @Test
  public void testBackupsWithoutMetadata() {
    Mockito.when(store.listBackups("blog")).thenReturn(Collections.singletonList(
        new RemoteObject("backups/blog/20240301_030000_blog.tar.gz.enc", 10, NOW, Collections.singletonMap("checksum", "abc"))));

    List<RemoteObject> backups = reporter.backups("blog");
    Assert.assertEquals(1, backups.size());
    Assert.assertEquals("backups/blog/20240301_030000_blog.tar.gz.enc", backups.get(0).getKey());
    Assert.assertTrue(backups.get(0).getMetadata().isEmpty());
  }

  @Test
  public void testBackupsListingFailureIsReported() {
    RetentionException boom = new RetentionException("Could not list backups for blog: timeout", null);
    Mockito.when(store.listBackups("blog")).thenThrow(boom);
    try {
      reporter.backups("blog");
      Assert.fail("Expected a RetentionException");
    } catch (RetentionException e) {
      Assert.assertSame(boom, e);
    }
  }

  @Test
  public void testInvalidSourceId() {
    Assert.assertTrue(reporter.history("../etc").isEmpty());
    Assert.assertTrue(reporter.history(null).isEmpty());
    Assert.assertTrue(reporter.backups("blog/../../x").isEmpty());
    Mockito.verifyNoInteractions(store);
  }

  @Test
  public void testReadOnly() {
    registry.tryStart("blog");
    reporter.status();
    reporter.metrics();
    reporter.history();

    RunningJobState marker = registry.runningJobs().get("blog");
    Assert.assertTrue(marker.isRunning());
    Assert.assertTrue(registry.jobHistory().isEmpty());
  }

}
