package com.daveeberhart.backup_util.doksnap;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import com.amazonaws.services.s3.AmazonS3;
import com.daveeberhart.backup_util.doksnap.archive.ArchiveBuilder;
import com.daveeberhart.backup_util.doksnap.archive.HookRunner;
import com.daveeberhart.backup_util.doksnap.archive.ScratchSpace;
import com.daveeberhart.backup_util.doksnap.archive.TarArchiver;
import com.daveeberhart.backup_util.doksnap.config.DokSnapConfig;
import com.daveeberhart.backup_util.doksnap.crypto.Encryptors;
import com.daveeberhart.backup_util.doksnap.job.BackupOrchestrator;
import com.daveeberhart.backup_util.doksnap.job.BackupScheduler;
import com.daveeberhart.backup_util.doksnap.job.JobRegistry;
import com.daveeberhart.backup_util.doksnap.retention.RetentionEnforcer;
import com.daveeberhart.backup_util.doksnap.status.StatusReporter;
import com.daveeberhart.backup_util.doksnap.storage.S3BackupStore;

/**
 * The running backup daemon: everything wired together, plus start/stop.
 * <p>
 * Stopping drains the scheduler first, and only then removes leftover scratch directories, so a
 * job that's still finishing never has its files pulled out from under it.
 *
 * @author deberhar
 */
public class Daemon {
  private static final Logger logger = LoggerFactory.getLogger(Daemon.class);

  private final ScratchSpace scratch;
  private final BackupScheduler scheduler;
  private final StatusReporter statusReporter;
  private final AmazonS3 s3;

  private final AtomicBoolean stopping = new AtomicBoolean();
  private final CountDownLatch stopped = new CountDownLatch(1);

  Daemon(ScratchSpace p_scratch, BackupScheduler p_scheduler, StatusReporter p_statusReporter, AmazonS3 p_s3) {
    scratch = p_scratch;
    scheduler = p_scheduler;
    statusReporter = p_statusReporter;
    s3 = p_s3;
  }

  /**
   * Build a daemon from a validated config.  Nothing is scheduled until {@link #start()}.
   */
  public static Daemon create(DokSnapConfig p_config) {
    ScratchSpace scratch = new ScratchSpace(p_config.getScratchDir());
    ArchiveBuilder builder = new ArchiveBuilder(
        new TarArchiver(),
        Encryptors.create(p_config.getEncryption()),
        new HookRunner(),
        scratch);

    AmazonS3 s3 = S3BackupStore.createClient(p_config.getS3());
    S3BackupStore store = new S3BackupStore(s3, p_config.getS3().getBucket());

    ThreadPoolTaskScheduler taskScheduler = BackupScheduler.createTaskScheduler(p_config.getSources().size());
    JobRegistry registry = new JobRegistry(taskScheduler);
    BackupOrchestrator orchestrator = new BackupOrchestrator(builder, store, new RetentionEnforcer(store), registry);

    return new Daemon(
        scratch,
        new BackupScheduler(p_config.getSources(), orchestrator, taskScheduler),
        new StatusReporter(p_config.getSources(), registry, store),
        s3);
  }

  public void start() {
    int swept = scratch.sweepStale();
    if (swept > 0) {
      logger.info("Removed {} scratch directories left over from an earlier run", swept);
    }
    scheduler.start();
  }

  /**
   * Stop scheduling, wait for running jobs, then clean up.  Only the first call does anything.
   */
  public void stop() {
    if (!stopping.compareAndSet(false, true)) {
      return;
    }

    try {
      scheduler.stop();
      scratch.releaseAll();
      s3.shutdown();
    } finally {
      stopped.countDown();
    }
  }

  /**
   * Block until {@link #stop()} has finished.
   */
  public void awaitStop() throws InterruptedException {
    stopped.await();
  }

  public StatusReporter getStatusReporter() {
    return statusReporter;
  }

}
