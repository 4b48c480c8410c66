package com.daveeberhart.backup_util.doksnap.job;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import com.daveeberhart.backup_util.doksnap.config.CronSchedules;
import com.daveeberhart.backup_util.doksnap.config.Source;

/**
 * Fires every source's backups on its cron schedule (UTC).
 * <p>
 * One pool thread per source, so a slow source never holds up another.  A source's next fire is
 * only computed after its previous run finishes, so fires missed during a long run are logged and
 * dropped rather than queued.  Stopping cancels all triggers and then waits for jobs already in
 * flight to finish.
 *
 * @author deberhar
 */
public class BackupScheduler {
  private static final Logger logger = LoggerFactory.getLogger(BackupScheduler.class);

  private final List<Source> sources;
  private final BackupOrchestrator orchestrator;
  private final ThreadPoolTaskScheduler taskScheduler;
  private final List<ScheduledFuture<?>> triggers = new ArrayList<>();

  public BackupScheduler(List<Source> p_sources, BackupOrchestrator p_orchestrator, ThreadPoolTaskScheduler p_taskScheduler) {
    sources = p_sources;
    orchestrator = p_orchestrator;
    taskScheduler = p_taskScheduler;
  }

  /**
   * A task scheduler sized for the given number of sources, plus a thread for bookkeeping.
   * Shutting it down waits for running backups; pending delayed tasks are dropped.
   */
  public static ThreadPoolTaskScheduler createTaskScheduler(int p_sourceCount) {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(p_sourceCount + 1);
    scheduler.setThreadNamePrefix("doksnap-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(Integer.MAX_VALUE);
    scheduler.initialize();
    scheduler.getScheduledThreadPoolExecutor().setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return scheduler;
  }

  public synchronized void start() {
    for (Source source : sources) {
      SourceCronTrigger trigger = new SourceCronTrigger(source.getId(), CronSchedules.toSpringCron(source.getSchedule()));
      triggers.add(taskScheduler.schedule(() -> orchestrator.trigger(source), trigger));
      logger.info("Scheduled {} with cron '{}'", source, source.getSchedule());
    }
    logger.info("Scheduler started with {} source(s)", sources.size());
  }

  /**
   * Stop firing, and wait for in-flight backups.  There's no timeout: a stuck job blocks shutdown.
   */
  public synchronized void stop() {
    logger.info("Stopping scheduler; waiting for running backups to finish");
    for (ScheduledFuture<?> trigger : triggers) {
      trigger.cancel(false);
    }
    triggers.clear();
    taskScheduler.shutdown();
    logger.info("Scheduler stopped");
  }

}
