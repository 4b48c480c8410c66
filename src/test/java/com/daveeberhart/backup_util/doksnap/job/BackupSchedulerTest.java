package com.daveeberhart.backup_util.doksnap.job;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

import org.junit.Assert;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mockito;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import com.daveeberhart.backup_util.doksnap.config.Source;
import com.daveeberhart.backup_util.doksnap.config.SourceKind;

/**
 * @author deberhar
 */
public class BackupSchedulerTest {
  private final Source blog = new Source("blog", SourceKind.DIRECTORY, Paths.get("/data/blog"), "0 3 * * *", null, null);
  private final Source api = new Source("api", SourceKind.VOLUME, Paths.get("/var/lib/docker/volumes/api"), "30 */6 * * * *", null, null);

  private final BackupOrchestrator orchestrator = Mockito.mock(BackupOrchestrator.class);
  private final ThreadPoolTaskScheduler taskScheduler = Mockito.mock(ThreadPoolTaskScheduler.class);
  private final ScheduledFuture<?> blogFuture = Mockito.mock(ScheduledFuture.class);
  private final ScheduledFuture<?> apiFuture = Mockito.mock(ScheduledFuture.class);

  private final BackupScheduler scheduler = new BackupScheduler(Arrays.asList(blog, api), orchestrator, taskScheduler);

  public BackupSchedulerTest() {
    Mockito.doReturn(blogFuture, apiFuture).when(taskScheduler).schedule(Mockito.any(Runnable.class), Mockito.any(Trigger.class));
  }

  @Test
  public void testStartSchedulesEverySource() {
    scheduler.start();

    ArgumentCaptor<Runnable> tasks = ArgumentCaptor.forClass(Runnable.class);
    ArgumentCaptor<Trigger> triggers = ArgumentCaptor.forClass(Trigger.class);
    Mockito.verify(taskScheduler, Mockito.times(2)).schedule(tasks.capture(), triggers.capture());

    List<Trigger> captured = triggers.getAllValues();
    Assert.assertEquals("0 0 3 * * *", ((SourceCronTrigger)captured.get(0)).getExpression());
    Assert.assertEquals("blog", ((SourceCronTrigger)captured.get(0)).getSourceId());
    Assert.assertEquals("30 */6 * * * *", ((SourceCronTrigger)captured.get(1)).getExpression());
    Assert.assertEquals("api", ((SourceCronTrigger)captured.get(1)).getSourceId());

    Mockito.verifyNoInteractions(orchestrator);
    tasks.getAllValues().get(1).run();
    Mockito.verify(orchestrator).trigger(api);
    tasks.getAllValues().get(0).run();
    Mockito.verify(orchestrator).trigger(blog);
  }

  @Test
  public void testStopCancelsThenDrains() {
    scheduler.start();
    scheduler.stop();

    InOrder order = Mockito.inOrder(blogFuture, apiFuture, taskScheduler);
    order.verify(blogFuture).cancel(false);
    order.verify(apiFuture).cancel(false);
    order.verify(taskScheduler).shutdown();
  }

  @Test
  public void testCreateTaskScheduler() {
    ThreadPoolTaskScheduler real = BackupScheduler.createTaskScheduler(3);
    try {
      Assert.assertEquals(4, real.getScheduledThreadPoolExecutor().getCorePoolSize());
      Assert.assertFalse(real.getScheduledThreadPoolExecutor().getExecuteExistingDelayedTasksAfterShutdownPolicy());
      Assert.assertTrue(real.getScheduledThreadPoolExecutor().getRemoveOnCancelPolicy());
    } finally {
      real.shutdown();
    }
  }

}
