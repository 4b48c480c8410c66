package com.daveeberhart.backup_util.doksnap.job;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Date;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TriggerContext;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;

/**
 * A UTC cron trigger for one source that logs the fires it drops.
 * <p>
 * Spring only computes the next fire once the previous run has finished, so fires that come due
 * while a backup is still running never reach the job registry.  They're logged here instead.
 *
 * @author deberhar
 */
class SourceCronTrigger extends CronTrigger {
  private static final Logger logger = LoggerFactory.getLogger(SourceCronTrigger.class);

  private final String sourceId;
  private final CronExpression cron;

  SourceCronTrigger(String p_sourceId, String p_springCron) {
    super(p_springCron, ZoneOffset.UTC);
    sourceId = p_sourceId;
    cron = CronExpression.parse(p_springCron);
  }

  @Override
  public Date nextExecutionTime(TriggerContext p_ctx) {
    Instant missed = missedFire(p_ctx);
    if (missed != null) {
      logger.info("Skipping backup for {}: previous backup still running at {}", sourceId, missed);
    }
    return super.nextExecutionTime(p_ctx);
  }

  /**
   * The first fire that came due while the last run was still going, or null if none did.
   */
  Instant missedFire(TriggerContext p_ctx) {
    Date scheduled = p_ctx.lastScheduledExecutionTime();
    Date completed = p_ctx.lastCompletionTime();
    if (scheduled == null || completed == null) {
      return null;
    }

    ZonedDateTime next = cron.next(scheduled.toInstant().atZone(ZoneOffset.UTC));
    if (next == null || !next.toInstant().isBefore(completed.toInstant())) {
      return null;
    }
    return next.toInstant();
  }

  String getSourceId() {
    return sourceId;
  }

}
