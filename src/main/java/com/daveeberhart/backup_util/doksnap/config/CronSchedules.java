package com.daveeberhart.backup_util.doksnap.config;

import org.springframework.scheduling.support.CronExpression;

/**
 * Crontab-style schedules are five fields; Spring wants six (leading seconds).
 *
 * @author deberhar
 */
public final class CronSchedules {

  private CronSchedules() {
  }

  /**
   * @param p_schedule A five-field crontab expression, or a six-field Spring one.
   * @return The six-field form, firing at second 0 for five-field input.
   */
  public static String toSpringCron(String p_schedule) {
    String trimmed = p_schedule.trim();
    if (trimmed.split("\\s+").length == 5) {
      return "0 " + trimmed;
    }
    return trimmed;
  }

  public static boolean isValid(String p_schedule) {
    return p_schedule != null && CronExpression.isValidExpression(toSpringCron(p_schedule));
  }

}
