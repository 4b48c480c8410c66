package com.daveeberhart.backup_util.doksnap.config;

import org.junit.Assert;
import org.junit.Test;

/**
 * @author deberhar
 */
public class CronSchedulesTest {

  @Test
  public void testFiveFieldsGetSeconds() {
    Assert.assertEquals("0 0 3 * * *", CronSchedules.toSpringCron("0 3 * * *"));
    Assert.assertEquals("0 */15 * * * MON-FRI", CronSchedules.toSpringCron("  */15 * * * MON-FRI "));
  }

  @Test
  public void testSixFieldsUnchanged() {
    Assert.assertEquals("30 0 3 * * *", CronSchedules.toSpringCron("30 0 3 * * *"));
  }

  @Test
  public void testValidity() {
    Assert.assertTrue(CronSchedules.isValid("0 3 * * *"));
    Assert.assertTrue(CronSchedules.isValid("0 0 */6 * * *"));
    Assert.assertFalse(CronSchedules.isValid("0 25 * * *"));
    Assert.assertFalse(CronSchedules.isValid("daily"));
    Assert.assertFalse(CronSchedules.isValid(null));
  }

}
