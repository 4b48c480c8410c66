package com.daveeberhart.backup_util.doksnap.retention;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.Assert;
import org.junit.Test;

import com.daveeberhart.backup_util.doksnap.config.RetentionPolicy;
import com.daveeberhart.backup_util.doksnap.storage.RemoteObject;

/**
 * @author deberhar
 */
public class RetentionPlannerTest {
  /** A Wednesday. */
  private static final LocalDate TODAY = LocalDate.parse("2024-03-20");

  private static RemoteObject at(String p_timestamp) {
    return new RemoteObject("backups/blog/" + p_timestamp, 1024, Instant.parse(p_timestamp), null);
  }

  private static List<RemoteObject> newestFirst(String... p_timestamps) {
    List<RemoteObject> backups = new ArrayList<>();
    for (String ts : p_timestamps) {
      backups.add(at(ts));
    }
    Collections.sort(backups, (a, b) -> b.getLastModified().compareTo(a.getLastModified()));
    return backups;
  }

  private static Set<String> keys(String... p_timestamps) {
    Set<String> keys = new HashSet<>();
    for (String ts : p_timestamps) {
      keys.add("backups/blog/" + ts);
    }
    return keys;
  }

  /** Nine daily backups over three Sunday-based weeks (Mar 3, 10 and 17 are Sundays). */
  private static List<RemoteObject> threeWeeks() {
    return newestFirst(
        "2024-03-19T02:00:00Z", "2024-03-18T02:00:00Z", "2024-03-17T02:00:00Z",
        "2024-03-12T02:00:00Z", "2024-03-11T02:00:00Z", "2024-03-10T02:00:00Z",
        "2024-03-05T02:00:00Z", "2024-03-04T02:00:00Z", "2024-03-03T02:00:00Z");
  }

  @Test
  public void testEmptyPolicy() {
    Assert.assertTrue(RetentionPlanner.plan(threeWeeks(), RetentionPolicy.none(), TODAY).isEmpty());
  }

  @Test
  public void testKeepLast() {
    List<RemoteObject> backups = threeWeeks();
    Set<String> doomed = RetentionPlanner.plan(backups, new RetentionPolicy(3, null, null, null), TODAY);

    Assert.assertEquals(6, doomed.size());
    for (int i = 0; i < backups.size(); i++) {
      Assert.assertEquals(backups.get(i).getKey(), i >= 3, doomed.contains(backups.get(i).getKey()));
    }
  }

  @Test
  public void testKeepLastWithFewerBackups() {
    Assert.assertTrue(RetentionPlanner.plan(threeWeeks(), new RetentionPolicy(9, null, null, null), TODAY).isEmpty());
    Assert.assertTrue(RetentionPlanner.plan(threeWeeks(), new RetentionPolicy(20, null, null, null), TODAY).isEmpty());
  }

  @Test
  public void testBlogKeepLastAndWeekly() {
    List<RemoteObject> backups = threeWeeks();
    Set<String> doomed = RetentionPlanner.plan(backups, new RetentionPolicy(2, null, 1, null), TODAY);

    // keep_last has already marked everything past the newest two; weekly finds nothing left to thin.
    Assert.assertFalse(doomed.contains(backups.get(0).getKey()));
    Assert.assertFalse(doomed.contains(backups.get(1).getKey()));
    Assert.assertEquals(7, doomed.size());
  }

  @Test
  public void testWeeklyCollapsesOldWeeks() {
    Set<String> doomed = RetentionPlanner.plan(threeWeeks(), new RetentionPolicy(null, null, 1, null), TODAY);

    // Cutoff is Mar 13: the current week survives whole, the two older weeks keep only their newest.
    Assert.assertEquals(keys(
        "2024-03-11T02:00:00Z", "2024-03-10T02:00:00Z",
        "2024-03-04T02:00:00Z", "2024-03-03T02:00:00Z"), doomed);
  }

  @Test
  public void testWeeklyWindowCoversEverything() {
    Assert.assertTrue(RetentionPlanner.plan(threeWeeks(), new RetentionPolicy(null, null, 3, null), TODAY).isEmpty());
  }

  @Test
  public void testDaily() {
    List<RemoteObject> backups = newestFirst(
        "2024-03-19T03:00:00Z", "2024-03-19T02:00:00Z",
        "2024-03-18T03:00:00Z", "2024-03-18T02:00:00Z",
        "2024-03-10T03:00:00Z", "2024-03-10T02:00:00Z", "2024-03-10T01:00:00Z");
    Set<String> doomed = RetentionPlanner.plan(backups, new RetentionPolicy(null, 2, null, null), TODAY);

    // Mar 18 is the cutoff day itself and is left alone.
    Assert.assertEquals(keys("2024-03-10T02:00:00Z", "2024-03-10T01:00:00Z"), doomed);
  }

  @Test
  public void testMonthly() {
    List<RemoteObject> backups = newestFirst(
        "2024-02-25T02:00:00Z", "2024-02-10T02:00:00Z",
        "2024-01-25T02:00:00Z", "2024-01-15T02:00:00Z", "2024-01-05T02:00:00Z");
    Set<String> doomed = RetentionPlanner.plan(backups, new RetentionPolicy(null, null, null, 1), TODAY);

    // Cutoff is Feb 19; February's newest backup is after it.
    Assert.assertEquals(keys("2024-01-15T02:00:00Z", "2024-01-05T02:00:00Z"), doomed);
  }

  @Test
  public void testTiersOnlySeeWhatIsLeft() {
    List<RemoteObject> backups = newestFirst(
        "2024-03-19T02:00:00Z",
        "2024-03-01T03:00:00Z", "2024-03-01T02:00:00Z",
        "2024-01-20T03:00:00Z", "2024-01-20T02:00:00Z", "2024-01-10T02:00:00Z");
    Set<String> doomed = RetentionPlanner.plan(backups, new RetentionPolicy(null, 7, 2, 1), TODAY);

    // Daily thins Mar 1 and Jan 20; monthly then sees Jan 10 and the Jan 20 survivor.
    Assert.assertEquals(keys("2024-03-01T02:00:00Z", "2024-01-20T02:00:00Z", "2024-01-10T02:00:00Z"), doomed);
    Assert.assertEquals(Arrays.asList("backups/blog/2024-03-01T02:00:00Z", "backups/blog/2024-01-20T02:00:00Z"),
        new ArrayList<>(doomed).subList(0, 2));
  }

  @Test
  public void testIdempotent() {
    RetentionPolicy policy = new RetentionPolicy(5, 3, 1, 1);
    List<RemoteObject> backups = newestFirst(
        "2024-03-19T02:00:00Z", "2024-03-19T01:00:00Z", "2024-03-12T02:00:00Z", "2024-03-11T02:00:00Z",
        "2024-03-10T02:00:00Z", "2024-02-02T02:00:00Z", "2024-02-01T02:00:00Z");
    Set<String> doomed = RetentionPlanner.plan(backups, policy, TODAY);
    Assert.assertFalse(doomed.isEmpty());

    List<RemoteObject> survivors = new ArrayList<>();
    for (RemoteObject backup : backups) {
      if (!doomed.contains(backup.getKey())) {
        survivors.add(backup);
      }
    }
    Assert.assertTrue(RetentionPlanner.plan(survivors, policy, TODAY).isEmpty());
  }

  @Test
  public void testOneSurvivorPerOldBucket() {
    List<RemoteObject> backups = new ArrayList<>();
    for (int day = 28; day >= 1; day--) {
      backups.add(at(String.format("2024-02-%02dT04:00:00Z", day)));
      backups.add(at(String.format("2024-02-%02dT02:00:00Z", day)));
    }
    Set<String> doomed = RetentionPlanner.plan(backups, new RetentionPolicy(null, 1, null, null), TODAY);

    Assert.assertEquals(28, doomed.size());
    for (RemoteObject backup : backups) {
      Assert.assertEquals(backup.getKey(), backup.getKey().endsWith("T02:00:00Z"), doomed.contains(backup.getKey()));
    }
  }

  @Test
  public void testWeekOfYear() {
    // 2024's first Sunday is Jan 7; the days before it are week 0, like strftime %U.
    Assert.assertEquals("2024-W00", RetentionPlanner.weekOfYear(at("2024-01-06T23:59:59Z")));
    Assert.assertEquals("2024-W01", RetentionPlanner.weekOfYear(at("2024-01-07T00:00:00Z")));
    Assert.assertEquals("2024-W01", RetentionPlanner.weekOfYear(at("2024-01-13T12:00:00Z")));
    Assert.assertEquals("2023-W01", RetentionPlanner.weekOfYear(at("2023-01-01T00:00:00Z")));
    Assert.assertEquals("2024-W11", RetentionPlanner.weekOfYear(at("2024-03-17T02:00:00Z")));
  }

  @Test
  public void testUtcDate() {
    Assert.assertEquals(LocalDate.parse("2024-03-19"), RetentionPlanner.utcDate(at("2024-03-19T23:30:00Z")));
  }

}
