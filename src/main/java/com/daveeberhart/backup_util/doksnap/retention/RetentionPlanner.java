package com.daveeberhart.backup_util.doksnap.retention;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.WeekFields;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import com.daveeberhart.backup_util.doksnap.config.RetentionPolicy;
import com.daveeberhart.backup_util.doksnap.storage.RemoteObject;

/**
 * Decides which backups a {@link RetentionPolicy} no longer wants.
 * <p>
 * The tiers are applied in order, each to the backups the earlier tiers left alone:
 * <ol>
 * <li>keep_last N: everything past the newest N goes.</li>
 * <li>daily D: per UTC calendar day older than D days, only the newest backup stays.</li>
 * <li>weekly W: per Sunday-based week (as {@code strftime %U}) older than 7W days, only the newest stays.</li>
 * <li>monthly M: per calendar month older than 30M days, only the newest stays.</li>
 * </ol>
 * A day/week/month bucket's age is the date of its newest backup, and only buckets strictly
 * older than the cutoff are thinned.  Planning touches nothing; it's a pure function of its
 * inputs, so running it twice over the same listing gives the same answer.
 *
 * @author deberhar
 */
public final class RetentionPlanner {
  /** Week 1 starts on the year's first Sunday; days before it are week 0. */
  private static final WeekFields SUNDAY_WEEKS = WeekFields.of(DayOfWeek.SUNDAY, 7);

  private static final Comparator<RemoteObject> OLDEST_FIRST = Comparator
      .comparing(RemoteObject::getLastModified)
      .thenComparing(RemoteObject::getKey);

  private RetentionPlanner() {
  }

  /**
   * @param p_newestFirst The source's backups, newest first.
   * @param p_today Today's UTC date.
   * @return Keys to delete, in the order the tiers chose them.
   */
  public static Set<String> plan(List<RemoteObject> p_newestFirst, RetentionPolicy p_policy, LocalDate p_today) {
    Set<String> doomed = new LinkedHashSet<>();

    if (p_policy.getKeepLast() != null && p_newestFirst.size() > p_policy.getKeepLast()) {
      for (RemoteObject backup : p_newestFirst.subList(p_policy.getKeepLast(), p_newestFirst.size())) {
        doomed.add(backup.getKey());
      }
    }

    if (p_policy.getDaily() != null) {
      thin(remaining(p_newestFirst, doomed), RetentionPlanner::utcDate,
          p_today.minusDays(p_policy.getDaily()), doomed);
    }

    if (p_policy.getWeekly() != null) {
      thin(remaining(p_newestFirst, doomed), RetentionPlanner::weekOfYear,
          p_today.minusDays(7L * p_policy.getWeekly()), doomed);
    }

    if (p_policy.getMonthly() != null) {
      thin(remaining(p_newestFirst, doomed), RetentionPlanner::monthOfYear,
          p_today.minusDays(30L * p_policy.getMonthly()), doomed);
    }

    return doomed;
  }

  /**
   * Bucket the backups, and in every bucket older than the cutoff mark all but the newest.
   */
  private static void thin(List<RemoteObject> p_backups, Function<RemoteObject, Object> p_bucketKey, LocalDate p_cutoff, Set<String> p_doomed) {
    Map<Object, List<RemoteObject>> buckets = new LinkedHashMap<>();
    for (RemoteObject backup : p_backups) {
      buckets.computeIfAbsent(p_bucketKey.apply(backup), k -> new ArrayList<>()).add(backup);
    }

    for (List<RemoteObject> bucket : buckets.values()) {
      bucket.sort(OLDEST_FIRST);
      RemoteObject newest = bucket.get(bucket.size() - 1);
      if (utcDate(newest).isBefore(p_cutoff)) {
        for (RemoteObject backup : bucket.subList(0, bucket.size() - 1)) {
          p_doomed.add(backup.getKey());
        }
      }
    }
  }

  private static List<RemoteObject> remaining(List<RemoteObject> p_backups, Set<String> p_doomed) {
    List<RemoteObject> remaining = new ArrayList<>();
    for (RemoteObject backup : p_backups) {
      if (!p_doomed.contains(backup.getKey())) {
        remaining.add(backup);
      }
    }
    return remaining;
  }

  static LocalDate utcDate(RemoteObject p_backup) {
    return p_backup.getLastModified().atZone(ZoneOffset.UTC).toLocalDate();
  }

  static String weekOfYear(RemoteObject p_backup) {
    LocalDate date = utcDate(p_backup);
    return String.format("%d-W%02d", date.getYear(), date.get(SUNDAY_WEEKS.weekOfYear()));
  }

  private static String monthOfYear(RemoteObject p_backup) {
    LocalDate date = utcDate(p_backup);
    return String.format("%d-%02d", date.getYear(), date.getMonthValue());
  }

}
