package com.daveeberhart.backup_util.doksnap.config;

/**
 * Layered keep-policy for one source.
 * <p>
 * Every tier is optional; a null tier deletes nothing.
 *
 * @author deberhar
 */
public final class RetentionPolicy {
  private static final RetentionPolicy NONE = new RetentionPolicy(null, null, null, null);

  private final Integer keepLast;
  private final Integer daily;
  private final Integer weekly;
  private final Integer monthly;

  public RetentionPolicy(Integer p_keepLast, Integer p_daily, Integer p_weekly, Integer p_monthly) {
    keepLast = requirePositive("keepLast", p_keepLast);
    daily = requirePositive("daily", p_daily);
    weekly = requirePositive("weekly", p_weekly);
    monthly = requirePositive("monthly", p_monthly);
  }

  /**
   * @return A policy that never deletes anything.
   */
  public static RetentionPolicy none() {
    return NONE;
  }

  /** Number of most-recent backups always kept, or null. */
  public Integer getKeepLast() {
    return keepLast;
  }

  /** Days within which every backup is kept, or null. */
  public Integer getDaily() {
    return daily;
  }

  /** Weeks within which every backup is kept, or null. */
  public Integer getWeekly() {
    return weekly;
  }

  /** Months (of 30 days) within which every backup is kept, or null. */
  public Integer getMonthly() {
    return monthly;
  }

  public boolean isEmpty() {
    return keepLast == null && daily == null && weekly == null && monthly == null;
  }

  private static Integer requirePositive(String p_tier, Integer p_value) {
    if (p_value != null && p_value < 1) {
      throw new IllegalArgumentException("Retention tier " + p_tier + " must be positive; was " + p_value);
    }
    return p_value;
  }

  @Override
  public String toString() {
    return "keep_last=" + keepLast + ", daily=" + daily + ", weekly=" + weekly + ", monthly=" + monthly;
  }
}
