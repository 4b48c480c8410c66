package com.daveeberhart.backup_util.doksnap.job;

import java.util.regex.Pattern;

/**
 * Turns a job failure into something safe to keep in history and show on a status page.
 * <p>
 * Absolute paths and AWS access key ids are masked and the message is length-capped.  Stack
 * traces are never included.  With {@code -Dverbose=true} the cause chain is appended.
 *
 * @author deberhar
 */
public final class ErrorMessages {
  static final int MAX_LENGTH = 500;

  private static final Pattern ACCESS_KEY_ID = Pattern.compile("\\b(AKIA|ASIA)[A-Z0-9]{16}\\b");
  private static final Pattern ABSOLUTE_PATH = Pattern.compile("(?<![\\w.:/])/(?:[\\w.\\-]+/)*[\\w.\\-]+/?");

  private ErrorMessages() {
  }

  public static String sanitize(Throwable p_error) {
    return sanitize(p_error, Boolean.getBoolean("verbose"));
  }

  static String sanitize(Throwable p_error, boolean p_withCauses) {
    StringBuilder msg = new StringBuilder(describe(p_error));
    if (p_withCauses) {
      for (Throwable cause = p_error.getCause(); cause != null && cause != cause.getCause(); cause = cause.getCause()) {
        msg.append(" (caused by ").append(describe(cause)).append(')');
      }
    }

    String clean = ABSOLUTE_PATH.matcher(ACCESS_KEY_ID.matcher(msg).replaceAll("[redacted]")).replaceAll("[path]");
    return clean.length() > MAX_LENGTH ? clean.substring(0, MAX_LENGTH - 3) + "..." : clean;
  }

  private static String describe(Throwable p_error) {
    String msg = p_error.getMessage();
    return msg == null || msg.trim().isEmpty() ? p_error.getClass().getSimpleName() : msg;
  }
}
