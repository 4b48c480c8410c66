package com.daveeberhart.backup_util.doksnap.config;

/**
 * Optional commands run around a backup.
 *
 * @author deberhar
 */
public final class Hooks {
  private static final Hooks NONE = new Hooks(null, null);

  private final String preBackup;
  private final String postBackup;

  public Hooks(String p_preBackup, String p_postBackup) {
    preBackup = blankToNull(p_preBackup);
    postBackup = blankToNull(p_postBackup);
  }

  public static Hooks none() {
    return NONE;
  }

  /** Command run before archiving, or null. */
  public String getPreBackup() {
    return preBackup;
  }

  /** Command run after the backup is built (or has failed), or null. */
  public String getPostBackup() {
    return postBackup;
  }

  private static String blankToNull(String p_cmd) {
    return p_cmd == null || p_cmd.trim().isEmpty() ? null : p_cmd;
  }
}
