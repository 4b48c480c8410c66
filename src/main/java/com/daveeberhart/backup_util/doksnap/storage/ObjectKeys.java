package com.daveeberhart.backup_util.doksnap.storage;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import com.daveeberhart.backup_util.doksnap.archive.BackupMetadata;

/**
 * Object key layout: {@code backups/<sourceId>/<yyyyMMdd_HHmmss>_<filename>}.
 *
 * @author deberhar
 */
public final class ObjectKeys {
  public static final String ROOT = "backups/";

  private static final DateTimeFormatter COMPACT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

  private ObjectKeys() {
  }

  public static String keyFor(BackupMetadata p_metadata) {
    return prefixFor(p_metadata.getSourceId())
        + COMPACT.format(p_metadata.getTimestamp())
        + "_" + sanitizeFilename(p_metadata.getFilename());
  }

  /**
   * @return The listing prefix for one source, with trailing slash.
   */
  public static String prefixFor(String p_sourceId) {
    return ROOT + sanitizeSourceId(p_sourceId) + "/";
  }

  static String sanitizeSourceId(String p_sourceId) {
    return p_sourceId.replaceAll("[^a-zA-Z0-9_\\-]", "_");
  }

  static String sanitizeFilename(String p_filename) {
    return p_filename.replaceAll("[^a-zA-Z0-9_.\\-]", "_");
  }
}
