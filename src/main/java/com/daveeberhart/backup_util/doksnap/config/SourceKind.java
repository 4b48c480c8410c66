package com.daveeberhart.backup_util.doksnap.config;

import com.daveeberhart.backup_util.doksnap.error.ConfigException;

/**
 * What kind of thing a {@link Source} points at.  Both are archived the same way.
 *
 * @author deberhar
 */
public enum SourceKind {
  VOLUME("volume"),
  DIRECTORY("directory");

  private final String id;

  private SourceKind(String p_id) {
    id = p_id;
  }

  /**
   * @return The lower-case name used in config files and object metadata.
   */
  public String getId() {
    return id;
  }

  public static SourceKind fromId(String p_id) {
    for (SourceKind kind : values()) {
      if (kind.id.equals(p_id)) {
        return kind;
      }
    }
    throw new ConfigException("Invalid source kind: " + p_id + ". Must be 'volume' or 'directory'");
  }

  @Override
  public String toString() {
    return id;
  }
}
