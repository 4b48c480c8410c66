package com.daveeberhart.backup_util.doksnap.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A named backup target.  Immutable once loaded.
 *
 * @author deberhar
 */
public final class Source {
  private final String id;
  private final SourceKind kind;
  private final Path path;
  private final String schedule;
  private final RetentionPolicy retention;
  private final Hooks hooks;

  public Source(String p_id, SourceKind p_kind, Path p_path, String p_schedule, RetentionPolicy p_retention, Hooks p_hooks) {
    id = Objects.requireNonNull(p_id, "id");
    kind = Objects.requireNonNull(p_kind, "kind");
    path = Objects.requireNonNull(p_path, "path");
    schedule = Objects.requireNonNull(p_schedule, "schedule");
    retention = p_retention == null ? RetentionPolicy.none() : p_retention;
    hooks = p_hooks == null ? Hooks.none() : p_hooks;
  }

  public String getId() {
    return id;
  }

  public SourceKind getKind() {
    return kind;
  }

  public Path getPath() {
    return path;
  }

  /**
   * @return The cron expression as configured (five or six fields).
   */
  public String getSchedule() {
    return schedule;
  }

  public RetentionPolicy getRetention() {
    return retention;
  }

  public Hooks getHooks() {
    return hooks;
  }

  @Override
  public String toString() {
    return id + " (" + kind + ")";
  }
}
