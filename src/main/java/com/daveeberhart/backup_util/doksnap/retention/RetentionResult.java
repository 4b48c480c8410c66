package com.daveeberhart.backup_util.doksnap.retention;

import java.util.Collections;
import java.util.List;

import com.daveeberhart.backup_util.doksnap.error.JobFailedException.RetentionException;

/**
 * What one retention pass actually deleted, and what it failed to.
 *
 * @author deberhar
 */
public final class RetentionResult {
  private static final RetentionResult NOTHING = new RetentionResult(Collections.<String>emptyList(), Collections.<RetentionException>emptyList());

  private final List<String> deletedKeys;
  private final List<RetentionException> failures;

  public RetentionResult(List<String> p_deletedKeys, List<RetentionException> p_failures) {
    deletedKeys = Collections.unmodifiableList(p_deletedKeys);
    failures = Collections.unmodifiableList(p_failures);
  }

  public static RetentionResult nothing() {
    return NOTHING;
  }

  public int getDeletedCount() {
    return deletedKeys.size();
  }

  public List<String> getDeletedKeys() {
    return deletedKeys;
  }

  /**
   * @return One entry per key that should have been deleted but wasn't.
   */
  public List<RetentionException> getFailures() {
    return failures;
  }
}
