package com.daveeberhart.backup_util.doksnap.storage;

/**
 * Outcome of {@link BackupStore#upload}.
 *
 * @author deberhar
 */
public final class UploadResult {
  private final String key;
  private final boolean success;
  private final Exception error;

  private UploadResult(String p_key, boolean p_success, Exception p_error) {
    key = p_key;
    success = p_success;
    error = p_error;
  }

  public static UploadResult success(String p_key) {
    return new UploadResult(p_key, true, null);
  }

  public static UploadResult failure(String p_key, Exception p_error) {
    return new UploadResult(p_key, false, p_error);
  }

  /**
   * @return The object key; set even when the upload failed.
   */
  public String getKey() {
    return key;
  }

  public boolean isSuccess() {
    return success;
  }

  /**
   * @return What went wrong, or null on success.
   */
  public Exception getError() {
    return error;
  }
}
