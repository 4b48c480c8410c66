package com.daveeberhart.backup_util.doksnap.error;

/**
 * A single backup job failed.
 * <p>
 * Caught at the orchestrator boundary; never takes down the daemon or other sources.
 *
 * @author deberhar
 */
public class JobFailedException extends RuntimeException {

  public JobFailedException(String p_mesg) {
    super(p_mesg);
  }

  public JobFailedException(String p_mesg, Exception e) {
    super(p_mesg, e);
  }

  /** The source path is missing or unreadable. */
  public static class SourceAccessException extends JobFailedException {
    public SourceAccessException(String p_mesg) {
      super(p_mesg);
    }
  }

  /** The archiver could not be started or reported a nonzero exit. */
  public static class ArchiveException extends JobFailedException {
    public ArchiveException(String p_mesg) {
      super(p_mesg);
    }

    public ArchiveException(String p_mesg, Exception p_e) {
      super(p_mesg, p_e);
    }
  }

  public static class SizeLimitExceededException extends JobFailedException {
    public SizeLimitExceededException(String p_mesg) {
      super(p_mesg);
    }
  }

  public static class EncryptionException extends JobFailedException {
    public EncryptionException(String p_mesg) {
      super(p_mesg);
    }

    public EncryptionException(String p_mesg, Exception p_e) {
      super(p_mesg, p_e);
    }
  }

  /** A pre/post hook was rejected, could not be found, or exited nonzero. */
  public static class HookException extends JobFailedException {
    public HookException(String p_mesg) {
      super(p_mesg);
    }

    public HookException(String p_mesg, Exception p_e) {
      super(p_mesg, p_e);
    }
  }

  public static class UploadException extends JobFailedException {
    public UploadException(String p_mesg) {
      super(p_mesg);
    }

    public UploadException(String p_mesg, Exception p_e) {
      super(p_mesg, p_e);
    }
  }

  /**
   * Retention could not list or delete backups.
   * <p>
   * Never fails a job: per-key failures are collected, listing failures are logged.
   */
  public static class RetentionException extends JobFailedException {
    private final String key;

    public RetentionException(String p_mesg, Exception p_e) {
      this(null, p_mesg, p_e);
    }

    public RetentionException(String p_key, String p_mesg, Exception p_e) {
      super(p_mesg, p_e);
      key = p_key;
    }

    /**
     * @return The object key that failed to delete, or null for a listing failure.
     */
    public String getKey() {
      return key;
    }
  }

}
