package com.daveeberhart.backup_util.doksnap.archive;

import java.nio.file.Path;

/**
 * An encrypted backup on local disk, plus its metadata.
 * <p>
 * Owns the job's scratch directory: {@link #close()} deletes the file and the directory.
 *
 * @author deberhar
 */
public class BackupArtifact implements AutoCloseable {
  private final Path file;
  private final BackupMetadata metadata;
  private final Path workDir;
  private final ScratchSpace scratch;

  BackupArtifact(Path p_file, BackupMetadata p_metadata, Path p_workDir, ScratchSpace p_scratch) {
    file = p_file;
    metadata = p_metadata;
    workDir = p_workDir;
    scratch = p_scratch;
  }

  public Path getFile() {
    return file;
  }

  public BackupMetadata getMetadata() {
    return metadata;
  }

  /**
   * Remove the local copy.  Safe to call more than once; never throws.
   */
  @Override
  public void close() {
    scratch.release(workDir);
  }

}
