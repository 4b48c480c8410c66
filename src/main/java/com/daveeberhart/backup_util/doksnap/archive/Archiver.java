package com.daveeberhart.backup_util.doksnap.archive;

import java.nio.file.Path;

import com.daveeberhart.backup_util.doksnap.error.JobFailedException.ArchiveException;

/**
 * The external compress-and-pack capability.
 *
 * @author deberhar
 */
public interface Archiver {

  /**
   * Pack {@code p_source} (a directory) into the single compressed file {@code p_output}.
   *
   * @throws ArchiveException if the archiver can't be started or reports failure.
   */
  void archive(Path p_source, Path p_output);

}
