package com.daveeberhart.backup_util.doksnap.storage;

import java.nio.file.Path;
import java.util.List;

import com.daveeberhart.backup_util.doksnap.archive.BackupMetadata;

/**
 * Where finished backups live.
 *
 * @author deberhar
 */
public interface BackupStore {

  /**
   * Store a backup.  Never throws for transfer problems; check {@link UploadResult#isSuccess()}.
   */
  UploadResult upload(Path p_file, BackupMetadata p_metadata);

  /**
   * @return Every stored backup of the source, newest first.
   * @throws com.daveeberhart.backup_util.doksnap.error.JobFailedException.RetentionException if the listing fails.
   */
  List<RemoteObject> listBackups(String p_sourceId);

  void deleteBackup(String p_key);

}
