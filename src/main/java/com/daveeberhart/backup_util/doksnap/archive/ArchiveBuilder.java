package com.daveeberhart.backup_util.doksnap.archive;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.daveeberhart.backup_util.doksnap.config.Hooks;
import com.daveeberhart.backup_util.doksnap.config.Source;
import com.daveeberhart.backup_util.doksnap.crypto.Encryptor;
import com.daveeberhart.backup_util.doksnap.error.JobFailedException;
import com.daveeberhart.backup_util.doksnap.error.JobFailedException.ArchiveException;
import com.daveeberhart.backup_util.doksnap.error.JobFailedException.SizeLimitExceededException;
import com.daveeberhart.backup_util.doksnap.error.JobFailedException.SourceAccessException;

/**
 * Builds one encrypted, verified backup of a source.
 * <p>
 * The pipeline:
 * <ol>
 * <li>pre-backup hook</li>
 * <li>fresh owner-only scratch directory</li>
 * <li>tar.gz of the source, checked against {@value #MAX_BACKUP_SIZE} bytes</li>
 * <li>encryption into a sibling file, checked against 110% of that</li>
 * <li>SHA-256 of the encrypted bytes, metadata, and a verification pass</li>
 * <li>plaintext archive deleted</li>
 * <li>post-backup hook, on every exit path once the pre-backup hook has succeeded</li>
 * </ol>
 * On failure the scratch directory is removed before the error propagates.
 *
 * @author deberhar
 */
public class ArchiveBuilder {
  private static final Logger logger = LoggerFactory.getLogger(ArchiveBuilder.class);

  /** 100GB */
  static final long MAX_BACKUP_SIZE = 100L * 1024L * 1024L * 1024L;
  private static final long MEGABYTE = 1024L * 1024L;
  static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

  private final Archiver archiver;
  private final Encryptor encryptor;
  private final HookRunner hookRunner;
  private final ScratchSpace scratch;
  private final Clock clock;
  private final long maxArchiveSize;
  private final long maxEncryptedSize;

  public ArchiveBuilder(Archiver p_archiver, Encryptor p_encryptor, HookRunner p_hookRunner, ScratchSpace p_scratch) {
    this(p_archiver, p_encryptor, p_hookRunner, p_scratch, Clock.systemUTC(), MAX_BACKUP_SIZE);
  }

  ArchiveBuilder(Archiver p_archiver, Encryptor p_encryptor, HookRunner p_hookRunner, ScratchSpace p_scratch, Clock p_clock, long p_maxArchiveSize) {
    archiver = p_archiver;
    encryptor = p_encryptor;
    hookRunner = p_hookRunner;
    scratch = p_scratch;
    clock = p_clock;
    maxArchiveSize = p_maxArchiveSize;
    maxEncryptedSize = p_maxArchiveSize + p_maxArchiveSize / 10; // Allow 10% overhead for encryption
  }

  /**
   * Build, encrypt and verify a backup of {@code p_source}.
   *
   * @return The encrypted file.  The caller owns it and must close it.
   */
  public BackupArtifact build(Source p_source) {
    Hooks hooks = p_source.getHooks();
    if (hooks.getPreBackup() != null) {
      hookRunner.run(p_source.getId() + " pre-backup", hooks.getPreBackup());
    }

    BackupArtifact artifact;
    try {
      artifact = buildArtifact(p_source);
    } catch (RuntimeException | Error e) {
      runPostHookAfterFailure(p_source, e);
      throw e;
    }

    if (hooks.getPostBackup() != null) {
      try {
        hookRunner.run(p_source.getId() + " post-backup", hooks.getPostBackup());
      } catch (RuntimeException | Error e) {
        artifact.close();
        throw e;
      }
    }
    return artifact;
  }

  private void runPostHookAfterFailure(Source p_source, Throwable p_failure) {
    String postBackup = p_source.getHooks().getPostBackup();
    if (postBackup == null) {
      return;
    }

    try {
      hookRunner.run(p_source.getId() + " post-backup", postBackup);
    } catch (RuntimeException e) {
      logger.warn("[{}] Post-backup hook failed after a failed backup: {}", p_source.getId(), e.getMessage());
      p_failure.addSuppressed(e);
    }
  }

  private BackupArtifact buildArtifact(Source p_source) {
    Instant started = clock.instant();
    checkSourceAccess(p_source);

    Path workDir;
    try {
      workDir = scratch.createJobDirectory(p_source.getId());
    } catch (IOException e) {
      throw new JobFailedException("Could not create a scratch directory: " + e.getMessage(), e);
    }

    try {
      String baseName = p_source.getId() + "_" + FILE_TIMESTAMP.format(started);
      Path tarFile = workDir.resolve(baseName + ".tar.gz");
      Path encryptedFile = workDir.resolve(baseName + ".tar.gz." + encryptor.getMethod().getFileExtension());

      logger.info("[{}] Archiving source", p_source.getId());
      archiver.archive(p_source.getPath(), tarFile);

      long archiveSize = Files.size(tarFile);
      if (archiveSize > maxArchiveSize) {
        throw new SizeLimitExceededException("Backup size (" + archiveSize / MEGABYTE + "MB) exceeds maximum allowed size ("
            + maxArchiveSize / MEGABYTE + "MB)");
      }

      logger.info("[{}] Encrypting archive ({})", p_source.getId(), encryptor.getMethod());
      encryptor.encrypt(tarFile, encryptedFile);

      long encryptedSize = Files.size(encryptedFile);
      if (encryptedSize > maxEncryptedSize) {
        throw new SizeLimitExceededException("Encrypted backup size (" + encryptedSize / MEGABYTE + "MB) exceeds maximum allowed size ("
            + maxEncryptedSize / MEGABYTE + "MB)");
      }

      double duration = Duration.between(started, clock.instant()).toMillis() / 1000d;
      BackupMetadata metadata = new BackupMetadata(
          p_source.getId(),
          started,
          encryptedFile.getFileName().toString(),
          encryptedSize,
          archiveSize,
          Checksums.sha256Hex(encryptedFile),
          Math.round(duration * 100d) / 100d,
          encryptor.getMethod(),
          p_source.getKind());

      verify(encryptedFile, metadata);
      Files.deleteIfExists(tarFile);

      logger.info("[{}] Built backup {}", p_source.getId(), metadata);
      return new BackupArtifact(encryptedFile, metadata, workDir, scratch);
    } catch (IOException e) {
      scratch.release(workDir);
      throw new ArchiveException("I/O error while building backup: " + e.getMessage(), e);
    } catch (RuntimeException | Error e) {
      scratch.release(workDir);
      throw e;
    }
  }

  private static void checkSourceAccess(Source p_source) {
    Path path = p_source.getPath();
    if (!Files.exists(path) || !Files.isReadable(path)) {
      throw new SourceAccessException("Source path for " + p_source.getId() + " is missing or unreadable");
    }
  }

  /**
   * Make sure the file we're about to upload is really the one we described.
   */
  private static void verify(Path p_file, BackupMetadata p_metadata) throws IOException {
    if (!Files.isRegularFile(p_file) || !Files.isReadable(p_file)) {
      throw new JobFailedException("Backup file is not accessible: " + p_file.getFileName());
    }
    if (Files.size(p_file) == 0) {
      throw new JobFailedException("Backup file is empty: " + p_file.getFileName());
    }
    if (p_metadata.getChecksum() == null || p_metadata.getChecksum().isEmpty()) {
      throw new JobFailedException("Backup checksum is missing");
    }
    if (!Checksums.sha256Hex(p_file).equals(p_metadata.getChecksum())) {
      throw new JobFailedException("Backup checksum verification failed");
    }
  }

}
