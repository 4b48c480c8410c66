package com.daveeberhart.backup_util.doksnap.archive;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

import com.daveeberhart.backup_util.doksnap.config.SourceKind;
import com.daveeberhart.backup_util.doksnap.crypto.EncryptionMethod;

/**
 * Everything we know about one built backup.  Travels with the file to the object store.
 *
 * @author deberhar
 */
public final class BackupMetadata {
  private static final double MEGABYTE = 1024d * 1024d;

  private final String sourceId;
  private final Instant timestamp;
  private final String filename;
  private final long size;
  private final long archiveSize;
  private final String checksum;
  private final double durationSeconds;
  private final EncryptionMethod encryptionMethod;
  private final SourceKind sourceKind;

  public BackupMetadata(String p_sourceId, Instant p_timestamp, String p_filename, long p_size, long p_archiveSize,
      String p_checksum, double p_durationSeconds, EncryptionMethod p_encryptionMethod, SourceKind p_sourceKind) {
    sourceId = p_sourceId;
    timestamp = p_timestamp.truncatedTo(ChronoUnit.SECONDS);
    filename = p_filename;
    size = p_size;
    archiveSize = p_archiveSize;
    checksum = p_checksum;
    durationSeconds = p_durationSeconds;
    encryptionMethod = p_encryptionMethod;
    sourceKind = p_sourceKind;
  }

  public String getSourceId() {
    return sourceId;
  }

  /**
   * @return When the backup was started, UTC, whole seconds.
   */
  public Instant getTimestamp() {
    return timestamp;
  }

  /**
   * @return ISO-8601 form of {@link #getTimestamp()}, e.g. {@code 2024-03-01T02:00:00Z}.
   */
  public String getTimestampIso() {
    return DateTimeFormatter.ISO_INSTANT.format(timestamp);
  }

  /**
   * @return Name of the encrypted file.
   */
  public String getFilename() {
    return filename;
  }

  /**
   * @return Size of the encrypted file in bytes.
   */
  public long getSize() {
    return size;
  }

  public double getSizeMb() {
    return Math.round(size / MEGABYTE * 100d) / 100d;
  }

  /**
   * @return Size of the plaintext archive in bytes, before encryption.
   */
  public long getArchiveSize() {
    return archiveSize;
  }

  /**
   * @return Hex SHA-256 of the encrypted bytes (what's actually stored).
   */
  public String getChecksum() {
    return checksum;
  }

  public double getDurationSeconds() {
    return durationSeconds;
  }

  public EncryptionMethod getEncryptionMethod() {
    return encryptionMethod;
  }

  public SourceKind getSourceKind() {
    return sourceKind;
  }

  @Override
  public String toString() {
    return filename + " (" + getSizeMb() + "MB, " + durationSeconds + "s, sha256 " + checksum + ")";
  }
}
