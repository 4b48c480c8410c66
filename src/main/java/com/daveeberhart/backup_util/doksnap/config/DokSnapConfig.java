package com.daveeberhart.backup_util.doksnap.config;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * Fully validated daemon configuration.
 *
 * @author deberhar
 */
public final class DokSnapConfig {
  private final S3Settings s3;
  private final EncryptionSettings encryption;
  private final List<Source> sources;
  private final Path scratchDir;

  public DokSnapConfig(S3Settings p_s3, EncryptionSettings p_encryption, List<Source> p_sources, Path p_scratchDir) {
    s3 = p_s3;
    encryption = p_encryption;
    sources = Collections.unmodifiableList(p_sources);
    scratchDir = p_scratchDir;
  }

  public S3Settings getS3() {
    return s3;
  }

  public EncryptionSettings getEncryption() {
    return encryption;
  }

  public List<Source> getSources() {
    return sources;
  }

  /**
   * @return Directory the per-job temp directories are created in.
   */
  public Path getScratchDir() {
    return scratchDir;
  }
}
