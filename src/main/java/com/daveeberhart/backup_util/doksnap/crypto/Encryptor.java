package com.daveeberhart.backup_util.doksnap.crypto;

import java.nio.file.Path;

import com.daveeberhart.backup_util.doksnap.error.JobFailedException.EncryptionException;

/**
 * Turns a plaintext archive into an encrypted file.
 * <p>
 * Implementations are chosen once at startup (see {@link Encryptors#create}) and shared by every
 * source, so they must be safe to call from several job threads at once.
 *
 * @author deberhar
 */
public interface Encryptor {

  EncryptionMethod getMethod();

  /**
   * Encrypt {@code p_in} into {@code p_out}, replacing any existing file.
   *
   * @throws EncryptionException on any cryptographic or I/O fault.  No partial output is left behind.
   */
  void encrypt(Path p_in, Path p_out);

}
