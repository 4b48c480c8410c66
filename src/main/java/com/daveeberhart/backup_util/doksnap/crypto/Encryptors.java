package com.daveeberhart.backup_util.doksnap.crypto;

import com.daveeberhart.backup_util.doksnap.config.EncryptionSettings;

/**
 * @author deberhar
 */
public final class Encryptors {

  private Encryptors() {
  }

  public static Encryptor create(EncryptionSettings p_settings) {
    switch (p_settings.getMethod()) {
    case GPG:
      return new GpgEncryptor(p_settings.getPublicKey(), p_settings.getKeyId(), p_settings.getKeyringFile());
    case AES256:
      return new Aes256Encryptor(p_settings.getPassword());
    default:
      throw new IllegalArgumentException("Unsupported encryption method: " + p_settings.getMethod());
    }
  }

}
