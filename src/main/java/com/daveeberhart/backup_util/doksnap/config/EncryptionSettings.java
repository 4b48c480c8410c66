package com.daveeberhart.backup_util.doksnap.config;

import java.nio.file.Path;

import com.daveeberhart.backup_util.doksnap.crypto.EncryptionMethod;

/**
 * Encryption method plus the materials it needs.
 * <p>
 * GPG uses {@link #getPublicKey()}, {@link #getKeyId()} and {@link #getKeyringFile()};
 * AES-256 uses {@link #getPassword()}.
 *
 * @author deberhar
 */
public final class EncryptionSettings {
  private final EncryptionMethod method;
  private final String publicKey;
  private final String keyId;
  private final Path keyringFile;
  private final String password;

  private EncryptionSettings(EncryptionMethod p_method, String p_publicKey, String p_keyId, Path p_keyringFile, String p_password) {
    method = p_method;
    publicKey = p_publicKey;
    keyId = p_keyId;
    keyringFile = p_keyringFile;
    password = p_password;
  }

  public static EncryptionSettings gpg(String p_armoredPublicKey, String p_keyId, Path p_keyringFile) {
    return new EncryptionSettings(EncryptionMethod.GPG, p_armoredPublicKey, p_keyId, p_keyringFile, null);
  }

  public static EncryptionSettings aes256(String p_password) {
    return new EncryptionSettings(EncryptionMethod.AES256, null, null, null, p_password);
  }

  public EncryptionMethod getMethod() {
    return method;
  }

  /** ASCII-armored public key to import. */
  public String getPublicKey() {
    return publicKey;
  }

  /** Explicit recipient fingerprint or key id, or null. */
  public String getKeyId() {
    return keyId;
  }

  /** Public keyring to seed the recipient lookup with, or null. */
  public Path getKeyringFile() {
    return keyringFile;
  }

  public String getPassword() {
    return password;
  }

  @Override
  public String toString() {
    return method.getId();
  }
}
