package com.daveeberhart.backup_util.doksnap.crypto;

/**
 * The supported encryption schemes.
 *
 * @author deberhar
 */
public enum EncryptionMethod {
  /** OpenPGP public-key encryption to a single recipient. */
  GPG("gpg", "gpg"),
  /** Passphrase-based AES-256-CBC with a self-describing salt/IV header. */
  AES256("aes256", "enc");

  private final String id;
  private final String fileExtension;

  private EncryptionMethod(String p_id, String p_fileExtension) {
    id = p_id;
    fileExtension = p_fileExtension;
  }

  /**
   * @return Name used in config files and object metadata.
   */
  public String getId() {
    return id;
  }

  /**
   * @return Extension appended to the archive name, without the dot.
   */
  public String getFileExtension() {
    return fileExtension;
  }

  public static EncryptionMethod fromId(String p_id) {
    for (EncryptionMethod method : values()) {
      if (method.id.equals(p_id)) {
        return method;
      }
    }
    throw new IllegalArgumentException("Unsupported encryption method: " + p_id);
  }

  @Override
  public String toString() {
    return id;
  }
}
